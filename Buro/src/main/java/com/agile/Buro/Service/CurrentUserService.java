package com.agile.Buro.Service;

import com.agile.Buro.Filter.AuthenticatedUser;
import com.agile.Buro.entity.UsersEntity;
import com.agile.Buro.exception.UnauthenticatedException;
import com.agile.Buro.repository.UsersRepository;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Resolves the caller of a request to an active user row.
 */
@Service
public class CurrentUserService {

    private final UsersRepository usersRepository;

    public CurrentUserService(UsersRepository usersRepository) {
        this.usersRepository = usersRepository;
    }

    @Transactional(readOnly = true)
    public UsersEntity require(Authentication authentication) {
        if (authentication == null || !(authentication.getPrincipal() instanceof AuthenticatedUser principal)) {
            throw new UnauthenticatedException("Unauthenticated");
        }
        return usersRepository.findById(principal.userId())
                .filter(UsersEntity::isActive)
                .orElseThrow(() -> new UnauthenticatedException("User not found or inactive"));
    }
}
