package com.agile.Buro.Service;

import com.agile.Buro.Config.BuroProperties;
import com.agile.Buro.Models.PageModel;
import com.agile.Buro.Models.UserModel;
import com.agile.Buro.dto.UserUpdate;
import com.agile.Buro.dto.request.ChangePasswordRequest;
import com.agile.Buro.entity.ProjectsEntity;
import com.agile.Buro.entity.UsersEntity;
import com.agile.Buro.exception.ForbiddenOperationException;
import com.agile.Buro.exception.InvalidInputException;
import com.agile.Buro.exception.UserNotFoundException;
import com.agile.Buro.repository.IssuesRepository;
import com.agile.Buro.repository.NotiRepository;
import com.agile.Buro.repository.ProjectMembersRepository;
import com.agile.Buro.repository.ProjectsRepository;
import com.agile.Buro.repository.UsersRepository;
import com.agile.Buro.util.Mappers;
import com.agile.Buro.util.OffsetPageRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Slf4j
@Service
public class UserService {

    private final UsersRepository usersRepository;
    private final ProjectsRepository projectsRepository;
    private final ProjectMembersRepository membersRepository;
    private final IssuesRepository issuesRepository;
    private final NotiRepository notiRepository;
    private final RefreshTokenService refreshTokenService;
    private final AccessPolicy accessPolicy;
    private final PasswordEncoder encoder;
    private final BuroProperties properties;

    public UserService(UsersRepository usersRepository,
                       ProjectsRepository projectsRepository,
                       ProjectMembersRepository membersRepository,
                       IssuesRepository issuesRepository,
                       NotiRepository notiRepository,
                       RefreshTokenService refreshTokenService,
                       AccessPolicy accessPolicy,
                       PasswordEncoder encoder,
                       BuroProperties properties) {
        this.usersRepository = usersRepository;
        this.projectsRepository = projectsRepository;
        this.membersRepository = membersRepository;
        this.issuesRepository = issuesRepository;
        this.notiRepository = notiRepository;
        this.refreshTokenService = refreshTokenService;
        this.accessPolicy = accessPolicy;
        this.encoder = encoder;
        this.properties = properties;
    }

    @Transactional(readOnly = true)
    public PageModel<UserModel> listUsers(String search, Integer skip, Integer limit, UsersEntity caller) {
        if (!accessPolicy.canListAllUsers(caller)) {
            throw new ForbiddenOperationException("Not enough permissions to list users");
        }
        OffsetPageRequest page = OffsetPageRequest.of(skip, limit,
                properties.getIssues().getDefaultPageSize(),
                properties.getIssues().getMaxPageSize(),
                Sort.by("fullName").and(Sort.by("email")));

        String term = search == null ? "" : search.trim();
        Page<UsersEntity> result = term.isEmpty()
                ? usersRepository.findAll(page)
                : usersRepository.findByFullNameContainingIgnoreCaseOrEmailContainingIgnoreCase(term, term, page);

        List<UserModel> items = result.getContent().stream().map(Mappers::toUserModel).toList();
        return new PageModel<>(items, result.getTotalElements(), page.getOffset(), page.getPageSize());
    }

    @Transactional(readOnly = true)
    public UserModel getUser(UUID userId, UsersEntity caller) {
        UsersEntity target = usersRepository.findById(userId).orElseThrow(UserNotFoundException::new);
        if (!accessPolicy.canViewUser(caller, target)) {
            throw new ForbiddenOperationException("Not enough permissions to view this user");
        }
        return Mappers.toUserModel(target);
    }

    @Transactional
    public UserModel updateUser(UUID userId, UserUpdate update, UsersEntity caller) {
        UsersEntity target = usersRepository.findById(userId).orElseThrow(UserNotFoundException::new);
        if (!accessPolicy.canEditUser(caller, target)) {
            throw new ForbiddenOperationException("Not enough permissions to update this user");
        }

        boolean passwordChanged = false;
        for (UserUpdate.Field field : update.fields()) {
            switch (field) {
                case FULL_NAME -> {
                    if (update.fullName() == null || update.fullName().trim().isEmpty()) {
                        throw new InvalidInputException("Full name must not be empty");
                    }
                    target.setFullName(requireMaxLength(update.fullName().trim(), "Full name",
                            UsersEntity.MAX_NAME_LENGTH));
                }
                case AVATAR_URL -> target.setAvatarUrl(
                        update.avatarUrl() == null || update.avatarUrl().isBlank()
                                ? null
                                : requireMaxLength(update.avatarUrl().trim(), "Avatar URL",
                                        UsersEntity.MAX_AVATAR_URL_LENGTH));
                case ROLE -> {
                    if (update.role() == null) {
                        throw new InvalidInputException("role must be one of the defined values");
                    }
                    if (update.role() != target.getRole()) {
                        if (!accessPolicy.canChangeRole(caller)) {
                            throw new ForbiddenOperationException("Only admins can change roles");
                        }
                        log.info("Role of {} changed from {} to {} by {}",
                                target.getEmail(), target.getRole(), update.role(), caller.getEmail());
                        target.setRole(update.role());
                    }
                }
                case PASSWORD -> {
                    AuthService.validatePassword(update.password());
                    target.setPassword(encoder.encode(update.password()));
                    passwordChanged = true;
                }
            }
        }

        UsersEntity saved = usersRepository.save(target);
        if (passwordChanged) {
            refreshTokenService.revokeAll(saved);
            log.info("Password of {} reset by {}, sessions revoked", saved.getEmail(), caller.getEmail());
        }
        return Mappers.toUserModel(saved);
    }

    @Transactional
    public void changePassword(UsersEntity caller, ChangePasswordRequest req) {
        UsersEntity user = usersRepository.findById(caller.getUserId()).orElseThrow(UserNotFoundException::new);

        AuthService.validatePassword(req.getNewPassword());
        if (!req.getNewPassword().equals(req.getConfirmPassword())) {
            throw new InvalidInputException("New password and confirm password do not match");
        }
        if (user.getPassword() != null
                && (req.getOldPassword() == null || !encoder.matches(req.getOldPassword(), user.getPassword()))) {
            throw new InvalidInputException("Old password is incorrect");
        }

        user.setPassword(encoder.encode(req.getNewPassword()));
        usersRepository.save(user);
        refreshTokenService.revokeAll(user);
        log.info("Password changed and all sessions revoked for user: {}", user.getEmail());
    }

    @Transactional
    public UserModel deactivate(UUID userId, UsersEntity caller) {
        UsersEntity target = usersRepository.findById(userId).orElseThrow(UserNotFoundException::new);
        if (caller.getUserId().equals(target.getUserId())) {
            throw new InvalidInputException("You cannot deactivate your own account");
        }
        if (!accessPolicy.canDeactivate(caller, target)) {
            throw new ForbiddenOperationException("Not enough permissions to deactivate users");
        }
        target.setActive(false);
        UsersEntity saved = usersRepository.save(target);
        refreshTokenService.revokeAll(saved);
        log.info("User {} deactivated by {}", saved.getEmail(), caller.getEmail());
        return Mappers.toUserModel(saved);
    }

    @Transactional
    public UserModel activate(UUID userId, UsersEntity caller) {
        UsersEntity target = usersRepository.findById(userId).orElseThrow(UserNotFoundException::new);
        if (caller.getUserId().equals(target.getUserId())) {
            throw new InvalidInputException("You cannot activate your own account");
        }
        if (!accessPolicy.canDeactivate(caller, target)) {
            throw new ForbiddenOperationException("Not enough permissions to activate users");
        }
        target.setActive(true);
        UsersEntity saved = usersRepository.save(target);
        log.info("User {} activated by {}", saved.getEmail(), caller.getEmail());
        return Mappers.toUserModel(saved);
    }

    /**
     * Hard delete. Owned projects go with their issues; issues the user reported or is
     * assigned to elsewhere are deleted too.
     */
    @Transactional
    public void deleteUser(UUID userId, UsersEntity caller) {
        if (!caller.isAdmin()) {
            throw new ForbiddenOperationException("Only admins can delete users");
        }
        if (caller.getUserId().equals(userId)) {
            throw new InvalidInputException("You cannot delete your own account");
        }
        UsersEntity user = usersRepository.findById(userId).orElseThrow(UserNotFoundException::new);

        refreshTokenService.revokeAll(user);
        notiRepository.deleteByRecipientId(userId);
        membersRepository.deleteByUserId(userId);
        projectsRepository.clearDefaultAssignee(userId);
        int issues = issuesRepository.deleteByReporterOrAssignee(userId);

        List<ProjectsEntity> owned = projectsRepository.findByOwner_UserId(userId);
        projectsRepository.deleteAll(owned);
        projectsRepository.flush();

        usersRepository.delete(user);
        log.info("User {} deleted by {} ({} issues, {} projects)", user.getEmail(), caller.getEmail(),
                issues, owned.size());
    }

    private static String requireMaxLength(String value, String label, int maxLength) {
        if (value.length() > maxLength) {
            throw new InvalidInputException(label + " must be at most " + maxLength + " characters");
        }
        return value;
    }
}
