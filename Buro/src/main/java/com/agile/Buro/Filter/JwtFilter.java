package com.agile.Buro.Filter;

import com.agile.Buro.Service.JwtService;
import com.agile.Buro.entity.UsersEntity;
import com.agile.Buro.repository.UsersRepository;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Component
public class JwtFilter extends OncePerRequestFilter {

    private final JwtService jwtService;
    private final UsersRepository usersRepository;

    public JwtFilter(JwtService jwtService, UsersRepository usersRepository) {
        this.jwtService = jwtService;
        this.usersRepository = usersRepository;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        String path = request.getRequestURI();
        // /api/auth/me needs the bearer token
        return path.startsWith("/api/auth/") && !path.equals("/api/auth/me");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String token = extractTokenFromRequest(request);
        if (token != null && SecurityContextHolder.getContext().getAuthentication() == null) {
            try {
                authenticateToken(request, token);
            } catch (JwtException | IllegalArgumentException ex) {
                log.debug("Bearer token rejected for {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
                SecurityContextHolder.clearContext();
            }
        }

        filterChain.doFilter(request, response);
    }

    private String extractTokenFromRequest(HttpServletRequest request) {
        String authHeader = request.getHeader("Authorization");
        if (authHeader != null && authHeader.regionMatches(true, 0, "Bearer ", 0, 7)) {
            String token = authHeader.substring(7).trim();
            return token.isEmpty() ? null : token;
        }
        return null;
    }

    private void authenticateToken(HttpServletRequest request, String token) {
        Claims claims = jwtService.parseAllClaims(token);
        if (!jwtService.isAccessToken(claims)) {
            log.debug("Ignoring non-access token on {}", request.getRequestURI());
            return;
        }

        UUID userId = jwtService.getUserId(claims);
        // role and active flag come from the database, not from the token
        Optional<UsersEntity> userOpt = usersRepository.findById(userId);
        if (userOpt.isEmpty() || !userOpt.get().isActive()) {
            log.debug("Token subject {} is unknown or inactive", userId);
            return;
        }
        UsersEntity user = userOpt.get();

        AuthenticatedUser principal = new AuthenticatedUser(user.getUserId(), user.getEmail(), user.getRole());
        List<SimpleGrantedAuthority> authorities = List.of(new SimpleGrantedAuthority("ROLE_" + user.getRole().name()));

        var authToken = new UsernamePasswordAuthenticationToken(principal, null, authorities);
        authToken.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authToken);
    }
}
