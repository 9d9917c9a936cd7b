package com.investorportal.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.investorportal.backend.global.error.AuthenticationProblemException;
import com.investorportal.backend.global.error.ConflictProblemException;
import com.investorportal.backend.global.error.NotFoundProblemException;
import com.investorportal.backend.global.error.ValidationProblemException;
import com.investorportal.backend.global.security.AuthenticatedPrincipal;
import com.investorportal.backend.global.web.ClientMetadata;
import com.investorportal.backend.modules.audit.application.AuditEvent;
import com.investorportal.backend.modules.audit.application.AuditLogService;
import com.investorportal.backend.modules.audit.domain.AuditAction;
import com.investorportal.backend.modules.auth.application.JwtTokenService.IssuedToken;
import com.investorportal.backend.modules.auth.application.SessionStore.LiveSession;
import com.investorportal.backend.modules.auth.application.SessionStore.NewSession;
import com.investorportal.backend.modules.auth.domain.PortalUser;
import com.investorportal.backend.modules.auth.domain.UserProfile;
import com.investorportal.backend.modules.auth.infrastructure.persistence.PortalUserRepository;
import com.investorportal.backend.modules.auth.infrastructure.persistence.UserProfileRepository;
import com.investorportal.backend.modules.auth.presentation.dto.AuthResponse;
import com.investorportal.backend.modules.auth.presentation.dto.AuthResponse.PrincipalSummary;
import com.investorportal.backend.modules.auth.presentation.dto.LoginRequest;
import com.investorportal.backend.modules.auth.presentation.dto.RegisterRequest;
import com.investorportal.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.investorportal.backend.modules.auth.presentation.dto.UserStatusResponse;
import com.investorportal.backend.modules.rbac.application.RoleAssignmentService;
import com.investorportal.backend.modules.rbac.application.RolePermissionAggregator;
import com.investorportal.backend.modules.rbac.application.RolePermissionAggregator.ResolvedAuthorities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Session lifecycle: register, login, refresh with rotation, logout on one or all devices.
 *
 * <p>A session moves from live to revoked or expired and never back. Refresh tokens are single
 * use: the old session is claimed with a conditional revoke before a new one is issued, so two
 * callers presenting the same token cannot both succeed.</p>
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final PortalUserRepository portalUserRepository;
    private final UserProfileRepository userProfileRepository;
    private final SessionStore sessionStore;
    private final JwtTokenService jwtTokenService;
    private final PasswordEncoder passwordEncoder;
    private final RoleAssignmentService roleAssignmentService;
    private final RolePermissionAggregator rolePermissionAggregator;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public AuthService(
            PortalUserRepository portalUserRepository,
            UserProfileRepository userProfileRepository,
            SessionStore sessionStore,
            JwtTokenService jwtTokenService,
            PasswordEncoder passwordEncoder,
            RoleAssignmentService roleAssignmentService,
            RolePermissionAggregator rolePermissionAggregator,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.portalUserRepository = portalUserRepository;
        this.userProfileRepository = userProfileRepository;
        this.sessionStore = sessionStore;
        this.jwtTokenService = jwtTokenService;
        this.passwordEncoder = passwordEncoder;
        this.roleAssignmentService = roleAssignmentService;
        this.rolePermissionAggregator = rolePermissionAggregator;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public AuthResponse register(RegisterRequest request, ClientMetadata client) {
        String email = normalizeEmail(request.email());
        if (portalUserRepository.existsByEmailIgnoreCase(email)) {
            throw emailTaken();
        }

        PortalUser user = new PortalUser();
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setFirstName(request.firstName());
        user.setLastName(request.lastName());
        user.setActive(true);
        user.setVerified(false);
        user = portalUserRepository.save(user);

        UserProfile profile = new UserProfile();
        profile.setUser(user);
        userProfileRepository.save(profile);

        Optional<String> defaultRole = roleAssignmentService.assignDefaultRole(user, client);

        AuthResponse response = issueSession(user, client);
        auditLogService.record(AuditEvent.of(AuditAction.REGISTER, user.getId(), "user:" + user.getId(), client,
                Map.of("email", email, "defaultRole", defaultRole.orElse("none"))));
        return response;
    }

    /**
     * Unknown email, inactive account and wrong password fail identically.
     */
    public AuthResponse login(LoginRequest request, ClientMetadata client) {
        PortalUser user = portalUserRepository.findByEmailIgnoreCase(normalizeEmail(request.email()))
                .orElseThrow(AuthenticationProblemException::invalidCredentials);
        if (!user.isActive() || !passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw AuthenticationProblemException.invalidCredentials();
        }

        user.setLastLoginAt(OffsetDateTime.now(clock));
        AuthResponse response = issueSession(user, client);
        auditLogService.record(AuditEvent.of(AuditAction.LOGIN, user.getId(), "user:" + user.getId(), client));
        return response;
    }

    public AuthResponse refresh(String refreshToken, ClientMetadata client) {
        LiveSession session = sessionStore.findLive(refreshToken)
                .orElseThrow(AuthenticationProblemException::invalidToken);

        PortalUser user = portalUserRepository.findById(session.userId())
                .filter(PortalUser::isActive)
                .orElseThrow(AuthenticationProblemException::invalidToken);

        if (!sessionStore.revoke(refreshToken)) {
            log.warn("Refresh token for user {} was already used", user.getId());
            throw AuthenticationProblemException.invalidToken();
        }

        AuthResponse response = issueSession(user, client);
        auditLogService.record(AuditEvent.of(AuditAction.TOKEN_REFRESH, user.getId(), "session:" + session.sessionId(), client));
        return response;
    }

    /**
     * Revokes the session behind the token. Unknown or already revoked tokens are accepted silently.
     */
    public void logout(String refreshToken, ClientMetadata client) {
        Optional<LiveSession> session = sessionStore.findLive(refreshToken);
        if (session.isPresent() && sessionStore.revoke(refreshToken)) {
            UUID userId = session.get().userId();
            auditLogService.record(AuditEvent.of(AuditAction.LOGOUT, userId, "session:" + session.get().sessionId(), client));
        }
    }

    public int logoutAll(UUID userId, ClientMetadata client) {
        int revoked = sessionStore.revokeAll(userId);
        if (portalUserRepository.existsById(userId)) {
            auditLogService.record(AuditEvent.of(AuditAction.LOGOUT_ALL, userId, "user:" + userId, client,
                    Map.of("revokedSessions", revoked)));
        }
        return revoked;
    }

    /**
     * Activates or deactivates an account. Deactivation revokes every live session so no refresh
     * succeeds afterwards; outstanding access tokens stop resolving to a principal on the next request.
     */
    public UserStatusResponse updateUserStatus(UUID userId, boolean active, UUID actorId, ClientMetadata client) {
        if (!active && userId.equals(actorId)) {
            throw new ValidationProblemException("auth.self_deactivation", "Cannot deactivate your own account");
        }
        PortalUser user = portalUserRepository.findById(userId)
                .orElseThrow(() -> new NotFoundProblemException("auth.user_not_found", "User not found"));

        int revoked = 0;
        if (user.isActive() != active) {
            user.setActive(active);
            if (!active) {
                revoked = sessionStore.revokeAll(userId);
            }
            AuditAction action = active ? AuditAction.USER_ACTIVATED : AuditAction.USER_DEACTIVATED;
            auditLogService.record(AuditEvent.of(action, actorId, "user:" + userId, client,
                    Map.of("revokedSessions", revoked)));
            log.info("User {} {} by {}", userId, active ? "activated" : "deactivated", actorId);
        }
        return new UserStatusResponse(user.getId(), user.getEmail(), user.isActive(), revoked);
    }

    /**
     * Resolves the principal behind a verified access token. Empty when the account is gone or deactivated.
     */
    @Transactional(readOnly = true)
    public Optional<AuthenticatedPrincipal> validatePrincipal(UUID userId) {
        return portalUserRepository.findById(userId)
                .filter(PortalUser::isActive)
                .map(user -> {
                    ResolvedAuthorities authorities = rolePermissionAggregator.resolve(user.getId());
                    return new AuthenticatedPrincipal(user.getId(), user.getEmail(),
                            authorities.roles(), authorities.permissions(), true);
                });
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(UUID userId) {
        PortalUser user = portalUserRepository.findById(userId)
                .orElseThrow(() -> new NotFoundProblemException("auth.user_not_found", "User not found"));
        Optional<UserProfile> profile = userProfileRepository.findByUserId(userId);
        ResolvedAuthorities authorities = rolePermissionAggregator.resolve(userId);
        return new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getFirstName(),
                user.getLastName(),
                user.isVerified(),
                profile.map(UserProfile::getPhone).orElse(null),
                profile.map(UserProfile::getTimezone).orElse(null),
                sorted(authorities.roles()),
                sorted(authorities.permissions()),
                user.getLastLoginAt(),
                user.getCreatedAt()
        );
    }

    private AuthResponse issueSession(PortalUser user, ClientMetadata client) {
        ClientMetadata source = client != null ? client : ClientMetadata.NONE;
        IssuedToken accessToken = jwtTokenService.issueAccessToken(user.getId(), user.getEmail());
        String refreshToken = jwtTokenService.issueRefreshToken(user.getId());
        OffsetDateTime expiresAt = OffsetDateTime.now(clock).plus(jwtTokenService.refreshTokenLifetime());

        sessionStore.create(new NewSession(user.getId(), refreshToken, expiresAt, source.userAgent(), source.ipAddress()));

        ResolvedAuthorities authorities = rolePermissionAggregator.resolve(user.getId());
        PrincipalSummary summary = new PrincipalSummary(
                user.getId(),
                user.getEmail(),
                user.getFirstName(),
                user.getLastName(),
                sorted(authorities.roles()),
                sorted(authorities.permissions())
        );
        return new AuthResponse(accessToken.token(), refreshToken, AuthResponse.DEFAULT_TOKEN_TYPE,
                accessToken.expiresInSeconds(), summary);
    }

    private static List<String> sorted(Set<String> values) {
        return values.stream().sorted().toList();
    }

    private static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    private static ConflictProblemException emailTaken() {
        return new ConflictProblemException("auth.email_taken", "An account with this email already exists");
    }
}
