package com.primemath.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import com.primemath.backend.global.error.ProblemException;
import com.primemath.backend.modules.auth.domain.AppUser;
import com.primemath.backend.modules.auth.domain.UserRole;
import com.primemath.backend.modules.auth.domain.UserSession;
import com.primemath.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.primemath.backend.modules.auth.infrastructure.persistence.UserRoleRepository;
import com.primemath.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.primemath.backend.modules.auth.presentation.dto.LoginRequest;
import com.primemath.backend.modules.auth.presentation.dto.LoginResponse;
import com.primemath.backend.modules.auth.presentation.dto.LogoutRequest;
import com.primemath.backend.modules.auth.presentation.dto.RefreshRequest;
import com.primemath.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.primemath.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(noRollbackFor = ProblemException.class)
public class AuthService {

    private static final String REASON_EXPIRED = "EXPIRED";
    private static final String REASON_ROTATED = "ROTATED";
    private static final String REASON_LOGOUT = "LOGOUT";
    private static final String REASON_DEVICE_MISMATCH = "DEVICE_MISMATCH";
    private static final String REASON_USER_INACTIVE = "USER_INACTIVE";
    private static final int DEVICE_ID_MAX_LENGTH = 100;

    private final AppUserRepository appUserRepository;
    private final UserRoleRepository userRoleRepository;
    private final UserSessionRepository userSessionRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final Clock clock;

    public AuthService(
            AppUserRepository appUserRepository,
            UserRoleRepository userRoleRepository,
            UserSessionRepository userSessionRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService,
            Clock clock
    ) {
        this.appUserRepository = appUserRepository;
        this.userRoleRepository = userRoleRepository;
        this.userSessionRepository = userSessionRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
        this.clock = clock;
    }

    public LoginResponse login(LoginRequest request) {
        AppUser user = appUserRepository.findByLoginIdIgnoreCase(request.loginId())
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "auth.invalid_credentials", "아이디 또는 비밀번호가 올바르지 않습니다"));

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "auth.invalid_credentials", "아이디 또는 비밀번호가 올바르지 않습니다");
        }

        if (!user.isActive()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "auth.user_inactive", "비활성화된 계정입니다");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        userSessionRepository.revokeExpiredSessions(user.getId(), now, REASON_EXPIRED);
        return issueSession(user, normalizeDeviceId(request.deviceId()));
    }

    public LoginResponse refresh(RefreshRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        UserSession session = userSessionRepository.findByRefreshTokenHash(hashToken(request.refreshToken()))
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "auth.invalid_refresh_token"));

        if (session.getRevokedAt() != null) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "auth.invalid_refresh_token");
        }

        if (session.getExpiresAt().isBefore(now)) {
            revokeSession(session, REASON_EXPIRED);
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "auth.refresh_token_expired");
        }

        String requestDeviceId = normalizeDeviceId(request.deviceId());
        String sessionDeviceId = normalizeDeviceId(session.getDeviceId());
        if (sessionDeviceId != null && requestDeviceId != null && !Objects.equals(sessionDeviceId, requestDeviceId)) {
            revokeSession(session, REASON_DEVICE_MISMATCH);
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "auth.refresh_token_device_mismatch");
        }

        AppUser user = session.getUser();
        if (!user.isActive()) {
            revokeSession(session, REASON_USER_INACTIVE);
            throw new ProblemException(HttpStatus.FORBIDDEN, "auth.user_inactive", "비활성화된 계정입니다");
        }

        // 재사용 방지: 기존 세션은 즉시 폐기하고 새 토큰을 발급한다.
        revokeSession(session, REASON_ROTATED);
        userSessionRepository.revokeExpiredSessions(user.getId(), now, REASON_EXPIRED);

        return issueSession(user, requestDeviceId != null ? requestDeviceId : sessionDeviceId);
    }

    public void logout(LogoutRequest request) {
        // 존재하지 않는 토큰도 같은 응답을 반환해 토큰 유효 여부를 노출하지 않는다.
        userSessionRepository.revokeByRefreshTokenHash(hashToken(request.refreshToken()), OffsetDateTime.now(clock), REASON_LOGOUT);
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(UUID userId) {
        AppUser user = appUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "auth.user_not_found"));
        return buildUserProfile(user, extractActiveRoleCodes(user.getId()));
    }

    private LoginResponse issueSession(AppUser user, String deviceId) {
        List<String> roleCodes = extractActiveRoleCodes(user.getId());
        String refreshToken = UUID.randomUUID().toString();
        TokenPairResponse tokens = jwtTokenService.issueTokenPair(user.getId(), user.getLoginId(), roleCodes, refreshToken);

        UserSession session = new UserSession();
        session.setUser(user);
        session.setRefreshTokenHash(hashToken(refreshToken));
        session.setIssuedAt(tokens.issuedAt());
        session.setExpiresAt(tokens.issuedAt().plusSeconds(tokens.refreshExpiresIn()));
        session.setDeviceId(deviceId);
        userSessionRepository.save(session);

        return new LoginResponse(tokens, buildUserProfile(user, roleCodes));
    }

    private void revokeSession(UserSession session, String reason) {
        session.setRevokedAt(OffsetDateTime.now(clock));
        session.setRevokedReason(reason);
        userSessionRepository.save(session);
    }

    private List<String> extractActiveRoleCodes(UUID userId) {
        return userRoleRepository.findActiveRoles(userId).stream()
                .map(UserRole::getRole)
                .map(role -> role.getCode())
                .distinct()
                .toList();
    }

    private UserProfileResponse buildUserProfile(AppUser user, List<String> roleCodes) {
        return new UserProfileResponse(
                user.getId(),
                user.getLoginId(),
                user.getFullName(),
                user.getPhone(),
                roleCodes,
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }

    private String normalizeDeviceId(String rawDeviceId) {
        if (rawDeviceId == null) {
            return null;
        }
        String trimmed = rawDeviceId.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (trimmed.length() > DEVICE_ID_MAX_LENGTH) {
            return trimmed.substring(0, DEVICE_ID_MAX_LENGTH);
        }
        return trimmed;
    }

    static String hashToken(String rawToken) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(rawToken.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
