package com.clinicmate.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.clinicmate.backend.global.web.ClientContext;
import com.clinicmate.backend.modules.auth.domain.TokenType;
import com.clinicmate.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import javax.crypto.SecretKey;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Mints and verifies the four token kinds. Verification fails closed: bad signature, expiry,
 * malformed payload and a type outside the accepted set all end in {@link AuthErrorCode#INVALID_TOKEN}.
 */
@Service
public class JwtTokenService {

    static final String CLAIM_TYPE = "type";
    static final String CLAIM_SESSION_ID = "sid";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ROLES = "roles";
    static final String CLAIM_PERMISSIONS = "permissions";
    static final String CLAIM_MFA_VERIFIED = "mfaVerified";
    static final String CLAIM_IP = "ip";
    static final String CLAIM_USER_AGENT = "ua";

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final long refreshTokenTtlMillis;
    private final String issuer;
    private final Duration challengeTtl;
    private final Duration setupTtl;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:900000}") long accessTokenTtlMillis,
            @Value("${jwt.refresh-expiration:604800000}") long refreshTokenTtlMillis,
            @Value("${jwt.issuer:clinicmate}") String issuer,
            AuthPolicyProperties properties,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.refreshTokenTtlMillis = refreshTokenTtlMillis;
        this.issuer = issuer;
        this.challengeTtl = properties.mfa().challengeTtl();
        this.setupTtl = properties.mfa().setupTtl();
        this.clock = clock;
    }

    public IssuedToken issueAccessToken(UUID userId, String email, UUID sessionId, ResolvedPermissions permissions,
                                        boolean mfaVerified) {
        Instant now = clock.instant();
        Instant expiresAt = now.plusMillis(accessTokenTtlMillis);
        String token = baseBuilder(userId, TokenType.ACCESS, now, expiresAt)
                .claim(CLAIM_SESSION_ID, sessionId.toString())
                .claim(CLAIM_EMAIL, email)
                .claim(CLAIM_ROLES, List.copyOf(permissions.roles()))
                .claim(CLAIM_PERMISSIONS, List.copyOf(permissions.permissions()))
                .claim(CLAIM_MFA_VERIFIED, mfaVerified)
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();
        return new IssuedToken(token, expiresAt, Duration.ofMillis(accessTokenTtlMillis));
    }

    public IssuedToken issueRefreshToken(UUID userId, UUID sessionId) {
        Instant now = clock.instant();
        Instant expiresAt = now.plusMillis(refreshTokenTtlMillis);
        String token = baseBuilder(userId, TokenType.REFRESH, now, expiresAt)
                .claim(CLAIM_SESSION_ID, sessionId.toString())
                .signWith(tokenProvider.getRefreshSecretKey(), SIG.HS256)
                .compact();
        return new IssuedToken(token, expiresAt, Duration.ofMillis(refreshTokenTtlMillis));
    }

    public IssuedToken issueMfaChallengeToken(UUID userId, String email, ClientContext client) {
        return issueTempToken(userId, email, client, TokenType.MFA_CHALLENGE, challengeTtl);
    }

    public IssuedToken issueMfaSetupToken(UUID userId, String email, ClientContext client) {
        return issueTempToken(userId, email, client, TokenType.MFA_SETUP, setupTtl);
    }

    private IssuedToken issueTempToken(UUID userId, String email, ClientContext client, TokenType type,
                                       Duration ttl) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(ttl);
        ClientContext context = client != null ? client : ClientContext.UNKNOWN;
        String token = baseBuilder(userId, type, now, expiresAt)
                .claim(CLAIM_EMAIL, email)
                .claim(CLAIM_IP, context.ipAddress())
                .claim(CLAIM_USER_AGENT, context.userAgent())
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();
        return new IssuedToken(token, expiresAt, ttl);
    }

    private JwtBuilder baseBuilder(UUID userId, TokenType type, Instant issuedAt, Instant expiresAt) {
        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .issuer(issuer)
                .subject(userId.toString())
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .claim(CLAIM_TYPE, type.claimValue());
    }

    public VerifiedToken.RefreshToken verifyRefreshToken(String token) {
        return (VerifiedToken.RefreshToken) verify(token, Set.of(TokenType.REFRESH));
    }

    /**
     * Verifies a token and narrows it to its variant. The refresh key is used only when refresh
     * tokens are the sole accepted kind; mixing refresh with other kinds is a programming error.
     */
    public VerifiedToken verify(String token, Set<TokenType> acceptedTypes) {
        if (acceptedTypes.isEmpty()
                || (acceptedTypes.contains(TokenType.REFRESH) && acceptedTypes.size() > 1)) {
            throw new IllegalArgumentException("Refresh tokens must be verified on their own: " + acceptedTypes);
        }
        if (token == null || token.isBlank()) {
            throw new AuthException(AuthErrorCode.INVALID_TOKEN);
        }

        SecretKey key = acceptedTypes.contains(TokenType.REFRESH)
                ? tokenProvider.getRefreshSecretKey()
                : tokenProvider.getSecretKey();

        Claims claims;
        Optional<TokenType> parsedType;
        try {
            claims = Jwts.parser()
                    .verifyWith(key)
                    .requireIssuer(issuer)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            // a non-string type claim raises RequiredTypeException
            parsedType = TokenType.fromClaim(claims.get(CLAIM_TYPE, String.class));
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthException(AuthErrorCode.INVALID_TOKEN, e);
        }

        TokenType type = parsedType.orElseThrow(() -> new AuthException(AuthErrorCode.INVALID_TOKEN));
        if (!acceptedTypes.contains(type)) {
            throw new AuthException(AuthErrorCode.INVALID_TOKEN);
        }

        try {
            return toVariant(type, claims);
        } catch (RuntimeException e) {
            throw new AuthException(AuthErrorCode.INVALID_TOKEN, e);
        }
    }

    private VerifiedToken toVariant(TokenType type, Claims claims) {
        UUID userId = UUID.fromString(claims.getSubject());
        Instant expiresAt = claims.getExpiration().toInstant();
        switch (type) {
            case ACCESS:
                return new VerifiedToken.AccessToken(
                        userId,
                        claims.get(CLAIM_EMAIL, String.class),
                        requiredSessionId(claims),
                        stringList(claims.get(CLAIM_ROLES, List.class)),
                        stringList(claims.get(CLAIM_PERMISSIONS, List.class)),
                        Boolean.TRUE.equals(claims.get(CLAIM_MFA_VERIFIED, Boolean.class)),
                        expiresAt
                );
            case REFRESH:
                return new VerifiedToken.RefreshToken(userId, requiredSessionId(claims), expiresAt);
            case MFA_CHALLENGE:
                return new VerifiedToken.MfaChallengeToken(userId, claims.get(CLAIM_EMAIL, String.class),
                        clientOf(claims), expiresAt);
            case MFA_SETUP:
                return new VerifiedToken.MfaSetupToken(userId, claims.get(CLAIM_EMAIL, String.class),
                        clientOf(claims), expiresAt);
            default:
                throw new IllegalStateException("Unhandled token type " + type);
        }
    }

    private static UUID requiredSessionId(Claims claims) {
        String sessionId = claims.get(CLAIM_SESSION_ID, String.class);
        return UUID.fromString(Objects.requireNonNull(sessionId, "sid claim missing"));
    }

    private static ClientContext clientOf(Claims claims) {
        return new ClientContext(claims.get(CLAIM_IP, String.class), claims.get(CLAIM_USER_AGENT, String.class));
    }

    private static List<String> stringList(List<?> raw) {
        return raw == null ? List.of() : raw.stream()
                .filter(Objects::nonNull)
                .map(Object::toString)
                .toList();
    }

    public record IssuedToken(String value, Instant expiresAt, Duration ttl) {
    }
}
