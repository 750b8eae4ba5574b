package com.sentient.security;

import com.sentient.secrets.SecretCache;
import io.jsonwebtoken.*;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Date;

/**
 * JWT Token Provider for generating and validating bearer tokens.
 *
 * Tokens are HS256-signed with the signing secret from the secret bundle.
 * The subject carries the user id. A token is accepted only if its signature
 * verifies, it has not expired, and it carries both {@code sub} and {@code exp}.
 *
 * The signing secret must be at least 32 bytes long.
 *
 * @see com.sentient.secrets.SecretCache
 */
@Component
@Slf4j
public class JwtTokenProvider {

    public static final String ISSUER = "sentient-planner";

    private final SecretCache secretCache;

    @Value("${jwt.expiration:86400000}")
    private long jwtExpirationMs;

    private SecretKey secretKey;

    public JwtTokenProvider(SecretCache secretCache) {
        this.secretCache = secretCache;
    }

    /**
     * Resolve the signing key at startup so a missing secret fails fast.
     */
    @PostConstruct
    public void init() {
        String signingSecret = secretCache.get().signingSecret();
        this.secretKey = Keys.hmacShaKeyFor(signingSecret.getBytes(StandardCharsets.UTF_8));
        log.info("JWT Token Provider initialized with expiration: {} ms", jwtExpirationMs);
    }

    /**
     * Generate a token for a user.
     *
     * @param userId the user's identifier, becomes the subject
     * @return signed JWT
     */
    public String generateToken(String userId) {
        Date now = new Date();
        Date expiryDate = new Date(now.getTime() + jwtExpirationMs);

        String token = Jwts.builder()
                .subject(userId)
                .issuer(ISSUER)
                .issuedAt(now)
                .expiration(expiryDate)
                .signWith(secretKey, Jwts.SIG.HS256)
                .compact();

        log.debug("Generated JWT token for user: {}", userId);
        return token;
    }

    /**
     * Validate token signature, expiration and required claims.
     *
     * @param token the JWT token to validate
     * @return true if token is valid, false otherwise
     */
    public boolean validateToken(String token) {
        try {
            Claims claims = parseClaims(token);
            if (claims.getSubject() == null || claims.getSubject().isBlank()) {
                log.warn("JWT token has no subject");
                return false;
            }
            if (claims.getExpiration() == null) {
                log.warn("JWT token has no expiration");
                return false;
            }
            return true;
        } catch (SignatureException ex) {
            log.error("Invalid JWT signature: {}", ex.getMessage());
        } catch (MalformedJwtException ex) {
            log.error("Invalid JWT token: {}", ex.getMessage());
        } catch (ExpiredJwtException ex) {
            log.warn("Expired JWT token: {}", ex.getMessage());
        } catch (UnsupportedJwtException ex) {
            log.error("Unsupported JWT token: {}", ex.getMessage());
        } catch (IllegalArgumentException ex) {
            log.error("JWT claims string is empty: {}", ex.getMessage());
        }
        return false;
    }

    public String getUserIdFromToken(String token) {
        return parseClaims(token).getSubject();
    }

    /**
     * Build the Authentication placed in the SecurityContext.
     * The principal is the user id string.
     *
     * @param token a token that passed {@link #validateToken(String)}
     * @return authenticated token with ROLE_USER
     */
    public Authentication getAuthentication(String token) {
        String userId = getUserIdFromToken(token);
        return new UsernamePasswordAuthenticationToken(
                userId,
                null,
                Collections.singletonList(new SimpleGrantedAuthority("ROLE_USER"))
        );
    }

    /**
     * Extract JWT token from Authorization header.
     *
     * Expected header format: "Bearer {token}"
     *
     * @param bearerToken the Authorization header value
     * @return the JWT token string, or null if header is invalid
     */
    public String extractTokenFromHeader(String bearerToken) {
        if (bearerToken != null && bearerToken.startsWith("Bearer ")) {
            return bearerToken.substring(7);
        }
        return null;
    }

    private Claims parseClaims(String token) {
        return Jwts.parser()
                .verifyWith(secretKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}
