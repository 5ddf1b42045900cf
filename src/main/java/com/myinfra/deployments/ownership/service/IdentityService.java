package com.myinfra.deployments.ownership.service;

import com.myinfra.deployments.ownership.config.AppConfig;
import com.myinfra.deployments.ownership.config.AppConfig.AuthConfig;
import com.myinfra.deployments.ownership.model.UserIdentity;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpCookie;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import javax.crypto.SecretKey;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.List;
import java.util.Objects;

/**
 * Reads the caller's identity from a signed identity token.
 *
 * <p>The token subject is the user reference and the "ent" claim lists the
 * ownership references, e.g.
 * {@code {"sub": "user:default/alice", "ent": ["user:default/alice", "group:default/platform-team"]}}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdentityService {

    static final String OWNERSHIP_CLAIM = "ent";

    private final AppConfig appConfig;

    /**
     * Authenticates an incoming request.
     *
     * @param request The incoming HTTP request
     * @return Mono<UserIdentity> if the token verifies, otherwise Mono.empty()
     */
    public Mono<UserIdentity> authenticate(ServerHttpRequest request) {
        AuthConfig config = appConfig.getAuth();
        String token = extractToken(request, config);

        if (token == null) return Mono.empty();

        try {
            JwtParserBuilder parserBuilder = Jwts.parser();

            if (config.getJwtPublicKey() != null && !config.getJwtPublicKey().isBlank()) {
                // Asymmetric (RS256)
                parserBuilder.verifyWith(parsePublicKey(config.getJwtPublicKey()));
            } else if (config.getJwtSecret() != null && !config.getJwtSecret().isBlank()) {
                // Symmetric (HS256)
                byte[] keyBytes = Base64.getDecoder().decode(config.getJwtSecret());
                SecretKey key = Keys.hmacShaKeyFor(keyBytes);
                parserBuilder.verifyWith(key);
            } else {
                log.error("No identity token key configured (app.auth.jwt-secret or app.auth.jwt-public-key)");
                return Mono.empty();
            }

            Claims claims = parserBuilder.build()
                    .parseSignedClaims(token)
                    .getPayload();

            return Mono.just(new UserIdentity(claims.getSubject(), ownershipRefsOf(claims)));

        } catch (Exception e) {
            log.warn("Identity token validation failed: {}", e.getMessage());
            return Mono.empty();
        }
    }

    private static List<String> ownershipRefsOf(Claims claims) {
        Object ent = claims.get(OWNERSHIP_CLAIM);
        if (!(ent instanceof List<?> refs)) {
            return List.of();
        }
        return refs.stream()
                .filter(Objects::nonNull)
                .map(Object::toString)
                .toList();
    }

    /**
     * Extracts the token from the Authorization header (Bearer) or the configured cookie.
     *
     * @param request Incoming HTTP request
     * @param config  Auth configuration
     * @return token string or null if not found
     */
    private String extractToken(ServerHttpRequest request, AuthConfig config) {
        String authHeader = request.getHeaders().getFirst("Authorization");
        if (authHeader != null && authHeader.startsWith("Bearer ")) {
            return authHeader.substring(7);
        }

        String jwtCookie = config.getJwtCookie();
        if (jwtCookie != null && !jwtCookie.isBlank()) {
            HttpCookie cookie = request.getCookies().getFirst(jwtCookie);
            if (cookie != null) {
                return cookie.getValue();
            }
        }

        return null;
    }

    /**
     * Parses a Base64-encoded X.509 RSA public key.
     *
     * @param base64PublicKey Base64-encoded public key
     * @return PublicKey instance
     * @throws Exception if parsing fails
     */
    private PublicKey parsePublicKey(String base64PublicKey) throws Exception {
        byte[] keyBytes = Base64.getDecoder().decode(base64PublicKey);
        X509EncodedKeySpec spec = new X509EncodedKeySpec(keyBytes);
        KeyFactory kf = KeyFactory.getInstance("RSA");
        return kf.generatePublic(spec);
    }
}
