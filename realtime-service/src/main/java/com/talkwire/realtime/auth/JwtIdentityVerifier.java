package com.talkwire.realtime.auth;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.Optional;

/**
 * Verifies RS256 access tokens issued by the auth service.
 */
@Slf4j
@Component
public class JwtIdentityVerifier implements IdentityVerifier {

    public static final String ISSUER = "talkwire";
    private static final String TOKEN_TYPE_ACCESS = "access";

    private final JwtParser jwtParser;

    public JwtIdentityVerifier(@Value("${realtime.jwt.public-key}") String publicKeyPem) {
        this.jwtParser = Jwts.parser()
                .verifyWith(parsePublicKey(publicKeyPem))
                .requireIssuer(ISSUER)
                .build();
    }

    @Override
    public Optional<Long> verify(String credential) {
        if (credential == null || credential.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = jwtParser.parseSignedClaims(credential).getPayload();

            String type = claims.get("type", String.class);
            if (type != null && !TOKEN_TYPE_ACCESS.equals(type)) {
                log.warn("Rejected non-access token for subject: {}", claims.getSubject());
                return Optional.empty();
            }
            return Optional.of(Long.parseLong(claims.getSubject()));
        } catch (JwtException e) {
            log.warn("JWT validation failed: {}", e.getMessage());
            return Optional.empty();
        } catch (NumberFormatException e) {
            log.warn("JWT subject is not a user id: {}", e.getMessage());
            return Optional.empty();
        }
    }

    static PublicKey parsePublicKey(String pem) {
        try {
            String base64 = pem
                    .replace("-----BEGIN PUBLIC KEY-----", "")
                    .replace("-----END PUBLIC KEY-----", "")
                    .replaceAll("\\s+", "");
            byte[] decoded = Base64.getDecoder().decode(base64);
            X509EncodedKeySpec spec = new X509EncodedKeySpec(decoded);
            return KeyFactory.getInstance("RSA").generatePublic(spec);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to parse RSA public key", e);
        }
    }
}
