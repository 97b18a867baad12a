package uk.gegc.livequiz.features.auth.infra.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.util.Date;
import java.util.List;
import java.util.Optional;

/**
 * Verifies host bearer tokens. Tokens are issued by the account service that shares
 * {@code livequiz.jwt.secret}; the subject is the host identifier stored on sessions.
 */
@Component
@Slf4j
public class JwtTokenService {

    public static final String HOST_ROLE = "ROLE_HOST";
    static final String TOKEN_TYPE_CLAIM = "type";
    static final String ACCESS_TOKEN_TYPE = "access";

    private final Clock clock;
    private final SecretKey key;

    public JwtTokenService(Clock clock, @Value("${livequiz.jwt.secret}") String base64Secret) {
        this.clock = clock;
        this.key = Keys.hmacShaKeyFor(Decoders.BASE64.decode(base64Secret));
    }

    /**
     * Resolves a signed, unexpired access token to the host it was issued for.
     *
     * @return the host authentication, or empty when the token must be ignored
     */
    public Optional<Authentication> authenticate(String token) {
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException ex) {
            log.debug("Expired host token: {}", ex.getMessage());
            return Optional.empty();
        } catch (JwtException | IllegalArgumentException ex) {
            log.warn("Rejected host token: {}", ex.getMessage());
            return Optional.empty();
        }

        String hostId = claims.getSubject();
        if (hostId == null || hostId.isBlank()) {
            log.warn("Host token without subject");
            return Optional.empty();
        }
        if (!ACCESS_TOKEN_TYPE.equals(claims.get(TOKEN_TYPE_CLAIM, String.class))) {
            log.warn("Rejected non-access token for host '{}'", hostId);
            return Optional.empty();
        }
        return Optional.of(new UsernamePasswordAuthenticationToken(
                hostId, null, List.of(new SimpleGrantedAuthority(HOST_ROLE))));
    }
}
