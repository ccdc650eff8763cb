package app.kartoteka.exchange.security;

import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class CurrentUserProvider {

    public UUID requireUserId(Jwt jwt) {
        return requireUuidClaim(jwt, "user_id");
    }

    public UUID requireTenantId(Jwt jwt) {
        return requireUuidClaim(jwt, "tenant_id");
    }

    public CallerContext requireCaller(Jwt jwt) {
        return new CallerContext(requireTenantId(jwt), requireUserId(jwt));
    }

    private UUID requireUuidClaim(Jwt jwt, String name) {
        if (jwt == null) {
            throw new IllegalStateException("Missing authentication token");
        }
        String claim = jwt.getClaimAsString(name);
        if (claim == null || claim.isBlank()) {
            throw new IllegalStateException("JWT does not contain '" + name + "' claim");
        }
        try {
            return UUID.fromString(claim);
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("JWT claim '" + name + "' is not a UUID");
        }
    }
}
