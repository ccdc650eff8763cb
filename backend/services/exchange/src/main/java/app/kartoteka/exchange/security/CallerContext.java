package app.kartoteka.exchange.security;

import java.util.UUID;

public record CallerContext(
        UUID tenantId,
        UUID userId
) {
}
