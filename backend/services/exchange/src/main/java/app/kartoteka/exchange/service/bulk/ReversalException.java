package app.kartoteka.exchange.service.bulk;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

public class ReversalException extends ResponseStatusException {

    private ReversalException(HttpStatus status, String reason) {
        super(status, reason);
    }

    public static ReversalException notFound(UUID mutationId) {
        return new ReversalException(HttpStatus.NOT_FOUND, "Bulk mutation not found: " + mutationId);
    }

    public static ReversalException notReversible(UUID mutationId) {
        return new ReversalException(HttpStatus.CONFLICT, "Bulk mutation " + mutationId + " cannot be reversed");
    }

    public static ReversalException alreadyReversed(UUID mutationId) {
        return new ReversalException(HttpStatus.CONFLICT, "Bulk mutation " + mutationId + " was already reversed");
    }
}
