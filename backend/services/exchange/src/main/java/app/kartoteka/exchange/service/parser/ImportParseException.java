package app.kartoteka.exchange.service.parser;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class ImportParseException extends ResponseStatusException {

    public ImportParseException(String reason) {
        super(HttpStatus.BAD_REQUEST, reason);
    }

    public ImportParseException(String reason, Throwable cause) {
        super(HttpStatus.BAD_REQUEST, reason, cause);
    }
}
