package app.kartoteka.exchange.service.mapping;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class MappingException extends ResponseStatusException {

    public MappingException(String reason) {
        super(HttpStatus.BAD_REQUEST, reason);
    }
}
