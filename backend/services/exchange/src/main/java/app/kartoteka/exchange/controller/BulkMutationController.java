package app.kartoteka.exchange.controller;

import app.kartoteka.exchange.controller.dto.BulkMutationRequest;
import app.kartoteka.exchange.controller.dto.BulkMutationResponse;
import app.kartoteka.exchange.controller.dto.BulkMutationResult;
import app.kartoteka.exchange.controller.dto.BulkReversalResponse;
import app.kartoteka.exchange.controller.dto.PageResponse;
import app.kartoteka.exchange.security.CallerContext;
import app.kartoteka.exchange.security.CurrentUserProvider;
import app.kartoteka.exchange.service.bulk.BulkMutationService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

@RestController
@RequestMapping("/bulk-mutations")
public class BulkMutationController {

    private final BulkMutationService mutationService;
    private final CurrentUserProvider currentUserProvider;

    public BulkMutationController(BulkMutationService mutationService, CurrentUserProvider currentUserProvider) {
        this.mutationService = mutationService;
        this.currentUserProvider = currentUserProvider;
    }

    @PostMapping
    public BulkMutationResult execute(@AuthenticationPrincipal Jwt jwt,
                                      @Valid @RequestBody BulkMutationRequest request) {
        return mutationService.execute(caller(jwt), request.operation(), request.ids());
    }

    @PostMapping("/{mutationId}/reverse")
    public BulkReversalResponse reverse(@AuthenticationPrincipal Jwt jwt,
                                        @PathVariable UUID mutationId) {
        return mutationService.reverse(caller(jwt), mutationId);
    }

    @GetMapping
    public PageResponse<BulkMutationResponse> list(@AuthenticationPrincipal Jwt jwt,
                                                   @RequestParam(defaultValue = "0") int page,
                                                   @RequestParam(defaultValue = "20") int size) {
        return mutationService.list(caller(jwt), page, size);
    }

    @GetMapping("/{mutationId}")
    public BulkMutationResponse get(@AuthenticationPrincipal Jwt jwt,
                                    @PathVariable UUID mutationId) {
        return mutationService.get(caller(jwt), mutationId);
    }

    private CallerContext caller(Jwt jwt) {
        try {
            return currentUserProvider.requireCaller(jwt);
        } catch (IllegalStateException ex) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, ex.getMessage());
        }
    }
}
