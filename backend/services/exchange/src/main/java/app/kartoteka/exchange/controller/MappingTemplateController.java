package app.kartoteka.exchange.controller;

import app.kartoteka.exchange.controller.dto.MappingTemplateRequest;
import app.kartoteka.exchange.controller.dto.MappingTemplateResponse;
import app.kartoteka.exchange.security.CallerContext;
import app.kartoteka.exchange.security.CurrentUserProvider;
import app.kartoteka.exchange.service.MappingTemplateService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/mapping-templates")
public class MappingTemplateController {

    private final MappingTemplateService templateService;
    private final CurrentUserProvider currentUserProvider;

    public MappingTemplateController(MappingTemplateService templateService, CurrentUserProvider currentUserProvider) {
        this.templateService = templateService;
        this.currentUserProvider = currentUserProvider;
    }

    @GetMapping
    public List<MappingTemplateResponse> list(@AuthenticationPrincipal Jwt jwt) {
        return templateService.list(caller(jwt));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public MappingTemplateResponse create(@AuthenticationPrincipal Jwt jwt,
                                          @Valid @RequestBody MappingTemplateRequest request) {
        return templateService.create(caller(jwt), request);
    }

    @GetMapping("/{templateId}")
    public MappingTemplateResponse get(@AuthenticationPrincipal Jwt jwt,
                                       @PathVariable UUID templateId) {
        return templateService.get(caller(jwt), templateId);
    }

    @DeleteMapping("/{templateId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@AuthenticationPrincipal Jwt jwt,
                       @PathVariable UUID templateId) {
        templateService.delete(caller(jwt), templateId);
    }

    private CallerContext caller(Jwt jwt) {
        try {
            return currentUserProvider.requireCaller(jwt);
        } catch (IllegalStateException ex) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, ex.getMessage());
        }
    }
}
