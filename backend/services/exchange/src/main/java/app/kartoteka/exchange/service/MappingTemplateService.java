package app.kartoteka.exchange.service;

import app.kartoteka.exchange.controller.dto.MappingTemplateRequest;
import app.kartoteka.exchange.controller.dto.MappingTemplateResponse;
import app.kartoteka.exchange.domain.MappingTemplateEntity;
import app.kartoteka.exchange.repository.MappingTemplateRepository;
import app.kartoteka.exchange.security.CallerContext;
import app.kartoteka.exchange.service.mapping.ColumnMapping;
import app.kartoteka.exchange.service.mapping.MappingException;
import app.kartoteka.exchange.service.mapping.MappingResolver;
import app.kartoteka.exchange.service.mapping.TargetField;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
public class MappingTemplateService {

    private final MappingTemplateRepository templateRepository;
    private final MappingResolver mappingResolver;
    private final ObjectMapper objectMapper;

    public MappingTemplateService(MappingTemplateRepository templateRepository,
                                  MappingResolver mappingResolver,
                                  ObjectMapper objectMapper) {
        this.templateRepository = templateRepository;
        this.mappingResolver = mappingResolver;
        this.objectMapper = objectMapper;
    }

    @Transactional
    public MappingTemplateResponse create(CallerContext caller, MappingTemplateRequest request) {
        String name = request.name().trim();
        if (templateRepository.existsByTenantIdAndNameIgnoreCase(caller.tenantId(), name)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Mapping template '" + name + "' already exists");
        }
        mappingResolver.resolve(request.mapping());
        String keyField = normalizeKeyField(request.duplicateKeyField());

        MappingTemplateEntity template = new MappingTemplateEntity();
        template.setTemplateId(UUID.randomUUID());
        template.setTenantId(caller.tenantId());
        template.setName(name);
        template.setDescription(request.description());
        template.setMapping(objectMapper.valueToTree(request.mapping()));
        template.setDuplicateKeyField(keyField);
        template.setCreatedBy(caller.userId());
        Instant now = Instant.now();
        template.setCreatedAt(now);
        template.setUpdatedAt(now);
        return toResponse(templateRepository.save(template));
    }

    @Transactional(readOnly = true)
    public List<MappingTemplateResponse> list(CallerContext caller) {
        return templateRepository.findByTenantIdOrderByNameAsc(caller.tenantId()).stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public MappingTemplateResponse get(CallerContext caller, UUID templateId) {
        return toResponse(require(caller.tenantId(), templateId));
    }

    @Transactional
    public void delete(CallerContext caller, UUID templateId) {
        templateRepository.delete(require(caller.tenantId(), templateId));
    }

    @Transactional(readOnly = true)
    public MappingTemplateResponse find(UUID tenantId, UUID templateId) {
        return toResponse(require(tenantId, templateId));
    }

    public static String normalizeKeyField(String keyField) {
        if (keyField == null || keyField.isBlank()) {
            return null;
        }
        TargetField target = TargetField.parse(keyField);
        if (target.isCustom()) {
            throw new MappingException("Duplicate key must be a client field, not " + target.name());
        }
        return target.name();
    }

    private MappingTemplateEntity require(UUID tenantId, UUID templateId) {
        return templateRepository.findByTemplateIdAndTenantId(templateId, tenantId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Mapping template not found"));
    }

    private MappingTemplateResponse toResponse(MappingTemplateEntity template) {
        ColumnMapping mapping;
        try {
            mapping = objectMapper.treeToValue(template.getMapping(), ColumnMapping.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Stored mapping is not readable for template " + template.getTemplateId(), ex);
        }
        return new MappingTemplateResponse(
                template.getTemplateId(),
                template.getName(),
                template.getDescription(),
                mapping,
                template.getDuplicateKeyField(),
                template.getCreatedBy(),
                template.getCreatedAt(),
                template.getUpdatedAt()
        );
    }
}
