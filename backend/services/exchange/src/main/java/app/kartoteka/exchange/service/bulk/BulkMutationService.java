package app.kartoteka.exchange.service.bulk;

import app.kartoteka.exchange.audit.AuditPublisher;
import app.kartoteka.exchange.controller.dto.BulkItemError;
import app.kartoteka.exchange.controller.dto.BulkMutationResponse;
import app.kartoteka.exchange.controller.dto.BulkMutationResult;
import app.kartoteka.exchange.controller.dto.BulkReversalResponse;
import app.kartoteka.exchange.controller.dto.PageResponse;
import app.kartoteka.exchange.domain.BulkMutationEntity;
import app.kartoteka.exchange.domain.ClientEntity;
import app.kartoteka.exchange.repository.BulkMutationRepository;
import app.kartoteka.exchange.security.CallerContext;
import app.kartoteka.exchange.store.ClientStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class BulkMutationService {

    private static final Logger log = LoggerFactory.getLogger(BulkMutationService.class);

    private final ClientStore clientStore;
    private final BulkMutationRepository mutationRepository;
    private final AuditPublisher auditPublisher;
    private final ObjectMapper objectMapper;
    private final int maxIds;
    private final int maxHardDeleteIds;

    public BulkMutationService(ClientStore clientStore,
                               BulkMutationRepository mutationRepository,
                               AuditPublisher auditPublisher,
                               ObjectMapper objectMapper,
                               @Value("${app.exchange.bulk.max-ids:100}") int maxIds,
                               @Value("${app.exchange.bulk.max-hard-delete-ids:50}") int maxHardDeleteIds) {
        this.clientStore = clientStore;
        this.mutationRepository = mutationRepository;
        this.auditPublisher = auditPublisher;
        this.objectMapper = objectMapper;
        this.maxIds = maxIds;
        this.maxHardDeleteIds = maxHardDeleteIds;
    }

    public BulkMutationResult execute(CallerContext caller, BulkOperation operation, List<UUID> requestedIds) {
        if (operation == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "operation is required");
        }
        operation.validate();
        Set<UUID> ids = distinctIds(requestedIds);
        if (operation instanceof BatchDelete delete && delete.hard() && ids.size() > maxHardDeleteIds) {
            throw new ResponseStatusException(
                    HttpStatus.BAD_REQUEST,
                    "Hard delete accepts at most " + maxHardDeleteIds + " ids"
            );
        }

        Map<UUID, ClientEntity> clients = clientStore.findAllByIds(caller.tenantId(), ids).stream()
                .collect(Collectors.toMap(ClientEntity::getClientId, Function.identity()));
        if (clients.size() != ids.size()) {
            List<UUID> unknown = ids.stream().filter(id -> !clients.containsKey(id)).toList();
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown client ids: " + unknown);
        }

        Map<UUID, Map<String, Object>> snapshot = new LinkedHashMap<>();
        List<BulkItemError> errors = new ArrayList<>();
        Instant now = Instant.now();
        for (UUID id : ids) {
            ClientEntity before = clients.get(id);
            Map<String, Object> prior = ClientSnapshot.capture(before, operation.affectedFields());
            try {
                if (operation instanceof BatchDelete delete && delete.hard()) {
                    clientStore.hardDelete(caller.tenantId(), id, before.getVersion());
                } else {
                    clientStore.update(caller.tenantId(), id, before.getVersion(), client -> operation.apply(client, now));
                }
                snapshot.put(id, prior);
            } catch (RuntimeException ex) {
                log.warn("Bulk mutation item failed type={} clientId={} error={}", operation.typeName(), id, ex.getMessage());
                errors.add(new BulkItemError(id, ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage()));
            }
        }

        BulkMutationEntity mutation = new BulkMutationEntity();
        mutation.setMutationId(UUID.randomUUID());
        mutation.setTenantId(caller.tenantId());
        mutation.setActorId(caller.userId());
        mutation.setOperationType(operation.typeName());
        mutation.setOperation(operationNode(operation));
        mutation.setTargetIds(objectMapper.valueToTree(ids));
        mutation.setSnapshot(operation.reversible() ? objectMapper.valueToTree(snapshot) : null);
        mutation.setErrors(objectMapper.valueToTree(errors));
        mutation.setSuccessfulCount(ids.size() - errors.size());
        mutation.setFailedCount(errors.size());
        mutation.setReversible(operation.reversible());
        mutation.setCreatedAt(now);
        mutationRepository.save(mutation);

        log.info(
                "Bulk mutation applied mutationId={} type={} successful={} failed={}",
                mutation.getMutationId(),
                operation.typeName(),
                mutation.getSuccessfulCount(),
                mutation.getFailedCount()
        );
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("type", operation.typeName());
        details.put("targets", ids.size());
        details.put("successful", mutation.getSuccessfulCount());
        details.put("failed", mutation.getFailedCount());
        auditPublisher.publish("bulk.mutation", caller.tenantId(), caller.userId(), mutation.getMutationId(), details);

        return new BulkMutationResult(mutation.getMutationId(), mutation.getSuccessfulCount(), mutation.getFailedCount(), errors);
    }

    public BulkReversalResponse reverse(CallerContext caller, UUID mutationId) {
        BulkMutationEntity mutation = mutationRepository.findByMutationIdAndTenantId(mutationId, caller.tenantId())
                .orElseThrow(() -> ReversalException.notFound(mutationId));
        if (!mutation.isReversible()) {
            throw ReversalException.notReversible(mutationId);
        }
        if (mutation.getReversedAt() != null) {
            throw ReversalException.alreadyReversed(mutationId);
        }
        Instant now = Instant.now();
        if (mutationRepository.markReversed(mutationId, caller.userId(), now) == 0) {
            throw ReversalException.alreadyReversed(mutationId);
        }

        int restored = 0;
        List<BulkItemError> errors = new ArrayList<>();
        JsonNode snapshot = mutation.getSnapshot();
        if (snapshot != null && snapshot.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> entries = snapshot.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                UUID clientId = UUID.fromString(entry.getKey());
                try {
                    clientStore.update(caller.tenantId(), clientId, null,
                            client -> ClientSnapshot.restore(client, entry.getValue(), objectMapper));
                    restored++;
                } catch (RuntimeException ex) {
                    log.warn("Bulk reversal item failed mutationId={} clientId={} error={}", mutationId, clientId, ex.getMessage());
                    errors.add(new BulkItemError(clientId, ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage()));
                }
            }
        }

        log.info("Bulk mutation reversed mutationId={} restored={} failed={}", mutationId, restored, errors.size());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("type", mutation.getOperationType());
        details.put("restored", restored);
        details.put("failed", errors.size());
        auditPublisher.publish("bulk.reversal", caller.tenantId(), caller.userId(), mutationId, details);

        return new BulkReversalResponse(mutationId, restored, errors.size(), errors, now);
    }

    public PageResponse<BulkMutationResponse> list(CallerContext caller, int page, int size) {
        PageRequest pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), 200));
        return PageResponse.of(
                mutationRepository.findByTenantIdOrderByCreatedAtDesc(caller.tenantId(), pageable),
                this::toResponse
        );
    }

    public BulkMutationResponse get(CallerContext caller, UUID mutationId) {
        return mutationRepository.findByMutationIdAndTenantId(mutationId, caller.tenantId())
                .map(this::toResponse)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Bulk mutation not found"));
    }

    private Set<UUID> distinctIds(List<UUID> requestedIds) {
        Set<UUID> ids = new LinkedHashSet<>();
        if (requestedIds != null) {
            for (UUID id : requestedIds) {
                if (id != null) {
                    ids.add(id);
                }
            }
        }
        if (ids.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "ids must not be empty");
        }
        if (ids.size() > maxIds) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "At most " + maxIds + " ids per bulk mutation");
        }
        return ids;
    }

    private JsonNode operationNode(BulkOperation operation) {
        ObjectNode node = objectMapper.valueToTree(operation);
        node.put("type", operation.typeName());
        return node;
    }

    private BulkMutationResponse toResponse(BulkMutationEntity mutation) {
        JsonNode targets = mutation.getTargetIds();
        return new BulkMutationResponse(
                mutation.getMutationId(),
                mutation.getOperationType(),
                mutation.getOperation(),
                mutation.getActorId(),
                targets == null ? 0 : targets.size(),
                mutation.getSuccessfulCount(),
                mutation.getFailedCount(),
                mutation.getErrors(),
                mutation.isReversible(),
                mutation.getReversedAt(),
                mutation.getReversedBy(),
                mutation.getCreatedAt()
        );
    }
}
