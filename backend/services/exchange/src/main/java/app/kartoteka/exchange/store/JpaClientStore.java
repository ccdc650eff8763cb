package app.kartoteka.exchange.store;

import app.kartoteka.exchange.domain.ClientEntity;
import app.kartoteka.exchange.domain.ClientField;
import app.kartoteka.exchange.domain.ClientStatus;
import app.kartoteka.exchange.repository.ClientRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Tuple;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.repository.query.QueryUtils;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

@Component
public class JpaClientStore implements ClientStore {

    private final ClientRepository clientRepository;
    private final EntityManager entityManager;

    public JpaClientStore(ClientRepository clientRepository, EntityManager entityManager) {
        this.clientRepository = clientRepository;
        this.entityManager = entityManager;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ClientEntity create(UUID tenantId, UUID ownerId, Consumer<ClientEntity> initializer) {
        ClientEntity client = new ClientEntity();
        client.setClientId(UUID.randomUUID());
        client.setTenantId(tenantId);
        client.setOwnerId(ownerId);
        client.setStatus(ClientStatus.ACTIVE);
        initializer.accept(client);
        client.refreshDisplayName();
        Instant now = Instant.now();
        client.setCreatedAt(now);
        client.setUpdatedAt(now);
        return clientRepository.saveAndFlush(client);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ClientEntity update(UUID tenantId, UUID clientId, Long expectedVersion, Consumer<ClientEntity> mutation) {
        ClientEntity client = requireClient(tenantId, clientId, expectedVersion);
        mutation.accept(client);
        client.refreshDisplayName();
        client.setUpdatedAt(Instant.now());
        return clientRepository.saveAndFlush(client);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void hardDelete(UUID tenantId, UUID clientId, Long expectedVersion) {
        ClientEntity client = requireClient(tenantId, clientId, expectedVersion);
        clientRepository.delete(client);
        clientRepository.flush();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ClientEntity> findById(UUID tenantId, UUID clientId, boolean includeDeleted) {
        return includeDeleted
                ? clientRepository.findByClientIdAndTenantId(clientId, tenantId)
                : clientRepository.findByClientIdAndTenantIdAndDeletedAtIsNull(clientId, tenantId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ClientEntity> findAllByIds(UUID tenantId, Collection<UUID> clientIds) {
        if (clientIds == null || clientIds.isEmpty()) {
            return List.of();
        }
        return clientRepository.findByTenantIdAndClientIdInAndDeletedAtIsNull(tenantId, clientIds);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, UUID> findKeyIndex(UUID tenantId, ClientField keyField) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Tuple> query = cb.createTupleQuery();
        Root<ClientEntity> root = query.from(ClientEntity.class);
        query.multiselect(root.get(keyField.key()), root.get("clientId"))
                .where(
                        cb.equal(root.get("tenantId"), tenantId),
                        cb.isNull(root.get("deletedAt")),
                        cb.isNotNull(root.get(keyField.key()))
                )
                .orderBy(cb.asc(root.get("createdAt")));

        Map<String, UUID> index = new HashMap<>();
        for (Tuple row : entityManager.createQuery(query).getResultList()) {
            String key = row.get(0, String.class);
            if (key != null && !key.isBlank()) {
                index.putIfAbsent(key, row.get(1, UUID.class));
            }
        }
        return index;
    }

    @Override
    @Transactional(readOnly = true)
    public List<UUID> findIdsByFilter(UUID tenantId, ExportFilter filter, Sort sort) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<UUID> query = cb.createQuery(UUID.class);
        Root<ClientEntity> root = query.from(ClientEntity.class);
        Predicate matching = ClientSpecifications.matching(tenantId, filter).toPredicate(root, query, cb);
        query.select(root.<UUID>get("clientId"))
                .where(matching)
                .orderBy(QueryUtils.toOrders(sort, root, cb));
        return entityManager.createQuery(query).getResultList();
    }

    private ClientEntity requireClient(UUID tenantId, UUID clientId, Long expectedVersion) {
        ClientEntity client = clientRepository.findByClientIdAndTenantId(clientId, tenantId)
                .orElseThrow(() -> new EmptyResultDataAccessException("Client not found: " + clientId, 1));
        if (expectedVersion != null && !Objects.equals(client.getVersion(), expectedVersion)) {
            throw new OptimisticLockingFailureException(
                    "Client " + clientId + " changed: expected version " + expectedVersion + ", found " + client.getVersion()
            );
        }
        return client;
    }
}
