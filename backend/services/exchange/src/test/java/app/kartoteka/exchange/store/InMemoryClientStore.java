package app.kartoteka.exchange.store;

import app.kartoteka.exchange.domain.ClientEntity;
import app.kartoteka.exchange.domain.ClientField;
import app.kartoteka.exchange.domain.ClientStatus;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Sort;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

public class InMemoryClientStore implements ClientStore {

    private final Map<UUID, ClientEntity> clients = new LinkedHashMap<>();
    private final Set<UUID> conflicting = new HashSet<>();
    private int writes;
    private Runnable afterNextRead;

    public ClientEntity seed(UUID tenantId, Consumer<ClientEntity> initializer) {
        ClientEntity client = new ClientEntity();
        client.setClientId(UUID.randomUUID());
        client.setTenantId(tenantId);
        client.setOwnerId(UUID.randomUUID());
        client.setStatus(ClientStatus.ACTIVE);
        client.setVersion(0L);
        initializer.accept(client);
        client.refreshDisplayName();
        client.setCreatedAt(Instant.now());
        clients.put(client.getClientId(), client);
        return client;
    }

    /**
     * Every later write to {@code clientId} fails as if another session had changed the record.
     */
    public void conflictOn(UUID clientId) {
        conflicting.add(clientId);
    }

    public List<ClientEntity> all(UUID tenantId) {
        return clients.values().stream().filter(client -> client.getTenantId().equals(tenantId)).toList();
    }

    public ClientEntity get(UUID clientId) {
        return clients.get(clientId);
    }

    /**
     * Runs {@code action} once, right after the next {@link #findAllByIds} has read its records.
     */
    public void afterNextRead(Runnable action) {
        afterNextRead = action;
    }

    public int writes() {
        return writes;
    }

    @Override
    public ClientEntity create(UUID tenantId, UUID ownerId, Consumer<ClientEntity> initializer) {
        ClientEntity client = new ClientEntity();
        client.setClientId(UUID.randomUUID());
        client.setTenantId(tenantId);
        client.setOwnerId(ownerId);
        client.setStatus(ClientStatus.ACTIVE);
        client.setVersion(0L);
        initializer.accept(client);
        client.refreshDisplayName();
        client.setCreatedAt(Instant.now());
        clients.put(client.getClientId(), client);
        writes++;
        return client;
    }

    @Override
    public ClientEntity update(UUID tenantId, UUID clientId, Long expectedVersion, Consumer<ClientEntity> mutation) {
        ClientEntity client = require(tenantId, clientId, expectedVersion);
        mutation.accept(client);
        client.refreshDisplayName();
        client.setVersion(client.getVersion() + 1);
        client.setUpdatedAt(Instant.now());
        writes++;
        return client;
    }

    @Override
    public void hardDelete(UUID tenantId, UUID clientId, Long expectedVersion) {
        require(tenantId, clientId, expectedVersion);
        clients.remove(clientId);
        writes++;
    }

    @Override
    public Optional<ClientEntity> findById(UUID tenantId, UUID clientId, boolean includeDeleted) {
        ClientEntity client = clients.get(clientId);
        if (client == null || !client.getTenantId().equals(tenantId) || (!includeDeleted && client.isDeleted())) {
            return Optional.empty();
        }
        return Optional.of(client);
    }

    @Override
    public List<ClientEntity> findAllByIds(UUID tenantId, Collection<UUID> clientIds) {
        List<ClientEntity> found = clientIds.stream()
                .map(id -> findById(tenantId, id, false))
                .flatMap(Optional::stream)
                .toList();
        if (afterNextRead != null) {
            Runnable action = afterNextRead;
            afterNextRead = null;
            action.run();
        }
        return found;
    }

    @Override
    public Map<String, UUID> findKeyIndex(UUID tenantId, ClientField keyField) {
        Map<String, UUID> index = new LinkedHashMap<>();
        for (ClientEntity client : clients.values()) {
            String key = keyField.read(client);
            if (client.getTenantId().equals(tenantId) && !client.isDeleted() && key != null) {
                index.putIfAbsent(key, client.getClientId());
            }
        }
        return index;
    }

    @Override
    public List<UUID> findIdsByFilter(UUID tenantId, ExportFilter filter, Sort sort) {
        return clients.values().stream()
                .filter(client -> client.getTenantId().equals(tenantId) && !client.isDeleted())
                .filter(client -> filter.statuses() == null || filter.statuses().isEmpty()
                        || filter.statuses().contains(client.getStatus()))
                .filter(client -> filter.tagIds() == null || filter.tagIds().isEmpty()
                        || client.getTags().stream().anyMatch(filter.tagIds()::contains))
                .filter(client -> filter.search() == null || client.getDisplayName().toLowerCase(Locale.ROOT)
                        .contains(filter.search().toLowerCase(Locale.ROOT)))
                .sorted(Comparator.comparing(ClientEntity::getDisplayName))
                .map(ClientEntity::getClientId)
                .toList();
    }

    private ClientEntity require(UUID tenantId, UUID clientId, Long expectedVersion) {
        ClientEntity client = clients.get(clientId);
        if (client == null || !client.getTenantId().equals(tenantId)) {
            throw new EmptyResultDataAccessException("Client " + clientId + " not found", 1);
        }
        if (conflicting.contains(clientId) || (expectedVersion != null && !expectedVersion.equals(client.getVersion()))) {
            throw new OptimisticLockingFailureException("Client " + clientId + " was modified concurrently");
        }
        return client;
    }
}
