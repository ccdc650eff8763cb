package app.kartoteka.exchange.store;

import app.kartoteka.exchange.domain.ClientEntity;
import app.kartoteka.exchange.domain.ClientField;
import org.springframework.data.domain.Sort;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Persisted client records as seen by the exchange engine. Every call is tenant scoped and
 * runs in its own transaction, so a failing write never takes earlier writes with it.
 */
public interface ClientStore {

    ClientEntity create(UUID tenantId, UUID ownerId, Consumer<ClientEntity> initializer);

    /**
     * Applies {@code mutation} to a record, soft-deleted ones included.
     *
     * @param expectedVersion version the caller read, or {@code null} to skip the check
     * @throws org.springframework.dao.OptimisticLockingFailureException when the record changed since it was read
     * @throws org.springframework.dao.EmptyResultDataAccessException   when the record does not exist in the tenant
     */
    ClientEntity update(UUID tenantId, UUID clientId, Long expectedVersion, Consumer<ClientEntity> mutation);

    void hardDelete(UUID tenantId, UUID clientId, Long expectedVersion);

    Optional<ClientEntity> findById(UUID tenantId, UUID clientId, boolean includeDeleted);

    List<ClientEntity> findAllByIds(UUID tenantId, Collection<UUID> clientIds);

    Map<String, UUID> findKeyIndex(UUID tenantId, ClientField keyField);

    List<UUID> findIdsByFilter(UUID tenantId, ExportFilter filter, Sort sort);
}
