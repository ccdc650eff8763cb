package app.kartoteka.exchange.repository;

import app.kartoteka.exchange.domain.ClientEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ClientRepository extends JpaRepository<ClientEntity, UUID> {

    Optional<ClientEntity> findByClientIdAndTenantId(UUID clientId, UUID tenantId);

    Optional<ClientEntity> findByClientIdAndTenantIdAndDeletedAtIsNull(UUID clientId, UUID tenantId);

    List<ClientEntity> findByTenantIdAndClientIdInAndDeletedAtIsNull(UUID tenantId, Collection<UUID> clientIds);
}
