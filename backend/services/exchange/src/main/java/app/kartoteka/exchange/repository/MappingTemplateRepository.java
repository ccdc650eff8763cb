package app.kartoteka.exchange.repository;

import app.kartoteka.exchange.domain.MappingTemplateEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface MappingTemplateRepository extends JpaRepository<MappingTemplateEntity, UUID> {

    List<MappingTemplateEntity> findByTenantIdOrderByNameAsc(UUID tenantId);

    Optional<MappingTemplateEntity> findByTemplateIdAndTenantId(UUID templateId, UUID tenantId);

    boolean existsByTenantIdAndNameIgnoreCase(UUID tenantId, String name);
}
