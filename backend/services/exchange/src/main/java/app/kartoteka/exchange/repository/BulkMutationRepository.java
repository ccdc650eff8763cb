package app.kartoteka.exchange.repository;

import app.kartoteka.exchange.domain.BulkMutationEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BulkMutationRepository extends JpaRepository<BulkMutationEntity, UUID> {

    Optional<BulkMutationEntity> findByMutationIdAndTenantId(UUID mutationId, UUID tenantId);

    Page<BulkMutationEntity> findByTenantIdOrderByCreatedAtDesc(UUID tenantId, Pageable pageable);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update BulkMutationEntity m
            set m.reversedAt = :now,
                m.reversedBy = :actorId
            where m.mutationId = :mutationId
              and m.reversible = true
              and m.reversedAt is null
            """)
    int markReversed(@Param("mutationId") UUID mutationId,
                     @Param("actorId") UUID actorId,
                     @Param("now") Instant now);
}
