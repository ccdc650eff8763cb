package app.kartoteka.exchange.repository;

import app.kartoteka.exchange.domain.JobRowErrorEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface JobRowErrorRepository extends JpaRepository<JobRowErrorEntity, UUID> {

    Page<JobRowErrorEntity> findByJobIdOrderByRowNumberAsc(UUID jobId, Pageable pageable);

    long countByJobId(UUID jobId);

    @Modifying
    @Query("delete from JobRowErrorEntity e where e.jobId = :jobId")
    int deleteByJobId(@Param("jobId") UUID jobId);
}
