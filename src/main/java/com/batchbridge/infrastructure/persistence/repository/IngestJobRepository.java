package com.batchbridge.infrastructure.persistence.repository;

import com.batchbridge.infrastructure.persistence.entity.IngestJobEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface IngestJobRepository extends JpaRepository<IngestJobEntity, UUID> {

    List<IngestJobEntity> findByFileReferenceOrderByStartedAtDesc(String fileReference);

    Page<IngestJobEntity> findByOutcome(IngestJobEntity.JobOutcome outcome, Pageable pageable);

    long countByEventId(UUID eventId);
}
