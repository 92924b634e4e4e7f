package com.batchbridge.infrastructure.persistence.repository;

import com.batchbridge.infrastructure.persistence.entity.IngestJobErrorEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface IngestJobErrorRepository extends JpaRepository<IngestJobErrorEntity, UUID> {

    List<IngestJobErrorEntity> findByJobIdOrderByLineNumberAsc(UUID jobId);
}
