package com.orgsuite.docflow.repository;

import com.orgsuite.docflow.model.entity.DocumentVersion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DocumentVersionRepository extends JpaRepository<DocumentVersion, UUID> {

    List<DocumentVersion> findByDocumentIdOrderBySequenceNumberDesc(UUID documentId);

    Optional<DocumentVersion> findByIdAndDocumentId(UUID id, UUID documentId);

    @Query("SELECT COALESCE(MAX(v.sequenceNumber), 0) FROM DocumentVersion v WHERE v.documentId = :documentId")
    int findLatestSequenceNumber(@Param("documentId") UUID documentId);
}
