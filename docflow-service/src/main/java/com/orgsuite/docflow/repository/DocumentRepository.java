package com.orgsuite.docflow.repository;

import com.orgsuite.docflow.model.entity.Document;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DocumentRepository extends JpaRepository<Document, UUID> {

    /**
     * Loads the document with a row lock. Every workflow mutation goes through
     * this so that signature writes and stage evaluation are serialized per document.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM Document d WHERE d.id = :id")
    Optional<Document> findByIdForUpdate(@Param("id") UUID id);

    boolean existsByReference(String reference);

    @Query("SELECT DISTINCT d FROM Document d WHERE d.createdBy = :userId " +
            "OR d.id IN (SELECT c.documentId FROM Contributor c WHERE c.userId = :userId) " +
            "ORDER BY d.updatedAt DESC")
    List<Document> findAccessibleBy(@Param("userId") UUID userId);
}
