package com.orgsuite.docflow.repository;

import com.orgsuite.docflow.model.entity.Signature;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SignatureRepository extends JpaRepository<Signature, UUID> {

    List<Signature> findByDocumentIdOrderBySignedAtAsc(UUID documentId);
}
