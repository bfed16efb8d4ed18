package com.orgsuite.docflow.repository;

import com.orgsuite.docflow.model.entity.Permission;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PermissionRepository extends JpaRepository<Permission, UUID> {

    Optional<Permission> findByDocumentIdAndUserId(UUID documentId, UUID userId);

    List<Permission> findByDocumentIdOrderByGrantedAtAsc(UUID documentId);
}
