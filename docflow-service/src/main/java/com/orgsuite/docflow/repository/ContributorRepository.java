package com.orgsuite.docflow.repository;

import com.orgsuite.docflow.model.entity.Contributor;
import com.orgsuite.docflow.model.enums.ContributorTeam;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ContributorRepository extends JpaRepository<Contributor, UUID> {

    List<Contributor> findByDocumentId(UUID documentId);

    List<Contributor> findByDocumentIdAndTeam(UUID documentId, ContributorTeam team);

    List<Contributor> findByDocumentIdAndUserId(UUID documentId, UUID userId);

    Optional<Contributor> findByDocumentIdAndUserIdAndTeam(UUID documentId, UUID userId, ContributorTeam team);

    boolean existsByDocumentIdAndUserIdAndTeam(UUID documentId, UUID userId, ContributorTeam team);

    boolean existsByDocumentIdAndTeam(UUID documentId, ContributorTeam team);
}
