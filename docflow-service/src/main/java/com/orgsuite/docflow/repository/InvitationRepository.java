package com.orgsuite.docflow.repository;

import com.orgsuite.docflow.model.entity.Invitation;
import com.orgsuite.docflow.model.enums.InvitationStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface InvitationRepository extends JpaRepository<Invitation, UUID> {

    /** Token lookup with a row lock; two concurrent accepts of one token serialize here. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM Invitation i WHERE i.token = :token")
    Optional<Invitation> findByTokenForUpdate(@Param("token") String token);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM Invitation i WHERE i.id = :id")
    Optional<Invitation> findByIdForUpdate(@Param("id") UUID id);

    List<Invitation> findByDocumentIdOrderByCreatedAtDesc(UUID documentId);

    @Query("SELECT i FROM Invitation i WHERE LOWER(i.invitedEmail) = LOWER(:email) " +
            "AND i.status = :status AND i.expiresAt > :now ORDER BY i.sentAt DESC")
    List<Invitation> findActionableByEmail(@Param("email") String email,
            @Param("status") InvitationStatus status,
            @Param("now") OffsetDateTime now);

    @Query("SELECT COUNT(i) > 0 FROM Invitation i WHERE i.documentId = :documentId " +
            "AND LOWER(i.invitedEmail) = LOWER(:email) AND i.status = :status AND i.expiresAt > :now")
    boolean existsActionable(@Param("documentId") UUID documentId,
            @Param("email") String email,
            @Param("status") InvitationStatus status,
            @Param("now") OffsetDateTime now);

    @Query("SELECT COUNT(i) > 0 FROM Invitation i WHERE i.documentId = :documentId " +
            "AND i.invitedUserId = :userId AND i.status = :status")
    boolean existsByDocumentIdAndInvitedUserIdAndStatus(@Param("documentId") UUID documentId,
            @Param("userId") UUID userId,
            @Param("status") InvitationStatus status);

    @Modifying
    @Transactional
    @Query("UPDATE Invitation i SET i.status = com.orgsuite.docflow.model.enums.InvitationStatus.EXPIRED, " +
            "i.updatedAt = :now WHERE i.status = com.orgsuite.docflow.model.enums.InvitationStatus.PENDING " +
            "AND i.expiresAt <= :now")
    int expireStaleInvitations(@Param("now") OffsetDateTime now);
}
