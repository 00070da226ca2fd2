package com.scanhub.pairing.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.scanhub.pairing.model.domain.PairingRecord;
import com.scanhub.pairing.model.enums.SyncStatus;

import jakarta.persistence.LockModeType;

/**
 * Repository for PairingRecord entity.
 */
@Repository
public interface PairingRecordRepository extends JpaRepository<PairingRecord, Long> {

    /**
     * Records for a product in insertion order, newest first, locked for update.
     * Ordered by id rather than scan time so a clock step cannot reorder them.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM PairingRecord r WHERE r.product = :product " +
           "ORDER BY r.id DESC")
    List<PairingRecord> findLatestForProduct(@Param("product") Long product, Pageable pageable);

    /**
     * Latest record written by a login, in insertion order.
     */
    Optional<PairingRecord> findFirstByLoginOrderByIdDesc(String login);

    /**
     * Flag a record as superseded.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE PairingRecord r SET r.overwrite = TRUE WHERE r.id = :id")
    int markOverwritten(@Param("id") Long id);

    /**
     * Move a record out of PENDING. Matches nothing once the record is terminal.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE PairingRecord r SET r.syncStatus = :status, r.syncError = :error " +
           "WHERE r.id = :id AND r.syncStatus = :expected")
    int transitionStatus(
            @Param("id") Long id,
            @Param("expected") SyncStatus expected,
            @Param("status") SyncStatus status,
            @Param("error") String error);

    /**
     * Count records in the given sync status.
     */
    long countBySyncStatus(SyncStatus status);

    /**
     * Count records for a product that are not overwritten.
     */
    long countByProductAndOverwriteFalse(Long product);
}
