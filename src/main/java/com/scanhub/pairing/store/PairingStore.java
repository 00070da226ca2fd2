package com.scanhub.pairing.store;

import java.util.Optional;

import com.scanhub.pairing.model.enums.SyncStatus;

/**
 * Persistence contract used by the pairing commit and the reconciliation worker.
 *
 * The store is the single arbiter of which platform currently holds a product.
 */
public interface PairingStore {

    /**
     * Find the most recent record for a product and flag it as overwritten.
     *
     * Not serialized per product. Two callers running this and {@link #insert}
     * concurrently for the same product can both see the same prior record and leave
     * two current records behind. Call it only from {@link #commitPairing}.
     *
     * @param product the product id
     * @return the superseded record, or empty when the product was never paired
     */
    Optional<PriorPairing> findAndMarkOverwritten(long product);

    /**
     * Insert a new record with overwrite=false and status PENDING.
     *
     * Does not supersede anything on its own. Outside {@link #commitPairing} it breaks
     * the one current record per product rule.
     *
     * @return the generated record id
     */
    long insert(NewPairing pairing);

    /**
     * Run {@link #findAndMarkOverwritten} and {@link #insert} as one unit, serialized
     * against every other commit for the same product.
     *
     * Either both effects are applied or neither is.
     *
     * @throws com.scanhub.pairing.exception.PairingCommitException if the unit failed
     */
    CommitResult commitPairing(NewPairing pairing);

    /**
     * Move a record from PENDING to a terminal status.
     *
     * @return true if the record was PENDING and is now {@code status}
     */
    boolean updateStatus(long recordId, SyncStatus status, String diagnostic);

    /**
     * Platform of the most recent record written by a login, used as the initial
     * binding of a freshly created identity context.
     */
    Optional<Integer> findLatestPlatformForIdentity(String login);

    // ========================================================================
    // VALUE TYPES
    // ========================================================================

    /**
     * Pairing about to be committed.
     */
    record NewPairing(String login, int platform, long product) {}

    /**
     * Record that was superseded by a commit.
     */
    record PriorPairing(long recordId, int platform) {}

    /**
     * Outcome of a commit.
     */
    record CommitResult(long recordId, Optional<PriorPairing> prior) {

        public boolean overwrite() {
            return prior.isPresent();
        }
    }
}
