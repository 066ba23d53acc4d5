package com.kats.ingestion.publish;

import com.kats.domain.KristTransaction;

/**
 * Hands ledger transactions to the broker. Implementations must be idempotent per transaction id:
 * republishing the same transaction is collapsed by the broker into one delivery.
 */
public interface TransactionPublisher {

    /**
     * Publishes the transaction unless it is reserved.
     *
     * @return true if the transaction was forwarded to the broker, false if it was filtered out
     */
    boolean publish(KristTransaction transaction);
}
