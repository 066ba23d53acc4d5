package com.kats.ingestion.adapter;

import com.kats.domain.TransactionPage;

/**
 * Read side of the ledger used by the sync jobs.
 */
public interface LedgerClient {

    /**
     * Full listing in ascending id order, starting at {@code offset}.
     */
    TransactionPage listTransactions(int limit, long offset);

    /**
     * Most recent transactions, newest first; {@code offset} counts back from the newest.
     */
    TransactionPage listLatestTransactions(int limit, long offset);
}
