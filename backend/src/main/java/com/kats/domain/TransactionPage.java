package com.kats.domain;

import java.util.List;

/**
 * One page of the ledger listing. {@code total} is only reported by the full listing; the latest
 * listing leaves it at -1.
 */
public record TransactionPage(int count, long total, List<KristTransaction> transactions) {

    public TransactionPage {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }

    public boolean isEmpty() {
        return count == 0 || transactions.isEmpty();
    }
}
