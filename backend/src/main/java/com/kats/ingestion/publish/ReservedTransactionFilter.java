package com.kats.ingestion.publish;

import com.kats.domain.KristTransaction;

import java.util.Set;

/**
 * Identifies synthetic ledger entries that are never forwarded: mined coins (no sender) and
 * name purchases / A-record updates ({@code to} is {@code name} or {@code a}).
 */
public final class ReservedTransactionFilter {

    private static final Set<String> RESERVED_RECIPIENTS = Set.of("name", "a");

    private ReservedTransactionFilter() {
    }

    public static boolean isReserved(KristTransaction tx) {
        if (tx.from() == null || tx.from().isEmpty()) {
            return true;
        }
        return RESERVED_RECIPIENTS.contains(tx.to());
    }
}
