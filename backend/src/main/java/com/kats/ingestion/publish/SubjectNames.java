package com.kats.ingestion.publish;

/**
 * Broker subjects for ledger transactions: {@code krist.from.{from}.to.{to}}.
 */
public final class SubjectNames {

    public static final String PREFIX = "krist";

    /** Matches every transaction subject; used for the stream binding and last-message lookup. */
    public static final String ALL_TRANSACTIONS = forTransfer("*", "*");

    private SubjectNames() {
    }

    public static String forTransfer(String from, String to) {
        return PREFIX + ".from." + from + ".to." + to;
    }
}
