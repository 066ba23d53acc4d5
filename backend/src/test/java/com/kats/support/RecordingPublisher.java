package com.kats.support;

import com.kats.domain.KristTransaction;
import com.kats.ingestion.publish.ReservedTransactionFilter;
import com.kats.ingestion.publish.TransactionPublisher;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Publisher double that behaves like a de-duplicating broker: records every publish attempt and the
 * set of distinct delivered ids.
 */
public class RecordingPublisher implements TransactionPublisher {

    private final List<Long> attempts = new ArrayList<>();
    private final Set<Long> delivered = new LinkedHashSet<>();
    private long failOnId = -1;

    @Override
    public boolean publish(KristTransaction transaction) {
        if (ReservedTransactionFilter.isReserved(transaction)) {
            return false;
        }
        if (transaction.id() == failOnId) {
            throw new IllegalStateException("broker unavailable");
        }
        attempts.add(transaction.id());
        delivered.add(transaction.id());
        return true;
    }

    public void failOn(long id) {
        this.failOnId = id;
    }

    public void recover() {
        this.failOnId = -1;
    }

    public List<Long> attempts() {
        return attempts;
    }

    public List<Long> delivered() {
        return List.copyOf(delivered);
    }
}
