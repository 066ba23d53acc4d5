package com.kats.ingestion.job.tail;

import com.kats.domain.KristTransaction;
import com.kats.domain.TailState;
import com.kats.domain.TransactionPage;
import com.kats.ingestion.adapter.LedgerClient;
import com.kats.ingestion.checkpoint.CheckpointService;
import com.kats.ingestion.config.TailProperties;
import com.kats.ingestion.publish.TransactionPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Publishes ledger transactions appended since the tail checkpoint.
 *
 * <p>Walks the newest-first latest listing page by page and stops at the first id at or below
 * {@code lastSeen}. Everything collected is published in ascending id order, then the checkpoint moves to
 * the highest collected id. Collection is keyed by id, so a transaction that shifts across a page boundary
 * while the listing grows is only published once.
 *
 * <p>Only ever called from {@link TailDispatcher}; errors propagate to it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LedgerTailJob {

    private final LedgerClient ledgerClient;
    private final TransactionPublisher publisher;
    private final CheckpointService checkpointService;
    private final TailProperties properties;

    public TailRunResult run() {
        long lastSeen = checkpointService.loadTailState().lastSeen();
        NavigableMap<Long, KristTransaction> fresh = collectNewerThan(lastSeen);
        if (fresh.isEmpty()) {
            return TailRunResult.nothingNew(lastSeen);
        }

        int published = 0;
        for (KristTransaction tx : fresh.values()) {
            if (publisher.publish(tx)) {
                published++;
            }
        }
        long newLastSeen = fresh.lastKey();
        checkpointService.saveTailState(new TailState(newLastSeen));
        log.info("Tail run: {} new transactions ({} published), lastSeen {} -> {}",
                fresh.size(), published, lastSeen, newLastSeen);
        return new TailRunResult(fresh.size(), published, newLastSeen);
    }

    private NavigableMap<Long, KristTransaction> collectNewerThan(long lastSeen) {
        NavigableMap<Long, KristTransaction> fresh = new TreeMap<>();
        int pageSize = properties.getPageSize();
        long offset = 0;
        while (true) {
            TransactionPage page = ledgerClient.listLatestTransactions(pageSize, offset);
            if (page.isEmpty()) {
                return fresh;
            }
            for (KristTransaction tx : page.transactions()) {
                if (tx.id() <= lastSeen) {
                    return fresh;
                }
                log.debug("Found new transaction {}", tx.id());
                fresh.putIfAbsent(tx.id(), tx);
            }
            offset += page.count();
        }
    }
}
