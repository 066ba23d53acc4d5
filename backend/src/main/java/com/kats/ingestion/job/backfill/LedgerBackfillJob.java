package com.kats.ingestion.job.backfill;

import com.kats.domain.BackfillState;
import com.kats.domain.KristTransaction;
import com.kats.domain.TailState;
import com.kats.domain.TransactionPage;
import com.kats.ingestion.adapter.LedgerClient;
import com.kats.ingestion.checkpoint.CheckpointService;
import com.kats.ingestion.config.BackfillProperties;
import com.kats.ingestion.publish.TransactionPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * One-time historical walk of the whole ledger, resumable from the stored offset.
 *
 * <p>Per page: publish every transaction in ledger order, then store {@code offset + count}, then store
 * the last id of the page as the tail checkpoint. A crash re-publishes at most the in-flight page, which
 * the broker de-duplicates by transaction id. An empty page marks the backfill done.
 *
 * <p>Any fetch, publish or checkpoint error aborts the run with the stored state untouched for that page.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LedgerBackfillJob {

    private final LedgerClient ledgerClient;
    private final TransactionPublisher publisher;
    private final CheckpointService checkpointService;
    private final BackfillProperties properties;

    /**
     * Runs until the ledger end is reached. Returns immediately when a previous run already finished.
     *
     * @return the final backfill state
     */
    public BackfillState run() {
        BackfillState state = checkpointService.loadBackfillState();
        if (state.done()) {
            log.info("Backfill already complete (offset {})", state.offset());
            return state;
        }
        log.info("Backfill starting at offset {}", state.offset());
        int pageSize = properties.getPageSize();
        while (true) {
            TransactionPage page = ledgerClient.listTransactions(pageSize, state.offset());
            log.info("Backfill page at offset {}: {} transactions, {} total", state.offset(), page.count(), page.total());

            if (page.isEmpty()) {
                state = state.complete();
                checkpointService.saveBackfillState(state);
                log.info("Backfill complete at offset {}", state.offset());
                return state;
            }

            List<KristTransaction> transactions = page.transactions();
            int published = 0;
            for (KristTransaction tx : transactions) {
                if (publisher.publish(tx)) {
                    published++;
                }
            }

            state = state.advance(page.count());
            checkpointService.saveBackfillState(state);
            checkpointService.saveTailState(new TailState(transactions.get(transactions.size() - 1).id()));
            log.debug("Backfill page done: {} published, {} skipped, next offset {}",
                    published, transactions.size() - published, state.offset());
        }
    }
}
