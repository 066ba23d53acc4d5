package com.kats.ingestion.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kats.common.RetryPolicy;
import com.kats.domain.KristTransaction;
import com.kats.domain.MalformedRecordException;
import com.kats.domain.TransactionPage;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Ledger listing over the Krist HTTP API. Every call passes the local rate limiter; retryable transport
 * failures are retried with {@link RetryPolicy} backoff. API-level errors ({@code ok:false}, 4xx) and
 * malformed records fail immediately.
 */
@Slf4j
public class KristLedgerAdapter implements LedgerClient {

    static final String TRANSACTIONS_PATH = "/transactions";
    static final String LATEST_TRANSACTIONS_PATH = "/transactions/latest";

    private final KristApiClient apiClient;
    private final ObjectMapper objectMapper;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;

    public KristLedgerAdapter(KristApiClient apiClient, ObjectMapper objectMapper,
                              RateLimiter rateLimiter, RetryPolicy retryPolicy) {
        this.apiClient = apiClient;
        this.objectMapper = objectMapper;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public TransactionPage listTransactions(int limit, long offset) {
        return fetchPage(TRANSACTIONS_PATH, limit, offset);
    }

    @Override
    public TransactionPage listLatestTransactions(int limit, long offset) {
        return fetchPage(LATEST_TRANSACTIONS_PATH, limit, offset);
    }

    private TransactionPage fetchPage(String path, int limit, long offset) {
        Map<String, Object> query = Map.of("limit", limit, "offset", offset);
        LedgerException lastException = null;
        for (int attempt = 0; retryPolicy.canRetry(attempt); attempt++) {
            if (attempt > 0) {
                sleepBeforeRetry(attempt - 1, path);
            }
            try {
                return parsePage(path, call(path, query));
            } catch (LedgerException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                lastException = e;
                log.warn("Krist {} (limit={}, offset={}) attempt {}/{} failed: {}",
                        path, limit, offset, attempt + 1, retryPolicy.getMaxAttempts(), e.getMessage());
            }
        }
        throw new LedgerException("Krist " + path + " failed after " + retryPolicy.getMaxAttempts() + " attempts",
                lastException);
    }

    private String call(String path, Map<String, Object> query) {
        if (!rateLimiter.acquirePermission()) {
            throw new LedgerException("Local limiter timeout before " + path, true, null);
        }
        String body = apiClient.get(path, query).block();
        if (body == null) {
            throw new LedgerException("Empty response from Krist " + path, true, null);
        }
        return body;
    }

    TransactionPage parsePage(String path, String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedRecordException("Krist " + path + " returned invalid JSON", e);
        }
        if (!root.path("ok").asBoolean(false)) {
            String error = root.path("error").asText("unknown_error");
            throw new LedgerException("Krist " + path + " error: " + error);
        }
        JsonNode items = root.path("transactions");
        if (!items.isArray()) {
            throw new MalformedRecordException("Krist " + path + " response has no transactions array");
        }
        List<KristTransaction> transactions = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            transactions.add(toTransaction(item));
        }
        int count = root.path("count").asInt(transactions.size());
        long total = root.path("total").asLong(-1);
        return new TransactionPage(count, total, transactions);
    }

    private KristTransaction toTransaction(JsonNode item) {
        try {
            return objectMapper.treeToValue(item, KristTransaction.class).validate();
        } catch (JsonProcessingException e) {
            throw new MalformedRecordException("Undecodable Krist transaction: " + item, e);
        }
    }

    private void sleepBeforeRetry(int attempt, String path) {
        try {
            Thread.sleep(retryPolicy.delay(attempt).toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LedgerException("Interrupted while retrying Krist " + path, e);
        }
    }
}
