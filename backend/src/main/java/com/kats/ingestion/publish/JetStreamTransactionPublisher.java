package com.kats.ingestion.publish;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kats.domain.KristTransaction;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.PublishOptions;
import io.nats.client.api.PublishAck;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Publishes transactions to JetStream with {@code Nats-Msg-Id} set to the transaction id, so the
 * stream drops repeats inside its duplicate window.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JetStreamTransactionPublisher implements TransactionPublisher {

    private final JetStream jetStream;
    private final ObjectMapper objectMapper;

    @Override
    public boolean publish(KristTransaction transaction) {
        if (ReservedTransactionFilter.isReserved(transaction)) {
            log.debug("Skipping reserved transaction {} from {} to {}",
                    transaction.id(), transaction.from(), transaction.to());
            return false;
        }
        String subject = SubjectNames.forTransfer(transaction.from(), transaction.to());
        PublishOptions options = PublishOptions.builder()
                .messageId(dedupId(transaction))
                .build();
        try {
            PublishAck ack = jetStream.publish(subject, objectMapper.writeValueAsBytes(transaction), options);
            log.debug("Published transaction {} subject={} stream={} seq={} duplicate={}",
                    transaction.id(), subject, ack.getStream(), ack.getSeqno(), ack.isDuplicate());
            return true;
        } catch (JsonProcessingException e) {
            throw new BrokerException("Cannot encode transaction " + transaction.id(), e);
        } catch (IOException | JetStreamApiException e) {
            throw new BrokerException("Publish of transaction " + transaction.id() + " to " + subject + " failed", e);
        }
    }

    static String dedupId(KristTransaction transaction) {
        return Long.toString(transaction.id());
    }
}
