package com.kats.ingestion.publish;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kats.domain.KristTransaction;
import com.kats.domain.MalformedRecordException;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.MessageInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.OptionalLong;

/**
 * Last-by-subject lookup over the transaction stream.
 */
@Slf4j
@RequiredArgsConstructor
public class JetStreamLastPublishedLookup implements LastPublishedLookup {

    /** JetStream API error: no message matches the requested subject. */
    static final int NO_MESSAGE_FOUND = 10037;

    private final JetStreamManagement jetStreamManagement;
    private final ObjectMapper objectMapper;
    private final String streamName;

    @Override
    public OptionalLong lastPublishedId() {
        MessageInfo last;
        try {
            last = jetStreamManagement.getLastMessage(streamName, SubjectNames.ALL_TRANSACTIONS);
        } catch (JetStreamApiException e) {
            if (e.getApiErrorCode() == NO_MESSAGE_FOUND) {
                log.info("Stream {} holds no transactions yet", streamName);
                return OptionalLong.empty();
            }
            throw new BrokerException("Last message lookup on stream " + streamName + " failed", e);
        } catch (IOException e) {
            throw new BrokerException("Last message lookup on stream " + streamName + " failed", e);
        }
        try {
            return OptionalLong.of(objectMapper.readValue(last.getData(), KristTransaction.class).validate().id());
        } catch (IOException e) {
            throw new MalformedRecordException("Last message on stream " + streamName + " is not a transaction", e);
        }
    }
}
