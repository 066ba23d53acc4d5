package com.kats.ingestion.publish;

import com.kats.ingestion.config.NatsProperties;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.KeyValueManagement;
import io.nats.client.api.KeyValueConfiguration;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.api.StreamInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;

/**
 * Declares the transaction stream and the checkpoint KV bucket before any publish happens.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StreamProvisioner {

    /** JetStream API error: stream name already in use (with a different configuration). */
    static final int STREAM_NAME_IN_USE = 10058;
    /** JetStream API error: stream (KV bucket) not found. */
    static final int STREAM_NOT_FOUND = 10059;

    private final Connection connection;
    private final NatsProperties properties;

    public void provision() {
        try {
            createOrUpdateStream(connection.jetStreamManagement(), streamConfiguration());
        } catch (IOException e) {
            throw new BrokerException("Cannot obtain JetStream management context", e);
        }
    }

    /**
     * Adds the stream; when the server reports the name is taken, updates it in place with the same config.
     */
    StreamInfo createOrUpdateStream(JetStreamManagement jsm, StreamConfiguration config) {
        try {
            StreamInfo info = jsm.addStream(config);
            log.info("Stream {} created with subjects {}", config.getName(), config.getSubjects());
            return info;
        } catch (JetStreamApiException e) {
            if (e.getApiErrorCode() != STREAM_NAME_IN_USE) {
                throw new BrokerException("Stream " + config.getName() + " declaration failed", e);
            }
            return updateStream(jsm, config);
        } catch (IOException e) {
            throw new BrokerException("Stream " + config.getName() + " declaration failed", e);
        }
    }

    private StreamInfo updateStream(JetStreamManagement jsm, StreamConfiguration config) {
        try {
            StreamInfo info = jsm.updateStream(config);
            log.info("Stream {} already existed, updated with subjects {}", config.getName(), config.getSubjects());
            return info;
        } catch (IOException | JetStreamApiException e) {
            throw new BrokerException("Stream " + config.getName() + " update failed", e);
        }
    }

    /**
     * Creates the checkpoint bucket unless it already exists.
     */
    public void ensureKeyValueBucket() {
        String bucket = properties.getKvBucket();
        try {
            KeyValueManagement kvm = connection.keyValueManagement();
            if (bucketExists(kvm, bucket)) {
                log.info("KV bucket {} present", bucket);
                return;
            }
            kvm.create(KeyValueConfiguration.builder()
                    .name(bucket)
                    .storageType(StorageType.File)
                    .build());
            log.info("KV bucket {} created", bucket);
        } catch (IOException | JetStreamApiException e) {
            throw new BrokerException("KV bucket " + bucket + " provisioning failed", e);
        }
    }

    private static boolean bucketExists(KeyValueManagement kvm, String bucket) throws IOException, JetStreamApiException {
        try {
            kvm.getStatus(bucket);
            return true;
        } catch (JetStreamApiException e) {
            if (e.getApiErrorCode() == STREAM_NOT_FOUND) {
                return false;
            }
            throw e;
        }
    }

    StreamConfiguration streamConfiguration() {
        return StreamConfiguration.builder()
                .name(properties.getStream())
                .subjects(SubjectNames.ALL_TRANSACTIONS)
                .storageType(StorageType.File)
                .duplicateWindow(Duration.ofMillis(properties.getDuplicateWindowMs()))
                .build();
    }
}
