package com.kats.ingestion.publish;

import com.kats.ingestion.config.NatsProperties;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.api.StreamInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StreamProvisionerTest {

    @Mock
    private Connection connection;
    @Mock
    private JetStreamManagement jsm;

    private StreamProvisioner provisioner;

    @BeforeEach
    void setUp() {
        NatsProperties properties = new NatsProperties();
        properties.setStream("KRIST");
        properties.setDuplicateWindowMs(120_000);
        provisioner = new StreamProvisioner(connection, properties);
    }

    @Test
    void streamConfiguration_bindsAllTransactionSubjects() {
        StreamConfiguration config = provisioner.streamConfiguration();

        assertThat(config.getName()).isEqualTo("KRIST");
        assertThat(config.getSubjects()).containsExactly("krist.from.*.to.*");
        assertThat(config.getDuplicateWindow()).isEqualTo(Duration.ofMinutes(2));
    }

    @Test
    void streamConfiguration_usesConfiguredDuplicateWindow() {
        assertThat(new NatsProperties().getDuplicateWindowMs()).isEqualTo(120_000);

        NatsProperties longRestarts = new NatsProperties();
        longRestarts.setDuplicateWindowMs(Duration.ofHours(1).toMillis());

        assertThat(new StreamProvisioner(connection, longRestarts).streamConfiguration().getDuplicateWindow())
                .isEqualTo(Duration.ofHours(1));
    }

    @Test
    void newStream_isAdded() throws Exception {
        StreamConfiguration config = provisioner.streamConfiguration();
        StreamInfo info = mock(StreamInfo.class);
        when(jsm.addStream(config)).thenReturn(info);

        assertThat(provisioner.createOrUpdateStream(jsm, config)).isSameAs(info);
        verify(jsm, never()).updateStream(config);
    }

    @Test
    void existingStream_isUpdatedWithSameConfig() throws Exception {
        StreamConfiguration config = provisioner.streamConfiguration();
        StreamInfo info = mock(StreamInfo.class);
        JetStreamApiException nameInUse = apiError(StreamProvisioner.STREAM_NAME_IN_USE);
        when(jsm.addStream(config)).thenThrow(nameInUse);
        when(jsm.updateStream(config)).thenReturn(info);

        assertThat(provisioner.createOrUpdateStream(jsm, config)).isSameAs(info);
        verify(jsm).updateStream(config);
    }

    @Test
    void otherApiError_isNotRecovered() throws Exception {
        StreamConfiguration config = provisioner.streamConfiguration();
        JetStreamApiException invalidConfig = apiError(10052);
        when(jsm.addStream(config)).thenThrow(invalidConfig);

        assertThatThrownBy(() -> provisioner.createOrUpdateStream(jsm, config))
                .isInstanceOf(BrokerException.class)
                .hasCauseInstanceOf(JetStreamApiException.class);
        verify(jsm, never()).updateStream(config);
    }

    @Test
    void provision_usesConnectionManagementContext() throws Exception {
        when(connection.jetStreamManagement()).thenReturn(jsm);

        provisioner.provision();

        ArgumentCaptor<StreamConfiguration> config = ArgumentCaptor.forClass(StreamConfiguration.class);
        verify(jsm).addStream(config.capture());
        assertThat(config.getValue().getName()).isEqualTo("KRIST");
    }

    /** Build before stubbing; creating it inside another when(..) leaves that stubbing unfinished. */
    static JetStreamApiException apiError(int apiErrorCode) {
        JetStreamApiException e = mock(JetStreamApiException.class);
        when(e.getApiErrorCode()).thenReturn(apiErrorCode);
        return e;
    }
}
