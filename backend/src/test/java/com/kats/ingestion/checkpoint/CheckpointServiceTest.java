package com.kats.ingestion.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kats.domain.BackfillState;
import com.kats.domain.MalformedRecordException;
import com.kats.domain.TailState;
import com.kats.ingestion.publish.LastPublishedLookup;
import com.kats.support.InMemoryCheckpointStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CheckpointServiceTest {

    @Mock
    private LastPublishedLookup lastPublishedLookup;

    private InMemoryCheckpointStore store;
    private CheckpointService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryCheckpointStore();
        service = new CheckpointService(store, lastPublishedLookup, new ObjectMapper());
    }

    @Test
    void missingBackfillState_isInitial() {
        assertThat(service.loadBackfillState()).isEqualTo(new BackfillState(false, 0));
        assertThat(store.writes()).isEmpty();
    }

    @Test
    void storedBackfillState_isDecoded() {
        store.putJson(CheckpointService.BACKFILL_KEY, "{\"done\":false,\"offset\":2000}");

        assertThat(service.loadBackfillState()).isEqualTo(new BackfillState(false, 2000));
    }

    @Test
    void backfillState_roundTripsThroughStore() {
        service.saveBackfillState(new BackfillState(false, 1000));

        assertThat(store.writes()).containsExactly("catchup_state={\"done\":false,\"offset\":1000}");
        assertThat(service.findBackfillState()).isEqualTo(new BackfillState(false, 1000));
    }

    @Test
    void malformedBlobs_areRejected() {
        store.putJson(CheckpointService.BACKFILL_KEY, "{\"done\":false}");
        assertThatThrownBy(() -> service.loadBackfillState()).isInstanceOf(MalformedRecordException.class);

        store.putJson(CheckpointService.BACKFILL_KEY, "{\"done\":false,\"offset\":-5}");
        assertThatThrownBy(() -> service.loadBackfillState()).isInstanceOf(MalformedRecordException.class);

        store.putJson(CheckpointService.BACKFILL_KEY, "null");
        assertThatThrownBy(() -> service.loadBackfillState()).isInstanceOf(MalformedRecordException.class);

        store.putJson(CheckpointService.TAIL_KEY, "{\"lastSeen\":\"soon\"}");
        assertThatThrownBy(() -> service.loadTailState()).isInstanceOf(MalformedRecordException.class);
    }

    @Test
    void backfillOffset_neverMovesBack() {
        store.putJson(CheckpointService.BACKFILL_KEY, "{\"done\":false,\"offset\":2000}");
        service.loadBackfillState();

        assertThatThrownBy(() -> service.saveBackfillState(new BackfillState(false, 1000)))
                .isInstanceOf(IllegalStateException.class);
        assertThat(store.writes()).isEmpty();
    }

    @Test
    void completedBackfill_cannotBeReopened() {
        service.saveBackfillState(new BackfillState(true, 2500));

        assertThatThrownBy(() -> service.saveBackfillState(new BackfillState(false, 2500)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void storedTailState_winsOverBroker() {
        store.putJson(CheckpointService.TAIL_KEY, "{\"lastSeen\":999}");

        assertThat(service.loadTailState()).isEqualTo(new TailState(999));
        verifyNoInteractions(lastPublishedLookup);
    }

    @Test
    void missingTailState_bootstrapsFromLastPublished() {
        when(lastPublishedLookup.lastPublishedId()).thenReturn(OptionalLong.of(1234));

        assertThat(service.loadTailState()).isEqualTo(new TailState(1234));
        assertThat(store.writes()).isEmpty();
    }

    @Test
    void missingTailState_andEmptyStream_startsAtZero() {
        when(lastPublishedLookup.lastPublishedId()).thenReturn(OptionalLong.empty());

        assertThat(service.loadTailState()).isEqualTo(new TailState(0));
    }

    @Test
    void findTailState_neverBootstraps() {
        assertThat(service.findTailState()).isEmpty();
        verifyNoInteractions(lastPublishedLookup);
    }
}
