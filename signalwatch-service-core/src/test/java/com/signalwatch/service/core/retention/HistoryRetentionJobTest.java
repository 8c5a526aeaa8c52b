package com.signalwatch.service.core.retention;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.signalwatch.service.core.config.TelemetryProperties;
import com.signalwatch.service.core.state.StateStore;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class HistoryRetentionJobTest {

    private final StateStore store = mock(StateStore.class);
    private final TelemetryProperties properties = new TelemetryProperties();
    private final HistoryRetentionJob job = new HistoryRetentionJob(store, properties);

    @Test
    void scheduledRunIsSkippedWhenDisabled() {
        job.purgeScheduled();

        verifyNoInteractions(store);
    }

    @Test
    void scheduledRunUsesConfiguredAge() {
        properties.getRetention().setEnabled(true);
        properties.getRetention().setMaxAge(Duration.ofHours(6));

        job.purgeScheduled();

        verify(store).purgeOlderThan(Duration.ofHours(6));
    }

    @Test
    void manualPurgeReturnsRemovedCount() {
        when(store.purgeOlderThan(Duration.ofDays(1))).thenReturn(42);

        assertThat(job.purge(Duration.ofDays(1))).isEqualTo(42);
        assertThat(job.defaultMaxAge()).isEqualTo(Duration.ofDays(7));
    }

    @Test
    void negativeAgeIsRejected() {
        assertThatThrownBy(() -> job.purge(Duration.ofDays(-1))).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(store);
    }
}
