package com.deepansh.focus.health;

import com.deepansh.focus.config.FocusProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HealthSummaryProviderTest {

    @Mock
    private HealthSnapshotRepository repository;

    private FocusProperties properties;
    private HealthSummaryProvider provider;

    @BeforeEach
    void setUp() {
        properties = new FocusProperties();
        provider = new HealthSummaryProvider(properties, repository);
    }

    @Test
    void summary_disabled_explainsHowToEnable() {
        assertThat(provider.summary()).isEqualTo(HealthSummaryProvider.DISABLED);
        verifyNoInteractions(repository);
    }

    @Test
    void summary_noSnapshot_saysSo() {
        properties.getHealth().setEnabled(true);
        when(repository.findFirstByOrderByRecordedAtDesc()).thenReturn(Optional.empty());

        assertThat(provider.summary()).isEqualTo(HealthSummaryProvider.NO_DATA);
    }

    @Test
    void summary_formatsLatestSnapshot() {
        properties.getHealth().setEnabled(true);
        when(repository.findFirstByOrderByRecordedAtDesc()).thenReturn(Optional.of(HealthSnapshot.builder()
                .recordedAt(Instant.parse("2026-10-18T07:00:00Z"))
                .sleepMinutes(435)
                .steps(4200)
                .build()));

        assertThat(provider.summary()).isEqualTo("""
                Health Summary (Last 24 Hours):

                Sleep: 7h 15m
                Activity: 4200 steps today

                This data can help tailor ADHD task recommendations based on your current physical state.""");
    }

    @Test
    void summary_includesHeartRateWhenPresent() {
        properties.getHealth().setEnabled(true);
        when(repository.findFirstByOrderByRecordedAtDesc()).thenReturn(Optional.of(HealthSnapshot.builder()
                .restingHeartRate(58)
                .build()));

        assertThat(provider.summary())
                .contains("Sleep: No sleep data for last 24h")
                .contains("Activity: No activity data available")
                .contains("Resting heart rate: 58 bpm");
    }
}
