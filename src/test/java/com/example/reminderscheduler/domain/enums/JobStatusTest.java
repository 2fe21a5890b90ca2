package com.example.reminderscheduler.domain.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JobStatus Enum Tests")
class JobStatusTest {

    @Test
    @DisplayName("Only completed should be terminal")
    void onlyCompletedShouldBeTerminal() {
        assertThat(JobStatus.COMPLETED.isTerminal()).isTrue();

        assertThat(JobStatus.SCHEDULED.isTerminal()).isFalse();
        assertThat(JobStatus.PAUSED.isTerminal()).isFalse();
    }

    @Test
    @DisplayName("Only scheduled jobs should be due eligible")
    void onlyScheduledShouldBeDueEligible() {
        assertThat(JobStatus.SCHEDULED.isDueEligible()).isTrue();

        assertThat(JobStatus.PAUSED.isDueEligible()).isFalse();
        assertThat(JobStatus.COMPLETED.isDueEligible()).isFalse();
    }

    @Test
    @DisplayName("Should lookup by code")
    void shouldLookupByCode() {
        assertThat(JobStatus.fromCode("scheduled")).isEqualTo(JobStatus.SCHEDULED);
        assertThat(JobStatus.fromCode("paused")).isEqualTo(JobStatus.PAUSED);
        assertThat(TriggerType.fromCode("interval")).isEqualTo(TriggerType.INTERVAL);
    }

    @Test
    @DisplayName("Should reject unknown codes")
    void shouldRejectUnknownCodes() {
        assertThatThrownBy(() -> JobStatus.fromCode("running"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("running");
    }
}
