package com.example.reminderscheduler.service.dispatch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DeliveryResult Tests")
class DeliveryResultTest {

    @Test
    @DisplayName("Should create success result")
    void shouldCreateSuccessResult() {
        var result = DeliveryResult.success("m-1");
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMessageId()).isEqualTo("m-1");
        assertThat(result.describeFailure()).isNull();
    }

    @Test
    @DisplayName("Should describe failure with type and message")
    void shouldDescribeFailure() {
        var result = DeliveryResult.failure("Target not found: 42", "TARGET_NOT_FOUND");
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.describeFailure()).isEqualTo("TARGET_NOT_FOUND: Target not found: 42");
    }

    @Test
    @DisplayName("Should create failure from exception")
    void shouldCreateFailureFromException() {
        var result = DeliveryResult.failure(new TimeoutException("took too long"));
        assertThat(result.getErrorType()).isEqualTo("TimeoutException");
        assertThat(result.getErrorMessage()).isEqualTo("took too long");
    }

    @Test
    @DisplayName("Should create HTTP failure")
    void shouldCreateHttpFailure() {
        var result = DeliveryResult.httpFailure(503, "Service Unavailable");
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getHttpStatusCode()).isEqualTo(503);
        assertThat(result.getErrorType()).isEqualTo("HTTP_503");
    }

    @Test
    @DisplayName("Should fill in missing failure details")
    void shouldFillMissingDetails() {
        var result = DeliveryResult.builder().success(false).build();
        assertThat(result.describeFailure()).isEqualTo("UNKNOWN: no details");
    }
}
