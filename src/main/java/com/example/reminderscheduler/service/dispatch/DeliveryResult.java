package com.example.reminderscheduler.service.dispatch;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of delivering one reminder message.
 */
@Value
@Builder
public class DeliveryResult {

    boolean success;

    /**
     * Id assigned by the chat gateway to the delivered message
     */
    String messageId;

    String errorMessage;

    /**
     * Error type/classification for analysis
     */
    String errorType;

    Integer httpStatusCode;

    public static DeliveryResult success(String messageId) {
        return DeliveryResult.builder()
                .success(true)
                .messageId(messageId)
                .build();
    }

    public static DeliveryResult failure(String errorMessage, String errorType) {
        return DeliveryResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .errorType(errorType)
                .build();
    }

    public static DeliveryResult failure(Exception e) {
        return DeliveryResult.builder()
                .success(false)
                .errorMessage(e.getMessage())
                .errorType(e.getClass().getSimpleName())
                .build();
    }

    public static DeliveryResult httpFailure(int statusCode, String errorMessage) {
        return DeliveryResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .errorType("HTTP_" + statusCode)
                .httpStatusCode(statusCode)
                .build();
    }

    /**
     * One-line description used for alerts and the job's last error
     */
    public String describeFailure() {
        if (success) {
            return null;
        }
        var type = errorType != null ? errorType : "UNKNOWN";
        var message = errorMessage != null ? errorMessage : "no details";
        return type + ": " + message;
    }
}
