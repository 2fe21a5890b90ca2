package com.example.reminderscheduler.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request/Response DTOs for the chat gateway client
 */
public class ClientModels {
    private ClientModels() {
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SendMessageRequest {
        private String content;

        /**
         * Users the gateway may notify through mentions contained in {@code content}
         */
        private String allowedMentionUserId;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SendMessageResponse {
        private String messageId;
        private String status;
        private String message;
    }
}
