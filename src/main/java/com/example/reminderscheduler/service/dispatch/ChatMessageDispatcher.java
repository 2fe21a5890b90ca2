package com.example.reminderscheduler.service.dispatch;

import com.example.reminderscheduler.client.ChatGatewayClient;
import com.example.reminderscheduler.client.ClientModels.SendMessageRequest;
import com.example.reminderscheduler.domain.enums.TargetKind;
import com.example.reminderscheduler.domain.trigger.ReminderPayload;
import com.example.reminderscheduler.exception.DispatchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Delivers reminders through the chat gateway.
 * <p>
 * Channel reminders mention their author on the first line, direct messages carry the
 * bare message.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatMessageDispatcher implements MessageDispatcher {

    private final ChatGatewayClient chatGatewayClient;

    @Override
    public DeliveryResult deliver(ReminderPayload payload) {
        var targetId = payload.getTargetId();
        log.info("Delivering reminder to {} {}", payload.getTargetKind().getCode(), targetId);

        try {
            var request = SendMessageRequest.builder()
                    .content(renderContent(payload))
                    .allowedMentionUserId(payload.getAuthorId())
                    .build();

            var response = payload.getTargetKind() == TargetKind.CHANNEL
                    ? chatGatewayClient.sendToChannel(targetId, request)
                    : chatGatewayClient.sendDirectMessage(targetId, request);

            if (response == null || response.getMessageId() == null) {
                var status = response != null ? response.getStatus() : "null";
                log.warn("Chat gateway accepted reminder for {} without a message id, status: {}", targetId, status);
                return DeliveryResult.failure("No message id in gateway response, status: " + status, "UNEXPECTED_RESPONSE");
            }
            return DeliveryResult.success(response.getMessageId());
        } catch (DispatchException e) {
            log.error("Chat gateway error delivering to {}: {}", targetId, e.getMessage());

            if (e.getHttpStatusCode() != null) {
                int statusCode = e.getHttpStatusCode();
                if (statusCode == 404) {
                    return DeliveryResult.failure("Target not found: " + targetId, "TARGET_NOT_FOUND");
                } else if (statusCode == 403) {
                    return DeliveryResult.failure("Not allowed to post to target: " + targetId, "TARGET_FORBIDDEN");
                }
                return DeliveryResult.httpFailure(statusCode, e.getMessage());
            }
            return DeliveryResult.failure(e);
        } catch (Exception e) {
            log.error("Unexpected error delivering reminder to {}: {}", targetId, e.getMessage(), e);
            return DeliveryResult.failure(e);
        }
    }

    static String renderContent(ReminderPayload payload) {
        if (payload.getTargetKind() == TargetKind.CHANNEL && payload.getAuthorId() != null) {
            return "<@" + payload.getAuthorId() + ">\n" + payload.getMessage();
        }
        return payload.getMessage();
    }
}
