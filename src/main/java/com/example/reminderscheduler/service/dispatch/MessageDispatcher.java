package com.example.reminderscheduler.service.dispatch;

import com.example.reminderscheduler.domain.trigger.ReminderPayload;

/**
 * Outbound transport for reminder messages.
 * <p>
 * Implementations report delivery problems through the returned result; exceptions
 * escaping {@link #deliver} are treated as failed deliveries as well.
 */
public interface MessageDispatcher {

    DeliveryResult deliver(ReminderPayload payload);
}
