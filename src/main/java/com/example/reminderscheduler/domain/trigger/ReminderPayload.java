package com.example.reminderscheduler.domain.trigger;

import com.example.reminderscheduler.domain.enums.TargetKind;
import lombok.Builder;
import lombok.Value;

/**
 * What a reminder delivers and to whom.
 */
@Value
@Builder(toBuilder = true)
public class ReminderPayload {

    TargetKind targetKind;
    String targetId;
    String message;

    /**
     * User who created the reminder, mentioned on channel deliveries
     */
    String authorId;
}
