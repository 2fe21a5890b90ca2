package com.example.reminderscheduler.domain.trigger;

import com.example.reminderscheduler.domain.enums.TriggerType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Fires exactly once at {@code runDate}.
 */
@Value
@Builder(toBuilder = true)
public class DateTrigger implements Trigger {

    Instant runDate;

    @Builder.Default
    ZoneId zone = ZoneOffset.UTC;

    @Override
    public TriggerType getType() {
        return TriggerType.DATE;
    }
}
