package com.example.reminderscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Kinds of trigger a reminder can be scheduled with.
 */
@Getter
@RequiredArgsConstructor
public enum TriggerType {

    DATE("date", "One-shot", false),
    CRON("cron", "Cron", true),
    INTERVAL("interval", "Interval", true);

    private final String code;
    private final String displayName;
    private final boolean recurring;

    public static TriggerType fromCode(String code) {
        for (var type : values()) {
            if (type.getCode().equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown trigger type code: " + code);
    }
}
