package com.example.reminderscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Where a reminder message is delivered.
 */
@Getter
@RequiredArgsConstructor
public enum TargetKind {

    /**
     * A server channel; the delivered text mentions the author.
     */
    CHANNEL("channel", "Channel"),

    /**
     * A direct message to a single user.
     */
    DIRECT_MESSAGE("dm", "Direct message");

    private final String code;
    private final String displayName;

    public static TargetKind fromCode(String code) {
        for (var kind : values()) {
            if (kind.getCode().equals(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown target kind code: " + code);
    }
}
