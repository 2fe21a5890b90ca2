package com.example.reminderscheduler.dto;

import com.example.reminderscheduler.domain.enums.TriggerType;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Trigger definition as sent by clients. Dates are free text, read by the date/time
 * parser in {@code timezone} (or the default zone).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerRequest {

    @NotNull(message = "Trigger type is required")
    private TriggerType type;

    /**
     * Zone id, e.g. Europe/Berlin
     */
    private String timezone;

    // === DATE ===

    private String runDate;

    // === CRON ===

    private String year;
    private String month;
    private String day;
    private String week;
    private String dayOfWeek;
    private String hour;
    private String minute;
    private String second;

    // === INTERVAL ===

    @Min(0)
    private Integer weeks;
    @Min(0)
    private Integer days;
    @Min(0)
    private Integer hours;
    @Min(0)
    private Integer minutes;
    @Min(0)
    private Integer seconds;

    // === CRON and INTERVAL ===

    private String startDate;
    private String endDate;

    @Min(0)
    private Integer jitterSeconds;
}
