package com.example.reminderscheduler.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for editing a reminder's text and/or run date.
 * Every supplied field is validated and applied, absent fields are left alone.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EditReminderRequest {

    @Size(min = 1, max = 4000)
    private String message;

    /**
     * New run date for one-shot reminders
     */
    private String runDate;

    private String timezone;
}
