package com.example.reminderscheduler.dto;

import com.example.reminderscheduler.domain.enums.TargetKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for scheduling a new reminder
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateReminderRequest {

    /**
     * Optional caller-chosen id; generated when absent
     */
    @Size(max = 64)
    @Pattern(regexp = "[A-Za-z0-9_.-]+", message = "Id may only contain letters, digits, '_', '.' and '-'")
    private String id;

    @Valid
    @NotNull(message = "Trigger is required")
    private TriggerRequest trigger;

    @NotNull(message = "Target kind is required")
    private TargetKind targetKind;

    @NotBlank(message = "Target ID is required")
    private String targetId;

    @NotBlank(message = "Message is required")
    @Size(max = 4000)
    private String message;

    private String authorId;

    /**
     * Override default misfire grace
     */
    @Min(0)
    private Integer misfireGraceSeconds;
}
