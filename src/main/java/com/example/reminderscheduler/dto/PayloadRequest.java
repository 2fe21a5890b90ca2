package com.example.reminderscheduler.dto;

import com.example.reminderscheduler.domain.enums.TargetKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for replacing what a reminder delivers
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayloadRequest {

    @NotNull(message = "Target kind is required")
    private TargetKind targetKind;

    @NotBlank(message = "Target ID is required")
    private String targetId;

    @NotBlank(message = "Message is required")
    @Size(max = 4000)
    private String message;

    /**
     * Keeps the current author when absent
     */
    private String authorId;
}
