package com.example.reminderscheduler.controller;

import com.example.reminderscheduler.domain.trigger.ReminderPayload;
import com.example.reminderscheduler.dto.ApiResponse;
import com.example.reminderscheduler.dto.CreateReminderRequest;
import com.example.reminderscheduler.dto.EditReminderRequest;
import com.example.reminderscheduler.dto.JobSnapshot;
import com.example.reminderscheduler.dto.PayloadRequest;
import com.example.reminderscheduler.dto.RescheduleRequest;
import com.example.reminderscheduler.dto.TriggerRequest;
import com.example.reminderscheduler.service.ReminderLifecycleService;
import com.example.reminderscheduler.service.parse.DateTimeParser;
import com.example.reminderscheduler.service.trigger.TriggerFactory;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API controller for reminder operations.
 * <p>
 * Provides endpoints for:
 * - Scheduling reminders
 * - Listing reminders, optionally for a set of targets
 * - Pausing, resuming and rescheduling
 * - Replacing triggers and payloads, editing, removing
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/reminders")
@Tag(name = "Reminders", description = "APIs for scheduling and managing reminders")
public class ReminderController {

    private final ReminderLifecycleService lifecycleService;
    private final TriggerFactory triggerFactory;
    private final DateTimeParser dateTimeParser;

    @PostMapping
    @Operation(summary = "Schedule a reminder", description = "Schedule a one-shot, cron or interval reminder")
    public ResponseEntity<ApiResponse<JobSnapshot>> createReminder(@Valid @RequestBody CreateReminderRequest request) {
        log.info("API: Schedule {} reminder for {} {}", request.getTrigger().getType(), request.getTargetKind(), request.getTargetId());

        var trigger = triggerFactory.fromRequest(request.getTrigger());
        var payload = ReminderPayload.builder()
                .targetKind(request.getTargetKind())
                .targetId(request.getTargetId())
                .message(request.getMessage())
                .authorId(request.getAuthorId())
                .build();

        var snapshot = lifecycleService.add(request.getId(), trigger, payload, request.getMisfireGraceSeconds());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(snapshot, "Reminder scheduled"));
    }

    @GetMapping
    @Operation(summary = "List reminders", description = "List reminders, optionally only those delivered to the given targets")
    public ResponseEntity<ApiResponse<Page<JobSnapshot>>> listReminders(
            @Parameter(description = "Target ids to filter by, e.g. the channels of one server")
            @RequestParam(required = false) List<String> targetIds,
            @Parameter(description = "Page number") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {

        var pageable = PageRequest.of(page, size, Sort.by(Sort.Direction.ASC, "id"));
        var reminders = targetIds == null || targetIds.isEmpty()
                ? lifecycleService.list(pageable)
                : lifecycleService.listByTargets(targetIds, pageable);
        return ResponseEntity.ok(ApiResponse.success(reminders));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get reminder by ID")
    public ResponseEntity<ApiResponse<JobSnapshot>> getReminder(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(lifecycleService.get(id)));
    }

    @PostMapping("/{id}/pause")
    @Operation(summary = "Pause a reminder", description = "Stop a reminder from firing until it is resumed")
    public ResponseEntity<ApiResponse<JobSnapshot>> pauseReminder(@PathVariable String id) {
        log.info("API: Pause reminder {}", id);
        return ResponseEntity.ok(ApiResponse.success(lifecycleService.pause(id), "Reminder paused"));
    }

    @PostMapping("/{id}/resume")
    @Operation(summary = "Resume a reminder")
    public ResponseEntity<ApiResponse<JobSnapshot>> resumeReminder(@PathVariable String id) {
        log.info("API: Resume reminder {}", id);
        return ResponseEntity.ok(ApiResponse.success(lifecycleService.resume(id), "Reminder resumed"));
    }

    @PutMapping("/{id}/run-date")
    @Operation(summary = "Reschedule a one-shot reminder")
    public ResponseEntity<ApiResponse<JobSnapshot>> rescheduleReminder(
            @PathVariable String id, @Valid @RequestBody RescheduleRequest request) {
        log.info("API: Reschedule reminder {} to {}", id, request.getRunDate());

        var timezone = request.getTimezone() != null
                ? request.getTimezone()
                : lifecycleService.get(id).getTimezone();
        var zone = triggerFactory.resolveZone(timezone);
        var runDate = dateTimeParser.parse(request.getRunDate(), zone);
        return ResponseEntity.ok(ApiResponse.success(lifecycleService.reschedule(id, runDate), "Reminder rescheduled"));
    }

    @PutMapping("/{id}/trigger")
    @Operation(summary = "Replace a reminder's trigger")
    public ResponseEntity<ApiResponse<JobSnapshot>> replaceTrigger(
            @PathVariable String id, @Valid @RequestBody TriggerRequest request) {
        log.info("API: Replace trigger of reminder {} with {}", id, request.getType());

        var trigger = triggerFactory.fromRequest(request);
        return ResponseEntity.ok(ApiResponse.success(lifecycleService.replaceTrigger(id, trigger), "Trigger replaced"));
    }

    @PutMapping("/{id}/payload")
    @Operation(summary = "Replace a reminder's message and target")
    public ResponseEntity<ApiResponse<JobSnapshot>> replacePayload(
            @PathVariable String id, @Valid @RequestBody PayloadRequest request) {
        log.info("API: Replace payload of reminder {}", id);

        var payload = ReminderPayload.builder()
                .targetKind(request.getTargetKind())
                .targetId(request.getTargetId())
                .message(request.getMessage())
                .authorId(request.getAuthorId())
                .build();
        return ResponseEntity.ok(ApiResponse.success(lifecycleService.modifyPayload(id, payload), "Payload replaced"));
    }

    @PatchMapping("/{id}")
    @Operation(summary = "Edit a reminder", description = "Change the message and/or run date shown on a reminder")
    public ResponseEntity<ApiResponse<JobSnapshot>> editReminder(
            @PathVariable String id, @Valid @RequestBody EditReminderRequest request) {
        log.info("API: Edit reminder {}", id);
        return ResponseEntity.ok(ApiResponse.success(lifecycleService.edit(id, request), "Reminder updated"));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Remove a reminder")
    public ResponseEntity<ApiResponse<JobSnapshot>> removeReminder(@PathVariable String id) {
        log.info("API: Remove reminder {}", id);
        return ResponseEntity.ok(ApiResponse.success(lifecycleService.remove(id), "Reminder removed"));
    }
}
