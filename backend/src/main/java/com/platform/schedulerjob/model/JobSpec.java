package com.platform.schedulerjob.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;

import java.time.OffsetDateTime;

/**
 * Declarative description of a scheduler job.
 * Rebuilt from the configuration document on every reconciliation pass.
 *
 * @param action      the web action; {@code null} when the document declares none
 * @param errorAction optional action invoked when the main action fails
 * @param retry       {@code null} means "no retry"
 * @param recurrence  {@code null} means the job runs once
 * @param startTime   {@code null} means "now" at the time of the write
 * @param state       {@code enabled} or {@code disabled}; the remote side may also report
 *                    {@code Faulted} or {@code Completed}
 */
@Builder(toBuilder = true)
public record JobSpec(
    @NotBlank
    @Pattern(regexp = "^[a-zA-Z][-_a-zA-Z0-9].*$",
        message = "must start with a letter and contain only letters, numbers, hyphens and underscores")
    String name,
    
    @NotBlank
    String resourceGroupName,
    
    @NotBlank
    String jobCollectionName,
    
    @Valid
    WebActionSpec action,
    
    @Valid
    WebActionSpec errorAction,
    
    @Valid
    RetrySpec retry,
    
    @Valid
    RecurrenceSpec recurrence,
    
    OffsetDateTime startTime,
    
    String state
) {
    
    public boolean hasAction() {
        return action != null;
    }
}
