package com.platform.schedulerjob.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;

import java.util.Map;

/**
 * An HTTP or HTTPS request performed by the job.
 * The protocol is never stored: it is always derived from the scheme of {@link #url()}.
 */
@Builder(toBuilder = true)
public record WebActionSpec(
    @NotBlank
    @Pattern(regexp = "(?i)^https?://.+", message = "must start with http:// or https://")
    String url,
    
    @NotBlank
    @Pattern(regexp = "(?i)get|put|post|delete", message = "must be one of Get, Put, Post or Delete")
    String method,
    
    String body,
    
    Map<String, String> headers,
    
    @Valid
    AuthenticationSpec authentication
) {
    
    public WebActionSpec {
        // an empty body is never sent, so it is not distinguishable from no body
        if (body != null && body.isEmpty()) {
            body = null;
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
