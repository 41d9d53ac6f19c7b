package com.platform.schedulerjob.resource;

import com.platform.schedulerjob.error.ErrorCode;
import com.platform.schedulerjob.error.ValidationException;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Identity of a scheduler job in the resource manager hierarchy:
 * {@code /subscriptions/{s}/resourceGroups/{rg}/providers/Microsoft.Scheduler/jobCollections/{c}/jobs/{j}}.
 */
public record JobResourceId(
    String subscriptionId,
    String resourceGroup,
    String jobCollection,
    String jobName
) {
    
    public static final String PROVIDER = "Microsoft.Scheduler";
    
    public static JobResourceId of(String subscriptionId, String resourceGroup, String jobCollection, String jobName) {
        return new JobResourceId(subscriptionId, resourceGroup, jobCollection, jobName);
    }
    
    /**
     * Parse a remote-assigned identifier. Segment names are matched case-insensitively
     * because the service does not always return {@code resourceGroups} in camel case.
     *
     * @throws ValidationException when the identifier is not a scheduler job path
     */
    public static JobResourceId parse(String id) {
        if (id == null || id.isBlank()) {
            throw invalid(id, "identifier is empty");
        }
        
        String path = id.startsWith("/") ? id.substring(1) : id;
        if (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        String[] segments = path.split("/");
        if (segments.length % 2 != 0) {
            throw invalid(id, "expected key/value pairs of path segments");
        }
        
        Map<String, String> components = new HashMap<>();
        for (int i = 0; i < segments.length; i += 2) {
            String key = segments[i].toLowerCase(Locale.ROOT);
            String value = segments[i + 1];
            if (key.isEmpty() || value.isEmpty()) {
                throw invalid(id, "empty path segment");
            }
            if (components.putIfAbsent(key, value) != null) {
                throw invalid(id, "duplicate segment '" + segments[i] + "'");
            }
        }
        
        String provider = components.get("providers");
        if (provider != null && !PROVIDER.equalsIgnoreCase(provider)) {
            throw invalid(id, "unexpected provider '" + provider + "'");
        }
        
        return new JobResourceId(
            require(components, "subscriptions", id),
            require(components, "resourcegroups", id),
            require(components, "jobcollections", id),
            require(components, "jobs", id));
    }
    
    public String format() {
        return String.format("/subscriptions/%s/resourceGroups/%s/providers/%s/jobCollections/%s/jobs/%s",
            subscriptionId, resourceGroup, PROVIDER, jobCollection, jobName);
    }
    
    @Override
    public String toString() {
        return format();
    }
    
    private static String require(Map<String, String> components, String key, String id) {
        String value = components.get(key);
        if (value == null) {
            throw invalid(id, "missing '" + key + "' segment");
        }
        return value;
    }
    
    private static ValidationException invalid(String id, String reason) {
        return new ValidationException(ErrorCode.INVALID_RESOURCE_ID,
            String.format("Invalid Scheduler Job id '%s': %s", id, reason));
    }
}
