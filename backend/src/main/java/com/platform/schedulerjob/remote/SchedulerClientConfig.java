package com.platform.schedulerjob.remote;

import com.platform.schedulerjob.resource.JobResourceId;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Configuration properties for the scheduler management API and its cloud environment.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scheduler.azure")
public class SchedulerClientConfig {
    
    /**
     * Resource manager base URL.
     */
    private String resourceManagerEndpoint = "https://management.azure.com";
    
    /**
     * Service management endpoint of the environment. Default OAuth audience for
     * Active Directory authenticated web actions.
     */
    private String serviceManagementEndpoint = "https://management.core.windows.net/";
    
    /**
     * Subscription new jobs are created in.
     */
    private String subscriptionId;
    
    private String apiVersion = "2016-03-01";
    
    /**
     * Bearer token sent with every request. Token acquisition happens outside this service.
     */
    private String accessToken;
    
    /**
     * Connection timeout in milliseconds.
     */
    private int connectionTimeoutMs = 5000;
    
    /**
     * Read timeout in milliseconds.
     */
    private int readTimeoutMs = 30000;
    
    /**
     * Management API URL of a job.
     */
    public URI jobUri(JobResourceId id) {
        String base = resourceManagerEndpoint.endsWith("/")
            ? resourceManagerEndpoint.substring(0, resourceManagerEndpoint.length() - 1)
            : resourceManagerEndpoint;
        return URI.create(String.format(
            "%s/subscriptions/%s/resourceGroups/%s/providers/%s/jobCollections/%s/jobs/%s?api-version=%s",
            base,
            encode(id.subscriptionId()),
            encode(id.resourceGroup()),
            JobResourceId.PROVIDER,
            encode(id.jobCollection()),
            encode(id.jobName()),
            encode(apiVersion)));
    }
    
    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
