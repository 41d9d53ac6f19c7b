package com.platform.schedulerjob.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.schedulerjob.error.ErrorCode;
import com.platform.schedulerjob.error.RemoteServiceException;
import com.platform.schedulerjob.observability.MetricsRegistry;
import com.platform.schedulerjob.remote.SchedulerJobModels.JobDefinition;
import com.platform.schedulerjob.resource.JobResourceId;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapSetter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

/**
 * Client for the scheduler management REST API.
 * One blocking round trip per call, authenticated with a bearer token and traced as a client span.
 */
@Slf4j
@Component
public class SchedulerJobsClient implements SchedulerJobsApi {
    
    private final SchedulerClientConfig config;
    private final ObjectMapper objectMapper;
    private final MetricsRegistry metricsRegistry;
    private final Tracer tracer;
    private final OpenTelemetry openTelemetry;
    private final HttpClient httpClient;
    
    private static final TextMapSetter<HttpRequest.Builder> SETTER = (carrier, key, value) -> {
        if (carrier != null) {
            carrier.header(key, value);
        }
    };
    
    public SchedulerJobsClient(
            SchedulerClientConfig config,
            ObjectMapper objectMapper,
            MetricsRegistry metricsRegistry,
            Tracer tracer,
            OpenTelemetry openTelemetry) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.metricsRegistry = metricsRegistry;
        this.tracer = tracer;
        this.openTelemetry = openTelemetry;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(config.getConnectionTimeoutMs()))
            .build();
    }
    
    @Override
    public JobDefinition createOrUpdate(JobResourceId id, JobDefinition definition) {
        String json;
        try {
            json = objectMapper.writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new RemoteServiceException(ErrorCode.SERIALIZATION_ERROR, "create/update", id.jobName(),
                "Failed to serialize Scheduler Job " + id.jobName() + ": " + e.getOriginalMessage(), e);
        }
        
        HttpRequest.Builder request = requestBuilder(id)
            .header("Content-Type", "application/json")
            .PUT(HttpRequest.BodyPublishers.ofString(json));
        
        HttpResponse<String> response = send("create/update", id, request);
        if (response.statusCode() != 200 && response.statusCode() != 201) {
            throw RemoteServiceException.rejected("create/update", id.jobName(), response.statusCode(), response.body());
        }
        
        log.info("Created/updated Scheduler Job {} in collection {}", id.jobName(), id.jobCollection());
        return parse("create/update", id, response.body());
    }
    
    @Override
    public Optional<JobDefinition> get(JobResourceId id) {
        HttpRequest.Builder request = requestBuilder(id).GET();
        
        HttpResponse<String> response = send("read", id, request);
        if (response.statusCode() == 404) {
            log.debug("Scheduler Job {} not found", id.jobName());
            return Optional.empty();
        }
        if (response.statusCode() != 200) {
            throw RemoteServiceException.rejected("read", id.jobName(), response.statusCode(), response.body());
        }
        return Optional.of(parse("read", id, response.body()));
    }
    
    @Override
    public boolean delete(JobResourceId id) {
        HttpRequest.Builder request = requestBuilder(id).DELETE();
        
        HttpResponse<String> response = send("delete", id, request);
        return switch (response.statusCode()) {
            case 200, 204 -> {
                log.info("Deleted Scheduler Job {}", id.jobName());
                yield true;
            }
            case 404 -> {
                log.debug("Scheduler Job {} already gone", id.jobName());
                yield false;
            }
            default -> throw RemoteServiceException.rejected("delete", id.jobName(), response.statusCode(), response.body());
        };
    }
    
    private HttpRequest.Builder requestBuilder(JobResourceId id) {
        URI uri = config.jobUri(id);
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(uri)
            .header("Accept", "application/json")
            .timeout(Duration.ofMillis(config.getReadTimeoutMs()));
        if (config.getAccessToken() != null && !config.getAccessToken().isBlank()) {
            builder.header("Authorization", "Bearer " + config.getAccessToken());
        }
        return builder;
    }
    
    private HttpResponse<String> send(String operation, JobResourceId id, HttpRequest.Builder builder) {
        Span span = tracer.spanBuilder("scheduler.job " + operation)
            .setSpanKind(SpanKind.CLIENT)
            .setAttribute("job.name", id.jobName())
            .setAttribute("job.collection", id.jobCollection())
            .setAttribute("job.resource_group", id.resourceGroup())
            .startSpan();
        
        long start = System.currentTimeMillis();
        try (Scope scope = span.makeCurrent()) {
            openTelemetry.getPropagators().getTextMapPropagator().inject(Context.current(), builder, SETTER);
            HttpRequest request = builder.build();
            span.setAttribute("http.method", request.method());
            
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            metricsRegistry.recordRemoteCall(operation, response.statusCode(), System.currentTimeMillis() - start);
            span.setAttribute("http.status_code", response.statusCode());
            if (response.statusCode() >= 500) {
                span.setStatus(StatusCode.ERROR, "Server error: " + response.statusCode());
            }
            log.debug("{} {} -> {}", request.method(), request.uri().getPath(), response.statusCode());
            return response;
        } catch (IOException e) {
            metricsRegistry.recordRemoteCall(operation, -1, System.currentTimeMillis() - start);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw RemoteServiceException.unreachable(operation, id.jobName(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            span.setStatus(StatusCode.ERROR, "interrupted");
            throw RemoteServiceException.unreachable(operation, id.jobName(), e);
        } finally {
            span.end();
        }
    }
    
    private JobDefinition parse(String operation, JobResourceId id, String body) {
        try {
            JobDefinition definition = objectMapper.readValue(body, JobDefinition.class);
            if (definition == null) {
                throw new IOException("empty response body");
            }
            return definition;
        } catch (IOException e) {
            throw RemoteServiceException.unreadable(operation, id.jobName(), e);
        }
    }
}
