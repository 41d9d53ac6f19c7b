package com.platform.schedulerjob.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * OpenTelemetry tracing configuration.
 * Calls to the scheduler service are traced as client spans and carry W3C trace context.
 */
@Slf4j
@Configuration
public class TracingConfig {
    
    static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    
    @Value("${spring.application.name:scheduler-job-control-plane}")
    private String serviceName;
    
    @Value("${scheduler.environment:development}")
    private String environment;
    
    @Value("${otel.exporter.otlp.endpoint:http://localhost:4317}")
    private String otlpEndpoint;
    
    @Value("${otel.traces.enabled:true}")
    private boolean tracingEnabled;
    
    @Bean
    public OpenTelemetry openTelemetry() {
        if (!tracingEnabled) {
            log.info("OpenTelemetry tracing is disabled");
            return OpenTelemetry.noop();
        }
        
        Resource resource = Resource.getDefault()
            .merge(Resource.create(Attributes.builder()
                .put(SERVICE_NAME, serviceName)
                .put("environment", environment)
                .build()));
        
        OtlpGrpcSpanExporter spanExporter = OtlpGrpcSpanExporter.builder()
            .setEndpoint(otlpEndpoint)
            .setTimeout(10, TimeUnit.SECONDS)
            .build();
        
        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
            .addSpanProcessor(BatchSpanProcessor.builder(spanExporter).build())
            .setResource(resource)
            .build();
        
        OpenTelemetrySdk openTelemetry = OpenTelemetrySdk.builder()
            .setTracerProvider(tracerProvider)
            .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
            .build();
        
        Runtime.getRuntime().addShutdownHook(new Thread(tracerProvider::close));
        
        log.info("OpenTelemetry tracing configured with endpoint: {}", otlpEndpoint);
        return openTelemetry;
    }
    
    @Bean
    public Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer(serviceName, "1.0.0");
    }
}
