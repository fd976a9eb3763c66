package com.koni.sensordata.infrastructure.tracing;

import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.aop.ObservedAspect;
import io.micrometer.tracing.Tracer;
import io.micrometer.tracing.annotation.DefaultNewSpanParser;
import io.micrometer.tracing.annotation.ImperativeMethodInvocationProcessor;
import io.micrometer.tracing.annotation.MethodInvocationProcessor;
import io.micrometer.tracing.annotation.NewSpanParser;
import io.micrometer.tracing.annotation.SpanAspect;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

/**
 * Enables the observation and tracing annotations used across the service:
 * {@code @Observed} on command/query handlers and {@code @ContinueSpan} on the
 * dimension repository adapters.
 */
@Configuration
@EnableAspectJAutoProxy
public class TracingAspectConfiguration {
    
    @Bean
    public ObservedAspect observedAspect(ObservationRegistry observationRegistry) {
        return new ObservedAspect(observationRegistry);
    }
    
    @Bean
    public SpanAspect spanAspect(MethodInvocationProcessor methodInvocationProcessor) {
        return new SpanAspect(methodInvocationProcessor);
    }
    
    @Bean
    public NewSpanParser newSpanParser() {
        return new DefaultNewSpanParser();
    }
    
    @Bean
    public MethodInvocationProcessor methodInvocationProcessor(
            NewSpanParser newSpanParser,
            Tracer tracer) {
        return new ImperativeMethodInvocationProcessor(newSpanParser, tracer);
    }
}
