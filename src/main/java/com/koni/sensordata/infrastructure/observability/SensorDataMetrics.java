package com.koni.sensordata.infrastructure.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Component for tracking store-specific metrics.
 * Provides counters and timers for monitoring writes, dimension creation and ingestion.
 */
@Slf4j
@Component
public class SensorDataMetrics {

    private final Counter valuesRecorded;
    private final Counter valueTypesCreated;
    private final Counter conflicts;
    private final Counter readingsConsumed;
    private final Counter dlqMessagesSent;
    private final Timer writeTime;

    public SensorDataMetrics(MeterRegistry registry) {
        this.valuesRecorded = Counter.builder("sensordata.values.recorded.total")
                .description("Total measurement values persisted")
                .register(registry);

        this.valueTypesCreated = Counter.builder("sensordata.value_types.created.total")
                .description("Total value types created, explicitly or by auto-creation on insert")
                .register(registry);

        this.conflicts = Counter.builder("sensordata.conflicts.total")
                .description("Total writes rejected because of a uniqueness or integrity conflict")
                .register(registry);

        this.readingsConsumed = Counter.builder("sensordata.readings.consumed.total")
                .description("Total sensor readings consumed from Kafka")
                .register(registry);

        this.dlqMessagesSent = Counter.builder("sensordata.dlq.sent.total")
                .description("Total sensor readings sent to the Dead Letter Queue")
                .register(registry);

        this.writeTime = Timer.builder("sensordata.write.time")
                .description("Time to persist a measurement value")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordValueRecorded() {
        valuesRecorded.increment();
    }

    public void recordValueTypeCreated() {
        valueTypesCreated.increment();
        log.debug("Value type created counter incremented");
    }

    public void recordConflict() {
        conflicts.increment();
        log.debug("Conflict counter incremented");
    }

    public void recordReadingConsumed() {
        readingsConsumed.increment();
    }

    public void recordDlqMessageSent() {
        dlqMessagesSent.increment();
        log.debug("DLQ message sent counter incremented");
    }

    /**
     * Record the time taken to persist a measurement.
     * 
     * @param operation The operation to time
     */
    public void recordWriteTime(Runnable operation) {
        writeTime.record(operation);
    }
}
