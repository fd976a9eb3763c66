package com.koni.sensordata.infrastructure.observability;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Health indicator for the measurement store.
 * 
 * Reports UP when a connection can be obtained and the value_type, device_type
 * and value tables are all present; DOWN otherwise.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StoreHealthIndicator implements HealthIndicator {
    
    static final List<String> REQUIRED_TABLES = List.of("value_type", "device_type", "value");
    
    private final DataSource dataSource;
    
    @Override
    public Health health() {
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            
            List<String> missing = new ArrayList<>();
            for (String table : REQUIRED_TABLES) {
                if (!tableExists(metaData, table)) {
                    missing.add(table);
                }
            }
            
            if (!missing.isEmpty()) {
                log.error("Store health check failed: missing tables {}", missing);
                return Health.down()
                        .withDetail("database", metaData.getDatabaseProductName())
                        .withDetail("missingTables", missing)
                        .build();
            }
            
            log.debug("Store health check passed: product={}", metaData.getDatabaseProductName());
            return Health.up()
                    .withDetail("database", metaData.getDatabaseProductName())
                    .withDetail("version", metaData.getDatabaseProductVersion())
                    .build();
            
        } catch (Exception e) {
            log.error("Store health check failed", e);
            
            return Health.down()
                    .withDetail("error", e.getClass().getSimpleName())
                    .withDetail("message", e.getMessage())
                    .build();
        }
    }
    
    // Unquoted identifiers fold to upper case on some databases, so both spellings are tried.
    private boolean tableExists(DatabaseMetaData metaData, String table) throws SQLException {
        for (String candidate : new String[] {table, table.toUpperCase()}) {
            try (ResultSet tables = metaData.getTables(null, null, candidate, new String[] {"TABLE"})) {
                if (tables.next()) {
                    return true;
                }
            }
        }
        return false;
    }
}
