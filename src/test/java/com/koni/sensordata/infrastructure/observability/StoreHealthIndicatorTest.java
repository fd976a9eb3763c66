package com.koni.sensordata.infrastructure.observability;

import com.koni.sensordata.tags.UnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

/**
 * Unit tests for StoreHealthIndicator.
 * Tests UP and DOWN states with a mocked data source.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class StoreHealthIndicatorTest {
    
    @Mock
    private DataSource dataSource;
    
    @Mock
    private Connection connection;
    
    @Mock
    private DatabaseMetaData metaData;
    
    @Mock
    private ResultSet presentTable;
    
    @Mock
    private ResultSet absentTable;
    
    private StoreHealthIndicator healthIndicator;
    
    @BeforeEach
    void setUp() {
        healthIndicator = new StoreHealthIndicator(dataSource);
    }
    
    @Test
    void shouldReturnUpWhenAllTablesExist() throws Exception {
        givenTables(Set.of("value_type", "device_type", "value"));
        when(metaData.getDatabaseProductVersion()).thenReturn("16.2");
        
        Health health = healthIndicator.health();
        
        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("database", "PostgreSQL");
        assertThat(health.getDetails()).containsEntry("version", "16.2");
    }
    
    @Test
    void shouldFindUpperCaseTables() throws Exception {
        givenTables(Set.of("VALUE_TYPE", "DEVICE_TYPE", "VALUE"));
        when(metaData.getDatabaseProductVersion()).thenReturn("2.2");
        
        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.UP);
    }
    
    @Test
    void shouldReturnDownWhenTableIsMissing() throws Exception {
        givenTables(Set.of("value_type", "device_type"));
        
        Health health = healthIndicator.health();
        
        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("missingTables", List.of("value"));
    }
    
    @Test
    void shouldReturnDownWhenConnectionFails() throws Exception {
        when(dataSource.getConnection()).thenThrow(new SQLException("Connection refused"));
        
        Health health = healthIndicator.health();
        
        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("error", "SQLException");
        assertThat(health.getDetails()).containsEntry("message", "Connection refused");
    }
    
    private void givenTables(Set<String> existing) throws SQLException {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.getMetaData()).thenReturn(metaData);
        when(metaData.getDatabaseProductName()).thenReturn("PostgreSQL");
        lenient().when(presentTable.next()).thenReturn(true);
        lenient().when(absentTable.next()).thenReturn(false);
        when(metaData.getTables(isNull(), isNull(), anyString(), any())).thenAnswer(invocation ->
                existing.contains(invocation.<String>getArgument(2)) ? presentTable : absentTable);
    }
}
