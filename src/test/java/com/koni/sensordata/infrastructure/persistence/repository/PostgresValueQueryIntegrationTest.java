package com.koni.sensordata.infrastructure.persistence.repository;

import com.koni.sensordata.domain.model.Value;
import com.koni.sensordata.domain.model.ValueType;
import com.koni.sensordata.domain.repository.ValueRepository;
import com.koni.sensordata.domain.repository.ValueTypeRepository;
import com.koni.sensordata.tags.IntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for the value query on PostgreSQL.
 * Uses TestContainers; skipped when Docker is unavailable.
 */
@IntegrationTest
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({JpaValueTypeRepositoryAdapter.class, JpaValueRepositoryAdapter.class})
@Testcontainers(disabledWithoutDocker = true)
class PostgresValueQueryIntegrationTest {
    
    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(
            DockerImageName.parse("postgres:16")
    )
            .withDatabaseName("sensordata_test")
            .withUsername("test")
            .withPassword("test");
    
    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
    }
    
    @Autowired
    private ValueTypeRepository valueTypeRepository;
    
    @Autowired
    private ValueRepository valueRepository;
    
    @BeforeEach
    void setUp() {
        valueTypeRepository.insert(new ValueType(1L, "TYPE_1", "UNIT_1"));
        valueTypeRepository.insert(new ValueType(2L, "TYPE_2", "UNIT_2"));
        valueRepository.save(new Value(100L, 1L, 97.0));
        valueRepository.save(new Value(200L, 1L, 98.5));
        valueRepository.save(new Value(150L, 2L, 0.4));
    }
    
    @Test
    void shouldReturnEveryValueInTimeOrderWithoutFilters() {
        assertThat(valueRepository.findValues(null, null, null))
                .extracting(Value::getTime)
                .containsExactly(100L, 150L, 200L);
    }
    
    @Test
    void shouldFilterByType() {
        assertThat(valueRepository.findValues(1L, null, null))
                .extracting(Value::getValue)
                .containsExactly(97.0, 98.5);
    }
    
    @Test
    void shouldFilterByInclusiveWindow() {
        assertThat(valueRepository.findValues(null, 150L, 200L))
                .extracting(Value::getTime)
                .containsExactly(150L, 200L);
        assertThat(valueRepository.findValues(2L, 151L, null)).isEmpty();
    }
}
