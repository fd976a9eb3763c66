package com.koni.sensordata.application.query;

import com.koni.sensordata.domain.model.Value;
import com.koni.sensordata.domain.repository.ValueRepository;
import com.koni.sensordata.tags.UnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for GetValuesQueryHandler.
 * Tests filter pass-through, empty results and DTO mapping.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class GetValuesQueryHandlerTest {
    
    @Mock
    private ValueRepository repository;
    
    private GetValuesQueryHandler handler;
    
    @BeforeEach
    void setUp() {
        handler = new GetValuesQueryHandler(repository);
    }
    
    @Test
    void shouldPassFiltersAndMapValues() {
        // Given
        when(repository.findValues(1L, 10L, 20L)).thenReturn(Arrays.asList(
                new Value(5L, 10L, 1L, 1.5),
                new Value(6L, 20L, 1L, 2.5)
        ));
        
        // When
        List<ValueResponse> result = handler.handle(new GetValuesQuery(1L, 10L, 20L));
        
        // Then
        verify(repository).findValues(1L, 10L, 20L);
        assertThat(result).extracting(ValueResponse::getTime).containsExactly(10L, 20L);
        assertThat(result).extracting(ValueResponse::getValue).containsExactly(1.5, 2.5);
        assertThat(result).extracting(ValueResponse::getValueTypeId).containsOnly(1L);
        assertThat(result.get(0).getId()).isEqualTo(5L);
    }
    
    @Test
    void shouldQueryWithoutFilters() {
        when(repository.findValues(null, null, null)).thenReturn(Collections.emptyList());
        
        List<ValueResponse> result = handler.handle(GetValuesQuery.all());
        
        verify(repository).findValues(null, null, null);
        assertThat(result).isEmpty();
    }
}
