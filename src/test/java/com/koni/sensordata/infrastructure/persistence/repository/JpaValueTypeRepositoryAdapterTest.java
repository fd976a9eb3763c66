package com.koni.sensordata.infrastructure.persistence.repository;

import com.koni.sensordata.domain.exception.ConflictException;
import com.koni.sensordata.domain.exception.MultipleResultsException;
import com.koni.sensordata.domain.exception.NotFoundException;
import com.koni.sensordata.domain.model.ValueType;
import com.koni.sensordata.infrastructure.persistence.entity.ValueTypeEntity;
import com.koni.sensordata.tags.UnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for JpaValueTypeRepositoryAdapter.
 * Tests lookup cardinality handling and translation of store failures.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class JpaValueTypeRepositoryAdapterTest {
    
    @Mock
    private ValueTypeJpaRepository jpaRepository;
    
    private JpaValueTypeRepositoryAdapter adapter;
    
    @BeforeEach
    void setUp() {
        adapter = new JpaValueTypeRepositoryAdapter(jpaRepository);
    }
    
    @Test
    void shouldReturnEmptyWhenNoRowMatches() {
        when(jpaRepository.findAllMatching(1L)).thenReturn(Collections.emptyList());
        
        assertThat(adapter.findById(1L)).isEmpty();
    }
    
    @Test
    void shouldMapSingleRow() {
        when(jpaRepository.findAllMatching(1L)).thenReturn(List.of(new ValueTypeEntity(1L, "temperature", "degC")));
        
        ValueType valueType = adapter.findById(1L).orElseThrow();
        
        assertThat(valueType.getName()).isEqualTo("temperature");
        assertThat(valueType.getUnit()).isEqualTo("degC");
    }
    
    @Test
    void shouldSignalMultipleResultsWhenUniquenessIsBroken() {
        when(jpaRepository.findAllMatching(1L)).thenReturn(List.of(
                new ValueTypeEntity(1L, "a", "b"),
                new ValueTypeEntity(1L, "c", "d")
        ));
        
        assertThatThrownBy(() -> adapter.findById(1L))
                .isInstanceOf(MultipleResultsException.class)
                .hasMessageContaining("found 2");
    }
    
    @Test
    void shouldTranslateIntegrityViolationToConflict() {
        when(jpaRepository.saveAndFlush(any(ValueTypeEntity.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key"));
        
        assertThatThrownBy(() -> adapter.insert(new ValueType(7L, "TYPE_7", "UNIT_7")))
                .isInstanceOf(ConflictException.class)
                .hasCauseInstanceOf(DataIntegrityViolationException.class);
    }
    
    @Test
    void shouldTranslateLockFailureToConflict() {
        when(jpaRepository.saveAndFlush(any(ValueTypeEntity.class)))
                .thenThrow(new CannotAcquireLockException("lock timeout"));
        
        assertThatThrownBy(() -> adapter.insert(new ValueType(7L, "TYPE_7", "UNIT_7")))
                .isInstanceOf(ConflictException.class);
    }
    
    @Test
    void shouldInsertNewRowWithoutMerging() {
        when(jpaRepository.saveAndFlush(any(ValueTypeEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));
        
        adapter.insert(new ValueType(7L, "TYPE_7", "UNIT_7"));
        
        ArgumentCaptor<ValueTypeEntity> captor = ArgumentCaptor.forClass(ValueTypeEntity.class);
        verify(jpaRepository).saveAndFlush(captor.capture());
        assertThat(captor.getValue().isNew()).isTrue();
        assertThat(captor.getValue().getName()).isEqualTo("TYPE_7");
    }
    
    @Test
    void shouldUpdateStoredRowInPlace() {
        ValueTypeEntity stored = new ValueTypeEntity(3L, "TYPE_3", "UNIT_3");
        when(jpaRepository.findById(3L)).thenReturn(Optional.of(stored));
        when(jpaRepository.saveAndFlush(stored)).thenReturn(stored);
        
        ValueType result = adapter.update(new ValueType(3L, "pressure", "hPa"));
        
        assertThat(stored.isNew()).isFalse();
        assertThat(stored.getName()).isEqualTo("pressure");
        assertThat(result.getUnit()).isEqualTo("hPa");
    }
    
    @Test
    void shouldTranslateStaleUpdateToConflict() {
        ValueTypeEntity stored = new ValueTypeEntity(3L, "TYPE_3", "UNIT_3");
        when(jpaRepository.findById(3L)).thenReturn(Optional.of(stored));
        when(jpaRepository.saveAndFlush(stored))
                .thenThrow(new ObjectOptimisticLockingFailureException(ValueTypeEntity.class, 3L));
        
        assertThatThrownBy(() -> adapter.update(new ValueType(3L, "pressure", "hPa")))
                .isInstanceOf(ConflictException.class);
    }
    
    @Test
    void shouldRejectUpdateOfMissingRow() {
        when(jpaRepository.findById(3L)).thenReturn(Optional.empty());
        
        assertThatThrownBy(() -> adapter.update(new ValueType(3L, "pressure", "hPa")))
                .isInstanceOf(NotFoundException.class);
        verify(jpaRepository, never()).saveAndFlush(any());
    }
    
    @Test
    void shouldRejectNullId() {
        assertThatThrownBy(() -> adapter.findById(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
