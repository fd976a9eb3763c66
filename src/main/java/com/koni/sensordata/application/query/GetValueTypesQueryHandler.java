package com.koni.sensordata.application.query;

import com.koni.sensordata.domain.repository.ValueTypeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Lists every configured ValueType ordered by id.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GetValueTypesQueryHandler {
    
    private final ValueTypeRepository repository;
    
    @Transactional(readOnly = true)
    public List<ValueTypeResponse> handle() {
        List<ValueTypeResponse> valueTypes = repository.findAll().stream()
                .map(ValueTypeResponse::from)
                .collect(Collectors.toList());
        
        log.info("Retrieved {} value types", valueTypes.size());
        
        return valueTypes;
    }
}
