package com.koni.sensordata.application.query;

import com.koni.sensordata.domain.repository.ValueRepository;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Query handler for retrieving stored values.
 * 
 * Results are ordered by ascending time; values sharing a timestamp come back in
 * insertion order. An empty result is a valid outcome, not an error.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GetValuesQueryHandler {
    
    private final ValueRepository repository;
    
    @Transactional(readOnly = true)
    @Observed(name = "query.handler", contextualName = "get-values")
    public List<ValueResponse> handle(GetValuesQuery query) {
        log.debug("Handling GetValuesQuery: valueTypeId={}, start={}, end={}",
                query.getValueTypeId(), query.getStart(), query.getEnd());
        
        List<ValueResponse> values = repository.findValues(query.getValueTypeId(), query.getStart(), query.getEnd())
                .stream()
                .map(ValueResponse::from)
                .collect(Collectors.toList());
        
        log.info("Retrieved {} values", values.size());
        
        return values;
    }
}
