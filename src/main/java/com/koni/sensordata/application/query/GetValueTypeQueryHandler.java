package com.koni.sensordata.application.query;

import com.koni.sensordata.domain.exception.NotFoundException;
import com.koni.sensordata.domain.repository.ValueTypeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Query handler for a single ValueType.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GetValueTypeQueryHandler {
    
    private final ValueTypeRepository repository;
    
    /**
     * @param query the query carrying the ValueType id
     * @return the ValueType
     * @throws NotFoundException if no ValueType has the id
     * @throws com.koni.sensordata.domain.exception.MultipleResultsException if several rows match
     */
    @Transactional(readOnly = true)
    public ValueTypeResponse handle(GetValueTypeQuery query) {
        log.debug("Handling GetValueTypeQuery: id={}", query.getId());
        
        return repository.findById(query.getId())
                .map(ValueTypeResponse::from)
                .orElseThrow(() -> new NotFoundException("ValueType with id " + query.getId() + " not found"));
    }
}
