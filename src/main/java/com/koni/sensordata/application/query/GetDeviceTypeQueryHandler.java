package com.koni.sensordata.application.query;

import com.koni.sensordata.domain.exception.NotFoundException;
import com.koni.sensordata.domain.repository.DeviceTypeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Query handler for a single DeviceType.
 * Shares the not-found / multiple-results contract of {@link GetValueTypeQueryHandler}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GetDeviceTypeQueryHandler {
    
    private final DeviceTypeRepository repository;
    
    @Transactional(readOnly = true)
    public DeviceTypeResponse handle(GetDeviceTypeQuery query) {
        log.debug("Handling GetDeviceTypeQuery: id={}", query.getId());
        
        return repository.findById(query.getId())
                .map(DeviceTypeResponse::from)
                .orElseThrow(() -> new NotFoundException("DeviceType with id " + query.getId() + " not found"));
    }
}
