package com.koni.sensordata.infrastructure.web.controller;

import com.koni.sensordata.application.command.UpsertValueTypeCommand;
import com.koni.sensordata.application.command.UpsertValueTypeCommandHandler;
import com.koni.sensordata.application.query.GetValueTypeQuery;
import com.koni.sensordata.application.query.GetValueTypeQueryHandler;
import com.koni.sensordata.application.query.GetValueTypesQueryHandler;
import com.koni.sensordata.application.query.ValueTypeResponse;
import com.koni.sensordata.infrastructure.web.dto.ValueTypeRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for ValueType dimension records.
 * 
 * Endpoints:
 * - GET /api/v1/types: list all value types
 * - GET /api/v1/types/{id}: fetch one value type (404 if unknown)
 * - PUT /api/v1/types/{id}: create or partially update a value type
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ValueTypeController {
    
    private final GetValueTypesQueryHandler listHandler;
    private final GetValueTypeQueryHandler getHandler;
    private final UpsertValueTypeCommandHandler upsertHandler;
    
    @GetMapping("/v1/types")
    public ResponseEntity<List<ValueTypeResponse>> getValueTypes() {
        log.info("Received request to get all value types");
        return ResponseEntity.ok(listHandler.handle());
    }
    
    @GetMapping("/v1/types/{id}")
    public ResponseEntity<ValueTypeResponse> getValueType(@PathVariable Long id) {
        log.info("Received request to get value type {}", id);
        return ResponseEntity.ok(getHandler.handle(new GetValueTypeQuery(id)));
    }
    
    /**
     * Creates or updates a value type.
     * 
     * Example request:
     * PUT /api/v1/types/3
     * {
     *   "name": "temperature",
     *   "unit": "degC"
     * }
     * 
     * @param id the value type identifier
     * @param request optional name and unit; missing fields are left untouched
     * @return 200 OK with the persisted value type
     */
    @PutMapping("/v1/types/{id}")
    public ResponseEntity<ValueTypeResponse> putValueType(@PathVariable Long id,
                                                          @RequestBody(required = false) ValueTypeRequest request) {
        log.info("Received value type upsert: id={}", id);
        
        ValueTypeRequest body = request != null ? request : new ValueTypeRequest();
        UpsertValueTypeCommand command = new UpsertValueTypeCommand(id, body.getName(), body.getUnit());
        
        return ResponseEntity.ok(ValueTypeResponse.from(upsertHandler.handle(command)));
    }
}
