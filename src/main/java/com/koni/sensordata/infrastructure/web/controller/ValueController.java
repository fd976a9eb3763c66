package com.koni.sensordata.infrastructure.web.controller;

import com.koni.sensordata.application.command.RecordValueCommand;
import com.koni.sensordata.application.command.RecordValueCommandHandler;
import com.koni.sensordata.application.query.GetValuesQuery;
import com.koni.sensordata.application.query.GetValuesQueryHandler;
import com.koni.sensordata.application.query.ValueResponse;
import com.koni.sensordata.infrastructure.web.dto.ValueRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for measurement values.
 * 
 * Endpoints:
 * - POST /api/v1/values: record one measurement
 * - GET /api/v1/values?typeId=&start=&end=: query measurements ordered by time
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ValueController {
    
    private final RecordValueCommandHandler commandHandler;
    private final GetValuesQueryHandler queryHandler;
    
    /**
     * Records a measurement. An unknown valueTypeId creates the value type with
     * default name and unit.
     * 
     * Example request:
     * POST /api/v1/values
     * {
     *   "time": 1699228800,
     *   "valueTypeId": 1,
     *   "value": 97.0
     * }
     * 
     * @param request the measurement to record
     * @return 201 Created on success
     */
    @PostMapping("/v1/values")
    public ResponseEntity<Void> postValue(@RequestBody @Valid ValueRequest request) {
        log.info("Received value: time={}, valueTypeId={}, value={}",
                request.getTime(), request.getValueTypeId(), request.getValue());
        
        commandHandler.handle(new RecordValueCommand(
                request.getTime(),
                request.getValueTypeId(),
                request.getValue()
        ));
        
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }
    
    /**
     * Returns stored values, optionally restricted to one value type and an inclusive
     * time window. 200 OK with an empty list when nothing matches.
     */
    @GetMapping("/v1/values")
    public ResponseEntity<List<ValueResponse>> getValues(
            @RequestParam(name = "typeId", required = false) Long typeId,
            @RequestParam(name = "start", required = false) Long start,
            @RequestParam(name = "end", required = false) Long end) {
        log.info("Received value query: typeId={}, start={}, end={}", typeId, start, end);
        
        List<ValueResponse> values = queryHandler.handle(new GetValuesQuery(typeId, start, end));
        
        return ResponseEntity.ok(values);
    }
}
