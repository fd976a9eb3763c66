package com.koni.sensordata.infrastructure.web.controller;

import com.koni.sensordata.application.command.UpsertDeviceTypeCommand;
import com.koni.sensordata.application.command.UpsertDeviceTypeCommandHandler;
import com.koni.sensordata.application.query.DeviceTypeResponse;
import com.koni.sensordata.application.query.GetDeviceTypeQuery;
import com.koni.sensordata.application.query.GetDeviceTypeQueryHandler;
import com.koni.sensordata.infrastructure.web.dto.DeviceTypeRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for DeviceType dimension records.
 * 
 * Endpoints:
 * - GET /api/v1/devices/{id}: fetch one device type (404 if unknown)
 * - PUT /api/v1/devices/{id}: create or partially update a device type
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class DeviceTypeController {
    
    private final GetDeviceTypeQueryHandler getHandler;
    private final UpsertDeviceTypeCommandHandler upsertHandler;
    
    @GetMapping("/v1/devices/{id}")
    public ResponseEntity<DeviceTypeResponse> getDeviceType(@PathVariable Long id) {
        log.info("Received request to get device type {}", id);
        return ResponseEntity.ok(getHandler.handle(new GetDeviceTypeQuery(id)));
    }
    
    @PutMapping("/v1/devices/{id}")
    public ResponseEntity<DeviceTypeResponse> putDeviceType(@PathVariable Long id,
                                                            @RequestBody(required = false) DeviceTypeRequest request) {
        log.info("Received device type upsert: id={}", id);
        
        DeviceTypeRequest body = request != null ? request : new DeviceTypeRequest();
        UpsertDeviceTypeCommand command = new UpsertDeviceTypeCommand(id, body.getName(), body.getLocation());
        
        return ResponseEntity.ok(DeviceTypeResponse.from(upsertHandler.handle(command)));
    }
}
