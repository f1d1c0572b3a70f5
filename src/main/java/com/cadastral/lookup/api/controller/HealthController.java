package com.cadastral.lookup.api.controller;

import com.cadastral.lookup.api.dto.MessageResponseDto;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    static final String RUNNING = "Server is running";

    @GetMapping("/ping")
    public ResponseEntity<MessageResponseDto> ping() {
        return ResponseEntity.ok(new MessageResponseDto(RUNNING));
    }
}
