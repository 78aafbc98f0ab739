package com.example.datalake.membank.controller;

import com.example.datalake.membank.service.ContentRetrievalService;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

    private final ContentRetrievalService retrievalService;

    @GetMapping
    public Mono<ResponseEntity<Map<String, String>>> health() {
        return retrievalService.ping()
                .then(Mono.fromSupplier(() -> ResponseEntity.ok(Map.of("status", "up"))))
                .onErrorResume(ex -> {
                    log.warn("[health] storage ping failed: {}", ex.getMessage());
                    return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                            .body(Map.of("status", "down", "storage", String.valueOf(ex.getMessage()))));
                });
    }
}
