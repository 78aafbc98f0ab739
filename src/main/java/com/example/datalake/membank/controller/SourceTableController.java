package com.example.datalake.membank.controller;

import com.example.datalake.membank.response.SourceTablesResponse;
import com.example.datalake.membank.service.ContentRetrievalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/v1/source-tables")
@Tag(name = "Source Tables", description = "Registered source tables in search priority order")
@RequiredArgsConstructor
public class SourceTableController {

    private final ContentRetrievalService retrievalService;

    @Operation(summary = "List source tables with presence and record counts")
    @GetMapping
    public Mono<ResponseEntity<SourceTablesResponse>> list() {
        return retrievalService.listSourceTables()
                .map(tables -> ResponseEntity.ok(SourceTablesResponse.builder()
                        .tables(tables)
                        .errors(List.of())
                        .build()))
                .onErrorResume(ex -> {
                    if (!ApiErrors.isExpected(ex)) {
                        log.error("Unexpected failure while listing source tables", ex);
                    }
                    return Mono.just(ResponseEntity.status(ApiErrors.statusFor(ex))
                            .body(SourceTablesResponse.builder()
                                    .tables(List.of())
                                    .errors(ApiErrors.messagesFor(ex))
                                    .build()));
                });
    }
}
