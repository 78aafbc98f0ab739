package com.example.datalake.membank.controller;

import com.example.datalake.membank.model.ExtractionResult;
import com.example.datalake.membank.request.ExtractRequest;
import com.example.datalake.membank.response.ExtractionResponse;
import com.example.datalake.membank.service.ContentRetrievalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
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
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/v1/extract")
@Tag(name = "Extraction", description = "Fetch complete records by key or title across source tables")
@RequiredArgsConstructor
public class ExtractionController {

    private final ContentRetrievalService retrievalService;

    @GetMapping
    @Operation(
            summary = "Extract a full record",
            description = "Looks the key up first (exact, then prefix), then the title (exact, then fuzzy), "
                    + "walking source tables in priority order. Content is never truncated."
    )
    public Mono<ResponseEntity<ExtractionResponse>> extract(
            @RequestParam(value = "key", required = false) String key,
            @RequestParam(value = "title", required = false) String title,
            @RequestParam(value = "table", required = false) String table) {
        return respond(retrievalService.extract(key, title, table));
    }

    @PostMapping("/export")
    @Operation(summary = "Extract a full record and write it as Markdown to the export directory")
    public Mono<ResponseEntity<ExtractionResponse>> export(@RequestBody ExtractRequest req) {
        return respond(retrievalService.export(req.getKey(), req.getTitle(), req.getTable()));
    }

    private Mono<ResponseEntity<ExtractionResponse>> respond(Mono<ExtractionResult> result) {
        return result
                .map(this::toResponseEntity)
                .onErrorResume(ex -> {
                    if (!ApiErrors.isExpected(ex)) {
                        log.error("Unexpected failure while extracting record", ex);
                    }
                    return Mono.just(ResponseEntity.status(ApiErrors.statusFor(ex))
                            .body(ExtractionResponse.builder()
                                    .found(false)
                                    .tablesTried(List.of())
                                    .strategiesTried(List.of())
                                    .errors(ApiErrors.messagesFor(ex))
                                    .build()));
                });
    }

    private ResponseEntity<ExtractionResponse> toResponseEntity(ExtractionResult result) {
        ExtractionResponse body = ExtractionResponse.builder()
                .found(result.isFound())
                .document(result.getDocument())
                .exportPath(result.getExportPath())
                .tablesTried(result.getTablesTried())
                .strategiesTried(result.getStrategiesTried())
                .errors(result.isFound()
                        ? List.of()
                        : List.of("No matching record in " + String.join(", ", result.getTablesTried())))
                .build();
        return result.isFound()
                ? ResponseEntity.ok(body)
                : ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
    }
}
