package com.example.datalake.membank.controller;

import com.example.datalake.membank.model.QueryContext;
import com.example.datalake.membank.model.TruncatedField;
import com.example.datalake.membank.model.TruncatedRow;
import com.example.datalake.membank.model.ContentLimit;
import com.example.datalake.membank.request.QueryRequest;
import com.example.datalake.membank.response.QueryResponse;
import com.example.datalake.membank.response.TruncatedFieldResponse;
import com.example.datalake.membank.response.TruncationHelpResponse;
import com.example.datalake.membank.service.ContentRetrievalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/v1/query")
@Tag(name = "Query", description = "Run queries with adaptive content truncation")
@RequiredArgsConstructor
public class QueryController {

    private final ContentRetrievalService retrievalService;

    @PostMapping
    @Operation(
            summary = "Run a query",
            description = "Classifies the query, executes it and truncates long text columns. "
                    + "Set maxContentLength to 0 for full content."
    )
    public Mono<ResponseEntity<QueryResponse>> query(@Valid @RequestBody QueryRequest req) {
        return retrievalService.runQuery(req.getQuery(), req.getMaxContentLength())
                .map(ctx -> ResponseEntity.ok(toResponse(ctx)))
                .onErrorResume(ex -> {
                    if (!ApiErrors.isExpected(ex)) {
                        log.error("Unexpected failure while running query", ex);
                    }
                    return Mono.just(ResponseEntity.status(ApiErrors.statusFor(ex))
                            .body(toErrorResponse(req, ex)));
                });
    }

    @GetMapping("/help")
    @Operation(summary = "Describe the truncation strategies and how to override them")
    public Mono<ResponseEntity<TruncationHelpResponse>> help() {
        TruncationHelpResponse body = TruncationHelpResponse.builder()
                .strategies(retrievalService.truncationHelp())
                .overrides(List.of(
                        "Omit maxContentLength to use the strategy default.",
                        "maxContentLength=" + ContentLimit.UNLIMITED_SENTINEL + " returns full content.",
                        "maxContentLength=N cuts text columns near N characters at a word boundary."))
                .build();
        return Mono.just(ResponseEntity.ok(body));
    }

    private QueryResponse toResponse(QueryContext ctx) {
        List<Map<String, Object>> rows = new ArrayList<>();
        List<TruncatedFieldResponse> fields = new ArrayList<>();
        List<TruncatedRow> truncatedRows = ctx.getTruncatedRows() == null ? List.of() : ctx.getTruncatedRows();

        for (int i = 0; i < truncatedRows.size(); i++) {
            TruncatedRow row = truncatedRows.get(i);
            Map<String, Object> rendered = new LinkedHashMap<>();
            row.getValues().forEach((column, value) -> rendered.put(column,
                    value instanceof TruncatedField field ? field.getRenderedValue() : value));
            rows.add(rendered);

            for (TruncatedField field : row.getTruncatedFields()) {
                fields.add(TruncatedFieldResponse.builder()
                        .row(i)
                        .column(field.getColumn())
                        .originalLength(field.getOriginalLength())
                        .renderedLength(field.getRenderedValue().length())
                        .build());
            }
        }

        return QueryResponse.builder()
                .query(ctx.getQueryText())
                .queryType(ctx.getQueryType() == null ? null : ctx.getQueryType().name())
                .strategy(ctx.getPolicy() == null ? null : ctx.getPolicy().getStrategy().name())
                .limit(ctx.getPolicy() == null || ctx.getPolicy().isUnlimited() ? null : ctx.getPolicy().getLimit())
                .reason(ctx.getPolicy() == null ? null : ctx.getPolicy().getReason())
                .rows(rows)
                .affectedRows(ctx.getAffectedRows())
                .truncated(ctx.isTruncated())
                .truncatedFields(fields)
                .suggestions(ctx.getSuggestions() == null ? List.of() : List.copyOf(ctx.getSuggestions()))
                .steps(ctx.getSteps() == null ? List.of() : List.copyOf(ctx.getSteps()))
                .notices(ctx.getNotices() == null ? List.of() : List.copyOf(ctx.getNotices()))
                .errors(List.of())
                .build();
    }

    private QueryResponse toErrorResponse(QueryRequest req, Throwable ex) {
        return QueryResponse.builder()
                .query(req.getQuery())
                .rows(List.of())
                .truncatedFields(List.of())
                .suggestions(List.of())
                .notices(List.of())
                .errors(ApiErrors.messagesFor(ex))
                .build();
    }
}
