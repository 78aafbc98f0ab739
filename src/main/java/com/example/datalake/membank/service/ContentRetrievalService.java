package com.example.datalake.membank.service;

import com.example.datalake.membank.dao.StorageGateway;
import com.example.datalake.membank.model.ContentLimit;
import com.example.datalake.membank.model.ExtractedDocument;
import com.example.datalake.membank.model.ExtractionResult;
import com.example.datalake.membank.model.QueryContext;
import com.example.datalake.membank.model.QueryIntent;
import com.example.datalake.membank.model.ResultRow;
import com.example.datalake.membank.model.SearchOutcome;
import com.example.datalake.membank.model.SourceTableDescriptor;
import com.example.datalake.membank.model.SourceTableSummary;
import com.example.datalake.membank.model.TruncationStrategyHelp;
import com.example.datalake.membank.processor.QueryIntentClassifierProcessor;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Entry point for callers: query execution with adaptive truncation, record extraction and
 * table listing. Every storage round trip runs on the storage executor.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContentRetrievalService {

  private final QueryPipeline pipeline;
  private final MultiTableSearchCoordinator coordinator;
  private final ContentExtractor extractor;
  private final ExtractedDocumentWriter writer;
  private final SourceTableRegistry registry;
  private final StorageGateway storage;
  private final StorageOffloader offloader;
  private final QueryIntentClassifierProcessor classifier;

  public Mono<QueryContext> runQuery(String query, ContentLimit limit) {
    ContentLimit effective = limit == null ? ContentLimit.strategyDefault() : limit;
    return pipeline.run(query, effective.toRequestValue());
  }

  /** Raw request form; validation rejects negative values. */
  public Mono<QueryContext> runQuery(String query, Integer maxContentLength) {
    return pipeline.run(query, maxContentLength);
  }

  public Mono<ExtractionResult> extract(String key, String title, String table) {
    return offloader.call(() -> coordinator.search(key, title, table))
        .map(this::toExtractionResult);
  }

  /** Extracts and writes the record as Markdown. Nothing is written on a miss. */
  public Mono<ExtractionResult> export(String key, String title, String table) {
    return extract(key, title, table)
        .flatMap(result -> {
          if (!result.isFound()) {
            return Mono.just(result);
          }
          Mono<Path> written = offloader.call(() -> writer.write(result.getDocument()));
          return written.map(path -> result.toBuilder().exportPath(path.toString()).build());
        });
  }

  public Mono<List<SourceTableSummary>> listSourceTables() {
    return offloader.call(this::summarizeTables);
  }

  public List<TruncationStrategyHelp> truncationHelp() {
    return List.of(
        TruncationStrategyHelp.builder()
            .strategy(QueryIntent.CONTENT_FOCUSED)
            .defaultLimit(classifier.defaultLimit(QueryIntent.CONTENT_FOCUSED))
            .description("Query reads or filters on a content or summary column; shows more text.")
            .exampleQueries(List.of(
                "SELECT title, content FROM documents_v2",
                "SELECT * FROM discussions WHERE content LIKE '%ssh%'",
                "SELECT summary, content FROM discussions"))
            .build(),
        TruncationStrategyHelp.builder()
            .strategy(QueryIntent.OVERVIEW)
            .defaultLimit(classifier.defaultLimit(QueryIntent.OVERVIEW))
            .description("Counts, full-row listings, schema lookups and small result sets; shows less text.")
            .exampleQueries(List.of(
                "SELECT COUNT(*) FROM artifacts",
                "SELECT * FROM documents_v2",
                "SELECT name FROM sqlite_master WHERE type = 'table'",
                "SELECT title FROM discussions LIMIT 3"))
            .build(),
        TruncationStrategyHelp.builder()
            .strategy(QueryIntent.BALANCED)
            .defaultLimit(classifier.defaultLimit(QueryIntent.BALANCED))
            .description("Everything else.")
            .exampleQueries(List.of(
                "SELECT title, created_at FROM documents_v2 ORDER BY created_at DESC",
                "SELECT uuid, title FROM artifacts"))
            .build());
  }

  public Mono<Void> ping() {
    return offloader.run(storage::ping);
  }

  private ExtractionResult toExtractionResult(SearchOutcome outcome) {
    ExtractedDocument document = outcome.match().map(extractor::extract).orElse(null);
    return ExtractionResult.builder()
        .document(document)
        .tablesTried(outcome.getTablesTried())
        .strategiesTried(outcome.getStrategiesTried())
        .build();
  }

  private List<SourceTableSummary> summarizeTables() {
    Set<String> present = storage.listTables();
    List<SourceTableSummary> out = new ArrayList<>();
    for (SourceTableDescriptor table : registry.inPriorityOrder()) {
      boolean exists = present.contains(table.getName());
      Long count = exists ? countRecords(table) : null;
      out.add(SourceTableSummary.builder()
          .name(table.getName())
          .icon(table.getIcon())
          .priorityRank(table.getPriorityRank())
          .present(exists)
          .recordCount(count)
          .build());
    }
    log.debug("[source-tables] {}", out);
    return out;
  }

  private Long countRecords(SourceTableDescriptor table) {
    List<ResultRow> rows = storage.query("SELECT COUNT(*) AS n FROM " + table.getName());
    if (rows.isEmpty() || !(rows.get(0).get("n") instanceof Number n)) {
      return 0L;
    }
    return n.longValue();
  }
}
