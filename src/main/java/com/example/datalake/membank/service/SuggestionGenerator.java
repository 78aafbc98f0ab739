package com.example.datalake.membank.service;

import com.example.datalake.membank.config.RetrievalProperties;
import com.example.datalake.membank.model.ContentLimit;
import com.example.datalake.membank.model.ResultRow;
import com.example.datalake.membank.model.SourceTableDescriptor;
import com.example.datalake.membank.model.Suggestion;
import com.example.datalake.membank.model.SuggestionKind;
import com.example.datalake.membank.model.TruncatedRow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Builds follow-up instructions for truncated results: one extract call per truncated record
 * (by key when the row carries one, by title otherwise) and a single retry without a limit.
 */
@Slf4j
@Component
public class SuggestionGenerator {

  public static final String EXTRACT_PATH = "/api/v1/extract";
  public static final String QUERY_PATH = "/api/v1/query";

  private static final Pattern FROM_TABLE =
      Pattern.compile("\\bFROM\\s+[\"`\\[]?([A-Za-z_][A-Za-z0-9_]*)", Pattern.CASE_INSENSITIVE);

  private final SourceTableRegistry registry;
  private final int maxExtractSuggestions;
  private final ObjectMapper objectMapper;

  @Autowired
  public SuggestionGenerator(SourceTableRegistry registry, RetrievalProperties properties,
                             ObjectMapper objectMapper) {
    this(registry, properties.getSuggestions().getMaxExtractSuggestions(), objectMapper);
  }

  /** The retry body is written with {@code objectMapper}, the same one that renders responses. */
  public SuggestionGenerator(SourceTableRegistry registry, int maxExtractSuggestions, ObjectMapper objectMapper) {
    this.registry = registry;
    this.maxExtractSuggestions = Math.max(0, maxExtractSuggestions);
    this.objectMapper = objectMapper;
  }

  public List<Suggestion> generate(List<TruncatedRow> rows, String queryText) {
    if (rows == null || rows.stream().noneMatch(TruncatedRow::isTruncated)) {
      return List.of();
    }

    Optional<SourceTableDescriptor> sourceTable = sourceTableOf(queryText);
    Set<RecordRef> refs = new LinkedHashSet<>();
    for (TruncatedRow row : rows) {
      if (row.isTruncated()) {
        identify(row.getSource(), sourceTable).ifPresent(refs::add);
      }
    }

    List<Suggestion> suggestions = new ArrayList<>();
    for (RecordRef ref : refs) {
      if (suggestions.size() >= maxExtractSuggestions) {
        log.debug("[suggestions] extract suggestions capped at {}", maxExtractSuggestions);
        break;
      }
      suggestions.add(toExtractSuggestion(ref));
    }
    suggestions.add(retryWithoutLimit(queryText));
    return suggestions;
  }

  Optional<SourceTableDescriptor> sourceTableOf(String queryText) {
    if (queryText == null) {
      return Optional.empty();
    }
    Matcher m = FROM_TABLE.matcher(queryText);
    while (m.find()) {
      Optional<SourceTableDescriptor> table = registry.find(m.group(1));
      if (table.isPresent()) {
        return table;
      }
    }
    return Optional.empty();
  }

  private Optional<RecordRef> identify(ResultRow row, Optional<SourceTableDescriptor> sourceTable) {
    if (row == null) {
      return Optional.empty();
    }
    if (sourceTable.isPresent()) {
      SourceTableDescriptor t = sourceTable.get();
      return ref(t.getName(), row.getString(t.getKeyField()), row.getString(t.getTitleField()));
    }

    // query names no registered table: borrow column names from the registry
    String key = null;
    String title = null;
    for (SourceTableDescriptor t : registry.inPriorityOrder()) {
      if (key == null && row.hasColumn(t.getKeyField())) {
        key = row.getString(t.getKeyField());
      }
      if (title == null && row.hasColumn(t.getTitleField())) {
        title = row.getString(t.getTitleField());
      }
    }
    return ref(null, key, title);
  }

  private static Optional<RecordRef> ref(String table, String key, String title) {
    String k = key == null || key.isBlank() ? null : key;
    String t = title == null || title.isBlank() ? null : title;
    if (k == null && t == null) {
      return Optional.empty();
    }
    // title only matters as identity when no key is known
    return Optional.of(k != null ? new RecordRef(table, k, null) : new RecordRef(table, null, t));
  }

  private static Suggestion toExtractSuggestion(RecordRef ref) {
    UriComponentsBuilder uri = UriComponentsBuilder.fromPath(EXTRACT_PATH);
    SuggestionKind kind;
    if (ref.key() != null) {
      kind = SuggestionKind.EXTRACT_BY_KEY;
      uri.queryParam("key", ref.key());
    } else {
      kind = SuggestionKind.EXTRACT_BY_TITLE;
      uri.queryParam("title", ref.title());
    }
    if (ref.table() != null) {
      uri.queryParam("table", ref.table());
    }
    return Suggestion.builder()
        .kind(kind)
        .renderedInstruction("GET " + uri.encode().build().toUriString())
        .build();
  }

  private Suggestion retryWithoutLimit(String queryText) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("query", queryText);
    body.put("maxContentLength", ContentLimit.UNLIMITED_SENTINEL);
    try {
      return Suggestion.builder()
          .kind(SuggestionKind.RETRY_NO_LIMIT)
          .renderedInstruction("POST " + QUERY_PATH + " " + objectMapper.writeValueAsString(body))
          .build();
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot render retry suggestion", e);
    }
  }

  private record RecordRef(String table, String key, String title) {}
}
