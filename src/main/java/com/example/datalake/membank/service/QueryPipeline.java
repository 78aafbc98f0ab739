package com.example.datalake.membank.service;

import com.example.datalake.membank.model.ContentLimit;
import com.example.datalake.membank.model.QueryContext;
import com.example.datalake.membank.processor.QueryExecutionProcessor;
import com.example.datalake.membank.processor.QueryIntentClassifierProcessor;
import com.example.datalake.membank.processor.QueryProcessor;
import com.example.datalake.membank.processor.SuggestionProcessor;
import com.example.datalake.membank.processor.TruncationProcessor;
import com.example.datalake.membank.validation.ValidationContext;
import com.example.datalake.membank.validation.ValidationException;
import com.example.datalake.membank.validation.ValidationService;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.support.AopUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Slf4j
@Service
public class QueryPipeline {

  // classify -> execute -> truncate -> suggest
  private static final List<Class<? extends QueryProcessor>> DEFAULT_ORDER = List.of(
          QueryIntentClassifierProcessor.class,
          QueryExecutionProcessor.class,
          TruncationProcessor.class,
          SuggestionProcessor.class
  );

  private final Map<Class<? extends QueryProcessor>, QueryProcessor> processorsByType;
  private final ValidationService validationService;

  public QueryPipeline(List<QueryProcessor> processors, ValidationService validationService) {
    this.processorsByType = processors.stream()
        .collect(Collectors.toMap(
            QueryPipeline::getConcreteType,
            Function.identity(),
            (left, right) -> left,
            LinkedHashMap::new
        ));
    this.validationService = validationService;
  }

  /**
   * Validates and runs a query. {@code maxContentLength} is the raw caller value: absent means
   * strategy default, 0 means no truncation.
   */
  public Mono<QueryContext> run(String query, Integer maxContentLength) {
    QueryContext ctx;
    try {
      ctx = initializeContext(query, maxContentLength);
    } catch (ValidationException ex) {
      log.warn("[query-pipeline] rejected query: {}", ex.getMessage());
      return Mono.error(ex);
    }

    Mono<QueryContext> pipeline = Mono.just(ctx);
    for (QueryProcessor processor : buildOrderedChain()) {
      final QueryProcessor stage = processor;
      pipeline = pipeline.flatMap(stage::process);
    }
    return pipeline;
  }

  private QueryContext initializeContext(String query, Integer maxContentLength) {
    ValidationContext validation = validationService.validate(query, maxContentLength);

    return new QueryContext()
        .setQueryText(validation.getProcessedQuery())
        .setContentLimit(ContentLimit.fromRequest(maxContentLength))
        .setNotices(new ArrayList<>(validation.getNotices()));
  }

  private List<QueryProcessor> buildOrderedChain() {
    Set<QueryProcessor> seen = new LinkedHashSet<>();
    List<QueryProcessor> ordered = new ArrayList<>();

    for (Class<? extends QueryProcessor> type : DEFAULT_ORDER) {
      QueryProcessor processor = processorsByType.get(type);
      if (processor != null && seen.add(processor)) {
        ordered.add(processor);
      }
    }

    for (QueryProcessor processor : processorsByType.values()) {
      if (seen.add(processor)) {
        ordered.add(processor);
      }
    }

    return ordered;
  }

  @SuppressWarnings("unchecked")
  private static Class<? extends QueryProcessor> getConcreteType(QueryProcessor p) {
    Class<?> target = AopUtils.getTargetClass(p);
    if (target == null || !QueryProcessor.class.isAssignableFrom(target)) {
      target = p.getClass();
    }
    return (Class<? extends QueryProcessor>) target;
  }
}
