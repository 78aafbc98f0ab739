package com.example.datalake.membank.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.datalake.membank.exception.QuerySyntaxException;
import com.example.datalake.membank.model.QueryIntent;
import com.example.datalake.membank.model.QueryType;
import com.example.datalake.membank.model.SuggestionKind;
import com.example.datalake.membank.model.TruncatedField;
import com.example.datalake.membank.processor.QueryExecutionProcessor;
import com.example.datalake.membank.processor.QueryIntentClassifierProcessor;
import com.example.datalake.membank.processor.SuggestionProcessor;
import com.example.datalake.membank.processor.TruncationProcessor;
import com.example.datalake.membank.support.SqliteMemoryBank;
import com.example.datalake.membank.validation.ContentLimitValidator;
import com.example.datalake.membank.validation.NotBlankQueryValidator;
import com.example.datalake.membank.validation.ReadOnlyQueryValidator;
import com.example.datalake.membank.validation.ValidationException;
import com.example.datalake.membank.validation.ValidationService;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

class QueryPipelineTest {

  private static final String CONTENT = ("The staging rollout failed twice because the SSH agent was not forwarded. ")
      .repeat(20).substring(0, 1200);

  private SqliteMemoryBank bank;
  private ExecutorService executor;
  private QueryPipeline pipeline;

  @BeforeEach
  void setUp() {
    bank = new SqliteMemoryBank();
    bank.discussion("s-1", "SSH troubleshooting", CONTENT, "2024-03-02 10:00:00");
    executor = Executors.newFixedThreadPool(2);
    SourceTableRegistry registry = SqliteMemoryBank.registry();

    // registration order differs from execution order on purpose
    pipeline = new QueryPipeline(
        List.of(
            new SuggestionProcessor(new SuggestionGenerator(registry, 10, new ObjectMapper())),
            new TruncationProcessor(new TruncationEngine()),
            new QueryExecutionProcessor(bank.gateway(), new StorageOffloader(executor)),
            QueryIntentClassifierProcessor.withDefaultLimits()),
        new ValidationService(List.of(
            new NotBlankQueryValidator(),
            new ContentLimitValidator(),
            new ReadOnlyQueryValidator(false))));
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
    bank.close();
  }

  @Test
  void contentQueryIsTruncatedWithRetrySuggestion() {
    StepVerifier.create(pipeline.run("SELECT uuid, content FROM discussions", null))
        .assertNext(ctx -> {
          assertThat(ctx.getPolicy().getStrategy()).isEqualTo(QueryIntent.CONTENT_FOCUSED);
          assertThat(ctx.getPolicy().getLimit()).isEqualTo(400);
          assertThat(ctx.getQueryType()).isEqualTo(QueryType.SELECT);
          assertThat(ctx.isTruncated()).isTrue();

          Object rendered = ctx.getTruncatedRows().get(0).getValues().get("content");
          assertThat(rendered).isInstanceOf(TruncatedField.class);
          assertThat(((TruncatedField) rendered).getRenderedValue().length()).isLessThanOrEqualTo(403);

          assertThat(ctx.getSuggestions()).extracting("kind")
              .containsExactly(SuggestionKind.EXTRACT_BY_KEY, SuggestionKind.RETRY_NO_LIMIT);
          assertThat(ctx.getSteps()).extracting("name")
              .containsExactly("intent-classifier", "query-execution", "truncation", "suggestions");
        })
        .verifyComplete();
  }

  @Test
  void unlimitedQueryReturnsFullContentWithoutSuggestions() {
    StepVerifier.create(pipeline.run("SELECT uuid, content FROM discussions", 0))
        .assertNext(ctx -> {
          assertThat(ctx.getPolicy().getStrategy()).isEqualTo(QueryIntent.CONTENT_FOCUSED);
          assertThat(ctx.getPolicy().isUnlimited()).isTrue();
          assertThat(ctx.isTruncated()).isFalse();
          assertThat(ctx.getTruncatedRows().get(0).getValues().get("content")).isEqualTo(CONTENT);
          assertThat(ctx.getSuggestions()).isEmpty();
          assertThat(ctx.getNotices()).containsExactly("Truncation disabled; full content returned.");
        })
        .verifyComplete();
  }

  @Test
  void blankQueryFailsValidation() {
    StepVerifier.create(pipeline.run("  ", null))
        .expectError(ValidationException.class)
        .verify();
  }

  @Test
  void writeQueryIsRejectedWhileReadOnly() {
    StepVerifier.create(pipeline.run("DELETE FROM discussions", null))
        .expectErrorSatisfies(ex -> assertThat(ex)
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("DELETE"))
        .verify();

    assertThat(bank.jdbc().queryForObject("SELECT COUNT(*) FROM discussions", Integer.class)).isEqualTo(1);
  }

  @Test
  void writeBehindCommonTableExpressionIsRejectedWhileReadOnly() {
    StepVerifier.create(pipeline.run("WITH x AS (SELECT 1) DELETE FROM discussions", null))
        .expectErrorSatisfies(ex -> assertThat(ex)
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("DELETE"))
        .verify();

    assertThat(bank.count("discussions")).isEqualTo(1);
  }

  @Test
  void storageRejectionSurfacesAsQuerySyntaxException() {
    StepVerifier.create(pipeline.run("SELECT nope FROM discussions", null))
        .expectError(QuerySyntaxException.class)
        .verify();
  }
}
