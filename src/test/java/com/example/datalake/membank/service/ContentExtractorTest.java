package com.example.datalake.membank.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.datalake.membank.model.ExtractedDocument;
import com.example.datalake.membank.model.MatchKind;
import com.example.datalake.membank.model.MatchResult;
import com.example.datalake.membank.support.SqliteMemoryBank;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ContentExtractorTest {

  private final ContentExtractor extractor = new ContentExtractor();

  @Test
  void carriesFullContentAndProvenance() {
    String content = "line one\n\n  line two with trailing spaces   \n" + "x".repeat(5000);
    MatchResult match = MatchResult.builder()
        .table(SqliteMemoryBank.registry().find("discussions").orElseThrow())
        .key("7f3a9c21-0000-4000-8000-000000000001")
        .title("SSH Setup: Troubleshooting!")
        .content(content)
        .matchKind(MatchKind.FUZZY_TITLE)
        .createdAt(Instant.parse("2024-01-01T00:00:00Z"))
        .modifiedAt(Instant.parse("2024-02-01T00:00:00Z"))
        .build();

    ExtractedDocument doc = extractor.extract(match);

    assertThat(doc.getContent()).isSameAs(content);
    assertThat(doc.getContentLength()).isEqualTo(content.length());
    assertThat(doc.getTable()).isEqualTo("discussions");
    assertThat(doc.getIcon()).isEqualTo("💭");
    assertThat(doc.getSafeName()).isEqualTo("ssh_setup_troubleshooting_7f3a9c21");
    assertThat(doc.getMatchKind()).isEqualTo(MatchKind.FUZZY_TITLE);
    assertThat(doc.getModifiedAt()).isEqualTo(Instant.parse("2024-02-01T00:00:00Z"));
  }
}
