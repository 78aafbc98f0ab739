package com.example.datalake.membank.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "membank")
public class RetrievalProperties {

  /** Path of the SQLite file backing the memory bank. */
  private String databasePath = "memory_bank.db";

  private List<SourceTable> sourceTables = new ArrayList<>();
  private final Truncation truncation = new Truncation();
  private final Search search = new Search();
  private final Suggestions suggestions = new Suggestions();
  private final Query query = new Query();
  private final Extraction extraction = new Extraction();
  private final Storage storage = new Storage();

  @Data
  public static class SourceTable {
    private String name;
    private String titleField;
    private String contentField;
    private String keyField;
    private String modifiedField;
    private String createdField;
    private String icon;
    private Integer priorityRank;
  }

  @Data
  public static class Truncation {
    private int contentFocused = 400;
    private int overview = 80;
    private int balanced = 150;
  }

  @Data
  public static class Search {
    /** Shortest key accepted for prefix lookups; shorter keys only match exactly. */
    private int minKeyPrefixLength = 4;
  }

  @Data
  public static class Suggestions {
    private int maxExtractSuggestions = 10;
  }

  @Data
  public static class Query {
    private boolean allowWrites = false;
  }

  @Data
  public static class Extraction {
    private String outputDir = System.getProperty("java.io.tmpdir");
  }

  @Data
  public static class Storage {
    private int threads = 4;
  }
}
