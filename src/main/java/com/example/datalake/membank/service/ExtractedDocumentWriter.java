package com.example.datalake.membank.service;

import com.example.datalake.membank.config.RetrievalProperties;
import com.example.datalake.membank.model.ExtractedDocument;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Writes an extracted record to {@code <output-dir>/<safeName>.md}. */
@Slf4j
@Component
public class ExtractedDocumentWriter {

  private final Path outputDir;

  @Autowired
  public ExtractedDocumentWriter(RetrievalProperties properties) {
    this(Paths.get(properties.getExtraction().getOutputDir()));
  }

  public ExtractedDocumentWriter(Path outputDir) {
    this.outputDir = outputDir;
  }

  public Path write(ExtractedDocument document) {
    Path target = outputDir.resolve(document.getSafeName() + ".md");
    try {
      Files.createDirectories(outputDir);
      Files.writeString(target, render(document), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot write " + target, e);
    }
    log.info("[extract] exported {}:{} to {}", document.getTable(), document.getKey(), target);
    return target;
  }

  /** Markdown header followed by the stored content, unmodified. */
  static String render(ExtractedDocument document) {
    String title = document.getTitle() == null || document.getTitle().isBlank()
        ? "Untitled"
        : document.getTitle();
    String source = document.getIcon() == null || document.getIcon().isBlank()
        ? document.getTable()
        : document.getIcon() + " " + document.getTable();

    StringBuilder sb = new StringBuilder();
    sb.append("# ").append(title).append("\n\n");
    sb.append("**Source:** ").append(source).append("  \n");
    sb.append("**Key:** ").append(document.getKey()).append("  \n");
    sb.append("**Match:** ").append(document.getMatchKind()).append("  \n");
    appendTimestamp(sb, "Created", document.getCreatedAt());
    appendTimestamp(sb, "Modified", document.getModifiedAt());
    sb.append("\n---\n\n");
    if (document.getContent() != null) {
      sb.append(document.getContent());
    }
    return sb.toString();
  }

  private static void appendTimestamp(StringBuilder sb, String label, Instant at) {
    if (at != null) {
      sb.append("**").append(label).append(":** ").append(at).append("  \n");
    }
  }
}
