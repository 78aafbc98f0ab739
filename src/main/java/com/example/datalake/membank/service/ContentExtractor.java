package com.example.datalake.membank.service;

import com.example.datalake.membank.model.ExtractedDocument;
import com.example.datalake.membank.model.MatchResult;
import com.example.datalake.membank.util.SafeNameUtils;
import java.util.Objects;
import org.springframework.stereotype.Component;

/** Turns a match into the full record payload. Content is passed through untouched. */
@Component
public class ContentExtractor {

  public ExtractedDocument extract(MatchResult match) {
    Objects.requireNonNull(match, "match");
    String content = match.getContent();
    return ExtractedDocument.builder()
        .table(match.getTable().getName())
        .icon(match.getTable().getIcon())
        .key(match.getKey())
        .title(match.getTitle())
        .content(content)
        .safeName(SafeNameUtils.safeName(match.getTitle(), match.getKey()))
        .matchKind(match.getMatchKind())
        .createdAt(match.getCreatedAt())
        .modifiedAt(match.getModifiedAt())
        .contentLength(content == null ? 0 : content.length())
        .build();
  }
}
