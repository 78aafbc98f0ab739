package com.example.datalake.membank.model;

import java.util.List;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of a multi-table search: either a match, or a not-found record listing every table
 * consulted in priority order together with the strategies attempted.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SearchOutcome {
  MatchResult match;
  List<String> tablesTried;
  List<String> strategiesTried;

  public static SearchOutcome found(MatchResult match, List<String> tablesTried, List<String> strategiesTried) {
    return new SearchOutcome(match, List.copyOf(tablesTried), List.copyOf(strategiesTried));
  }

  public static SearchOutcome notFound(List<String> tablesTried, List<String> strategiesTried) {
    return new SearchOutcome(null, List.copyOf(tablesTried), List.copyOf(strategiesTried));
  }

  public boolean isFound() {
    return match != null;
  }

  public Optional<MatchResult> match() {
    return Optional.ofNullable(match);
  }
}
