package com.example.datalake.membank.exception;

import java.util.List;
import java.util.Objects;

/**
 * The source table configuration is unusable. Raised while the application starts, which
 * prevents the context from serving any request.
 */
public class ConfigurationException extends RuntimeException {

  private final List<String> problems;

  public ConfigurationException(List<String> problems) {
    super("Invalid source table configuration: " + String.join("; ", Objects.requireNonNull(problems, "problems")));
    if (problems.isEmpty()) {
      throw new IllegalArgumentException("problems must not be empty");
    }
    this.problems = List.copyOf(problems);
  }

  public List<String> getProblems() {
    return problems;
  }
}
