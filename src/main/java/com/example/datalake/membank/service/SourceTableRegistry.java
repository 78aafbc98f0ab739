package com.example.datalake.membank.service;

import com.example.datalake.membank.config.RetrievalProperties;
import com.example.datalake.membank.exception.ConfigurationException;
import com.example.datalake.membank.model.SourceTableDescriptor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable, priority-ordered set of content tables. Every table and column name is checked to
 * be a plain SQL identifier so it can be placed into statement text; values are always bound.
 */
public final class SourceTableRegistry {

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private final List<SourceTableDescriptor> tables;

  public SourceTableRegistry(List<SourceTableDescriptor> descriptors) {
    List<String> problems = new ArrayList<>();
    if (descriptors == null || descriptors.isEmpty()) {
      throw new ConfigurationException(List.of("no source tables configured"));
    }

    Set<String> names = new HashSet<>();
    Set<Integer> ranks = new HashSet<>();
    for (int i = 0; i < descriptors.size(); i++) {
      SourceTableDescriptor d = descriptors.get(i);
      if (d == null) {
        problems.add("source table #" + i + " is null");
        continue;
      }
      String label = d.getName() == null ? "source table #" + i : "source table '" + d.getName() + "'";
      requireIdentifier(problems, label, "name", d.getName());
      requireIdentifier(problems, label, "title-field", d.getTitleField());
      requireIdentifier(problems, label, "content-field", d.getContentField());
      requireIdentifier(problems, label, "key-field", d.getKeyField());
      if (d.hasModifiedField()) {
        requireIdentifier(problems, label, "modified-field", d.getModifiedField());
      }
      if (d.hasCreatedField()) {
        requireIdentifier(problems, label, "created-field", d.getCreatedField());
      }
      if (d.getName() != null && !names.add(d.getName().toLowerCase(Locale.ROOT))) {
        problems.add(label + " is declared more than once");
      }
      if (!ranks.add(d.getPriorityRank())) {
        problems.add(label + " reuses priority-rank " + d.getPriorityRank());
      }
    }

    if (!problems.isEmpty()) {
      throw new ConfigurationException(problems);
    }

    this.tables = descriptors.stream()
        .sorted(Comparator.comparingInt(SourceTableDescriptor::getPriorityRank))
        .toList();
  }

  public static SourceTableRegistry fromProperties(List<RetrievalProperties.SourceTable> configured) {
    if (configured == null || configured.isEmpty()) {
      throw new ConfigurationException(List.of("no source tables configured under membank.source-tables"));
    }
    List<String> problems = new ArrayList<>();
    List<SourceTableDescriptor> descriptors = new ArrayList<>(configured.size());
    for (int i = 0; i < configured.size(); i++) {
      RetrievalProperties.SourceTable t = configured.get(i);
      if (t.getPriorityRank() == null) {
        problems.add("source table #" + i + " is missing priority-rank");
        continue;
      }
      descriptors.add(SourceTableDescriptor.builder()
          .name(trimToNull(t.getName()))
          .titleField(trimToNull(t.getTitleField()))
          .contentField(trimToNull(t.getContentField()))
          .keyField(trimToNull(t.getKeyField()))
          .modifiedField(trimToNull(t.getModifiedField()))
          .createdField(trimToNull(t.getCreatedField()))
          .icon(t.getIcon() == null ? "" : t.getIcon().trim())
          .priorityRank(t.getPriorityRank())
          .build());
    }
    if (!problems.isEmpty()) {
      throw new ConfigurationException(problems);
    }
    return new SourceTableRegistry(descriptors);
  }

  /** Tables sorted by ascending priority rank. */
  public List<SourceTableDescriptor> inPriorityOrder() {
    return tables;
  }

  public Optional<SourceTableDescriptor> find(String name) {
    if (name == null || name.isBlank()) {
      return Optional.empty();
    }
    String wanted = name.trim();
    return tables.stream().filter(t -> t.getName().equalsIgnoreCase(wanted)).findFirst();
  }

  public List<String> names() {
    return tables.stream().map(SourceTableDescriptor::getName).toList();
  }

  public int size() {
    return tables.size();
  }

  static boolean isIdentifier(String value) {
    return value != null && IDENTIFIER.matcher(value).matches();
  }

  private static void requireIdentifier(List<String> problems, String label, String field, String value) {
    if (value == null || value.isBlank()) {
      problems.add(label + " is missing " + field);
    } else if (!isIdentifier(value)) {
      problems.add(label + " has invalid " + field + " '" + value + "'");
    }
  }

  private static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
