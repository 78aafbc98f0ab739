package com.example.datalake.membank.service;

import com.example.datalake.membank.config.RetrievalProperties;
import com.example.datalake.membank.dao.StorageGateway;
import com.example.datalake.membank.model.MatchKind;
import com.example.datalake.membank.model.MatchResult;
import com.example.datalake.membank.model.ResultRow;
import com.example.datalake.membank.model.SearchOutcome;
import com.example.datalake.membank.model.SourceTableDescriptor;
import com.example.datalake.membank.util.TextNormalizer;
import com.example.datalake.membank.util.TimestampUtils;
import com.example.datalake.membank.validation.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds one record across the registered tables, walking them in priority order and stopping at
 * the first table that yields a hit.
 *
 * <ul>
 *   <li>Key lookups try an exact match, then a prefix match, per table.</li>
 *   <li>Title lookups try an exact normalized match, then normalized containment in either
 *       direction, per table.</li>
 *   <li>Several hits inside one table: most recently modified first, then lowest key.</li>
 * </ul>
 *
 * Storage faults are not caught here; one failing table fails the whole search.
 */
@Slf4j
@Service
public class MultiTableSearchCoordinator {

    private static final String NAME = "search-coordinator";

    // aliases keep the row shape independent of the configured column names
    private static final String K = "k";
    private static final String T = "t";
    private static final String C = "c";
    private static final String M = "m";
    private static final String CR = "cr";

    private static final Comparator<Candidate> TIE_BREAK = Comparator
            .comparing(Candidate::modifiedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(Candidate::key, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private final StorageGateway storage;
    private final SourceTableRegistry registry;
    private final int minKeyPrefixLength;

    @Autowired
    public MultiTableSearchCoordinator(StorageGateway storage,
                                       SourceTableRegistry registry,
                                       RetrievalProperties properties) {
        this(storage, registry, properties.getSearch().getMinKeyPrefixLength());
    }

    public MultiTableSearchCoordinator(StorageGateway storage, SourceTableRegistry registry, int minKeyPrefixLength) {
        this.storage = storage;
        this.registry = registry;
        this.minKeyPrefixLength = Math.max(1, minKeyPrefixLength);
    }

    /**
     * @param key              exact or shortened record key; takes precedence over the title
     * @param titleFragment    full or partial title
     * @param tableRestriction when set, only this table is consulted
     */
    public SearchOutcome search(String key, String titleFragment, String tableRestriction) {
        String wantedKey = blankToNull(key);
        String wantedTitle = TextNormalizer.normalizeTitle(titleFragment);
        if (wantedKey == null && wantedTitle.isEmpty()) {
            throw new ValidationException("Either a key or a title fragment is required.");
        }

        List<SourceTableDescriptor> tables = resolveTables(tableRestriction);
        Set<String> tablesTried = new LinkedHashSet<>();
        Set<String> strategiesTried = new LinkedHashSet<>();

        if (wantedKey != null) {
            for (SourceTableDescriptor table : tables) {
                tablesTried.add(table.getName());
                Optional<MatchResult> hit = searchByKey(table, wantedKey, strategiesTried);
                if (hit.isPresent()) {
                    return found(hit.get(), tablesTried, strategiesTried);
                }
            }
        }

        if (!wantedTitle.isEmpty()) {
            for (SourceTableDescriptor table : tables) {
                tablesTried.add(table.getName());
                Optional<MatchResult> hit = searchByTitle(table, wantedTitle, strategiesTried);
                if (hit.isPresent()) {
                    return found(hit.get(), tablesTried, strategiesTried);
                }
            }
        }

        log.info("[{}] no match for key={} title='{}' after tables={}", NAME, wantedKey, wantedTitle, tablesTried);
        return SearchOutcome.notFound(new ArrayList<>(tablesTried), new ArrayList<>(strategiesTried));
    }

    private List<SourceTableDescriptor> resolveTables(String tableRestriction) {
        String restriction = blankToNull(tableRestriction);
        if (restriction == null) {
            return registry.inPriorityOrder();
        }
        return registry.find(restriction)
                .map(List::of)
                .orElseThrow(() -> new ValidationException(
                        "Unknown source table '" + restriction + "'. Known tables: " + registry.names()));
    }

    private Optional<MatchResult> searchByKey(SourceTableDescriptor table, String key, Set<String> strategiesTried) {
        strategiesTried.add(MatchKind.EXACT_KEY.name());
        log.debug("[{}] exact key lookup in {}", NAME, table.getName());
        List<ResultRow> exact = storage.query(
                selectRecord(table) + " WHERE " + table.getKeyField() + " = ?", key);
        Optional<MatchResult> hit = pickRecord(table, exact, MatchKind.EXACT_KEY);
        if (hit.isPresent() || key.length() < minKeyPrefixLength) {
            return hit;
        }

        strategiesTried.add(MatchKind.KEY_PREFIX.name());
        log.debug("[{}] key prefix lookup in {}", NAME, table.getName());
        // substr keeps the prefix step as case-sensitive as the exact one
        List<ResultRow> prefixed = storage.query(
                selectIndex(table) + " WHERE substr(" + table.getKeyField() + ", 1, ?) = ?",
                key.codePointCount(0, key.length()), key);
        return best(toCandidates(prefixed)).flatMap(c -> fetchRecord(table, c.key(), MatchKind.KEY_PREFIX));
    }

    private Optional<MatchResult> searchByTitle(SourceTableDescriptor table, String fragment, Set<String> strategiesTried) {
        log.debug("[{}] title lookup in {}", NAME, table.getName());
        List<Candidate> candidates = toCandidates(storage.query(
                selectIndex(table) + " WHERE " + table.getTitleField() + " IS NOT NULL"));

        strategiesTried.add(MatchKind.EXACT_TITLE.name());
        List<Candidate> exact = candidates.stream()
                .filter(c -> c.normalizedTitle().equals(fragment))
                .toList();
        if (!exact.isEmpty()) {
            return best(exact).flatMap(c -> fetchRecord(table, c.key(), MatchKind.EXACT_TITLE));
        }

        strategiesTried.add(MatchKind.FUZZY_TITLE.name());
        List<Candidate> fuzzy = candidates.stream()
                .filter(c -> !c.normalizedTitle().isEmpty())
                .filter(c -> c.normalizedTitle().contains(fragment) || fragment.contains(c.normalizedTitle()))
                .toList();
        return best(fuzzy).flatMap(c -> fetchRecord(table, c.key(), MatchKind.FUZZY_TITLE));
    }

    private Optional<MatchResult> fetchRecord(SourceTableDescriptor table, String key, MatchKind kind) {
        List<ResultRow> rows = storage.query(
                selectRecord(table) + " WHERE " + table.getKeyField() + " = ?", key);
        return pickRecord(table, rows, kind);
    }

    private Optional<MatchResult> pickRecord(SourceTableDescriptor table, List<ResultRow> rows, MatchKind kind) {
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        ResultRow row = rows.size() == 1
                ? rows.get(0)
                : rows.stream().min(Comparator.comparing(Candidate::of, TIE_BREAK)).orElseThrow();

        String content = row.getString(C);
        return Optional.of(MatchResult.builder()
                .table(table)
                .key(row.getString(K))
                .title(row.getString(T))
                .content(content == null ? "" : content)
                .matchKind(kind)
                .modifiedAt(TimestampUtils.toInstant(row.get(M)))
                .createdAt(TimestampUtils.toInstant(row.get(CR)))
                .build());
    }

    private static Optional<Candidate> best(List<Candidate> candidates) {
        return candidates.stream().min(TIE_BREAK);
    }

    private static List<Candidate> toCandidates(List<ResultRow> rows) {
        return rows.stream()
                .map(Candidate::of)
                .filter(c -> c.key() != null)
                .toList();
    }

    private static String selectIndex(SourceTableDescriptor table) {
        return "SELECT " + table.getKeyField() + " AS " + K
                + ", " + table.getTitleField() + " AS " + T
                + ", " + timestampColumn(table.hasModifiedField(), table.getModifiedField()) + " AS " + M
                + " FROM " + table.getName();
    }

    private static String selectRecord(SourceTableDescriptor table) {
        return "SELECT " + table.getKeyField() + " AS " + K
                + ", " + table.getTitleField() + " AS " + T
                + ", " + table.getContentField() + " AS " + C
                + ", " + timestampColumn(table.hasModifiedField(), table.getModifiedField()) + " AS " + M
                + ", " + timestampColumn(table.hasCreatedField(), table.getCreatedField()) + " AS " + CR
                + " FROM " + table.getName();
    }

    private static String timestampColumn(boolean present, String column) {
        return present ? column : "NULL";
    }

    private SearchOutcome found(MatchResult match, Set<String> tablesTried, Set<String> strategiesTried) {
        log.info("[{}] {} match in {} (key={}) after tables={}",
                NAME, match.getMatchKind(), match.getTable().getName(), match.getKey(), tablesTried);
        return SearchOutcome.found(match, new ArrayList<>(tablesTried), new ArrayList<>(strategiesTried));
    }

    private static String blankToNull(String s) {
        if (s == null) {
            return null;
        }
        String trimmed = s.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private record Candidate(String key, String normalizedTitle, Instant modifiedAt) {

        static Candidate of(ResultRow row) {
            return new Candidate(
                    row.getString(K),
                    TextNormalizer.normalizeTitle(row.getString(T)),
                    TimestampUtils.toInstant(row.get(M)));
        }
    }
}
