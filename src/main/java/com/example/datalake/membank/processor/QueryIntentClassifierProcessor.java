package com.example.datalake.membank.processor;

import com.example.datalake.membank.config.RetrievalProperties;
import com.example.datalake.membank.model.ContentLimit;
import com.example.datalake.membank.model.QueryContext;
import com.example.datalake.membank.model.QueryIntent;
import com.example.datalake.membank.model.QueryType;
import com.example.datalake.membank.model.TruncationPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Picks a truncation strategy from the shape of the query text.
 *
 * <p>Rules are checked in order and the first hit wins: content-focused rules come before
 * overview rules, so a query that both counts and reads a body column is shown richly.
 * Balanced rules only contribute a reason; BALANCED is also the fallback.
 */
@Slf4j
@Component
public class QueryIntentClassifierProcessor implements QueryProcessor {

    private static final String NAME = "intent-classifier";

    private static final List<IntentRule> RULES = List.of(
            // content-focused
            rule("select-content", QueryIntent.CONTENT_FOCUSED, "SELECT\\b.*\\bcontent\\b.*\\bFROM\\b"),
            rule("filter-content", QueryIntent.CONTENT_FOCUSED,
                    "WHERE\\b.*\\bcontent\\b\\s*(?:NOT\\s+)?(?:LIKE|GLOB|MATCH|REGEXP|=)"),
            rule("discussion-summary", QueryIntent.CONTENT_FOCUSED, "SELECT\\b.*\\bsummary\\b.*\\bFROM\\s+discussions\\b"),
            rule("content-match", QueryIntent.CONTENT_FOCUSED, "\\bcontent\\b.*\\bMATCH\\b"),
            // overview
            rule("count", QueryIntent.OVERVIEW, "\\bCOUNT\\s*\\("),
            rule("pragma", QueryIntent.OVERVIEW, "^\\s*PRAGMA\\b"),
            rule("schema", QueryIntent.OVERVIEW, "\\bsqlite_(?:master|schema)\\b"),
            rule("describe", QueryIntent.OVERVIEW, "^\\s*(?:DESCRIBE|SHOW\\s+TABLES)\\b"),
            rule("select-all", QueryIntent.OVERVIEW, "SELECT\\s+(?:DISTINCT\\s+)?\\*\\s+FROM\\b"),
            rule("small-limit", QueryIntent.OVERVIEW, "\\bLIMIT\\s+[1-5]\\b(?!\\s*,)"),
            // balanced
            rule("select-title", QueryIntent.BALANCED, "SELECT\\b.*\\btitle\\b.*\\bFROM\\b"),
            rule("select-summary", QueryIntent.BALANCED, "SELECT\\b.*\\bsummary\\b.*\\bFROM\\b"),
            rule("select-key", QueryIntent.BALANCED, "SELECT\\b.*\\buuid\\b.*\\bFROM\\b"),
            rule("order-by-created", QueryIntent.BALANCED, "ORDER\\s+BY\\b.*\\bcreated_at\\b"),
            rule("group-by", QueryIntent.BALANCED, "\\bGROUP\\s+BY\\b")
    );

    private final Map<QueryIntent, Integer> defaultLimits;

    @Autowired
    public QueryIntentClassifierProcessor(RetrievalProperties properties) {
        this(limitsFrom(properties.getTruncation()));
    }

    public QueryIntentClassifierProcessor(Map<QueryIntent, Integer> defaultLimits) {
        EnumMap<QueryIntent, Integer> limits = new EnumMap<>(QueryIntent.class);
        for (QueryIntent intent : QueryIntent.values()) {
            limits.put(intent, Objects.requireNonNull(defaultLimits.get(intent), "missing limit for " + intent));
        }
        this.defaultLimits = Collections.unmodifiableMap(limits);
    }

    /** Defaults used when nothing is configured: 400 / 80 / 150 characters. */
    public static QueryIntentClassifierProcessor withDefaultLimits() {
        return new QueryIntentClassifierProcessor(limitsFrom(new RetrievalProperties.Truncation()));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<QueryContext> process(QueryContext ctx) {
        TruncationPolicy policy = classify(ctx.getQueryText(), ctx.getContentLimit());
        ctx.setQueryType(QueryType.detect(ctx.getQueryText()));
        ctx.setPolicy(policy);

        String note = "strategy=" + policy.getStrategy()
                + ", limit=" + (policy.isUnlimited() ? "none" : policy.getLimit())
                + ", type=" + ctx.getQueryType()
                + ", reason=" + policy.getReason();
        ctx.addStep(NAME, note);
        log.info("[{}] {}", NAME, note);
        return Mono.just(ctx);
    }

    /** Never fails: anything that matches no rule is BALANCED. */
    public TruncationPolicy classify(String query, ContentLimit override) {
        ContentLimit limit = override == null ? ContentLimit.strategyDefault() : override;

        IntentRule matched = match(query);
        QueryIntent intent = matched == null ? QueryIntent.BALANCED : matched.intent();

        if (limit.isExplicit()) {
            String reason = limit.isUnlimited()
                    ? "Caller requested full content"
                    : "Caller specified " + limit.chars() + " chars";
            return TruncationPolicy.builder()
                    .strategy(intent)
                    .limit(limit.chars())
                    .reason(reason)
                    .build();
        }

        return TruncationPolicy.builder()
                .strategy(intent)
                .limit(defaultLimits.get(intent))
                .reason(describe(intent, matched))
                .build();
    }

    public QueryIntent classifyIntent(String query) {
        IntentRule matched = match(query);
        return matched == null ? QueryIntent.BALANCED : matched.intent();
    }

    public int defaultLimit(QueryIntent intent) {
        return defaultLimits.get(intent);
    }

    private static IntentRule match(String query) {
        if (query == null || query.isBlank()) {
            return null;
        }
        for (IntentRule r : RULES) {
            if (r.pattern().matcher(query).find()) {
                return r;
            }
        }
        return null;
    }

    private static String describe(QueryIntent intent, IntentRule matched) {
        if (matched == null) {
            return "Default strategy";
        }
        return switch (intent) {
            case CONTENT_FOCUSED -> "Content-focused query detected (rule=" + matched.name() + ")";
            case OVERVIEW -> "Overview/metadata query detected (rule=" + matched.name() + ")";
            case BALANCED -> "Balanced query detected (rule=" + matched.name() + ")";
        };
    }

    private static Map<QueryIntent, Integer> limitsFrom(RetrievalProperties.Truncation truncation) {
        Map<QueryIntent, Integer> limits = new EnumMap<>(QueryIntent.class);
        limits.put(QueryIntent.CONTENT_FOCUSED, truncation.getContentFocused());
        limits.put(QueryIntent.OVERVIEW, truncation.getOverview());
        limits.put(QueryIntent.BALANCED, truncation.getBalanced());
        return limits;
    }

    private static IntentRule rule(String name, QueryIntent intent, String regex) {
        return new IntentRule(name, intent,
                Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.DOTALL | Pattern.MULTILINE));
    }

    private record IntentRule(String name, QueryIntent intent, Pattern pattern) {}
}
