package com.example.datalake.membank.processor;

import com.example.datalake.membank.model.QueryContext;
import com.example.datalake.membank.model.Suggestion;
import com.example.datalake.membank.service.SuggestionGenerator;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
@RequiredArgsConstructor
public class SuggestionProcessor implements QueryProcessor {

    private static final String NAME = "suggestions";

    private final SuggestionGenerator generator;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<QueryContext> process(QueryContext ctx) {
        if (!ctx.isTruncated()) {
            ctx.setSuggestions(new ArrayList<>());
            return Mono.just(ctx.addStep(NAME, "skip: nothing truncated"));
        }
        List<Suggestion> suggestions = generator.generate(ctx.getTruncatedRows(), ctx.getQueryText());
        ctx.setSuggestions(new ArrayList<>(suggestions));
        return Mono.just(ctx.addStep(NAME, "count=" + suggestions.size()));
    }
}
