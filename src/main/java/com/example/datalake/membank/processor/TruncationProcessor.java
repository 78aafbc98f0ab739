package com.example.datalake.membank.processor;

import com.example.datalake.membank.model.QueryContext;
import com.example.datalake.membank.model.TruncatedRow;
import com.example.datalake.membank.service.TruncationEngine;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
@RequiredArgsConstructor
public class TruncationProcessor implements QueryProcessor {

    private static final String NAME = "truncation";

    private final TruncationEngine engine;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<QueryContext> process(QueryContext ctx) {
        List<TruncatedRow> truncated = engine.truncateRows(ctx.getRows(), ctx.getPolicy());
        ctx.setTruncatedRows(truncated);

        long rowsCut = truncated.stream().filter(TruncatedRow::isTruncated).count();
        int fieldsCut = truncated.stream().mapToInt(r -> r.getTruncatedFields().size()).sum();
        return Mono.just(ctx.addStep(NAME, "rows=" + rowsCut + "/" + truncated.size() + ", fields=" + fieldsCut));
    }
}
