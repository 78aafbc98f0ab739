package com.example.datalake.membank.processor;

import com.example.datalake.membank.dao.StorageGateway;
import com.example.datalake.membank.exception.QuerySyntaxException;
import com.example.datalake.membank.model.QueryContext;
import com.example.datalake.membank.service.StorageOffloader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/** Runs the query text against storage. The only stage that leaves the calling thread. */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueryExecutionProcessor implements QueryProcessor {

    private static final String NAME = "query-execution";

    private final StorageGateway storage;
    private final StorageOffloader offloader;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<QueryContext> process(QueryContext ctx) {
        String query = ctx.getQueryText();
        return offloader.call(() -> storage.execute(query))
                .doOnError(QuerySyntaxException.class,
                        ex -> log.warn("[{}] storage rejected query: {}", NAME, ex.getMessage()))
                .map(execution -> {
                    ctx.setRows(execution.rows());
                    ctx.setAffectedRows(execution.affectedRows());
                    String note = execution.affectedRows() == null
                            ? "rows=" + execution.rows().size()
                            : "affectedRows=" + execution.affectedRows();
                    log.debug("[{}] {}", NAME, note);
                    return ctx.addStep(NAME, note);
                });
    }
}
