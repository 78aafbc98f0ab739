package com.example.datalake.membank.processor;

import com.example.datalake.membank.model.QueryContext;
import reactor.core.publisher.Mono;

public interface QueryProcessor {
    String name();
    Mono<QueryContext> process(QueryContext ctx);
}
