package com.example.datalake.membank.service;

import com.example.datalake.membank.config.RetrievalConfig;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Moves blocking storage calls onto the bounded storage executor. A cancelled subscriber does
 * not interrupt the running call; its result is dropped.
 */
@Component
public class StorageOffloader {

  private final ExecutorService executor;

  public StorageOffloader(@Qualifier(RetrievalConfig.STORAGE_EXECUTOR) ExecutorService executor) {
    this.executor = executor;
  }

  public <T> Mono<T> call(Supplier<T> storageCall) {
    return Mono.fromFuture(() -> CompletableFuture.supplyAsync(storageCall, executor), true);
  }

  public Mono<Void> run(Runnable storageCall) {
    return call(() -> {
      storageCall.run();
      return Boolean.TRUE;
    }).then();
  }
}
