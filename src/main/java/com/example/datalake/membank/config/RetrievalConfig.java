package com.example.datalake.membank.config;

import com.example.datalake.membank.service.SourceTableRegistry;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class RetrievalConfig {

  public static final String STORAGE_EXECUTOR = "storageExecutor";

  /** Fails context startup when the configured tables are unusable. */
  @Bean
  public SourceTableRegistry sourceTableRegistry(RetrievalProperties properties) {
    SourceTableRegistry registry = SourceTableRegistry.fromProperties(properties.getSourceTables());
    log.info("[registry] source tables in priority order: {}", registry.names());
    return registry;
  }

  @Bean(name = STORAGE_EXECUTOR, destroyMethod = "shutdown")
  public ExecutorService storageExecutor(RetrievalProperties properties) {
    int threads = Math.max(1, properties.getStorage().getThreads());
    AtomicInteger counter = new AtomicInteger();
    ThreadFactory factory = r -> {
      Thread t = new Thread(r, "membank-storage-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
    return Executors.newFixedThreadPool(threads, factory);
  }
}
