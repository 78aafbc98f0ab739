package com.example.datalake.membank.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.datalake.membank.exception.ConfigurationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;

class RetrievalConfigTest {

  private final RetrievalConfig config = new RetrievalConfig();

  @Test
  void emptySourceTablesFailStartup() {
    RetrievalProperties properties = new RetrievalProperties();

    assertThatThrownBy(() -> config.sourceTableRegistry(properties))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("membank.source-tables");
  }

  @Test
  void storageExecutorUsesNamedThreads() throws Exception {
    RetrievalProperties properties = new RetrievalProperties();
    properties.getStorage().setThreads(0);
    ExecutorService executor = config.storageExecutor(properties);
    try {
      Future<String> name = executor.submit(() -> Thread.currentThread().getName());
      assertThat(name.get()).startsWith("membank-storage-");
    } finally {
      executor.shutdownNow();
    }
  }
}
