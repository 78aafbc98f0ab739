package com.example.datalake.membank;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.datalake.membank.controller.HealthController;
import com.example.datalake.membank.service.SourceTableRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = "membank.database-path=target/membank-context-test.db")
class MemBankApplicationTests {

  @Autowired
  SourceTableRegistry registry;

  @Autowired
  HealthController healthController;

  @Test
  void contextLoads() {
    assertThat(registry.names()).containsExactly("documents_v2", "discussions", "artifacts");
  }

  @Test
  void healthPingsStorage() {
    assertThat(healthController.health().block().getStatusCode().value()).isEqualTo(200);
  }
}
