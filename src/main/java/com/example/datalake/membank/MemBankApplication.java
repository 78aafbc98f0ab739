package com.example.datalake.membank;

import com.example.datalake.membank.config.RetrievalProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(RetrievalProperties.class)
public class MemBankApplication {

  public static void main(String[] args) {
    SpringApplication.run(MemBankApplication.class, args);
  }
}
