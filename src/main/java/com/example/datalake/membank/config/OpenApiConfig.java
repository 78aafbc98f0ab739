package com.example.datalake.membank.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import io.swagger.v3.oas.models.OpenAPI;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
    info = @Info(
        title = "Memory Bank Retrieval API",
        version = "v1",
        description = "Query execution with adaptive truncation, record extraction and source table listing."
    ),
    servers = {
        @Server(url = "/", description = "Default server")
    }
)
public class OpenApiConfig {

  @Bean
  public OpenAPI baseOpenAPI() {
    return new OpenAPI()
        .info(new io.swagger.v3.oas.models.info.Info()
            .title("Memory Bank Retrieval API")
            .version("v1")
            .description("Swagger UI for the query, extraction and source table endpoints."));
  }

  @Bean
  public GroupedOpenApi retrievalApi() {
    return GroupedOpenApi.builder()
        .group("retrieval")
        .packagesToScan("com.example.datalake.membank.controller")
        .pathsToMatch("/api/v1/**")
        .build();
  }
}
