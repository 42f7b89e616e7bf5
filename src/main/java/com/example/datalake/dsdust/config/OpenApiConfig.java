package com.example.datalake.dsdust.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.License;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
    info = @Info(
        title = "DS-DUST API",
        version = "v1",
        description = "Dataset discovery over the Kaggle catalog: search, column similarity and export."
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
            .title("DS-DUST API")
            .version("v1")
            .description("Swagger UI for the dataset search endpoints.")
            .license(new License().name("Apache 2.0")));
  }

  @Bean
  public GroupedOpenApi datasetsApi() {
    return GroupedOpenApi.builder()
        .group("datasets")
        .packagesToScan("com.example.datalake.dsdust.controller")
        .pathsToMatch("/v1/**")
        .build();
  }
}
