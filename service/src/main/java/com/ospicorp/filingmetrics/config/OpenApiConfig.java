package com.ospicorp.filingmetrics.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Bean
  OpenAPI apiInfo() {
    return new OpenAPI()
        .info(new Info()
            .title("Filing Metrics API")
            .version("v1")
            .description("Periodized financial metrics, growth rates and data-quality reports "
                + "derived from SEC company facts")
            .license(new License().name("MIT")))
        .servers(List.of(new Server().url("/")))
        .externalDocs(new ExternalDocumentation()
            .description("SEC EDGAR XBRL APIs")
            .url("https://www.sec.gov/edgar/sec-api-documentation"));
  }
}
