package com.ospicorp.templog.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Bean
  OpenAPI apiInfo(@Value("${spring.application.name:templog}") String applicationName) {
    return new OpenAPI()
        .info(new Info()
            .title("Temperature Log Upload API")
            .version("v1")
            .description(applicationName + ": turns temperature logger exports (CSV, XLS, XLSX) "
                + "into a clean time series with statistics")
            .contact(new Contact().name("Time Series Platform Team").email("api-support@example.com"))
            .license(new License().name("MIT")))
        .servers(List.of(new Server().url("/")));
  }
}
