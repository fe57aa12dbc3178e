package com.ogt.jobs.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI jobsOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Job Service API")
                        .description("Importaciones masivas y generación de reportes asíncronas: alta, estado, cancelación, reintento y descarga.")
                        .version("1.0"));
    }
}
