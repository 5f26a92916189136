package com.z254.butterfly.prism.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation configuration for PRISM service.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8089}")
    private int serverPort;

    @Bean
    public OpenAPI prismOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("PRISM Causal Root-Cause Service API")
                        .description("""
                                PRISM discovers causal structure in service telemetry and ranks root causes.
                                
                                ## Features
                                
                                - **Observation window**: bounded, append-only sample of service metrics
                                - **Causal discovery**: PC skeleton search with Fisher-z tests and Meek orientation
                                - **Effect estimation**: back-door adjusted regression with placebo refutation
                                - **Ranking**: root causes ordered by effect size, path length and confidence
                                
                                ## Integration
                                
                                PRISM integrates with:
                                - Telemetry producers: observations over Kafka or REST
                                - Diagnosis service: ranked root causes over Kafka
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("BUTTERFLY Team")
                                .email("butterfly@254studioz.com")
                                .url("https://254carbon.com"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server"),
                        new Server()
                                .url("http://prism-service:8089")
                                .description("Kubernetes service")
                ))
                .tags(List.of(
                        new Tag()
                                .name("Observations")
                                .description("Observation ingestion and window inspection"),
                        new Tag()
                                .name("Discovery")
                                .description("Causal discovery passes, graphs and root causes")
                ));
    }
}
