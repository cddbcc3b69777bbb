package com.z254.vigil.warden.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation configuration for WARDEN service.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8097}")
    private int serverPort;

    @Bean
    public OpenAPI wardenOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("WARDEN Remediation Safety Service API")
                        .description("""
                                WARDEN turns reliability telemetry into governed remediation decisions.

                                ## Features

                                - **Classification**: Static thresholds plus per-component baselines
                                - **Incident memory**: Similar incidents and the outcomes that resolved them
                                - **Policies**: Deterministic healing rules with cooldowns and rate limits
                                - **Safety gateway**: Advisory, approval and autonomous modes with a full audit trail
                                """)
                        .version("1.0.0")
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")))
                .tags(List.of(
                        new Tag().name("Events").description("Telemetry ingestion and decisions"),
                        new Tag().name("Approvals").description("Pending approval workflow"),
                        new Tag().name("Audit").description("Safety gateway audit trail"),
                        new Tag().name("Memory").description("Incident outcomes and action effectiveness")));
    }
}
