package com.baykanat.health.store.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/** OpenAPI / Swagger UI bean tanımı. */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI healthStoreOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Health Store - Telemetry Ingestion & Query API")
                        .description("""
                                Append-only store for health telemetry events. Every event is written \
                                as its own Parquet file under a year=/month=/day= partition of its \
                                timestamp; partitions are merged on read and queried ad hoc with DuckDB.\
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Burak Aykanat")
                                .email("burak.aykanat12@gmail.com")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Development")
                ));
    }
}
