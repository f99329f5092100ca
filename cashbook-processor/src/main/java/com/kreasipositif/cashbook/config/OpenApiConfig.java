package com.kreasipositif.cashbook.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * SpringDoc metadata for the cash book API.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI cashBookOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Cash Book Processor API")
                        .description("""
                                Builds the simplified-regime cash book (Libro de Caja) from tax-authority exports.

                                **Exposed resources:**
                                - `POST /api/v1/cash-book` - ingest sales, summary and purchase exports plus pasted entries
                                - `POST /api/v1/cash-book/edits` - change the opening balance or operation dates and recompute
                                - `GET /api/v1/cash-book/document-types` - document type catalog used for labels
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Kreasi Positif")
                                .url("https://github.com/kreasipositif")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")
                ));
    }
}
