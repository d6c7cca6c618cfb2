package com.xksgroup.streamarchiver.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        Server localDev = new Server()
                .url("http://localhost:8080")
                .description("Local development");

        return new OpenAPI()
                .info(new Info()
                        .title("Stream Archiver API")
                        .version("v1")
                        .description("Archival job tracking, live progress streams and feed monitor configuration"))
                .servers(List.of(localDev));
    }
}
