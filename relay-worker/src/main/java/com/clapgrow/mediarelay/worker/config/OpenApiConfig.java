package com.clapgrow.mediarelay.worker.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI mediaRelayOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Media Relay Worker API")
                        .description("Media Relay Worker API Documentation. " +
                                "This service watches source groups and relays images and videos to target groups. " +
                                "It exposes the routing table, the group directory, the engine webhook and a live event stream.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("ClapGrow")
                                .email("support@clapgrow.com"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0.html")))
                .servers(List.of(
                        new Server().url("http://localhost:3001").description("Local Development Server")
                ));
    }
}
