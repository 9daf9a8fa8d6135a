package com.orderdesk.backend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class SwaggerConfig {

    @Value("${app.api.server-url:http://localhost:8080}")
    private String serverUrl;

    @Bean
    public OpenAPI orderDeskOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Order Desk API")
                        .version("1.0")
                        .description("Users, orders, customers and statistics for freelance order tracking."))

                .servers(List.of(new Server().url(serverUrl)))

                // Every non-auth endpoint expects an access token
                .addSecurityItem(new SecurityRequirement().addList("bearerAuth"))
                .components(new Components()
                        .addSecuritySchemes("bearerAuth",
                                new SecurityScheme()
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .bearerFormat("JWT")
                                        .description("Access token returned by /api/auth/login.")));
    }
}
