package com.caffe.devicebinding.config;

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
public class OpenApiConfig {

    public static final String BEARER_SCHEME = "Bearer Authentication";

    @Value("${server.port:2406}")
    private String serverPort;

    @Bean
    public OpenAPI deviceBindingOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("CAFFE Observer Device Binding API")
                        .description("""
                                Binds each observer account to the device it first signed in from.

                                ## Flow
                                - `/api/auth/login` verifies credentials and the device fingerprint
                                - a mismatch is answered with `DEVICE_MISMATCH`; the observer files a reset request
                                - administrators approve or deny reset requests under `/admin/device-resets`

                                ## Authentication
                                Protected endpoints require a Bearer token obtained from `/api/auth/login`.
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")))
                .addSecurityItem(new SecurityRequirement().addList(BEARER_SCHEME))
                .components(new Components()
                        .addSecuritySchemes(BEARER_SCHEME,
                                new SecurityScheme()
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .bearerFormat("JWT")
                                        .description("Enter JWT Bearer token")));
    }
}
