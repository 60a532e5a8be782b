package dev.pagestack.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration(proxyBeanMethods = false)
public class OpenApiConfig {

    @Value("${app.version:1.0.0}")
    private String appVersion;

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("PageStack CMS API")
                        .description("""
                                Page composition and versioning API.

                                ## Features
                                - Live rendering of draft pages with per-section data sources and conditions
                                - Immutable page versions with publish/unpublish
                                - Version comparison in unified, side-by-side, JSON Patch and summary form

                                ## Identity
                                Rendering endpoints read the visitor from `X-User-*` headers set by the gateway.
                                """)
                        .version(appVersion))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Development Server")));
    }
}
