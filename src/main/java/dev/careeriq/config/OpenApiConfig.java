package dev.careeriq.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration(proxyBeanMethods = false)
public class OpenApiConfig {

    @Value("${app.version:2.0.0}")
    private String appVersion;

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI careerIqOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Career-IQ API")
                        .description("""
                                Resume to job description matching and analysis.

                                ## Features
                                - Skill extraction against a controlled vocabulary
                                - Match score with matched, missing and extra skills
                                - Experience level, resume structure and role readiness
                                - Smart suggestions and 30/60/90 day learning roadmaps
                                - Optional AI narrative overlays, omitted when the provider is degraded

                                The resume is sent already parsed (text and/or sections); file upload
                                and parsing happen upstream.
                                """)
                        .version(appVersion)
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Development Server")));
    }
}
