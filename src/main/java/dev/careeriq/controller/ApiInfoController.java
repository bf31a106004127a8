package dev.careeriq.controller;

import dev.careeriq.model.SkillVocabulary;
import dev.careeriq.service.AiEnrichmentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.info.BuildProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * API information and health endpoints.
 */
@RestController
@RequestMapping("/api")
@Tag(name = "API Info", description = "API information and version")
@Slf4j
public class ApiInfoController {

    private final String appVersion;
    private final SkillVocabulary skillVocabulary;
    private final AiEnrichmentService aiEnrichmentService;

    @Value("${app.name:Career-IQ API}")
    private String appName;

    @Value("${app.description:Resume to job description matching and analysis}")
    private String appDescription;

    public ApiInfoController(
            @Autowired(required = false) BuildProperties buildProperties,
            @Value("${app.version:2.0.0}") String fallbackVersion,
            SkillVocabulary skillVocabulary,
            AiEnrichmentService aiEnrichmentService) {
        if (buildProperties != null) {
            this.appVersion = buildProperties.getVersion();
        } else {
            log.info("BuildProperties not available, using fallback version");
            this.appVersion = fallbackVersion;
        }
        this.skillVocabulary = skillVocabulary;
        this.aiEnrichmentService = aiEnrichmentService;
    }

    @GetMapping
    @Operation(summary = "API Root", description = "Get API information and available versions")
    public Mono<ResponseEntity<Map<String, Object>>> getApiInfo() {
        return Mono.just(ResponseEntity.ok(Map.of(
                "name", appName,
                "description", appDescription,
                "versions", Map.of(
                        "v1", "/api/v1",
                        "latest", "/api/v1"
                ),
                "documentation", "/swagger-ui.html",
                "health", "/api/health"
        )));
    }

    @GetMapping("/v1")
    @Operation(summary = "API v1 Info", description = "Get API v1 information and endpoints")
    public Mono<ResponseEntity<Map<String, Object>>> getV1Info() {
        return Mono.just(ResponseEntity.ok(Map.of(
                "version", "1.0",
                "status", "stable",
                "endpoints", Map.of(
                        "analysis", "/api/v1/analysis",
                        "vocabulary", "/api/v1/analysis/vocabulary"
                )
        )));
    }

    @GetMapping("/health")
    @Operation(summary = "Health Check", description = "Get API health status")
    public Mono<ResponseEntity<Map<String, Object>>> healthCheck() {
        return Mono.just(ResponseEntity.ok(Map.of(
                "status", "UP",
                "timestamp", LocalDateTime.now().toString(),
                "version", appVersion,
                "vocabulary_version", skillVocabulary.getVersion(),
                "ai_enabled", aiEnrichmentService.isAvailable()
        )));
    }
}
