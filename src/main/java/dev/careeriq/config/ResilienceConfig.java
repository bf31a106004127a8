package dev.careeriq.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralised resilience settings for the analysis pipeline.
 *
 * <pre>
 * return enrichment.enrich(profile, requirement, match)
 *         .timeout(resilience.getAnalysisDeadline(), Mono.just(EnrichmentResult.degraded("deadline")));
 * </pre>
 */
@Component
@Getter
@Slf4j
public class ResilienceConfig {

    private final Duration externalTimeout;
    private final Duration analysisDeadline;

    public ResilienceConfig(
            @Value("${resilience.external.timeout-seconds:5}") int externalTimeoutSeconds,
            @Value("${resilience.analysis.deadline-seconds:8}") int analysisDeadlineSeconds
    ) {
        if (externalTimeoutSeconds <= 0 || analysisDeadlineSeconds <= 0) {
            throw new IllegalArgumentException("Resilience timeouts must be positive");
        }
        this.externalTimeout = Duration.ofSeconds(externalTimeoutSeconds);
        this.analysisDeadline = Duration.ofSeconds(analysisDeadlineSeconds);
        log.info("Resilience configuration initialized (externalTimeout={}s, analysisDeadline={}s)",
                externalTimeoutSeconds, analysisDeadlineSeconds);
    }
}
