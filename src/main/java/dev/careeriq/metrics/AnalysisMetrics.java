package dev.careeriq.metrics;

import dev.careeriq.dto.EnrichmentResult;
import dev.careeriq.model.EnrichmentOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.stream.Stream;

@Component
@RequiredArgsConstructor
@Slf4j
public class AnalysisMetrics {

    private final MeterRegistry meterRegistry;

    // Cached meter references to avoid registry lookup on every request
    private Counter completedCounter;
    private Counter rejectedCounter;
    private Counter enrichmentPresentCounter;
    private Timer analysisTimer;

    @PostConstruct
    public void init() {
        completedCounter = Counter.builder("careeriq.analysis.completed")
                .description("Analyses returned to the client")
                .register(meterRegistry);
        rejectedCounter = Counter.builder("careeriq.analysis.rejected")
                .description("Analyses rejected for unusable input")
                .register(meterRegistry);
        enrichmentPresentCounter = Counter.builder("careeriq.enrichment.present")
                .description("Narrative overlays included in a response")
                .register(meterRegistry);
        analysisTimer = Timer.builder("careeriq.analysis.duration")
                .description("End-to-end analysis time, enrichment included")
                .register(meterRegistry);
    }

    public void recordCompleted(Duration elapsed) {
        completedCounter.increment();
        analysisTimer.record(elapsed);
    }

    public void recordRejected() {
        rejectedCounter.increment();
    }

    /** One increment per overlay; degraded overlays are tagged with their reason. */
    public void recordEnrichment(EnrichmentResult enrichment) {
        Stream.of(enrichment.analysis(), enrichment.role(), enrichment.improvement()).forEach(outcome -> {
            if (outcome instanceof EnrichmentOutcome.Degraded<?> degraded) {
                meterRegistry.counter("careeriq.enrichment.degraded", "reason", degraded.reason()).increment();
            } else {
                enrichmentPresentCounter.increment();
            }
        });
    }
}
