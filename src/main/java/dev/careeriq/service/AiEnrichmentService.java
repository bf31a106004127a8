package dev.careeriq.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.careeriq.config.ResilienceConfig;
import dev.careeriq.dto.AiAnalysisNarrative;
import dev.careeriq.dto.EnrichmentResult;
import dev.careeriq.dto.ResumeImprovementNarrative;
import dev.careeriq.dto.RoleAnalysisNarrative;
import dev.careeriq.model.EnrichmentOutcome;
import dev.careeriq.model.JobRequirement;
import dev.careeriq.model.MatchResult;
import dev.careeriq.model.ResumeProfile;
import dev.careeriq.model.SkillToken;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Narrative overlays from an OpenAI-compatible chat completion endpoint.
 * <p>
 * The three overlays are requested concurrently, each bounded by the external timeout and
 * guarded by one circuit breaker. Every failure (timeout, non-2xx status, open circuit,
 * unparseable reply, placeholder text) ends up as {@link EnrichmentOutcome.Degraded} with
 * the reason; the returned {@code Mono} never errors.
 */
@Service
@Slf4j
public class AiEnrichmentService {

    private static final int MAX_RESUME_CHARS = 2000;
    private static final int MAX_JOB_CHARS = 2000;
    private static final String SYSTEM_PROMPT =
            "You are a career advisor reviewing resumes. Answer with a single JSON object and nothing else.";

    private final WebClient webClient;
    private final boolean enabled;
    private final String apiKey;
    private final String model;
    private final Duration timeout;
    private final PlaceholderDetector placeholderDetector;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;

    public AiEnrichmentService(
            WebClient.Builder webClientBuilder,
            @Value("${ai.enabled:true}") boolean enabled,
            @Value("${ai.base-url:https://api.openai.com/v1}") String baseUrl,
            @Value("${ai.api-key:}") String apiKey,
            @Value("${ai.model:gpt-4o-mini}") String model,
            ResilienceConfig resilienceConfig,
            PlaceholderDetector placeholderDetector,
            ObjectMapper objectMapper) {
        this.webClient = webClientBuilder.baseUrl(baseUrl).build();
        this.enabled = enabled;
        this.apiKey = apiKey;
        this.model = model;
        this.timeout = resilienceConfig.getExternalTimeout();
        this.placeholderDetector = placeholderDetector;
        this.objectMapper = objectMapper;

        CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .build();
        this.circuitBreaker = CircuitBreaker.of("ai-enrichment", cbConfig);
        log.info("AI enrichment circuit breaker initialised (enabled={}, model={}, timeout={}s)",
                isAvailable(), model, timeout.toSeconds());
    }

    /**
     * Enrichment is attempted only when enabled and an API key is configured.
     */
    public boolean isAvailable() {
        return enabled && apiKey != null && !apiKey.isBlank();
    }

    public Mono<EnrichmentResult> enrich(ResumeProfile profile, JobRequirement requirement, MatchResult match) {
        if (!isAvailable()) {
            return Mono.just(EnrichmentResult.disabled());
        }
        String resume = truncate(profile.rawText(), MAX_RESUME_CHARS);
        String job = truncate(requirement.rawText(), MAX_JOB_CHARS);

        Mono<EnrichmentOutcome<AiAnalysisNarrative>> analysis = overlay("ai_analysis",
                analysisPrompt(resume, job, match), AiAnalysisNarrative.class, placeholderDetector::screen);
        Mono<EnrichmentOutcome<RoleAnalysisNarrative>> role = overlay("role_analysis",
                rolePrompt(resume, requirement.targetRole(), match), RoleAnalysisNarrative.class, placeholderDetector::screen);
        Mono<EnrichmentOutcome<ResumeImprovementNarrative>> improvement = overlay("resume_improvement",
                improvementPrompt(resume, job), ResumeImprovementNarrative.class, placeholderDetector::screen);

        return Mono.zip(analysis, role, improvement)
                .map(t -> new EnrichmentResult(t.getT1(), t.getT2(), t.getT3()));
    }

    private <T> Mono<EnrichmentOutcome<T>> overlay(String name, String prompt, Class<T> type,
                                                   Function<T, EnrichmentOutcome<T>> screen) {
        return complete(prompt)
                .timeout(timeout)
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                .map(content -> parse(name, content, type, screen))
                .defaultIfEmpty(EnrichmentOutcome.<T>degraded("empty"))
                .onErrorResume(e -> {
                    log.debug("AI overlay {} failed: {}", name, e.toString());
                    return Mono.just(EnrichmentOutcome.<T>degraded(reasonFor(e)));
                })
                .doOnNext(outcome -> {
                    if (outcome instanceof EnrichmentOutcome.Degraded<T> degraded) {
                        log.warn("AI overlay {} suppressed: {}", name, degraded.reason());
                    } else {
                        log.debug("AI overlay {} present", name);
                    }
                });
    }

    private Mono<String> complete(String prompt) {
        ChatCompletionRequest request = new ChatCompletionRequest(model, List.of(
                new ChatMessage("system", SYSTEM_PROMPT),
                new ChatMessage("user", prompt)), 0.3);

        return webClient.post()
                .uri("/chat/completions")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(ChatCompletionResponse.class)
                .flatMap(response -> {
                    if (response.getChoices() == null || response.getChoices().isEmpty()
                            || response.getChoices().get(0).getMessage() == null) {
                        return Mono.empty();
                    }
                    return Mono.justOrEmpty(response.getChoices().get(0).getMessage().getContent());
                });
    }

    private <T> EnrichmentOutcome<T> parse(String name, String content, Class<T> type,
                                           Function<T, EnrichmentOutcome<T>> screen) {
        try {
            T narrative = objectMapper.readValue(stripCodeFences(content), type);
            if (narrative == null) {
                return EnrichmentOutcome.degraded("unparseable");
            }
            return screen.apply(narrative);
        } catch (JsonProcessingException e) {
            log.warn("AI overlay {} returned unparseable content: {}", name, e.getOriginalMessage());
            return EnrichmentOutcome.degraded("unparseable");
        }
    }

    static String reasonFor(Throwable e) {
        if (e instanceof TimeoutException) {
            return "timeout";
        }
        if (e instanceof CallNotPermittedException) {
            return "circuit_open";
        }
        if (e instanceof WebClientResponseException responseException) {
            return "http_" + responseException.getStatusCode().value();
        }
        return "provider_error";
    }

    /**
     * Models often wrap JSON in markdown fences or add prose around it; keeps the JSON object.
     */
    static String stripCodeFences(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        int fence = trimmed.indexOf("```");
        if (fence >= 0) {
            int lineEnd = trimmed.indexOf('\n', fence);
            int close = lineEnd < 0 ? -1 : trimmed.indexOf("```", lineEnd);
            if (close > lineEnd) {
                trimmed = trimmed.substring(lineEnd + 1, close).trim();
            }
        }
        int open = trimmed.indexOf('{');
        int end = trimmed.lastIndexOf('}');
        if (open > 0 && end > open) {
            trimmed = trimmed.substring(open, end + 1);
        }
        return trimmed;
    }

    // ============================
    // Prompts
    // ============================

    private String analysisPrompt(String resume, String job, MatchResult match) {
        return """
                Analyze this resume against the job description.

                RESUME:
                %s

                JOB DESCRIPTION:
                %s

                Skills found in both: %s
                Skills the job asks for but the resume lacks: %s

                Respond with a JSON object with these fields:
                overall_assessment (string), strengths (3-5 strings), weaknesses (3-5 strings),
                skill_gaps (strings), improvement_suggestions (3-5 strings).
                """.formatted(resume, job, names(match.matched()), names(match.missing()));
    }

    private String rolePrompt(String resume, String targetRole, MatchResult match) {
        return """
                Based on this resume, give role-specific advice for a %s position.

                RESUME:
                %s

                Skills the target job lacks on this resume: %s

                Respond with a JSON object with these fields:
                target_role (string), summary (string), recommended_skills (5-7 strings),
                learning_path (ordered strings).
                """.formatted(targetRole, resume, names(match.missing()));
    }

    private String improvementPrompt(String resume, String job) {
        return """
                Give specific, actionable resume improvement advice.

                CURRENT RESUME:
                %s

                TARGET JOB:
                %s

                Respond with a JSON object whose fields are lists of strings:
                summary_suggestions, experience_improvements, skills_section_tips,
                keyword_optimization, formatting_tips.
                """.formatted(resume, job);
    }

    private static String names(Collection<SkillToken> skills) {
        return skills.isEmpty() ? "none" : skills.stream().map(SkillToken::name).collect(Collectors.joining(", "));
    }

    private static String truncate(String text, int max) {
        if (text == null) return "";
        return text.length() <= max ? text : text.substring(0, max);
    }

    // ============================
    // Provider wire format
    // ============================

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class ChatCompletionRequest {
        private String model;
        private List<ChatMessage> messages;
        private double temperature;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ChatMessage {
        private String role;
        private String content;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ChatCompletionResponse {
        private List<Choice> choices;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Choice {
        private ChatMessage message;
    }
}
