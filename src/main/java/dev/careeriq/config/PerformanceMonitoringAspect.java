package dev.careeriq.config;

import dev.careeriq.exception.InvalidAnalysisInputException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Pointcut;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Times every analysis service method with a Micrometer timer ({@code method.execution},
 * tagged by class, method and outcome). Reactive results are timed from subscription to
 * completion, plain results around the call. Slow calls are logged at WARN.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class PerformanceMonitoringAspect {

    private static final int MAX_TIMER_CACHE_SIZE = 200;

    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, Timer> timerCache = new ConcurrentHashMap<>();

    @Value("${analysis.monitoring.slow-threshold-ms:500}")
    private long slowThresholdMs = 500;

    @Pointcut("execution(public * dev.careeriq.service.*.*(..))")
    public void serviceMethods() {}

    /**
     * Called many times per request on small inputs; timing them costs more than it tells.
     */
    @Pointcut("execution(* dev.careeriq.service.SkillExtractionService.*(..))"
            + " || execution(* dev.careeriq.service.PlaceholderDetector.*(..))"
            + " || execution(* dev.careeriq.service.AiEnrichmentService.isAvailable(..))")
    public void trivialMethods() {}

    @Around("serviceMethods() && !trivialMethods()")
    public Object monitorServiceMethod(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String className = signature.getDeclaringType().getSimpleName();
        String methodName = signature.getName();

        long startTime = System.nanoTime();
        Object result;
        try {
            result = joinPoint.proceed();
        } catch (Throwable error) {
            recordError(startTime, className, methodName, error);
            throw error;
        }

        if (result instanceof Mono<?> mono) {
            return Mono.defer(() -> {
                long subscribed = System.nanoTime();
                return mono
                        .doOnSuccess(value -> recordSuccess(subscribed, className, methodName))
                        .doOnError(error -> recordError(subscribed, className, methodName, error));
            });
        }
        recordSuccess(startTime, className, methodName);
        return result;
    }

    private void recordSuccess(long startTime, String className, String methodName) {
        long duration = System.nanoTime() - startTime;
        timer(className, methodName, "success").record(duration, TimeUnit.NANOSECONDS);
        if (TimeUnit.NANOSECONDS.toMillis(duration) > slowThresholdMs) {
            log.warn("Slow operation: {}.{} took {}ms", className, methodName, TimeUnit.NANOSECONDS.toMillis(duration));
        }
    }

    private void recordError(long startTime, String className, String methodName, Throwable error) {
        long duration = System.nanoTime() - startTime;
        timer(className, methodName, "error").record(duration, TimeUnit.NANOSECONDS);
        if (error instanceof InvalidAnalysisInputException || error instanceof IllegalArgumentException) {
            log.warn("Operation failed: {}.{} after {}ms: {}",
                    className, methodName, TimeUnit.NANOSECONDS.toMillis(duration), error.getMessage());
        } else {
            log.error("Operation failed: {}.{} after {}ms: {}",
                    className, methodName, TimeUnit.NANOSECONDS.toMillis(duration), error.getMessage());
        }
    }

    private Timer timer(String className, String methodName, String status) {
        String key = className + "." + methodName + "." + status;
        Timer cached = timerCache.get(key);
        if (cached != null) {
            return cached;
        }
        Timer timer = Timer.builder("method.execution")
                .tag("class", className)
                .tag("method", methodName)
                .tag("status", status)
                .description("Service method execution time")
                .register(meterRegistry);
        if (timerCache.size() < MAX_TIMER_CACHE_SIZE) {
            timerCache.putIfAbsent(key, timer);
        }
        return timer;
    }
}
