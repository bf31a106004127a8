package dev.careeriq.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of one narrative overlay request: either usable content or a degraded marker with the reason.
 * Decided once by the enrichment adapter; consumers only ask {@link #isPresent()}.
 */
public sealed interface EnrichmentOutcome<T> permits EnrichmentOutcome.Present, EnrichmentOutcome.Degraded {

    boolean isPresent();

    Optional<T> content();

    static <T> EnrichmentOutcome<T> present(T content) {
        return new Present<>(content);
    }

    static <T> EnrichmentOutcome<T> degraded(String reason) {
        return new Degraded<>(reason);
    }

    record Present<T>(T value) implements EnrichmentOutcome<T> {

        public Present {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isPresent() {
            return true;
        }

        @Override
        public Optional<T> content() {
            return Optional.of(value);
        }
    }

    record Degraded<T>(String reason) implements EnrichmentOutcome<T> {

        @Override
        public boolean isPresent() {
            return false;
        }

        @Override
        public Optional<T> content() {
            return Optional.empty();
        }
    }
}
