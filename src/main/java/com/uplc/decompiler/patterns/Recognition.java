package com.uplc.decompiler.patterns;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a heuristic recognizer: found, not found, or ambiguous between candidates.
 *
 * An ambiguous result still names the value a caller should fall back to; it is always one of
 * the candidates.
 */
public final class Recognition<T> {

    public enum Kind { FOUND, NOT_FOUND, AMBIGUOUS }

    private static final Recognition<?> NOT_FOUND = new Recognition<>(Kind.NOT_FOUND, null, List.of(), 0.0);

    public final Kind kind;
    private final T value;
    private final List<T> candidates;
    private final double confidence;

    private Recognition(Kind kind, T value, List<T> candidates, double confidence) {
        this.kind = kind;
        this.value = value;
        this.candidates = candidates;
        this.confidence = confidence;
    }

    public static <T> Recognition<T> found(T value, double confidence) {
        return new Recognition<>(Kind.FOUND, Objects.requireNonNull(value), List.of(value), clamp(confidence));
    }

    @SuppressWarnings("unchecked")
    public static <T> Recognition<T> notFound() {
        return (Recognition<T>) NOT_FOUND;
    }

    public static <T> Recognition<T> ambiguous(T fallback, List<T> candidates, double confidence) {
        if (!candidates.contains(fallback)) {
            throw new IllegalArgumentException("fallback " + fallback + " is not among " + candidates);
        }
        return new Recognition<>(Kind.AMBIGUOUS, fallback, List.copyOf(candidates), clamp(confidence));
    }

    public boolean isFound() { return kind == Kind.FOUND; }
    public boolean isAmbiguous() { return kind == Kind.AMBIGUOUS; }

    /** The found value, the fallback of an ambiguous result, or {@code other}. */
    public T orElse(T other) {
        return value != null ? value : other;
    }

    public List<T> candidates() { return candidates; }
    public double confidence() { return confidence; }

    private static double clamp(double c) {
        return Math.max(0.0, Math.min(1.0, c));
    }

    @Override
    public String toString() {
        switch (kind) {
            case FOUND: return "Found(" + value + ", " + confidence + ")";
            case AMBIGUOUS: return "Ambiguous(" + value + " of " + candidates + ", " + confidence + ")";
            default: return "NotFound";
        }
    }
}
