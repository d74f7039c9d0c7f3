package org.fielddispatch.engine.resilience;

/**
 * Result of a guarded call: the live value, or the fallback when the
 * dependency failed, timed out or was short-circuited.
 */
public final class Guarded<T> {

    private final T value;
    private final boolean fallbackUsed;

    private Guarded(T value, boolean fallbackUsed) {
        this.value = value;
        this.fallbackUsed = fallbackUsed;
    }

    public static <T> Guarded<T> live(T value) {
        return new Guarded<>(value, false);
    }

    public static <T> Guarded<T> fallback(T value) {
        return new Guarded<>(value, true);
    }

    public T get() {
        return value;
    }

    public boolean isFallbackUsed() {
        return fallbackUsed;
    }
}
