package com.platform.schedulerjob.document;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * A configuration value that remembers whether it was provided.
 *
 * <p>{@link Presence#UNSET}: the key is absent. {@link Presence#EMPTY}: the key is present
 * but null, a blank string or an empty list. {@link Presence#VALUE}: anything else.
 * Only {@code VALUE} counts as "set".
 */
public final class ConfigValue<T> {
    
    public enum Presence {
        UNSET,
        EMPTY,
        VALUE
    }
    
    private final Presence presence;
    private final T value;
    
    private ConfigValue(Presence presence, T value) {
        this.presence = presence;
        this.value = value;
    }
    
    public static <T> ConfigValue<T> unset() {
        return new ConfigValue<>(Presence.UNSET, null);
    }
    
    public static <T> ConfigValue<T> empty() {
        return new ConfigValue<>(Presence.EMPTY, null);
    }
    
    public static <T> ConfigValue<T> of(T value) {
        return new ConfigValue<>(Presence.VALUE, Objects.requireNonNull(value, "value"));
    }
    
    public Presence presence() {
        return presence;
    }
    
    public boolean isSet() {
        return presence == Presence.VALUE;
    }
    
    /**
     * True when the key was written at all, even as an empty value.
     */
    public boolean isPresent() {
        return presence != Presence.UNSET;
    }
    
    public T get() {
        if (presence != Presence.VALUE) {
            throw new NoSuchElementException("No value: " + presence);
        }
        return value;
    }
    
    public T orElse(T other) {
        return presence == Presence.VALUE ? value : other;
    }
    
    public <R> ConfigValue<R> map(Function<? super T, ? extends R> mapper) {
        if (presence != Presence.VALUE) {
            return presence == Presence.EMPTY ? empty() : unset();
        }
        return of(mapper.apply(value));
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConfigValue<?> other)) {
            return false;
        }
        return presence == other.presence && Objects.equals(value, other.value);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(presence, value);
    }
    
    @Override
    public String toString() {
        return presence == Presence.VALUE ? "ConfigValue[" + value + "]" : "ConfigValue." + presence;
    }
}
