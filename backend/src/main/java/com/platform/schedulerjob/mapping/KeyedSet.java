package com.platform.schedulerjob.mapping;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.ToIntFunction;

/**
 * Immutable, order-independent collection whose element identity is an explicit key
 * rather than {@link Object#equals(Object)}.
 *
 * <p>Two elements with the same key are the same element; the first one added wins.
 * Equality between two keyed sets compares keys only, so {@code "Monday"} and
 * {@code "monday"} are equal members of a case-insensitive set. Iteration follows
 * ascending key order, which makes {@link #toList()} deterministic for equal sets.
 *
 * <p>Not a {@link Set}: membership is by key, so it is only ever equal to another keyed set.
 */
public final class KeyedSet<T> implements Iterable<T> {
    
    private final ToIntFunction<? super T> keyFunction;
    private final Map<Integer, T> elements;
    
    private KeyedSet(ToIntFunction<? super T> keyFunction, Map<Integer, T> elements) {
        this.keyFunction = keyFunction;
        this.elements = elements;
    }
    
    public static <T> KeyedSet<T> of(ToIntFunction<? super T> keyFunction, Collection<? extends T> values) {
        Objects.requireNonNull(keyFunction, "keyFunction");
        Map<Integer, T> elements = new TreeMap<>();
        if (values != null) {
            for (T value : values) {
                Objects.requireNonNull(value, "keyed set elements cannot be null");
                elements.putIfAbsent(keyFunction.applyAsInt(value), value);
            }
        }
        return new KeyedSet<>(keyFunction, Collections.unmodifiableMap(elements));
    }
    
    public static <T> KeyedSet<T> empty(ToIntFunction<? super T> keyFunction) {
        return of(keyFunction, List.of());
    }
    
    public Set<Integer> keys() {
        return elements.keySet();
    }
    
    /**
     * Elements as a plain sequence, in ascending key order.
     */
    public List<T> toList() {
        return new ArrayList<>(elements.values());
    }
    
    /**
     * True when an element with the same key is present.
     */
    public boolean contains(T element) {
        if (element == null) {
            return false;
        }
        return elements.containsKey(keyFunction.applyAsInt(element));
    }
    
    @Override
    public Iterator<T> iterator() {
        return elements.values().iterator();
    }
    
    public int size() {
        return elements.size();
    }
    
    public boolean isEmpty() {
        return elements.isEmpty();
    }
    
    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        if (!(o instanceof KeyedSet<?> other)) {
            return false;
        }
        return elements.keySet().equals(other.elements.keySet());
    }
    
    @Override
    public int hashCode() {
        return elements.keySet().hashCode();
    }
    
    @Override
    public String toString() {
        return elements.values().toString();
    }
}
