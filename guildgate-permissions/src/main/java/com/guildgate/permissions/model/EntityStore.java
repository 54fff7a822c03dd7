package com.guildgate.permissions.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Immutable ID-keyed store of owned entities. Absence of an ID is a normal
 * outcome: snapshots routinely reference entities that have since been
 * removed.
 *
 * <p>
 * Values iterate in insertion order. When two values share a key, the later one
 * replaces the earlier one.
 *
 * @param <K> identifier type
 * @param <V> entity type
 */
public final class EntityStore<K, V> {

    private static final EntityStore<?, ?> EMPTY = new EntityStore<>(Map.of());

    private final Map<K, V> entries;

    private EntityStore(Map<K, V> entries) {
        this.entries = entries;
    }

    @SuppressWarnings("unchecked")
    public static <K, V> EntityStore<K, V> empty() {
        return (EntityStore<K, V>) EMPTY;
    }

    /**
     * Build a store from values, deriving each key with {@code keyOf}.
     */
    public static <K, V> EntityStore<K, V> of(Collection<? extends V> values, Function<? super V, ? extends K> keyOf) {
        Objects.requireNonNull(keyOf, "keyOf");
        if (values == null || values.isEmpty()) {
            return empty();
        }
        Map<K, V> map = new LinkedHashMap<>();
        for (V value : values) {
            map.put(Objects.requireNonNull(keyOf.apply(value), "key"), value);
        }
        return new EntityStore<>(Collections.unmodifiableMap(map));
    }

    public Optional<V> get(K id) {
        return id == null ? Optional.empty() : Optional.ofNullable(entries.get(id));
    }

    public boolean contains(K id) {
        return id != null && entries.containsKey(id);
    }

    public Collection<V> values() {
        return entries.values();
    }

    public Set<K> keys() {
        return entries.keySet();
    }

    public Stream<V> stream() {
        return entries.values().stream();
    }

    /** First value in insertion order matching the predicate. */
    public Optional<V> find(Predicate<? super V> predicate) {
        for (V value : entries.values()) {
            if (predicate.test(value)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public String toString() {
        return "EntityStore" + entries.keySet();
    }
}
