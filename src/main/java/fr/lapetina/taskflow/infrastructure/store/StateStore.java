package fr.lapetina.taskflow.infrastructure.store;

import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;

/**
 * Keyed holder for the process-local state of breakers, limiters and retries.
 *
 * Values are expected to be immutable. {@link #compute} is atomic per key, which
 * is what makes read-modify-write transitions safe under concurrent requests.
 *
 * @param <K> key type
 * @param <V> value type
 */
public interface StateStore<K, V> {

    Optional<V> get(K key);

    /**
     * Atomically replaces the value for a key. The function receives null when the
     * key is absent; returning null removes the entry.
     */
    V compute(K key, BiFunction<? super K, ? super V, ? extends V> remapping);

    void put(K key, V value);

    void remove(K key);

    /**
     * Removes every entry matching the predicate and returns how many were removed.
     */
    int removeIf(BiPredicate<? super K, ? super V> predicate);

    int size();

    /**
     * Point-in-time copy of all entries.
     */
    Map<K, V> snapshot();
}
