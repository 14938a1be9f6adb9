package fr.lapetina.taskflow.infrastructure.store;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;

/**
 * {@link StateStore} backed by a {@link ConcurrentHashMap}. Nothing survives a restart.
 */
public final class InMemoryStateStore<K, V> implements StateStore<K, V> {

    private final ConcurrentHashMap<K, V> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<V> get(K key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public V compute(K key, BiFunction<? super K, ? super V, ? extends V> remapping) {
        return entries.compute(key, remapping);
    }

    @Override
    public void put(K key, V value) {
        entries.put(key, value);
    }

    @Override
    public void remove(K key) {
        entries.remove(key);
    }

    @Override
    public int removeIf(BiPredicate<? super K, ? super V> predicate) {
        int removed = 0;
        for (Map.Entry<K, V> entry : entries.entrySet()) {
            if (predicate.test(entry.getKey(), entry.getValue())
                    && entries.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public Map<K, V> snapshot() {
        return Map.copyOf(entries);
    }
}
