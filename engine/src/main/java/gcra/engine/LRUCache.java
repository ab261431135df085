package gcra.engine;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Bounded access-ordered map: once {@code maxSize} is exceeded the least recently used
 * entry is dropped and handed to the eviction callback.
 *
 * All operations are synchronized; values are created under the same monitor, so a key never
 * maps to two different values.
 *
 * @param <K> Key type
 * @param <V> Value type
 */
final class LRUCache<K, V> {

    private final int maxSize;
    private final LinkedHashMap<K, V> map;

    /**
     * @param maxSize Maximum number of entries (must be > 0)
     * @param evictionCallback Invoked with each evicted entry (can be null)
     */
    LRUCache(int maxSize, BiConsumer<K, V> evictionCallback) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        this.maxSize = maxSize;

        // accessOrder=true: iteration order is least to most recently used
        this.map = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                boolean evict = size() > LRUCache.this.maxSize;
                if (evict && evictionCallback != null) {
                    evictionCallback.accept(eldest.getKey(), eldest.getValue());
                }
                return evict;
            }
        };
    }

    /**
     * Returns the value for {@code key}, creating it if absent. Marks the entry as recently used.
     */
    synchronized V getOrCreate(K key, Function<? super K, ? extends V> factory) {
        V value = map.get(key);
        if (value == null) {
            value = factory.apply(key);
            map.put(key, value);
        }
        return value;
    }

    /**
     * Returns the value for {@code key} or null. Marks the entry as recently used.
     */
    synchronized V get(K key) {
        return map.get(key);
    }

    synchronized boolean containsKey(K key) {
        return map.containsKey(key);
    }

    synchronized int size() {
        return map.size();
    }

    synchronized void clear() {
        map.clear();
    }

    int maxSize() {
        return maxSize;
    }
}
