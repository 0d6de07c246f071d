package io.github.cyfko.logicopt.core.cache;

import java.util.Deque;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Bounded least-recently-used cache holding optimization results keyed by expression.
 * <p>
 * Optimizing an expression is a pure function of its text and the active policy, so a
 * facade bound to a single policy can hand back a previous result for a repeated input.
 * The cache keeps at most {@code maxSize} entries and evicts the least recently used one
 * when a new entry would exceed that bound.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Lookups share a read lock; insertions and clears take the write lock, which is only held
 * for the map update itself. Recency tracking on lookups is best effort: the access-order
 * deque is concurrent, but two simultaneous hits may be recorded in either order.
 * </p>
 * <p>
 * {@link #computeIfAbsent} runs the loader outside of any lock. Loads in progress are tracked
 * per key, so a concurrent miss on the same key waits for that load instead of starting a
 * second one, while hits and misses on other keys proceed.
 * </p>
 *
 * <pre>{@code
 * BoundedLRUCache<String, OptimizationResult> cache = new BoundedLRUCache<>(500);
 * OptimizationResult result = cache.computeIfAbsent("a | a & b", optimizer::run);
 * }</pre>
 *
 * @param <K> the key type
 * @param <V> the value type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BoundedLRUCache<K, V> {

    private final int maxSize;
    private final Map<K, V> entries;
    private final Deque<K> accessOrder;
    private final ReadWriteLock lock;
    private final ConcurrentMap<K, CompletableFuture<V>> loading;

    /**
     * Creates an empty cache.
     *
     * @param maxSize the maximum number of entries kept
     * @throws IllegalArgumentException if {@code maxSize} is not positive
     */
    public BoundedLRUCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive, got: " + maxSize);
        }
        this.maxSize = maxSize;
        this.entries = new HashMap<>();
        this.accessOrder = new ConcurrentLinkedDeque<>();
        this.lock = new ReentrantReadWriteLock();
        this.loading = new ConcurrentHashMap<>();
    }

    /**
     * Looks up a key and marks it as most recently used when present.
     *
     * @param key the key
     * @return the cached value, or {@code null} when absent
     */
    public V get(K key) {
        lock.readLock().lock();
        try {
            V value = entries.get(key);
            if (value != null) {
                accessOrder.remove(key);
                accessOrder.addFirst(key);
            }
            return value;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Stores a value, evicting the least recently used entries past capacity.
     *
     * @param key the key
     * @param value the value
     */
    public void put(K key, V value) {
        lock.writeLock().lock();
        try {
            if (entries.put(key, value) != null) {
                accessOrder.remove(key);
            }
            accessOrder.addFirst(key);
            while (accessOrder.size() > maxSize) {
                entries.remove(accessOrder.removeLast());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the cached value for {@code key}, computing and storing it on a miss.
     * <p>
     * Concurrent misses on the same key compute once; the other callers receive the same value
     * or the same exception. A {@code null} result is returned but not stored. Exceptions thrown
     * by {@code loader} propagate and leave the cache unchanged.
     * </p>
     *
     * @param key the key
     * @param loader computes the value on a miss
     * @return the cached or freshly computed value
     */
    public V computeIfAbsent(K key, Function<? super K, ? extends V> loader) {
        V value = get(key);
        if (value != null) {
            return value;
        }

        CompletableFuture<V> pending = new CompletableFuture<>();
        CompletableFuture<V> running = loading.putIfAbsent(key, pending);
        if (running != null) {
            return await(running);
        }

        try {
            // a load of the same key may have finished since the first lookup
            value = get(key);
            if (value == null) {
                value = loader.apply(key);
                if (value != null) {
                    put(key, value);
                }
            }
            pending.complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            pending.completeExceptionally(e);
            throw e;
        } finally {
            loading.remove(key, pending);
        }
    }

    private static <V> V await(CompletableFuture<V> load) {
        try {
            return load.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            if (e.getCause() instanceof Error cause) {
                throw cause;
            }
            throw e;
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean containsKey(K key) {
        lock.readLock().lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
            accessOrder.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    /**
     * Returns a one-line summary such as {@code BoundedLRUCache[size=3, maxSize=10, utilization=30.0%]}.
     *
     * @return the summary
     */
    public String getStats() {
        lock.readLock().lock();
        try {
            return String.format(Locale.ROOT, "BoundedLRUCache[size=%d, maxSize=%d, utilization=%.1f%%]",
                    entries.size(), maxSize, (entries.size() * 100.0) / maxSize);
        } finally {
            lock.readLock().unlock();
        }
    }
}
