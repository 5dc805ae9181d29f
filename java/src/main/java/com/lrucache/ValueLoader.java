package com.lrucache;

/**
 * Produces a value for a cache miss.
 *
 * @param <V> produced value type
 * @param <X> exception the loader may throw; propagated unchanged by {@link LruCache#getOrLoad}
 */
@FunctionalInterface
public interface ValueLoader<V, X extends Exception> {

    V load() throws X;
}
