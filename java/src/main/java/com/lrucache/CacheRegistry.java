package com.lrucache;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.WeakHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Set of persistent caches that are closed when the JVM shuts down.
 *
 * <p>Caches are held weakly: registration never keeps a cache reachable, and a cache collected
 * before shutdown is skipped. The global instance starts empty and installs its shutdown hook on
 * the first registration.
 */
public final class CacheRegistry {

    private static final Logger log = LoggerFactory.getLogger(CacheRegistry.class);

    private static final class Holder {
        static final CacheRegistry GLOBAL = new CacheRegistry(true);
    }

    private final Set<LruCache<?, ?>> caches = Collections.newSetFromMap(new WeakHashMap<>());
    private final boolean installHook;
    private boolean hookInstalled = false;

    CacheRegistry(boolean installHook) {
        this.installHook = installHook;
    }

    /**
     * Returns the process-wide registry used by caches built with {@code closeOnExit(true)}.
     *
     * @return global registry
     */
    public static CacheRegistry global() {
        return Holder.GLOBAL;
    }

    /**
     * Creates a registry without a shutdown hook; callers flush it themselves.
     *
     * @return detached registry
     */
    public static CacheRegistry detached() {
        return new CacheRegistry(false);
    }

    /**
     * Adds {@code cache} to the set flushed at exit.
     *
     * @param cache cache to register
     */
    public synchronized void register(LruCache<?, ?> cache) {
        caches.add(cache);
        if (installHook && !hookInstalled) {
            Runtime.getRuntime().addShutdownHook(new Thread(this::flushAll, "lru-cache-shutdown"));
            hookInstalled = true;
        }
    }

    /**
     * Removes {@code cache} if registered.
     *
     * @param cache cache to forget
     * @return {@code true} if it was registered
     */
    public synchronized boolean unregister(LruCache<?, ?> cache) {
        return caches.remove(cache);
    }

    public synchronized boolean isRegistered(LruCache<?, ?> cache) {
        return caches.contains(cache);
    }

    /**
     * Returns the number of registered caches that are still reachable.
     *
     * @return live registration count
     */
    public synchronized int size() {
        return caches.size();
    }

    /**
     * Closes every registered cache that is still alive. A failure to close one cache is logged
     * and does not stop the others.
     *
     * @return number of caches closed without error
     */
    public int flushAll() {
        List<LruCache<?, ?>> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(caches);
        }
        int closed = 0;
        for (LruCache<?, ?> cache : snapshot) {
            try {
                cache.close();
                closed++;
            } catch (IOException | RuntimeException ex) {
                log.warn("failed to close cache {} at exit", cache.backingPath().orElse(null), ex);
            }
        }
        return closed;
    }
}
