package org.machlink.compiler.frontend.module.resolve;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.Optional;

/**
 * Explicit cache of successfully fetched remote modules, keyed by absolute URL.
 * Entries have no expiry; they stay until evicted, cleared, or pushed out by the size bound.
 */
public class ModuleCache {

    private final Cache<String, ResolvedModule> cache;

    public ModuleCache(long maximumSize) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .build();
    }

    public Optional<ResolvedModule> get(String url) {
        return Optional.ofNullable(cache.getIfPresent(url));
    }

    public void put(String url, ResolvedModule module) {
        cache.put(url, module);
    }

    public void evict(String url) {
        cache.invalidate(url);
    }

    public void clear() {
        cache.invalidateAll();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
