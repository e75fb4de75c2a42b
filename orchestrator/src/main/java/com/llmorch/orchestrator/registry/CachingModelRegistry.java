package com.llmorch.orchestrator.registry;

import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Caches successful resolutions for a bounded time. Failures are never cached,
 * so a model published after a miss is picked up on the next lookup.
 */
public class CachingModelRegistry implements IModelRegistry {
    private static final Logger log = LoggerFactory.getLogger(CachingModelRegistry.class);

    private final IModelRegistry delegate;
    private final Cache<String, ModelResolution> cache;

    public CachingModelRegistry(IModelRegistry delegate, Duration ttl) {
        this(delegate, ttl, Ticker.systemTicker());
    }

    public CachingModelRegistry(IModelRegistry delegate, Duration ttl, Ticker ticker) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.cache = CacheBuilder.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(10_000)
                .ticker(ticker)
                .build();
        log.info("CachingModelRegistry initialized (ttl={})", ttl);
    }

    @Override
    public ModelResolution resolve(String modelName, String version) {
        String key = modelName + ":" + (IModelRegistry.isLatest(version) ? "latest" : version);
        ModelResolution cached = cache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }
        ModelResolution resolved = delegate.resolve(modelName, version);
        cache.put(key, resolved);
        return resolved;
    }

    @Override
    public void ping() {
        delegate.ping();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }
}
