package com.riskengine.cache;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.riskengine.config.RiskEngineProperties;
import com.riskengine.domain.model.RiskAnalysisResult;
import com.riskengine.exception.CacheException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Memoizes {@link RiskAnalysisResult}s by {@link PipelineFingerprint}.
 *
 * <p>Backed by a Caffeine {@link AsyncCache} whose values are futures, which gives at most one
 * computation per fingerprint without a global lock:
 * <ul>
 *   <li>the first caller installs an incomplete future with {@code putIfAbsent} and computes</li>
 *   <li>concurrent callers for the same fingerprint find that future and join it</li>
 *   <li>callers for other fingerprints are unaffected</li>
 * </ul>
 * A computation that throws completes its future exceptionally and is removed, so the next
 * call retries. Entries expire a fixed TTL after they are written.
 *
 * <p>Failures of the cache itself are rethrown as {@link CacheException}; failures of the
 * computation propagate unchanged.
 */
@Component
public class AnalysisResultCache {

    private static final Logger log = LoggerFactory.getLogger(AnalysisResultCache.class);

    private final AsyncCache<PipelineFingerprint, RiskAnalysisResult> cache;

    public AnalysisResultCache(RiskEngineProperties properties) {
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(properties.getCache().getTtl())
                .maximumSize(properties.getCache().getMaximumSize())
                .buildAsync();
    }

    /**
     * Returns the completed or in-flight entry for {@code fingerprint}, or null on a miss.
     * Joining an in-flight entry blocks until its owner finishes.
     */
    public RiskAnalysisResult getIfPresent(PipelineFingerprint fingerprint) {
        CompletableFuture<RiskAnalysisResult> future;
        try {
            future = cache.getIfPresent(fingerprint);
        } catch (RuntimeException e) {
            throw new CacheException("Result cache lookup failed for " + fingerprint, e);
        }
        if (future == null) {
            return null;
        }
        log.debug("Result cache hit for {}", fingerprint);
        return join(future);
    }

    /**
     * Returns the cached result for {@code fingerprint}, computing it with {@code computation}
     * if absent. Exactly one caller computes per fingerprint; the others wait for its result.
     */
    public RiskAnalysisResult getOrCompute(PipelineFingerprint fingerprint, Supplier<RiskAnalysisResult> computation) {
        CompletableFuture<RiskAnalysisResult> owned = new CompletableFuture<>();
        CompletableFuture<RiskAnalysisResult> existing;
        try {
            existing = cache.asMap().putIfAbsent(fingerprint, owned);
        } catch (RuntimeException e) {
            throw new CacheException("Result cache insert failed for " + fingerprint, e);
        }
        if (existing != null) {
            log.debug("Joining in-flight computation for {}", fingerprint);
            return join(existing);
        }

        try {
            RiskAnalysisResult result = computation.get();
            owned.complete(result);
            return result;
        } catch (RuntimeException e) {
            cache.asMap().remove(fingerprint, owned);
            owned.completeExceptionally(e);
            throw e;
        }
    }

    public void invalidate(PipelineFingerprint fingerprint) {
        cache.synchronous().invalidate(fingerprint);
    }

    public void invalidateAll() {
        cache.synchronous().invalidateAll();
    }

    /**
     * Drops every entry whose fingerprint matches {@code filter}, e.g. all entries built with a
     * proxy set that has since changed.
     */
    public int invalidateIf(Predicate<PipelineFingerprint> filter) {
        int before = cache.asMap().size();
        cache.asMap().keySet().removeIf(filter);
        return before - cache.asMap().size();
    }

    public long size() {
        return cache.synchronous().estimatedSize();
    }

    private static RiskAnalysisResult join(CompletableFuture<RiskAnalysisResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
