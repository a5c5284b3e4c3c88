package com.riskengine.cache;

import com.riskengine.domain.model.AnalysisWindow;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Deterministic cache key for one analysis: a SHA-256 digest over the canonical holdings, the
 * window, the proxy-set content hash and the limit-set content hash.
 *
 * <p>The component hashes are kept so entries can be invalidated by proxy set or limit set.
 * Equality is by digest.
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class PipelineFingerprint {

    @EqualsAndHashCode.Include
    private final String digest;

    private final String holdingsHash;
    private final AnalysisWindow window;
    private final String proxySetHash;
    private final String limitSetHash;

    PipelineFingerprint(
            String digest, String holdingsHash, AnalysisWindow window, String proxySetHash, String limitSetHash) {
        this.digest = digest;
        this.holdingsHash = holdingsHash;
        this.window = window;
        this.proxySetHash = proxySetHash;
        this.limitSetHash = limitSetHash;
    }

    /** First 16 hex characters, for log lines. */
    public String shortId() {
        return digest.substring(0, 16);
    }

    @Override
    public String toString() {
        return "PipelineFingerprint{" + shortId() + ", window=" + window + "}";
    }
}
