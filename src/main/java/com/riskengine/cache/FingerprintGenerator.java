package com.riskengine.cache;

import com.riskengine.domain.model.FactorProxySet;
import com.riskengine.domain.model.Holding;
import com.riskengine.domain.model.Portfolio;
import com.riskengine.risk.RiskLimitSet;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Builds {@link PipelineFingerprint}s and the content hashes they are made of.
 *
 * <p>Every hash is SHA-256 over a canonical text form, so equal content always yields the same
 * key regardless of holding order, map iteration order, or object identity:
 * <ul>
 *   <li>holdings: sorted {@code TICKER|QUANTITY_TYPE|quantity} lines, quantities in plain
 *       notation with trailing zeros stripped</li>
 *   <li>proxy set: ordered factor entries (order is significant), excess flags, sorted cash map;
 *       the id is excluded</li>
 *   <li>limit set: each threshold by field name, {@code -} when disabled; the name is excluded</li>
 * </ul>
 */
@Component
public class FingerprintGenerator {

    public PipelineFingerprint fingerprint(Portfolio portfolio, FactorProxySet proxySet, RiskLimitSet limits) {
        String holdingsHash = holdingsHash(portfolio.getHoldings());
        String proxySetHash = proxySetHash(proxySet);
        String limitSetHash = limitSetHash(limits);
        String digest = sha256(String.join(
                "\n", holdingsHash, portfolio.getWindow().toString(), proxySetHash, limitSetHash));
        return new PipelineFingerprint(digest, holdingsHash, portfolio.getWindow(), proxySetHash, limitSetHash);
    }

    public String holdingsHash(List<Holding> holdings) {
        List<String> lines = new ArrayList<>(holdings.size());
        for (Holding holding : holdings) {
            lines.add(holding.getTicker() + "|" + holding.getQuantityType() + "|"
                    + holding.getQuantity().stripTrailingZeros().toPlainString());
        }
        lines.sort(Comparator.naturalOrder());
        return sha256(String.join("\n", lines));
    }

    public String proxySetHash(FactorProxySet proxySet) {
        StringBuilder canonical = new StringBuilder("factors:");
        for (Map.Entry<String, String> factor : proxySet.getFactors().entrySet()) {
            canonical
                    .append(factor.getKey())
                    .append('=')
                    .append(factor.getValue())
                    .append(proxySet.isExcessFactor(factor.getKey()) ? "(excess)" : "")
                    .append(';');
        }
        canonical.append("cash:");
        canonical.append(proxySet.getCashProxies().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(";")));
        return sha256(canonical.toString());
    }

    public String limitSetHash(RiskLimitSet limits) {
        return sha256(limits.thresholds().entrySet().stream()
                .map(entry -> entry.getKey() + "=" + (entry.getValue() == null ? "-" : entry.getValue()))
                .collect(Collectors.joining(";")));
    }

    static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
