package com.escrowswap.chain;

import com.escrowswap.common.RetryPolicy;
import com.escrowswap.domain.ChainId;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * RPC URLs of one chain, handed out in turn so each retry lands on the next node. Blank and repeated URLs are
 * dropped; the backoff between attempts comes from the chain's {@link RetryPolicy}.
 */
public class RpcEndpointRotator {

    private final ChainId chainId;
    private final List<String> urls;
    private final AtomicInteger cursor = new AtomicInteger();
    private final RetryPolicy retryPolicy;

    public RpcEndpointRotator(ChainId chainId, List<String> urls, RetryPolicy retryPolicy) {
        this.chainId = chainId;
        this.urls = distinctUrls(urls);
        if (this.urls.isEmpty()) {
            throw new IllegalArgumentException("No RPC endpoint configured for " + chainId);
        }
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
    }

    public String next() {
        return urls.get(Math.floorMod(cursor.getAndIncrement(), urls.size()));
    }

    /** Pause before the attempt that follows failed attempt {@code failedAttempt} (0-based). */
    public long backoffMs(int failedAttempt) {
        return retryPolicy.delayMs(failedAttempt);
    }

    public int maxAttempts() {
        return retryPolicy.getMaxAttempts();
    }

    public ChainId chainId() {
        return chainId;
    }

    public List<String> urls() {
        return urls;
    }

    private static List<String> distinctUrls(List<String> urls) {
        if (urls == null) {
            return List.of();
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String url : urls) {
            if (url != null && !url.isBlank()) {
                distinct.add(url.trim());
            }
        }
        return List.copyOf(distinct);
    }
}
