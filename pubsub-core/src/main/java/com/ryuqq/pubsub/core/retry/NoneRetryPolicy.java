package com.ryuqq.pubsub.core.retry;

import java.util.Set;

/**
 * Policy that never retries: every failure is terminal.
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public final class NoneRetryPolicy implements RetryPolicy {

    static final NoneRetryPolicy INSTANCE = new NoneRetryPolicy();

    private NoneRetryPolicy() {
    }

    @Override
    public RetryDecision shouldRetry(int attempt, Endpoint endpoint) {
        RetryPolicy.checkArguments(attempt, endpoint);
        return RetryDecision.giveUp();
    }

    @Override
    public Set<Endpoint> excluded() {
        return Set.of();
    }

    @Override
    public String toString() {
        return "NoneRetryPolicy";
    }
}
