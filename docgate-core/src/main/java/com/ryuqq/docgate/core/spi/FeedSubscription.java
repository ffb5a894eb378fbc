package com.ryuqq.docgate.core.spi;

/**
 * Handle of one backend feed subscription.
 *
 * @author DocGate Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FeedSubscription {

    /**
     * Cancels the subscription. Calling it more than once has no further effect.
     */
    void cancel();
}
