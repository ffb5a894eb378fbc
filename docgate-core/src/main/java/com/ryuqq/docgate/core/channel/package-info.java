/**
 * Reference-counted shared live-feed subscriptions.
 *
 * <p>This package guarantees exactly one backend subscription per key regardless of
 * how many watchers observe that key.</p>
 *
 * <h2>Core Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.docgate.core.channel.ChannelRegistry} - acquire / release / forceRelease / disposeAll</li>
 *   <li>{@link com.ryuqq.docgate.core.channel.SharedKeyedChannel} - subscription, last value, reference count</li>
 *   <li>{@link com.ryuqq.docgate.core.channel.WatchView} - per-watcher fan-out view</li>
 *   <li>{@link com.ryuqq.docgate.core.channel.FeedOpener} - subscribes the backend feed once per channel</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <p>Reference counting is caller-managed: cancelling a view never releases the channel.
 * Every completed acquire must be matched by exactly one release.</p>
 *
 * @since 1.0.0
 * @author DocGate Team
 */
package com.ryuqq.docgate.core.channel;
