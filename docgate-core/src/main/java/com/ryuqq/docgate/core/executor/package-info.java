/**
 * Per-key action serialization.
 *
 * <p>{@link com.ryuqq.docgate.core.executor.KeyedFifoExecutor} runs asynchronous actions
 * strictly in submission order per key while leaving independent keys unordered.</p>
 *
 * @since 1.0.0
 * @author DocGate Team
 */
package com.ryuqq.docgate.core.executor;
