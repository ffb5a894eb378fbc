package com.ryuqq.docgate.core.spi;

import java.util.Map;

/**
 * Receiver of a live document feed.
 *
 * <p>After {@link #onClosed()} no further callbacks are delivered.</p>
 *
 * @author DocGate Team
 * @since 1.0.0
 */
public interface DocumentFeedListener {

    /**
     * A new snapshot of the document. An absent document is reported as an empty map.
     *
     * @param payload the document payload
     */
    void onDocument(Map<String, Object> payload);

    /**
     * The feed reported an error. The feed may keep delivering afterwards.
     *
     * @param error the failure
     */
    void onError(Throwable error);

    /**
     * The feed terminated.
     */
    void onClosed();
}
