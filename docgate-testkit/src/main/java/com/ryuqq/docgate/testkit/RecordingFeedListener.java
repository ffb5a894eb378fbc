package com.ryuqq.docgate.testkit;

import com.ryuqq.docgate.core.spi.DocumentFeedListener;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 수신한 feed 이벤트를 기록하는 {@link DocumentFeedListener}.
 *
 * @author DocGate Team
 * @since 1.0.0
 */
public class RecordingFeedListener implements DocumentFeedListener {

    private final List<Map<String, Object>> documents = new CopyOnWriteArrayList<>();
    private final List<Throwable> errors = new CopyOnWriteArrayList<>();
    private final AtomicInteger closedCount = new AtomicInteger();

    @Override
    public void onDocument(Map<String, Object> document) {
        documents.add(document);
    }

    @Override
    public void onError(Throwable error) {
        errors.add(error);
    }

    @Override
    public void onClosed() {
        closedCount.incrementAndGet();
    }

    /**
     * 지금까지 받은 문서 목록 (스냅샷).
     *
     * @return 문서 목록
     */
    public List<Map<String, Object>> documents() {
        return new ArrayList<>(documents);
    }

    /**
     * 마지막으로 받은 문서.
     *
     * @return 마지막 문서 (없으면 null)
     */
    public Map<String, Object> lastDocument() {
        return documents.isEmpty() ? null : documents.get(documents.size() - 1);
    }

    public List<Throwable> errors() {
        return new ArrayList<>(errors);
    }

    public int closedCount() {
        return closedCount.get();
    }
}
