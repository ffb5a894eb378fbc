package com.ryuqq.docgate.core.channel;

import com.ryuqq.docgate.core.result.Result;
import com.ryuqq.docgate.core.spi.FeedSubscription;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * 구독/취소 횟수를 기록하고 sink로 이벤트를 직접 보낼 수 있는 테스트용 opener.
 */
class RecordingFeedOpener implements FeedOpener<String, String> {

    private final Map<String, Consumer<Result<String>>> sinks = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> opens = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> cancels = new ConcurrentHashMap<>();

    @Override
    public FeedSubscription open(String key, Consumer<Result<String>> sink) {
        opens.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
        sinks.put(key, sink);
        return () -> cancels.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
    }

    void push(String key, Result<String> value) {
        sinks.get(key).accept(value);
    }

    int openCount(String key) {
        AtomicInteger count = opens.get(key);
        return count == null ? 0 : count.get();
    }

    int cancelCount(String key) {
        AtomicInteger count = cancels.get(key);
        return count == null ? 0 : count.get();
    }
}
