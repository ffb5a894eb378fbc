package com.ryuqq.docgate.core.channel;

import com.ryuqq.docgate.core.result.Result;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 원본 뷰의 이벤트를 변환해 전달하는 파생 뷰.
 */
final class MappedWatchView<V, U> implements WatchView<U> {

    private final WatchView<V> source;
    private final Function<? super Result<V>, Result<U>> mapper;

    MappedWatchView(WatchView<V> source, Function<? super Result<V>, Result<U>> mapper) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.source = source;
        this.mapper = mapper;
    }

    @Override
    public void subscribe(Consumer<? super Result<U>> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        source.subscribe(event -> listener.accept(mapper.apply(event)));
    }

    @Override
    public void cancel() {
        source.cancel();
    }

    @Override
    public boolean isCancelled() {
        return source.isCancelled();
    }
}
