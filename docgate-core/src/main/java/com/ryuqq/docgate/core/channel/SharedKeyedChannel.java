package com.ryuqq.docgate.core.channel;

import com.ryuqq.docgate.core.result.Result;
import com.ryuqq.docgate.core.spi.FeedSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.function.Consumer;

/**
 * 키 하나에 대한 공유 채널.
 *
 * <p>백엔드 구독 1개, 마지막 값 셀 1개, 참조 카운트 1개를 보관하고
 * 들어오는 이벤트를 연결된 모든 {@link WatchView}에 같은 순서로 전달합니다.</p>
 *
 * <p><strong>참조 카운트:</strong></p>
 * <ul>
 *   <li>{@link #retain()}: watch 호출마다 +1</li>
 *   <li>{@link #release()}: detachWatch 호출마다 -1, 0이 되면 true 반환 (이후 retain 불가)</li>
 *   <li>뷰 취소는 카운트를 변경하지 않음</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 상태 변경은 채널 모니터 안에서 수행하고, 이때 전달할 이벤트를
 * 채널의 전달 큐에 넣습니다. listener 호출은 모니터 밖에서 한 번에 한 스레드만 큐를 비우며
 * 수행합니다. 따라서 listener가 watch/detachWatch를 호출해도 교착되지 않고,
 * 한 채널의 모든 뷰는 동일한 이벤트 순서를 관찰합니다.</p>
 *
 * <p>다른 스레드가 큐를 비우는 중이면 이벤트는 그 스레드가 이어서 전달합니다.</p>
 *
 * <p><strong>dispose:</strong> 백엔드 구독 취소, 마지막 값 제거, 모든 뷰 닫기.
 * 이후 도착하는 이벤트는 무시됩니다.</p>
 *
 * @param <K> 키 타입
 * @param <V> 값 타입
 * @author DocGate Team
 * @since 1.0.0
 */
public final class SharedKeyedChannel<K, V> {

    private static final Logger log = LoggerFactory.getLogger(SharedKeyedChannel.class);

    private final K key;
    private final Result<V> bootstrap;
    private final boolean replayLastValue;
    private final List<ChannelView> views = new ArrayList<>();
    private final Queue<Runnable> deliveries = new ArrayDeque<>();

    private FeedSubscription subscription;
    private Result<V> lastValue;
    private int refCount;
    private boolean retired;
    private boolean disposed;
    private boolean draining;

    /**
     * 생성자.
     *
     * @param key 채널 키
     * @param bootstrap 새 뷰의 첫 이벤트
     * @param replayLastValue true면 새 뷰가 bootstrap 대신 마지막 값으로 시작
     * @throws IllegalArgumentException key 또는 bootstrap이 null인 경우
     */
    public SharedKeyedChannel(K key, Result<V> bootstrap, boolean replayLastValue) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (bootstrap == null) {
            throw new IllegalArgumentException("bootstrap cannot be null");
        }
        this.key = key;
        this.bootstrap = bootstrap;
        this.replayLastValue = replayLastValue;
        this.lastValue = bootstrap;
    }

    /**
     * 백엔드 feed를 구독합니다. 채널당 한 번만 호출해야 합니다.
     *
     * <p>구독 도중 채널이 dispose되었다면 방금 얻은 구독을 즉시 취소합니다.</p>
     *
     * @param opener feed 구독 함수
     * @throws IllegalStateException 이미 구독된 경우
     */
    public void open(FeedOpener<K, V> opener) {
        if (opener == null) {
            throw new IllegalArgumentException("opener cannot be null");
        }
        synchronized (this) {
            if (subscription != null) {
                throw new IllegalStateException("Channel already opened for key: " + key);
            }
        }

        FeedSubscription opened = opener.open(key, this::publish);

        boolean cancelNow;
        synchronized (this) {
            cancelNow = disposed;
            if (!disposed) {
                subscription = opened;
            }
        }
        if (cancelNow) {
            cancelQuietly(opened);
        }
    }

    /**
     * 참조 카운트 증가.
     *
     * @return 증가 후 카운트 (이미 0까지 release되었거나 dispose된 채널이면 증가하지 않고 0)
     */
    public synchronized int retain() {
        if (retired || disposed) {
            return 0;
        }
        refCount++;
        return refCount;
    }

    /**
     * 참조 카운트 감소 (0 미만으로 내려가지 않음). 0이 되면 채널은 더 이상 retain되지 않습니다.
     *
     * @return 카운트가 0이 되었으면 true (호출자가 dispose해야 함)
     */
    public synchronized boolean release() {
        if (refCount > 0) {
            refCount--;
        }
        if (refCount == 0) {
            retired = true;
        }
        return refCount == 0;
    }

    /**
     * 이후 retain을 거부하도록 표시합니다. 레지스트리에서 제거되는 채널에 사용합니다.
     */
    synchronized void retire() {
        retired = true;
    }

    /**
     * 새 뷰 연결.
     *
     * @return 새 뷰 (채널이 이미 dispose되었으면 닫힌 뷰)
     */
    public synchronized WatchView<V> attach() {
        ChannelView view = new ChannelView();
        if (disposed) {
            view.cancelled = true;
        } else {
            views.add(view);
        }
        return view;
    }

    /**
     * 이벤트를 마지막 값으로 저장하고 연결된 모든 뷰에 전달합니다.
     *
     * @param value 전달할 이벤트
     */
    public void publish(Result<V> value) {
        if (value == null) {
            return;
        }
        synchronized (this) {
            if (disposed) {
                return;
            }
            lastValue = value;
            for (ChannelView view : views) {
                view.enqueue(value);
            }
        }
        drain();
    }

    /**
     * 백엔드 구독 취소, 마지막 값 제거, 모든 뷰 닫기. 여러 번 호출해도 안전합니다.
     */
    public void dispose() {
        FeedSubscription toCancel;
        synchronized (this) {
            if (disposed) {
                return;
            }
            disposed = true;
            retired = true;
            toCancel = subscription;
            subscription = null;
            lastValue = null;
            for (ChannelView view : views) {
                view.closeLocked();
            }
            views.clear();
        }
        cancelQuietly(toCancel);
    }

    public K key() {
        return key;
    }

    public synchronized int refCount() {
        return refCount;
    }

    /**
     * 마지막 값 조회.
     *
     * @return 마지막 값 (첫 이벤트 전에는 bootstrap, dispose 후에는 null)
     */
    public synchronized Result<V> lastValue() {
        return lastValue;
    }

    public synchronized boolean isDisposed() {
        return disposed;
    }

    /**
     * 현재 연결된(취소되지 않은) 뷰 수.
     *
     * @return 뷰 수
     */
    public synchronized int viewCount() {
        return views.size();
    }

    /**
     * 전달 큐를 비웁니다. 이미 다른 스레드가 비우는 중이면 즉시 반환합니다.
     */
    private void drain() {
        synchronized (this) {
            if (draining) {
                return;
            }
            draining = true;
        }
        boolean drained = false;
        try {
            while (true) {
                Runnable next;
                synchronized (this) {
                    next = deliveries.poll();
                    if (next == null) {
                        draining = false;
                        drained = true;
                        return;
                    }
                }
                next.run();
            }
        } finally {
            if (!drained) {
                synchronized (this) {
                    draining = false;
                }
            }
        }
    }

    private void cancelQuietly(FeedSubscription target) {
        if (target == null) {
            return;
        }
        try {
            target.cancel();
            log.debug("Feed subscription cancelled for {}", key);
        } catch (RuntimeException e) {
            log.error("Failed to cancel feed subscription for {}", key, e);
        }
    }

    /**
     * 채널에 연결된 뷰. 전달 순서는 채널 모니터 안에서 정해지고, 호출은 모니터 밖에서 일어납니다.
     */
    private final class ChannelView implements WatchView<V> {

        private final List<Consumer<? super Result<V>>> listeners = new ArrayList<>();
        // 첫 subscribe 전에 도착한 이벤트, 첫 이벤트 직후 순서대로 전달
        private final List<Result<V>> pending = new ArrayList<>();
        private boolean subscribed;
        private volatile boolean cancelled;

        @Override
        public void subscribe(Consumer<? super Result<V>> listener) {
            if (listener == null) {
                throw new IllegalArgumentException("listener cannot be null");
            }
            synchronized (SharedKeyedChannel.this) {
                if (cancelled) {
                    return;
                }
                Result<V> first = replayLastValue && lastValue != null ? lastValue : bootstrap;
                listeners.add(listener);
                schedule(listener, first);
                if (!subscribed) {
                    subscribed = true;
                    if (!replayLastValue) {
                        for (Result<V> value : pending) {
                            schedule(listener, value);
                        }
                    }
                    pending.clear();
                }
            }
            drain();
        }

        @Override
        public void cancel() {
            synchronized (SharedKeyedChannel.this) {
                closeLocked();
                views.remove(this);
            }
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        /**
         * 채널 모니터 안에서 호출됩니다.
         */
        void enqueue(Result<V> value) {
            if (cancelled) {
                return;
            }
            if (!subscribed) {
                pending.add(value);
                return;
            }
            for (Consumer<? super Result<V>> listener : listeners) {
                schedule(listener, value);
            }
        }

        void closeLocked() {
            cancelled = true;
            listeners.clear();
            pending.clear();
        }

        private void schedule(Consumer<? super Result<V>> listener, Result<V> value) {
            deliveries.add(() -> dispatch(listener, value));
        }

        private void dispatch(Consumer<? super Result<V>> listener, Result<V> value) {
            if (cancelled) {
                return;
            }
            try {
                listener.accept(value);
            } catch (RuntimeException e) {
                log.error("Watch listener failed for {}", key, e);
            }
        }
    }
}
