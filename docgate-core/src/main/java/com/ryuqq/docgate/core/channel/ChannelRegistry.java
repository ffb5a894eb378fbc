package com.ryuqq.docgate.core.channel;

import com.ryuqq.docgate.core.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 키 → {@link SharedKeyedChannel} 레지스트리.
 *
 * <p>watcher가 몇 명이든 키당 백엔드 live feed 구독은 정확히 한 번만 생성됩니다.</p>
 *
 * <p><strong>라이프사이클:</strong></p>
 * <pre>
 * acquire(key)      → 채널이 없으면 생성 + 구독, refCount++ , 새 뷰 반환
 * release(key)      → refCount--, 0이면 dispose + 제거 (없으면 no-op)
 * forceRelease(key) → refCount와 무관하게 즉시 dispose + 제거 (없으면 no-op)
 * disposeAll()      → 전체 dispose, 이후 acquire는 IllegalStateException
 * </pre>
 *
 * <p><strong>주의 (호출자 관리 참조 카운트):</strong> 뷰를 취소해도 카운트는 줄지 않습니다.
 * 완료된 acquire 한 번마다 release를 정확히 한 번 호출해야 합니다.</p>
 *
 * <p><strong>동시성:</strong> 채널 설치와 제거는 {@link ConcurrentHashMap}의 키 단위 원자 연산으로
 * 수행됩니다. 맵 잠금 안에서는 백엔드 호출이나 listener 호출을 하지 않습니다. 전역 잠금은 없습니다.</p>
 *
 * @param <K> 키 타입
 * @param <V> 값 타입
 * @author DocGate Team
 * @since 1.0.0
 */
public final class ChannelRegistry<K, V> {

    private static final Logger log = LoggerFactory.getLogger(ChannelRegistry.class);

    private final ConcurrentHashMap<K, SharedKeyedChannel<K, V>> channels = new ConcurrentHashMap<>();
    private final FeedOpener<K, V> opener;
    private final Result<V> bootstrap;
    private final boolean replayLastValue;
    private volatile boolean disposed;

    /**
     * 생성자 (새 뷰는 항상 bootstrap 값으로 시작).
     *
     * @param opener 채널 생성 시 백엔드 feed를 구독하는 함수
     * @param bootstrap 새 뷰의 첫 이벤트
     * @throws IllegalArgumentException opener 또는 bootstrap이 null인 경우
     */
    public ChannelRegistry(FeedOpener<K, V> opener, Result<V> bootstrap) {
        this(opener, bootstrap, false);
    }

    /**
     * 생성자.
     *
     * @param opener 채널 생성 시 백엔드 feed를 구독하는 함수
     * @param bootstrap 새 뷰의 첫 이벤트
     * @param replayLastValue true면 이미 동작 중인 채널에 붙는 뷰가 마지막 값으로 시작
     * @throws IllegalArgumentException opener 또는 bootstrap이 null인 경우
     */
    public ChannelRegistry(FeedOpener<K, V> opener, Result<V> bootstrap, boolean replayLastValue) {
        if (opener == null) {
            throw new IllegalArgumentException("opener cannot be null");
        }
        if (bootstrap == null) {
            throw new IllegalArgumentException("bootstrap cannot be null");
        }
        this.opener = opener;
        this.bootstrap = bootstrap;
        this.replayLastValue = replayLastValue;
    }

    /**
     * 채널 획득 (없으면 생성 및 구독) 후 참조 카운트 증가.
     *
     * <p>맵에는 채널 설치만 원자적으로 수행하고, 참조 카운트 증가와 뷰 연결, 백엔드 구독은
     * 맵 잠금 밖에서 수행합니다. 0까지 release되어 제거 중인 채널을 만나면 새 채널로 다시 시도합니다.</p>
     *
     * @param key 키
     * @return 새 뷰
     * @throws IllegalArgumentException key가 null인 경우
     * @throws IllegalStateException 레지스트리가 dispose된 경우
     */
    public WatchView<V> acquire(K key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }

        while (true) {
            assertNotDisposed();

            AtomicReference<SharedKeyedChannel<K, V>> created = new AtomicReference<>();
            SharedKeyedChannel<K, V> channel = channels.computeIfAbsent(key, k -> {
                SharedKeyedChannel<K, V> fresh = new SharedKeyedChannel<>(k, bootstrap, replayLastValue);
                created.set(fresh);
                return fresh;
            });

            if (channel.retain() == 0) {
                channels.remove(key, channel);
                continue;
            }
            if (disposed) {
                channels.remove(key, channel);
                channel.dispose();
                throw new IllegalStateException("ChannelRegistry is disposed");
            }

            // 구독 중 동기적으로 도착하는 이벤트도 첫 뷰가 받도록 연결 후 구독
            WatchView<V> view = channel.attach();
            if (created.get() == channel) {
                try {
                    channel.open(opener);
                } catch (RuntimeException e) {
                    channels.remove(key, channel);
                    channel.dispose();
                    throw e;
                }
                log.info("Channel opened for {}", key);
            }
            return view;
        }
    }

    /**
     * 참조 카운트 감소, 0이 되면 채널 dispose 및 제거.
     *
     * @param key 키 (없으면 no-op)
     */
    public void release(K key) {
        if (key == null) {
            return;
        }
        AtomicReference<SharedKeyedChannel<K, V>> removed = new AtomicReference<>();
        channels.computeIfPresent(key, (k, channel) -> {
            if (channel.release()) {
                removed.set(channel);
                return null;
            }
            return channel;
        });

        SharedKeyedChannel<K, V> channel = removed.get();
        if (channel != null) {
            channel.dispose();
            log.info("Channel released for {}", key);
        }
    }

    /**
     * 참조 카운트와 무관하게 채널을 즉시 dispose 및 제거.
     *
     * @param key 키 (없으면 no-op)
     */
    public void forceRelease(K key) {
        if (key == null) {
            return;
        }
        SharedKeyedChannel<K, V> channel = detach(key);
        if (channel != null) {
            channel.dispose();
            log.info("Channel force-released for {} (refCount was {})", key, channel.refCount());
        }
    }

    /**
     * 모든 채널 dispose 후 레지스트리를 종료 상태로 전환. 여러 번 호출해도 안전합니다.
     */
    public void disposeAll() {
        disposed = true;
        List<K> keys = new ArrayList<>(channels.keySet());
        for (K key : keys) {
            SharedKeyedChannel<K, V> channel = detach(key);
            if (channel != null) {
                channel.dispose();
            }
        }
        log.info("ChannelRegistry disposed: {} channels closed", keys.size());
    }

    public boolean isDisposed() {
        return disposed;
    }

    /**
     * 키의 현재 참조 카운트.
     *
     * @param key 키
     * @return 참조 카운트 (채널이 없으면 0)
     */
    public int refCount(K key) {
        SharedKeyedChannel<K, V> channel = key == null ? null : channels.get(key);
        return channel == null ? 0 : channel.refCount();
    }

    public boolean isActive(K key) {
        return key != null && channels.containsKey(key);
    }

    public int activeKeyCount() {
        return channels.size();
    }

    /**
     * 키 채널의 마지막 값 조회.
     *
     * @param key 키
     * @return 마지막 값 (채널이 없으면 empty)
     */
    public Optional<Result<V>> lastValue(K key) {
        SharedKeyedChannel<K, V> channel = key == null ? null : channels.get(key);
        return channel == null ? Optional.empty() : Optional.ofNullable(channel.lastValue());
    }

    private SharedKeyedChannel<K, V> detach(K key) {
        AtomicReference<SharedKeyedChannel<K, V>> removed = new AtomicReference<>();
        channels.computeIfPresent(key, (k, channel) -> {
            channel.retire();
            removed.set(channel);
            return null;
        });
        return removed.get();
    }

    private void assertNotDisposed() {
        if (disposed) {
            throw new IllegalStateException("ChannelRegistry is disposed");
        }
    }
}
