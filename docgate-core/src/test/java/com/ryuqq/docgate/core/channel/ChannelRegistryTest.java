package com.ryuqq.docgate.core.channel;

import com.ryuqq.docgate.core.error.DatabaseErrors;
import com.ryuqq.docgate.core.result.Result;
import com.ryuqq.docgate.core.spi.FeedSubscription;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ChannelRegistry 테스트.
 *
 * <ul>
 *   <li>키당 백엔드 구독 1회</li>
 *   <li>N번 acquire + N번 release → 마지막 release에서만 취소</li>
 *   <li>forceRelease / disposeAll</li>
 * </ul>
 *
 * @author DocGate Team
 * @since 1.0.0
 */
class ChannelRegistryTest {

    private static final Result<String> BOOTSTRAP = Result.success("");

    private RecordingFeedOpener opener;
    private ChannelRegistry<String, String> registry;

    @BeforeEach
    void setUp() {
        opener = new RecordingFeedOpener();
        registry = new ChannelRegistry<>(opener, BOOTSTRAP);
    }

    @Test
    void acquire_N번_release_N번이면_구독_1회_취소_1회() {
        int watchers = 5;
        for (int i = 0; i < watchers; i++) {
            registry.acquire("doc1");
        }
        assertThat(opener.openCount("doc1")).isEqualTo(1);
        assertThat(registry.refCount("doc1")).isEqualTo(watchers);

        for (int i = 0; i < watchers - 1; i++) {
            registry.release("doc1");
            assertThat(opener.cancelCount("doc1")).isZero();
        }
        registry.release("doc1");

        assertThat(opener.cancelCount("doc1")).isEqualTo(1);
        assertThat(registry.isActive("doc1")).isFalse();
    }

    @Test
    void 두_watcher_중_하나만_release해도_둘_다_계속_받음() {
        List<Result<String>> first = new CopyOnWriteArrayList<>();
        List<Result<String>> second = new CopyOnWriteArrayList<>();
        registry.acquire("doc1").subscribe(first::add);
        registry.acquire("doc1").subscribe(second::add);

        registry.release("doc1");
        opener.push("doc1", Result.success("v1"));

        assertThat(first).containsExactly(BOOTSTRAP, Result.success("v1"));
        assertThat(second).containsExactly(BOOTSTRAP, Result.success("v1"));
        assertThat(registry.refCount("doc1")).isEqualTo(1);
    }

    @Test
    void 구독_중_동기_이벤트도_첫_뷰가_받음() {
        ChannelRegistry<String, String> eager = new ChannelRegistry<>((key, sink) -> {
            sink.accept(Result.success("initial"));
            return () -> { };
        }, BOOTSTRAP);
        List<Result<String>> events = new CopyOnWriteArrayList<>();

        eager.acquire("doc1").subscribe(events::add);

        assertThat(events).containsExactly(BOOTSTRAP, Result.success("initial"));
    }

    @Test
    void release_없는_키는_no_op() {
        registry.release("missing");
        registry.forceRelease("missing");

        assertThat(registry.activeKeyCount()).isZero();
    }

    @Test
    void release_이후_다시_acquire하면_새_구독() {
        registry.acquire("doc1");
        registry.release("doc1");

        registry.acquire("doc1");

        assertThat(opener.openCount("doc1")).isEqualTo(2);
        assertThat(registry.refCount("doc1")).isEqualTo(1);
    }

    @Test
    void forceRelease_참조_카운트와_무관하게_정리() {
        WatchView<String> view = registry.acquire("doc1");
        registry.acquire("doc1");

        registry.forceRelease("doc1");

        assertThat(opener.cancelCount("doc1")).isEqualTo(1);
        assertThat(view.isCancelled()).isTrue();
        assertThat(registry.isActive("doc1")).isFalse();
        assertThat(registry.lastValue("doc1")).isEmpty();
    }

    @Test
    void disposeAll_모든_채널_정리_이후_acquire는_IllegalStateException() {
        registry.acquire("doc1");
        registry.acquire("doc2");

        registry.disposeAll();
        registry.disposeAll();

        assertThat(opener.cancelCount("doc1")).isEqualTo(1);
        assertThat(opener.cancelCount("doc2")).isEqualTo(1);
        assertThat(registry.activeKeyCount()).isZero();
        assertThatThrownBy(() -> registry.acquire("doc1"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("disposed");
    }

    @Test
    void disposeAll_구독_취소_예외가_나도_나머지_채널을_정리() {
        ChannelRegistry<String, String> fragile = new ChannelRegistry<>((key, sink) -> () -> {
            if (key.equals("bad")) {
                throw new IllegalStateException("cancel failed");
            }
        }, BOOTSTRAP);
        WatchView<String> bad = fragile.acquire("bad");
        WatchView<String> good = fragile.acquire("good");

        fragile.disposeAll();

        assertThat(bad.isCancelled()).isTrue();
        assertThat(good.isCancelled()).isTrue();
        assertThat(fragile.activeKeyCount()).isZero();
    }

    @Test
    void lastValue_마지막_이벤트_조회() {
        registry.acquire("doc1");
        assertThat(registry.lastValue("doc1")).contains(BOOTSTRAP);

        opener.push("doc1", Result.success("v1"));

        assertThat(registry.lastValue("doc1")).contains(Result.success("v1"));
    }

    @Test
    void 동시에_acquire해도_키당_구독은_1회() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<WatchView<String>>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return registry.acquire("doc1");
                }));
            }
            start.countDown();
            for (Future<WatchView<String>> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(opener.openCount("doc1")).isEqualTo(1);
        assertThat(registry.refCount("doc1")).isEqualTo(threads);
    }

    @Test
    void 생성자_null_인자는_거부() {
        assertThatThrownBy(() -> new ChannelRegistry<String, String>(null, BOOTSTRAP))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ChannelRegistry<>(opener, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void listener가_release하는_동안_다른_스레드가_acquire해도_교착되지_않음() throws Exception {
        CountDownLatch inListener = new CountDownLatch(1);
        CountDownLatch proceed = new CountDownLatch(1);
        registry.acquire("k").subscribe(event -> {
            if (event.equals(Result.success("go"))) {
                inListener.countDown();
                try {
                    proceed.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                registry.release("k");
            }
        });
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> publisher = pool.submit(() -> opener.push("k", Result.success("go")));
            assertThat(inListener.await(5, TimeUnit.SECONDS)).isTrue();

            Future<WatchView<String>> watcher = pool.submit(() -> registry.acquire("k"));
            WatchView<String> view = watcher.get(5, TimeUnit.SECONDS);
            proceed.countDown();
            publisher.get(5, TimeUnit.SECONDS);

            assertThat(view.isCancelled()).isFalse();
            assertThat(registry.refCount("k")).isEqualTo(1);
            assertThat(opener.cancelCount("k")).isZero();
        } finally {
            proceed.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void listener가_마지막_release를_해도_채널이_정리됨() {
        WatchView<String> view = registry.acquire("doc1");
        view.subscribe(event -> {
            if (event.isFailure()) {
                registry.release("doc1");
            }
        });

        opener.push("doc1", Result.failure(DatabaseErrors.STREAM_CLOSED));

        assertThat(registry.isActive("doc1")).isFalse();
        assertThat(opener.cancelCount("doc1")).isEqualTo(1);
        assertThat(view.isCancelled()).isTrue();
    }

    @Test
    void 구독_중에_disposeAll되면_방금_얻은_구독을_취소() {
        AtomicReference<ChannelRegistry<String, String>> self = new AtomicReference<>();
        ChannelRegistry<String, String> closing = new ChannelRegistry<>((key, sink) -> {
            FeedSubscription subscription = opener.open(key, sink);
            self.get().disposeAll();
            return subscription;
        }, BOOTSTRAP);
        self.set(closing);

        WatchView<String> view = closing.acquire("doc1");

        assertThat(view.isCancelled()).isTrue();
        assertThat(opener.cancelCount("doc1")).isEqualTo(1);
        assertThat(closing.activeKeyCount()).isZero();
    }

    @Test
    void disposeAll과_동시에_acquire해도_열린_구독은_모두_취소됨() throws Exception {
        int keys = 200;
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < 4; t++) {
                int offset = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = offset; i < keys; i += 4) {
                        try {
                            registry.acquire("k" + i);
                        } catch (IllegalStateException e) {
                            return null;
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            registry.disposeAll();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(registry.activeKeyCount()).isZero();
        for (int i = 0; i < keys; i++) {
            assertThat(opener.cancelCount("k" + i)).isEqualTo(opener.openCount("k" + i));
        }
    }
}
