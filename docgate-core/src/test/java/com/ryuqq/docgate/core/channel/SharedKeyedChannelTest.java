package com.ryuqq.docgate.core.channel;

import com.ryuqq.docgate.core.error.DatabaseErrors;
import com.ryuqq.docgate.core.result.Result;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SharedKeyedChannel 테스트.
 *
 * @author DocGate Team
 * @since 1.0.0
 */
class SharedKeyedChannelTest {

    private static final Result<String> BOOTSTRAP = Result.success("");

    private RecordingFeedOpener opener;
    private SharedKeyedChannel<String, String> channel;

    @BeforeEach
    void setUp() {
        opener = new RecordingFeedOpener();
        channel = new SharedKeyedChannel<>("doc1", BOOTSTRAP, false);
        channel.open(opener);
    }

    @Test
    void subscribe_첫_이벤트는_bootstrap_이후_변경을_순서대로() {
        List<Result<String>> events = new CopyOnWriteArrayList<>();
        channel.attach().subscribe(events::add);

        opener.push("doc1", Result.success("v1"));
        opener.push("doc1", Result.success("v2"));

        assertThat(events).containsExactly(BOOTSTRAP, Result.success("v1"), Result.success("v2"));
        assertThat(channel.lastValue()).isEqualTo(Result.success("v2"));
    }

    @Test
    void 모든_뷰는_같은_순서로_이벤트를_받음() {
        List<Result<String>> first = new CopyOnWriteArrayList<>();
        List<Result<String>> second = new CopyOnWriteArrayList<>();
        channel.attach().subscribe(first::add);
        channel.attach().subscribe(second::add);

        opener.push("doc1", Result.success("a"));
        opener.push("doc1", Result.failure(DatabaseErrors.TIMEOUT));
        opener.push("doc1", Result.success("b"));

        assertThat(first).isEqualTo(second).hasSize(4);
    }

    @Test
    void 구독_전에_도착한_이벤트는_bootstrap_직후에_전달() {
        WatchView<String> view = channel.attach();
        opener.push("doc1", Result.success("early"));

        List<Result<String>> events = new CopyOnWriteArrayList<>();
        view.subscribe(events::add);
        opener.push("doc1", Result.success("late"));

        assertThat(events).containsExactly(BOOTSTRAP, Result.success("early"), Result.success("late"));
    }

    @Test
    void 늦게_붙은_뷰는_bootstrap부터_시작하고_이전_이력은_받지_않음() {
        opener.push("doc1", Result.success("old"));

        List<Result<String>> events = new CopyOnWriteArrayList<>();
        channel.attach().subscribe(events::add);

        assertThat(events).containsExactly(BOOTSTRAP);
    }

    @Test
    void replayLastValue면_늦게_붙은_뷰는_마지막_값부터_시작() {
        SharedKeyedChannel<String, String> replaying = new SharedKeyedChannel<>("doc2", BOOTSTRAP, true);
        replaying.open(opener);
        opener.push("doc2", Result.success("current"));

        List<Result<String>> events = new CopyOnWriteArrayList<>();
        replaying.attach().subscribe(events::add);

        assertThat(events).containsExactly(Result.success("current"));
    }

    @Test
    void 뷰_취소는_그_뷰만_멈추고_참조_카운트는_그대로() {
        List<Result<String>> cancelled = new CopyOnWriteArrayList<>();
        List<Result<String>> active = new CopyOnWriteArrayList<>();
        WatchView<String> view = channel.attach();
        view.subscribe(cancelled::add);
        channel.attach().subscribe(active::add);
        channel.retain();

        view.cancel();
        opener.push("doc1", Result.success("v1"));

        assertThat(view.isCancelled()).isTrue();
        assertThat(cancelled).containsExactly(BOOTSTRAP);
        assertThat(active).containsExactly(BOOTSTRAP, Result.success("v1"));
        assertThat(channel.refCount()).isEqualTo(1);
        assertThat(channel.viewCount()).isEqualTo(1);
    }

    @Test
    void release는_0_아래로_내려가지_않음() {
        channel.retain();
        channel.retain();

        assertThat(channel.release()).isFalse();
        assertThat(channel.release()).isTrue();
        assertThat(channel.release()).isTrue();
        assertThat(channel.refCount()).isZero();
    }

    @Test
    void dispose_구독_취소_뷰_닫기_이후_이벤트_무시() {
        List<Result<String>> events = new CopyOnWriteArrayList<>();
        WatchView<String> view = channel.attach();
        view.subscribe(events::add);

        channel.dispose();
        channel.dispose();
        opener.push("doc1", Result.success("ignored"));

        assertThat(opener.cancelCount("doc1")).isEqualTo(1);
        assertThat(view.isCancelled()).isTrue();
        assertThat(events).containsExactly(BOOTSTRAP);
        assertThat(channel.lastValue()).isNull();
        assertThat(channel.attach().isCancelled()).isTrue();
    }

    @Test
    void listener_예외는_다른_listener_전달을_막지_않음() {
        List<Result<String>> events = new CopyOnWriteArrayList<>();
        channel.attach().subscribe(value -> {
            throw new IllegalStateException("listener failure");
        });
        channel.attach().subscribe(events::add);

        opener.push("doc1", Result.success("v1"));

        assertThat(events).containsExactly(BOOTSTRAP, Result.success("v1"));
    }

    @Test
    void map_파생_뷰는_변환된_이벤트를_받고_취소를_공유() {
        List<Result<Integer>> lengths = new CopyOnWriteArrayList<>();
        WatchView<String> source = channel.attach();
        WatchView<Integer> mapped = source.map(result -> result.map(String::length));
        mapped.subscribe(lengths::add);

        opener.push("doc1", Result.success("abc"));
        mapped.cancel();

        assertThat(lengths).containsExactly(Result.success(0), Result.success(3));
        assertThat(source.isCancelled()).isTrue();
    }

    @Test
    void open_두번_호출하면_IllegalStateException() {
        assertThatThrownBy(() -> channel.open(opener))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void listener_안에서_publish해도_모든_뷰가_같은_순서로_받음() {
        List<Result<String>> first = new CopyOnWriteArrayList<>();
        List<Result<String>> second = new CopyOnWriteArrayList<>();
        channel.attach().subscribe(event -> {
            first.add(event);
            if (event.equals(Result.success("v1"))) {
                channel.publish(Result.success("v2"));
            }
        });
        channel.attach().subscribe(second::add);

        opener.push("doc1", Result.success("v1"));

        assertThat(first).containsExactly(BOOTSTRAP, Result.success("v1"), Result.success("v2"));
        assertThat(second).isEqualTo(first);
    }

    @Test
    void listener_안에서_뷰를_취소하면_남은_이벤트는_받지_않음() {
        List<Result<String>> events = new CopyOnWriteArrayList<>();
        WatchView<String> view = channel.attach();
        view.subscribe(event -> {
            events.add(event);
            if (event.equals(Result.success("v1"))) {
                view.cancel();
                channel.publish(Result.success("v2"));
            }
        });

        opener.push("doc1", Result.success("v1"));

        assertThat(events).containsExactly(BOOTSTRAP, Result.success("v1"));
        assertThat(channel.viewCount()).isZero();
    }

    @Test
    void release로_0이_된_채널은_다시_retain되지_않음() {
        channel.retain();
        channel.release();

        assertThat(channel.retain()).isZero();
        assertThat(channel.refCount()).isZero();
    }
}
