package com.ryuqq.docgate.testkit;

import com.ryuqq.docgate.core.spi.FeedSubscription;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ScriptedDocumentStore 테스트.
 *
 * @author DocGate Team
 * @since 1.0.0
 */
class ScriptedDocumentStoreTest {

    private final ScriptedDocumentStore store = new ScriptedDocumentStore();

    @Test
    void read_지정한_문서가_없으면_빈_payload() {
        assertThat(store.read("c", "doc-1").join()).isEmpty();

        store.givenDocument("doc-1", Map.of("v", 1));

        assertThat(store.read("c", "doc-1").join()).containsEntry("v", 1);
        assertThat(store.readCount()).isEqualTo(2);
        assertThat(store.lastCollection()).isEqualTo("c");
    }

    @Test
    void emit_취소되지_않은_feed에만_전달() {
        RecordingFeedListener first = new RecordingFeedListener();
        RecordingFeedListener second = new RecordingFeedListener();
        FeedSubscription firstSubscription = store.watch("c", "doc-1", first);
        store.watch("c", "doc-1", second);

        firstSubscription.cancel();
        store.emit("doc-1", Map.of("v", 1));

        assertThat(first.documents()).isEmpty();
        assertThat(second.documents()).containsExactly(Map.of("v", 1));
        assertThat(store.subscribeCount("doc-1")).isEqualTo(2);
        assertThat(store.cancelCount("doc-1")).isEqualTo(1);
        assertThat(store.activeFeedCount("doc-1")).isEqualTo(1);
    }

    @Test
    void complete_feed를_종료하고_이후_이벤트는_전달되지_않음() {
        RecordingFeedListener listener = new RecordingFeedListener();
        store.watch("c", "doc-1", listener);

        store.complete("doc-1");
        store.emit("doc-1", Map.of("v", 1));

        assertThat(listener.closedCount()).isEqualTo(1);
        assertThat(listener.documents()).isEmpty();
    }

    @Test
    void failSavesWith_save_future가_실패() {
        store.failSavesWith(new IllegalStateException("boom"));

        assertThatThrownBy(() -> store.save("c", "doc-1", Map.of()).join())
            .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(store.savedInOrder()).isEmpty();
    }

    @Test
    void throwOnCall_동기적으로_예외를_던짐() {
        store.throwOnCall(new IllegalStateException("down"));

        assertThatThrownBy(() -> store.read("c", "doc-1"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("down");
    }

    @Test
    void acknowledgeSavesWith_save_응답을_변경() {
        store.acknowledgeSavesWith(payload -> Map.of("server", true));

        assertThat(store.save("c", "doc-1", Map.of("v", 1)).join()).containsEntry("server", true);
        assertThat(store.storedDocument("doc-1")).containsEntry("v", 1);
    }
}
