package com.ryuqq.docgate.core.executor;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 키 단위 FIFO 비동기 작업 실행자.
 *
 * <p>같은 키로 제출된 작업은 제출 순서대로 하나씩 실행되고,
 * 서로 다른 키의 작업은 순서 보장 없이 동시에 실행될 수 있습니다.</p>
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>같은 키: 제출 순서대로 실행, 실행 구간이 겹치지 않음</li>
 *   <li>다른 키: 서로를 기다리지 않음</li>
 *   <li>각 호출자는 자기 작업의 결과(값 또는 예외)만 받음</li>
 *   <li>실패한 작업(동기 예외, 실패한 stage, null stage)이 뒤 작업을 막지 않음</li>
 * </ul>
 *
 * <p><strong>동작 방식:</strong></p>
 * <pre>
 * withLock(key, action)
 *   ↓
 * 키의 대기열에 추가          → 실행 중인 작업이 없으면 호출 스레드가 drain 시작
 *   ↓
 * drain: 작업 하나 실행 → 결과를 호출자 future에 전달 → 다음 작업
 *   ↓
 * 대기열이 비면 키 제거
 * </pre>
 *
 * <p>이미 완료된 stage를 반환하는 작업은 drain 반복문 안에서 이어서 처리되므로,
 * 한 키에 작업이 아무리 많이 쌓여도 호출 스택이 깊어지지 않습니다.
 * 호출자에게 반환되는 future는 action의 실제 결과입니다.</p>
 *
 * <p><strong>주의 (재진입 불가):</strong> 실행 중인 action 안에서 <strong>같은 키</strong>로
 * {@code withLock}을 호출하면 교착 상태가 됩니다. 다른 키로의 중첩 호출은 허용됩니다.</p>
 *
 * <p><strong>dispose:</strong> 대기열을 비우고 이후 호출은 체인 없이 즉시 실행됩니다
 * (진행 중인 작업과 겹칠 수 있음). 진행 중인 작업은 취소하지도 기다리지도 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * KeyedFifoExecutor&lt;String&gt; executor = new KeyedFifoExecutor&lt;&gt;();
 *
 * CompletableFuture&lt;String&gt; saved = executor.withLock(userId, () -&gt; store.save(...));
 * </pre>
 *
 * @param <K> 키 타입 (안정적인 equals/hashCode 필요)
 * @author DocGate Team
 * @since 1.0.0
 */
public final class KeyedFifoExecutor<K> {

    private final ConcurrentHashMap<K, KeyQueue> queues = new ConcurrentHashMap<>();
    private volatile boolean disposed;

    /**
     * 키의 이전 작업들이 모두 끝난 뒤 action을 실행합니다.
     *
     * @param key 직렬화 범위를 정하는 키
     * @param action 실행할 비동기 작업
     * @param <R> 결과 타입
     * @return action의 실제 결과 (실패 시 예외로 완료)
     * @throws IllegalArgumentException key 또는 action이 null인 경우
     */
    public <R> CompletableFuture<R> withLock(K key, Supplier<? extends CompletionStage<R>> action) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }

        if (disposed) {
            return invoke(action);
        }

        Task<R> task = new Task<>(action);
        while (true) {
            KeyQueue queue = queues.computeIfAbsent(key, k -> new KeyQueue());
            boolean start;
            synchronized (queue) {
                if (queue.retired) {
                    // 방금 비워져 제거된 큐, 새 큐로 다시 시도
                    continue;
                }
                queue.tasks.add(task);
                start = !queue.running;
                queue.running = true;
            }
            if (start) {
                drain(key, queue);
            }
            return task.result;
        }
    }

    /**
     * 대기열을 비우고 이후 호출의 체인을 중단합니다.
     *
     * <p>진행 중인 작업과 이미 대기 중인 작업은 취소되지 않고 순서대로 끝까지 실행됩니다.
     * 여러 번 호출해도 안전합니다.</p>
     */
    public void dispose() {
        disposed = true;
        queues.clear();
    }

    /**
     * dispose 여부 확인.
     *
     * @return dispose된 경우 true
     */
    public boolean isDisposed() {
        return disposed;
    }

    /**
     * 아직 정리되지 않은 키 수 (실행 중이거나 대기 중인 작업이 있는 키).
     *
     * @return 키 수
     */
    public int pendingKeyCount() {
        return queues.size();
    }

    /**
     * 큐의 작업을 하나씩 실행합니다. 동기적으로 끝난 작업은 반복문으로 이어서 처리하고,
     * 아직 끝나지 않은 작업은 완료 시점에 다시 drain을 시작합니다. 작업 수와 무관하게
     * 호출 스택 깊이는 일정합니다.
     */
    private void drain(K key, KeyQueue queue) {
        while (true) {
            Task<?> next;
            synchronized (queue) {
                next = queue.tasks.poll();
                if (next == null) {
                    queue.running = false;
                    queue.retired = true;
                    queues.remove(key, queue);
                    return;
                }
            }

            CompletableFuture<Void> settled = next.run();
            if (!settled.isDone()) {
                settled.whenComplete((ignored, error) -> drain(key, queue));
                return;
            }
        }
    }

    /**
     * action을 호출하고 동기 예외와 null stage를 실패한 future로 변환합니다.
     */
    private static <R> CompletableFuture<R> invoke(Supplier<? extends CompletionStage<R>> action) {
        try {
            CompletionStage<R> stage = action.get();
            if (stage == null) {
                return CompletableFuture.failedFuture(new NullPointerException("action returned null stage"));
            }
            return stage.toCompletableFuture();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    /**
     * 키 하나의 대기열. 필드는 큐 모니터 안에서만 접근합니다.
     */
    private static final class KeyQueue {

        private final Queue<Task<?>> tasks = new ArrayDeque<>();
        private boolean running;
        private boolean retired;
    }

    /**
     * 대기 중인 작업 하나와 그 호출자의 future.
     */
    private static final class Task<R> {

        private final Supplier<? extends CompletionStage<R>> action;
        private final CompletableFuture<R> result = new CompletableFuture<>();

        Task(Supplier<? extends CompletionStage<R>> action) {
            this.action = action;
        }

        /**
         * action을 실행하고, 결과를 호출자의 future에 전달한 뒤 완료되는 future를 반환합니다.
         * 반환된 future는 항상 정상 완료됩니다.
         */
        CompletableFuture<Void> run() {
            return invoke(action).handle((value, error) -> {
                if (error != null) {
                    result.completeExceptionally(unwrap(error));
                } else {
                    result.complete(value);
                }
                return null;
            });
        }
    }
}
