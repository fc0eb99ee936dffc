package com.ryuqq.fanout.core.context;

import com.ryuqq.fanout.core.error.CancelledException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 취소 가능한 실행 컨텍스트.
 *
 * <p>배치 하나의 모든 태스크는 호출자 컨텍스트의 자식 컨텍스트 하나를 공유합니다.
 * 최초 태스크 오류가 자식 컨텍스트를 취소하면, 진행 중인 형제 태스크의 원격 호출은
 * 이를 협조적으로 관찰하고 빠르게 실패합니다.</p>
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>취소는 한 번만 일어나며, 최초 원인(cause)만 보존됩니다.</li>
 *   <li>부모가 취소되면 자식도 같은 원인으로 취소됩니다. 역방향 전파는 없습니다.</li>
 *   <li>리스너는 정확히 한 번 실행되며, 이미 취소된 컨텍스트에 등록하면 즉시 실행됩니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (CancellationContext group = callerContext.child()) {
 *     // 태스크에 group 전달
 *     group.cancel(firstError);
 * }
 * </pre>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public final class CancellationContext implements AutoCloseable {

    private final AtomicReference<Throwable> cause = new AtomicReference<>();
    private final List<Runnable> listeners = new ArrayList<>();
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final CancellationContext parent;
    private final Runnable parentListener;

    private CancellationContext(CancellationContext parent) {
        this.parent = parent;
        if (parent == null) {
            this.parentListener = null;
        } else {
            this.parentListener = () -> cancel(parent.cause());
            parent.onCancel(parentListener);
        }
    }

    /**
     * 새 루트 컨텍스트 생성.
     *
     * @return 취소되지 않은 루트 컨텍스트
     */
    public static CancellationContext create() {
        return new CancellationContext(null);
    }

    /**
     * 자식 컨텍스트 생성.
     *
     * <p>부모가 이미 취소되었다면 자식은 생성 즉시 취소 상태입니다.</p>
     *
     * @return 자식 컨텍스트
     */
    public CancellationContext child() {
        return new CancellationContext(this);
    }

    /**
     * 컨텍스트 취소.
     *
     * @param reason 취소 원인 (null이면 일반 취소)
     * @return 이번 호출로 취소되었으면 true, 이미 취소되어 있었으면 false
     */
    public boolean cancel(Throwable reason) {
        Throwable effective = reason != null ? reason : new CancelledException("context cancelled");
        if (!cause.compareAndSet(null, effective)) {
            return false;
        }
        cancelled.countDown();
        List<Runnable> snapshot;
        synchronized (listeners) {
            snapshot = new ArrayList<>(listeners);
            listeners.clear();
        }
        for (Runnable listener : snapshot) {
            listener.run();
        }
        return true;
    }

    public boolean isCancelled() {
        return cause.get() != null;
    }

    /**
     * 취소 원인 조회.
     *
     * @return 최초 취소 원인, 취소되지 않았으면 null
     */
    public Throwable cause() {
        return cause.get();
    }

    /**
     * 취소 리스너 등록.
     *
     * <p>이미 취소된 경우 호출 스레드에서 즉시 실행됩니다.</p>
     *
     * @param listener 취소 시 실행할 작업
     * @throws IllegalArgumentException listener가 null인 경우
     */
    public void onCancel(Runnable listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        synchronized (listeners) {
            if (!isCancelled()) {
                listeners.add(listener);
                return;
            }
        }
        listener.run();
    }

    /**
     * 취소 리스너 해제.
     *
     * @param listener 등록했던 리스너
     */
    public void removeListener(Runnable listener) {
        synchronized (listeners) {
            listeners.remove(listener);
        }
    }

    /**
     * 취소될 때까지 대기.
     *
     * @param timeout 최대 대기 시간
     * @param unit 시간 단위
     * @return 시간 내 취소되었으면 true
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public boolean awaitCancellation(long timeout, TimeUnit unit) throws InterruptedException {
        return cancelled.await(timeout, unit);
    }

    /**
     * 취소된 경우 {@link CancelledException}을 던집니다.
     *
     * @throws CancelledException 컨텍스트가 취소된 경우 (cause는 취소 원인)
     */
    public void throwIfCancelled() throws CancelledException {
        Throwable reason = cause.get();
        if (reason != null) {
            throw new CancelledException("context was cancelled: " + reason.getMessage(), reason);
        }
    }

    /**
     * 부모와의 연결을 끊고, 아직 취소되지 않았다면 컨텍스트를 닫힘 상태로 취소합니다.
     */
    @Override
    public void close() {
        if (parent != null) {
            parent.removeListener(parentListener);
        }
        cancel(new CancelledException("context closed"));
    }
}
