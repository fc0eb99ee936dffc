package com.ryuqq.fanout.adapter.runner;

import com.ryuqq.fanout.core.result.TaggedResult;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * 태스크 결과 수집기 (다중 생산자 / 단일 소비자).
 *
 * <p>배치 하나에서 나올 수 있는 최대 결과 수만큼 미리 버퍼를 잡아 두므로
 * 생산자는 절대 블로킹되지 않습니다. 용량을 넘는 발행은 호출 규약 위반입니다.</p>
 *
 * <p><strong>규약:</strong></p>
 * <ul>
 *   <li>emit(): 여러 태스크 스레드에서 동시 호출 가능</li>
 *   <li>close(): 모든 생산자가 끝났음을 확인한 뒤 코디네이터만 호출</li>
 *   <li>drain(): close() 이후 한 번만 호출</li>
 * </ul>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
final class ResultCollector {

    private final BlockingQueue<TaggedResult> queue;
    private final int capacity;
    private volatile boolean closed;
    private boolean drained;

    /**
     * 생성자.
     *
     * @param capacity 버퍼 크기 (양수)
     * @throws IllegalArgumentException capacity가 양수가 아닌 경우
     */
    ResultCollector(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * 결과 발행 (논블로킹).
     *
     * @param result 발행할 결과
     * @throws IllegalArgumentException result가 null인 경우
     * @throws IllegalStateException 이미 닫혔거나 버퍼가 가득 찬 경우
     */
    void emit(TaggedResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        if (closed) {
            throw new IllegalStateException("collector is closed");
        }
        if (!queue.offer(result)) {
            throw new IllegalStateException("collector capacity exceeded (capacity: " + capacity + ")");
        }
    }

    void close() {
        closed = true;
    }

    boolean isClosed() {
        return closed;
    }

    /**
     * 수집된 결과 전부 꺼내기.
     *
     * @return 발행 순서의 결과 목록
     * @throws IllegalStateException 닫히기 전이거나 이미 drain한 경우
     */
    List<TaggedResult> drain() {
        if (!closed) {
            throw new IllegalStateException("collector must be closed before draining");
        }
        if (drained) {
            throw new IllegalStateException("collector was already drained");
        }
        drained = true;
        List<TaggedResult> results = new ArrayList<>(queue.size());
        queue.drainTo(results);
        return results;
    }

    int size() {
        return queue.size();
    }
}
