package com.ryuqq.signal.core.handler;

import com.ryuqq.signal.core.config.FailurePolicy;
import com.ryuqq.signal.core.exception.HandlerFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 하나의 시그니처를 공유하는 핸들러의 순서 있는 집합.
 *
 * <p>목록 내 위치가 실행 순위(priority)입니다. 추가 순서대로 실행되며,
 * 중간 항목을 제거하면 뒤쪽 항목이 한 칸씩 당겨집니다.</p>
 *
 * <p><strong>실행 스냅샷:</strong></p>
 * <ul>
 *   <li>저장소는 copy-on-write 목록이므로 실행은 시작 시점의 스냅샷을 순회</li>
 *   <li>실행 중 add/remove는 다음 실행부터 반영</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> {@link #collect}는 핸들러마다 정확히 하나의 결과를 핸들러 순서대로 반환</p>
 *
 * @param <R> 핸들러 반환 타입
 * @author Signal Team
 * @since 1.0.0
 */
public final class HandlerSet<R> {

    private static final Logger log = LoggerFactory.getLogger(HandlerSet.class);

    private final String owner;
    private final List<Handler<R>> handlers = new CopyOnWriteArrayList<>();

    /**
     * @param owner 진단 메시지에 사용할 소유자 이름 (보통 Channel 이름)
     */
    public HandlerSet(String owner) {
        this.owner = owner == null ? "" : owner;
    }

    /**
     * 핸들러를 마지막 순위로 추가.
     *
     * @param handler 핸들러
     * @return 추가된 위치
     * @throws IllegalArgumentException handler가 null인 경우
     */
    public int add(Handler<R> handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        handlers.add(handler);
        return handlers.size() - 1;
    }

    /**
     * 위치의 핸들러 제거 (뒤쪽 항목은 한 칸씩 당겨짐).
     *
     * @param position 제거할 위치
     * @return 제거된 핸들러
     * @throws IllegalArgumentException position이 범위를 벗어난 경우
     */
    public Handler<R> remove(int position) {
        if (position < 0 || position >= handlers.size()) {
            throw new IllegalArgumentException(
                "position out of range: " + position + " (size: " + handlers.size() + ")");
        }
        return handlers.remove(position);
    }

    public int size() {
        return handlers.size();
    }

    public boolean isEmpty() {
        return handlers.isEmpty();
    }

    /**
     * @return 현재 핸들러 목록의 불변 스냅샷
     */
    public List<Handler<R>> snapshot() {
        return List.copyOf(handlers);
    }

    /**
     * 모든 핸들러 실행 (결과 버림).
     *
     * @param args 핸들러 인자
     * @param policy 실패 정책
     */
    public void run(Object[] args, FailurePolicy policy) {
        execute(args, policy, null);
    }

    /**
     * 모든 핸들러 실행 후 결과 수집.
     *
     * @param args 핸들러 인자
     * @param policy 실패 정책
     * @return 핸들러 순서의 결과 목록 (불변, null 원소 허용)
     */
    public List<R> collect(Object[] args, FailurePolicy policy) {
        List<R> results = new ArrayList<>(handlers.size());
        execute(args, policy, results);
        return Collections.unmodifiableList(results);
    }

    private void execute(Object[] args, FailurePolicy policy, List<R> results) {
        if (args == null) {
            throw new IllegalArgumentException("args cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }

        if (policy == FailurePolicy.FAIL_FAST) {
            for (Handler<R> handler : handlers) {
                R result = handler.invoke(args);
                if (results != null) {
                    results.add(result);
                }
            }
            return;
        }

        List<HandlerFailureException.Failure> failures = new ArrayList<>();
        int position = 0;
        for (Handler<R> handler : handlers) {
            try {
                R result = handler.invoke(args);
                if (results != null) {
                    results.add(result);
                }
            } catch (RuntimeException e) {
                log.warn("Handler at position {} failed on '{}'", position, owner, e);
                failures.add(new HandlerFailureException.Failure(position, e));
            }
            position++;
        }
        if (!failures.isEmpty()) {
            throw new HandlerFailureException(owner, failures);
        }
    }
}
