package com.ryuqq.signal.core.exception;

import java.util.List;

/**
 * {@code FailurePolicy.CONTINUE}로 trigger한 결과, 하나 이상의 핸들러가 실패했음을 나타냅니다.
 *
 * <p>모든 핸들러가 실행된 뒤 한 번만 발생합니다. 첫 번째 실패가 cause이고,
 * 나머지 실패는 suppressed로 추가됩니다.</p>
 *
 * @author Signal Team
 * @since 1.0.0
 */
public class HandlerFailureException extends SignalException {

    private final String channelName;
    private final List<Failure> failures;

    /**
     * @param channelName 실패가 발생한 Channel 이름
     * @param failures 실패 목록 (1개 이상)
     * @throws IllegalArgumentException failures가 null이거나 비어 있는 경우
     */
    public HandlerFailureException(String channelName, List<Failure> failures) {
        super(describe(channelName, failures), firstCause(failures));
        this.channelName = channelName;
        this.failures = List.copyOf(failures);
        for (int i = 1; i < this.failures.size(); i++) {
            addSuppressed(this.failures.get(i).error());
        }
    }

    private static RuntimeException firstCause(List<Failure> failures) {
        if (failures == null || failures.isEmpty()) {
            throw new IllegalArgumentException("failures cannot be null or empty");
        }
        return failures.get(0).error();
    }

    private static String describe(String channelName, List<Failure> failures) {
        int count = failures == null ? 0 : failures.size();
        return count + " handler(s) failed on channel '" + channelName + "'";
    }

    public String getChannelName() {
        return channelName;
    }

    public List<Failure> getFailures() {
        return failures;
    }

    /**
     * 개별 핸들러 실패.
     *
     * @param position 실패한 핸들러의 실행 순위
     * @param error 핸들러가 던진 예외
     */
    public record Failure(int position, RuntimeException error) {

        public Failure {
            if (position < 0) {
                throw new IllegalArgumentException("position cannot be negative, but was: " + position);
            }
            if (error == null) {
                throw new IllegalArgumentException("error cannot be null");
            }
        }
    }
}
