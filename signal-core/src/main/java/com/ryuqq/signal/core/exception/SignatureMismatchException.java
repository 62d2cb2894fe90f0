package com.ryuqq.signal.core.exception;

/**
 * Action의 시그니처가 Channel 시그니처와 일치하지 않을 때 발생합니다.
 *
 * <p>먼저 확인하고 싶다면 {@code Channel.testMatch(Action)}을 사용하세요.</p>
 *
 * @author Signal Team
 * @since 1.0.0
 */
public class SignatureMismatchException extends SignalException {

    private final String actionName;
    private final String channelName;

    public SignatureMismatchException(String actionName, Object actionSignature,
                                      String channelName, Object channelSignature) {
        super(String.format("Action '%s' %s does not match channel '%s' %s",
            actionName, actionSignature, channelName, channelSignature));
        this.actionName = actionName;
        this.channelName = channelName;
    }

    public String getActionName() {
        return actionName;
    }

    public String getChannelName() {
        return channelName;
    }
}
