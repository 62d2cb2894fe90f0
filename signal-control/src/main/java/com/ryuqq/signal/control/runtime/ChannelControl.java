package com.ryuqq.signal.control.runtime;

import com.ryuqq.signal.control.action.ActionManager;
import com.ryuqq.signal.control.manager.ChannelManager;
import com.ryuqq.signal.control.manager.ManagerConfig;
import com.ryuqq.signal.core.action.Action;
import com.ryuqq.signal.core.channel.Channel;
import com.ryuqq.signal.core.key.SubscriptionKey;
import com.ryuqq.signal.core.result.DispatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 이름 기반 Channel/Action 연결 Facade.
 *
 * <p>Channel과 Action을 각각 이름으로 등록한 뒤, 이름만으로 연결하고 실행합니다.
 * 호출 측은 Channel의 구체 타입을 몰라도 되며, 인자 타입은 실행 시점에 검증됩니다.</p>
 *
 * <p><strong>흐름:</strong></p>
 * <pre>
 * ChannelControl control = new ChannelControl();
 * control.channels().channel1("on-hit", int.class);
 * control.addAction(Action.of("log-hit", int.class, dmg -&gt; ...));
 *
 * control.link("on-hit", "log-hit");   // SubscriptionKey
 * control.trigger("on-hit", 10);       // baseTrigger로 실행
 * </pre>
 *
 * <p><strong>예외:</strong></p>
 * <ul>
 *   <li>알 수 없는 Channel/Action 이름 → {@link IllegalArgumentException}</li>
 *   <li>시그니처 불일치 연결 → {@link com.ryuqq.signal.core.exception.SignatureMismatchException}</li>
 *   <li>인자 타입 불일치 실행 → {@link com.ryuqq.signal.core.exception.TypeMismatchException}</li>
 * </ul>
 *
 * @author Signal Team
 * @since 1.0.0
 */
public class ChannelControl implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ChannelControl.class);

    private final ChannelManager channels;
    private final ActionManager actions;

    public ChannelControl() {
        this(new ManagerConfig());
    }

    public ChannelControl(ManagerConfig config) {
        this(new ChannelManager(config), new ActionManager());
    }

    /**
     * @param channels Channel 관리자
     * @param actions Action 관리자
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ChannelControl(ChannelManager channels, ActionManager actions) {
        if (channels == null) {
            throw new IllegalArgumentException("channels cannot be null");
        }
        if (actions == null) {
            throw new IllegalArgumentException("actions cannot be null");
        }
        this.channels = channels;
        this.actions = actions;
    }

    public ChannelManager channels() {
        return channels;
    }

    public ActionManager actions() {
        return actions;
    }

    /**
     * 외부에서 생성한 Channel 등록 (소유권 이전).
     */
    public <C extends Channel<?>> C addChannel(C channel) {
        return channels.adopt(channel);
    }

    public <F> Action<F> addAction(Action<F> action) {
        return actions.add(action);
    }

    /**
     * 이름으로 Action을 Channel에 연결.
     *
     * @param channelName Channel 이름
     * @param actionName Action 이름
     * @return 연결 키
     */
    public SubscriptionKey link(String channelName, String actionName) {
        Channel<?> channel = channels.get(channelName);
        Action<?> action = actions.get(actionName);
        SubscriptionKey key = channel.attach(action);
        log.debug("Linked action '{}' to channel '{}' as {}", actionName, channelName, key);
        return key;
    }

    public void unlink(String channelName, SubscriptionKey key) {
        channels.get(channelName).remove(key);
    }

    /**
     * void Channel 실행.
     */
    public void trigger(String channelName, Object... args) {
        channels.get(channelName).baseTrigger(args);
    }

    /**
     * 반환 Channel 실행.
     *
     * @param channelName Channel 이름
     * @param returnType 기대하는 반환 타입
     * @param args 인자
     * @return 핸들러별 결과 (위치 순서)
     */
    public <T> List<T> query(String channelName, Class<T> returnType, Object... args) {
        return channels.get(channelName).baseQuery(returnType, args);
    }

    public DispatchResult<?> dispatch(String channelName, Object... args) {
        return channels.get(channelName).dispatch(args);
    }

    /**
     * Action과 시그니처가 맞는 Channel 이름 목록.
     *
     * @param actionName Action 이름
     * @return 등록 순서대로의 Channel 이름
     */
    public List<String> compatibleChannels(String actionName) {
        Action<?> action = actions.get(actionName);
        List<String> names = new ArrayList<>();
        for (Channel<?> channel : channels.channels()) {
            if (channel.testMatch(action)) {
                names.add(channels.nameOf(channel));
            }
        }
        return names;
    }

    @Override
    public void close() {
        channels.close();
    }
}
