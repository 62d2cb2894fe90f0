package com.ryuqq.signal.control.action;

import com.ryuqq.signal.core.action.Action;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 이름으로 Action을 보관하는 저장소.
 *
 * @author Signal Team
 * @since 1.0.0
 */
public class ActionManager {

    private static final Logger log = LoggerFactory.getLogger(ActionManager.class);

    private final Map<String, Action<?>> actions = new LinkedHashMap<>();

    /**
     * Action 등록.
     *
     * @param action 등록할 Action
     * @return 같은 Action
     * @throws IllegalArgumentException action이 null이거나 같은 이름이 이미 있는 경우
     */
    public <F> Action<F> add(Action<F> action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (actions.containsKey(action.getName())) {
            throw new IllegalArgumentException("Action name already registered: " + action.getName());
        }
        actions.put(action.getName(), action);
        log.debug("Registered action '{}' {}", action.getName(), action.getSignature());
        return action;
    }

    /**
     * @param name Action 이름
     * @return Action
     * @throws IllegalArgumentException 등록되지 않은 이름인 경우
     */
    public Action<?> get(String name) {
        Action<?> action = actions.get(name);
        if (action == null) {
            throw new IllegalArgumentException("Unknown action: " + name);
        }
        return action;
    }

    public boolean remove(String name) {
        return actions.remove(name) != null;
    }

    public boolean contains(String name) {
        return actions.containsKey(name);
    }

    public int size() {
        return actions.size();
    }

    public List<String> names() {
        return List.copyOf(actions.keySet());
    }

    public List<Action<?>> actions() {
        return List.copyOf(actions.values());
    }
}
