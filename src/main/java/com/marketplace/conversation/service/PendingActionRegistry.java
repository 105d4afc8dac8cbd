package com.marketplace.conversation.service;

import com.marketplace.conversation.model.ActionType;
import com.marketplace.conversation.model.ApprovalOutcome;
import com.marketplace.conversation.model.PendingAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Active pending actions, indexed by id and by (buyer, action type). All mutations are serialized,
 * and {@link #remove} hands an action to exactly one resolver.
 */
@Component
public class PendingActionRegistry {

    private static final int RESOLVED_HISTORY = 1000;

    private final Map<String, PendingAction> byId = new HashMap<>();
    private final Map<String, String> byTarget = new HashMap<>();
    private final Map<String, ApprovalOutcome> resolved = new LinkedHashMap<>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, ApprovalOutcome> eldest) {
            return size() > RESOLVED_HISTORY;
        }
    };

    /**
     * Adds the action and detaches any active action for the same buyer and type.
     * @return the detached action, which the caller must resolve
     */
    public synchronized Optional<PendingAction> register(PendingAction action) {
        String target = targetKey(action.getBuyerId(), action.getActionType());
        String previousId = byTarget.put(target, action.getId());
        byId.put(action.getId(), action);
        if (previousId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byId.remove(previousId));
    }

    /**
     * Detaches the action. Only the first caller for a given id gets it.
     */
    public synchronized Optional<PendingAction> remove(String actionId) {
        PendingAction action = byId.remove(actionId);
        if (action == null) {
            return Optional.empty();
        }
        String target = targetKey(action.getBuyerId(), action.getActionType());
        byTarget.remove(target, actionId);
        return Optional.of(action);
    }

    public synchronized void markResolved(String actionId, ApprovalOutcome outcome) {
        resolved.put(actionId, outcome);
    }

    public synchronized Optional<ApprovalOutcome> resolvedOutcome(String actionId) {
        return Optional.ofNullable(resolved.get(actionId));
    }

    public synchronized Optional<PendingAction> find(String actionId) {
        return Optional.ofNullable(byId.get(actionId));
    }

    public synchronized Optional<PendingAction> findActive(String buyerId, ActionType type) {
        String id = byTarget.get(targetKey(buyerId, type));
        return id == null ? Optional.empty() : Optional.ofNullable(byId.get(id));
    }

    /**
     * Oldest first.
     */
    public synchronized List<PendingAction> active() {
        List<PendingAction> actions = new ArrayList<>(byId.values());
        actions.sort(Comparator.comparingLong(PendingAction::getCreatedAt));
        return actions;
    }

    public synchronized List<String> overdueIds(long now) {
        List<String> ids = new ArrayList<>();
        for (PendingAction action : byId.values()) {
            if (action.isExpiredAt(now)) {
                ids.add(action.getId());
            }
        }
        return ids;
    }

    public synchronized int size() {
        return byId.size();
    }

    private static String targetKey(String buyerId, ActionType type) {
        return buyerId + "|" + type.name();
    }
}
