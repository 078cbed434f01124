package com.rulewise.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * What the user is asking for in a single message. Derived per message and never persisted.
 */
public record UserIntent(
    Set<String> topics,
    IntentAction action,
    Urgency urgency
) {
    public UserIntent {
        topics = topics == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(topics));
        action = action == null ? IntentAction.GENERAL : action;
        urgency = urgency == null ? Urgency.NORMAL : urgency;
    }

    public static UserIntent of(String... topics) {
        return new UserIntent(Set.of(topics), IntentAction.GENERAL, Urgency.NORMAL);
    }
}
