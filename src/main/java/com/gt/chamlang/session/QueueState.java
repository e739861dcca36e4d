package com.gt.chamlang.session;

import java.util.List;
import java.util.Optional;
import java.util.Set;

public record QueueState(List<String> pending, SessionContext context, Set<String> deferred) {

    public QueueState {
        pending = pending == null ? List.of() : List.copyOf(pending);
        context = context == null ? SessionContext.empty() : context;
        deferred = deferred == null ? Set.of() : Set.copyOf(deferred);
    }

    public static QueueState start(List<String> pending) {
        return new QueueState(pending, SessionContext.empty(), Set.of());
    }

    public Optional<String> next() {
        return pending.isEmpty() ? Optional.empty() : Optional.of(pending.get(0));
    }

    public boolean isExhausted() {
        return pending.isEmpty();
    }
}
