package com.monitintel.service.support;

import com.monitintel.core.model.FailureState;
import com.monitintel.service.store.FailureStateStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

public class InMemoryFailureStateStore implements FailureStateStore {
    private final Map<String, FailureState> states = new TreeMap<>();
    private boolean failWrites;

    public synchronized void failWrites(boolean fail) {
        this.failWrites = fail;
    }

    @Override
    public synchronized Optional<FailureState> find(String serviceName) {
        return Optional.ofNullable(states.get(serviceName));
    }

    @Override
    public synchronized void upsert(FailureState state) {
        if (failWrites) {
            throw new IllegalStateException("Failed storing failure state for " + state.serviceName());
        }
        states.put(state.serviceName(), state);
    }

    @Override
    public synchronized List<FailureState> all() {
        return new ArrayList<>(states.values());
    }
}
