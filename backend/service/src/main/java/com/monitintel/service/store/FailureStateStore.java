package com.monitintel.service.store;

import com.monitintel.core.model.FailureState;

import java.util.List;
import java.util.Optional;

public interface FailureStateStore {
    Optional<FailureState> find(String serviceName);

    /**
     * Inserts or replaces the row for {@code state.serviceName()} in one statement.
     */
    void upsert(FailureState state);

    List<FailureState> all();
}
