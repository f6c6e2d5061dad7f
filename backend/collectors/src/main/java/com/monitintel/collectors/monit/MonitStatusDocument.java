package com.monitintel.collectors.monit;

import java.util.List;

/**
 * Parse result. {@code valid == false} means the whole document was rejected and the tick is
 * abandoned; {@code rejected} lists individual service entries that were skipped.
 */
public record MonitStatusDocument(
        boolean valid,
        List<MonitServiceEntry> services,
        List<String> rejected,
        String error
) {
    public MonitStatusDocument {
        services = services == null ? List.of() : List.copyOf(services);
        rejected = rejected == null ? List.of() : List.copyOf(rejected);
    }

    static MonitStatusDocument invalid(String error) {
        return new MonitStatusDocument(false, List.of(), List.of(), error);
    }
}
