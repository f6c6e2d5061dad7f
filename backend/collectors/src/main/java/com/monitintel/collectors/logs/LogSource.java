package com.monitintel.collectors.logs;

import com.monitintel.core.model.LogExcerpt;
import com.monitintel.core.model.LogFetchSpec;
import com.monitintel.core.model.LogStrategy;

/**
 * One log retrieval strategy. Implementations never throw for a missing or unreadable source;
 * they return an empty {@link LogExcerpt} with a reason, and never more than
 * {@link LogFetchSpec#maxLines()} lines.
 */
public interface LogSource {
    LogStrategy strategy();

    LogExcerpt fetch(String serviceName, LogFetchSpec spec);
}
