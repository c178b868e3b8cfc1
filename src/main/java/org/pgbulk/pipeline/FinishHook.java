package org.pgbulk.pipeline;

import java.sql.Connection;

/**
 * Work that depends on the freshly loaded rows, such as refreshing a materialized view.
 * Called on the load's connection right before commit, so it shares the load transaction.
 */
@FunctionalInterface
public interface FinishHook {

    FinishHook NONE = connection -> {
    };

    void onFinish(Connection connection) throws Exception;
}
