package org.pgbulk.pipeline;

import java.util.Map;

/**
 * Per-row hook applied to every parsed record before column mapping.
 * <p>
 * The hook runs on the worker thread of the file it belongs to, so a blocking call
 * (a lookup in another service, say) only holds up that file. It must return exactly one
 * record for every record it receives; throwing fails the whole load.
 */
@FunctionalInterface
public interface RowParser {

    RowParser IDENTITY = row -> row;

    Map<String, Object> parse(Map<String, Object> row) throws Exception;
}
