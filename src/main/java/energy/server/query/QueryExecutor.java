package energy.server.query;

import io.vertx.core.Future;

import java.util.List;

/**
 * Runs read-only queries against the energy store.
 */
public interface QueryExecutor {

    /**
     * Execute a SELECT and return its rows in result order.
     * Non-SELECT text fails with INVALID_QUERY without touching the store;
     * driver failures fail with DATABASE_ERROR.
     */
    Future<List<ResultRow>> execute(QuerySpec query);
}
