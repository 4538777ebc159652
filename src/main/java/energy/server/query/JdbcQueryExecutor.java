package energy.server.query;

import energy.server.errors.EnergyServiceException;
import energy.server.services.LogUtil;
import io.vertx.core.Future;
import io.vertx.core.Vertx;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link QueryExecutor} over a pooled JDBC {@link DataSource}. Each call
 * borrows one connection on a Vert.x worker thread and returns it when done.
 */
public class JdbcQueryExecutor implements QueryExecutor {

    private static final String COMPONENT = "JdbcQueryExecutor";

    private final Vertx vertx;
    private final DataSource dataSource;

    public JdbcQueryExecutor(Vertx vertx, DataSource dataSource) {
        this.vertx = vertx;
        this.dataSource = dataSource;
    }

    @Override
    public Future<List<ResultRow>> execute(QuerySpec query) {
        if (!query.isReadOnly()) {
            LogUtil.logError(vertx, "Rejected non-SELECT query: " + query.getText(), COMPONENT, "Execute", "Validation", false);
            return Future.failedFuture(EnergyServiceException.invalidQuery(query.getText()));
        }

        // SQL Server accepts a trailing semicolon but some drivers do not
        String trimmedSql = query.getText().trim();
        final String cleanSql = trimmedSql.endsWith(";") ?
            trimmedSql.substring(0, trimmedSql.length() - 1).trim() :
            trimmedSql;
        final List<Object> params = query.getParams();

        LogUtil.logDebug(vertx, "Executing " + query, COMPONENT, "Execute", "Database");

        return vertx.<List<ResultRow>>executeBlocking(() -> {
            long startTime = System.currentTimeMillis();
            try (Connection conn = dataSource.getConnection();
                 PreparedStatement stmt = conn.prepareStatement(cleanSql)) {

                for (int i = 0; i < params.size(); i++) {
                    stmt.setObject(i + 1, params.get(i));
                }

                try (ResultSet rs = stmt.executeQuery()) {
                    List<ResultRow> rows = toRows(rs);
                    LogUtil.logDetail(vertx, "Query returned " + rows.size() + " rows in "
                        + (System.currentTimeMillis() - startTime) + "ms", COMPONENT, "Execute", "Database");
                    return rows;
                }

            } catch (SQLException e) {
                throw EnergyServiceException.database("Query execution failed: " + e.getMessage(), e);
            }
        }, false);
    }

    private static List<ResultRow> toRows(ResultSet rs) throws SQLException {
        List<ResultRow> rows = new ArrayList<>();
        ResultSetMetaData metaData = rs.getMetaData();
        int columnCount = metaData.getColumnCount();

        while (rs.next()) {
            ResultRow row = new ResultRow();
            for (int i = 1; i <= columnCount; i++) {
                row.put(metaData.getColumnLabel(i), rs.getObject(i));
            }
            rows.add(row);
        }
        return rows;
    }
}
