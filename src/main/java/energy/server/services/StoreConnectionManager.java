package energy.server.services;

import energy.server.config.EnergyServerConfig;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import oracle.ucp.UniversalConnectionPoolException;
import oracle.ucp.admin.UniversalConnectionPoolManager;
import oracle.ucp.admin.UniversalConnectionPoolManagerImpl;
import oracle.ucp.jdbc.PoolDataSource;
import oracle.ucp.jdbc.PoolDataSourceFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Connection pool for the energy store, built on Universal Connection Pool
 * (UCP) with the SQL Server driver's DataSource as connection factory.
 */
public class StoreConnectionManager {

    private static final String COMPONENT = "StoreConnectionManager";
    private static final String POOL_NAME = "EnergyStorePool";

    private final Vertx vertx;
    private final EnergyServerConfig config;
    private PoolDataSource poolDataSource;
    private boolean initialized = false;

    public StoreConnectionManager(Vertx vertx, EnergyServerConfig config) {
        this.vertx = vertx;
        this.config = config;
    }

    /**
     * Create the pool and check out one connection to make sure the store is reachable.
     */
    public Future<Void> initialize() {
        if (initialized) {
            return Future.succeededFuture();
        }

        return vertx.<Void>executeBlocking(() -> {
            try {
                PoolDataSource pds = PoolDataSourceFactory.getPoolDataSource();
                pds.setConnectionFactoryClassName(config.getDataSourceClass());
                pds.setConnectionPoolName(POOL_NAME);
                pds.setURL(config.getDbUrl());
                pds.setUser(config.getDbUser());
                pds.setPassword(config.getDbPassword());

                pds.setInitialPoolSize(1);
                pds.setMinPoolSize(1);
                pds.setMaxPoolSize(config.getPoolMax());
                pds.setConnectionWaitTimeout(config.getPoolWaitTimeoutSeconds());
                pds.setMaxConnectionReuseTime(config.getPoolMaxReuseSeconds());
                pds.setValidateConnectionOnBorrow(true);

                try (Connection conn = pds.getConnection()) {
                    if (!conn.isValid(5)) {
                        throw new SQLException("Connection validation failed");
                    }
                }

                poolDataSource = pds;
                initialized = true;
                LogUtil.logInfo(vertx, "Store pool initialized (max=" + config.getPoolMax() + ", waitTimeout="
                    + config.getPoolWaitTimeoutSeconds() + "s, maxReuse=" + config.getPoolMaxReuseSeconds() + "s)",
                    COMPONENT, "StartUp", "Database", true);
                return null;
            } catch (SQLException e) {
                LogUtil.logError(vertx, "Failed to initialize store pool", e, COMPONENT, "StartUp", "Database", true);
                throw new IllegalStateException("Store pool initialization failed: " + e.getMessage(), e);
            }
        }, false);
    }

    public DataSource getDataSource() {
        if (!initialized) {
            throw new IllegalStateException("StoreConnectionManager not initialized. Call initialize() first.");
        }
        return poolDataSource;
    }

    public boolean isInitialized() {
        return initialized;
    }

    public Future<Void> shutdown() {
        if (!initialized) {
            return Future.succeededFuture();
        }

        return vertx.<Void>executeBlocking(() -> {
            try {
                poolDataSource.setConnectionWaitTimeout(0);
                UniversalConnectionPoolManager mgr = UniversalConnectionPoolManagerImpl.getUniversalConnectionPoolManager();
                mgr.purgeConnectionPool(POOL_NAME);
                mgr.destroyConnectionPool(POOL_NAME);
                LogUtil.logInfo(vertx, "Store pool shut down", COMPONENT, "Shutdown", "Database", false);
            } catch (SQLException | UniversalConnectionPoolException e) {
                LogUtil.logError(vertx, "Failed to destroy store pool", e, COMPONENT, "Shutdown", "Database", true);
                throw new IllegalStateException("Failed to shutdown store pool: " + e.getMessage(), e);
            } finally {
                poolDataSource = null;
                initialized = false;
            }
            return null;
        }, false);
    }
}
