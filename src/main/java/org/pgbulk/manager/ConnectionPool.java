package org.pgbulk.manager;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pgbulk.config.ConfigurationException;
import org.pgbulk.config.JobConfig;

import javax.sql.DataSource;
import java.io.Closeable;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Database connections of a job. The HikariCP pool is only built the first time a
 * connection is asked for, so a job that never loads anything never connects.
 * A {@link DataSource} handed in from outside is used as is and left open on {@link #close()}.
 */
public class ConnectionPool implements Closeable {

    private static final Logger LOG = LogManager.getLogger(ConnectionPool.class.getName());
    private static final AtomicInteger poolIdCounter = new AtomicInteger(0);

    private final JobConfig config;
    private final boolean owned;
    private DataSource dataSource;

    public ConnectionPool(JobConfig config) {
        this.config = config;
        this.owned = true;
    }

    public ConnectionPool(DataSource dataSource) {
        this.config = null;
        this.dataSource = dataSource;
        this.owned = false;
    }

    public synchronized Connection getConnection() throws SQLException {
        if (dataSource == null) {
            dataSource = createDataSource(config);
        }
        return dataSource.getConnection();
    }

    static HikariConfig hikariConfig(JobConfig config) {
        if (config.getConnect() == null || config.getConnect().isBlank())
            throw new ConfigurationException("Option connect is mandatory to open a database connection.");

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(config.getConnect());
        if (config.getUser() != null) hikariConfig.setUsername(config.getUser());
        if (config.getPassword() != null) hikariConfig.setPassword(config.getPassword());
        hikariConfig.setMaximumPoolSize(config.getPoolSize());
        hikariConfig.setMinimumIdle(0);
        hikariConfig.setAutoCommit(false);
        config.getConnectionParams().forEach((key, value) -> hikariConfig.addDataSourceProperty(key.toString(), value));
        hikariConfig.setPoolName("pgbulk-" + config.getJobName() + "-" + poolIdCounter.incrementAndGet());
        return hikariConfig;
    }

    private static DataSource createDataSource(JobConfig config) {
        HikariConfig hikariConfig = hikariConfig(config);
        LOG.log(config.isQuiet() ? Level.DEBUG : Level.INFO, "Creating connection pool {} for {} (maxPoolSize={})",
                hikariConfig.getPoolName(), config.getConnect(), hikariConfig.getMaximumPoolSize());
        return new HikariDataSource(hikariConfig);
    }

    public synchronized boolean isOpen() {
        return dataSource != null;
    }

    @Override
    public synchronized void close() {
        if (owned && dataSource instanceof HikariDataSource) {
            LOG.debug("Closing connection pool {}", ((HikariDataSource) dataSource).getPoolName());
            ((HikariDataSource) dataSource).close();
            dataSource = null;
        }
    }
}
