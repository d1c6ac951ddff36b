package com.headspace.infrastructure.lock;

import com.headspace.domain.lock.adapter.gateway.IAdvisoryLockBackend;
import com.headspace.domain.lock.adapter.gateway.IAdvisoryLockSession;
import com.headspace.domain.lock.model.valobj.LockKey;
import com.headspace.types.enums.ResponseCode;
import com.headspace.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;

/**
 * PostgreSQL advisory lock 后端：每个会话从连接池借出一条独立连接，锁为会话级，
 * 与业务 SQL 所在的连接和事务互不影响。
 */
@Slf4j
@Component
public class PostgresAdvisoryLockBackend implements IAdvisoryLockBackend {

    /** lock_not_available：lock_timeout 触发 */
    private static final String LOCK_NOT_AVAILABLE = "55P03";

    private final DataSource dataSource;

    public PostgresAdvisoryLockBackend(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public IAdvisoryLockSession openSession() {
        try {
            Connection connection = dataSource.getConnection();
            if (!connection.getAutoCommit()) {
                connection.setAutoCommit(true);
            }
            return new JdbcLockSession(connection);
        } catch (SQLException ex) {
            throw new AppException(ResponseCode.LOCK_BACKEND_ERROR.getCode(),
                    "Failed to borrow connection for advisory lock", ex);
        }
    }

    private static final class JdbcLockSession implements IAdvisoryLockSession {

        private final Connection connection;

        private JdbcLockSession(Connection connection) {
            this.connection = connection;
        }

        @Override
        public boolean lock(LockKey key, Duration timeout) {
            applyLockTimeout(timeout);
            try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_lock(?, ?)")) {
                statement.setInt(1, key.namespace());
                statement.setInt(2, key.key());
                statement.execute();
                return true;
            } catch (SQLException ex) {
                if (LOCK_NOT_AVAILABLE.equals(ex.getSQLState())) {
                    return false;
                }
                throw new AppException(ResponseCode.LOCK_BACKEND_ERROR.getCode(),
                        "pg_advisory_lock failed. key=" + key, ex);
            } finally {
                resetLockTimeout();
            }
        }

        @Override
        public boolean tryLock(LockKey key) {
            try (PreparedStatement statement = connection.prepareStatement("SELECT pg_try_advisory_lock(?, ?)")) {
                statement.setInt(1, key.namespace());
                statement.setInt(2, key.key());
                try (ResultSet resultSet = statement.executeQuery()) {
                    return resultSet.next() && resultSet.getBoolean(1);
                }
            } catch (SQLException ex) {
                throw new AppException(ResponseCode.LOCK_BACKEND_ERROR.getCode(),
                        "pg_try_advisory_lock failed. key=" + key, ex);
            }
        }

        @Override
        public void unlock(LockKey key) {
            try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_unlock(?, ?)")) {
                statement.setInt(1, key.namespace());
                statement.setInt(2, key.key());
                try (ResultSet resultSet = statement.executeQuery()) {
                    if (resultSet.next() && !resultSet.getBoolean(1)) {
                        log.debug("Advisory unlock found no lock held. key={}", key);
                    }
                }
            } catch (SQLException ex) {
                throw new AppException(ResponseCode.LOCK_BACKEND_ERROR.getCode(),
                        "pg_advisory_unlock failed. key=" + key, ex);
            }
        }

        @Override
        public void close() {
            try {
                connection.close();
            } catch (SQLException ex) {
                throw new AppException(ResponseCode.LOCK_BACKEND_ERROR.getCode(),
                        "Failed to return advisory lock connection", ex);
            }
        }

        private void applyLockTimeout(Duration timeout) {
            try (PreparedStatement statement = connection.prepareStatement("SELECT set_config('lock_timeout', ?, false)")) {
                statement.setString(1, Math.max(timeout.toMillis(), 1L) + "ms");
                statement.execute();
            } catch (SQLException ex) {
                throw new AppException(ResponseCode.LOCK_BACKEND_ERROR.getCode(), "Failed to set lock_timeout", ex);
            }
        }

        private void resetLockTimeout() {
            try (Statement statement = connection.createStatement()) {
                statement.execute("RESET lock_timeout");
            } catch (SQLException ex) {
                log.warn("Failed to reset lock_timeout on advisory lock session. error={}", ex.getMessage());
            }
        }
    }
}
