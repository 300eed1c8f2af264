/*
 * どこで: TTL single-flight ガード
 * 何を: 専用のプール接続上でセッションレベルの PostgreSQL advisory lock を保持する
 * なぜ: ロックは個々の文より長く生き、ランナーが落ちたらセッションと共に消える必要があるため
 */
package com.example.ttl.lock;

import com.zaxxer.hikari.HikariDataSource;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "DataSource is a Spring managed shared pool and cannot be copied")
public class PostgresAdvisoryLockGuard implements SingleFlightGuard {

  private static final Logger logger = LoggerFactory.getLogger(PostgresAdvisoryLockGuard.class);

  private final DataSource dataSource;
  private final LockKeyGenerator lockKeyGenerator;
  private final ConcurrentMap<String, Connection> leases = new ConcurrentHashMap<>();

  public PostgresAdvisoryLockGuard(DataSource dataSource, LockKeyGenerator lockKeyGenerator) {
    this.dataSource = dataSource;
    this.lockKeyGenerator = lockKeyGenerator;
  }

  @Override
  public boolean tryAcquire(String name) {
    if (leases.containsKey(name)) {
      // PostgreSQL のセッションロックは再入可能なので、同一プロセス内の 2 重取得はここで拒否する。
      return false;
    }
    final long key = lockKeyGenerator.generate(name);
    Connection connection = null;
    try {
      connection = dataSource.getConnection();
      connection.setAutoCommit(true);
      if (!queryBoolean(connection, "SELECT pg_try_advisory_lock(?)", key)) {
        connection.close();
        return false;
      }
      if (leases.putIfAbsent(name, connection) != null) {
        unlockAndClose(name, key, connection);
        return false;
      }
      logger.debug("advisory lock acquired name={} key={}", name, key);
      return true;
    } catch (SQLException ex) {
      closeQuietly(connection);
      throw new DataAccessResourceFailureException("failed to acquire advisory lock " + name, ex);
    }
  }

  @Override
  public void release(String name) {
    final Connection connection = leases.remove(name);
    if (connection == null) {
      return;
    }
    unlockAndClose(name, lockKeyGenerator.generate(name), connection);
    logger.debug("advisory lock released name={}", name);
  }

  boolean holds(String name) {
    return leases.containsKey(name);
  }

  private void unlockAndClose(String name, long key, Connection connection) {
    try {
      if (!queryBoolean(connection, "SELECT pg_advisory_unlock(?)", key)) {
        logger.warn("advisory lock was not held at release name={} key={}", name, key);
      }
      connection.close();
    } catch (SQLException ex) {
      // ロックを保持したままかもしれない接続をプールに戻して他へ渡さない。
      logger.warn("advisory unlock failed, evicting connection name={} key={}", name, key, ex);
      evict(connection);
    }
  }

  private void evict(Connection connection) {
    try {
      if (dataSource.isWrapperFor(HikariDataSource.class)) {
        dataSource.unwrap(HikariDataSource.class).evictConnection(connection);
        return;
      }
    } catch (SQLException ex) {
      logger.warn("failed to unwrap pool for eviction", ex);
    }
    closeQuietly(connection);
  }

  private boolean queryBoolean(Connection connection, String sql, long key) throws SQLException {
    try (PreparedStatement statement = connection.prepareStatement(sql)) {
      statement.setLong(1, key);
      try (ResultSet rs = statement.executeQuery()) {
        return rs.next() && rs.getBoolean(1);
      }
    }
  }

  private void closeQuietly(Connection connection) {
    if (connection == null) {
      return;
    }
    try {
      connection.close();
    } catch (SQLException ex) {
      logger.warn("failed to close lock connection", ex);
    }
  }
}
