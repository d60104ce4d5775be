package courier.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for side-store operations.
 *
 * <p>Callers are responsible for closing the returned connection. A
 * {@link javax.sql.DataSource} adapts as {@code dataSource::getConnection}.
 */
@FunctionalInterface
public interface ConnectionProvider {

  /**
   * Obtains a new JDBC connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;
}
