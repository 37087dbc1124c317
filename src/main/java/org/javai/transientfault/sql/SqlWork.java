package org.javai.transientfault.sql;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A unit of database work run on a connection obtained by {@link ReliableDataSource}.
 *
 * @param <T> the type of result
 */
@FunctionalInterface
public interface SqlWork<T> {

    T apply(Connection connection) throws SQLException;
}
