package org.javai.transientfault.manager;

import org.javai.transientfault.classify.ErrorClassifier;
import org.javai.transientfault.sql.AzureSqlErrorClassifier;
import org.javai.transientfault.sql.MySqlErrorClassifier;
import org.javai.transientfault.sql.OracleErrorClassifier;
import org.javai.transientfault.sql.PostgreSqlErrorClassifier;
import org.javai.transientfault.sql.SqlServerErrorClassifier;

import java.util.function.Supplier;

/**
 * The database technologies a {@link RetryManager} knows default policies for.
 *
 * <p>Each technology has two names under which a default strategy can be mapped: one for
 * commands and one for opening connections.</p>
 */
public enum Technology {

    SQL("SQL", "SQLConnection", SqlServerErrorClassifier::new),
    AZURE_SQL("AzureSql", "AzureSqlConnection", AzureSqlErrorClassifier::new),
    MYSQL("MySql", "MySqlConnection", MySqlErrorClassifier::new),
    ORACLE("Oracle", "OracleConnection", OracleErrorClassifier::new),
    NPGSQL("Npgsql", "NpgsqlConnection", PostgreSqlErrorClassifier::new);

    private final String commandName;
    private final String connectionName;
    private final Supplier<ErrorClassifier> classifierFactory;

    Technology(String commandName, String connectionName, Supplier<ErrorClassifier> classifierFactory) {
        this.commandName = commandName;
        this.connectionName = connectionName;
        this.classifierFactory = classifierFactory;
    }

    /**
     * The name under which the default command strategy is mapped, e.g. {@code "SQL"}.
     */
    public String commandName() {
        return commandName;
    }

    /**
     * The name under which the default connection strategy is mapped, e.g. {@code "SQLConnection"}.
     */
    public String connectionName() {
        return connectionName;
    }

    /**
     * Creates the error classifier for this technology.
     */
    public ErrorClassifier newErrorClassifier() {
        return classifierFactory.get();
    }
}
