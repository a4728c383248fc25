package com.baykanat.insider.warehouse.infrastructure.persistence;

import com.baykanat.insider.warehouse.domain.model.QuerySource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/** Primary ve (varsa) replica havuzları. */
public class WarehouseConnections {

    private final Map<QuerySource, Connection> connections = new EnumMap<>(QuerySource.class);

    public WarehouseConnections(DataSource primary, DataSource replica) {
        connections.put(QuerySource.PRIMARY, new Connection(primary));
        if (replica != null) {
            connections.put(QuerySource.REPLICA, new Connection(replica));
        }
    }

    public boolean hasReplica() {
        return connections.containsKey(QuerySource.REPLICA);
    }

    public Connection primary() {
        return connections.get(QuerySource.PRIMARY);
    }

    public Optional<Connection> replica() {
        return Optional.ofNullable(connections.get(QuerySource.REPLICA));
    }

    public Connection get(QuerySource source) {
        Connection connection = connections.get(source);
        if (connection == null) {
            throw new IllegalStateException("No " + source.value() + " connection configured");
        }
        return connection;
    }

    /** Tek bir havuz üzerindeki JDBC erişimi. */
    public static final class Connection {

        private final NamedParameterJdbcTemplate jdbc;
        private final DataSourceTransactionManager transactionManager;

        Connection(DataSource dataSource) {
            this.jdbc = new NamedParameterJdbcTemplate(dataSource);
            this.transactionManager = new DataSourceTransactionManager(dataSource);
        }

        public NamedParameterJdbcTemplate jdbc() {
            return jdbc;
        }

        /** Read-only transaction; süre transaction timeout olarak her statement'a setQueryTimeout ile uygulanır. */
        public TransactionTemplate readOnlyTx(Duration timeout) {
            TransactionTemplate template = new TransactionTemplate(transactionManager);
            template.setReadOnly(true);
            template.setTimeout((int) Math.max(1, (timeout.toMillis() + 999) / 1000));
            return template;
        }
    }
}
