package com.baykanat.insider.warehouse.infrastructure.persistence;

import com.baykanat.insider.warehouse.domain.catalog.ParameterSpec;
import com.baykanat.insider.warehouse.domain.catalog.QueryCatalog;
import com.baykanat.insider.warehouse.domain.catalog.QueryDefinition;
import com.baykanat.insider.warehouse.domain.exception.ReplicaUnavailableException;
import com.baykanat.insider.warehouse.domain.exception.StatementTimeoutException;
import com.baykanat.insider.warehouse.domain.model.QuerySource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.TransactionException;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Duration;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Katalog sorgularını seçilen bağlantıda çalıştırır. Süre sınırı hem sunucu tarafında
 * (set_config statement_timeout, transaction'a lokal) hem sürücü tarafında (setQueryTimeout) uygulanır.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class WarehouseQueryJdbcRepository {

    private static final String SET_TIMEOUT_SQL = "SELECT set_config('statement_timeout', :timeout, true)";

    private final WarehouseConnections connections;

    /** En fazla fetchSize satır döner; sıralama sorgunun kendi ORDER BY'ı ile. */
    public List<Map<String, Object>> fetch(QueryDefinition query, SortedMap<String, Object> parameters,
                                           int fetchSize, int offset, Duration timeout, QuerySource source) {
        WarehouseConnections.Connection connection = connections.get(source);
        String sql = paginated(query.getSql());
        MapSqlParameterSource params = bind(query, parameters)
                .addValue(QueryCatalog.LIMIT_PARAM, fetchSize, Types.INTEGER)
                .addValue(QueryCatalog.OFFSET_PARAM, offset, Types.INTEGER);
        try {
            return connection.readOnlyTx(timeout).execute(status -> {
                connection.jdbc().queryForObject(SET_TIMEOUT_SQL,
                        Map.of("timeout", timeout.toMillis() + "ms"), String.class);
                return connection.jdbc().query(sql, params, new RowMapper());
            });
        } catch (DataAccessException | TransactionException e) {
            throw translate(query, timeout, source, e);
        }
    }

    private RuntimeException translate(QueryDefinition query, Duration timeout, QuerySource source, RuntimeException e) {
        if (SqlErrors.isTimeout(e)) {
            return new StatementTimeoutException(query.getName(), timeout, e);
        }
        if (SqlErrors.isNotPopulated(e)) {
            return new ViewNotPopulatedException(query.getName(), e);
        }
        if (source == QuerySource.REPLICA && SqlErrors.isConnectionFailure(e)) {
            return new ReplicaUnavailableException("Replica connection failed for query " + query.getName(), e);
        }
        return e;
    }

    /** Null değerler şemadaki tipiyle bağlanır; aksi halde Postgres parametre tipini çıkaramaz. */
    private MapSqlParameterSource bind(QueryDefinition query, SortedMap<String, Object> parameters) {
        MapSqlParameterSource source = new MapSqlParameterSource();
        for (ParameterSpec spec : query.getParameterSchema().getSpecs()) {
            Object value = parameters.get(spec.getName());
            if (value instanceof LocalDate date) {
                value = Date.valueOf(date);
            }
            source.addValue(spec.getName(), value, spec.getType().sqlType());
        }
        return source;
    }

    private static String paginated(String sql) {
        String trimmed = sql.strip();
        if (trimmed.endsWith(";")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed + "\nLIMIT :" + QueryCatalog.LIMIT_PARAM + " OFFSET :" + QueryCatalog.OFFSET_PARAM;
    }

    /** Sütun sırasını korur; JDBC zaman tiplerini java.time'a çevirir. */
    private static final class RowMapper extends ColumnMapRowMapper {

        @Override
        protected Map<String, Object> createColumnMap(int columnCount) {
            return new LinkedHashMap<>(columnCount * 2);
        }

        @Override
        protected Object getColumnValue(ResultSet rs, int index) throws SQLException {
            Object value = super.getColumnValue(rs, index);
            if (value instanceof Timestamp timestamp) {
                return timestamp.toInstant();
            }
            if (value instanceof Date date) {
                return date.toLocalDate();
            }
            return value;
        }
    }
}
