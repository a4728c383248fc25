package com.baykanat.insider.warehouse.infrastructure.persistence;

import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionTimedOutException;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;

/** Sürücü/Spring exception zincirinin sınıflandırılması. */
final class SqlErrors {

    static final String QUERY_CANCELED = "57014";
    static final String OBJECT_NOT_IN_PREREQUISITE_STATE = "55000";
    private static final String CONNECTION_EXCEPTION_CLASS = "08";

    private SqlErrors() {
    }

    static boolean isTimeout(Throwable error) {
        for (Throwable t = error; t != null; t = next(t)) {
            if (t instanceof QueryTimeoutException || t instanceof TransactionTimedOutException
                    || t instanceof SQLTimeoutException) {
                return true;
            }
            if (t instanceof SQLException sql && QUERY_CANCELED.equals(sql.getSQLState())) {
                return true;
            }
        }
        return false;
    }

    static boolean isNotPopulated(Throwable error) {
        for (Throwable t = error; t != null; t = next(t)) {
            if (t instanceof SQLException sql && OBJECT_NOT_IN_PREREQUISITE_STATE.equals(sql.getSQLState())) {
                return true;
            }
        }
        return false;
    }

    /** Bağlantı alınamadı veya bağlantı koptu. */
    static boolean isConnectionFailure(Throwable error) {
        for (Throwable t = error; t != null; t = next(t)) {
            if (t instanceof CannotGetJdbcConnectionException || t instanceof CannotCreateTransactionException
                    || t instanceof SQLTransientConnectionException) {
                return true;
            }
            if (t instanceof SQLException sql && sql.getSQLState() != null
                    && sql.getSQLState().startsWith(CONNECTION_EXCEPTION_CLASS)) {
                return true;
            }
        }
        return false;
    }

    private static Throwable next(Throwable t) {
        return t.getCause() == t ? null : t.getCause();
    }
}
