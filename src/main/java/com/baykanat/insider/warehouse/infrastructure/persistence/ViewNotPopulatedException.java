package com.baykanat.insider.warehouse.infrastructure.persistence;

/** Materialized view henüz doldurulmamış (SQLState 55000); sorgu sonucu uninitialized döner. */
public class ViewNotPopulatedException extends RuntimeException {

    public ViewNotPopulatedException(String queryName, Throwable cause) {
        super("Query '" + queryName + "' reads a materialized view that has not been populated", cause);
    }
}
