package com.baykanat.insider.warehouse.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Sorgu sonucu; cache'te de bu haliyle (fromCache=false) saklanır. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QueryResult {

    private String queryName;
    private List<Map<String, Object>> rows;
    private int rowCount;
    private int limit;
    private int offset;
    private boolean hasMore;
    private boolean fromCache;
    private QuerySource source;
    /** Hedef view hiç yenilenmemişse true; rows boştur. */
    private boolean uninitialized;
    /** View hedefli sorgularda verinin ait olduğu son refresh zamanı. */
    private Instant dataAsOf;

    /** Hiç yenilenmemiş view için boş, işaretli sonuç. */
    public static QueryResult uninitialized(String queryName, int limit, int offset) {
        return QueryResult.builder()
                .queryName(queryName)
                .rows(List.of())
                .rowCount(0)
                .limit(limit)
                .offset(offset)
                .uninitialized(true)
                .build();
    }
}
