package com.baykanat.insider.warehouse.domain.catalog;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/** Sorgunun okuduğu kaynak: bir aggregate view veya canlı tablolar. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class QueryTarget {

    /** Canlı tablo sorgularının cache key segmenti. */
    public static final String LIVE = "live";

    String viewName;
    List<String> tables;

    public static QueryTarget view(String viewName) {
        return new QueryTarget(viewName, List.of());
    }

    public static QueryTarget liveTables(String... tables) {
        return new QueryTarget(null, List.of(tables));
    }

    public boolean isView() {
        return viewName != null;
    }

    /** Cache key ve log'larda kullanılan hedef adı. */
    public String keySegment() {
        return isView() ? viewName : LIVE;
    }
}
