package com.baykanat.insider.warehouse.domain.model;

/** getOrCompute sonucu: değer ve cache'ten gelip gelmediği. */
public record CacheLookup<T>(T value, boolean hit) {
}
