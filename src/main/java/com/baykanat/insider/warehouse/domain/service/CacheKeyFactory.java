package com.baykanat.insider.warehouse.domain.service;

import com.baykanat.insider.warehouse.domain.catalog.QueryDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;

/**
 * Cache key üretimi: {@code <prefix>:<hedef>:<sorgu>:<sha256>}. Hash, isme göre sıralı parametreler ile
 * limit/offset'in kanonik JSON'undan hesaplanır; parametre sırası key'i değiştirmez.
 */
public class CacheKeyFactory {

    private final ObjectMapper canonicalMapper;
    private final String keyPrefix;

    public CacheKeyFactory(ObjectMapper objectMapper, String keyPrefix) {
        this.canonicalMapper = objectMapper.copy()
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.keyPrefix = keyPrefix;
    }

    public String key(QueryDefinition query, SortedMap<String, Object> parameters, int limit, int offset) {
        return queryPrefix(query) + sha256(canonicalJson(parameters, limit, offset));
    }

    /** View'ı okuyan tüm sorguların kayıtları. */
    public String viewPrefix(String viewName) {
        return keyPrefix + ":" + viewName + ":";
    }

    /** Tek sorgunun tüm parametre/sayfa kombinasyonları. */
    public String queryPrefix(QueryDefinition query) {
        return keyPrefix + ":" + query.getTarget().keySegment() + ":" + query.getName() + ":";
    }

    public String rootPrefix() {
        return keyPrefix + ":";
    }

    String canonicalJson(SortedMap<String, Object> parameters, int limit, int offset) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("parameters", parameters);
        document.put("limit", limit);
        document.put("offset", offset);
        try {
            return canonicalMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Parameters are not serializable", e);
        }
    }

    private String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
