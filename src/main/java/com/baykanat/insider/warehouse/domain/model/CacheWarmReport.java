package com.baykanat.insider.warehouse.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/** warm çağrısının sonucu: ısıtılan sorgular ve sorgu bazında hata mesajları. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheWarmReport {

    private List<String> warmed;
    private Map<String, String> failures;

    public boolean isComplete() {
        return failures == null || failures.isEmpty();
    }
}
