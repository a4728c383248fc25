package com.baykanat.insider.warehouse.scheduler;

import java.util.Map;

/** Tek bir job çalıştırması; her deneme attempt() çağrısıdır ve denemeler arası durum burada tutulabilir. */
@FunctionalInterface
public interface JobRun {

    /** Başarıda job detaylarını döner; exception denemeyi başarısız sayar. */
    Map<String, Object> attempt() throws Exception;
}
