package com.baykanat.insider.warehouse.scheduler;

/** JobOrchestrator'ın çalıştırdığı zamanlanmış iş. */
public interface WarehouseJob {

    String name();

    JobRun newRun();
}
