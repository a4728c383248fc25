package com.baykanat.insider.warehouse.scheduler;

/** Job yaşam döngüsü: IDLE → RUNNING → SUCCEEDED | FAILED; bitmiş job tekrar RUNNING'e geçebilir. */
public enum JobState {
    IDLE,
    RUNNING,
    SUCCEEDED,
    FAILED;

    public boolean canStart() {
        return this != RUNNING;
    }
}
