package com.devicesync.telemetry.apply;

public enum ApplyResult {
    INSERTED,
    ALREADY_PRESENT,
    DELETED,
    ALREADY_ABSENT,
    SKIPPED
}
