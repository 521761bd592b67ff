package com.example.mediacache.precache;

import java.time.Duration;
import java.time.Instant;

public record PrecacheReport(
        Instant startedAt,
        Duration duration,
        PrecacheStatistics statistics
) {
}
