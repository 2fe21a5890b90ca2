package com.example.reminderscheduler.service.scheduler;

import lombok.Value;

import java.time.Instant;
import java.util.Comparator;

/**
 * A job id and the instant it is due, ordered by time then id.
 */
@Value
public class DueEntry implements Comparable<DueEntry> {

    private static final Comparator<DueEntry> ORDER = Comparator
            .comparing(DueEntry::getDueAt)
            .thenComparing(DueEntry::getJobId);

    String jobId;
    Instant dueAt;

    @Override
    public int compareTo(DueEntry other) {
        return ORDER.compare(this, other);
    }
}
