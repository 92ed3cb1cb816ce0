package com.astradesk.worklog.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;

/**
 * Outcome of one aggregation: per-user buckets in discovery order, plus how many issues
 * had their worklogs replaced by an empty list because the fetch failed.
 */
public record AggregationResult(Map<String, UserWorklogs> users, int degradedIssues) {

    public AggregationResult {
        users = Collections.unmodifiableMap(users);
    }

    public Collection<UserWorklogs> userWorklogs() {
        return users.values();
    }

    public AggregationResult withDegradedIssues(int count) {
        return new AggregationResult(users, count);
    }
}
