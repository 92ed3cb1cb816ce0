package com.astradesk.worklog.service;

/**
 * Hooks the aggregation pipeline reports progress to. The pipeline itself never writes
 * to a log or an output stream; implementations decide what to record.
 */
public interface AggregationObserver {

    /** Observer that ignores every event. */
    AggregationObserver NONE = new AggregationObserver() {
    };

    default void issueSearchCompleted(String jql, int issueCount) {
    }

    /**
     * @param searches number of upstream searches issued
     * @param issues   distinct issues after de-duplication
     */
    default void issuesCollected(int searches, int issues) {
    }

    /**
     * A non-auth failure replaced the worklogs of {@code issueKey} with an empty list.
     */
    default void worklogFetchDegraded(String issueKey, Throwable cause) {
    }

    default void aggregationCompleted(int users, int issues, int degradedIssues) {
    }
}
