package com.astradesk.worklog.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default {@link AggregationObserver}: per-search detail at DEBUG, summaries at INFO and
 * degraded worklog fetches at WARN.
 */
@Component
public class LoggingAggregationObserver implements AggregationObserver {

    private static final Logger log = LoggerFactory.getLogger(LoggingAggregationObserver.class);

    @Override
    public void issueSearchCompleted(String jql, int issueCount) {
        log.debug("Search [{}] returned {} issues", jql, issueCount);
    }

    @Override
    public void issuesCollected(int searches, int issues) {
        log.info("Collected {} distinct issues from {} searches", issues, searches);
    }

    @Override
    public void worklogFetchDegraded(String issueKey, Throwable cause) {
        log.warn("Failed to fetch worklogs for issue {}; counting it as empty: {}", issueKey, cause.getMessage());
    }

    @Override
    public void aggregationCompleted(int users, int issues, int degradedIssues) {
        if (degradedIssues > 0) {
            log.warn("Aggregated {} users over {} issues; {} issues degraded to empty worklogs", users, issues, degradedIssues);
        } else {
            log.info("Aggregated {} users over {} issues", users, issues);
        }
    }
}
