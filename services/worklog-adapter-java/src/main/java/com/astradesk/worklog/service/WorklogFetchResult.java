package com.astradesk.worklog.service;

import java.util.List;

import com.astradesk.worklog.integration.jira.JiraWorklog;

/**
 * All worklogs of one issue. {@code degraded} marks an empty list that stands in for a
 * failed fetch.
 */
public record WorklogFetchResult(String issueKey, List<JiraWorklog> worklogs, boolean degraded) {

    public static WorklogFetchResult complete(String issueKey, List<JiraWorklog> worklogs) {
        return new WorklogFetchResult(issueKey, List.copyOf(worklogs), false);
    }

    public static WorklogFetchResult degraded(String issueKey) {
        return new WorklogFetchResult(issueKey, List.of(), true);
    }
}
