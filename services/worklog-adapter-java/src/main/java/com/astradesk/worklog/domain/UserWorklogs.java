package com.astradesk.worklog.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.astradesk.worklog.integration.jira.JiraIssue;
import com.astradesk.worklog.integration.jira.JiraWorklog;

/**
 * Running total for one user plus their worklogs, grouped by issue in the order the
 * issues were first encountered.
 */
public final class UserWorklogs {

    private final String user;
    private long totalSeconds;
    private final Map<String, IssueWorklogs> issues = new LinkedHashMap<>();

    public UserWorklogs(String user) {
        this.user = user;
    }

    public void add(JiraIssue issue, JiraWorklog worklog) {
        totalSeconds += Math.max(0, worklog.timeSpentSeconds());
        issues.computeIfAbsent(issue.key(), key -> new IssueWorklogs(issue)).add(worklog);
    }

    public String getUser() {
        return user;
    }

    public long getTotalSeconds() {
        return totalSeconds;
    }

    public Collection<IssueWorklogs> getIssues() {
        return Collections.unmodifiableCollection(issues.values());
    }

    /**
     * All of the user's worklogs, issue by issue.
     */
    public List<JiraWorklog> getWorklogs() {
        List<JiraWorklog> all = new ArrayList<>();
        issues.values().forEach(entry -> all.addAll(entry.getWorklogs()));
        return all;
    }
}
