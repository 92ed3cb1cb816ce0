package com.astradesk.worklog.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.astradesk.worklog.integration.jira.JiraIssue;
import com.astradesk.worklog.integration.jira.JiraWorklog;

/**
 * The worklogs one user logged on one issue.
 */
public final class IssueWorklogs {

    private final JiraIssue issue;
    private final List<JiraWorklog> worklogs = new ArrayList<>();

    public IssueWorklogs(JiraIssue issue) {
        this.issue = issue;
    }

    void add(JiraWorklog worklog) {
        worklogs.add(worklog);
    }

    public JiraIssue getIssue() {
        return issue;
    }

    public List<JiraWorklog> getWorklogs() {
        return Collections.unmodifiableList(worklogs);
    }
}
