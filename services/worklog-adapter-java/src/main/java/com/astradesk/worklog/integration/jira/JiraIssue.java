package com.astradesk.worklog.integration.jira;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Projection of an issue returned by {@code /search/jql}. Identity is {@link #key()}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JiraIssue(String id, String key, JiraIssueFields fields) {

    /**
     * Worklogs embedded in the search response, but only when Jira included all of them.
     * Returns {@code null} when a separate, paginated fetch is required.
     */
    public List<JiraWorklog> completeEmbeddedWorklogs() {
        if (fields == null || fields.worklog() == null || fields.worklog().worklogs() == null) {
            return null;
        }
        WorklogPage page = fields.worklog();
        return page.total() <= page.worklogs().size() ? page.worklogs() : null;
    }
}
