package com.astradesk.worklog.integration.jira;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A single time entry. {@code started} is when the work was performed and drives
 * aggregation; {@code created} is only when the entry was recorded in Jira.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JiraWorklog(
    String id,
    WorklogAuthor author,
    long timeSpentSeconds,
    String started,
    String created
) {
}
