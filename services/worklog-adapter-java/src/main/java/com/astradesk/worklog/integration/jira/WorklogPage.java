package com.astradesk.worklog.integration.jira;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One page of an issue's worklogs, as returned both by the worklog endpoint and
 * embedded in search results.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorklogPage(int startAt, int maxResults, int total, List<JiraWorklog> worklogs) {
}
