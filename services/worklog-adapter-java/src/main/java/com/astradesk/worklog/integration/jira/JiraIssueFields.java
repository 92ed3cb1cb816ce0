package com.astradesk.worklog.integration.jira;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The subset of issue fields requested from search. The assignee is passed through
 * untouched, so it is kept as a raw JSON tree.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JiraIssueFields(String summary, JsonNode assignee, WorklogPage worklog) {
}
