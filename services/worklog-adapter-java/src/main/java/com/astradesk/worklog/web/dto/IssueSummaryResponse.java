package com.astradesk.worklog.web.dto;

import java.util.List;

import com.astradesk.worklog.integration.jira.JiraWorklog;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * An issue as shown under one user; {@code fields.worklog} only holds that user's worklogs.
 */
public record IssueSummaryResponse(String id, String key, Fields fields) {

    public record Fields(String summary, JsonNode assignee, List<JiraWorklog> worklog) {
    }
}
