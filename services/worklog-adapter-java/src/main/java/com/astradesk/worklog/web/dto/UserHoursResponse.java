package com.astradesk.worklog.web.dto;

import java.util.List;

import com.astradesk.worklog.integration.jira.JiraWorklog;

/**
 * Hours of one user.
 *
 * @param user     email address, or display name when Jira hides the email
 * @param hours    total hours with two decimals, e.g. {@code "1.02"}
 * @param worklogs every counted worklog of the user
 * @param issues   the same worklogs grouped by issue
 */
public record UserHoursResponse(
    String user,
    String hours,
    List<JiraWorklog> worklogs,
    List<IssueSummaryResponse> issues
) {
}
