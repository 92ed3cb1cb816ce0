package com.astradesk.worklog.web.dto;

import jakarta.validation.constraints.Size;

/**
 * Payload of {@code POST /api/jira/hours-by-user}. Every field is optional.
 */
public class HoursByUserRequest {

    @Size(max = 32)
    private String dateFrom;

    @Size(max = 32)
    private String dateTo;

    @Size(max = 128)
    private String username;

    @Size(max = 4000)
    private String jql;

    @Size(max = 64)
    private String projectKey;

    public HoursByUserRequest() {
    }

    public HoursByUserRequest(String dateFrom, String dateTo, String username, String jql, String projectKey) {
        this.dateFrom = dateFrom;
        this.dateTo = dateTo;
        this.username = username;
        this.jql = jql;
        this.projectKey = projectKey;
    }

    public String getDateFrom() {
        return dateFrom;
    }

    public void setDateFrom(String dateFrom) {
        this.dateFrom = dateFrom;
    }

    public String getDateTo() {
        return dateTo;
    }

    public void setDateTo(String dateTo) {
        this.dateTo = dateTo;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getJql() {
        return jql;
    }

    public void setJql(String jql) {
        this.jql = jql;
    }

    public String getProjectKey() {
        return projectKey;
    }

    public void setProjectKey(String projectKey) {
        this.projectKey = projectKey;
    }
}
