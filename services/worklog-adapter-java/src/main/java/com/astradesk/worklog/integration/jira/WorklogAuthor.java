package com.astradesk.worklog.integration.jira;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WorklogAuthor(String accountId, String emailAddress, String displayName) {
}
