package com.astradesk.worklog.integration.jira;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The access token was rejected by Atlassian, or it does not reach any Jira site with
 * the required scope. Mapped to 401 and never retried.
 */
@ResponseStatus(HttpStatus.UNAUTHORIZED)
public class JiraAuthException extends RuntimeException {

    public JiraAuthException(String message) {
        super(message);
    }
}
