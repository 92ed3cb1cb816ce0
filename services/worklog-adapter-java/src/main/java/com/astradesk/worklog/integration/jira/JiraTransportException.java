package com.astradesk.worklog.integration.jira;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Any non-auth failure talking to Atlassian: a non-2xx status, a network error or a
 * timeout. {@link #getStatus()} is {@code 0} when no response was received.
 */
@ResponseStatus(HttpStatus.BAD_GATEWAY)
public class JiraTransportException extends RuntimeException {

    private final int status;
    private final String responseBody;

    public JiraTransportException(String operation, int status, String responseBody) {
        super("%s failed: %d - %s".formatted(operation, status, responseBody));
        this.status = status;
        this.responseBody = responseBody;
    }

    public JiraTransportException(String operation, Throwable cause) {
        super("%s failed: %s".formatted(operation, cause.getMessage()), cause);
        this.status = 0;
        this.responseBody = null;
    }

    public int getStatus() {
        return status;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
