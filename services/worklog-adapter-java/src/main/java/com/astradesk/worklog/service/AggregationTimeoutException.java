package com.astradesk.worklog.service;

import java.time.Duration;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import com.astradesk.worklog.integration.jira.JiraTransportException;

/**
 * The aggregation as a whole ran past its deadline. In-flight Jira calls are cancelled.
 */
@ResponseStatus(HttpStatus.GATEWAY_TIMEOUT)
public class AggregationTimeoutException extends JiraTransportException {

    public AggregationTimeoutException(Duration deadline) {
        super("Worklog aggregation", 504, "Not completed within " + deadline);
    }
}
