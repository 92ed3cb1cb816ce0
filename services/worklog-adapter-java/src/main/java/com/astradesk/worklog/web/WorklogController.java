/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/worklog-adapter-java/src/main/java/com/astradesk/worklog/web/WorklogController.java
 * Project: AstraDesk Framework — Worklog Adapter
 * Description: REST controller for the hours-by-user worklog report.
 *              Secured via Spring Security (opaque bearer); the token is forwarded to Jira.
 * Since: 2026-10-19
 */

package com.astradesk.worklog.web;

import org.springframework.http.MediaType;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.oauth2.server.resource.authentication.BearerTokenAuthentication;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.astradesk.worklog.service.WorklogReportService;
import com.astradesk.worklog.web.dto.HoursByUserRequest;
import com.astradesk.worklog.web.dto.HoursByUserResponse;

import jakarta.validation.Valid;
import reactor.core.publisher.Mono;

/**
 * HTTP API exposed to the frontend.
 */
@RestController
@RequestMapping(path = "/api/jira", produces = MediaType.APPLICATION_JSON_VALUE)
public class WorklogController {

    private final WorklogReportService reportService;
    private final WorklogMapper worklogMapper;

    public WorklogController(WorklogReportService reportService, WorklogMapper worklogMapper) {
        this.reportService = reportService;
        this.worklogMapper = worklogMapper;
    }

    /**
     * Reports hours logged per user, acting with the caller's Atlassian token.
     *
     * @param authentication the caller's bearer token
     * @param request        filters; an absent body means "last 30 days"
     */
    @PostMapping(path = "/hours-by-user", consumes = MediaType.APPLICATION_JSON_VALUE)
    @PreAuthorize("isAuthenticated()")
    public Mono<HoursByUserResponse> hoursByUser(BearerTokenAuthentication authentication,
                                                 @Valid @RequestBody(required = false) HoursByUserRequest request) {
        String accessToken = authentication.getToken().getTokenValue();
        return reportService.hoursByUser(accessToken, worklogMapper.toQuery(request))
            .map(worklogMapper::toResponse);
    }
}
