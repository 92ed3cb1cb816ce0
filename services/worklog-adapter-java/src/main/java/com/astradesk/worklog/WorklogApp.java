/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/worklog-adapter-java/src/main/java/com/astradesk/worklog/WorklogApp.java
 * Project: AstraDesk Framework — Worklog Adapter
 * Description: Spring Boot entrypoint for the Worklog Adapter microservice.
 * Since: 2026-10-19
 */

package com.astradesk.worklog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.astradesk.worklog.integration.props.IntegrationProperties;

/**
 * Spring Boot entry point for the AstraDesk Worklog Adapter service.
 *
 * <p>The application exposes a reactive API that reads worklogs from Jira Cloud on
 * behalf of the calling user and reports logged hours grouped by user and issue.
 * Nothing is persisted; every request goes to Jira again.</p>
 */
@SpringBootApplication
@EnableConfigurationProperties(IntegrationProperties.class)
public class WorklogApp {

    public static void main(String[] args) {
        SpringApplication.run(WorklogApp.class, args);
    }
}
