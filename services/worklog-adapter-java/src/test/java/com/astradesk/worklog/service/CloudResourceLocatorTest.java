package com.astradesk.worklog.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.astradesk.worklog.integration.jira.AccessibleResource;
import com.astradesk.worklog.integration.jira.JiraAuthException;
import com.astradesk.worklog.integration.jira.JiraClient;
import com.astradesk.worklog.integration.jira.JiraTransportException;
import com.astradesk.worklog.integration.props.IntegrationProperties;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

@DisplayName("CloudResourceLocator")
class CloudResourceLocatorTest {

    private JiraClient jiraClient;
    private CloudResourceLocator locator;

    @BeforeEach
    void setUp() {
        jiraClient = mock(JiraClient.class);
        locator = new CloudResourceLocator(jiraClient, new IntegrationProperties());
    }

    @Test
    @DisplayName("returns the first resource granting read:jira-work")
    void shouldPickFirstMatchingResource() {
        when(jiraClient.accessibleResources("token")).thenReturn(Mono.just(List.of(
            new AccessibleResource("confluence-only", "Wiki", "https://wiki", List.of("read:confluence-content.all")),
            new AccessibleResource("cloud-1", "Acme", "https://acme.atlassian.net", List.of("read:jira-user", "read:jira-work")),
            new AccessibleResource("cloud-2", "Beta", "https://beta.atlassian.net", List.of("read:jira-work")))));

        StepVerifier.create(locator.resolveCloudId("token"))
            .expectNext("cloud-1")
            .verifyComplete();
    }

    @Test
    @DisplayName("fails with an auth error when the token reaches no resource")
    void shouldRejectEmptyResourceList() {
        when(jiraClient.accessibleResources("token")).thenReturn(Mono.just(List.of()));

        StepVerifier.create(locator.resolveCloudId("token"))
            .expectErrorSatisfies(error -> assertThat(error)
                .isInstanceOf(JiraAuthException.class)
                .hasMessageContaining("No accessible Jira resources"))
            .verify();
    }

    @Test
    @DisplayName("fails with an auth error when no resource has the required scope")
    void shouldRejectMissingScope() {
        when(jiraClient.accessibleResources("token")).thenReturn(Mono.just(List.of(
            new AccessibleResource("cloud-1", "Acme", "https://acme.atlassian.net", null))));

        StepVerifier.create(locator.resolveCloudId("token"))
            .expectError(JiraAuthException.class)
            .verify();
    }

    @Test
    @DisplayName("passes transport errors through untouched")
    void shouldPropagateTransportError() {
        when(jiraClient.accessibleResources("token"))
            .thenReturn(Mono.error(new JiraTransportException("Resolving cloudId", 503, "down")));

        StepVerifier.create(locator.resolveCloudId("token"))
            .expectError(JiraTransportException.class)
            .verify();
    }
}
