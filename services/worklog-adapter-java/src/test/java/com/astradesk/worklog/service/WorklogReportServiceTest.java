package com.astradesk.worklog.service;

import static com.astradesk.worklog.JiraFixtures.issue;
import static com.astradesk.worklog.JiraFixtures.issueWithEmbedded;
import static com.astradesk.worklog.JiraFixtures.worklog;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.astradesk.worklog.domain.DateRange;
import com.astradesk.worklog.domain.WorklogQuery;
import com.astradesk.worklog.integration.jira.AccessibleResource;
import com.astradesk.worklog.integration.jira.JiraAuthException;
import com.astradesk.worklog.integration.jira.JiraClient;
import com.astradesk.worklog.integration.jira.JiraTransportException;
import com.astradesk.worklog.integration.jira.WorklogPage;
import com.astradesk.worklog.integration.props.IntegrationProperties;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

/**
 * Runs the real pipeline against a mocked {@link JiraClient}.
 */
@DisplayName("WorklogReportService")
class WorklogReportServiceTest {

    private JiraClient jiraClient;
    private IntegrationProperties properties;

    @BeforeEach
    void setUp() {
        jiraClient = mock(JiraClient.class);
        properties = new IntegrationProperties();
        when(jiraClient.accessibleResources("token")).thenReturn(Mono.just(List.of(
            new AccessibleResource("cloud", "Acme", "https://acme.atlassian.net", List.of("read:jira-work")))));
        when(jiraClient.searchIssues(anyString(), eq("token"), eq("cloud"))).thenReturn(Mono.just(List.of()));
    }

    private WorklogReportService service() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-15T10:00:00Z"), ZoneOffset.UTC);
        AggregationObserver observer = AggregationObserver.NONE;
        JqlBuilder jqlBuilder = new JqlBuilder(clock, properties);
        IssueSearchClient searchClient = new IssueSearchClient(jiraClient, observer);
        return new WorklogReportService(
            new CloudResourceLocator(jiraClient, properties),
            jqlBuilder,
            searchClient,
            new RangeSplitIssueFetcher(jqlBuilder, searchClient, observer, properties),
            new WorklogFetcher(jiraClient, observer, properties),
            new WorklogAggregator(properties),
            observer,
            properties
        );
    }

    private static WorklogQuery query(String from, String to, String username) {
        return new WorklogQuery(Optional.empty(), DateRange.of(from, to), Optional.ofNullable(username), Optional.empty());
    }

    @Nested
    @DisplayName("Issue collection")
    class IssueCollection {

        @Test
        @DisplayName("splits a closed range into one search per day of the widened window")
        void shouldSplitClosedRange() {
            StepVerifier.create(service().hoursByUser("token", query("2024-01-10", "2024-01-11", null)))
                .assertNext(result -> assertThat(result.users()).isEmpty())
                .verifyComplete();

            verify(jiraClient, times(16)).searchIssues(anyString(), eq("token"), eq("cloud"));
        }

        @Test
        @DisplayName("runs a single expanded search when only one date is given")
        void shouldSearchOnceForOpenRange() {
            StepVerifier.create(service().hoursByUser("token", query("2024-01-10", null, null)))
                .expectNextCount(1)
                .verifyComplete();

            ArgumentCaptor<String> jql = ArgumentCaptor.forClass(String.class);
            verify(jiraClient, times(1)).searchIssues(jql.capture(), eq("token"), eq("cloud"));
            assertThat(jql.getValue()).startsWith("worklogDate >= \"2023-12-11\"");
        }

        @Test
        @DisplayName("normalizes European dates before planning")
        void shouldNormalizeDates() {
            StepVerifier.create(service().hoursByUser("token", query("10/01/2024", "10-01-2024", null)))
                .expectNextCount(1)
                .verifyComplete();

            verify(jiraClient, times(15)).searchIssues(anyString(), eq("token"), eq("cloud"));
        }

        @Test
        @DisplayName("rejects an unparseable date before calling Jira")
        void shouldRejectInvalidDate() {
            StepVerifier.create(service().hoursByUser("token", query("last monday", "2024-01-10", null)))
                .expectError(InvalidDateException.class)
                .verify();

            verify(jiraClient, never()).accessibleResources(anyString());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("keeps sibling issues when one worklog fetch fails and reports it as degraded")
        void shouldDegradeSingleIssue() {
            when(jiraClient.searchIssues(anyString(), eq("token"), eq("cloud"))).thenReturn(Mono.just(List.of(
                issueWithEmbedded("OPS-1", 1, worklog("acc-1", "ann@example.com", 3600, "2024-01-10")),
                issue("OPS-2"),
                issueWithEmbedded("OPS-3", 1, worklog("acc-2", "bob@example.com", 1800, "2024-01-10")))));
            when(jiraClient.worklogPage(eq("OPS-2"), anyInt(), anyInt(), anyString(), anyString()))
                .thenReturn(Mono.error(new JiraTransportException("Worklog fetch for OPS-2", 500, "boom")));

            StepVerifier.create(service().hoursByUser("token", query("2024-01-10", "2024-01-10", null)))
                .assertNext(result -> {
                    assertThat(result.users().keySet()).containsExactly("ann@example.com", "bob@example.com");
                    assertThat(result.users().get("ann@example.com").getTotalSeconds()).isEqualTo(3600);
                    assertThat(result.degradedIssues()).isEqualTo(1);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("aborts when a worklog fetch is rejected as unauthorized")
        void shouldAbortOnAuthError() {
            when(jiraClient.searchIssues(anyString(), eq("token"), eq("cloud"))).thenReturn(Mono.just(List.of(issue("OPS-1"))));
            when(jiraClient.worklogPage(anyString(), anyInt(), anyInt(), anyString(), anyString()))
                .thenReturn(Mono.error(new JiraAuthException("Invalid or expired access token")));

            StepVerifier.create(service().hoursByUser("token", query(null, null, null)))
                .expectError(JiraAuthException.class)
                .verify();
        }

        @Test
        @DisplayName("aborts when the issue search fails")
        void shouldAbortOnSearchFailure() {
            when(jiraClient.searchIssues(anyString(), eq("token"), eq("cloud")))
                .thenReturn(Mono.error(new JiraTransportException("Issue search", 400, "bad jql")));

            StepVerifier.create(service().hoursByUser("token", query(null, null, null)))
                .expectError(JiraTransportException.class)
                .verify();
        }

        @Test
        @DisplayName("fails with a timeout error once the overall deadline passes")
        void shouldEnforceDeadline() {
            properties.getAggregation().setTimeout(Duration.ofMillis(50));
            when(jiraClient.searchIssues(anyString(), eq("token"), eq("cloud"))).thenReturn(Mono.never());

            StepVerifier.create(service().hoursByUser("token", query(null, null, null)))
                .expectError(AggregationTimeoutException.class)
                .verify(Duration.ofSeconds(5));
        }
    }

    @Test
    @DisplayName("returns an empty aggregation when the user filter matches no author")
    void shouldReturnEmptyForUnknownUser() {
        when(jiraClient.searchIssues(anyString(), eq("token"), eq("cloud"))).thenReturn(Mono.just(List.of(
            issueWithEmbedded("OPS-1", 1, worklog("acc-1", "ann@example.com", 3600, "2024-01-10")))));

        StepVerifier.create(service().hoursByUser("token", query(null, null, "acc-404")))
            .assertNext(result -> {
                assertThat(result.users()).isEmpty();
                assertThat(result.degradedIssues()).isZero();
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("fetches remaining worklog pages for issues with partial embedded worklogs")
    void shouldFetchMissingWorklogs() {
        when(jiraClient.searchIssues(anyString(), eq("token"), eq("cloud"))).thenReturn(Mono.just(List.of(
            issueWithEmbedded("OPS-1", 2, worklog("acc-1", "ann@example.com", 60, "2024-01-10")))));
        when(jiraClient.worklogPage("OPS-1", 0, 1000, "token", "cloud")).thenReturn(Mono.just(new WorklogPage(0, 1000, 2, List.of(
            worklog("acc-1", "ann@example.com", 60, "2024-01-10"),
            worklog("acc-1", "ann@example.com", 3601, "2024-01-11")))));

        StepVerifier.create(service().hoursByUser("token", query(null, null, null)))
            .assertNext(result -> assertThat(result.users().get("ann@example.com").getTotalSeconds()).isEqualTo(3661))
            .verifyComplete();
    }
}
