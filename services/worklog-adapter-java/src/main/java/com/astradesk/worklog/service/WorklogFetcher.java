package com.astradesk.worklog.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.springframework.stereotype.Service;

import com.astradesk.worklog.integration.jira.JiraAuthException;
import com.astradesk.worklog.integration.jira.JiraClient;
import com.astradesk.worklog.integration.jira.JiraIssue;
import com.astradesk.worklog.integration.jira.JiraWorklog;
import com.astradesk.worklog.integration.jira.WorklogPage;
import com.astradesk.worklog.integration.props.IntegrationProperties;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Loads the complete worklog list of issues.
 *
 * <p>Partial-failure policy: an auth rejection aborts the whole aggregation, any other
 * failure only empties the worklogs of the affected issue.</p>
 */
@Service
public class WorklogFetcher {

    private final JiraClient jiraClient;
    private final AggregationObserver observer;
    private final int pageSize;
    private final int concurrency;

    public WorklogFetcher(JiraClient jiraClient, AggregationObserver observer, IntegrationProperties properties) {
        this.jiraClient = jiraClient;
        this.observer = observer;
        this.pageSize = properties.getAggregation().getWorklogPageSize();
        this.concurrency = properties.getAggregation().getWorklogConcurrency();
    }

    /**
     * Fetches worklogs for every issue in batches of the configured concurrency. A batch
     * starts only once every fetch of the previous batch has finished.
     *
     * @return results keyed by issue key, in issue order
     */
    public Mono<Map<String, WorklogFetchResult>> fetchAll(List<JiraIssue> issues, String accessToken, String cloudId) {
        return Flux.fromIterable(issues)
            .buffer(concurrency)
            .concatMap(batch -> Flux.fromIterable(batch)
                .flatMapSequential(issue -> fetch(issue, accessToken, cloudId), concurrency))
            .collectMap(WorklogFetchResult::issueKey, Function.identity(), LinkedHashMap::new);
    }

    /**
     * Uses the worklogs embedded in the search result when they are complete, otherwise
     * pages through the worklog endpoint.
     */
    public Mono<WorklogFetchResult> fetch(JiraIssue issue, String accessToken, String cloudId) {
        List<JiraWorklog> embedded = issue.completeEmbeddedWorklogs();
        if (embedded != null) {
            return Mono.just(WorklogFetchResult.complete(issue.key(), embedded));
        }
        return fetchAllPages(issue.key(), accessToken, cloudId)
            .map(worklogs -> WorklogFetchResult.complete(issue.key(), worklogs))
            .onErrorResume(
                error -> !(error instanceof JiraAuthException),
                error -> {
                    observer.worklogFetchDegraded(issue.key(), error);
                    return Mono.just(WorklogFetchResult.degraded(issue.key()));
                }
            );
    }

    private Mono<List<JiraWorklog>> fetchAllPages(String issueKey, String accessToken, String cloudId) {
        return page(issueKey, 0, accessToken, cloudId)
            .expand(cursor -> cursor.isLast(pageSize)
                ? Mono.empty()
                : page(issueKey, cursor.startAt() + pageSize, accessToken, cloudId))
            .concatMapIterable(PageCursor::worklogs)
            .collectList();
    }

    private Mono<PageCursor> page(String issueKey, int startAt, String accessToken, String cloudId) {
        return jiraClient.worklogPage(issueKey, startAt, pageSize, accessToken, cloudId)
            .map(page -> new PageCursor(startAt, page));
    }

    /**
     * A fetched page together with the offset it was requested at.
     */
    private record PageCursor(int startAt, WorklogPage page) {

        List<JiraWorklog> worklogs() {
            return page.worklogs() == null ? List.of() : page.worklogs();
        }

        boolean isLast(int pageSize) {
            int fetched = worklogs().size();
            return startAt + fetched >= page.total() || fetched < pageSize;
        }
    }
}
