package com.astradesk.worklog.service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.astradesk.worklog.domain.AggregationResult;
import com.astradesk.worklog.domain.DateRange;
import com.astradesk.worklog.domain.WorklogQuery;
import com.astradesk.worklog.integration.jira.JiraIssue;
import com.astradesk.worklog.integration.jira.JiraWorklog;
import com.astradesk.worklog.integration.props.IntegrationProperties;
import com.astradesk.worklog.util.DateUtils;

import reactor.core.publisher.Mono;

/**
 * Application service producing the hours-by-user report.
 *
 * <p>Flow:
 * <ul>
 *   <li>resolve the cloudId of the caller's token</li>
 *   <li>collect issues: one search per day when both dates are given, otherwise a single
 *       search with a widened worklogDate window</li>
 *   <li>fetch the worklogs of every issue with bounded concurrency</li>
 *   <li>filter and group them with {@link WorklogAggregator}</li>
 * </ul>
 * The service is reactive end-to-end; cancelling the returned {@link Mono} cancels all
 * outstanding Jira requests.</p>
 */
@Service
public class WorklogReportService {

    private static final Logger log = LoggerFactory.getLogger(WorklogReportService.class);

    private final CloudResourceLocator cloudResourceLocator;
    private final JqlBuilder jqlBuilder;
    private final IssueSearchClient issueSearchClient;
    private final RangeSplitIssueFetcher rangeSplitIssueFetcher;
    private final WorklogFetcher worklogFetcher;
    private final WorklogAggregator aggregator;
    private final AggregationObserver observer;
    private final Duration timeout;

    public WorklogReportService(
        CloudResourceLocator cloudResourceLocator,
        JqlBuilder jqlBuilder,
        IssueSearchClient issueSearchClient,
        RangeSplitIssueFetcher rangeSplitIssueFetcher,
        WorklogFetcher worklogFetcher,
        WorklogAggregator aggregator,
        AggregationObserver observer,
        IntegrationProperties properties
    ) {
        this.cloudResourceLocator = cloudResourceLocator;
        this.jqlBuilder = jqlBuilder;
        this.issueSearchClient = issueSearchClient;
        this.rangeSplitIssueFetcher = rangeSplitIssueFetcher;
        this.worklogFetcher = worklogFetcher;
        this.aggregator = aggregator;
        this.observer = observer;
        this.timeout = properties.getAggregation().getTimeout();
    }

    public Mono<AggregationResult> hoursByUser(String accessToken, WorklogQuery query) {
        WorklogQuery normalized;
        try {
            normalized = normalizeDates(query);
        } catch (InvalidDateException e) {
            return Mono.error(e);
        }
        log.debug("Aggregating worklogs for range {}", normalized.range());

        return cloudResourceLocator.resolveCloudId(accessToken)
            .flatMap(cloudId -> collectIssues(normalized, accessToken, cloudId)
                .flatMap(issues -> worklogFetcher.fetchAll(issues, accessToken, cloudId)
                    .map(results -> aggregate(normalized, issues, results))))
            .timeout(timeout)
            .onErrorMap(TimeoutException.class, error -> new AggregationTimeoutException(timeout));
    }

    private Mono<List<JiraIssue>> collectIssues(WorklogQuery query, String accessToken, String cloudId) {
        if (query.range().isClosed()) {
            return rangeSplitIssueFetcher.fetch(query, accessToken, cloudId);
        }
        String jql = jqlBuilder.build(query, true);
        return issueSearchClient.search(jql, accessToken, cloudId)
            .doOnNext(issues -> observer.issuesCollected(1, issues.size()));
    }

    private AggregationResult aggregate(WorklogQuery query, List<JiraIssue> issues,
                                        Map<String, WorklogFetchResult> results) {
        Map<String, List<JiraWorklog>> worklogsByIssue = new LinkedHashMap<>();
        int degraded = 0;
        for (WorklogFetchResult result : results.values()) {
            worklogsByIssue.put(result.issueKey(), result.worklogs());
            if (result.degraded()) {
                degraded++;
            }
        }
        AggregationResult aggregation = aggregator
            .aggregate(issues, worklogsByIssue, query.range(), query.username())
            .withDegradedIssues(degraded);
        observer.aggregationCompleted(aggregation.users().size(), issues.size(), degraded);
        return aggregation;
    }

    private static WorklogQuery normalizeDates(WorklogQuery query) {
        Optional<String> from = query.range().from().map(DateUtils::normalizeToIsoDate);
        Optional<String> to = query.range().to().map(DateUtils::normalizeToIsoDate);
        from.filter(date -> !DateUtils.isIsoDate(date)).ifPresent(date -> {
            throw new InvalidDateException("dateFrom", date);
        });
        to.filter(date -> !DateUtils.isIsoDate(date)).ifPresent(date -> {
            throw new InvalidDateException("dateTo", date);
        });
        return query.withRange(new DateRange(from, to));
    }
}
