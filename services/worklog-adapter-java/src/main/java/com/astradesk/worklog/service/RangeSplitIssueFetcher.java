package com.astradesk.worklog.service;

import java.util.List;

import org.springframework.stereotype.Service;

import com.astradesk.worklog.domain.DateRange;
import com.astradesk.worklog.domain.WorklogQuery;
import com.astradesk.worklog.integration.jira.JiraIssue;
import com.astradesk.worklog.integration.props.IntegrationProperties;
import com.astradesk.worklog.util.DateUtils;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Collects every issue with worklogs in a closed date range by running one search per
 * calendar day.
 *
 * <p>The window is widened by the lookback on both sides: a worklog performed on day D
 * but recorded on D+1..D+lookback only matches the search for the day it was recorded.
 * Searches run one after another to stay within Atlassian rate limits.</p>
 */
@Service
public class RangeSplitIssueFetcher {

    private final JqlBuilder jqlBuilder;
    private final IssueSearchClient searchClient;
    private final AggregationObserver observer;
    private final int lookbackDays;

    public RangeSplitIssueFetcher(JqlBuilder jqlBuilder,
                                  IssueSearchClient searchClient,
                                  AggregationObserver observer,
                                  IntegrationProperties properties) {
        this.jqlBuilder = jqlBuilder;
        this.searchClient = searchClient;
        this.observer = observer;
        this.lookbackDays = properties.getAggregation().getLookbackDays();
    }

    /**
     * @param query a query whose range has both bounds
     * @return distinct issues, first occurrence wins, in discovery order
     */
    public Mono<List<JiraIssue>> fetch(WorklogQuery query, String accessToken, String cloudId) {
        DateRange window = effectiveWindow(query.range());
        List<String> days = DateUtils.daysBetweenInclusive(window.from().get(), window.to().get());

        return Flux.fromIterable(days)
            .concatMap(day -> searchClient.search(
                jqlBuilder.build(query.withRange(DateRange.singleDay(day)), false), accessToken, cloudId))
            .concatMapIterable(issues -> issues)
            .distinct(JiraIssue::key)
            .collectList()
            .doOnNext(issues -> observer.issuesCollected(days.size(), issues.size()));
    }

    /**
     * {@code [from - lookback, to + lookback]}, both ends inclusive.
     */
    public DateRange effectiveWindow(DateRange range) {
        if (!range.isClosed()) {
            throw new IllegalArgumentException("Range split needs both dates, got " + range);
        }
        return DateRange.of(
            DateUtils.subtractDays(range.from().get(), lookbackDays),
            DateUtils.addDays(range.to().get(), lookbackDays)
        );
    }
}
