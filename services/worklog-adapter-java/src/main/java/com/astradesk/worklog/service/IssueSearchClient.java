package com.astradesk.worklog.service;

import java.util.List;

import org.springframework.stereotype.Service;

import com.astradesk.worklog.integration.jira.JiraClient;
import com.astradesk.worklog.integration.jira.JiraIssue;

import reactor.core.publisher.Mono;

/**
 * One bounded JQL search. Jira returns at most ~50 issues per search and offers no
 * way to page further, so callers needing completeness must split the query.
 */
@Service
public class IssueSearchClient {

    private final JiraClient jiraClient;
    private final AggregationObserver observer;

    public IssueSearchClient(JiraClient jiraClient, AggregationObserver observer) {
        this.jiraClient = jiraClient;
        this.observer = observer;
    }

    /**
     * @return issues in upstream order (creation time, newest first)
     */
    public Mono<List<JiraIssue>> search(String jql, String accessToken, String cloudId) {
        return jiraClient.searchIssues(jql, accessToken, cloudId)
            .doOnNext(issues -> observer.issueSearchCompleted(jql, issues.size()));
    }
}
