package com.astradesk.worklog.integration.jira;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;

import com.astradesk.worklog.integration.props.IntegrationProperties;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import reactor.core.publisher.Mono;

/**
 * Minimal Atlassian REST client. Only implements the read operations the adapter
 * needs: token introspection, JQL search and paginated worklog pages.
 *
 * <p>Every call forwards the caller's bearer token. Failures are translated into
 * {@link JiraAuthException} for 401/403 and {@link JiraTransportException} for
 * everything else, including timeouts and connection errors.</p>
 */
@Component
public class JiraClient {

    private static final Logger log = LoggerFactory.getLogger(JiraClient.class);

    static final List<String> SEARCH_FIELDS = List.of("summary", "assignee", "worklog");

    private static final String TENANT_API = "/ex/jira/{cloudId}/rest/api/3";

    private final WebClient webClient;
    private final IntegrationProperties.AtlassianProperties properties;

    public JiraClient(WebClient.Builder builder, IntegrationProperties properties) {
        this.properties = properties.getAtlassian();
        this.webClient = builder
            .baseUrl(this.properties.getApiUrl())
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(this.properties.getMaxResponseBytes()))
            .build();
    }

    /**
     * Lists the sites the token can reach together with the scopes granted on each.
     */
    public Mono<List<AccessibleResource>> accessibleResources(String accessToken) {
        String operation = "Resolving cloudId";
        Mono<List<AccessibleResource>> call = webClient.get()
            .uri("/oauth/token/accessible-resources")
            .headers(headers -> headers.setBearerAuth(accessToken))
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> toError(operation, response))
            .bodyToMono(new ParameterizedTypeReference<List<AccessibleResource>>() {})
            .defaultIfEmpty(List.of());
        return guard(operation, call);
    }

    /**
     * Runs one JQL search. The endpoint has no pagination and returns at most ~50 issues.
     */
    public Mono<List<JiraIssue>> searchIssues(String jql, String accessToken, String cloudId) {
        String operation = "Issue search";
        Mono<List<JiraIssue>> call = webClient.post()
            .uri(TENANT_API + "/search/jql", cloudId)
            .headers(headers -> headers.setBearerAuth(accessToken))
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(new SearchRequest(jql, SEARCH_FIELDS))
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> toError(operation, response))
            .bodyToMono(SearchResponse.class)
            .map(response -> response.issues() == null ? List.<JiraIssue>of() : response.issues())
            .defaultIfEmpty(List.of())
            .doOnNext(issues -> log.debug("JQL [{}] returned {} issues", jql, issues.size()));
        return guard(operation, call);
    }

    /**
     * Fetches one page of an issue's worklogs.
     */
    public Mono<WorklogPage> worklogPage(String issueKey, int startAt, int maxResults,
                                         String accessToken, String cloudId) {
        String operation = "Worklog fetch for " + issueKey;
        Mono<WorklogPage> call = webClient.get()
            .uri(TENANT_API + "/issue/{issueKey}/worklog?startAt={startAt}&maxResults={maxResults}",
                cloudId, issueKey, startAt, maxResults)
            .headers(headers -> headers.setBearerAuth(accessToken))
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> toError(operation, response))
            .bodyToMono(WorklogPage.class)
            .defaultIfEmpty(new WorklogPage(startAt, maxResults, 0, List.of()));
        return guard(operation, call);
    }

    private Mono<RuntimeException> toError(String operation, ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
            .defaultIfEmpty("")
            .map(body -> translate(operation, status, body));
    }

    private RuntimeException translate(String operation, int status, String body) {
        if (status == 401 || status == 403) {
            return new JiraAuthException("Invalid or expired access token");
        }
        log.error("[Jira] {} returned {}: {}", operation, status, body);
        return new JiraTransportException(operation, status, body);
    }

    private <T> Mono<T> guard(String operation, Mono<T> call) {
        return call
            .timeout(properties.getRequestTimeout())
            .onErrorMap(
                error -> !(error instanceof JiraAuthException) && !(error instanceof JiraTransportException),
                error -> new JiraTransportException(operation, error)
            );
    }

    record SearchRequest(String jql, List<String> fields) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SearchResponse(List<JiraIssue> issues) {
    }
}
