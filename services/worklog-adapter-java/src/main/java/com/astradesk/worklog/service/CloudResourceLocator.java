package com.astradesk.worklog.service;

import org.springframework.stereotype.Service;

import com.astradesk.worklog.integration.jira.AccessibleResource;
import com.astradesk.worklog.integration.jira.JiraAuthException;
import com.astradesk.worklog.integration.jira.JiraClient;
import com.astradesk.worklog.integration.props.IntegrationProperties;

import reactor.core.publisher.Mono;

/**
 * Resolves the Jira cloudId an access token is scoped to. Resolved on every call, never
 * cached.
 */
@Service
public class CloudResourceLocator {

    private final JiraClient jiraClient;
    private final String requiredScope;

    public CloudResourceLocator(JiraClient jiraClient, IntegrationProperties properties) {
        this.jiraClient = jiraClient;
        this.requiredScope = properties.getAtlassian().getRequiredScope();
    }

    /**
     * Picks the first accessible resource granting the required scope.
     *
     * @throws JiraAuthException (as an error signal) when the token reaches no resource,
     *                           or none with the required scope
     */
    public Mono<String> resolveCloudId(String accessToken) {
        return jiraClient.accessibleResources(accessToken)
            .flatMap(resources -> {
                if (resources.isEmpty()) {
                    return Mono.error(new JiraAuthException("No accessible Jira resources found for this token"));
                }
                return resources.stream()
                    .filter(resource -> resource.grants(requiredScope))
                    .map(AccessibleResource::id)
                    .findFirst()
                    .map(Mono::just)
                    .orElseGet(() -> Mono.error(
                        new JiraAuthException("No Jira resource found with required scope " + requiredScope)));
            });
    }
}
