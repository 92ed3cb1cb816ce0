package com.astradesk.worklog.integration.jira;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A site the access token can reach. {@code id} is the cloudId used in tenant URLs.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AccessibleResource(String id, String name, String url, List<String> scopes) {

    public boolean grants(String scope) {
        return scopes != null && scopes.contains(scope);
    }
}
