package com.astradesk.worklog.domain;

import java.util.Optional;

/**
 * Everything a caller can ask for in one aggregation. Absent values are always
 * {@link Optional#empty()}; sentinel strings never get this far.
 *
 * @param baseJql    JQL expression the generated clauses are appended to
 * @param range      dates the work was performed on
 * @param username   restricts both the search and the aggregation to one user
 * @param projectKey added as a project clause unless the base JQL already names a project
 */
public record WorklogQuery(
    Optional<String> baseJql,
    DateRange range,
    Optional<String> username,
    Optional<String> projectKey
) {

    public WorklogQuery {
        baseJql = baseJql == null ? Optional.empty() : baseJql;
        range = range == null ? DateRange.unbounded() : range;
        username = username == null ? Optional.empty() : username;
        projectKey = projectKey == null ? Optional.empty() : projectKey;
    }

    public WorklogQuery withRange(DateRange newRange) {
        return new WorklogQuery(baseJql, newRange, username, projectKey);
    }
}
