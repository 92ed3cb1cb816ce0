package com.astradesk.worklog.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import com.astradesk.worklog.domain.AggregationResult;
import com.astradesk.worklog.domain.DateRange;
import com.astradesk.worklog.domain.UserFilterTarget;
import com.astradesk.worklog.domain.UserWorklogs;
import com.astradesk.worklog.integration.jira.JiraIssue;
import com.astradesk.worklog.integration.jira.JiraWorklog;
import com.astradesk.worklog.integration.jira.WorklogAuthor;
import com.astradesk.worklog.integration.props.IntegrationProperties;
import com.astradesk.worklog.util.DateUtils;

/**
 * Groups worklogs by author and issue.
 *
 * <p>Users are keyed by email address, falling back to display name. A worklog counts
 * towards the date range of the day it was started, whatever day it was recorded.</p>
 */
@Component
public class WorklogAggregator {

    private final UserFilterTarget userFilterTarget;

    public WorklogAggregator(IntegrationProperties properties) {
        this.userFilterTarget = properties.getAggregation().getUserFilterTarget();
    }

    /**
     * @param issues          issues in the order their worklogs should be reported
     * @param worklogsByIssue all worklogs per issue key; missing keys count as empty
     * @param range           inclusive range on the started date
     * @param username        when present, only worklogs of this user are kept
     */
    public AggregationResult aggregate(List<JiraIssue> issues,
                                       Map<String, List<JiraWorklog>> worklogsByIssue,
                                       DateRange range,
                                       Optional<String> username) {
        Map<String, UserWorklogs> users = new LinkedHashMap<>();
        for (JiraIssue issue : issues) {
            List<JiraWorklog> worklogs = worklogsByIssue.get(issue.key());
            if (worklogs == null) {
                continue;
            }
            for (JiraWorklog worklog : worklogs) {
                if (!performedWithin(worklog, range)) {
                    continue;
                }
                String author = authorId(worklog.author());
                if (author == null) {
                    continue;
                }
                if (username.isPresent() && !username.get().equals(filterValue(worklog.author(), author))) {
                    continue;
                }
                users.computeIfAbsent(author, UserWorklogs::new).add(issue, worklog);
            }
        }
        return new AggregationResult(users, 0);
    }

    private static boolean performedWithin(JiraWorklog worklog, DateRange range) {
        if (!range.isBounded()) {
            return true;
        }
        if (!StringUtils.hasText(worklog.started())) {
            return false;
        }
        return range.contains(DateUtils.datePart(worklog.started()));
    }

    static String authorId(WorklogAuthor author) {
        if (author == null) {
            return null;
        }
        if (StringUtils.hasText(author.emailAddress())) {
            return author.emailAddress();
        }
        return StringUtils.hasText(author.displayName()) ? author.displayName() : null;
    }

    private String filterValue(WorklogAuthor author, String authorId) {
        return switch (userFilterTarget) {
            case ACCOUNT_ID -> author.accountId();
            case AUTHOR -> authorId;
        };
    }
}
