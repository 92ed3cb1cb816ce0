package com.astradesk.worklog.web;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import com.astradesk.worklog.domain.AggregationResult;
import com.astradesk.worklog.domain.DateRange;
import com.astradesk.worklog.domain.IssueWorklogs;
import com.astradesk.worklog.domain.UserWorklogs;
import com.astradesk.worklog.domain.WorklogQuery;
import com.astradesk.worklog.integration.jira.JiraIssue;
import com.astradesk.worklog.integration.jira.JiraIssueFields;
import com.astradesk.worklog.web.dto.HoursByUserRequest;
import com.astradesk.worklog.web.dto.HoursByUserResponse;
import com.astradesk.worklog.web.dto.IssueSummaryResponse;
import com.astradesk.worklog.web.dto.UserHoursResponse;

/**
 * Centralises conversion between API DTOs and the aggregation model so the shape of
 * requests and responses stays consistent.
 */
@Component
public class WorklogMapper {

    private static final BigDecimal SECONDS_PER_HOUR = BigDecimal.valueOf(3600);

    /**
     * Values some clients send for a field they meant to leave out.
     */
    private static final Set<String> ABSENT_MARKERS = Set.of("undefined", "null");

    public WorklogQuery toQuery(HoursByUserRequest request) {
        if (request == null) {
            return new WorklogQuery(Optional.empty(), DateRange.unbounded(), Optional.empty(), Optional.empty());
        }
        return new WorklogQuery(
            present(request.getJql()),
            new DateRange(present(request.getDateFrom()), present(request.getDateTo())),
            present(request.getUsername()),
            present(request.getProjectKey())
        );
    }

    public HoursByUserResponse toResponse(AggregationResult result) {
        return new HoursByUserResponse(
            result.userWorklogs().stream().map(this::toUserHours).toList(),
            result.degradedIssues()
        );
    }

    /**
     * Presentation rounding only; totals are kept in seconds.
     */
    public static String formatHours(long seconds) {
        return BigDecimal.valueOf(seconds)
            .divide(SECONDS_PER_HOUR, 2, RoundingMode.HALF_UP)
            .toPlainString();
    }

    private UserHoursResponse toUserHours(UserWorklogs user) {
        return new UserHoursResponse(
            user.getUser(),
            formatHours(user.getTotalSeconds()),
            user.getWorklogs(),
            user.getIssues().stream().map(this::toIssueSummary).toList()
        );
    }

    private IssueSummaryResponse toIssueSummary(IssueWorklogs entry) {
        JiraIssue issue = entry.getIssue();
        JiraIssueFields fields = issue.fields();
        String summary = fields != null && fields.summary() != null ? fields.summary() : "";
        return new IssueSummaryResponse(
            issue.id(),
            issue.key(),
            new IssueSummaryResponse.Fields(summary, fields != null ? fields.assignee() : null, entry.getWorklogs())
        );
    }

    private static Optional<String> present(String value) {
        if (!StringUtils.hasText(value)) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return ABSENT_MARKERS.contains(trimmed) ? Optional.empty() : Optional.of(trimmed);
    }
}
