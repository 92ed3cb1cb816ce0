package com.astradesk.worklog.service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;

import com.astradesk.worklog.domain.DateRange;
import com.astradesk.worklog.domain.WorklogQuery;
import com.astradesk.worklog.integration.props.IntegrationProperties;
import com.astradesk.worklog.util.DateUtils;

/**
 * Builds the JQL for worklog searches.
 *
 * <p>{@code worklogDate} in JQL matches the day a worklog was <em>recorded</em>, while the
 * report filters on the day the work was <em>performed</em>. The generated query is
 * therefore only a pre-filter; exact date filtering happens after the worklogs are
 * fetched. Issues created more than a year before the range are never searched.</p>
 *
 * <p>Output depends only on the query, the flag and the clock's current date.</p>
 */
@Component
public class JqlBuilder {

    static final String ORDER_BY = " ORDER BY created DESC";
    static final String DEFAULT_WORKLOG_WINDOW = "worklogDate >= -30d";

    private final Clock clock;
    private final int rangeExpansionDays;
    private final int createdLookbackDays;

    public JqlBuilder(Clock clock, IntegrationProperties properties) {
        this.clock = clock;
        this.rangeExpansionDays = properties.getAggregation().getRangeExpansionDays();
        this.createdLookbackDays = properties.getAggregation().getCreatedLookbackDays();
    }

    /**
     * @param expandRange widen the worklogDate bounds by the configured expansion. Use
     *                    {@code true} for a single search over the whole range and
     *                    {@code false} for per-day sub-range searches, which must not
     *                    overlap.
     * @return the JQL, or an empty string when there is nothing to filter on
     */
    public String build(WorklogQuery query, boolean expandRange) {
        String base = query.baseJql().map(String::trim).orElse("");
        List<String> clauses = new ArrayList<>();

        query.username().ifPresent(user -> clauses.add("worklogAuthor = " + quote(user)));

        query.projectKey()
            .filter(key -> !base.toLowerCase(Locale.ROOT).contains("project"))
            .ifPresent(key -> clauses.add("project = " + quote(key)));

        DateRange range = query.range();
        if (range.isBounded()) {
            range.from().ifPresent(from -> clauses.add("worklogDate >= "
                + quote(expandRange ? DateUtils.subtractDays(from, rangeExpansionDays) : from)));
            range.to().ifPresent(to -> clauses.add("worklogDate <= "
                + quote(expandRange ? DateUtils.addDays(to, rangeExpansionDays) : to)));
            String anchor = range.from().orElseGet(this::today);
            clauses.add("created >= " + quote(DateUtils.subtractDays(anchor, createdLookbackDays)));
        } else if (base.isEmpty()) {
            clauses.add(DEFAULT_WORKLOG_WINDOW);
            clauses.add("created >= " + quote(DateUtils.subtractDays(today(), createdLookbackDays)));
        }

        String jql = base;
        if (!clauses.isEmpty()) {
            String filters = String.join(" AND ", clauses);
            jql = jql.isEmpty() ? filters : jql + " AND " + filters;
        }
        return jql.isEmpty() ? jql : jql + ORDER_BY;
    }

    private String today() {
        return LocalDate.now(clock).toString();
    }

    private static String quote(String value) {
        return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
