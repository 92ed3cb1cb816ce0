package com.astradesk.worklog.web.dto;

import java.util.List;

/**
 * Report returned to the frontend.
 *
 * @param worklogs       one record per user, in the order users were first seen
 * @param degradedIssues issues whose worklogs could not be fetched and were counted as empty
 */
public record HoursByUserResponse(List<UserHoursResponse> worklogs, int degradedIssues) {
}
