package com.astradesk.worklog.domain;

/**
 * Which worklog author attribute the {@code username} filter is compared against.
 */
public enum UserFilterTarget {
    /** Atlassian account id ({@code author.accountId}). */
    ACCOUNT_ID,
    /** The reporting key of the author: email address, else display name. */
    AUTHOR
}
