package com.astradesk.worklog.integration.props;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import com.astradesk.worklog.domain.UserFilterTarget;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Configuration properties describing how the adapter talks to Atlassian and how it
 * plans worklog queries.
 *
 * <p>The structure mirrors {@code application.yml}. Validation ensures missing critical
 * settings are caught at startup instead of failing during runtime calls.</p>
 */
@Validated
@ConfigurationProperties(prefix = "integration")
public class IntegrationProperties {

    @Valid
    @NestedConfigurationProperty
    private final AtlassianProperties atlassian = new AtlassianProperties();

    @Valid
    @NestedConfigurationProperty
    private final AggregationProperties aggregation = new AggregationProperties();

    public AtlassianProperties getAtlassian() {
        return atlassian;
    }

    public AggregationProperties getAggregation() {
        return aggregation;
    }

    public static class AtlassianProperties {

        /**
         * Gateway for both token introspection and tenant-scoped Jira calls.
         */
        @NotBlank
        private String apiUrl = "https://api.atlassian.com";

        /**
         * A tenant is only usable when the token grants this scope on it.
         */
        @NotBlank
        private String requiredScope = "read:jira-work";

        @NotNull
        private Duration requestTimeout = Duration.ofSeconds(30);

        /**
         * Worklog pages of 1000 entries easily exceed the 256 KB codec default.
         */
        @Min(262_144)
        private int maxResponseBytes = 16 * 1024 * 1024;

        public String getApiUrl() {
            return apiUrl;
        }

        public void setApiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
        }

        public String getRequiredScope() {
            return requiredScope;
        }

        public void setRequiredScope(String requiredScope) {
            this.requiredScope = requiredScope;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }

        public int getMaxResponseBytes() {
            return maxResponseBytes;
        }

        public void setMaxResponseBytes(int maxResponseBytes) {
            this.maxResponseBytes = maxResponseBytes;
        }
    }

    public static class AggregationProperties {

        /**
         * Extra days searched on both sides of a split range. A worklog performed on day D
         * may be recorded up to this many days later.
         */
        @Min(0)
        private int lookbackDays = 7;

        /**
         * Widening of the worklogDate bounds for the single, un-split search.
         */
        @Min(0)
        private int rangeExpansionDays = 30;

        /**
         * Oldest issue creation date considered, relative to the range start.
         */
        @Min(1)
        private int createdLookbackDays = 365;

        @Min(1)
        @Max(5000)
        private int worklogPageSize = 1000;

        @Min(1)
        @Max(64)
        private int worklogConcurrency = 10;

        @NotNull
        private Duration timeout = Duration.ofMinutes(5);

        @NotNull
        private UserFilterTarget userFilterTarget = UserFilterTarget.ACCOUNT_ID;

        public int getLookbackDays() {
            return lookbackDays;
        }

        public void setLookbackDays(int lookbackDays) {
            this.lookbackDays = lookbackDays;
        }

        public int getRangeExpansionDays() {
            return rangeExpansionDays;
        }

        public void setRangeExpansionDays(int rangeExpansionDays) {
            this.rangeExpansionDays = rangeExpansionDays;
        }

        public int getCreatedLookbackDays() {
            return createdLookbackDays;
        }

        public void setCreatedLookbackDays(int createdLookbackDays) {
            this.createdLookbackDays = createdLookbackDays;
        }

        public int getWorklogPageSize() {
            return worklogPageSize;
        }

        public void setWorklogPageSize(int worklogPageSize) {
            this.worklogPageSize = worklogPageSize;
        }

        public int getWorklogConcurrency() {
            return worklogConcurrency;
        }

        public void setWorklogConcurrency(int worklogConcurrency) {
            this.worklogConcurrency = worklogConcurrency;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public UserFilterTarget getUserFilterTarget() {
            return userFilterTarget;
        }

        public void setUserFilterTarget(UserFilterTarget userFilterTarget) {
            this.userFilterTarget = userFilterTarget;
        }
    }
}
