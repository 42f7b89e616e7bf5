package com.example.datalake.dsdust.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@ConfigurationProperties(prefix = "dsdust.search")
@Validated
public class SearchProperties {

    @Positive
    private int descriptionMaxLength = 500;
    @Positive
    private int defaultMaxResults = 50;
    @Positive
    private int maxResultsLimit = 500;
    @Positive
    private int defaultPerQueryLimit = 30;
    /** Pages fetched per concrete query; 0 or less means until the catalog runs dry. */
    private int maxPages = 1;
    /** File listings fetched per page; negative means every record, 0 disables enrichment. */
    private int fileDetailsPerPage = 0;
    private boolean strictTagMatch = false;
    private Duration interQueryDelay = Duration.ZERO;
    private Duration interColumnDelay = Duration.ofSeconds(5);
    @Valid
    private final Retry retry = new Retry();
    @Valid
    private final Cache cache = new Cache();

    public int getDescriptionMaxLength() {
        return descriptionMaxLength;
    }

    public void setDescriptionMaxLength(int descriptionMaxLength) {
        this.descriptionMaxLength = descriptionMaxLength;
    }

    public int getDefaultMaxResults() {
        return defaultMaxResults;
    }

    public void setDefaultMaxResults(int defaultMaxResults) {
        this.defaultMaxResults = defaultMaxResults;
    }

    public int getMaxResultsLimit() {
        return maxResultsLimit;
    }

    public void setMaxResultsLimit(int maxResultsLimit) {
        this.maxResultsLimit = maxResultsLimit;
    }

    public int getDefaultPerQueryLimit() {
        return defaultPerQueryLimit;
    }

    public void setDefaultPerQueryLimit(int defaultPerQueryLimit) {
        this.defaultPerQueryLimit = defaultPerQueryLimit;
    }

    public int getMaxPages() {
        return maxPages;
    }

    public void setMaxPages(int maxPages) {
        this.maxPages = maxPages;
    }

    public int getFileDetailsPerPage() {
        return fileDetailsPerPage;
    }

    public void setFileDetailsPerPage(int fileDetailsPerPage) {
        this.fileDetailsPerPage = fileDetailsPerPage;
    }

    public boolean isStrictTagMatch() {
        return strictTagMatch;
    }

    public void setStrictTagMatch(boolean strictTagMatch) {
        this.strictTagMatch = strictTagMatch;
    }

    public Duration getInterQueryDelay() {
        return interQueryDelay;
    }

    public void setInterQueryDelay(Duration interQueryDelay) {
        this.interQueryDelay = interQueryDelay;
    }

    public Duration getInterColumnDelay() {
        return interColumnDelay;
    }

    public void setInterColumnDelay(Duration interColumnDelay) {
        this.interColumnDelay = interColumnDelay;
    }

    public Retry getRetry() {
        return retry;
    }

    public Cache getCache() {
        return cache;
    }

    public static final class Retry {
        private Duration minDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(3);
        private Duration backoffBase = Duration.ofSeconds(1);
        @PositiveOrZero
        private int maxRetries = 3;
        /** Concurrent catalog calls allowed across the whole process. */
        @Positive
        private int requestPermits = 1;

        public Duration getMinDelay() {
            return minDelay;
        }

        public void setMinDelay(Duration minDelay) {
            this.minDelay = minDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public Duration getBackoffBase() {
            return backoffBase;
        }

        public void setBackoffBase(Duration backoffBase) {
            this.backoffBase = backoffBase;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public int getRequestPermits() {
            return requestPermits;
        }

        public void setRequestPermits(int requestPermits) {
            this.requestPermits = requestPermits;
        }
    }

    public static final class Cache {
        @Positive
        private int capacity = 100;

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }
    }
}
