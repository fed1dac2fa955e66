package net.bibrecords.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Strongly typed configuration for publication records.
 */
@Component
@ConfigurationProperties(prefix = "bibrecords")
public class BibRecordsProperties {

    /**
     * Domain of the site publishing the records, used as referrer in COinS context objects.
     */
    private String siteDomain = "localhost";

    /**
     * Attempts made to store a publication when its citation key collides with a concurrent writer.
     */
    private int citekeyMaxAttempts = 3;

    /**
     * Base backoff between citation key attempts; multiplied by the attempt number.
     */
    private long citekeyBaseBackoffMillis = 50L;

    @PostConstruct
    void validate() {
        Assert.hasText(siteDomain, "bibrecords.site-domain must not be blank");
        Assert.isTrue(citekeyMaxAttempts >= 1, "bibrecords.citekey-max-attempts must be at least 1");
        Assert.isTrue(citekeyBaseBackoffMillis >= 0, "bibrecords.citekey-base-backoff-millis must be non-negative");
    }

    public String getSiteDomain() {
        return siteDomain;
    }

    public void setSiteDomain(String siteDomain) {
        this.siteDomain = siteDomain;
    }

    public int getCitekeyMaxAttempts() {
        return citekeyMaxAttempts;
    }

    public void setCitekeyMaxAttempts(int citekeyMaxAttempts) {
        this.citekeyMaxAttempts = citekeyMaxAttempts;
    }

    public long getCitekeyBaseBackoffMillis() {
        return citekeyBaseBackoffMillis;
    }

    public void setCitekeyBaseBackoffMillis(long citekeyBaseBackoffMillis) {
        this.citekeyBaseBackoffMillis = Math.max(0L, citekeyBaseBackoffMillis);
    }
}
