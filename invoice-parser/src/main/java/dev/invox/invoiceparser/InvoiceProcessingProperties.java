package dev.invox.invoiceparser;

import dev.invox.invoiceparser.usage.UsageTracker;
import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "invoice.processing")
public class InvoiceProcessingProperties {

    /**
     * Maximum time a single Gemini extraction attempt may take before the next model is tried.
     */
    private Duration attemptTimeout = Duration.ofMinutes(2);

    /**
     * Time zone whose calendar day resets the daily request counters.
     */
    private ZoneId usageZone = UsageTracker.DEFAULT_ZONE;

    public Duration getAttemptTimeout() {
        return attemptTimeout;
    }

    public void setAttemptTimeout(Duration attemptTimeout) {
        this.attemptTimeout = attemptTimeout;
    }

    public ZoneId getUsageZone() {
        return usageZone;
    }

    public void setUsageZone(ZoneId usageZone) {
        this.usageZone = usageZone;
    }
}
