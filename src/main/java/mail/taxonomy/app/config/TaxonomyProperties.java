package mail.taxonomy.app.config;

import lombok.Data;
import mail.taxonomy.app.provider.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings under the {@code taxonomy.*} prefix.
 */
@Data
@ConfigurationProperties(prefix = "taxonomy")
public class TaxonomyProperties {
    private Catalog catalog = new Catalog();
    private Provider provider = new Provider();
    private Provisioning provisioning = new Provisioning();
    private Reconciliation reconciliation = new Reconciliation();
    private Routing routing = new Routing();
    private Coverage coverage = new Coverage();
    private Lock lock = new Lock();

    @Data
    public static class Catalog {
        private String location = "classpath:taxonomy";
    }

    @Data
    public static class Provider {
        private Duration callTimeout = Duration.ofSeconds(20);
        private Retry gmail = new Retry(2, Duration.ofSeconds(1), Duration.ofSeconds(10));
        private Outlook outlook = new Outlook();
    }

    @Data
    public static class Retry {
        private int maxAttempts;
        private Duration baseDelay;
        private Duration maxDelay;

        public Retry() {
        }

        public Retry(int maxAttempts, Duration baseDelay, Duration maxDelay) {
            this.maxAttempts = maxAttempts;
            this.baseDelay = baseDelay;
            this.maxDelay = maxDelay;
        }

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, baseDelay, maxDelay);
        }
    }

    @Data
    public static class Outlook {
        private Retry retry = new Retry(4, Duration.ofSeconds(2), Duration.ofSeconds(30));
        private String graphBaseUrl = "https://graph.microsoft.com/v1.0/me";
        private List<String> systemFolders = new ArrayList<>(List.of(
                "Inbox", "Drafts", "Sent Items", "Deleted Items", "Junk Email", "Archive", "Outbox",
                "Conversation History", "RSS Feeds", "RSS Subscriptions", "Sync Issues", "Notes"));
    }

    @Data
    public static class Provisioning {
        private int maxConcurrency = 4;
    }

    @Data
    public static class Reconciliation {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(15);
        private Duration initialDelay = Duration.ofMinutes(1);
    }

    @Data
    public static class Routing {
        private Map<String, String> aliases = new LinkedHashMap<>(Map.of(
                "formsub", "forms",
                "form_submissions", "forms",
                "socialmedia", "social",
                "social_media", "social",
                "googlereview", "google_review"));
    }

    @Data
    public static class Coverage {
        private double healthyThreshold = 90.0;
    }

    @Data
    public static class Lock {
        private Duration timeout = Duration.ofMinutes(10);
    }
}
