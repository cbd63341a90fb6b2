package webmention.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;
import webmention.WebmentionsConfig;
import webmention.model.WebmentionStatus;

import java.time.Duration;

/**
 * Configuration properties for webmention processing.
 *
 * @see WebmentionAutoConfiguration
 */
@ConfigurationProperties(prefix = "webmention")
public class WebmentionProperties {

    /**
     * Whether to auto-configure the {@link webmention.Webmentions} facade.
     */
    private boolean enabled = true;

    /**
     * Root URL of the site. Received mentions whose target lies elsewhere are rejected.
     */
    private String baseUrl;

    /**
     * Status given to newly received mentions. PENDING holds them for moderation.
     */
    private WebmentionStatus initialStatus = WebmentionStatus.CONFIRMED;

    /**
     * Timeout of every outbound HTTP request.
     */
    private Duration httpTimeout = Duration.ofSeconds(10);

    /**
     * User-Agent sent when fetching sources and notifying endpoints.
     */
    private String userAgent = WebmentionsConfig.DEFAULT_USER_AGENT;

    /**
     * Targets resolved and notified in parallel within one outgoing run.
     */
    private int outgoingConcurrency = 4;

    /**
     * Whether a retracted target's endpoint is notified again.
     */
    private boolean notifyOnRetraction = true;

    /**
     * Maximum length of stored excerpts.
     */
    private int excerptLength = 240;

    private final Jdbc jdbc = new Jdbc();
    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public WebmentionStatus getInitialStatus() {
        return initialStatus;
    }

    public void setInitialStatus(WebmentionStatus initialStatus) {
        this.initialStatus = initialStatus;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public void setHttpTimeout(Duration httpTimeout) {
        this.httpTimeout = httpTimeout;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public int getOutgoingConcurrency() {
        return outgoingConcurrency;
    }

    public void setOutgoingConcurrency(int outgoingConcurrency) {
        this.outgoingConcurrency = outgoingConcurrency;
    }

    public boolean isNotifyOnRetraction() {
        return notifyOnRetraction;
    }

    public void setNotifyOnRetraction(boolean notifyOnRetraction) {
        this.notifyOnRetraction = notifyOnRetraction;
    }

    public int getExcerptLength() {
        return excerptLength;
    }

    public void setExcerptLength(int excerptLength) {
        this.excerptLength = excerptLength;
    }

    public Jdbc getJdbc() {
        return jdbc;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Jdbc {
        /**
         * Table holding mentions.
         */
        private String tableName = "webmention";

        /**
         * Whether to create the table on start-up when it is missing.
         */
        private boolean initializeSchema = false;

        public String getTableName() {
            return tableName;
        }

        public void setTableName(String tableName) {
            this.tableName = tableName;
        }

        public boolean isInitializeSchema() {
            return initializeSchema;
        }

        public void setInitializeSchema(boolean initializeSchema) {
            this.initializeSchema = initializeSchema;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "webmention";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
