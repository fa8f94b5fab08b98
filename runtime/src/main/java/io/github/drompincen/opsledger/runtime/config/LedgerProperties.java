package io.github.drompincen.opsledger.runtime.config;

import io.github.drompincen.opsledger.protocol.api.EnforcementMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Typed view of the {@code opsledger.*} configuration tree. Defaults here are the
 * values used when {@code application.yml} is silent.
 */
@Component
@ConfigurationProperties(prefix = "opsledger")
public class LedgerProperties {

    private final Scheduler scheduler = new Scheduler();
    private final Executor executor = new Executor();
    private final Budget budget = new Budget();
    private final Approval approval = new Approval();
    private final Notification notification = new Notification();
    private final Platform platform = new Platform();
    private final Llm llm = new Llm();

    public Scheduler getScheduler() { return scheduler; }
    public Executor getExecutor() { return executor; }
    public Budget getBudget() { return budget; }
    public Approval getApproval() { return approval; }
    public Notification getNotification() { return notification; }
    public Platform getPlatform() { return platform; }
    public Llm getLlm() { return llm; }

    public static class Scheduler {
        private long triggerPollIntervalMs = 15000;
        private long executorPollIntervalMs = 5000;
        private int staggerSeconds = 30;

        public long getTriggerPollIntervalMs() { return triggerPollIntervalMs; }
        public void setTriggerPollIntervalMs(long triggerPollIntervalMs) { this.triggerPollIntervalMs = triggerPollIntervalMs; }
        public long getExecutorPollIntervalMs() { return executorPollIntervalMs; }
        public void setExecutorPollIntervalMs(long executorPollIntervalMs) { this.executorPollIntervalMs = executorPollIntervalMs; }
        public int getStaggerSeconds() { return staggerSeconds; }
        public void setStaggerSeconds(int staggerSeconds) { this.staggerSeconds = staggerSeconds; }
    }

    public static class Executor {
        private int maxConcurrentJobs = 5;
        private long jobTimeoutMs = 300_000;
        private int defaultMaxAttempts = 3;
        private long retryBackoffMs = 60_000;
        private long retryBackoffMaxMs = 600_000;

        public int getMaxConcurrentJobs() { return maxConcurrentJobs; }
        public void setMaxConcurrentJobs(int maxConcurrentJobs) { this.maxConcurrentJobs = maxConcurrentJobs; }
        public long getJobTimeoutMs() { return jobTimeoutMs; }
        public void setJobTimeoutMs(long jobTimeoutMs) { this.jobTimeoutMs = jobTimeoutMs; }
        public int getDefaultMaxAttempts() { return defaultMaxAttempts; }
        public void setDefaultMaxAttempts(int defaultMaxAttempts) { this.defaultMaxAttempts = defaultMaxAttempts; }
        public long getRetryBackoffMs() { return retryBackoffMs; }
        public void setRetryBackoffMs(long retryBackoffMs) { this.retryBackoffMs = retryBackoffMs; }
        public long getRetryBackoffMaxMs() { return retryBackoffMaxMs; }
        public void setRetryBackoffMaxMs(long retryBackoffMaxMs) { this.retryBackoffMaxMs = retryBackoffMaxMs; }
    }

    public static class Budget {
        private BigDecimal defaultDailyCapUsd = new BigDecimal("10.00");
        private EnforcementMode defaultEnforcement = EnforcementMode.HARD;
        private BigDecimal defaultEstimateUsd = new BigDecimal("0.01");
        private int warningPercent = 80;

        public BigDecimal getDefaultDailyCapUsd() { return defaultDailyCapUsd; }
        public void setDefaultDailyCapUsd(BigDecimal defaultDailyCapUsd) { this.defaultDailyCapUsd = defaultDailyCapUsd; }
        public EnforcementMode getDefaultEnforcement() { return defaultEnforcement; }
        public void setDefaultEnforcement(EnforcementMode defaultEnforcement) { this.defaultEnforcement = defaultEnforcement; }
        public BigDecimal getDefaultEstimateUsd() { return defaultEstimateUsd; }
        public void setDefaultEstimateUsd(BigDecimal defaultEstimateUsd) { this.defaultEstimateUsd = defaultEstimateUsd; }
        public int getWarningPercent() { return warningPercent; }
        public void setWarningPercent(int warningPercent) { this.warningPercent = warningPercent; }
    }

    public static class Approval {
        private int defaultExpiryMinutes = 60;
        /** A pending approval this close to expiry gets one reminder. 0 disables reminders. */
        private int reminderLeadMinutes = 15;
        private long reminderSweepIntervalMs = 60_000;

        public int getDefaultExpiryMinutes() { return defaultExpiryMinutes; }
        public void setDefaultExpiryMinutes(int defaultExpiryMinutes) { this.defaultExpiryMinutes = defaultExpiryMinutes; }
        public int getReminderLeadMinutes() { return reminderLeadMinutes; }
        public void setReminderLeadMinutes(int reminderLeadMinutes) { this.reminderLeadMinutes = reminderLeadMinutes; }
        public long getReminderSweepIntervalMs() { return reminderSweepIntervalMs; }
        public void setReminderSweepIntervalMs(long reminderSweepIntervalMs) { this.reminderSweepIntervalMs = reminderSweepIntervalMs; }
    }

    /** HTTP relay for one outbound channel. Blank url means the channel is not configured. */
    public static class Endpoint {
        private String url = "";
        private String token = "";

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
    }

    public static class Notification {
        private int maxAttempts = 5;
        private long initialBackoffMs = 2000;
        private long maxBackoffMs = 300_000;
        private long sweepIntervalMs = 30_000;
        private String telegramBotToken = "";
        private String telegramApiBase = "https://api.telegram.org";
        private Endpoint whatsapp = new Endpoint();
        private Endpoint sms = new Endpoint();
        private Endpoint email = new Endpoint();
        private String emailSubjectPrefix = "Ops Ledger";

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public long getInitialBackoffMs() { return initialBackoffMs; }
        public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }
        public long getMaxBackoffMs() { return maxBackoffMs; }
        public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }
        public long getSweepIntervalMs() { return sweepIntervalMs; }
        public void setSweepIntervalMs(long sweepIntervalMs) { this.sweepIntervalMs = sweepIntervalMs; }
        public String getTelegramBotToken() { return telegramBotToken; }
        public void setTelegramBotToken(String telegramBotToken) { this.telegramBotToken = telegramBotToken; }
        public String getTelegramApiBase() { return telegramApiBase; }
        public void setTelegramApiBase(String telegramApiBase) { this.telegramApiBase = telegramApiBase; }
        public Endpoint getWhatsapp() { return whatsapp; }
        public void setWhatsapp(Endpoint whatsapp) { this.whatsapp = whatsapp; }
        public Endpoint getSms() { return sms; }
        public void setSms(Endpoint sms) { this.sms = sms; }
        public Endpoint getEmail() { return email; }
        public void setEmail(Endpoint email) { this.email = email; }
        public String getEmailSubjectPrefix() { return emailSubjectPrefix; }
        public void setEmailSubjectPrefix(String emailSubjectPrefix) { this.emailSubjectPrefix = emailSubjectPrefix; }
    }

    /** Agent platform HTTP API used by the non-prompt actions. */
    public static class Platform {
        private String baseUrl = "";
        private String apiKey = "";
        private long requestTimeoutMs = 30_000;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
    }

    public static class Llm {
        private String provider = "fake";
        private String model = "";
        private String apiKey = "";

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    }
}
