package com.mailflow.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Subscription subscription = new Subscription();
    private Watch watch = new Watch();
    private Gmail gmail = new Gmail();
    private PubSub pubsub = new PubSub();
    private Output output = new Output();

    public Subscription getSubscription() {
        return subscription;
    }

    public void setSubscription(Subscription subscription) {
        this.subscription = subscription;
    }

    public Watch getWatch() {
        return watch;
    }

    public void setWatch(Watch watch) {
        this.watch = watch;
    }

    public Gmail getGmail() {
        return gmail;
    }

    public void setGmail(Gmail gmail) {
        this.gmail = gmail;
    }

    public PubSub getPubsub() {
        return pubsub;
    }

    public void setPubsub(PubSub pubsub) {
        this.pubsub = pubsub;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public static class Subscription {
        private boolean enabled;
        private String mode = "poll";
        private String name;
        private String topicName;
        private String subscriptionName;
        private Duration pollingInterval = Duration.ofSeconds(30);
        private Duration duration;
        private boolean setupWatch;
        private boolean forceNewWatch;
        private String applicationName = "mailflow";
        private String initialHistoryId;
        private Filter filter = new Filter();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getTopicName() {
            return topicName;
        }

        public void setTopicName(String topicName) {
            this.topicName = topicName;
        }

        public String getSubscriptionName() {
            return subscriptionName;
        }

        public void setSubscriptionName(String subscriptionName) {
            this.subscriptionName = subscriptionName;
        }

        public Duration getPollingInterval() {
            return pollingInterval;
        }

        public void setPollingInterval(Duration pollingInterval) {
            this.pollingInterval = pollingInterval;
        }

        public Duration getDuration() {
            return duration;
        }

        public void setDuration(Duration duration) {
            this.duration = duration;
        }

        public boolean isSetupWatch() {
            return setupWatch;
        }

        public void setSetupWatch(boolean setupWatch) {
            this.setupWatch = setupWatch;
        }

        public boolean isForceNewWatch() {
            return forceNewWatch;
        }

        public void setForceNewWatch(boolean forceNewWatch) {
            this.forceNewWatch = forceNewWatch;
        }

        public String getApplicationName() {
            return applicationName;
        }

        public void setApplicationName(String applicationName) {
            this.applicationName = applicationName;
        }

        public String getInitialHistoryId() {
            return initialHistoryId;
        }

        public void setInitialHistoryId(String initialHistoryId) {
            this.initialHistoryId = initialHistoryId;
        }

        public Filter getFilter() {
            return filter;
        }

        public void setFilter(Filter filter) {
            this.filter = filter;
        }
    }

    public static class Filter {
        private String query;
        private String from;
        private String subject;
        private String after;
        private String before;
        private List<String> labels = new ArrayList<>();
        private boolean unreadOnly;
        private boolean includeSpamTrash;
        private int maxResults = 10;

        public String getQuery() {
            return query;
        }

        public void setQuery(String query) {
            this.query = query;
        }

        public String getFrom() {
            return from;
        }

        public void setFrom(String from) {
            this.from = from;
        }

        public String getSubject() {
            return subject;
        }

        public void setSubject(String subject) {
            this.subject = subject;
        }

        public String getAfter() {
            return after;
        }

        public void setAfter(String after) {
            this.after = after;
        }

        public String getBefore() {
            return before;
        }

        public void setBefore(String before) {
            this.before = before;
        }

        public List<String> getLabels() {
            return labels;
        }

        public void setLabels(List<String> labels) {
            this.labels = labels;
        }

        public boolean isUnreadOnly() {
            return unreadOnly;
        }

        public void setUnreadOnly(boolean unreadOnly) {
            this.unreadOnly = unreadOnly;
        }

        public boolean isIncludeSpamTrash() {
            return includeSpamTrash;
        }

        public void setIncludeSpamTrash(boolean includeSpamTrash) {
            this.includeSpamTrash = includeSpamTrash;
        }

        public int getMaxResults() {
            return maxResults;
        }

        public void setMaxResults(int maxResults) {
            this.maxResults = maxResults;
        }
    }

    public static class Watch {
        private String serviceType = "gmail";
        private String stateDirectory;
        private Duration safetyMargin = Duration.ofMinutes(15);
        private Duration renewalThreshold = Duration.ofMinutes(20);
        private Duration retryBackoff = Duration.ofMinutes(5);
        private Duration minimumDelay = Duration.ofMinutes(1);
        private Duration defaultExpiration = Duration.ofDays(7);
        private List<String> defaultLabels = new ArrayList<>(List.of("INBOX"));
        private Duration stopTimeout = Duration.ofSeconds(10);

        public String getServiceType() {
            return serviceType;
        }

        public void setServiceType(String serviceType) {
            this.serviceType = serviceType;
        }

        public String getStateDirectory() {
            return stateDirectory;
        }

        public void setStateDirectory(String stateDirectory) {
            this.stateDirectory = stateDirectory;
        }

        public Duration getSafetyMargin() {
            return safetyMargin;
        }

        public void setSafetyMargin(Duration safetyMargin) {
            this.safetyMargin = safetyMargin;
        }

        public Duration getRenewalThreshold() {
            return renewalThreshold;
        }

        public void setRenewalThreshold(Duration renewalThreshold) {
            this.renewalThreshold = renewalThreshold;
        }

        public Duration getRetryBackoff() {
            return retryBackoff;
        }

        public void setRetryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
        }

        public Duration getMinimumDelay() {
            return minimumDelay;
        }

        public void setMinimumDelay(Duration minimumDelay) {
            this.minimumDelay = minimumDelay;
        }

        public Duration getDefaultExpiration() {
            return defaultExpiration;
        }

        public void setDefaultExpiration(Duration defaultExpiration) {
            this.defaultExpiration = defaultExpiration;
        }

        public List<String> getDefaultLabels() {
            return defaultLabels;
        }

        public void setDefaultLabels(List<String> defaultLabels) {
            this.defaultLabels = defaultLabels;
        }

        public Duration getStopTimeout() {
            return stopTimeout;
        }

        public void setStopTimeout(Duration stopTimeout) {
            this.stopTimeout = stopTimeout;
        }
    }

    public static class Gmail {
        private String baseUrl = "https://gmail.googleapis.com";
        private String userId = "me";
        private String accessToken;
        private String accessTokenFile;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getUserId() {
            return userId;
        }

        public void setUserId(String userId) {
            this.userId = userId;
        }

        public String getAccessToken() {
            return accessToken;
        }

        public void setAccessToken(String accessToken) {
            this.accessToken = accessToken;
        }

        public String getAccessTokenFile() {
            return accessTokenFile;
        }

        public void setAccessTokenFile(String accessTokenFile) {
            this.accessTokenFile = accessTokenFile;
        }
    }

    public static class PubSub {
        private String baseUrl = "https://pubsub.googleapis.com";
        private int maxMessages = 10;
        private int handlerThreads = 4;
        private Duration pullInterval = Duration.ofSeconds(1);
        private Duration stopTimeout = Duration.ofSeconds(10);
        private String pushToken;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getMaxMessages() {
            return maxMessages;
        }

        public void setMaxMessages(int maxMessages) {
            this.maxMessages = maxMessages;
        }

        public int getHandlerThreads() {
            return handlerThreads;
        }

        public void setHandlerThreads(int handlerThreads) {
            this.handlerThreads = handlerThreads;
        }

        public Duration getPullInterval() {
            return pullInterval;
        }

        public void setPullInterval(Duration pullInterval) {
            this.pullInterval = pullInterval;
        }

        public Duration getStopTimeout() {
            return stopTimeout;
        }

        public void setStopTimeout(Duration stopTimeout) {
            this.stopTimeout = stopTimeout;
        }

        public String getPushToken() {
            return pushToken;
        }

        public void setPushToken(String pushToken) {
            this.pushToken = pushToken;
        }
    }

    public static class Output {
        private Kafka kafka = new Kafka();

        public Kafka getKafka() {
            return kafka;
        }

        public void setKafka(Kafka kafka) {
            this.kafka = kafka;
        }
    }

    public static class Kafka {
        private boolean enabled;
        private String topic = "mailflow.records";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getTopic() {
            return topic;
        }

        public void setTopic(String topic) {
            this.topic = topic;
        }
    }
}
