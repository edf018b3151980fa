package com.compcollector.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "collector")
public class CollectorProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/125.0.0.0 Safari/537.36";

    private Worker worker = new Worker();
    private Browser browser = new Browser();
    private Pattern pattern = new Pattern();
    private Capture capture = new Capture();
    private Retry retry = new Retry();
    private Storage storage = new Storage();
    private AutoAttach autoAttach = new AutoAttach();
    private Reference reference = new Reference();
    private Http http = new Http();
    private Cli cli = new Cli();
    private CardLadder cardLadder = new CardLadder();

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }

    public Browser getBrowser() {
        return browser;
    }

    public void setBrowser(Browser browser) {
        this.browser = browser;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public void setPattern(Pattern pattern) {
        this.pattern = pattern;
    }

    public Capture getCapture() {
        return capture;
    }

    public void setCapture(Capture capture) {
        this.capture = capture;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public AutoAttach getAutoAttach() {
        return autoAttach;
    }

    public void setAutoAttach(AutoAttach autoAttach) {
        this.autoAttach = autoAttach;
    }

    public Reference getReference() {
        return reference;
    }

    public void setReference(Reference reference) {
        this.reference = reference;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public CardLadder getCardLadder() {
        return cardLadder;
    }

    public void setCardLadder(CardLadder cardLadder) {
        this.cardLadder = cardLadder;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Worker {
        private boolean enabled = true;
        private int pollIntervalMs = 3000;
        private int concurrency = 1;
        private int staleJobMinutes = 30;
        private int staleSweepIntervalSeconds = 60;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getPollIntervalMs() {
            return Math.max(100, pollIntervalMs);
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = Math.max(100, pollIntervalMs);
        }

        public int getConcurrency() {
            return Math.max(1, concurrency);
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }

        public int getStaleJobMinutes() {
            return Math.max(1, staleJobMinutes);
        }

        public void setStaleJobMinutes(int staleJobMinutes) {
            this.staleJobMinutes = Math.max(1, staleJobMinutes);
        }

        public int getStaleSweepIntervalSeconds() {
            return Math.max(1, staleSweepIntervalSeconds);
        }

        public void setStaleSweepIntervalSeconds(int staleSweepIntervalSeconds) {
            this.staleSweepIntervalSeconds = Math.max(1, staleSweepIntervalSeconds);
        }
    }

    public static class Browser {
        private boolean headless = true;
        private int viewportWidth = 1280;
        private int viewportHeight = 720;
        private String userAgent;
        private int navigationTimeoutMs = 20000;
        private int readyTimeoutMs = 15000;
        private int settleDelayMs = 1500;
        private int detailSettleDelayMs = 1200;
        private List<String> launchArgs = new ArrayList<>(List.of("--no-sandbox", "--disable-setuid-sandbox"));

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }

        public int getViewportWidth() {
            return Math.max(320, viewportWidth);
        }

        public void setViewportWidth(int viewportWidth) {
            this.viewportWidth = viewportWidth;
        }

        public int getViewportHeight() {
            return Math.max(240, viewportHeight);
        }

        public void setViewportHeight(int viewportHeight) {
            this.viewportHeight = viewportHeight;
        }

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getNavigationTimeoutMs() {
            return Math.max(1000, navigationTimeoutMs);
        }

        public void setNavigationTimeoutMs(int navigationTimeoutMs) {
            this.navigationTimeoutMs = navigationTimeoutMs;
        }

        public int getReadyTimeoutMs() {
            return Math.max(1, readyTimeoutMs);
        }

        public void setReadyTimeoutMs(int readyTimeoutMs) {
            this.readyTimeoutMs = readyTimeoutMs;
        }

        public int getSettleDelayMs() {
            return Math.max(0, settleDelayMs);
        }

        public void setSettleDelayMs(int settleDelayMs) {
            this.settleDelayMs = settleDelayMs;
        }

        public int getDetailSettleDelayMs() {
            return Math.max(0, detailSettleDelayMs);
        }

        public void setDetailSettleDelayMs(int detailSettleDelayMs) {
            this.detailSettleDelayMs = detailSettleDelayMs;
        }

        public List<String> getLaunchArgs() {
            return launchArgs;
        }

        public void setLaunchArgs(List<String> launchArgs) {
            this.launchArgs = launchArgs == null ? new ArrayList<>() : launchArgs;
        }
    }

    public static class Pattern {
        private boolean enabled = false;
        private double minScore = 0.7;
        private double likelyScore = 0.8;
        private double verifiedScore = 0.9;
        private int maxScrollIterations = 6;
        private int scrollDelayMs = 1200;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public double getMinScore() {
            return clampScore(minScore);
        }

        public void setMinScore(double minScore) {
            this.minScore = clampScore(minScore);
        }

        /**
         * Never below {@link #getMinScore()}, so a tile the matcher rejects cannot be tiered.
         */
        public double getLikelyScore() {
            return Math.max(getMinScore(), clampScore(likelyScore));
        }

        public void setLikelyScore(double likelyScore) {
            this.likelyScore = clampScore(likelyScore);
        }

        public double getVerifiedScore() {
            return Math.max(getLikelyScore(), clampScore(verifiedScore));
        }

        public void setVerifiedScore(double verifiedScore) {
            this.verifiedScore = clampScore(verifiedScore);
        }

        public int getMaxScrollIterations() {
            return Math.max(1, maxScrollIterations);
        }

        public void setMaxScrollIterations(int maxScrollIterations) {
            this.maxScrollIterations = Math.max(1, maxScrollIterations);
        }

        public int getScrollDelayMs() {
            return Math.max(0, scrollDelayMs);
        }

        public void setScrollDelayMs(int scrollDelayMs) {
            this.scrollDelayMs = scrollDelayMs;
        }

        private static double clampScore(double value) {
            if (Double.isNaN(value)) {
                return 0.0;
            }
            return Math.max(0.0, Math.min(1.0, value));
        }
    }

    public static class Capture {
        private int jpegQuality = 70;
        private int reloadDelayMs = 1200;

        public int getJpegQuality() {
            return Math.max(1, Math.min(100, jpegQuality));
        }

        public void setJpegQuality(int jpegQuality) {
            this.jpegQuality = jpegQuality;
        }

        public int getReloadDelayMs() {
            return Math.max(0, reloadDelayMs);
        }

        public void setReloadDelayMs(int reloadDelayMs) {
            this.reloadDelayMs = reloadDelayMs;
        }
    }

    public static class Retry {
        private int maxSourceAttempts = 2;

        public int getMaxSourceAttempts() {
            return Math.max(1, maxSourceAttempts);
        }

        public void setMaxSourceAttempts(int maxSourceAttempts) {
            this.maxSourceAttempts = Math.max(1, maxSourceAttempts);
        }
    }

    public static class Storage {
        private String endpoint;
        private String region;
        private String bucket;
        private String accessKeyId;
        private String secretAccessKey;
        private String baseUrl;
        private String prefix = "comp-collector";

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getBucket() {
            return bucket;
        }

        public void setBucket(String bucket) {
            this.bucket = bucket;
        }

        public String getAccessKeyId() {
            return accessKeyId;
        }

        public void setAccessKeyId(String accessKeyId) {
            this.accessKeyId = accessKeyId;
        }

        public String getSecretAccessKey() {
            return secretAccessKey;
        }

        public void setSecretAccessKey(String secretAccessKey) {
            this.secretAccessKey = secretAccessKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getPrefix() {
            return prefix == null ? "" : prefix.trim();
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }
    }

    public static class AutoAttach {
        private boolean enabled = true;
        private String source = "ebay_sold";
        private int topK = 5;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getSource() {
            return source;
        }

        public void setSource(String source) {
            this.source = source;
        }

        public int getTopK() {
            return Math.max(1, topK);
        }

        public void setTopK(int topK) {
            this.topK = Math.max(1, topK);
        }
    }

    public static class Reference {
        private boolean enabled = false;
        private int pollIntervalMs = 30000;
        private int batchSize = 10;
        private int minDimension = 320;
        private int maxAttempts = 5;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getPollIntervalMs() {
            return Math.max(1000, pollIntervalMs);
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }

        public int getMinDimension() {
            return Math.max(1, minDimension);
        }

        public void setMinDimension(int minDimension) {
            this.minDimension = Math.max(1, minDimension);
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }
    }

    public static class Http {
        private int requestTimeoutSeconds = 15;
        private int maxImageBytes = 8 * 1024 * 1024;

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getMaxImageBytes() {
            return Math.max(1024, maxImageBytes);
        }

        public void setMaxImageBytes(int maxImageBytes) {
            this.maxImageBytes = maxImageBytes;
        }
    }

    public static class Cli {
        private boolean enqueue;
        private String query = "";
        private String sources = "ebay_sold,tcgplayer";
        private String subjectId;
        private int maxComps = 5;
        private int maxAgeDays = 730;
        private boolean exitAfterEnqueue = true;

        public boolean isEnqueue() {
            return enqueue;
        }

        public void setEnqueue(boolean enqueue) {
            this.enqueue = enqueue;
        }

        public String getQuery() {
            return query;
        }

        public void setQuery(String query) {
            this.query = query;
        }

        public String getSources() {
            return sources;
        }

        public void setSources(String sources) {
            this.sources = sources;
        }

        public String getSubjectId() {
            return subjectId;
        }

        public void setSubjectId(String subjectId) {
            this.subjectId = subjectId;
        }

        public int getMaxComps() {
            return Math.max(1, maxComps);
        }

        public void setMaxComps(int maxComps) {
            this.maxComps = maxComps;
        }

        public int getMaxAgeDays() {
            return Math.max(1, maxAgeDays);
        }

        public void setMaxAgeDays(int maxAgeDays) {
            this.maxAgeDays = maxAgeDays;
        }

        public boolean isExitAfterEnqueue() {
            return exitAfterEnqueue;
        }

        public void setExitAfterEnqueue(boolean exitAfterEnqueue) {
            this.exitAfterEnqueue = exitAfterEnqueue;
        }
    }

    public static class CardLadder {
        private String bearerToken;
        private String appCheckToken;

        public String getBearerToken() {
            return bearerToken;
        }

        public void setBearerToken(String bearerToken) {
            this.bearerToken = bearerToken;
        }

        public String getAppCheckToken() {
            return appCheckToken;
        }

        public void setAppCheckToken(String appCheckToken) {
            this.appCheckToken = appCheckToken;
        }
    }
}
