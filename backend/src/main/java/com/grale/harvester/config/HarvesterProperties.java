package com.grale.harvester.config;

import com.grale.harvester.harvest.http.SessionSettings;
import com.grale.harvester.harvest.model.OutputMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@ConfigurationProperties(prefix = "grale")
public class HarvesterProperties {
    private static final String DEFAULT_USER_AGENT = "grale-harvester/0.1";
    private static final String DEFAULT_OUT_SR = "4326";

    private String userAgent;
    private int maxWorkers;
    private int connectTimeoutSeconds = 30;
    private int readTimeoutSeconds = 180;
    private int requestMaxRetries = 5;
    private int requestRetryBaseDelayMs = 0;
    private int requestRetryMaxDelayMs = 10_000;
    private List<Integer> retryStatusCodes = List.of(408, 429, 500, 502, 503, 504);
    private boolean verifyTls = true;
    private String defaultOutSr = DEFAULT_OUT_SR;
    private OutputMode outputMode = OutputMode.MEMORY;
    private String spillDirectory;
    private boolean cleanup = true;
    private int asyncRetention = 20;
    private Pkcs12 pkcs12 = new Pkcs12();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getMaxWorkers() {
        return Math.max(0, maxWorkers);
    }

    public void setMaxWorkers(int maxWorkers) {
        this.maxWorkers = Math.max(0, maxWorkers);
    }

    public int resolvedMaxWorkers() {
        int configured = getMaxWorkers();
        return configured > 0 ? configured : Runtime.getRuntime().availableProcessors() * 5;
    }

    public int getConnectTimeoutSeconds() {
        return Math.max(1, connectTimeoutSeconds);
    }

    public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
        this.connectTimeoutSeconds = Math.max(1, connectTimeoutSeconds);
    }

    public int getReadTimeoutSeconds() {
        return Math.max(1, readTimeoutSeconds);
    }

    public void setReadTimeoutSeconds(int readTimeoutSeconds) {
        this.readTimeoutSeconds = Math.max(1, readTimeoutSeconds);
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = Math.max(0, requestRetryBaseDelayMs);
    }

    public int getRequestRetryMaxDelayMs() {
        return Math.max(getRequestRetryBaseDelayMs(), requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = Math.max(0, requestRetryMaxDelayMs);
    }

    public List<Integer> getRetryStatusCodes() {
        return retryStatusCodes;
    }

    public void setRetryStatusCodes(List<Integer> retryStatusCodes) {
        this.retryStatusCodes = retryStatusCodes == null ? List.of() : retryStatusCodes;
    }

    public boolean isVerifyTls() {
        return verifyTls;
    }

    public void setVerifyTls(boolean verifyTls) {
        this.verifyTls = verifyTls;
    }

    public String getDefaultOutSr() {
        return defaultOutSr == null || defaultOutSr.isBlank() ? DEFAULT_OUT_SR : defaultOutSr.trim();
    }

    public void setDefaultOutSr(String defaultOutSr) {
        this.defaultOutSr = defaultOutSr;
    }

    public OutputMode getOutputMode() {
        return outputMode == null ? OutputMode.MEMORY : outputMode;
    }

    public void setOutputMode(OutputMode outputMode) {
        this.outputMode = outputMode;
    }

    public String getSpillDirectory() {
        return spillDirectory;
    }

    public void setSpillDirectory(String spillDirectory) {
        this.spillDirectory = spillDirectory;
    }

    public Path spillDirectoryPath() {
        return spillDirectory == null || spillDirectory.isBlank() ? null : Path.of(spillDirectory.trim());
    }

    public boolean isCleanup() {
        return cleanup;
    }

    public void setCleanup(boolean cleanup) {
        this.cleanup = cleanup;
    }

    public int getAsyncRetention() {
        return Math.max(1, asyncRetention);
    }

    public void setAsyncRetention(int asyncRetention) {
        this.asyncRetention = Math.max(1, asyncRetention);
    }

    public Pkcs12 getPkcs12() {
        return pkcs12;
    }

    public void setPkcs12(Pkcs12 pkcs12) {
        this.pkcs12 = pkcs12;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public SessionSettings toSessionSettings() {
        Set<Integer> codes = new LinkedHashSet<>(getRetryStatusCodes());
        Path certificate = pkcs12.getPath() == null || pkcs12.getPath().isBlank() ? null : Path.of(pkcs12.getPath().trim());
        char[] password = pkcs12.getPassword() == null ? null : pkcs12.getPassword().toCharArray();
        return new SessionSettings(
            getUserAgent(),
            getConnectTimeoutSeconds(),
            getReadTimeoutSeconds(),
            getRequestMaxRetries(),
            getRequestRetryBaseDelayMs(),
            getRequestRetryMaxDelayMs(),
            Set.copyOf(codes),
            isVerifyTls(),
            certificate,
            password,
            Map.of()
        );
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Pkcs12 {
        private String path;
        private String password;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }
    }

    public static class Cli {
        private boolean run;
        private String url;
        private String where;
        private String outFields = "";
        private Integer chunkSize;
        private String outDir;
        private OutputMode outputMode;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getWhere() {
            return where;
        }

        public void setWhere(String where) {
            this.where = where;
        }

        public String getOutFields() {
            return outFields;
        }

        public void setOutFields(String outFields) {
            this.outFields = outFields;
        }

        public Integer getChunkSize() {
            return chunkSize == null ? null : Math.max(1, chunkSize);
        }

        public void setChunkSize(Integer chunkSize) {
            this.chunkSize = chunkSize;
        }

        public String getOutDir() {
            return outDir;
        }

        public void setOutDir(String outDir) {
            this.outDir = outDir;
        }

        public OutputMode getOutputMode() {
            return outputMode;
        }

        public void setOutputMode(OutputMode outputMode) {
            this.outputMode = outputMode;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
