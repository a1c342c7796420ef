package com.delta.factengine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@ConfigurationProperties(prefix = "engine")
public class EngineProperties {
    private static final String DEFAULT_USER_AGENT = "fact-engine/0.1 (+contact)";
    private static final String DEFAULT_CURRENCY = "USD";
    /** Upper bound on concurrent company workers in a run. */
    public static final int MAX_CONCURRENCY = 16;

    private String userAgent;
    private int globalConcurrency = 3;
    private int perHostDelayMs = 1000;
    private int requestTimeoutSeconds = 20;
    private int freshnessWindowHours = 24;
    private String storageCurrency = DEFAULT_CURRENCY;
    private String defaultSourceCurrency = DEFAULT_CURRENCY;
    private int progressLogInterval = 25;
    private double priceJumpThreshold = 0.25;
    private int shutdownGraceSeconds = 60;
    private Retry retry = new Retry();
    private Lease lease = new Lease();
    private Reconcile reconcile = new Reconcile();
    private Sources sources = new Sources();
    private Fx fx = new Fx();
    private Data data = new Data();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getGlobalConcurrency() {
        return clampConcurrency(globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = clampConcurrency(globalConcurrency);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getFreshnessWindowHours() {
        return Math.max(0, freshnessWindowHours);
    }

    public void setFreshnessWindowHours(int freshnessWindowHours) {
        this.freshnessWindowHours = Math.max(0, freshnessWindowHours);
    }

    public String getStorageCurrency() {
        return normalizeCurrency(storageCurrency);
    }

    public void setStorageCurrency(String storageCurrency) {
        this.storageCurrency = normalizeCurrency(storageCurrency);
    }

    public String getDefaultSourceCurrency() {
        return normalizeCurrency(defaultSourceCurrency);
    }

    public void setDefaultSourceCurrency(String defaultSourceCurrency) {
        this.defaultSourceCurrency = normalizeCurrency(defaultSourceCurrency);
    }

    public int getProgressLogInterval() {
        return Math.max(1, progressLogInterval);
    }

    public void setProgressLogInterval(int progressLogInterval) {
        this.progressLogInterval = Math.max(1, progressLogInterval);
    }

    public double getPriceJumpThreshold() {
        return priceJumpThreshold > 0 ? priceJumpThreshold : 0.25;
    }

    public void setPriceJumpThreshold(double priceJumpThreshold) {
        this.priceJumpThreshold = priceJumpThreshold;
    }

    public int getShutdownGraceSeconds() {
        return Math.max(1, shutdownGraceSeconds);
    }

    public void setShutdownGraceSeconds(int shutdownGraceSeconds) {
        this.shutdownGraceSeconds = Math.max(1, shutdownGraceSeconds);
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Lease getLease() {
        return lease;
    }

    public void setLease(Lease lease) {
        this.lease = lease;
    }

    public Reconcile getReconcile() {
        return reconcile;
    }

    public void setReconcile(Reconcile reconcile) {
        this.reconcile = reconcile;
    }

    public Sources getSources() {
        return sources;
    }

    public void setSources(Sources sources) {
        this.sources = sources;
    }

    public Fx getFx() {
        return fx;
    }

    public void setFx(Fx fx) {
        this.fx = fx;
    }

    public Data getData() {
        return data;
    }

    public void setData(Data data) {
        this.data = data;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static String normalizeCurrency(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_CURRENCY;
        }
        return candidate.trim().toUpperCase(Locale.ROOT);
    }

    private static int clampConcurrency(int value) {
        return Math.max(1, Math.min(MAX_CONCURRENCY, value));
    }

    public static class Retry {
        private int maxRetries = 2;
        private long baseDelayMs = 2000;
        private long timeoutMs = 35000;

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public long getBaseDelayMs() {
            return Math.max(0, baseDelayMs);
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = Math.max(0, baseDelayMs);
        }

        public long getTimeoutMs() {
            return Math.max(1, timeoutMs);
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = Math.max(1, timeoutMs);
        }
    }

    public static class Lease {
        private String path = "./fact-engine.lock";
        private int staleAfterMinutes = 30;
        private int heartbeatSeconds = 60;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public int getStaleAfterMinutes() {
            return Math.max(1, staleAfterMinutes);
        }

        public void setStaleAfterMinutes(int staleAfterMinutes) {
            this.staleAfterMinutes = Math.max(1, staleAfterMinutes);
        }

        public int getHeartbeatSeconds() {
            return Math.max(1, heartbeatSeconds);
        }

        public void setHeartbeatSeconds(int heartbeatSeconds) {
            this.heartbeatSeconds = Math.max(1, heartbeatSeconds);
        }
    }

    public static class Reconcile {
        private double discrepancyThreshold = 0.10;

        public double getDiscrepancyThreshold() {
            return Math.max(0.0, discrepancyThreshold);
        }

        public void setDiscrepancyThreshold(double discrepancyThreshold) {
            this.discrepancyThreshold = Math.max(0.0, discrepancyThreshold);
        }
    }

    public static class Sources {
        private QuoteApi quoteApi = new QuoteApi();
        private SummaryPage summaryPage = new SummaryPage();

        public QuoteApi getQuoteApi() {
            return quoteApi;
        }

        public void setQuoteApi(QuoteApi quoteApi) {
            this.quoteApi = quoteApi;
        }

        public SummaryPage getSummaryPage() {
            return summaryPage;
        }

        public void setSummaryPage(SummaryPage summaryPage) {
            this.summaryPage = summaryPage;
        }
    }

    public static class QuoteApi {
        private boolean enabled = true;
        private int priority = 1;
        private String urlTemplate = "https://query2.finance.yahoo.com/v10/finance/quoteSummary/{ticker}"
            + "?modules=price,summaryDetail,financialData,defaultKeyStatistics,incomeStatementHistory,balanceSheetHistory";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getPriority() {
            return priority;
        }

        public void setPriority(int priority) {
            this.priority = priority;
        }

        public String getUrlTemplate() {
            return urlTemplate;
        }

        public void setUrlTemplate(String urlTemplate) {
            this.urlTemplate = urlTemplate;
        }
    }

    public static class SummaryPage {
        private boolean enabled = false;
        private int priority = 2;
        private String urlTemplate = "https://www.google.com/finance/quote/{ticker}?hl=en";
        private String currency;
        private Map<String, String> labels = defaultLabels();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getPriority() {
            return priority;
        }

        public void setPriority(int priority) {
            this.priority = priority;
        }

        public String getUrlTemplate() {
            return urlTemplate;
        }

        public void setUrlTemplate(String urlTemplate) {
            this.urlTemplate = urlTemplate;
        }

        public String getCurrency() {
            return currency;
        }

        public void setCurrency(String currency) {
            this.currency = currency;
        }

        public Map<String, String> getLabels() {
            return labels;
        }

        public void setLabels(Map<String, String> labels) {
            this.labels = labels == null ? new LinkedHashMap<>() : labels;
        }

        private static Map<String, String> defaultLabels() {
            Map<String, String> labels = new LinkedHashMap<>();
            labels.put("market cap", "market_cap_value");
            labels.put("market value", "market_cap_value");
            labels.put("shares outstanding", "shares_outstanding");
            labels.put("revenue", "revenue_value");
            labels.put("net income", "net_income_value");
            labels.put("ebitda", "ebitda");
            labels.put("total debt", "debt_value");
            labels.put("total liabilities", "liabilities");
            labels.put("cash", "cash_value");
            labels.put("free cash flow", "free_cash_flow");
            return labels;
        }
    }

    public static class Fx {
        private boolean refreshOnStart = false;
        private String apiUrl = "https://api.frankfurter.app/latest";
        private List<String> baseCurrencies = new ArrayList<>(List.of("USD", "CAD", "AUD"));
        private List<String> targetCurrencies = new ArrayList<>(List.of("USD", "CAD"));

        public boolean isRefreshOnStart() {
            return refreshOnStart;
        }

        public void setRefreshOnStart(boolean refreshOnStart) {
            this.refreshOnStart = refreshOnStart;
        }

        public String getApiUrl() {
            return apiUrl;
        }

        public void setApiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
        }

        public List<String> getBaseCurrencies() {
            return baseCurrencies;
        }

        public void setBaseCurrencies(List<String> baseCurrencies) {
            this.baseCurrencies = baseCurrencies == null ? new ArrayList<>() : baseCurrencies;
        }

        public List<String> getTargetCurrencies() {
            return targetCurrencies;
        }

        public void setTargetCurrencies(List<String> targetCurrencies) {
            this.targetCurrencies = targetCurrencies == null ? new ArrayList<>() : targetCurrencies;
        }
    }

    public static class Data {
        private String companiesCsv = "../data/companies.csv";

        public String getCompaniesCsv() {
            return companiesCsv;
        }

        public void setCompaniesCsv(String companiesCsv) {
            this.companiesCsv = companiesCsv;
        }
    }

    public static class Cli {
        private boolean run;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
