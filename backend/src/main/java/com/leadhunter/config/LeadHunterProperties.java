package com.leadhunter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "leadhunter")
public class LeadHunterProperties {
    public static final int MAX_RESULTS_LIMIT = 1000;
    public static final int MINIMUM_DELAY_FLOOR_MS = 300;

    private int maxResults = 500;
    private int requestTimeoutSeconds = 30;
    private int maxRetries = 3;
    private int retryDelayMs = 5000;
    private int expansionDepth = 3;
    private int maxQueriesPerSource = 3;
    private boolean enrichmentEnabled = true;
    private boolean validateEmails = true;
    private int maxConcurrentAcquisitions = 3;
    private int maxConcurrentBrowserSessions = 2;
    private int enrichmentConcurrency = 4;
    private int apiRetries = 0;
    private String languageCode = "en";
    private String professionalNetworkDomain = "www.linkedin.com";
    private String searchDomain = "google.com";
    private Rate rate = new Rate();
    private Proxy proxy = new Proxy();
    private Pacing pacing = new Pacing();
    private Cache cache = new Cache();
    private ApiKeys apiKeys = new ApiKeys();
    private ApiUrls apiUrls = new ApiUrls();
    private Output output = new Output();
    private Cli cli = new Cli();

    /**
     * Rejects settings the pipeline cannot run with. Called once when the generator factory is built.
     */
    public void validate() {
        if (maxResults <= 0 || maxResults > MAX_RESULTS_LIMIT) {
            throw new ConfigException(
                ConfigException.Kind.INVALID_RANGE,
                "max-results must be within 1.." + MAX_RESULTS_LIMIT + " but was " + maxResults
            );
        }
        if (expansionDepth <= 0) {
            throw new ConfigException(ConfigException.Kind.INVALID_RANGE, "expansion-depth must be positive");
        }
        if (maxRetries < 0) {
            throw new ConfigException(ConfigException.Kind.INVALID_RANGE, "max-retries must not be negative");
        }
        if (rate.getDelayMinMs() < MINIMUM_DELAY_FLOOR_MS || rate.getDelayMaxMs() < rate.getDelayMinMs()) {
            throw new ConfigException(
                ConfigException.Kind.INVALID_RANGE,
                "delay range must satisfy " + MINIMUM_DELAY_FLOOR_MS + " <= min <= max but was "
                    + rate.getDelayMinMs() + ".." + rate.getDelayMaxMs()
            );
        }
        if (rate.getProfessionalNetworkRequestsPerMinute() <= 0) {
            throw new ConfigException(
                ConfigException.Kind.INVALID_RANGE,
                "professional-network-requests-per-minute must be positive"
            );
        }
        if (pacing.getBeforeMaxMs() < pacing.getBeforeMinMs() || pacing.getAfterMaxMs() < pacing.getAfterMinMs()) {
            throw new ConfigException(ConfigException.Kind.INVALID_RANGE, "pacing ranges must satisfy min <= max");
        }
        if (proxy.isEnabled() && (proxy.getList() == null || proxy.getList().isBlank())) {
            throw new ConfigException(
                ConfigException.Kind.MISSING_REQUIRED_PROXY,
                "Proxy enabled but no proxies provided"
            );
        }
    }

    public int getMaxResults() {
        return maxResults;
    }

    public void setMaxResults(int maxResults) {
        this.maxResults = maxResults;
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public int getRetryDelayMs() {
        return Math.max(0, retryDelayMs);
    }

    public void setRetryDelayMs(int retryDelayMs) {
        this.retryDelayMs = retryDelayMs;
    }

    public int getExpansionDepth() {
        return expansionDepth;
    }

    public void setExpansionDepth(int expansionDepth) {
        this.expansionDepth = expansionDepth;
    }

    public int getMaxQueriesPerSource() {
        return Math.max(1, maxQueriesPerSource);
    }

    public void setMaxQueriesPerSource(int maxQueriesPerSource) {
        this.maxQueriesPerSource = Math.max(1, maxQueriesPerSource);
    }

    public boolean isEnrichmentEnabled() {
        return enrichmentEnabled;
    }

    public void setEnrichmentEnabled(boolean enrichmentEnabled) {
        this.enrichmentEnabled = enrichmentEnabled;
    }

    public boolean isValidateEmails() {
        return validateEmails;
    }

    public void setValidateEmails(boolean validateEmails) {
        this.validateEmails = validateEmails;
    }

    public int getMaxConcurrentAcquisitions() {
        return Math.max(1, maxConcurrentAcquisitions);
    }

    public void setMaxConcurrentAcquisitions(int maxConcurrentAcquisitions) {
        this.maxConcurrentAcquisitions = Math.max(1, maxConcurrentAcquisitions);
    }

    public int getMaxConcurrentBrowserSessions() {
        return Math.max(1, maxConcurrentBrowserSessions);
    }

    public void setMaxConcurrentBrowserSessions(int maxConcurrentBrowserSessions) {
        this.maxConcurrentBrowserSessions = Math.max(1, maxConcurrentBrowserSessions);
    }

    public int getEnrichmentConcurrency() {
        return Math.max(1, enrichmentConcurrency);
    }

    public void setEnrichmentConcurrency(int enrichmentConcurrency) {
        this.enrichmentConcurrency = Math.max(1, enrichmentConcurrency);
    }

    public int getApiRetries() {
        return Math.max(0, apiRetries);
    }

    public void setApiRetries(int apiRetries) {
        this.apiRetries = Math.max(0, apiRetries);
    }

    public String getLanguageCode() {
        return languageCode == null || languageCode.isBlank() ? "en" : languageCode.trim();
    }

    public void setLanguageCode(String languageCode) {
        this.languageCode = languageCode;
    }

    public String getProfessionalNetworkDomain() {
        return professionalNetworkDomain;
    }

    public void setProfessionalNetworkDomain(String professionalNetworkDomain) {
        this.professionalNetworkDomain = professionalNetworkDomain;
    }

    public String getSearchDomain() {
        return searchDomain;
    }

    public void setSearchDomain(String searchDomain) {
        this.searchDomain = searchDomain;
    }

    public Rate getRate() {
        return rate;
    }

    public void setRate(Rate rate) {
        this.rate = rate;
    }

    public Proxy getProxy() {
        return proxy;
    }

    public void setProxy(Proxy proxy) {
        this.proxy = proxy;
    }

    public Pacing getPacing() {
        return pacing;
    }

    public void setPacing(Pacing pacing) {
        this.pacing = pacing;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public ApiKeys getApiKeys() {
        return apiKeys;
    }

    public void setApiKeys(ApiKeys apiKeys) {
        this.apiKeys = apiKeys;
    }

    public ApiUrls getApiUrls() {
        return apiUrls;
    }

    public void setApiUrls(ApiUrls apiUrls) {
        this.apiUrls = apiUrls;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static class Rate {
        private int professionalNetworkRequestsPerMinute = 5;
        private int delayMinMs = 500;
        private int delayMaxMs = 2500;

        public int getProfessionalNetworkRequestsPerMinute() {
            return professionalNetworkRequestsPerMinute;
        }

        public void setProfessionalNetworkRequestsPerMinute(int professionalNetworkRequestsPerMinute) {
            this.professionalNetworkRequestsPerMinute = professionalNetworkRequestsPerMinute;
        }

        public int getDelayMinMs() {
            return delayMinMs;
        }

        public void setDelayMinMs(int delayMinMs) {
            this.delayMinMs = delayMinMs;
        }

        public int getDelayMaxMs() {
            return delayMaxMs;
        }

        public void setDelayMaxMs(int delayMaxMs) {
            this.delayMaxMs = delayMaxMs;
        }
    }

    public static class Proxy {
        private boolean enabled = false;
        /**
         * Path to a file with one proxy per line, or a comma-separated list.
         */
        private String list = "";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getList() {
            return list;
        }

        public void setList(String list) {
            this.list = list;
        }
    }

    public static class Pacing {
        private int beforeMinMs = 1500;
        private int beforeMaxMs = 4500;
        private int afterMinMs = 1000;
        private int afterMaxMs = 3000;

        public int getBeforeMinMs() {
            return Math.max(0, beforeMinMs);
        }

        public void setBeforeMinMs(int beforeMinMs) {
            this.beforeMinMs = beforeMinMs;
        }

        public int getBeforeMaxMs() {
            return Math.max(0, beforeMaxMs);
        }

        public void setBeforeMaxMs(int beforeMaxMs) {
            this.beforeMaxMs = beforeMaxMs;
        }

        public int getAfterMinMs() {
            return Math.max(0, afterMinMs);
        }

        public void setAfterMinMs(int afterMinMs) {
            this.afterMinMs = afterMinMs;
        }

        public int getAfterMaxMs() {
            return Math.max(0, afterMaxMs);
        }

        public void setAfterMaxMs(int afterMaxMs) {
            this.afterMaxMs = afterMaxMs;
        }
    }

    public static class Cache {
        private int maxEntries = 256;
        private int ttlMinutes = 15;

        public int getMaxEntries() {
            return Math.max(1, maxEntries);
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = Math.max(1, maxEntries);
        }

        public int getTtlMinutes() {
            return Math.max(1, ttlMinutes);
        }

        public void setTtlMinutes(int ttlMinutes) {
            this.ttlMinutes = Math.max(1, ttlMinutes);
        }
    }

    public static class ApiKeys {
        private String scrapingApi;
        private String emailFinder;
        private String companyData;
        private String socialLookup;
        private String phoneValidatorSid;
        private String phoneValidatorToken;
        private String emailVerifier;

        public String getScrapingApi() {
            return scrapingApi;
        }

        public void setScrapingApi(String scrapingApi) {
            this.scrapingApi = scrapingApi;
        }

        public String getEmailFinder() {
            return emailFinder;
        }

        public void setEmailFinder(String emailFinder) {
            this.emailFinder = emailFinder;
        }

        public String getCompanyData() {
            return companyData;
        }

        public void setCompanyData(String companyData) {
            this.companyData = companyData;
        }

        public String getSocialLookup() {
            return socialLookup;
        }

        public void setSocialLookup(String socialLookup) {
            this.socialLookup = socialLookup;
        }

        public String getPhoneValidatorSid() {
            return phoneValidatorSid;
        }

        public void setPhoneValidatorSid(String phoneValidatorSid) {
            this.phoneValidatorSid = phoneValidatorSid;
        }

        public String getPhoneValidatorToken() {
            return phoneValidatorToken;
        }

        public void setPhoneValidatorToken(String phoneValidatorToken) {
            this.phoneValidatorToken = phoneValidatorToken;
        }

        public String getEmailVerifier() {
            return emailVerifier;
        }

        public void setEmailVerifier(String emailVerifier) {
            this.emailVerifier = emailVerifier;
        }

        public static boolean isPresent(String key) {
            return key != null && !key.isBlank();
        }
    }

    public static class ApiUrls {
        private String scrapingApi = "https://app.scrapingbee.com/api/v1";
        private String emailFinder = "https://api.hunter.io/v2/domain-search";
        private String companyData = "https://company.clearbit.com/v2/companies/find";
        private String socialLookup = "https://api.fullcontact.com/v3/person.enrich";
        private String phoneValidator = "https://lookups.twilio.com/v1/PhoneNumbers/";
        private String emailVerifier = "http://apilayer.net/api/check";

        public String getScrapingApi() {
            return scrapingApi;
        }

        public void setScrapingApi(String scrapingApi) {
            this.scrapingApi = scrapingApi;
        }

        public String getEmailFinder() {
            return emailFinder;
        }

        public void setEmailFinder(String emailFinder) {
            this.emailFinder = emailFinder;
        }

        public String getCompanyData() {
            return companyData;
        }

        public void setCompanyData(String companyData) {
            this.companyData = companyData;
        }

        public String getSocialLookup() {
            return socialLookup;
        }

        public void setSocialLookup(String socialLookup) {
            this.socialLookup = socialLookup;
        }

        public String getPhoneValidator() {
            return phoneValidator;
        }

        public void setPhoneValidator(String phoneValidator) {
            this.phoneValidator = phoneValidator;
        }

        public String getEmailVerifier() {
            return emailVerifier;
        }

        public void setEmailVerifier(String emailVerifier) {
            this.emailVerifier = emailVerifier;
        }
    }

    public static class Output {
        private String directory = ".";

        public String getDirectory() {
            return directory == null || directory.isBlank() ? "." : directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }
    }

    public static class Cli {
        private boolean run;
        private String jobTitle = "";
        private String industry = "";
        private String location = "";
        private String regions = "";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getJobTitle() {
            return jobTitle;
        }

        public void setJobTitle(String jobTitle) {
            this.jobTitle = jobTitle;
        }

        public String getIndustry() {
            return industry;
        }

        public void setIndustry(String industry) {
            this.industry = industry;
        }

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }

        public String getRegions() {
            return regions;
        }

        public void setRegions(String regions) {
            this.regions = regions;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
