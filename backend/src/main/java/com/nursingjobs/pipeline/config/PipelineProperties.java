package com.nursingjobs.pipeline.config;

import com.nursingjobs.pipeline.ingest.model.PageFormat;
import com.nursingjobs.pipeline.ingest.model.PaginationStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36";

    private String userAgent;
    private int requestTimeoutSeconds = 20;
    private int requestMaxRetries = 2;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 5000;
    private int perHostDelayMs = 750;
    private String siteUrl = "https://example.org";
    private String jobPathPrefix = "/jobs/nursing/";
    private Classification classification = new Classification();
    private Announce announce = new Announce();
    private Notify notify = new Notify();
    private Logs logs = new Logs();
    private Lookup lookup = new Lookup();
    private Cli cli = new Cli();
    private List<SourceBinding> sources = new ArrayList<>();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
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
        return Math.max(0, requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = Math.max(0, requestRetryMaxDelayMs);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public String getSiteUrl() {
        return siteUrl;
    }

    public void setSiteUrl(String siteUrl) {
        if (siteUrl != null && siteUrl.endsWith("/")) {
            siteUrl = siteUrl.substring(0, siteUrl.length() - 1);
        }
        this.siteUrl = siteUrl;
    }

    public String getJobPathPrefix() {
        return jobPathPrefix;
    }

    public void setJobPathPrefix(String jobPathPrefix) {
        this.jobPathPrefix = jobPathPrefix;
    }

    public Classification getClassification() {
        return classification;
    }

    public void setClassification(Classification classification) {
        this.classification = classification;
    }

    public Announce getAnnounce() {
        return announce;
    }

    public void setAnnounce(Announce announce) {
        this.announce = announce;
    }

    public Notify getNotify() {
        return notify;
    }

    public void setNotify(Notify notify) {
        this.notify = notify;
    }

    public Logs getLogs() {
        return logs;
    }

    public void setLogs(Logs logs) {
        this.logs = logs;
    }

    public Lookup getLookup() {
        return lookup;
    }

    public void setLookup(Lookup lookup) {
        this.lookup = lookup;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public List<SourceBinding> getSources() {
        return sources;
    }

    public void setSources(List<SourceBinding> sources) {
        this.sources = sources == null ? new ArrayList<>() : sources;
    }

    public SourceBinding findSource(String slug) {
        if (slug == null || slug.isBlank()) {
            return null;
        }
        String key = slug.trim().toLowerCase(Locale.ROOT);
        for (SourceBinding source : sources) {
            if (source.getSlug() != null && source.getSlug().equalsIgnoreCase(key)) {
                return source;
            }
        }
        return null;
    }

    /**
     * Public URL of a job page on the site, e.g. {@code https://example.org/jobs/nursing/icu-rn-akron-oh-123}.
     */
    public String jobUrl(String slug) {
        String prefix = jobPathPrefix == null || jobPathPrefix.isBlank() ? "/" : jobPathPrefix;
        if (!prefix.startsWith("/")) {
            prefix = "/" + prefix;
        }
        if (!prefix.endsWith("/")) {
            prefix = prefix + "/";
        }
        return siteUrl + prefix + slug;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Classification {
        private String endpoint = "https://api.openai.com/v1/chat/completions";
        private String apiKey;
        private String model = "gpt-5-mini";
        private int batchSize = 25;
        private int concurrency = 3;
        private int timeoutSeconds = 60;
        private double costPerCallUsd = 0.0006;
        private int maxDescriptionChars = 1300;
        private int maxResponseBytes = 16384;
        private int maxCompletionTokens = 1500;
        private boolean failRunWhenAllFail = true;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }

        public int getConcurrency() {
            return Math.max(1, concurrency);
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public double getCostPerCallUsd() {
            return Math.max(0.0, costPerCallUsd);
        }

        public void setCostPerCallUsd(double costPerCallUsd) {
            this.costPerCallUsd = costPerCallUsd;
        }

        public int getMaxDescriptionChars() {
            return Math.max(100, maxDescriptionChars);
        }

        public void setMaxDescriptionChars(int maxDescriptionChars) {
            this.maxDescriptionChars = maxDescriptionChars;
        }

        public int getMaxResponseBytes() {
            return Math.max(1024, maxResponseBytes);
        }

        public void setMaxResponseBytes(int maxResponseBytes) {
            this.maxResponseBytes = maxResponseBytes;
        }

        public int getMaxCompletionTokens() {
            return Math.max(1, maxCompletionTokens);
        }

        public void setMaxCompletionTokens(int maxCompletionTokens) {
            this.maxCompletionTokens = maxCompletionTokens;
        }

        public boolean isFailRunWhenAllFail() {
            return failRunWhenAllFail;
        }

        public void setFailRunWhenAllFail(boolean failRunWhenAllFail) {
            this.failRunWhenAllFail = failRunWhenAllFail;
        }
    }

    public static class Announce {
        private boolean enabled = true;
        private List<String> endpoints = new ArrayList<>(List.of("https://api.indexnow.org/IndexNow"));
        private String key;
        private String keyLocation;
        private int batchSize = 50;
        private long delayBetweenBatchesMs = 180_000L;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<String> getEndpoints() {
            return endpoints;
        }

        public void setEndpoints(List<String> endpoints) {
            this.endpoints = endpoints == null ? new ArrayList<>() : endpoints;
        }

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }

        public String getKeyLocation() {
            return keyLocation;
        }

        public void setKeyLocation(String keyLocation) {
            this.keyLocation = keyLocation;
        }

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }

        public long getDelayBetweenBatchesMs() {
            return Math.max(0L, delayBetweenBatchesMs);
        }

        public void setDelayBetweenBatchesMs(long delayBetweenBatchesMs) {
            this.delayBetweenBatchesMs = Math.max(0L, delayBetweenBatchesMs);
        }
    }

    public static class Notify {
        private boolean enabled = false;
        private String from = "noreply@example.org";
        private String to;
        private String subjectPrefix = "[job-pipeline]";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getFrom() {
            return from;
        }

        public void setFrom(String from) {
            this.from = from;
        }

        public String getTo() {
            return to;
        }

        public void setTo(String to) {
            this.to = to;
        }

        public String getSubjectPrefix() {
            return subjectPrefix;
        }

        public void setSubjectPrefix(String subjectPrefix) {
            this.subjectPrefix = subjectPrefix;
        }
    }

    public static class Logs {
        private String directory = "logs";
        private int retentionDays = 30;
        private int tailLines = 20;

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public int getRetentionDays() {
            return Math.max(1, retentionDays);
        }

        public void setRetentionDays(int retentionDays) {
            this.retentionDays = Math.max(1, retentionDays);
        }

        public int getTailLines() {
            return Math.max(1, tailLines);
        }

        public void setTailLines(int tailLines) {
            this.tailLines = Math.max(1, tailLines);
        }
    }

    public static class Lookup {
        private int notFoundCacheSeconds = 300;
        private int notFoundCacheMaxEntries = 10_000;

        public int getNotFoundCacheSeconds() {
            return Math.max(0, notFoundCacheSeconds);
        }

        public void setNotFoundCacheSeconds(int notFoundCacheSeconds) {
            this.notFoundCacheSeconds = Math.max(0, notFoundCacheSeconds);
        }

        public int getNotFoundCacheMaxEntries() {
            return Math.max(1, notFoundCacheMaxEntries);
        }

        public void setNotFoundCacheMaxEntries(int notFoundCacheMaxEntries) {
            this.notFoundCacheMaxEntries = notFoundCacheMaxEntries;
        }
    }

    public static class Cli {
        private boolean run = false;
        private String employer;
        private Integer maxPages;
        private Integer maxItems;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getEmployer() {
            return employer;
        }

        public void setEmployer(String employer) {
            this.employer = employer;
        }

        public Integer getMaxPages() {
            return maxPages;
        }

        public void setMaxPages(Integer maxPages) {
            this.maxPages = maxPages;
        }

        public Integer getMaxItems() {
            return maxItems;
        }

        public void setMaxItems(Integer maxItems) {
            this.maxItems = maxItems;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }

    /**
     * Binds one employer to the source adapter variant that can read its career site.
     */
    public static class SourceBinding {
        private String slug;
        private String name;
        private String careerPageUrl;
        private PaginationStrategy strategy = PaginationStrategy.PARAMETER;
        private PageFormat format = PageFormat.HTML;
        private String method = "GET";
        private String urlTemplate;
        private String bodyTemplate;
        private int startPage = 1;
        private int pageSize = 20;
        private int maxPages = 200;
        private Selectors selectors = new Selectors();

        public String getSlug() {
            return slug;
        }

        public void setSlug(String slug) {
            this.slug = slug == null ? null : slug.trim().toLowerCase(Locale.ROOT);
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getCareerPageUrl() {
            return careerPageUrl;
        }

        public void setCareerPageUrl(String careerPageUrl) {
            this.careerPageUrl = careerPageUrl;
        }

        public PaginationStrategy getStrategy() {
            return strategy;
        }

        public void setStrategy(PaginationStrategy strategy) {
            this.strategy = strategy;
        }

        public PageFormat getFormat() {
            return format;
        }

        public void setFormat(PageFormat format) {
            this.format = format;
        }

        public String getMethod() {
            return method;
        }

        public void setMethod(String method) {
            this.method = method;
        }

        public String getUrlTemplate() {
            return urlTemplate;
        }

        public void setUrlTemplate(String urlTemplate) {
            this.urlTemplate = urlTemplate;
        }

        public String getBodyTemplate() {
            return bodyTemplate;
        }

        public void setBodyTemplate(String bodyTemplate) {
            this.bodyTemplate = bodyTemplate;
        }

        public int getStartPage() {
            return Math.max(0, startPage);
        }

        public void setStartPage(int startPage) {
            this.startPage = Math.max(0, startPage);
        }

        public int getPageSize() {
            return Math.max(1, pageSize);
        }

        public void setPageSize(int pageSize) {
            this.pageSize = Math.max(1, pageSize);
        }

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }

        public Selectors getSelectors() {
            return selectors;
        }

        public void setSelectors(Selectors selectors) {
            this.selectors = selectors == null ? new Selectors() : selectors;
        }
    }

    /**
     * CSS selectors for HTML pages, or field names for JSON pages. Unused entries stay null.
     */
    public static class Selectors {
        private String container;
        private String item;
        private String title;
        private String link;
        private String location;
        private String externalIdAttr;
        private String postedDate;
        private String salary;
        private String department;
        private String employmentType;
        private String description;
        private String next;
        private String pageLinks;
        private String itemsPath;
        private String titleField = "title";
        private String idField = "id";
        private String urlField = "url";
        private String locationField = "location";
        private String postedDateField;
        private String salaryField;
        private String departmentField;
        private String employmentTypeField;
        private String descriptionField;
        private String nextField;
        private String urlPrefix;

        public String getContainer() {
            return container;
        }

        public void setContainer(String container) {
            this.container = container;
        }

        public String getItem() {
            return item;
        }

        public void setItem(String item) {
            this.item = item;
        }

        public String getTitle() {
            return title;
        }

        public void setTitle(String title) {
            this.title = title;
        }

        public String getLink() {
            return link;
        }

        public void setLink(String link) {
            this.link = link;
        }

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }

        public String getExternalIdAttr() {
            return externalIdAttr;
        }

        public void setExternalIdAttr(String externalIdAttr) {
            this.externalIdAttr = externalIdAttr;
        }

        public String getPostedDate() {
            return postedDate;
        }

        public void setPostedDate(String postedDate) {
            this.postedDate = postedDate;
        }

        public String getSalary() {
            return salary;
        }

        public void setSalary(String salary) {
            this.salary = salary;
        }

        public String getDepartment() {
            return department;
        }

        public void setDepartment(String department) {
            this.department = department;
        }

        public String getEmploymentType() {
            return employmentType;
        }

        public void setEmploymentType(String employmentType) {
            this.employmentType = employmentType;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public String getNext() {
            return next;
        }

        public void setNext(String next) {
            this.next = next;
        }

        public String getPageLinks() {
            return pageLinks;
        }

        public void setPageLinks(String pageLinks) {
            this.pageLinks = pageLinks;
        }

        public String getItemsPath() {
            return itemsPath;
        }

        public void setItemsPath(String itemsPath) {
            this.itemsPath = itemsPath;
        }

        public String getTitleField() {
            return titleField;
        }

        public void setTitleField(String titleField) {
            this.titleField = titleField;
        }

        public String getIdField() {
            return idField;
        }

        public void setIdField(String idField) {
            this.idField = idField;
        }

        public String getUrlField() {
            return urlField;
        }

        public void setUrlField(String urlField) {
            this.urlField = urlField;
        }

        public String getLocationField() {
            return locationField;
        }

        public void setLocationField(String locationField) {
            this.locationField = locationField;
        }

        public String getPostedDateField() {
            return postedDateField;
        }

        public void setPostedDateField(String postedDateField) {
            this.postedDateField = postedDateField;
        }

        public String getSalaryField() {
            return salaryField;
        }

        public void setSalaryField(String salaryField) {
            this.salaryField = salaryField;
        }

        public String getDepartmentField() {
            return departmentField;
        }

        public void setDepartmentField(String departmentField) {
            this.departmentField = departmentField;
        }

        public String getEmploymentTypeField() {
            return employmentTypeField;
        }

        public void setEmploymentTypeField(String employmentTypeField) {
            this.employmentTypeField = employmentTypeField;
        }

        public String getDescriptionField() {
            return descriptionField;
        }

        public void setDescriptionField(String descriptionField) {
            this.descriptionField = descriptionField;
        }

        public String getNextField() {
            return nextField;
        }

        public void setNextField(String nextField) {
            this.nextField = nextField;
        }

        public String getUrlPrefix() {
            return urlPrefix;
        }

        public void setUrlPrefix(String urlPrefix) {
            this.urlPrefix = urlPrefix;
        }
    }
}
