package com.refharvest.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 수집 설정 (harvest.yml / profiles/*.yml 매핑 대상). 값 보관만 한다.
 * CLI 플래그 오버라이드는 app 쪽에서 적용한다.
 */
public final class HarvestConfig {

    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 "
                    + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    /** YAML `http:` 섹션 */
    public static final class HttpCfg {
        private Duration pageTimeout = Duration.ofSeconds(30);
        private Duration fileTimeout = Duration.ofSeconds(300);
        private int maxAttempts = 3;
        private long retryStepMs = 1000;   // 시도 n 이후 대기 = step × n

        public Duration getPageTimeout() { return pageTimeout; }
        public HttpCfg setPageTimeout(Duration v) { this.pageTimeout = v; return this; }

        public Duration getFileTimeout() { return fileTimeout; }
        public HttpCfg setFileTimeout(Duration v) { this.fileTimeout = v; return this; }

        public int getMaxAttempts() { return maxAttempts; }
        public HttpCfg setMaxAttempts(int v) { this.maxAttempts = Math.max(1, v); return this; }

        public long getRetryStepMs() { return retryStepMs; }
        public HttpCfg setRetryStepMs(long v) { this.retryStepMs = Math.max(0, v); return this; }
    }

    /** YAML `politeness:` 섹션. 0이면 대기 없음(테스트용). */
    public static final class PolitenessCfg {
        private long pageDelayMs = 1000;
        private long downloadDelayMs = 500;
        private long postLoginDelayMs = 2000;

        public long getPageDelayMs() { return pageDelayMs; }
        public PolitenessCfg setPageDelayMs(long v) { this.pageDelayMs = Math.max(0, v); return this; }

        public long getDownloadDelayMs() { return downloadDelayMs; }
        public PolitenessCfg setDownloadDelayMs(long v) { this.downloadDelayMs = Math.max(0, v); return this; }

        public long getPostLoginDelayMs() { return postLoginDelayMs; }
        public PolitenessCfg setPostLoginDelayMs(long v) { this.postLoginDelayMs = Math.max(0, v); return this; }
    }

    /** YAML `links:` 섹션: 링크 분류 허용 목록 */
    public static final class LinksCfg {
        private List<String> fileExtensions = List.of(
                "zip", "pdf", "txt", "csv", "xlsx", "xls", "docx", "doc", "xml", "db", "sqlite", "owl", "rdf");
        /** 비어 있으면 모든 앵커를 페이지 후보로 본다 */
        private List<String> pageKeywords = List.of();
        private List<String> formActionKeywords = List.of("download");
        /** URL에 포함되면 약관 동의 흐름을 시도 */
        private List<String> termsTriggers = List.of("file-access");

        public List<String> getFileExtensions() { return fileExtensions; }
        public LinksCfg setFileExtensions(List<String> v) {
            if (v != null && !v.isEmpty()) this.fileExtensions = lowerNoDot(v);
            return this;
        }

        public List<String> getPageKeywords() { return pageKeywords; }
        public LinksCfg setPageKeywords(List<String> v) {
            this.pageKeywords = (v == null) ? List.of() : lower(v);
            return this;
        }

        public List<String> getFormActionKeywords() { return formActionKeywords; }
        public LinksCfg setFormActionKeywords(List<String> v) {
            this.formActionKeywords = (v == null) ? List.of() : lower(v);
            return this;
        }

        public List<String> getTermsTriggers() { return termsTriggers; }
        public LinksCfg setTermsTriggers(List<String> v) {
            this.termsTriggers = (v == null) ? List.of() : lower(v);
            return this;
        }
    }

    /** YAML `download:` 섹션 */
    public static final class DownloadCfg {
        /** 이보다 작은 HTML 응답은 로그인/리다이렉트 페이지로 보고 저장하지 않는다 */
        private int htmlSkipThresholdBytes = 10_000;
        private int chunkSize = 8192;
        /** 출력 디렉터리에 이미 있는 파일은 재다운로드하지 않음 */
        private boolean seedFromDisk = true;

        public int getHtmlSkipThresholdBytes() { return htmlSkipThresholdBytes; }
        public DownloadCfg setHtmlSkipThresholdBytes(int v) { this.htmlSkipThresholdBytes = Math.max(0, v); return this; }

        public int getChunkSize() { return chunkSize; }
        public DownloadCfg setChunkSize(int v) { this.chunkSize = Math.max(512, v); return this; }

        public boolean isSeedFromDisk() { return seedFromDisk; }
        public DownloadCfg setSeedFromDisk(boolean v) { this.seedFromDisk = v; return this; }
    }

    /** YAML `auth:` 섹션. loginUrl/username/password가 모두 있어야 로그인 시도 */
    public static final class AuthCfg {
        private String loginUrl;
        private String username;
        private String password;
        private String formAdapter = "default";
        private String redirectTo;
        private List<String> successUrlFragments = List.of();
        private List<String> termsPages = List.of();
        private boolean dumpFailedLogin = false;

        public String getLoginUrl() { return loginUrl; }
        public AuthCfg setLoginUrl(String v) { this.loginUrl = blankToNull(v); return this; }

        public String getUsername() { return username; }
        public AuthCfg setUsername(String v) { this.username = blankToNull(v); return this; }

        public String getPassword() { return password; }
        public AuthCfg setPassword(String v) { this.password = v; return this; }

        public String getFormAdapter() { return formAdapter; }
        public AuthCfg setFormAdapter(String v) {
            this.formAdapter = (v == null || v.isBlank()) ? "default" : v.trim().toLowerCase(Locale.ROOT);
            return this;
        }

        public String getRedirectTo() { return redirectTo; }
        public AuthCfg setRedirectTo(String v) { this.redirectTo = blankToNull(v); return this; }

        public List<String> getSuccessUrlFragments() { return successUrlFragments; }
        public AuthCfg setSuccessUrlFragments(List<String> v) {
            this.successUrlFragments = (v == null) ? List.of() : List.copyOf(v);
            return this;
        }

        public List<String> getTermsPages() { return termsPages; }
        public AuthCfg setTermsPages(List<String> v) {
            this.termsPages = (v == null) ? List.of() : List.copyOf(v);
            return this;
        }

        public boolean isDumpFailedLogin() { return dumpFailedLogin; }
        public AuthCfg setDumpFailedLogin(boolean v) { this.dumpFailedLogin = v; return this; }

        /** 로그인 가능 여부(URL + 자격 증명) */
        public boolean hasLogin() {
            return loginUrl != null && username != null && password != null;
        }

        public Credentials credentials() {
            return hasLogin() ? new Credentials(username, password) : null;
        }
    }

    // ---------- 기본 필드 ----------
    private String name = "default";     // 프로파일 이름(리포트/로그용)
    private String target;               // 시드 URL (필수)
    private List<String> extraSeeds = List.of();
    private int maxDepth = 3;
    private int maxPages = 500;          // 병적인 사이트 대비 안전판
    private boolean sameOriginOnly = true;
    private String userAgent = DEFAULT_USER_AGENT;
    private Path outputDir = Path.of("downloads");
    private boolean writeReport = true;

    private HttpCfg http = new HttpCfg();
    private PolitenessCfg politeness = new PolitenessCfg();
    private LinksCfg links = new LinksCfg();
    private DownloadCfg download = new DownloadCfg();
    private AuthCfg auth = new AuthCfg();

    // ---------- getters ----------
    public String getName() { return name; }
    public String getTarget() { return target; }
    public List<String> getExtraSeeds() { return extraSeeds; }
    public int getMaxDepth() { return maxDepth; }
    public int getMaxPages() { return maxPages; }
    public boolean isSameOriginOnly() { return sameOriginOnly; }
    public String getUserAgent() { return userAgent; }
    public Path getOutputDir() { return outputDir; }
    public boolean isWriteReport() { return writeReport; }

    public HttpCfg http() { return http; }
    public PolitenessCfg politeness() { return politeness; }
    public LinksCfg links() { return links; }
    public DownloadCfg download() { return download; }
    public AuthCfg auth() { return auth; }

    // ---------- fluent setters ----------
    public HarvestConfig setName(String name) { this.name = (name == null || name.isBlank()) ? "default" : name.trim(); return this; }
    public HarvestConfig setTarget(String target) { this.target = target; return this; }
    public HarvestConfig setExtraSeeds(List<String> seeds) { this.extraSeeds = (seeds == null) ? List.of() : List.copyOf(seeds); return this; }
    public HarvestConfig setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; return this; }
    public HarvestConfig setMaxPages(int maxPages) { this.maxPages = maxPages; return this; }
    public HarvestConfig setSameOriginOnly(boolean v) { this.sameOriginOnly = v; return this; }
    public HarvestConfig setUserAgent(String ua) { this.userAgent = (ua == null || ua.isBlank()) ? DEFAULT_USER_AGENT : ua; return this; }
    public HarvestConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }
    public HarvestConfig setWriteReport(boolean v) { this.writeReport = v; return this; }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(target, "target");
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
        Objects.requireNonNull(outputDir, "outputDir");

        checkPositive(http.getPageTimeout(), "http.pageTimeout");
        checkPositive(http.getFileTimeout(), "http.fileTimeout");
        if (http.getMaxAttempts() < 1) throw new IllegalArgumentException("http.maxAttempts must be >= 1");

        if (links.getFileExtensions().isEmpty())
            throw new IllegalArgumentException("links.fileExtensions must not be empty");

        if (auth.getLoginUrl() != null && (auth.getUsername() == null) != (auth.getPassword() == null))
            throw new IllegalArgumentException("auth.username and auth.password must be given together");
    }

    // ---------- helpers ----------
    public static HarvestConfig defaults() { return new HarvestConfig(); }

    /** 모든 지연을 0으로: 테스트/로컬 실행용 */
    public HarvestConfig withoutDelays() {
        politeness.setPageDelayMs(0).setDownloadDelayMs(0).setPostLoginDelayMs(0);
        http.setRetryStepMs(0);
        return this;
    }

    /** 시드 + 추가 시드(중복 제거, 순서 유지) */
    public List<String> allSeeds() {
        List<String> out = new ArrayList<>();
        if (target != null) out.add(target);
        for (String s : extraSeeds) if (s != null && !out.contains(s)) out.add(s);
        return out;
    }

    private static void checkPositive(Duration d, String label) {
        if (d == null || d.isNegative() || d.isZero())
            throw new IllegalArgumentException(label + " must be > 0");
    }

    private static String blankToNull(String v) {
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static List<String> lower(List<String> in) {
        List<String> out = new ArrayList<>();
        for (String s : in) if (s != null && !s.isBlank()) out.add(s.trim().toLowerCase(Locale.ROOT));
        return List.copyOf(out);
    }

    private static List<String> lowerNoDot(List<String> in) {
        List<String> out = new ArrayList<>();
        for (String s : lower(in)) out.add(s.startsWith(".") ? s.substring(1) : s);
        return List.copyOf(out);
    }
}
