package com.refharvest.core.util;

import com.refharvest.core.model.HarvestConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * harvest.yml / 프로파일 YAML을 읽어 HarvestConfig로 변환.
 *
 * 예상 YAML 키:
 * name: "loinc"
 * target: "https://example.org/downloads/"
 * extraSeeds: ["https://example.org/more/"]
 * sameOriginOnly: true
 * userAgent: "..."
 * scope:
 *   maxDepth: 3
 *   maxPages: 500
 * output:
 *   dir: "downloads"
 *   report: true
 * http:
 *   pageTimeoutMs: 30000
 *   fileTimeoutMs: 300000
 *   maxAttempts: 3
 *   retryStepMs: 1000
 * politeness:
 *   pageDelayMs: 1000
 *   downloadDelayMs: 500
 *   postLoginDelayMs: 2000
 * links:
 *   fileExtensions: [zip, pdf, csv]
 *   pageKeywords: [hcpcs, coding]
 *   formActionKeywords: [download]
 *   termsTriggers: [file-access]
 * download:
 *   htmlSkipThresholdBytes: 10000
 *   chunkSize: 8192
 *   seedFromDisk: true
 * auth:
 *   loginUrl: "https://example.org/wp-login.php"
 *   username: "..."      # 보통 CLI/환경변수로 지정
 *   password: "..."
 *   formAdapter: wordpress | default
 *   redirectTo: "https://example.org/file-access/"
 *   successUrlFragments: [wp-admin, file-access]
 *   termsPages: ["https://example.org/file-access/download-id/1/"]
 *   dumpFailedLogin: false
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    /** 파일 하나를 기본값 위에 읽고 검증까지 */
    public static HarvestConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("harvest.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            HarvestConfig cfg = merge(HarvestConfig.defaults(), in);
            cfg.validate();
            return cfg;
        }
    }

    /**
     * 기존 설정 위에 YAML 값을 덮어쓴다(검증 없음). 프로파일 → 사용자 파일 → CLI 순 적용용.
     * 없는 키는 기존 값을 유지한다.
     */
    public static HarvestConfig merge(HarvestConfig cfg, InputStream in) {
        Objects.requireNonNull(cfg, "cfg");
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root;
        try {
            root = yaml.load(in);
        } catch (YAMLException e) {
            throw new IllegalArgumentException("invalid YAML: " + firstLine(e.getMessage()), e);
        }

        // 비어있거나 단순 스칼라면 그대로
        if (!(root instanceof Map<?, ?> map)) return cfg;

        // 1) 평면 키
        setString(map, "name", cfg::setName);
        setString(map, "target", cfg::setTarget);
        setStringList(map, "extraSeeds", cfg::setExtraSeeds);
        setBoolean(map, "sameOriginOnly", cfg::setSameOriginOnly);
        setString(map, "userAgent", cfg::setUserAgent);

        // 2) scope.*
        Map<String, Object> scope = getMap(map, "scope");
        if (scope != null) {
            setInt(scope, "maxDepth", cfg::setMaxDepth);
            setInt(scope, "maxPages", cfg::setMaxPages);
        }

        // 3) output.*
        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            setPath(output, "dir", cfg::setOutputDir);
            setBoolean(output, "report", cfg::setWriteReport);
        }

        // 4) http.*
        Map<String, Object> http = getMap(map, "http");
        if (http != null) {
            var h = cfg.http();
            setDurationMs(http, "pageTimeoutMs", h::setPageTimeout);
            setDurationMs(http, "fileTimeoutMs", h::setFileTimeout);
            setInt(http, "maxAttempts", h::setMaxAttempts);
            setLong(http, "retryStepMs", h::setRetryStepMs);
        }

        // 5) politeness.*
        Map<String, Object> pol = getMap(map, "politeness");
        if (pol != null) {
            var p = cfg.politeness();
            setLong(pol, "pageDelayMs", p::setPageDelayMs);
            setLong(pol, "downloadDelayMs", p::setDownloadDelayMs);
            setLong(pol, "postLoginDelayMs", p::setPostLoginDelayMs);
        }

        // 6) links.*
        Map<String, Object> links = getMap(map, "links");
        if (links != null) {
            var l = cfg.links();
            setStringList(links, "fileExtensions", l::setFileExtensions);
            setStringList(links, "pageKeywords", l::setPageKeywords);
            setStringList(links, "formActionKeywords", l::setFormActionKeywords);
            setStringList(links, "termsTriggers", l::setTermsTriggers);
        }

        // 7) download.*
        Map<String, Object> dl = getMap(map, "download");
        if (dl != null) {
            var d = cfg.download();
            setInt(dl, "htmlSkipThresholdBytes", d::setHtmlSkipThresholdBytes);
            setInt(dl, "chunkSize", d::setChunkSize);
            setBoolean(dl, "seedFromDisk", d::setSeedFromDisk);
        }

        // 8) auth.*
        Map<String, Object> auth = getMap(map, "auth");
        if (auth != null) {
            var a = cfg.auth();
            setString(auth, "loginUrl", a::setLoginUrl);
            setString(auth, "username", a::setUsername);
            setString(auth, "password", a::setPassword);
            setString(auth, "formAdapter", a::setFormAdapter);
            setString(auth, "redirectTo", a::setRedirectTo);
            setStringList(auth, "successUrlFragments", a::setSuccessUrlFragments);
            setStringList(auth, "termsPages", a::setTermsPages);
            setBoolean(auth, "dumpFailedLogin", a::setDumpFailedLogin);
        }
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        if (v instanceof List<?> list) {
            List<String> out = new ArrayList<>();
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
            setter.accept(List.copyOf(out));
            return;
        }
        // "a,b,c" 형태 지원
        String s = String.valueOf(v).trim();
        List<String> out = new ArrayList<>();
        if (!s.isEmpty()) {
            for (String p : s.split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static void setDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        if (ms > 0) setter.accept(Duration.ofMillis(ms));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }

    private static String firstLine(String msg) {
        if (msg == null) return "parse error";
        int nl = msg.indexOf('\n');
        return (nl < 0) ? msg : msg.substring(0, nl);
    }
}
