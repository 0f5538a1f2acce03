package com.siteharvest.core.util;

import com.siteharvest.core.model.CrawlConfig;
import com.siteharvest.core.model.CrawlConfig.MatchMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * siteharvest.yml → CrawlConfig.
 *
 * 예상 YAML 키:
 * seedUrl: "https://casl.website/"
 * baseUrl: "https://casl.website/"
 * scope:
 *   domain: "casl.website"
 *   match: substring | host
 * timeoutMs: 10000
 * followRedirects: true
 * userAgent: "SiteHarvest/1.0"
 * concurrency: 1
 * fetch:
 *   maxAttempts: 1
 * lexicon:
 *   stopwordsFile: "stopwords.txt"
 * output:
 *   dir: "out"
 *   formats: [txt, json]
 *   console: true
 *
 * 시스템 프로퍼티(파일 값보다 우선): sh.seed, sh.domain, sh.out.dir
 */
public final class YamlConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(YamlConfigLoader.class);

    public static final String DEFAULT_FILE = "siteharvest.yml";

    private YamlConfigLoader() {}

    /** 작업 디렉터리의 siteharvest.yml. 없으면 기본값 + 시스템 프로퍼티 */
    public static CrawlConfig loadDefault() throws IOException {
        Path p = Path.of(DEFAULT_FILE);
        if (Files.exists(p)) return load(p);
        LOG.info("{} not found in {}; using defaults and system properties",
                DEFAULT_FILE, Path.of("").toAbsolutePath());
        CrawlConfig cfg = CrawlConfig.defaults();
        applySystemOverrides(cfg);
        cfg.validate();
        return cfg;
    }

    public static CrawlConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException(DEFAULT_FILE + " not found at: " + yamlPath.toAbsolutePath());
        }
        Object root;
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            root = yaml.load(in);
        } catch (YAMLException e) {
            throw new IOException("malformed YAML in " + yamlPath + ": " + e.getMessage(), e);
        }

        CrawlConfig cfg = CrawlConfig.defaults();
        if (root instanceof Map<?, ?> map) {
            apply(map, cfg);
        }
        applySystemOverrides(cfg);
        cfg.validate();
        LOG.debug("Loaded config from {}: seed={}, domain={}, concurrency={}",
                yamlPath, cfg.getSeedUrl(), cfg.getDomain(), cfg.getConcurrency());
        return cfg;
    }

    static void apply(Map<?, ?> map, CrawlConfig cfg) {
        // 1) 평면 키
        setString(map, "seedUrl", cfg::setSeedUrl);
        setString(map, "baseUrl", cfg::setBaseUrl);
        setLong(map, "timeoutMs", ms -> cfg.setTimeout(Duration.ofMillis(ms)));
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);
        setString(map, "userAgent", cfg::setUserAgent);
        setInt(map, "concurrency", cfg::setConcurrency);

        // 2) scope.*
        Map<String, Object> scope = getMap(map, "scope");
        if (scope != null) {
            setString(scope, "domain", cfg::setDomain);
            setEnum(scope, "match", MatchMode.class, cfg::setMatchMode);
        }

        // 3) fetch.*
        Map<String, Object> fetch = getMap(map, "fetch");
        if (fetch != null) {
            setInt(fetch, "maxAttempts", cfg::setMaxAttempts);
        }

        // 4) lexicon.*
        Map<String, Object> lexicon = getMap(map, "lexicon");
        if (lexicon != null) {
            setPath(lexicon, "stopwordsFile", cfg::setStopwordsFile);
            setString(lexicon, "taggerModel", cfg::setTaggerModel);
        }

        // 5) output.*
        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            var o = cfg.getOutput();
            setPath(output, "dir", o::setDir);
            setStringList(output, "formats", o::setFormats);
            setBoolean(output, "console", o::setConsole);
        }
    }

    static void applySystemOverrides(CrawlConfig cfg) {
        String seed = System.getProperty("sh.seed");
        if (seed != null && !seed.isBlank()) cfg.setSeedUrl(seed.trim());
        String domain = System.getProperty("sh.domain");
        if (domain != null && !domain.isBlank()) cfg.setDomain(domain.trim());
        String outDir = System.getProperty("sh.out.dir");
        if (outDir != null && !outDir.isBlank()) cfg.getOutput().setDir(Path.of(outDir.trim()));
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
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
        } else {
            // "txt,json" 형태 지원
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) {
                if (!p.isEmpty()) out.add(p);
            }
        }
        setter.accept(out);
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v == null) return;
        try {
            setter.accept(v instanceof Number n ? n.intValue() : Integer.parseInt(String.valueOf(v).trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + v, e);
        }
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v == null) return;
        try {
            setter.accept(v instanceof Number n ? n.longValue() : Long.parseLong(String.valueOf(v).trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + v, e);
        }
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }

    private static <E extends Enum<E>> void setEnum(Map<?, ?> map, String key, Class<E> type, Consumer<E> setter) {
        Object v = map.get(key);
        if (v == null) return;
        String s = String.valueOf(v).trim();
        for (E e : type.getEnumConstants()) {
            if (e.name().equalsIgnoreCase(s)) {
                setter.accept(e);
                return;
            }
        }
        throw new IllegalArgumentException("unknown " + key + ": " + s
                + " (expected one of " + List.of(type.getEnumConstants()).toString().toLowerCase(Locale.ROOT) + ")");
    }
}
