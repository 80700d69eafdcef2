package com.pricefeed.core.util;

import com.pricefeed.core.model.FeedConfig;
import com.pricefeed.core.model.Vendor;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * pricefeed.yml 을 읽어 FeedConfig 로 변환.
 *
 * 예상 YAML 키:
 * timeoutMs: 10000
 * userAgent: "Mozilla/5.0 ..."
 * acceptLanguage: "en-US,en;q=0.5"
 * concurrency: 2
 * defaultVendor: PHU_QUY | BTMC
 * server:
 *   host: "0.0.0.0"
 *   port: 8000
 * vendors:
 *   PHU_QUY:
 *     goldUrl: "http://giavang.phuquygroup.vn"
 *     silverUrl: "http://giabac.phuquygroup.vn"
 *     goldUnit: "VNĐ/Chỉ"
 *     silverUnit: "VNĐ/Lượng"
 *   BTMC:
 *     referer: "https://btmc.vn/"
 *
 * 없는 키는 기본값 유지.
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "pricefeed.yml";
    public static final String CLASSPATH_DEFAULT = "pricefeed-default.yml";

    private YamlConfigLoader() {}

    /** 작업 디렉터리의 pricefeed.yml, 없으면 classpath 기본 파일. */
    public static FeedConfig loadDefault() throws IOException {
        Path local = Path.of(DEFAULT_FILE);
        if (Files.exists(local)) return load(local);
        try (InputStream in = YamlConfigLoader.class.getClassLoader().getResourceAsStream(CLASSPATH_DEFAULT)) {
            if (in == null) {
                FeedConfig cfg = FeedConfig.defaults();
                cfg.validate();
                return cfg;
            }
            return load(in);
        }
    }

    public static FeedConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("pricefeed.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static FeedConfig load(InputStream in) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        FeedConfig cfg = FeedConfig.defaults();

        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        // 1) 평면 키
        setLongMs(map, "timeoutMs", cfg::setTimeoutMs);
        setString(map, "userAgent", cfg::setUserAgent);
        setString(map, "accept", cfg::setAccept);
        setString(map, "acceptLanguage", cfg::setAcceptLanguage);
        setInt(map, "concurrency", cfg::setConcurrency);
        setEnum(map, "defaultVendor", Vendor.class, cfg::setDefaultVendor);

        // 2) server.*
        Map<String, Object> server = getMap(map, "server");
        if (server != null) {
            setString(server, "host", cfg.server()::setHost);
            setInt(server, "port", cfg.server()::setPort);
        }

        // 3) vendors.<VENDOR>.*
        Map<String, Object> vendors = getMap(map, "vendors");
        if (vendors != null) {
            for (Map.Entry<String, Object> e : vendors.entrySet()) {
                Vendor v = Vendor.fromKey(e.getKey())
                        .orElseThrow(() -> new IllegalArgumentException("unknown vendor: " + e.getKey()));
                Map<String, Object> vm = getMap(vendors, e.getKey());
                if (vm == null) continue;
                FeedConfig.VendorCfg vc = cfg.vendor(v);
                setUri(vm, "goldUrl", vc::setGoldUrl);
                setUri(vm, "silverUrl", vc::setSilverUrl);
                setString(vm, "referer", vc::setReferer);
                setString(vm, "goldUnit", vc::setGoldUnit);
                setString(vm, "silverUnit", vc::setSilverUnit);
            }
        }

        // 기본값/필수값 확인
        cfg.validate();
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

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLongMs(Map<?, ?> map, String key, Consumer<Long> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        if (ms > 0) setter.accept(ms);
    }

    private static void setUri(Map<?, ?> map, String key, Consumer<URI> setter) {
        Object v = map.get(key);
        if (v == null) return;
        String s = String.valueOf(v).trim();
        try {
            setter.accept(URI.create(s));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(key + " is not a valid URI: " + s, e);
        }
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
        try {
            setter.accept(Enum.valueOf(type, s.toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ignore) {
            // 무시(사용자 오타 시 기본값 유지)
        }
    }
}
