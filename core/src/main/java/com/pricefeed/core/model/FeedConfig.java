package com.pricefeed.core.model;

import java.net.URI;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * 시세 수집 설정 (pricefeed.yml 매핑 대상). 순수 설정 보관용.
 * 판매처별 URL/단위는 vendors 맵, HTTP 공통 헤더와 타임아웃은 최상위 필드.
 */
public final class FeedConfig {

    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                    + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
    public static final String DEFAULT_ACCEPT =
            "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    /** 판매처 하위 설정: YAML의 `vendors.<VENDOR>:` 섹션과 매핑 */
    public static final class VendorCfg {
        private URI goldUrl;
        private URI silverUrl;
        /** null 이면 Referer 헤더를 보내지 않음 */
        private String referer;
        private String goldUnit;
        /** 행에 단위 셀이 있으면 그 값이 우선, 없을 때의 기본값 */
        private String silverUnit;

        public URI getGoldUrl() { return goldUrl; }
        public VendorCfg setGoldUrl(URI goldUrl) { this.goldUrl = goldUrl; return this; }

        public URI getSilverUrl() { return silverUrl; }
        public VendorCfg setSilverUrl(URI silverUrl) { this.silverUrl = silverUrl; return this; }

        public String getReferer() { return referer; }
        public VendorCfg setReferer(String referer) {
            this.referer = (referer == null || referer.isBlank()) ? null : referer.trim();
            return this;
        }

        public String getGoldUnit() { return goldUnit; }
        public VendorCfg setGoldUnit(String goldUnit) { this.goldUnit = goldUnit; return this; }

        public String getSilverUnit() { return silverUnit; }
        public VendorCfg setSilverUnit(String silverUnit) { this.silverUnit = silverUnit; return this; }

        public URI urlFor(Metal metal) { return metal == Metal.GOLD ? goldUrl : silverUrl; }
        public String unitFor(Metal metal) { return metal == Metal.GOLD ? goldUnit : silverUnit; }

        static VendorCfg defaultsFor(Vendor vendor) {
            return switch (vendor) {
                case PHU_QUY -> new VendorCfg()
                        .setGoldUrl(URI.create("http://giavang.phuquygroup.vn"))
                        .setSilverUrl(URI.create("http://giabac.phuquygroup.vn"))
                        .setGoldUnit("VNĐ/Chỉ")
                        .setSilverUnit("VNĐ/Lượng");
                case BTMC -> new VendorCfg()
                        .setGoldUrl(URI.create("https://btmc.vn/gia-vang-theo-ngay.html"))
                        .setSilverUrl(URI.create("https://btmc.vn/gia-bac-hom-nay.html"))
                        .setReferer("https://btmc.vn/")
                        .setGoldUnit("Nghìn VNĐ/Chỉ")
                        .setSilverUnit("Nghìn VNĐ/Lượng");
            };
        }
    }

    /** HTTP 서버 하위 설정: YAML의 `server:` 섹션 */
    public static final class ServerCfg {
        private String host = "0.0.0.0";
        private int port = 8000;

        public String getHost() { return host; }
        public ServerCfg setHost(String host) { this.host = host; return this; }

        public int getPort() { return port; }
        public ServerCfg setPort(int port) { this.port = port; return this; }
    }

    // ---------- 기본 필드 ----------
    private Duration timeout = Duration.ofSeconds(10); // 요청 타임아웃 (재시도 없음)
    private String userAgent = DEFAULT_USER_AGENT;
    private String accept = DEFAULT_ACCEPT;
    private String acceptLanguage = "en-US,en;q=0.5";
    private int concurrency = 2;         // 금/은 병렬 추출용 풀 크기
    private Vendor defaultVendor = Vendor.PHU_QUY;
    private final ServerCfg server = new ServerCfg();
    private final Map<Vendor, VendorCfg> vendors = new EnumMap<>(Vendor.class);

    public FeedConfig() {
        for (Vendor v : Vendor.values()) vendors.put(v, VendorCfg.defaultsFor(v));
    }

    // ---------- getters ----------
    public Duration getTimeout() { return timeout; }
    public String getUserAgent() { return userAgent; }
    public String getAccept() { return accept; }
    public String getAcceptLanguage() { return acceptLanguage; }
    public int getConcurrency() { return concurrency; }
    public Vendor getDefaultVendor() { return defaultVendor; }
    public ServerCfg server() { return server; }

    public VendorCfg vendor(Vendor vendor) {
        return vendors.get(Objects.requireNonNull(vendor, "vendor"));
    }

    // ---------- fluent setters ----------
    public FeedConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public FeedConfig setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }
    public FeedConfig setAccept(String accept) { this.accept = accept; return this; }
    public FeedConfig setAcceptLanguage(String acceptLanguage) { this.acceptLanguage = acceptLanguage; return this; }
    public FeedConfig setConcurrency(int concurrency) { this.concurrency = Math.max(1, concurrency); return this; }
    public FeedConfig setDefaultVendor(Vendor v) {
        this.defaultVendor = (v != null ? v : Vendor.PHU_QUY);
        return this;
    }

    public FeedConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        if (userAgent == null || userAgent.isBlank())
            throw new IllegalArgumentException("userAgent must not be blank");
        if (server.getPort() < 0 || server.getPort() > 65535)
            throw new IllegalArgumentException("server.port out of range: " + server.getPort());
        Objects.requireNonNull(defaultVendor, "defaultVendor");

        for (Vendor v : Vendor.values()) {
            VendorCfg c = vendors.get(v);
            for (Metal m : Metal.values()) {
                URI u = c.urlFor(m);
                if (u == null) {
                    throw new IllegalArgumentException("vendors." + v.name() + "." + m.key() + "Url is required");
                }
                String scheme = u.getScheme();
                if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                    throw new IllegalArgumentException("vendors." + v.name() + "." + m.key() + "Url must be http(s): " + u);
                }
            }
        }
    }

    public static FeedConfig defaults() { return new FeedConfig(); }

    public long getTimeoutMs() { return timeout.toMillis(); }
}
