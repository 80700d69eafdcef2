package com.pricefeed.core.util;

import com.pricefeed.core.model.FeedConfig;
import com.pricefeed.core.model.Metal;
import com.pricefeed.core.model.Vendor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlConfigLoaderTest {

    private static InputStream yaml(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void load_flatKeys_andServer(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("pricefeed.yml");
        Files.writeString(file, String.join("\n",
                "timeoutMs: 2500",
                "userAgent: \"pf-test/1.0\"",
                "concurrency: 4",
                "defaultVendor: btmc",
                "server:",
                "  host: \"127.0.0.1\"",
                "  port: 9090",
                ""));

        FeedConfig cfg = YamlConfigLoader.load(file);

        assertThat(cfg.getTimeout()).isEqualTo(Duration.ofMillis(2500));
        assertThat(cfg.getUserAgent()).isEqualTo("pf-test/1.0");
        assertThat(cfg.getConcurrency()).isEqualTo(4);
        assertThat(cfg.getDefaultVendor()).isEqualTo(Vendor.BTMC);
        assertThat(cfg.server().getHost()).isEqualTo("127.0.0.1");
        assertThat(cfg.server().getPort()).isEqualTo(9090);
        // 지정하지 않은 값은 기본값
        assertThat(cfg.getAcceptLanguage()).isEqualTo("en-US,en;q=0.5");
    }

    @Test
    void load_vendorOverrides_keepOtherDefaults() {
        FeedConfig cfg = YamlConfigLoader.load(yaml(String.join("\n",
                "vendors:",
                "  btmc:",
                "    goldUrl: \"http://localhost:8081/gold.html\"",
                "    referer: \"\"",
                "  PHU_QUY:",
                "    silverUnit: \"VNĐ/Kg\"",
                "")));

        FeedConfig.VendorCfg btmc = cfg.vendor(Vendor.BTMC);
        assertThat(btmc.getGoldUrl()).isEqualTo(URI.create("http://localhost:8081/gold.html"));
        assertThat(btmc.getSilverUrl()).isEqualTo(URI.create("https://btmc.vn/gia-bac-hom-nay.html"));
        assertThat(btmc.getReferer()).isNull();
        assertThat(cfg.vendor(Vendor.PHU_QUY).unitFor(Metal.SILVER)).isEqualTo("VNĐ/Kg");
        assertThat(cfg.vendor(Vendor.PHU_QUY).unitFor(Metal.GOLD)).isEqualTo("VNĐ/Chỉ");
    }

    @Test
    void emptyDocument_givesDefaults() {
        FeedConfig cfg = YamlConfigLoader.load(yaml(""));
        assertThat(cfg.getTimeoutMs()).isEqualTo(10_000);
        assertThat(cfg.getDefaultVendor()).isEqualTo(Vendor.PHU_QUY);
    }

    @Test
    void typoInEnum_keepsDefault() {
        FeedConfig cfg = YamlConfigLoader.load(yaml("defaultVendor: sjc\n"));
        assertThat(cfg.getDefaultVendor()).isEqualTo(Vendor.PHU_QUY);
    }

    @Test
    void unknownVendorSection_fails() {
        assertThatThrownBy(() -> YamlConfigLoader.load(yaml("vendors:\n  doji:\n    goldUrl: \"http://x\"\n")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("doji");
    }

    @Test
    void invalidUrl_failsValidation() {
        assertThatThrownBy(() -> YamlConfigLoader.load(yaml("vendors:\n  btmc:\n    silverUrl: \"ftp://x/y\"\n")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("silverUrl");
    }

    @Test
    void missingFile_throwsIOException(@TempDir Path dir) {
        assertThatThrownBy(() -> YamlConfigLoader.load(dir.resolve("nope.yml")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void classpathDefault_matchesBuiltInDefaults() throws IOException {
        FeedConfig fromFile;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(YamlConfigLoader.CLASSPATH_DEFAULT)) {
            assertThat(in).isNotNull();
            fromFile = YamlConfigLoader.load(in);
        }
        FeedConfig builtIn = FeedConfig.defaults();
        for (Vendor v : Vendor.values()) {
            for (Metal m : Metal.values()) {
                assertThat(fromFile.vendor(v).urlFor(m)).isEqualTo(builtIn.vendor(v).urlFor(m));
                assertThat(fromFile.vendor(v).unitFor(m)).isEqualTo(builtIn.vendor(v).unitFor(m));
            }
            assertThat(fromFile.vendor(v).getReferer()).isEqualTo(builtIn.vendor(v).getReferer());
        }
        assertThat(fromFile.server().getPort()).isEqualTo(builtIn.server().getPort());
    }
}
