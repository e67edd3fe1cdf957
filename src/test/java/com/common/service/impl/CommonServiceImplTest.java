package com.common.service.impl;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CommonServiceImplTest {

    private final CommonServiceImpl commonService = new CommonServiceImpl();

    @Test
    void parseTargetUsesDefaultPortWhenNoneGiven() {
        assertThat(commonService.parseTarget("Example.COM", 443)).containsExactly("example.com", "443");
    }

    @Test
    void parseTargetReadsExplicitPort() {
        assertThat(commonService.parseTarget(" mail.example.com:8443 ", 443)).containsExactly("mail.example.com", "8443");
    }

    @Test
    void parseTargetStripsSchemeAndPath() {
        assertThat(commonService.parseTarget("https://shop.example.com/checkout?x=1", 443))
                .containsExactly("shop.example.com", "443");
        assertThat(commonService.parseTarget("https://shop.example.com:9443/", 443))
                .containsExactly("shop.example.com", "9443");
    }

    @Test
    void parseTargetReadsIpv6Literals() {
        assertThat(commonService.parseTarget("[::1]:8443", 443)).containsExactly("::1", "8443");
        assertThat(commonService.parseTarget("[2001:DB8::1]", 443)).containsExactly("2001:db8::1", "443");
        assertThat(commonService.parseTarget("::1", 443)).containsExactly("::1", "443");
        assertThat(commonService.parseTarget("https://[::1]:443/status", 443)).containsExactly("::1", "443");
    }

    @ParameterizedTest
    @ValueSource(strings = {"[::1", "[::1]x", "[]:443", "[::1]:0", "[::1]:", "[example.com]:443", "host:a:b"})
    void parseTargetRejectsMalformedIpv6(String line) {
        assertThat(commonService.parseTarget(line, 443)).isNull();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "# comment", "host:abc", "host:0", "host:70000", ":443", "https://"})
    void parseTargetRejectsMalformedLines(String line) {
        assertThat(commonService.parseTarget(line, 443)).isNull();
    }

    @Test
    void loadTargetsMergesPropertyListAndFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("targets.txt");
        Files.write(file, List.of("# seed list", "", "  b.example.com:8443  ", "c.example.com"));

        List<String> targets = commonService.loadTargets(List.of(" a.example.com ", "", "   "), file.toString());

        assertThat(targets).containsExactly("a.example.com", "b.example.com:8443", "c.example.com");
    }

    @Test
    void missingTargetsFileFallsBackToPropertyList(@TempDir Path dir) {
        List<String> targets = commonService.loadTargets(List.of("a.example.com"), dir.resolve("absent.txt").toString());

        assertThat(targets).containsExactly("a.example.com");
    }

    @Test
    void nullInputsYieldEmptyList() {
        assertThat(commonService.loadTargets(null, null)).isEmpty();
    }
}
