package com.siteharvest.core.crawler;

import com.siteharvest.core.model.CrawlConfig.MatchMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DomainScopeTest {

    @Test
    @DisplayName("SUBSTRING: URL 어디든 도메인 문자열이 있으면 포함")
    void substring_mode_is_plain_contains() {
        var scope = DomainScope.of("casl.website", MatchMode.SUBSTRING);

        assertThat(scope.contains("https://casl.website/a")).isTrue();
        assertThat(scope.contains("https://www.casl.website/")).isTrue();
        assertThat(scope.contains("https://evil.test/?r=casl.website")).isTrue(); // 알려진 한계
        assertThat(scope.contains("https://other.org/")).isFalse();
    }

    @Test
    @DisplayName("HOST: host 가 같거나 하위 도메인일 때만")
    void host_mode_compares_host() {
        var scope = DomainScope.of("casl.website", MatchMode.HOST);

        assertThat(scope.contains("https://casl.website/a")).isTrue();
        assertThat(scope.contains("https://CASL.website:8443/a")).isTrue();
        assertThat(scope.contains("https://blog.casl.website/")).isTrue();
        assertThat(scope.contains("https://evilcasl.website/")).isFalse();
        assertThat(scope.contains("https://evil.test/?r=casl.website")).isFalse();
        assertThat(scope.contains("not a url")).isFalse();
    }
}
