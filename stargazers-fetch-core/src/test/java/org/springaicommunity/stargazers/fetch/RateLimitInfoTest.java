package org.springaicommunity.stargazers.fetch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.http.HttpHeaders;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link RateLimitInfo} header parsing.
 */
@DisplayName("RateLimitInfo Tests")
class RateLimitInfoTest {

	private static HttpHeaders headers(Map<String, String> values) {
		Map<String, List<String>> multi = new HashMap<>();
		values.forEach((name, value) -> multi.put(name, List.of(value)));
		return HttpHeaders.of(multi, (name, value) -> true);
	}

	@Test
	@DisplayName("Should parse all rate limit headers")
	void shouldParseHeaders() {
		RateLimitInfo info = RateLimitInfo.fromHeaders(headers(Map.of("X-RateLimit-Limit", "5000",
				"X-RateLimit-Remaining", "0", "X-RateLimit-Reset", "1714564800", "X-RateLimit-Used", "5000")));

		assertThat(info).isEqualTo(new RateLimitInfo(5000, 0, 1714564800L, 5000));
		assertThat(info.isExceeded()).isTrue();
		assertThat(info.hasResetTime()).isTrue();
		assertThat(info.getResetTime()).isEqualTo(Instant.ofEpochSecond(1714564800L));
	}

	@Test
	@DisplayName("Should not report an exhausted quota for counts beyond int range")
	void shouldSaturateLargeCounts() {
		RateLimitInfo info = RateLimitInfo.fromHeaders(headers(Map.of("X-RateLimit-Limit", "4294967296",
				"X-RateLimit-Remaining", "4294967296", "X-RateLimit-Used", "8589934593")));

		assertThat(info).isNotNull();
		assertThat(info.isExceeded()).isFalse();
		assertThat(info.remaining()).isEqualTo(Integer.MAX_VALUE);
		assertThat(info.limit()).isEqualTo(Integer.MAX_VALUE);
		assertThat(info.used()).isEqualTo(Integer.MAX_VALUE);
		assertThat(info.hasResetTime()).isFalse();
	}

	@Test
	@DisplayName("Should return null without a parseable remaining header")
	void shouldReturnNullWithoutRemaining() {
		assertThat(RateLimitInfo.fromHeaders(headers(Map.of("X-RateLimit-Limit", "5000")))).isNull();
		assertThat(RateLimitInfo.fromHeaders(headers(Map.of("X-RateLimit-Remaining", "lots")))).isNull();
	}

}
