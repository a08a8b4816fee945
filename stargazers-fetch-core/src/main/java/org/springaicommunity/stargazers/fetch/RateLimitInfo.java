package org.springaicommunity.stargazers.fetch;

import org.jspecify.annotations.Nullable;

import java.net.http.HttpHeaders;
import java.time.Instant;

/**
 * Rate limit status reported by the {@code X-RateLimit-*} headers of a GitHub response.
 *
 * @param limit the maximum number of requests allowed per window, or -1 if not reported
 * @param remaining the number of requests remaining in the current window
 * @param reset when the window resets (epoch seconds), or -1 if not reported
 * @param used the number of requests used in the current window, or -1 if not reported
 */
public record RateLimitInfo(int limit, int remaining, long reset, int used) {

	public static final String REMAINING_HEADER = "X-RateLimit-Remaining";

	public static final String RESET_HEADER = "X-RateLimit-Reset";

	public static final String LIMIT_HEADER = "X-RateLimit-Limit";

	public static final String USED_HEADER = "X-RateLimit-Used";

	/**
	 * Parse the rate limit headers of a response.
	 * @param headers response headers
	 * @return the parsed status, or {@code null} when no parseable remaining-quota header
	 * is present
	 */
	@Nullable
	public static RateLimitInfo fromHeaders(HttpHeaders headers) {
		long remaining = parseHeader(headers, REMAINING_HEADER);
		if (remaining < 0) {
			return null;
		}
		return new RateLimitInfo(saturatedCount(parseHeader(headers, LIMIT_HEADER)), saturatedCount(remaining),
				parseHeader(headers, RESET_HEADER), saturatedCount(parseHeader(headers, USED_HEADER)));
	}

	// counts beyond int range saturate instead of wrapping
	private static int saturatedCount(long value) {
		return (int) Math.min(value, Integer.MAX_VALUE);
	}

	public Instant getResetTime() {
		return Instant.ofEpochSecond(reset);
	}

	public boolean hasResetTime() {
		return reset >= 0;
	}

	public boolean isExceeded() {
		return remaining == 0;
	}

	private static long parseHeader(HttpHeaders headers, String name) {
		return headers.firstValue(name).map(value -> {
			try {
				return Long.parseLong(value.trim());
			}
			catch (NumberFormatException e) {
				return -1L;
			}
		}).orElse(-1L);
	}

}
