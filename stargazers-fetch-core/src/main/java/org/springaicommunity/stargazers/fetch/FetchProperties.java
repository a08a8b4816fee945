package org.springaicommunity.stargazers.fetch;

import java.time.Duration;

/**
 * Tuning knobs for the fetch engine.
 *
 * <p>
 * Properties can be set directly via setters and are handed to
 * {@link ResourceFetcherBuilder}. The defaults reproduce the engine's standard
 * behaviour: ten attempts per fetch, exponential backoff from 50ms capped at one
 * second, and a one second pad after a rate limit reset.
 */
public class FetchProperties {

	/**
	 * Maximum number of attempts per logical fetch, rate limit waits included.
	 */
	private int maxAttempts = 10;

	/**
	 * Backoff before the second attempt after a transient failure; doubles per attempt.
	 */
	private Duration initialBackoff = Duration.ofMillis(50);

	/**
	 * Upper bound for the transient-failure backoff.
	 */
	private Duration maxBackoff = Duration.ofMillis(1000);

	/**
	 * Padding added to the rate limit reset time to absorb clock skew.
	 */
	private Duration rateLimitPadding = Duration.ofSeconds(1);

	/**
	 * TCP connect timeout of the default HTTP client.
	 */
	private Duration connectTimeout = Duration.ofSeconds(30);

	/**
	 * Timeout for a single request/response exchange.
	 */
	private Duration requestTimeout = Duration.ofSeconds(60);

	/**
	 * Value of the {@code User-Agent} header sent with every request.
	 */
	private String userAgent = "Stargazers Fetch Engine";

	/**
	 * Remaining-quota level below which rate limit status is logged at INFO.
	 */
	private int lowQuotaThreshold = 100;

	public int getMaxAttempts() {
		return maxAttempts;
	}

	public void setMaxAttempts(int maxAttempts) {
		this.maxAttempts = maxAttempts;
	}

	public Duration getInitialBackoff() {
		return initialBackoff;
	}

	public void setInitialBackoff(Duration initialBackoff) {
		this.initialBackoff = initialBackoff;
	}

	public Duration getMaxBackoff() {
		return maxBackoff;
	}

	public void setMaxBackoff(Duration maxBackoff) {
		this.maxBackoff = maxBackoff;
	}

	public Duration getRateLimitPadding() {
		return rateLimitPadding;
	}

	public void setRateLimitPadding(Duration rateLimitPadding) {
		this.rateLimitPadding = rateLimitPadding;
	}

	public Duration getConnectTimeout() {
		return connectTimeout;
	}

	public void setConnectTimeout(Duration connectTimeout) {
		this.connectTimeout = connectTimeout;
	}

	public Duration getRequestTimeout() {
		return requestTimeout;
	}

	public void setRequestTimeout(Duration requestTimeout) {
		this.requestTimeout = requestTimeout;
	}

	public String getUserAgent() {
		return userAgent;
	}

	public void setUserAgent(String userAgent) {
		this.userAgent = userAgent;
	}

	public int getLowQuotaThreshold() {
		return lowQuotaThreshold;
	}

	public void setLowQuotaThreshold(int lowQuotaThreshold) {
		this.lowQuotaThreshold = lowQuotaThreshold;
	}

}
