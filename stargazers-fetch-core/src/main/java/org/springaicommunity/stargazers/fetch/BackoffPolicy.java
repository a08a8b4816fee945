package org.springaicommunity.stargazers.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Retry state machine around a single {@link FetchExecutor} attempt.
 *
 * <p>
 * Every outcome consumes one of at most {@code maxAttempts} attempts:
 * <ul>
 * <li>{@link FetchOutcome.Success}: done</li>
 * <li>{@link FetchOutcome.Permanent}: stop immediately, no result</li>
 * <li>{@link FetchOutcome.RateLimited}: sleep until the reset time plus padding, however
 * long that is, then retry</li>
 * <li>{@link FetchOutcome.Transient}: sleep {@code initialDelay * 2^attempt}, capped at
 * {@code maxDelay}, then retry</li>
 * </ul>
 * No wait follows the final attempt. Running out of attempts yields no result.
 *
 * <p>
 * The remote quota belongs to the access token, so one policy instance should serve all
 * fetches made with that token. Not thread-safe.
 *
 * <pre>
 * {@code
 * BackoffPolicy policy = BackoffPolicy.builder()
 *     .maxAttempts(10)
 *     .initialDelay(Duration.ofMillis(50))
 *     .maxDelay(Duration.ofSeconds(1))
 *     .build();
 * }
 * </pre>
 */
public final class BackoffPolicy {

	private static final Logger logger = LoggerFactory.getLogger(BackoffPolicy.class);

	private final int maxAttempts;

	private final Duration initialDelay;

	private final Duration maxDelay;

	private final Duration rateLimitPadding;

	private final Sleeper sleeper;

	private final Clock clock;

	private BackoffPolicy(Builder builder) {
		this.maxAttempts = builder.maxAttempts;
		this.initialDelay = builder.initialDelay;
		this.maxDelay = builder.maxDelay;
		this.rateLimitPadding = builder.rateLimitPadding;
		this.sleeper = builder.sleeper;
		this.clock = builder.clock;
	}

	public static Builder builder() {
		return new Builder();
	}

	public int getMaxAttempts() {
		return maxAttempts;
	}

	/**
	 * Run {@code attempt} until it succeeds, fails permanently, or the attempts run out.
	 * @param url URL being fetched, for logging
	 * @param attempt one network attempt
	 * @return the successful response, or empty on permanent failure or exhaustion
	 * @throws FetchException if interrupted while waiting
	 */
	public Optional<CacheEntry> execute(String url, Supplier<FetchOutcome> attempt) {
		for (int i = 0; i < maxAttempts; i++) {
			FetchOutcome outcome = attempt.get();
			if (outcome instanceof FetchOutcome.Success success) {
				return Optional.of(success.entry());
			}
			if (outcome instanceof FetchOutcome.Permanent permanent) {
				logger.warn("unable to fetch {}: {}", url, permanent.diagnostic());
				return Optional.empty();
			}

			Duration wait = delayFor(outcome, i);
			if (outcome instanceof FetchOutcome.RateLimited rateLimited) {
				logger.info(
						"rate limit for GitHub API access using this user token has been exceeded; "
								+ "resets at {} (in {}s) while fetching {} (attempt {}/{})",
						rateLimited.resetAt(), wait.toSeconds(), url, i + 1, maxAttempts);
			}
			else if (outcome instanceof FetchOutcome.Transient transientFailure) {
				logger.warn("{} (attempt {}/{}); retrying in {}ms", transientFailure.cause(), i + 1, maxAttempts,
						wait.toMillis());
			}

			if (i < maxAttempts - 1) {
				sleep(wait, url);
			}
		}
		logger.error("unable to fetch {}: giving up after {} attempts", url, maxAttempts);
		return Optional.empty();
	}

	/**
	 * How long to wait after {@code outcome} before the next attempt.
	 * @param outcome outcome of attempt {@code attemptIndex}
	 * @param attemptIndex zero-based attempt number
	 * @return the wait; zero for outcomes that are not retried
	 */
	public Duration delayFor(FetchOutcome outcome, int attemptIndex) {
		if (outcome instanceof FetchOutcome.RateLimited rateLimited) {
			Instant resumeAt = rateLimited.resetAt().plus(rateLimitPadding);
			Duration untilReset = Duration.between(clock.instant(), resumeAt);
			return untilReset.isNegative() ? Duration.ZERO : untilReset;
		}
		if (outcome instanceof FetchOutcome.Transient) {
			return backoff(attemptIndex);
		}
		if (outcome instanceof FetchOutcome.Success || outcome instanceof FetchOutcome.Permanent) {
			return Duration.ZERO;
		}
		throw new IllegalStateException("Unhandled fetch outcome: " + outcome);
	}

	private Duration backoff(int attemptIndex) {
		long cap = maxDelay.toMillis();
		long millis = initialDelay.toMillis();
		for (int i = 0; i < attemptIndex && millis < cap; i++) {
			millis *= 2;
		}
		return millis >= cap ? maxDelay : Duration.ofMillis(millis);
	}

	private void sleep(Duration wait, String url) {
		if (wait.isZero()) {
			return;
		}
		try {
			sleeper.sleep(wait);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new FetchException("Interrupted while waiting to retry " + url, e);
		}
	}

	/**
	 * Builder for {@link BackoffPolicy}.
	 *
	 * <p>
	 * Defaults:
	 * <ul>
	 * <li>maxAttempts: 10</li>
	 * <li>initialDelay: 50ms</li>
	 * <li>maxDelay: 1 second</li>
	 * <li>rateLimitPadding: 1 second</li>
	 * <li>sleeper: {@link Thread#sleep(long)}</li>
	 * <li>clock: system UTC</li>
	 * </ul>
	 */
	public static class Builder {

		private int maxAttempts = 10;

		private Duration initialDelay = Duration.ofMillis(50);

		private Duration maxDelay = Duration.ofSeconds(1);

		private Duration rateLimitPadding = Duration.ofSeconds(1);

		private Sleeper sleeper = Sleeper.threadSleep();

		private Clock clock = Clock.systemUTC();

		private Builder() {
		}

		public Builder maxAttempts(int maxAttempts) {
			this.maxAttempts = maxAttempts;
			return this;
		}

		public Builder initialDelay(Duration initialDelay) {
			this.initialDelay = initialDelay;
			return this;
		}

		public Builder maxDelay(Duration maxDelay) {
			this.maxDelay = maxDelay;
			return this;
		}

		public Builder rateLimitPadding(Duration rateLimitPadding) {
			this.rateLimitPadding = rateLimitPadding;
			return this;
		}

		public Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		/**
		 * Build the policy.
		 * @return configured BackoffPolicy
		 * @throws IllegalStateException if a setting is out of range
		 */
		public BackoffPolicy build() {
			if (maxAttempts < 1) {
				throw new IllegalStateException("maxAttempts must be at least 1");
			}
			if (initialDelay == null || initialDelay.isNegative() || initialDelay.isZero()) {
				throw new IllegalStateException("initialDelay must be positive");
			}
			if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
				throw new IllegalStateException("maxDelay must not be shorter than initialDelay");
			}
			if (rateLimitPadding == null || rateLimitPadding.isNegative()) {
				throw new IllegalStateException("rateLimitPadding must not be negative");
			}
			if (sleeper == null || clock == null) {
				throw new IllegalStateException("sleeper and clock are required");
			}
			return new BackoffPolicy(this);
		}

	}

}
