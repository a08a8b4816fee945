package org.springaicommunity.stargazers.fetch;

import java.time.Instant;

/**
 * Classified result of a single HTTP attempt.
 *
 * <p>
 * The variants are closed; {@link BackoffPolicy} matches all four:
 * <ul>
 * <li>{@link Success} - a 200 response, already stored in the response cache</li>
 * <li>{@link RateLimited} - the token's quota is spent until {@code resetAt}</li>
 * <li>{@link Transient} - worth retrying after a backoff (network failure, 202)</li>
 * <li>{@link Permanent} - retrying will not help</li>
 * </ul>
 */
public sealed interface FetchOutcome {

	record Success(CacheEntry entry) implements FetchOutcome {
	}

	record RateLimited(Instant resetAt) implements FetchOutcome {
	}

	record Transient(String cause) implements FetchOutcome {
	}

	record Permanent(int status, String diagnostic) implements FetchOutcome {
	}

}
