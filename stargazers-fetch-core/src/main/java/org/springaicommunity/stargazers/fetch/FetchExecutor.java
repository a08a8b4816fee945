package org.springaicommunity.stargazers.fetch;

import org.jspecify.annotations.Nullable;

/**
 * Performs one network attempt for a request and classifies what happened.
 *
 * <p>
 * Implementations never throw for remote or transport failures; those are reported as a
 * {@link FetchOutcome}. Retrying is left to {@link BackoffPolicy}.
 */
public interface FetchExecutor {

	/**
	 * Issue the request once.
	 * @param ctx per-call configuration (token, cache scope)
	 * @param request request to issue
	 * @return the classified outcome; a {@link FetchOutcome.Success} has already been
	 * written to the response cache when possible
	 * @throws FetchException if the calling thread is interrupted
	 */
	FetchOutcome execute(FetchContext ctx, RequestIdentity request);

	/**
	 * Rate limit status from the most recent response, or {@code null} if none has been
	 * observed yet.
	 * @return last observed RateLimitInfo, or null
	 */
	@Nullable
	default RateLimitInfo getLastRateLimitInfo() {
		return null;
	}

}
