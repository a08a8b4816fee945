package org.springaicommunity.stargazers.fetch;

/**
 * Thrown when the response cache cannot be read, written or cleared. Signals storage
 * trouble rather than a remote API hiccup, so it always propagates to the caller.
 */
public class ResponseCacheException extends FetchException {

	public ResponseCacheException(String message, Throwable cause) {
		super(message, cause);
	}

}
