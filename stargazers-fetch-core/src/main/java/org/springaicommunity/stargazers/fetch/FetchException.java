package org.springaicommunity.stargazers.fetch;

/**
 * Base exception for failures the fetch engine cannot absorb. The message always names
 * the operation and the URL or cache location involved.
 */
public class FetchException extends RuntimeException {

	public FetchException(String message) {
		super(message);
	}

	public FetchException(String message, Throwable cause) {
		super(message, cause);
	}

}
