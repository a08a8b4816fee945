package org.springaicommunity.stargazers.fetch;

/**
 * Thrown when a response body still fails to decode after its cache entry was removed
 * and the resource fetched again.
 */
public class ResponseDecodeException extends FetchException {

	private final String url;

	public ResponseDecodeException(String url, Throwable cause) {
		super("unmarshal URL=\"" + url + "\": " + cause.getMessage(), cause);
		this.url = url;
	}

	public String getUrl() {
		return url;
	}

}
