package org.springaicommunity.stargazers.fetch;

import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * Everything that determines the representation a request returns, and therefore the key
 * its response is cached under.
 *
 * @param method HTTP method
 * @param url absolute request URL
 * @param acceptHeader optional content-negotiation override
 */
public record RequestIdentity(String method, String url, @Nullable String acceptHeader) {

	public RequestIdentity {
		Objects.requireNonNull(method, "method");
		Objects.requireNonNull(url, "url");
	}

	public static RequestIdentity get(String url, @Nullable String acceptHeader) {
		return new RequestIdentity("GET", url, acceptHeader);
	}

	/**
	 * Stable single-line rendering, also used to derive cache file names.
	 * @return e.g. {@code GET https://api.github.com/x [application/json]}
	 */
	public String describe() {
		return method + " " + url + (acceptHeader != null ? " [" + acceptHeader + "]" : "");
	}

}
