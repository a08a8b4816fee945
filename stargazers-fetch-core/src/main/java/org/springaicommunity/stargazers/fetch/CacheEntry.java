package org.springaicommunity.stargazers.fetch;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A stored HTTP response: status, headers and raw body as received, plus the time it was
 * stored. Header names are matched case-insensitively.
 *
 * @param statusCode HTTP status code
 * @param headers response headers
 * @param body raw response body (decompressed)
 * @param storedAt when the response was stored
 */
public record CacheEntry(@JsonProperty("status_code") int statusCode,
		@JsonProperty("headers") Map<String, List<String>> headers, @JsonProperty("body") String body,
		@JsonProperty("stored_at") Instant storedAt) {

	public CacheEntry {
		Objects.requireNonNull(body, "body");
		Objects.requireNonNull(storedAt, "storedAt");
		headers = copyHeaders(headers);
	}

	/**
	 * First value of the named header.
	 * @param name header name, any case
	 * @return the value, or empty when the header is absent
	 */
	public Optional<String> firstHeader(String name) {
		List<String> values = headers.get(name);
		return (values == null || values.isEmpty()) ? Optional.empty() : Optional.of(values.get(0));
	}

	private static Map<String, List<String>> copyHeaders(Map<String, List<String>> source) {
		TreeMap<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
		if (source != null) {
			source.forEach((name, values) -> {
				if (name != null && values != null) {
					copy.computeIfAbsent(name, k -> new ArrayList<>()).addAll(values);
				}
			});
		}
		copy.replaceAll((name, values) -> List.copyOf(values));
		return Collections.unmodifiableMap(copy);
	}

}
