package org.springaicommunity.stargazers.fetch;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * Extracts the next-page cursor from a {@code Link} response header such as:
 *
 * <pre>
 * &lt;https://api.github.com/x?page=2&gt;; rel="next", &lt;https://api.github.com/x?page=5&gt;; rel="last"
 * </pre>
 *
 * <p>
 * The header is read with a small recursive-descent parser for the grammar below
 * (RFC&nbsp;8288, without extended parameters):
 *
 * <pre>
 * links  = link *( OWS "," OWS link )
 * link   = "&lt;" target "&gt;" *( OWS ";" OWS param )
 * param  = token [ OWS "=" OWS ( token / quoted-string ) ]
 * </pre>
 *
 * <p>
 * A missing, blank or malformed header yields no cursor, exactly like the last page of a
 * collection or an endpoint that does not paginate.
 */
public final class LinkHeaderParser {

	private static final Logger logger = LoggerFactory.getLogger(LinkHeaderParser.class);

	public static final String LINK_HEADER = "Link";

	private static final String TOKEN_SYMBOLS = "!#$%&'*+-.^_`|~";

	private final String input;

	private int pos;

	private LinkHeaderParser(String input) {
		this.input = input;
	}

	/**
	 * Next-page cursor of a stored response.
	 * @param entry stored response
	 * @return the {@code rel="next"} target, or empty on the last page
	 */
	public static Optional<String> nextCursor(CacheEntry entry) {
		return nextCursor(entry.firstHeader(LINK_HEADER).orElse(null));
	}

	/**
	 * Next-page cursor of a raw {@code Link} header value.
	 * @param headerValue header value, may be {@code null}
	 * @return the {@code rel="next"} target, or empty when there is none or the value
	 * does not parse
	 */
	public static Optional<String> nextCursor(@Nullable String headerValue) {
		if (headerValue == null || headerValue.isBlank()) {
			return Optional.empty();
		}
		try {
			return Optional.ofNullable(new LinkHeaderParser(headerValue).findTarget("next"));
		}
		catch (MalformedLinkException e) {
			logger.debug("Ignoring malformed Link header \"{}\": {}", headerValue, e.getMessage());
			return Optional.empty();
		}
	}

	@Nullable
	private String findTarget(String wantedRel) {
		String found = null;
		skipWhitespace();
		while (true) {
			String target = parseTarget();
			boolean matches = parseParamsMatchingRel(wantedRel);
			if (found == null && matches) {
				found = target;
			}
			skipWhitespace();
			if (atEnd()) {
				return found;
			}
			expect(',');
			skipWhitespace();
		}
	}

	private String parseTarget() {
		expect('<');
		int close = input.indexOf('>', pos);
		if (close < 0) {
			throw new MalformedLinkException("unterminated target at " + pos);
		}
		String target = input.substring(pos, close).trim();
		if (target.isEmpty()) {
			throw new MalformedLinkException("empty target at " + pos);
		}
		pos = close + 1;
		return target;
	}

	/**
	 * Consume the parameters of one link.
	 * @return whether a {@code rel} parameter lists {@code wantedRel}
	 */
	private boolean parseParamsMatchingRel(String wantedRel) {
		boolean matches = false;
		while (true) {
			skipWhitespace();
			if (atEnd() || peek() != ';') {
				return matches;
			}
			pos++;
			skipWhitespace();
			String name = parseToken();
			String value = null;
			skipWhitespace();
			if (!atEnd() && peek() == '=') {
				pos++;
				skipWhitespace();
				value = (!atEnd() && peek() == '"') ? parseQuotedString() : parseToken();
			}
			if (value != null && name.equalsIgnoreCase("rel") && containsRelation(value, wantedRel)) {
				matches = true;
			}
		}
	}

	private static boolean containsRelation(String relValue, String wantedRel) {
		// rel may hold several space-separated relation types
		int i = 0;
		int length = relValue.length();
		while (i < length) {
			while (i < length && Character.isWhitespace(relValue.charAt(i))) {
				i++;
			}
			int start = i;
			while (i < length && !Character.isWhitespace(relValue.charAt(i))) {
				i++;
			}
			if (i > start && relValue.substring(start, i).toLowerCase(Locale.ROOT).equals(wantedRel)) {
				return true;
			}
		}
		return false;
	}

	private String parseToken() {
		int start = pos;
		while (!atEnd() && isTokenChar(peek())) {
			pos++;
		}
		if (start == pos) {
			throw new MalformedLinkException("expected token at " + pos);
		}
		return input.substring(start, pos);
	}

	private String parseQuotedString() {
		expect('"');
		StringBuilder value = new StringBuilder();
		while (!atEnd()) {
			char c = input.charAt(pos++);
			if (c == '"') {
				return value.toString();
			}
			if (c == '\\') {
				if (atEnd()) {
					break;
				}
				c = input.charAt(pos++);
			}
			value.append(c);
		}
		throw new MalformedLinkException("unterminated quoted string");
	}

	private static boolean isTokenChar(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
				|| TOKEN_SYMBOLS.indexOf(c) >= 0;
	}

	private void expect(char expected) {
		if (atEnd() || peek() != expected) {
			throw new MalformedLinkException("expected '" + expected + "' at " + pos);
		}
		pos++;
	}

	private void skipWhitespace() {
		while (!atEnd() && (peek() == ' ' || peek() == '\t')) {
			pos++;
		}
	}

	private char peek() {
		return input.charAt(pos);
	}

	private boolean atEnd() {
		return pos >= input.length();
	}

	private static final class MalformedLinkException extends RuntimeException {

		MalformedLinkException(String message) {
			super(message);
		}

	}

}
