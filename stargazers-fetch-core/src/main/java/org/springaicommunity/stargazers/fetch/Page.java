package org.springaicommunity.stargazers.fetch;

import org.jspecify.annotations.Nullable;

/**
 * One fetched page: the decoded body and the URL of the following page.
 *
 * <p>
 * A page without a cursor is the last one. {@link #empty()} stands for a URL that could
 * not be fetched; callers treat it as the end of the collection.
 *
 * @param content decoded body, or {@code null} when nothing was fetched
 * @param nextCursor URL of the next page, or {@code null} on the last page
 * @param <T> decoded body type
 */
public record Page<T>(@Nullable T content, @Nullable String nextCursor) {

	public static <T> Page<T> empty() {
		return new Page<>(null, null);
	}

	public boolean hasNext() {
		return nextCursor != null;
	}

	public boolean isEmpty() {
		return content == null;
	}

}
