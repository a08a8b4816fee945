package org.springaicommunity.stargazers.fetch;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Namespace of cached responses: everything fetched on behalf of one tracked repository
 * lives under {@code <cacheRoot>/<owner>/<repo>} and can be cleared as a unit.
 *
 * @param cacheRoot root directory shared by all tracked repositories
 * @param repository tracked repository in "owner/repo" format
 */
public record CacheScope(Path cacheRoot, String repository) {

	public CacheScope {
		Objects.requireNonNull(cacheRoot, "cacheRoot");
		validateRepository(repository);
	}

	/**
	 * Directory holding every entry of this scope.
	 * @return {@code <cacheRoot>/<owner>/<repo>}
	 */
	public Path directory() {
		String[] parts = repository.split("/");
		return cacheRoot.resolve(parts[0]).resolve(parts[1]);
	}

	/**
	 * Check that {@code repository} is an "owner/repo" pair usable as two directory
	 * names.
	 * @param repository candidate repository name
	 * @throws IllegalArgumentException if the name is malformed
	 */
	static void validateRepository(String repository) {
		Objects.requireNonNull(repository, "repository");
		String[] parts = repository.split("/", -1);
		if (parts.length != 2 || !isPlainSegment(parts[0]) || !isPlainSegment(parts[1])) {
			throw new IllegalArgumentException(
					"repository must be in :owner/:repo format, got \"" + repository + "\"");
		}
	}

	private static boolean isPlainSegment(String segment) {
		return !segment.isBlank() && !segment.equals(".") && !segment.equals("..") && segment.indexOf('\\') < 0;
	}

}
