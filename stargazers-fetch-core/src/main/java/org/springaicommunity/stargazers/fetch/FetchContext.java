package org.springaicommunity.stargazers.fetch;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Per-call fetch configuration. Instances are immutable: a call site that needs a
 * different {@code Accept} header derives its own copy with
 * {@link #withAcceptHeader(String)}.
 *
 * @param repository tracked repository ("owner/repo") that scopes cached responses
 * @param token GitHub access token, or {@code null} for unauthenticated access
 * @param cacheRoot root directory of the response cache
 * @param acceptHeader optional content-negotiation override
 */
public record FetchContext(String repository, @Nullable String token, Path cacheRoot,
		@Nullable String acceptHeader) {

	/**
	 * Cache root used when {@code STARGAZERS_CACHE_DIR} is not set.
	 */
	public static final String DEFAULT_CACHE_DIR = "./stargazer_cache";

	public FetchContext {
		CacheScope.validateRepository(repository);
		Objects.requireNonNull(cacheRoot, "cacheRoot");
	}

	/**
	 * Create a context without a content-negotiation override.
	 * @param repository tracked repository ("owner/repo")
	 * @param token access token, may be {@code null}
	 * @param cacheRoot response cache root
	 * @return new context
	 */
	public static FetchContext of(String repository, @Nullable String token, Path cacheRoot) {
		return new FetchContext(repository, token, cacheRoot, null);
	}

	/**
	 * Create a context from {@code GITHUB_TOKEN} and {@code STARGAZERS_CACHE_DIR}, read
	 * through {@link EnvironmentSupport}.
	 * @param repository tracked repository ("owner/repo")
	 * @return new context
	 */
	public static FetchContext fromEnvironment(String repository) {
		String token = EnvironmentSupport.get(EnvironmentSupport.TOKEN_VARIABLE);
		String cacheDir = EnvironmentSupport.getOrDefault(EnvironmentSupport.CACHE_DIR_VARIABLE, DEFAULT_CACHE_DIR);
		return of(repository, token, Paths.get(cacheDir));
	}

	public FetchContext withAcceptHeader(@Nullable String acceptHeader) {
		return new FetchContext(repository, token, cacheRoot, acceptHeader);
	}

	public boolean hasToken() {
		return token != null && !token.isBlank();
	}

	public CacheScope cacheScope() {
		return new CacheScope(cacheRoot, repository);
	}

	@Override
	public String toString() {
		return "FetchContext[repository=" + repository + ", token=" + (hasToken() ? "****" : "none") + ", cacheRoot="
				+ cacheRoot + ", acceptHeader=" + acceptHeader + "]";
	}

}
