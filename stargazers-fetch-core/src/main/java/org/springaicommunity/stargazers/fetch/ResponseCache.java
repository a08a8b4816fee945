package org.springaicommunity.stargazers.fetch;

import java.util.Optional;

/**
 * Store of raw responses keyed by {@link RequestIdentity} within a {@link CacheScope}.
 *
 * <p>
 * Abstracts the storage so that the fetcher can be tested without a file system and so
 * that alternative stores can be plugged in. Implementations need not be thread-safe;
 * the fetch engine reads and writes from a single thread.
 */
public interface ResponseCache {

	/**
	 * Look up the stored response for a request.
	 * @param scope repository namespace
	 * @param identity request identity
	 * @return the entry, or empty on a miss
	 * @throws ResponseCacheException if the store cannot be read
	 */
	Optional<CacheEntry> get(CacheScope scope, RequestIdentity identity);

	/**
	 * Store a response, replacing any previous entry for the same identity.
	 * @param scope repository namespace
	 * @param identity request identity
	 * @param entry response to store
	 * @throws ResponseCacheException if the store cannot be written
	 */
	void put(CacheScope scope, RequestIdentity identity, CacheEntry entry);

	/**
	 * Remove the stored response for a request, if any.
	 * @param scope repository namespace
	 * @param identity request identity
	 * @throws ResponseCacheException if the entry exists but cannot be removed
	 */
	void invalidate(CacheScope scope, RequestIdentity identity);

	/**
	 * Remove every stored response of a repository namespace.
	 * @param scope repository namespace
	 * @throws ResponseCacheException if the namespace cannot be removed
	 */
	void clearScope(CacheScope scope);

}
