package org.springaicommunity.stargazers.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fetches one URL of the GitHub REST API, answering from the {@link ResponseCache} when
 * it can and going to the network through the {@link BackoffPolicy} when it must.
 *
 * <p>
 * Traversal code drives pagination itself:
 *
 * <pre>
 * {@code
 * FetchContext ctx = FetchContext.fromEnvironment("cockroachdb/cockroach")
 *     .withAcceptHeader(GitHubApi.STAR_MEDIA_TYPE);
 * String url = GitHubApi.stargazersUrl(ctx.repository());
 * while (url != null) {
 *     Page<List<Stargazer>> page = fetcher.fetch(ctx, url, new TypeReference<>() {}, true);
 *     ...
 *     url = page.nextCursor();
 * }
 * }
 * </pre>
 *
 * <p>
 * Failure handling:
 * <ul>
 * <li>rate limits and transient failures are retried inside the policy</li>
 * <li>a permanent failure or running out of attempts is logged and returns
 * {@link Page#empty()}, so one bad endpoint does not abort a long traversal</li>
 * <li>a body that does not decode is treated as a corrupt cache entry: it is removed and
 * the fetch repeated once; a second failure removes it again and throws
 * {@link ResponseDecodeException}</li>
 * <li>{@link ResponseCacheException} always propagates</li>
 * </ul>
 *
 * <p>
 * Not thread-safe: calls are expected to run one after another so that a single policy
 * paces all requests made with one token.
 */
public class ResourceFetcher {

	private static final Logger logger = LoggerFactory.getLogger(ResourceFetcher.class);

	private final FetchExecutor executor;

	private final ResponseCache responseCache;

	private final BackoffPolicy backoffPolicy;

	private final ObjectMapper objectMapper;

	public ResourceFetcher(FetchExecutor executor, ResponseCache responseCache, BackoffPolicy backoffPolicy,
			ObjectMapper objectMapper) {
		this.executor = executor;
		this.responseCache = responseCache;
		this.backoffPolicy = backoffPolicy;
		this.objectMapper = objectMapper;
	}

	public <T> Page<T> fetch(FetchContext ctx, String url, Class<T> type, boolean revalidateLastPage) {
		return fetch(ctx, url, objectMapper.constructType(type), revalidateLastPage);
	}

	public <T> Page<T> fetch(FetchContext ctx, String url, TypeReference<T> type, boolean revalidateLastPage) {
		return fetch(ctx, url, objectMapper.getTypeFactory().constructType(type), revalidateLastPage);
	}

	/**
	 * Fetch {@code url} and decode its body.
	 * @param ctx per-call configuration
	 * @param url absolute URL, typically a previous page's cursor
	 * @param type target type of the body
	 * @param revalidateLastPage whether a cached last page must be fetched again, for
	 * collections that grow between runs
	 * @param <T> target type
	 * @return decoded content and next cursor, or {@link Page#empty()} if the URL could
	 * not be fetched
	 * @throws ResponseDecodeException if the body does not decode even after a refetch
	 * @throws ResponseCacheException if the response cache fails
	 */
	public <T> Page<T> fetch(FetchContext ctx, String url, JavaType type, boolean revalidateLastPage) {
		return fetch(ctx, url, type, revalidateLastPage, true);
	}

	private <T> Page<T> fetch(FetchContext ctx, String url, JavaType type, boolean revalidateLastPage,
			boolean refetchIfCorrupt) {
		RequestIdentity identity = RequestIdentity.get(url, ctx.acceptHeader());
		CacheScope scope = ctx.cacheScope();

		CacheEntry entry = responseCache.get(scope, identity)
			.filter(cached -> isUsable(cached, url, revalidateLastPage))
			.orElse(null);
		if (entry == null) {
			entry = backoffPolicy.execute(url, () -> executor.execute(ctx, identity)).orElse(null);
			if (entry == null) {
				return Page.empty();
			}
		}

		String next = LinkHeaderParser.nextCursor(entry).orElse(null);
		T content;
		try {
			content = objectMapper.readValue(entry.body(), type);
		}
		catch (JsonProcessingException e) {
			if (!refetchIfCorrupt) {
				responseCache.invalidate(scope, identity);
				throw new ResponseDecodeException(url, e);
			}
			logger.warn("cache entry {} corrupted; removing and refetching: {}", url, e.getOriginalMessage());
			responseCache.invalidate(scope, identity);
			return fetch(ctx, url, type, revalidateLastPage, false);
		}
		return new Page<>(content, next);
	}

	private static boolean isUsable(CacheEntry cached, String url, boolean revalidateLastPage) {
		if (!revalidateLastPage || LinkHeaderParser.nextCursor(cached).isPresent()) {
			logger.debug("cache hit for {}", url);
			return true;
		}
		logger.debug("revalidating cached last page {}", url);
		return false;
	}

	/**
	 * Fetch every page of a list-valued collection and concatenate the items in order.
	 * @param ctx per-call configuration
	 * @param url first page
	 * @param elementType type of one item
	 * @param revalidateLastPage see {@link #fetch(FetchContext, String, JavaType, boolean)}
	 * @param <T> item type
	 * @return all items; pages that could not be fetched contribute nothing
	 */
	public <T> List<T> fetchAll(FetchContext ctx, String url, Class<T> elementType, boolean revalidateLastPage) {
		JavaType pageType = objectMapper.getTypeFactory().constructCollectionType(List.class, elementType);
		List<T> items = new ArrayList<>();
		Set<String> visited = new HashSet<>();
		String next = url;
		while (next != null) {
			if (!visited.add(next)) {
				logger.warn("pagination of {} links back to {}; stopping", url, next);
				break;
			}
			Page<List<T>> page = fetch(ctx, next, pageType, revalidateLastPage);
			if (page.content() != null) {
				items.addAll(page.content());
			}
			next = page.nextCursor();
		}
		logger.debug("fetched {} items from {} pages of {}", items.size(), visited.size(), url);
		return items;
	}

	/**
	 * Remove every cached response of {@code ctx}'s repository.
	 * @param ctx context naming the repository and cache root
	 * @throws ResponseCacheException if the cache cannot be cleared
	 */
	public void clearScope(FetchContext ctx) {
		logger.info("clearing GitHub API response cache for repository {}", ctx.repository());
		responseCache.clearScope(ctx.cacheScope());
	}

}
