package org.springaicommunity.stargazers.fetch;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.net.http.HttpClient;
import java.time.Clock;

/**
 * Builder wiring a {@link ResourceFetcher} from its collaborators.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Defaults: file system cache, JDK HttpClient, 10 attempts
 * ResourceFetcher fetcher = ResourceFetcherBuilder.create().build();
 *
 * // With custom configuration
 * FetchProperties props = new FetchProperties();
 * props.setUserAgent("my-analysis");
 *
 * ResourceFetcher fetcher = ResourceFetcherBuilder.create()
 *     .properties(props)
 *     .build();
 *
 * // For testing with a mock executor
 * FetchExecutor mockExecutor = mock(FetchExecutor.class);
 * ResourceFetcher testFetcher = ResourceFetcherBuilder.create()
 *     .executor(mockExecutor)
 *     .sleeper(duration -> {})
 *     .build();
 * }
 * </pre>
 */
public class ResourceFetcherBuilder {

	private FetchProperties properties;

	@Nullable
	private ObjectMapper objectMapper;

	@Nullable
	private FetchExecutor executor;

	@Nullable
	private ResponseCache responseCache;

	@Nullable
	private HttpClient httpClient;

	private Sleeper sleeper = Sleeper.threadSleep();

	private Clock clock = Clock.systemUTC();

	private ResourceFetcherBuilder() {
		this.properties = new FetchProperties();
	}

	public static ResourceFetcherBuilder create() {
		return new ResourceFetcherBuilder();
	}

	/**
	 * Set fetch properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public ResourceFetcherBuilder properties(@Nullable FetchProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper used for decoding bodies and for cache files. It must be
	 * able to handle {@link java.time.Instant}.
	 * @param objectMapper Jackson ObjectMapper (null to use
	 * {@link ObjectMapperFactory#create()})
	 * @return this builder
	 */
	public ResourceFetcherBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom FetchExecutor, e.g. a mock. The HTTP client setting is then unused.
	 * @param executor custom executor (null to use {@link HttpFetchExecutor})
	 * @return this builder
	 */
	public ResourceFetcherBuilder executor(@Nullable FetchExecutor executor) {
		this.executor = executor;
		return this;
	}

	/**
	 * Set a custom ResponseCache.
	 * @param responseCache custom cache (null to use {@link FileSystemResponseCache})
	 * @return this builder
	 */
	public ResourceFetcherBuilder responseCache(@Nullable ResponseCache responseCache) {
		this.responseCache = responseCache;
		return this;
	}

	/**
	 * Set the HttpClient used by the default executor.
	 * @param httpClient client (null to build one from the properties)
	 * @return this builder
	 */
	public ResourceFetcherBuilder httpClient(@Nullable HttpClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	public ResourceFetcherBuilder sleeper(@Nullable Sleeper sleeper) {
		this.sleeper = sleeper != null ? sleeper : Sleeper.threadSleep();
		return this;
	}

	public ResourceFetcherBuilder clock(@Nullable Clock clock) {
		this.clock = clock != null ? clock : Clock.systemUTC();
		return this;
	}

	/**
	 * Build the ResourceFetcher.
	 * @return configured ResourceFetcher
	 * @throws IllegalStateException if the properties describe an invalid backoff
	 */
	public ResourceFetcher build() {
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		ResponseCache cache = this.responseCache != null ? this.responseCache : new FileSystemResponseCache(mapper);
		FetchExecutor fetchExecutor = this.executor;
		if (fetchExecutor == null) {
			HttpClient client = this.httpClient != null ? this.httpClient
					: HttpFetchExecutor.defaultHttpClient(properties);
			fetchExecutor = new HttpFetchExecutor(client, cache, properties, clock);
		}
		BackoffPolicy policy = BackoffPolicy.builder()
			.maxAttempts(properties.getMaxAttempts())
			.initialDelay(properties.getInitialBackoff())
			.maxDelay(properties.getMaxBackoff())
			.rateLimitPadding(properties.getRateLimitPadding())
			.sleeper(sleeper)
			.clock(clock)
			.build();
		return new ResourceFetcher(fetchExecutor, cache, policy, mapper);
	}

}
