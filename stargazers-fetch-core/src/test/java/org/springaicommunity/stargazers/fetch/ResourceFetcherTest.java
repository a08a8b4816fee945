package org.springaicommunity.stargazers.fetch;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link ResourceFetcher}.
 *
 * Runs the fetcher against a real file cache and a scripted executor to cover caching,
 * last-page revalidation, pagination, soft failures and corruption recovery.
 */
@DisplayName("ResourceFetcher Tests")
class ResourceFetcherTest {

	private static final String BASE = "https://api.github.com/repos/owner/repo/stargazers";

	private static final Instant START = Instant.parse("2024-05-01T12:00:00Z");

	private static final TypeReference<List<User>> USERS = new TypeReference<>() {
	};

	record User(String login, int id) {
	}

	@TempDir
	Path tempDir;

	private ObjectMapper objectMapper;

	private FileSystemResponseCache cache;

	private StubFetchExecutor executor;

	private ManualClock clock;

	private ResourceFetcher fetcher;

	private FetchContext ctx;

	@BeforeEach
	void setUp() {
		objectMapper = ObjectMapperFactory.create();
		cache = new FileSystemResponseCache(objectMapper);
		executor = new StubFetchExecutor(cache);
		clock = new ManualClock(START);
		fetcher = fetcherWith(executor);
		ctx = FetchContext.of("owner/repo", "token", tempDir);
	}

	private ResourceFetcher fetcherWith(FetchExecutor fetchExecutor) {
		BackoffPolicy policy = BackoffPolicy.builder().sleeper(clock.sleeper()).clock(clock).build();
		return new ResourceFetcher(fetchExecutor, cache, policy, objectMapper);
	}

	private static String page(int from, int to) {
		List<String> users = new ArrayList<>();
		for (int i = from; i <= to; i++) {
			users.add("{\"login\":\"user" + i + "\",\"id\":" + i + ",\"site_admin\":false}");
		}
		return "[" + String.join(",", users) + "]";
	}

	private void storeInCache(String url, String body) {
		cache.put(ctx.cacheScope(), RequestIdentity.get(url, null), new CacheEntry(200, Map.of(), body, START));
	}

	@Nested
	@DisplayName("Caching Tests")
	class CachingTest {

		@Test
		@DisplayName("Should serve a second fetch from cache with identical content")
		void shouldBeIdempotent() {
			executor.enqueuePage(BASE, page(1, 3), null);

			Page<List<User>> first = fetcher.fetch(ctx, BASE, USERS, false);
			Page<List<User>> second = fetcher.fetch(ctx, BASE, USERS, false);

			assertThat(second).isEqualTo(first);
			assertThat(second.content()).extracting(User::login).containsExactly("user1", "user2", "user3");
			assertThat(executor.callsTo(BASE)).isEqualTo(1);
		}

		@Test
		@DisplayName("Should decode into a plain class target")
		void shouldDecodeClassTarget() {
			executor.enqueuePage("https://api.github.com/users/user1", "{\"login\":\"user1\",\"id\":1}", null);

			Page<User> page = fetcher.fetch(ctx, "https://api.github.com/users/user1", User.class, false);

			assertThat(page.content()).isEqualTo(new User("user1", 1));
			assertThat(page.hasNext()).isFalse();
		}

		@Test
		@DisplayName("Should cache representations of different accept headers separately")
		void shouldKeyCacheByAcceptHeader() {
			FetchContext starred = ctx.withAcceptHeader(GitHubApi.STAR_MEDIA_TYPE);
			executor.enqueuePage(BASE, page(1, 1), null).enqueuePage(BASE, page(2, 2), null);

			Page<List<User>> plain = fetcher.fetch(ctx, BASE, USERS, false);
			Page<List<User>> withStars = fetcher.fetch(starred, BASE, USERS, false);

			assertThat(plain.content()).extracting(User::id).containsExactly(1);
			assertThat(withStars.content()).extracting(User::id).containsExactly(2);
			assertThat(executor.calls()).extracting(RequestIdentity::acceptHeader)
				.containsExactly(null, GitHubApi.STAR_MEDIA_TYPE);
		}

		@Test
		@DisplayName("Should refetch after the repository scope is cleared")
		void shouldRefetchAfterClear() {
			executor.enqueuePage(BASE, page(1, 1), null).enqueuePage(BASE, page(1, 2), null);
			fetcher.fetch(ctx, BASE, USERS, false);

			fetcher.clearScope(ctx);
			Page<List<User>> page = fetcher.fetch(ctx, BASE, USERS, false);

			assertThat(page.content()).hasSize(2);
			assertThat(executor.callsTo(BASE)).isEqualTo(2);
			assertThat(cache.get(ctx.cacheScope(), RequestIdentity.get(BASE, null))).isEmpty();
		}

		@Test
		@DisplayName("Should propagate cache I/O failures")
		void shouldPropagateCacheFailure() {
			ResponseCache brokenCache = mock(ResponseCache.class);
			when(brokenCache.get(any(), any()))
				.thenThrow(new ResponseCacheException("getCache URL=\"" + BASE + "\"", new IOException("EIO")));
			ResourceFetcher brokenFetcher = new ResourceFetcher(executor, brokenCache,
					BackoffPolicy.builder().sleeper(clock.sleeper()).clock(clock).build(), objectMapper);

			assertThatThrownBy(() -> brokenFetcher.fetch(ctx, BASE, USERS, false))
				.isInstanceOf(ResponseCacheException.class)
				.hasMessageContaining(BASE);
			assertThat(executor.calls()).isEmpty();
		}

	}

	@Nested
	@DisplayName("Last Page Revalidation Tests")
	class RevalidationTest {

		@Test
		@DisplayName("Should refetch a cached last page when revalidating")
		void shouldRefetchLastPage() {
			storeInCache(BASE, page(1, 2));
			executor.enqueuePage(BASE, page(1, 3), BASE + "?page=2");

			Page<List<User>> page = fetcher.fetch(ctx, BASE, USERS, true);

			assertThat(page.content()).hasSize(3);
			assertThat(page.nextCursor()).isEqualTo(BASE + "?page=2");
			assertThat(executor.callsTo(BASE)).isEqualTo(1);
			assertThat(cache.get(ctx.cacheScope(), RequestIdentity.get(BASE, null)).orElseThrow().body())
				.isEqualTo(page(1, 3));
		}

		@Test
		@DisplayName("Should use a cached page that has a next cursor even when revalidating")
		void shouldKeepInnerPages() {
			executor.enqueuePage(BASE, page(1, 2), BASE + "?page=2");
			fetcher.fetch(ctx, BASE, USERS, true);

			Page<List<User>> again = fetcher.fetch(ctx, BASE, USERS, true);

			assertThat(again.nextCursor()).isEqualTo(BASE + "?page=2");
			assertThat(executor.callsTo(BASE)).isEqualTo(1);
		}

		@Test
		@DisplayName("Should use a cached last page when not revalidating")
		void shouldKeepLastPageWithoutRevalidation() {
			storeInCache(BASE, page(1, 2));

			Page<List<User>> page = fetcher.fetch(ctx, BASE, USERS, false);

			assertThat(page.content()).hasSize(2);
			assertThat(executor.calls()).isEmpty();
		}

	}

	@Nested
	@DisplayName("Pagination Tests")
	class PaginationTest {

		@Test
		@DisplayName("Should concatenate pages into the same items as one unpaged response")
		void shouldMatchUnpagedCollection() {
			String unpaged = "https://api.github.com/repos/owner/repo/stargazers?per_page=100";
			executor.enqueuePage(unpaged, page(1, 7), null);
			executor.enqueuePage(BASE, page(1, 3), BASE + "?page=2")
				.enqueuePage(BASE + "?page=2", page(4, 6), BASE + "?page=3")
				.enqueuePage(BASE + "?page=3", page(7, 7), null);

			List<User> paged = fetcher.fetchAll(ctx, BASE, User.class, false);
			List<User> whole = fetcher.fetch(ctx, unpaged, USERS, false).content();

			assertThat(paged).containsExactlyElementsOf(whole);
			assertThat(paged).doesNotHaveDuplicates();
		}

		@Test
		@DisplayName("Should let callers drive the loop with cursors")
		void shouldFollowCursorsManually() {
			executor.enqueuePage(BASE, page(1, 2), BASE + "?page=2").enqueuePage(BASE + "?page=2", page(3, 4), null);

			List<User> collected = new ArrayList<>();
			String url = BASE;
			while (url != null) {
				Page<List<User>> page = fetcher.fetch(ctx, url, USERS, false);
				collected.addAll(page.content());
				url = page.nextCursor();
			}

			assertThat(collected).extracting(User::id).containsExactly(1, 2, 3, 4);
		}

		@Test
		@DisplayName("Should stop when pagination links back to a visited page")
		void shouldStopOnCursorCycle() {
			executor.enqueuePage(BASE, page(1, 1), BASE + "?page=2").enqueuePage(BASE + "?page=2", page(2, 2), BASE);

			List<User> users = fetcher.fetchAll(ctx, BASE, User.class, false);

			assertThat(users).extracting(User::id).containsExactly(1, 2);
		}

	}

	@Nested
	@DisplayName("Soft Failure Tests")
	class SoftFailureTest {

		@Test
		@DisplayName("Should return an empty page for a permanent failure")
		void shouldSoftFailOnPermanent() {
			executor.enqueue(BASE, new FetchOutcome.Permanent(404, "Not Found"));

			Page<List<User>> page = fetcher.fetch(ctx, BASE, USERS, false);

			assertThat(page).isEqualTo(Page.empty());
			assertThat(page.isEmpty()).isTrue();
			assertThat(page.hasNext()).isFalse();
			assertThat(clock.sleeps()).isEmpty();
		}

		@Test
		@DisplayName("Should return an empty page after exhausting attempts")
		void shouldSoftFailOnExhaustion() {
			for (int i = 0; i < 10; i++) {
				executor.enqueue(BASE, new FetchOutcome.Transient("connection reset"));
			}

			Page<List<User>> page = fetcher.fetch(ctx, BASE, USERS, false);

			assertThat(page.isEmpty()).isTrue();
			assertThat(page.nextCursor()).isNull();
			assertThat(executor.callsTo(BASE)).isEqualTo(10);
			assertThat(clock.sleeps()).startsWith(Duration.ofMillis(50), Duration.ofMillis(100), Duration.ofMillis(200),
					Duration.ofMillis(400), Duration.ofMillis(800), Duration.ofMillis(1000));
		}

		@Test
		@DisplayName("Should skip an unreachable page in fetchAll")
		void shouldSkipUnreachablePage() {
			executor.enqueue(BASE, new FetchOutcome.Permanent(500, "boom"));

			assertThat(fetcher.fetchAll(ctx, BASE, User.class, false)).isEmpty();
		}

		@Test
		@DisplayName("Should wait out a rate limit and then succeed")
		void shouldWaitOutRateLimit() {
			Instant reset = START.plusSeconds(300);
			AtomicInteger attempts = new AtomicInteger();
			FetchExecutor rateLimited = (context, request) -> {
				if (attempts.getAndIncrement() == 0) {
					return new FetchOutcome.RateLimited(reset);
				}
				assertThat(clock.instant()).isAfterOrEqualTo(reset.plusSeconds(1));
				CacheEntry entry = new CacheEntry(200, Map.of(), page(1, 1), clock.instant());
				cache.put(context.cacheScope(), request, entry);
				return new FetchOutcome.Success(entry);
			};

			Page<List<User>> page = fetcherWith(rateLimited).fetch(ctx, BASE, USERS, false);

			assertThat(page.content()).extracting(User::login).containsExactly("user1");
			assertThat(clock.sleeps()).containsExactly(Duration.ofSeconds(301));
		}

	}

	@Nested
	@DisplayName("Corruption Recovery Tests")
	class CorruptionTest {

		@Test
		@DisplayName("Should replace a corrupt cached body with a fresh fetch")
		void shouldRecoverFromCorruptCache() {
			storeInCache(BASE, "[{\"login\": \"user1\", ");
			executor.enqueuePage(BASE, page(1, 2), null);

			Page<List<User>> page = fetcher.fetch(ctx, BASE, USERS, false);

			assertThat(page.content()).hasSize(2);
			assertThat(executor.callsTo(BASE)).isEqualTo(1);
			assertThat(cache.get(ctx.cacheScope(), RequestIdentity.get(BASE, null)).orElseThrow().body())
				.isEqualTo(page(1, 2));
		}

		@Test
		@DisplayName("Should throw after a second consecutive decode failure")
		void shouldFailOnSecondCorruption() {
			storeInCache(BASE, "not json");
			executor.enqueuePage(BASE, "still not json", null);

			assertThatThrownBy(() -> fetcher.fetch(ctx, BASE, USERS, false))
				.isInstanceOf(ResponseDecodeException.class)
				.hasMessageContaining(BASE);
			assertThat(executor.callsTo(BASE)).isEqualTo(1);
			assertThat(cache.get(ctx.cacheScope(), RequestIdentity.get(BASE, null))).isEmpty();
		}

		@Test
		@DisplayName("Should retry a freshly fetched undecodable body only once")
		void shouldRetryFreshBodyOnce() {
			executor.enqueuePage(BASE, "{\"unexpected\": \"object\"}", null)
				.enqueuePage(BASE, "{\"unexpected\": \"object\"}", null);

			assertThatThrownBy(() -> fetcher.fetch(ctx, BASE, USERS, false))
				.isInstanceOf(ResponseDecodeException.class)
				.satisfies(e -> assertThat(((ResponseDecodeException) e).getUrl()).isEqualTo(BASE));
			assertThat(executor.callsTo(BASE)).isEqualTo(2);
			assertThat(cache.get(ctx.cacheScope(), RequestIdentity.get(BASE, null))).isEmpty();
		}

	}

}
