package org.springaicommunity.stargazers.fetch;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;

/**
 * {@link FetchExecutor} backed by the Java 11+ {@link HttpClient}.
 *
 * <p>
 * Status classification:
 * <ul>
 * <li>200: {@link FetchOutcome.Success}, stored in the {@link ResponseCache} first</li>
 * <li>202 (GitHub is still computing statistics): {@link FetchOutcome.Transient}</li>
 * <li>403 with {@code X-RateLimit-Remaining: 0}: {@link FetchOutcome.RateLimited} until
 * {@code X-RateLimit-Reset}</li>
 * <li>anything else: {@link FetchOutcome.Permanent}</li>
 * <li>no response at all: {@link FetchOutcome.Transient}</li>
 * </ul>
 *
 * <p>
 * Rate limit headers are read from every response and available via
 * {@link #getLastRateLimitInfo()}.
 */
public class HttpFetchExecutor implements FetchExecutor {

	private static final Logger logger = LoggerFactory.getLogger(HttpFetchExecutor.class);

	private static final int MAX_DIAGNOSTIC_BODY_LENGTH = 512;

	private final HttpClient httpClient;

	private final ResponseCache responseCache;

	private final FetchProperties properties;

	private final Clock clock;

	@Nullable
	private volatile RateLimitInfo lastRateLimitInfo;

	public HttpFetchExecutor(ResponseCache responseCache, FetchProperties properties) {
		this(defaultHttpClient(properties), responseCache, properties, Clock.systemUTC());
	}

	HttpFetchExecutor(HttpClient httpClient, ResponseCache responseCache, FetchProperties properties, Clock clock) {
		this.httpClient = httpClient;
		this.responseCache = responseCache;
		this.properties = properties;
		this.clock = clock;
	}

	static HttpClient defaultHttpClient(FetchProperties properties) {
		return HttpClient.newBuilder()
			.connectTimeout(properties.getConnectTimeout())
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	@Nullable
	public RateLimitInfo getLastRateLimitInfo() {
		return lastRateLimitInfo;
	}

	@Override
	public FetchOutcome execute(FetchContext ctx, RequestIdentity request) {
		HttpRequest httpRequest;
		try {
			httpRequest = buildRequest(ctx, request);
		}
		catch (IllegalArgumentException e) {
			return new FetchOutcome.Permanent(0, "invalid request " + request.describe() + ": " + e.getMessage());
		}

		logger.debug("fetching {}...", request.url());
		long start = System.currentTimeMillis();
		HttpResponse<byte[]> response;
		try {
			response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
		}
		catch (IOException e) {
			logger.debug("GET {} failed after {}ms: {}", request.url(), System.currentTimeMillis() - start,
					e.toString());
			return new FetchOutcome.Transient("GET " + request.url() + " failed: " + e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new FetchException("GET " + request.url() + " interrupted", e);
		}
		logger.debug("GET {} returned {} in {}ms ({} bytes)", request.url(), response.statusCode(),
				System.currentTimeMillis() - start, response.body() == null ? 0 : response.body().length);

		RateLimitInfo rateLimit = recordRateLimit(response.headers());
		return classify(ctx, request, response, rateLimit);
	}

	private HttpRequest buildRequest(FetchContext ctx, RequestIdentity request) {
		HttpRequest.Builder builder = HttpRequest.newBuilder()
			.uri(URI.create(request.url()))
			.timeout(properties.getRequestTimeout())
			.header("User-Agent", properties.getUserAgent())
			.header("Accept-Encoding", "gzip");
		if (ctx.hasToken()) {
			builder.header("Authorization", "Bearer " + ctx.token());
		}
		if (request.acceptHeader() != null) {
			builder.header("Accept", request.acceptHeader());
		}
		return builder.method(request.method(), HttpRequest.BodyPublishers.noBody()).build();
	}

	private FetchOutcome classify(FetchContext ctx, RequestIdentity request, HttpResponse<byte[]> response,
			@Nullable RateLimitInfo rateLimit) {
		int status = response.statusCode();
		if (status == 200) {
			String body;
			try {
				body = decodeBody(response);
			}
			catch (IOException e) {
				return new FetchOutcome.Transient("GET " + request.url() + " returned an unreadable body: " + e);
			}
			CacheEntry entry = new CacheEntry(status, storedHeaders(response.headers()), body, clock.instant());
			store(ctx, request, entry);
			return new FetchOutcome.Success(entry);
		}
		if (status == 202) {
			return new FetchOutcome.Transient(
					"202 (Accepted) HTTP response for " + request.url() + "; backoff and retry");
		}
		if (status == 403 && rateLimit != null && rateLimit.isExceeded() && rateLimit.hasResetTime()) {
			return new FetchOutcome.RateLimited(rateLimit.getResetTime());
		}
		return new FetchOutcome.Permanent(status, diagnostic(request, response));
	}

	private void store(FetchContext ctx, RequestIdentity request, CacheEntry entry) {
		try {
			responseCache.put(ctx.cacheScope(), request, entry);
		}
		catch (ResponseCacheException e) {
			logger.warn("Failed to cache response for {}; continuing uncached: {}", request.url(), e.getMessage());
		}
	}

	@Nullable
	private RateLimitInfo recordRateLimit(HttpHeaders headers) {
		RateLimitInfo info = RateLimitInfo.fromHeaders(headers);
		if (info == null) {
			return null;
		}
		this.lastRateLimitInfo = info;
		if (info.remaining() < properties.getLowQuotaThreshold()) {
			logger.info("Rate limit low: {}/{} remaining, resets at {}", info.remaining(), info.limit(),
					info.getResetTime());
		}
		else {
			logger.debug("Rate limit: {}/{} remaining, resets at {}", info.remaining(), info.limit(),
					info.getResetTime());
		}
		return info;
	}

	private static String decodeBody(HttpResponse<byte[]> response) throws IOException {
		byte[] raw = response.body() == null ? new byte[0] : response.body();
		boolean gzipped = response.headers()
			.firstValue("Content-Encoding")
			.map(encoding -> encoding.trim().equalsIgnoreCase("gzip"))
			.orElse(false);
		if (gzipped && raw.length > 0) {
			try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(raw))) {
				raw = in.readAllBytes();
			}
		}
		return new String(raw, StandardCharsets.UTF_8);
	}

	/**
	 * Response headers as stored: the body is kept decompressed, so the transfer
	 * headers describing the wire form are dropped.
	 */
	private static Map<String, List<String>> storedHeaders(HttpHeaders headers) {
		Map<String, List<String>> stored = new LinkedHashMap<>();
		headers.map().forEach((name, values) -> {
			if (!name.equalsIgnoreCase("Content-Encoding") && !name.equalsIgnoreCase("Content-Length")) {
				stored.put(name, values);
			}
		});
		return stored;
	}

	private static String diagnostic(RequestIdentity request, HttpResponse<byte[]> response) {
		String body;
		try {
			body = decodeBody(response);
		}
		catch (IOException e) {
			body = "<unreadable body>";
		}
		if (body.length() > MAX_DIAGNOSTIC_BODY_LENGTH) {
			body = body.substring(0, MAX_DIAGNOSTIC_BODY_LENGTH) + "...";
		}
		return "failed to fetch (req: " + request.describe() + "): HTTP " + response.statusCode()
				+ (body.isEmpty() ? "" : " " + body);
	}

}
