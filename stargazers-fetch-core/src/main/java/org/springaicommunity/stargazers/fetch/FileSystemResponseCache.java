package org.springaicommunity.stargazers.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * File system implementation of {@link ResponseCache}.
 *
 * <p>
 * Each entry is a pretty-printed JSON file whose location mirrors the request URL, so
 * that cached responses can be inspected by hand:
 *
 * <pre>
 * &lt;cacheRoot&gt;/&lt;owner&gt;/&lt;repo&gt;/api.github.com/repos/o/r/stargazers/GET_page=2_1a2b3c4d.json
 * </pre>
 *
 * The file name carries the sanitized query and accept header plus a short digest of the
 * full {@link RequestIdentity}, which keeps one file per identity.
 */
public class FileSystemResponseCache implements ResponseCache {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemResponseCache.class);

	private static final int MAX_NAME_PART_LENGTH = 80;

	private final ObjectMapper objectMapper;

	public FileSystemResponseCache(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	@Override
	public Optional<CacheEntry> get(CacheScope scope, RequestIdentity identity) {
		Path file = pathFor(scope, identity);
		if (!Files.isRegularFile(file)) {
			return Optional.empty();
		}
		try {
			return Optional.of(objectMapper.readValue(file.toFile(), CacheEntry.class));
		}
		catch (JsonProcessingException e) {
			logger.warn("Cache entry {} for {} is unreadable; removing it: {}", file, identity.url(),
					e.getOriginalMessage());
			invalidate(scope, identity);
			return Optional.empty();
		}
		catch (IOException e) {
			throw new ResponseCacheException("getCache URL=\"" + identity.url() + "\": failed to read " + file, e);
		}
	}

	@Override
	public void put(CacheScope scope, RequestIdentity identity, CacheEntry entry) {
		Path file = pathFor(scope, identity);
		Path temp = null;
		try {
			Files.createDirectories(file.getParent());
			temp = Files.createTempFile(file.getParent(), ".entry", ".tmp");
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), entry);
			moveIntoPlace(temp, file);
			logger.debug("Cached {} ({} bytes) at {}", identity.describe(), entry.body().length(), file);
		}
		catch (IOException e) {
			ResponseCacheException failure = new ResponseCacheException(
					"putCache URL=\"" + identity.url() + "\": failed to write " + file, e);
			if (temp != null) {
				try {
					Files.deleteIfExists(temp);
				}
				catch (IOException cleanup) {
					failure.addSuppressed(cleanup);
				}
			}
			throw failure;
		}
	}

	@Override
	public void invalidate(CacheScope scope, RequestIdentity identity) {
		Path file = pathFor(scope, identity);
		try {
			if (Files.deleteIfExists(file)) {
				logger.debug("Removed cache entry {} for {}", file, identity.describe());
			}
		}
		catch (IOException e) {
			throw new ResponseCacheException("clearEntry URL=\"" + identity.url() + "\": failed to delete " + file, e);
		}
	}

	@Override
	public void clearScope(CacheScope scope) {
		Path directory = scope.directory();
		if (!Files.exists(directory)) {
			logger.info("No cached responses for {} under {}", scope.repository(), directory);
			return;
		}
		int deleted = 0;
		try (Stream<Path> paths = Files.walk(directory)) {
			Iterator<Path> deepestFirst = paths.sorted(Comparator.reverseOrder()).iterator();
			while (deepestFirst.hasNext()) {
				Files.delete(deepestFirst.next());
				deleted++;
			}
		}
		catch (IOException e) {
			throw new ResponseCacheException("clear cache for " + scope.repository() + ": failed under " + directory,
					e);
		}
		logger.info("Cleared {} cached paths for {} from {}", deleted, scope.repository(), directory);
	}

	/**
	 * Location of the file holding the entry for {@code identity}.
	 * @param scope repository namespace
	 * @param identity request identity
	 * @return entry file path (which may not exist)
	 */
	public Path pathFor(CacheScope scope, RequestIdentity identity) {
		URI uri;
		try {
			uri = URI.create(identity.url());
		}
		catch (IllegalArgumentException e) {
			uri = null;
		}

		Path directory = scope.directory();
		StringBuilder fileName = new StringBuilder(sanitize(identity.method()));
		if (uri != null && uri.getHost() != null) {
			String host = uri.getPort() >= 0 ? uri.getHost() + "_" + uri.getPort() : uri.getHost();
			directory = directory.resolve(sanitize(host));
			String rawPath = uri.getRawPath();
			if (rawPath != null) {
				for (String segment : rawPath.split("/")) {
					if (!segment.isEmpty()) {
						directory = directory.resolve(sanitize(segment));
					}
				}
			}
			if (uri.getRawQuery() != null) {
				fileName.append('_').append(sanitize(uri.getRawQuery()));
			}
		}
		else {
			directory = directory.resolve("_unparsed");
		}
		if (identity.acceptHeader() != null) {
			fileName.append('_').append(sanitize(identity.acceptHeader()));
		}
		fileName.append('_').append(digest(identity.describe())).append(".json");
		return directory.resolve(fileName.toString());
	}

	private static void moveIntoPlace(Path source, Path target) throws IOException {
		try {
			Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
		}
		catch (AtomicMoveNotSupportedException e) {
			Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	/**
	 * Reduce a URL part to characters that are safe in a file name on every platform.
	 */
	static String sanitize(String part) {
		StringBuilder safe = new StringBuilder(Math.min(part.length(), MAX_NAME_PART_LENGTH));
		for (int i = 0; i < part.length() && safe.length() < MAX_NAME_PART_LENGTH; i++) {
			char c = part.charAt(i);
			boolean allowed = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '-'
					|| c == '.' || c == '=' || c == '+';
			safe.append(allowed ? c : '_');
		}
		String result = safe.toString();
		if (result.isEmpty() || result.chars().allMatch(c -> c == '.')) {
			return "_" + result;
		}
		return result;
	}

	private static String digest(String value) {
		try {
			byte[] hash = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
			return HexFormat.of().formatHex(Arrays.copyOf(hash, 4));
		}
		catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 not available", e);
		}
	}

}
