package org.springaicommunity.stargazers.fetch;

/**
 * Endpoints and media types of the GitHub REST API used by stargazer traversals.
 */
public final class GitHubApi {

	public static final String API_BASE = "https://api.github.com/";

	/**
	 * Media type that makes the stargazers endpoint include {@code starred_at}.
	 */
	public static final String STAR_MEDIA_TYPE = "application/vnd.github.v3.star+json";

	private GitHubApi() {
	}

	/**
	 * First page of the stargazers of {@code repository}.
	 * @param repository repository in "owner/repo" format
	 * @return absolute URL
	 */
	public static String stargazersUrl(String repository) {
		return API_BASE + "repos/" + repository + "/stargazers";
	}

	/**
	 * Contributor statistics of {@code repository}. GitHub answers 202 while it is still
	 * computing them.
	 * @param repository repository in "owner/repo" format
	 * @return absolute URL
	 */
	public static String contributorStatsUrl(String repository) {
		return API_BASE + "repos/" + repository + "/stats/contributors";
	}

}
