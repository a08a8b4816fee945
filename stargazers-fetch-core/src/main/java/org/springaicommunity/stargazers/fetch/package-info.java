/**
 * Single-request fetch engine for the GitHub REST API.
 *
 * <p>
 * {@link org.springaicommunity.stargazers.fetch.ResourceFetcher} is the entry point. It
 * consults a {@link org.springaicommunity.stargazers.fetch.ResponseCache}, runs a
 * {@link org.springaicommunity.stargazers.fetch.FetchExecutor} through a
 * {@link org.springaicommunity.stargazers.fetch.BackoffPolicy} on a miss, and returns
 * the decoded body together with the next pagination cursor.
 *
 * <p>
 * This package is null-marked, meaning all reference types are non-null by default unless
 * explicitly annotated with @Nullable.
 */
@NullMarked
package org.springaicommunity.stargazers.fetch;

import org.jspecify.annotations.NullMarked;
