package org.springaicommunity.stargazers.fetch;

import java.time.Duration;

/**
 * Blocks the calling thread. Every wait of the fetch engine goes through this seam, so
 * tests can observe waits instead of serving them.
 */
@FunctionalInterface
public interface Sleeper {

	void sleep(Duration duration) throws InterruptedException;

	static Sleeper threadSleep() {
		return duration -> Thread.sleep(duration.toMillis());
	}

}
