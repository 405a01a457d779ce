/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package com.soklet.tackd.service;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.pyranid.Database;
import com.soklet.tackd.Configuration;
import com.soklet.tackd.CurrentContext;
import com.soklet.tackd.exception.CleanupNotRequiredException;
import com.soklet.tackd.exception.CleanupNotRequiredException.Reason;
import com.soklet.tackd.model.db.CleanupLock;
import com.soklet.tackd.model.db.Upload;
import com.soklet.tackd.storage.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Reclaims expired uploads, coordinating with every other process that shares the database.
 * <p>
 * Mutual exclusion comes from a single {@code cleanup_lock} control record that is only ever changed through
 * conditional {@code UPDATE}s: the match and the mutation are one atomic step, so two processes racing for the
 * record cannot both win. A record left active by a crashed holder is reclaimable once it is older than
 * {@link Configuration#getStaleLockThreshold()}.
 * <p>
 * In front of that sits a process-local timer so a busy node only contends for the record once per
 * {@link Configuration#getCleanupInterval()}. The timer reduces load; it is not what makes the sweep safe.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@Singleton
@ThreadSafe
public class CleanupCoordinator {
	@Nonnull
	public static final String CONTROL_RECORD_ID;
	@Nonnull
	private static final Duration SHUTDOWN_TIMEOUT;

	static {
		CONTROL_RECORD_ID = "uploads";
		SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);
	}

	@Nonnull
	private final Configuration configuration;
	@Nonnull
	private final Database database;
	@Nonnull
	private final ObjectStore objectStore;
	@Nonnull
	private final Clock clock;
	@Nonnull
	private final ExecutorService executorService;
	@Nonnull
	private final Object lockTimerLock;
	@Nonnull
	private final Logger logger;

	@Nullable
	@GuardedBy("lockTimerLock")
	private Instant lastLockAttemptAt;

	@Inject
	public CleanupCoordinator(@Nonnull Configuration configuration,
														@Nonnull Database database,
														@Nonnull ObjectStore objectStore,
														@Nonnull Clock clock) {
		requireNonNull(configuration);
		requireNonNull(database);
		requireNonNull(objectStore);
		requireNonNull(clock);

		this.configuration = configuration;
		this.database = database;
		this.objectStore = objectStore;
		this.clock = clock;
		this.lockTimerLock = new Object();
		this.logger = LoggerFactory.getLogger(getClass());
		this.executorService = Executors.newSingleThreadExecutor(runnable -> {
			Thread thread = new Thread(runnable, "cleanup-sweeper");
			thread.setDaemon(true);
			return thread;
		});
	}

	@Nonnull
	public Optional<CleanupLock> findControlRecord() {
		return getDatabase().queryForObject("""
				SELECT *
				FROM cleanup_lock
				WHERE cleanup_lock_id=?
				""", CleanupLock.class, CONTROL_RECORD_ID);
	}

	/**
	 * Ensures the control record exists and is not held by a process that died while sweeping.
	 */
	public void adminInit() {
		Instant now = getClock().instant();
		CleanupLock controlRecord = findControlRecord().orElse(null);

		if (controlRecord == null) {
			// Backdated so the first lock attempt is not made to wait out a quiet period
			getDatabase().execute("""
					INSERT INTO cleanup_lock (
						cleanup_lock_id,
						active,
						modified_at
					) VALUES (?,?,?)
					""", CONTROL_RECORD_ID, false, now.minus(getConfiguration().getCleanupInterval()));

			getLogger().debug("Created cleanup control record");
			return;
		}

		if (!controlRecord.active())
			return;

		Instant staleBefore = now.minus(getConfiguration().getStaleLockThreshold());

		boolean released = getDatabase().execute("""
				UPDATE cleanup_lock
				SET active=FALSE, modified_at=?
				WHERE cleanup_lock_id=?
				AND active=TRUE
				AND modified_at < ?
				""", now, CONTROL_RECORD_ID, staleBefore) > 0;

		if (released)
			getLogger().warn("Released stale cleanup lock last modified at {}", controlRecord.modifiedAt());
		else
			getLogger().debug("Cleanup lock is held by another process and is not stale; leaving it alone");
	}

	/**
	 * Allows at most one lock attempt per cleanup interval from this process.
	 *
	 * @throws CleanupNotRequiredException with {@link Reason#INTERVAL_NOT_ELAPSED} if this process tried too recently
	 */
	public void lockTimer() {
		Instant now = getClock().instant();

		synchronized (this.lockTimerLock) {
			if (this.lastLockAttemptAt != null && now.isBefore(this.lastLockAttemptAt.plus(getConfiguration().getCleanupInterval())))
				throw new CleanupNotRequiredException(Reason.INTERVAL_NOT_ELAPSED);

			this.lastLockAttemptAt = now;
		}
	}

	/**
	 * Acquires the control record.
	 * <p>
	 * An inactive record qualifies once it has been quiet for a full interval (or immediately, when
	 * {@code requireQuietPeriod} is false). An active record qualifies only once it is stale.
	 *
	 * @throws CleanupNotRequiredException with {@link Reason#LOCK_NOT_ACQUIRED} if the record did not qualify
	 */
	public void lockCleanup(@Nonnull Boolean requireQuietPeriod) {
		requireNonNull(requireQuietPeriod);

		Instant now = getClock().instant();
		Instant quietSince = requireQuietPeriod ? now.minus(getConfiguration().getCleanupInterval()) : now;
		Instant staleBefore = now.minus(getConfiguration().getStaleLockThreshold());

		boolean acquired = getDatabase().execute("""
				UPDATE cleanup_lock
				SET active=TRUE, modified_at=?
				WHERE cleanup_lock_id=?
				AND (
					(active=FALSE AND modified_at <= ?)
					OR (active=TRUE AND modified_at < ?)
				)
				""", now, CONTROL_RECORD_ID, quietSince, staleBefore) > 0;

		if (!acquired)
			throw new CleanupNotRequiredException(Reason.LOCK_NOT_ACQUIRED);
	}

	public void unlockCleanup() {
		getDatabase().execute("""
				UPDATE cleanup_lock
				SET active=FALSE, modified_at=?
				WHERE cleanup_lock_id=?
				AND active=TRUE
				""", getClock().instant(), CONTROL_RECORD_ID);
	}

	/**
	 * Deactivates one batch of expired uploads and deletes their blobs.
	 * <p>
	 * A failure on one upload is logged and the sweep moves on to the next.
	 *
	 * @return the number of uploads this sweep deactivated
	 */
	@Nonnull
	public Integer cleanupWork() {
		Instant now = getClock().instant();

		List<Upload> expiredUploads = getDatabase().queryForList(format("""
				SELECT *
				FROM upload
				WHERE active=TRUE
				AND expires_at < ?
				ORDER BY expires_at
				LIMIT %d
				""", getConfiguration().getCleanupBatchSize()), Upload.class, now);

		int deactivatedCount = 0;

		for (Upload expiredUpload : expiredUploads) {
			try {
				boolean deactivated = getDatabase().execute("""
						UPDATE upload
						SET active=FALSE
						WHERE upload_id=?
						AND active=TRUE
						""", expiredUpload.uploadId()) > 0;

				if (deactivated)
					++deactivatedCount;

				getObjectStore().delete(expiredUpload.uploadId().toString());
			} catch (RuntimeException e) {
				getLogger().warn(format("Unable to clean up upload ID %s, continuing with the rest of the batch", expiredUpload.uploadId()), e);
			}
		}

		if (deactivatedCount > 0)
			getLogger().info("Cleanup sweep deactivated {} expired upload[s]", deactivatedCount);

		return deactivatedCount;
	}

	/**
	 * Lock, sweep, unlock. Runs on the calling thread.
	 */
	@Nonnull
	public Integer performCleanup(@Nonnull Boolean requireQuietPeriod) {
		requireNonNull(requireQuietPeriod);

		lockCleanup(requireQuietPeriod);

		try {
			return cleanupWork();
		} finally {
			unlockCleanup();
		}
	}

	/**
	 * Opportunistic sweep, gated by the process-local timer.
	 * <p>
	 * The timer check happens on the calling thread. Lock acquisition and the sweep itself run detached, so the
	 * caller never waits on them; a lost lock race completes the returned future with an empty result.
	 *
	 * @throws CleanupNotRequiredException with {@link Reason#INTERVAL_NOT_ELAPSED} if this process tried too recently
	 */
	@Nonnull
	public CompletableFuture<Optional<Integer>> cleanup() {
		lockTimer();
		return dispatchCleanup(true);
	}

	/**
	 * Startup sweep. Skips the timer and the quiet period to drain any backlog quickly after a deploy.
	 */
	@Nonnull
	public CompletableFuture<Optional<Integer>> cleanupInit() {
		return dispatchCleanup(false);
	}

	@Nonnull
	protected CompletableFuture<Optional<Integer>> dispatchCleanup(@Nonnull Boolean requireQuietPeriod) {
		requireNonNull(requireQuietPeriod);

		if (isShutDown()) {
			getLogger().debug("Skipping cleanup sweep: coordinator is shut down");
			return CompletableFuture.completedFuture(Optional.empty());
		}

		return CompletableFuture.supplyAsync(() -> CurrentContext.empty().build().run(() -> {
			try {
				return Optional.of(performCleanup(requireQuietPeriod));
			} catch (CleanupNotRequiredException e) {
				getLogger().debug("Skipping cleanup sweep: {}", e.getReason().name());
				return Optional.<Integer>empty();
			}
		}), getExecutorService()).whenComplete((deactivatedCount, throwable) -> {
			if (throwable != null)
				getLogger().error("Cleanup sweep failed", throwable instanceof CompletionException && throwable.getCause() != null
						? throwable.getCause() : throwable);
		});
	}

	/**
	 * Stops accepting sweeps and waits briefly for one in flight to finish.
	 * <p>
	 * A sweep that is still running afterwards is interrupted. Its lock goes stale and the next process to start
	 * reclaims it. Sweeps requested after shutdown complete immediately with an empty result.
	 */
	public void shutdown() {
		getExecutorService().shutdown();

		try {
			if (!getExecutorService().awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
				getLogger().warn("Cleanup sweep did not finish in time; interrupting it");
				getExecutorService().shutdownNow();
			}
		} catch (InterruptedException e) {
			getExecutorService().shutdownNow();
			Thread.currentThread().interrupt();
		}
	}

	@Nonnull
	public Boolean isShutDown() {
		return getExecutorService().isShutdown();
	}

	@Nonnull
	private Configuration getConfiguration() {
		return this.configuration;
	}

	@Nonnull
	private Database getDatabase() {
		return this.database;
	}

	@Nonnull
	private ObjectStore getObjectStore() {
		return this.objectStore;
	}

	@Nonnull
	private Clock getClock() {
		return this.clock;
	}

	@Nonnull
	private ExecutorService getExecutorService() {
		return this.executorService;
	}

	@Nonnull
	private Logger getLogger() {
		return this.logger;
	}
}
