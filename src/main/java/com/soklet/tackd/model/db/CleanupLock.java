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


package com.soklet.tackd.model.db;

import org.jspecify.annotations.NonNull;

import java.time.Instant;

import static java.util.Objects.requireNonNull;

/**
 * Maps to the {@code cleanup_lock} table in the database: the single control record shared by every server instance.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record CleanupLock(
		@NonNull String cleanupLockId,
		@NonNull Boolean active,
		@NonNull Instant modifiedAt
) {
	public CleanupLock {
		requireNonNull(cleanupLockId);
		requireNonNull(active);
		requireNonNull(modifiedAt);
	}
}
