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

package com.soklet.tackd.exception;

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.NotThreadSafe;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Signals that a cleanup attempt was skipped.
 * <p>
 * This is control flow, not a failure: callers absorb it without logging above {@code DEBUG}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class CleanupNotRequiredException extends RuntimeException {
	@NonNull
	private final Reason reason;

	public CleanupNotRequiredException(@NonNull Reason reason) {
		super(format("Cleanup not required (%s)", requireNonNull(reason).name()));
		this.reason = reason;
	}

	@NonNull
	public Reason getReason() {
		return this.reason;
	}

	public enum Reason {
		// This process attempted a cleanup too recently
		INTERVAL_NOT_ELAPSED,
		// Another process holds the control record, or released it too recently
		LOCK_NOT_ACQUIRED
	}
}
