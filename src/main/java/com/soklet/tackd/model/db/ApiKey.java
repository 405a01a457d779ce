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
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.UUID;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Maps to the {@code api_key} table in the database.
 * <p>
 * {@code tags} holds a JSON array.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record ApiKey(
		@NonNull String apiKey,
		@NonNull UUID accountId,
		@NonNull String secretHash,
		@Nullable String tags,
		@NonNull Instant createdAt
) {
	public ApiKey {
		requireNonNull(apiKey);
		requireNonNull(accountId);
		requireNonNull(secretHash);
		requireNonNull(createdAt);
	}

	@Override
	public String toString() {
		return format("%s{apiKey=%s, accountId=%s}", ApiKey.class.getSimpleName(), apiKey(), accountId());
	}
}
