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

import com.soklet.tackd.model.db.Role.RoleId;
import org.jspecify.annotations.NonNull;

import java.time.Instant;
import java.util.UUID;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Maps to the {@code account} table in the database.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record Account(
		@NonNull UUID accountId,
		@NonNull RoleId roleId,
		@NonNull String emailAddress,
		@NonNull String passwordHash,
		@NonNull Instant createdAt
) {
	public Account {
		requireNonNull(accountId);
		requireNonNull(roleId);
		requireNonNull(emailAddress);
		requireNonNull(passwordHash);
		requireNonNull(createdAt);
	}

	// Keep the password hash out of logs
	@Override
	public String toString() {
		return format("%s{accountId=%s, roleId=%s}", Account.class.getSimpleName(), accountId(), roleId().name());
	}
}
