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

import java.util.EnumSet;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Maps to the {@code role} table in the database.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record Role(
		@NonNull RoleId roleId,
		@NonNull String description,
		@NonNull Boolean canCreate,
		@NonNull Boolean canList,
		@NonNull Boolean canDelete
) {
	public enum RoleId {
		ANONYMOUS,
		USER
	}

	public enum Permission {
		CREATE,
		LIST,
		DELETE
	}

	public Role {
		requireNonNull(roleId);
		requireNonNull(description);
		requireNonNull(canCreate);
		requireNonNull(canList);
		requireNonNull(canDelete);
	}

	@NonNull
	public Set<@NonNull Permission> permissions() {
		Set<Permission> permissions = EnumSet.noneOf(Permission.class);

		if (canCreate())
			permissions.add(Permission.CREATE);
		if (canList())
			permissions.add(Permission.LIST);
		if (canDelete())
			permissions.add(Permission.DELETE);

		return permissions;
	}
}
