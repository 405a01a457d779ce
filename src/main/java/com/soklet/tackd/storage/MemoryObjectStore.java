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


package com.soklet.tackd.storage;

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.requireNonNull;

/**
 * {@link ObjectStore} backed by a process-local map, for local development and tests.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class MemoryObjectStore implements ObjectStore {
	@NonNull
	private final ConcurrentHashMap<@NonNull String, @NonNull StoredObject> storedObjectsById;

	public MemoryObjectStore() {
		this.storedObjectsById = new ConcurrentHashMap<>();
	}

	@NonNull
	@Override
	public String put(@NonNull String id,
										@NonNull byte[] bytes,
										@NonNull String contentType,
										@NonNull Map<@NonNull String, @NonNull String> metadata) {
		requireNonNull(id);
		requireNonNull(bytes);
		requireNonNull(contentType);
		requireNonNull(metadata);

		// Copy so callers can't mutate stored bytes
		getStoredObjectsById().put(id, new StoredObject(bytes.clone(), contentType, Map.copyOf(metadata)));
		return id;
	}

	@NonNull
	@Override
	public Optional<byte[]> get(@NonNull String id) {
		requireNonNull(id);

		StoredObject storedObject = getStoredObjectsById().get(id);
		return storedObject == null ? Optional.empty() : Optional.of(storedObject.bytes().clone());
	}

	@Override
	public void delete(@NonNull String id) {
		requireNonNull(id);
		getStoredObjectsById().remove(id);
	}

	@NonNull
	public Integer size() {
		return getStoredObjectsById().size();
	}

	private record StoredObject(
			@NonNull byte[] bytes,
			@NonNull String contentType,
			@NonNull Map<@NonNull String, @NonNull String> metadata
	) {
		public StoredObject {
			requireNonNull(bytes);
			requireNonNull(contentType);
			requireNonNull(metadata);
		}
	}

	@NonNull
	private ConcurrentHashMap<@NonNull String, @NonNull StoredObject> getStoredObjectsById() {
		return this.storedObjectsById;
	}
}
