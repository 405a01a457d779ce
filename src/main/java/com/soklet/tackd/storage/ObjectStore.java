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

import java.util.Map;
import java.util.Optional;

/**
 * Contract for storing upload blobs (ciphertext, or plaintext when encryption is disabled).
 * <p>
 * Exactly one implementation is selected at startup via {@link Type}; there is no runtime switching.
 * Implementations must tolerate concurrent access from many in-flight requests.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface ObjectStore {
	/**
	 * Writes a blob, replacing any existing blob with the same id. Readers see either the previous blob or the
	 * complete new one, never a partial write. How long the blob survives a crash is up to the implementation.
	 *
	 * @return the id the blob was stored under
	 */
	@NonNull
	String put(@NonNull String id,
						 @NonNull byte[] bytes,
						 @NonNull String contentType,
						 @NonNull Map<@NonNull String, @NonNull String> metadata);

	@NonNull
	Optional<byte[]> get(@NonNull String id);

	/**
	 * Deleting a blob that does not exist is a no-op.
	 */
	void delete(@NonNull String id);

	enum Type {
		MEMORY,
		FILESYSTEM
	}
}
