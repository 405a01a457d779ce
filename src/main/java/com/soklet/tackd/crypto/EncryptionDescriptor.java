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

package com.soklet.tackd.crypto;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * How an upload's stored bytes were produced, and what the server kept in order to reverse it.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record EncryptionDescriptor(
		@NonNull Mode mode,
		@Nullable String wrappedKey,
		@Nullable Integer wrappedKeyVersion
) {
	public EncryptionDescriptor {
		requireNonNull(mode);

		if (mode == Mode.MANAGED && (wrappedKey == null || wrappedKeyVersion == null))
			throw new IllegalArgumentException("Managed encryption requires a wrapped key and its version");

		if (mode != Mode.MANAGED && (wrappedKey != null || wrappedKeyVersion != null))
			throw new IllegalArgumentException("Only managed encryption persists a wrapped key");
	}

	@NonNull
	public Boolean isManaged() {
		return mode() == Mode.MANAGED;
	}

	public enum Mode {
		// Stored as plaintext, no key material at all
		NONE,
		// Stored as ciphertext; the data key goes back to the uploader and is never persisted
		UNMANAGED,
		// Stored as ciphertext; the data key is wrapped under the key registry and persisted
		MANAGED
	}
}
