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

import com.soklet.tackd.exception.CryptoException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Versioned master keys used to wrap per-upload data keys.
 * <p>
 * Wrapping always uses {@link #latest()}. Unwrapping looks up the version recorded when the upload was written, so
 * adding a version never re-wraps existing uploads and removing one strands every upload wrapped under it.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class KeyRegistry {
	@NonNull
	private final SortedMap<@NonNull Integer, @NonNull SecretKey> keysByVersion;

	public KeyRegistry(@NonNull List<@NonNull RegistryKey> registryKeys) {
		requireNonNull(registryKeys);

		if (registryKeys.isEmpty())
			throw new CryptoException("At least one encryption key is required");

		SortedMap<Integer, SecretKey> keysByVersion = new TreeMap<>();

		for (RegistryKey registryKey : registryKeys) {
			byte[] keyBytes = registryKey.key().getBytes(StandardCharsets.UTF_8);

			if (keyBytes.length != EncryptionEngine.KEY_LENGTH_IN_BYTES)
				throw new CryptoException(format("Encryption key version %d must be exactly %d bytes, but was %d",
						registryKey.version(), EncryptionEngine.KEY_LENGTH_IN_BYTES, keyBytes.length));

			if (keysByVersion.put(registryKey.version(), new SecretKeySpec(keyBytes, "AES")) != null)
				throw new CryptoException(format("Encryption key version %d is declared more than once", registryKey.version()));
		}

		this.keysByVersion = Collections.unmodifiableSortedMap(keysByVersion);
	}

	@NonNull
	public VersionedKey latest() {
		Integer version = getKeysByVersion().lastKey();
		return new VersionedKey(version, getKeysByVersion().get(version));
	}

	@NonNull
	public Optional<VersionedKey> forVersion(@Nullable Integer version) {
		if (version == null)
			return Optional.empty();

		SecretKey secretKey = getKeysByVersion().get(version);
		return secretKey == null ? Optional.empty() : Optional.of(new VersionedKey(version, secretKey));
	}

	@NonNull
	private SortedMap<@NonNull Integer, @NonNull SecretKey> getKeysByVersion() {
		return this.keysByVersion;
	}

	/**
	 * A registry entry as supplied by configuration.
	 */
	public record RegistryKey(
			@NonNull Integer version,
			@NonNull String key
	) {
		public RegistryKey {
			requireNonNull(version);
			requireNonNull(key);
		}

		@Override
		public String toString() {
			return format("%s{version=%d, key=[REDACTED]}", RegistryKey.class.getSimpleName(), version());
		}
	}

	public record VersionedKey(
			@NonNull Integer version,
			@NonNull SecretKey secretKey
	) {
		public VersionedKey {
			requireNonNull(version);
			requireNonNull(secretKey);
		}
	}
}
