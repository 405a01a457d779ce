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

import com.google.inject.Inject;
import com.soklet.tackd.crypto.EncryptionDescriptor.Mode;
import com.soklet.tackd.crypto.KeyRegistry.VersionedKey;
import com.soklet.tackd.exception.CryptoException;
import com.soklet.tackd.util.ContentTypeDetector;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Seals and opens payloads with AES-256-GCM and manages envelope wrapping of per-upload data keys.
 * <p>
 * Sealed bytes are laid out as {@code nonce || ciphertext || tag}. Data keys are 32 random alphanumeric characters whose
 * UTF-8 bytes form the AES key, so an unmanaged upload's key can travel in a URL unescaped.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class EncryptionEngine {
	public static final int KEY_LENGTH_IN_BYTES;
	private static final int NONCE_LENGTH_IN_BYTES;
	private static final int TAG_LENGTH_IN_BITS;
	@NonNull
	private static final String CIPHER_TRANSFORMATION;

	static {
		KEY_LENGTH_IN_BYTES = 32;
		NONCE_LENGTH_IN_BYTES = 12;
		TAG_LENGTH_IN_BITS = 128;
		CIPHER_TRANSFORMATION = "AES/GCM/NoPadding";
	}

	@NonNull
	private final KeyRegistry keyRegistry;
	@NonNull
	private final ContentTypeDetector contentTypeDetector;

	@Inject
	public EncryptionEngine(@NonNull KeyRegistry keyRegistry,
													@NonNull ContentTypeDetector contentTypeDetector) {
		requireNonNull(keyRegistry);
		requireNonNull(contentTypeDetector);

		this.keyRegistry = keyRegistry;
		this.contentTypeDetector = contentTypeDetector;
	}

	@NonNull
	public byte[] seal(@NonNull SecretKey key,
										 @NonNull byte[] plaintext) {
		requireNonNull(key);
		requireNonNull(plaintext);

		byte[] nonce = SecureTokens.randomBytes(NONCE_LENGTH_IN_BYTES);

		try {
			Cipher cipher = Cipher.getInstance(CIPHER_TRANSFORMATION);
			cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_IN_BITS, nonce));
			byte[] ciphertext = cipher.doFinal(plaintext);

			return ByteBuffer.allocate(nonce.length + ciphertext.length)
					.put(nonce)
					.put(ciphertext)
					.array();
		} catch (GeneralSecurityException e) {
			throw new CryptoException("Unable to seal payload", e);
		}
	}

	/**
	 * Wrong keys, truncated input and tampering all surface as the same {@link CryptoException}.
	 */
	@NonNull
	public byte[] open(@NonNull SecretKey key,
										 @NonNull byte[] sealed) {
		requireNonNull(key);
		requireNonNull(sealed);

		if (sealed.length < NONCE_LENGTH_IN_BYTES + TAG_LENGTH_IN_BITS / 8)
			throw new CryptoException("Sealed payload is too short");

		try {
			Cipher cipher = Cipher.getInstance(CIPHER_TRANSFORMATION);
			cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_IN_BITS, sealed, 0, NONCE_LENGTH_IN_BYTES));
			return cipher.doFinal(sealed, NONCE_LENGTH_IN_BYTES, sealed.length - NONCE_LENGTH_IN_BYTES);
		} catch (GeneralSecurityException e) {
			throw new CryptoException("Unable to open payload", e);
		}
	}

	@NonNull
	public SealedPayload create(@NonNull byte[] payload,
															@Nullable String declaredContentType,
															@Nullable String explicitKey,
															@NonNull Boolean encryptKey,
															@NonNull Boolean encryptData) {
		requireNonNull(payload);
		requireNonNull(encryptKey);
		requireNonNull(encryptData);

		String contentType = getContentTypeDetector().detectContentType(payload, declaredContentType);

		if (!encryptData)
			return new SealedPayload(payload, contentType, null, new EncryptionDescriptor(Mode.NONE, null, null));

		String dataKey = explicitKey == null ? generateDataKey() : explicitKey;
		byte[] storedBytes = seal(toSecretKey(dataKey), payload);

		if (!encryptKey)
			return new SealedPayload(storedBytes, contentType, dataKey, new EncryptionDescriptor(Mode.UNMANAGED, null, null));

		VersionedKey latestKey = getKeyRegistry().latest();
		byte[] wrappedKey = seal(latestKey.secretKey(), dataKey.getBytes(StandardCharsets.UTF_8));

		return new SealedPayload(storedBytes, contentType, dataKey, new EncryptionDescriptor(Mode.MANAGED,
				Base64.getEncoder().encodeToString(wrappedKey), latestKey.version()));
	}

	/**
	 * Reverses {@link #create(byte[], String, String, Boolean, Boolean)}.
	 * <p>
	 * Unmanaged uploads need the caller's data key; managed uploads unwrap their own under the recorded key version.
	 */
	@NonNull
	public byte[] decrypt(@NonNull byte[] storedBytes,
												@NonNull EncryptionDescriptor encryptionDescriptor,
												@Nullable String clientKey) {
		requireNonNull(storedBytes);
		requireNonNull(encryptionDescriptor);

		switch (encryptionDescriptor.mode()) {
			case NONE:
				return storedBytes;
			case UNMANAGED:
				if (clientKey == null)
					throw new CryptoException("A data key is required to open an unmanaged upload");

				return open(toSecretKey(clientKey), storedBytes);
			case MANAGED:
				return open(toSecretKey(unwrapDataKey(encryptionDescriptor)), storedBytes);
			default:
				throw new IllegalStateException(format("Unexpected encryption mode %s", encryptionDescriptor.mode().name()));
		}
	}

	@NonNull
	public String unwrapDataKey(@NonNull EncryptionDescriptor encryptionDescriptor) {
		requireNonNull(encryptionDescriptor);

		if (!encryptionDescriptor.isManaged())
			throw new CryptoException("Only managed uploads carry a wrapped key");

		Integer version = encryptionDescriptor.wrappedKeyVersion();
		VersionedKey versionedKey = getKeyRegistry().forVersion(version)
				.orElseThrow(() -> new CryptoException(format("Encryption key version %d is no longer in the registry", version)));

		byte[] wrappedKey;

		try {
			wrappedKey = Base64.getDecoder().decode(encryptionDescriptor.wrappedKey());
		} catch (IllegalArgumentException e) {
			throw new CryptoException("Wrapped key is not valid Base64", e);
		}

		return new String(open(versionedKey.secretKey(), wrappedKey), StandardCharsets.UTF_8);
	}

	@NonNull
	public String generateDataKey() {
		return SecureTokens.alphanumeric(KEY_LENGTH_IN_BYTES);
	}

	@NonNull
	public SecretKey toSecretKey(@NonNull String dataKey) {
		requireNonNull(dataKey);

		byte[] keyBytes = dataKey.getBytes(StandardCharsets.UTF_8);

		if (keyBytes.length != KEY_LENGTH_IN_BYTES)
			throw new CryptoException(format("Data keys must be %d bytes", KEY_LENGTH_IN_BYTES));

		return new SecretKeySpec(keyBytes, "AES");
	}

	/**
	 * Output of {@link #create(byte[], String, String, Boolean, Boolean)}.
	 * <p>
	 * {@code dataKey} is only present when data was encrypted; it must never be persisted for unmanaged uploads.
	 */
	public record SealedPayload(
			@NonNull byte[] storedBytes,
			@NonNull String contentType,
			@Nullable String dataKey,
			@NonNull EncryptionDescriptor encryptionDescriptor
	) {
		public SealedPayload {
			requireNonNull(storedBytes);
			requireNonNull(contentType);
			requireNonNull(encryptionDescriptor);
		}

		@Override
		public String toString() {
			return format("%s{contentType=%s, bytes=%d, mode=%s}", SealedPayload.class.getSimpleName(), contentType(),
					storedBytes().length, encryptionDescriptor().mode().name());
		}
	}

	@NonNull
	private KeyRegistry getKeyRegistry() {
		return this.keyRegistry;
	}

	@NonNull
	private ContentTypeDetector getContentTypeDetector() {
		return this.contentTypeDetector;
	}
}
