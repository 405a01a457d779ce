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


package com.soklet.tackd.util;

import com.soklet.tackd.crypto.SecureTokens;
import com.soklet.tackd.exception.CryptoException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Salted PBKDF2 hashing for account passwords, upload passwords and API key secrets.
 * <p>
 * Hashes are self-describing strings of the form {@code <algorithm>:<iterations>:<key length>:<salt>:<hash>} so
 * that work factors can be raised later without invalidating stored values.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class PasswordManager {
	@NonNull
	private static final Integer DEFAULT_ITERATIONS;
	@NonNull
	private static final Integer DEFAULT_SALT_LENGTH;
	@NonNull
	private static final Integer DEFAULT_KEY_LENGTH;
	@NonNull
	private static final Logger LOGGER;

	static {
		DEFAULT_ITERATIONS = 210_000; // OWASP 2023 recommendation
		DEFAULT_SALT_LENGTH = 64;
		DEFAULT_KEY_LENGTH = 512;
		LOGGER = LoggerFactory.getLogger(PasswordManager.class);
	}

	@NonNull
	private final String hashAlgorithm;
	@NonNull
	private final Integer iterations;
	@NonNull
	private final Integer saltLength;
	@NonNull
	private final Integer keyLength;

	@NonNull
	public static Builder withHashAlgorithm(@NonNull String hashAlgorithm) {
		requireNonNull(hashAlgorithm);
		return new Builder(hashAlgorithm);
	}

	private PasswordManager(@NonNull Builder builder) {
		requireNonNull(builder);

		this.hashAlgorithm = requireNonNull(builder.hashAlgorithm);
		this.iterations = builder.iterations == null ? DEFAULT_ITERATIONS : builder.iterations;
		this.saltLength = builder.saltLength == null ? DEFAULT_SALT_LENGTH : builder.saltLength;
		this.keyLength = builder.keyLength == null ? DEFAULT_KEY_LENGTH : builder.keyLength;
	}

	@NonNull
	public String hashPassword(@NonNull String plaintextPassword) {
		requireNonNull(plaintextPassword);

		byte[] salt = SecureTokens.randomBytes(getSaltLength());
		byte[] hash = deriveKey(getHashAlgorithm(), plaintextPassword, salt, getIterations(), getKeyLength());

		return format("%s:%d:%d:%s:%s", getHashAlgorithm(), getIterations(), getKeyLength(),
				Base64.getEncoder().withoutPadding().encodeToString(salt),
				Base64.getEncoder().withoutPadding().encodeToString(hash));
	}

	/**
	 * Compares in constant time. A missing plaintext or a malformed stored hash is a mismatch, never an exception,
	 * so callers on the download path can fold every failure into "not found".
	 */
	@NonNull
	public Boolean verifyPassword(@Nullable String plaintextPassword,
																@Nullable String hashedPassword) {
		if (plaintextPassword == null || hashedPassword == null)
			return false;

		String[] components = hashedPassword.split(":");

		if (components.length != 5) {
			LOGGER.warn("Stored password hash has {} components, expected 5", components.length);
			return false;
		}

		try {
			String hashAlgorithm = components[0];
			int iterations = Integer.parseInt(components[1]);
			int keyLength = Integer.parseInt(components[2]);
			byte[] salt = Base64.getDecoder().decode(components[3]);
			byte[] expectedHash = Base64.getDecoder().decode(components[4]);

			return MessageDigest.isEqual(expectedHash, deriveKey(hashAlgorithm, plaintextPassword, salt, iterations, keyLength));
		} catch (IllegalArgumentException | CryptoException e) {
			LOGGER.warn("Stored password hash is malformed", e);
			return false;
		}
	}

	@NonNull
	private static byte[] deriveKey(@NonNull String hashAlgorithm,
																	@NonNull String plaintextPassword,
																	@NonNull byte[] salt,
																	int iterations,
																	int keyLength) {
		requireNonNull(hashAlgorithm);
		requireNonNull(plaintextPassword);
		requireNonNull(salt);

		PBEKeySpec keySpec = new PBEKeySpec(plaintextPassword.toCharArray(), salt, iterations, keyLength);

		try {
			return SecretKeyFactory.getInstance(hashAlgorithm).generateSecret(keySpec).getEncoded();
		} catch (GeneralSecurityException e) {
			throw new CryptoException(format("Unable to derive key with %s", hashAlgorithm), e);
		} finally {
			keySpec.clearPassword();
		}
	}

	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final String hashAlgorithm;
		@Nullable
		private Integer iterations;
		@Nullable
		private Integer saltLength;
		@Nullable
		private Integer keyLength;

		private Builder(@NonNull String hashAlgorithm) {
			requireNonNull(hashAlgorithm);
			this.hashAlgorithm = hashAlgorithm;
		}

		@NonNull
		public Builder iterations(@Nullable Integer iterations) {
			this.iterations = iterations;
			return this;
		}

		@NonNull
		public Builder saltLength(@Nullable Integer saltLength) {
			this.saltLength = saltLength;
			return this;
		}

		@NonNull
		public Builder keyLength(@Nullable Integer keyLength) {
			this.keyLength = keyLength;
			return this;
		}

		@NonNull
		public PasswordManager build() {
			return new PasswordManager(this);
		}
	}

	@NonNull
	public String getHashAlgorithm() {
		return this.hashAlgorithm;
	}

	@NonNull
	public Integer getIterations() {
		return this.iterations;
	}

	@NonNull
	public Integer getSaltLength() {
		return this.saltLength;
	}

	@NonNull
	public Integer getKeyLength() {
		return this.keyLength;
	}
}
