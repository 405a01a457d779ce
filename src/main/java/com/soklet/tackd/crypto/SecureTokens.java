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

import javax.annotation.concurrent.ThreadSafe;
import java.security.SecureRandom;

/**
 * Random, unguessable strings for data keys, link unlock keys and API keys.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class SecureTokens {
	@NonNull
	private static final char[] ALPHANUMERIC_CHARACTERS;
	@NonNull
	private static final SecureRandom SECURE_RANDOM;

	static {
		ALPHANUMERIC_CHARACTERS = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789".toCharArray();
		SECURE_RANDOM = new SecureRandom();
	}

	@NonNull
	public static String alphanumeric(int length) {
		if (length < 1)
			throw new IllegalArgumentException("Length must be positive");

		char[] characters = new char[length];

		for (int i = 0; i < length; ++i)
			characters[i] = ALPHANUMERIC_CHARACTERS[SECURE_RANDOM.nextInt(ALPHANUMERIC_CHARACTERS.length)];

		return new String(characters);
	}

	@NonNull
	public static byte[] randomBytes(int length) {
		byte[] bytes = new byte[length];
		SECURE_RANDOM.nextBytes(bytes);
		return bytes;
	}

	private SecureTokens() {
		// Non-instantiable
	}
}
