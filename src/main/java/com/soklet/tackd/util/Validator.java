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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.regex.Pattern;

/**
 * Utilities for validating user-supplied input.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Validator {
	private static final int EMAIL_ADDRESS_MAX_LENGTH;
	private static final int EMAIL_ADDRESS_MAX_LOCAL_PART_LENGTH;
	private static final int EMAIL_ADDRESS_MAX_DOMAIN_LENGTH;
	private static final int PASSWORD_MIN_LENGTH;
	private static final int PASSWORD_MAX_LENGTH;
	private static final int STORED_TAGS_MAX_LENGTH;
	@NonNull
	private static final Pattern EMAIL_ADDRESS_LOCAL_PART_PATTERN;
	@NonNull
	private static final Pattern EMAIL_ADDRESS_DOMAIN_LABEL_PATTERN;
	@NonNull
	private static final Pattern ALPHANUMERIC_PATTERN;

	static {
		EMAIL_ADDRESS_MAX_LENGTH = 320;
		EMAIL_ADDRESS_MAX_LOCAL_PART_LENGTH = 64;
		EMAIL_ADDRESS_MAX_DOMAIN_LENGTH = 255;
		PASSWORD_MIN_LENGTH = 8;
		PASSWORD_MAX_LENGTH = 256;
		STORED_TAGS_MAX_LENGTH = 4096;
		EMAIL_ADDRESS_LOCAL_PART_PATTERN = Pattern.compile("^[A-Za-z0-9!#$%&'*+/=?^_`{|}~-]+(\\.[A-Za-z0-9!#$%&'*+/=?^_`{|}~-]+)*$");
		EMAIL_ADDRESS_DOMAIN_LABEL_PATTERN = Pattern.compile("^[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?$");
		ALPHANUMERIC_PATTERN = Pattern.compile("^[A-Za-z0-9]+$");
	}

	@NonNull
	public static Boolean isValidEmailAddress(@Nullable String emailAddress) {
		String trimmed = Normalizer.trimAggressivelyToNull(emailAddress);

		if (trimmed == null || trimmed.length() > EMAIL_ADDRESS_MAX_LENGTH)
			return false;

		if (trimmed.chars().anyMatch(Character::isWhitespace))
			return false;

		int atIndex = trimmed.indexOf('@');

		if (atIndex <= 0 || atIndex != trimmed.lastIndexOf('@') || atIndex == trimmed.length() - 1)
			return false;

		String localPart = trimmed.substring(0, atIndex);
		String domain = trimmed.substring(atIndex + 1);

		if (localPart.length() > EMAIL_ADDRESS_MAX_LOCAL_PART_LENGTH || domain.length() > EMAIL_ADDRESS_MAX_DOMAIN_LENGTH)
			return false;

		if (!EMAIL_ADDRESS_LOCAL_PART_PATTERN.matcher(localPart).matches())
			return false;

		String[] labels = domain.split("\\.", -1);

		if (labels.length < 2)
			return false;

		for (String label : labels)
			if (!EMAIL_ADDRESS_DOMAIN_LABEL_PATTERN.matcher(label).matches())
				return false;

		return labels[labels.length - 1].length() >= 2;
	}

	@NonNull
	public static Boolean isAcceptablePassword(@Nullable String password) {
		if (password == null)
			return false;

		return password.length() >= PASSWORD_MIN_LENGTH
				&& password.length() <= PASSWORD_MAX_LENGTH
				&& Normalizer.trimAggressivelyToNull(password) != null;
	}

	// Unlock keys, data keys and API keys are all minted as fixed-length alphanumeric strings
	@NonNull
	public static Boolean isWellFormedToken(@Nullable String token,
																					int expectedLength) {
		return token != null
				&& token.length() == expectedLength
				&& ALPHANUMERIC_PATTERN.matcher(token).matches();
	}

	// Tags are stored as a JSON array in a bounded column; escaping can make the JSON much longer than the raw tags
	@NonNull
	public static Boolean isStorableTags(@Nullable String tagsJson) {
		return tagsJson == null || tagsJson.length() <= STORED_TAGS_MAX_LENGTH;
	}

	private Validator() {
		// Non-instantiable
	}
}
