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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Utilities for normalizing user-supplied input: email addresses, upload filenames and tag lists.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Normalizer {
	@Nonnull
	private static final Pattern HEAD_WHITESPACE_PATTERN;
	@Nonnull
	private static final Pattern TAIL_WHITESPACE_PATTERN;
	@Nonnull
	private static final Pattern UNSAFE_FILENAME_CHARACTERS_PATTERN;
	private static final int MAXIMUM_FILENAME_LENGTH;
	private static final int MAXIMUM_TAG_COUNT;
	private static final int MAXIMUM_TAG_LENGTH;

	static {
		HEAD_WHITESPACE_PATTERN = Pattern.compile("^(\\p{Z}|\\s)+");
		TAIL_WHITESPACE_PATTERN = Pattern.compile("(\\p{Z}|\\s)+$");
		UNSAFE_FILENAME_CHARACTERS_PATTERN = Pattern.compile("[^A-Za-z0-9._-]+");
		MAXIMUM_FILENAME_LENGTH = 255;
		MAXIMUM_TAG_COUNT = 32;
		MAXIMUM_TAG_LENGTH = 64;
	}

	@Nonnull
	public static Optional<String> normalizeEmailAddress(@Nullable String emailAddress) {
		emailAddress = trimAggressivelyToNull(emailAddress);

		if (!Validator.isValidEmailAddress(emailAddress))
			return Optional.empty();

		return Optional.of(emailAddress.toLowerCase(Locale.ROOT));
	}

	/**
	 * Reduces a caller-supplied filename to a single URL-safe path segment.
	 * <p>
	 * Directory components are discarded and runs of unsafe characters collapse to {@code _}.
	 */
	@Nonnull
	public static Optional<String> normalizeFilename(@Nullable String filename) {
		filename = trimAggressivelyToNull(filename);

		if (filename == null)
			return Optional.empty();

		int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));

		if (lastSeparatorIndex >= 0)
			filename = filename.substring(lastSeparatorIndex + 1);

		filename = UNSAFE_FILENAME_CHARACTERS_PATTERN.matcher(filename).replaceAll("_");

		// "." and ".." are not filenames
		if (filename.isEmpty() || filename.chars().allMatch(c -> c == '.'))
			return Optional.empty();

		if (filename.length() > MAXIMUM_FILENAME_LENGTH)
			filename = filename.substring(filename.length() - MAXIMUM_FILENAME_LENGTH);

		return Optional.of(filename);
	}

	// Splits a comma-separated tag list, dropping blanks and duplicates but preserving order. Long tags are cut short
	@Nonnull
	public static List<String> normalizeTags(@Nullable String tags) {
		tags = trimAggressivelyToNull(tags);

		if (tags == null)
			return List.of();

		Set<String> normalizedTags = new LinkedHashSet<>();

		for (String tag : tags.split(",")) {
			String normalizedTag = trimAggressivelyToNull(truncate(trimAggressivelyToNull(tag), MAXIMUM_TAG_LENGTH));

			if (normalizedTag != null && normalizedTags.size() < MAXIMUM_TAG_COUNT)
				normalizedTags.add(normalizedTag);
		}

		return List.copyOf(new ArrayList<>(normalizedTags));
	}

	/**
	 * Cuts a value down to at most {@code maximumLength} characters without splitting a surrogate pair.
	 */
	@Nullable
	public static String truncate(@Nullable String string,
																int maximumLength) {
		if (maximumLength < 0)
			throw new IllegalArgumentException("Maximum length cannot be negative");

		if (string == null || string.length() <= maximumLength)
			return string;

		int endIndex = maximumLength;

		if (endIndex > 0 && Character.isHighSurrogate(string.charAt(endIndex - 1)))
			--endIndex;

		return string.substring(0, endIndex);
	}

	/**
	 * A "stronger" version of {@link String#trim()} which discards any kind of whitespace or invisible separator.
	 */
	@Nonnull
	public static Optional<String> trimAggressively(@Nullable String string) {
		if (string == null)
			return Optional.empty();

		string = HEAD_WHITESPACE_PATTERN.matcher(string).replaceAll("");

		if (string.length() == 0)
			return Optional.of(string);

		string = TAIL_WHITESPACE_PATTERN.matcher(string).replaceAll("");

		return Optional.of(string);
	}

	@Nullable
	public static String trimAggressivelyToNull(@Nullable String string) {
		String trimmed = trimAggressively(string).orElse(null);
		return trimmed == null || trimmed.length() == 0 ? null : trimmed;
	}

	private Normalizer() {
		// Non-instantiable
	}
}
