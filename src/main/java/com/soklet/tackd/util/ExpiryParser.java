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
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the {@code expires} upload parameter.
 * <p>
 * Accepts a bare number of seconds ({@code 3600}) or a number with a unit suffix: {@code s}, {@code m}, {@code h},
 * {@code d}, {@code w} or {@code y} (365 days). Fractions, negative values and zero are rejected: the shortest
 * expiry is one second.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ExpiryParser {
	@NonNull
	private static final Pattern EXPIRY_PATTERN;
	@NonNull
	private static final Map<@NonNull String, @NonNull Duration> UNITS;

	static {
		EXPIRY_PATTERN = Pattern.compile("^(\\d{1,18})\\s*(s|m|h|d|w|y)?$");
		UNITS = Map.of(
				"s", Duration.ofSeconds(1),
				"m", Duration.ofMinutes(1),
				"h", Duration.ofHours(1),
				"d", Duration.ofDays(1),
				"w", Duration.ofDays(7),
				"y", Duration.ofDays(365)
		);
	}

	@NonNull
	public static Optional<Duration> parseExpiry(@Nullable String expires) {
		expires = Normalizer.trimAggressivelyToNull(expires);

		if (expires == null)
			return Optional.empty();

		Matcher matcher = EXPIRY_PATTERN.matcher(expires.toLowerCase(Locale.ROOT));

		if (!matcher.matches())
			return Optional.empty();

		long amount = Long.parseLong(matcher.group(1));

		if (amount == 0)
			return Optional.empty();

		String unit = matcher.group(2) == null ? "s" : matcher.group(2);

		try {
			return Optional.of(UNITS.get(unit).multipliedBy(amount));
		} catch (ArithmeticException e) {
			// Too large to represent; the caller clamps anyway
			return Optional.of(Duration.ofSeconds(Long.MAX_VALUE));
		}
	}

	private ExpiryParser() {
		// Non-instantiable
	}
}
