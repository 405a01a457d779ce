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

import ch.qos.logback.classic.pattern.MessageConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.regex.Pattern;

/**
 * Logback converter that redacts capability material from log messages.
 * <p>
 * Download URLs carry unlock keys, data keys and passwords as query parameters, and Basic credentials
 * can surface in logged headers. Anything that looks like {@code key=...}, {@code pwd=...},
 * {@code password=...} or {@code Basic ...} has its value replaced.
 * <p>
 * Usage in logback.xml:
 * <pre>{@code
 * <conversionRule conversionWord="msg" converterClass="com.soklet.tackd.util.LoggingRedactor"/>
 * }</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class LoggingRedactor extends MessageConverter {
	@NonNull
	private static final Pattern SECRET_QUERY_PARAMETER_PATTERN;
	@NonNull
	private static final Pattern BASIC_CREDENTIALS_PATTERN;

	static {
		// Group 1 keeps the parameter name and separator so the log still shows that a value was supplied
		SECRET_QUERY_PARAMETER_PATTERN = Pattern.compile("(?i)(\\b(?:key|pwd|password)=)[^&\\s,}\\]\"]+");
		BASIC_CREDENTIALS_PATTERN = Pattern.compile("(?i)(\\bBasic\\s+)[A-Za-z0-9+/=]+");
	}

	@Override
	public String convert(ILoggingEvent event) {
		return redact(super.convert(event));
	}

	@Nullable
	public static String redact(@Nullable String message) {
		if (message == null)
			return null;

		String redacted = SECRET_QUERY_PARAMETER_PATTERN.matcher(message).replaceAll("$1[REDACTED]");
		return BASIC_CREDENTIALS_PATTERN.matcher(redacted).replaceAll("$1[REDACTED]");
	}
}
