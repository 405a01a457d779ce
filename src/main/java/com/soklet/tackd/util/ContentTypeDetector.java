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

import org.apache.tika.Tika;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Set;

import static com.soklet.tackd.util.Normalizer.trimAggressivelyToNull;
import static java.util.Objects.requireNonNull;

/**
 * Sniffs the MIME type of uploaded content, falling back to what the uploader declared.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ContentTypeDetector {
	@NonNull
	public static final String UNKNOWN_CONTENT_TYPE;
	@NonNull
	private static final Set<@NonNull String> GENERIC_CONTENT_TYPES;
	private static final int MAXIMUM_CONTENT_TYPE_LENGTH;

	static {
		UNKNOWN_CONTENT_TYPE = "none";
		// Tika's answers when magic bytes tell it nothing useful
		GENERIC_CONTENT_TYPES = Set.of("application/octet-stream", "text/plain");
		MAXIMUM_CONTENT_TYPE_LENGTH = 255;
	}

	@NonNull
	private final Tika tika;
	@NonNull
	private final Logger logger;

	public ContentTypeDetector() {
		this.tika = new Tika();
		this.logger = LoggerFactory.getLogger(getClass());
	}

	@NonNull
	public String detectContentType(@NonNull byte[] content,
																	@Nullable String declaredContentType) {
		requireNonNull(content);

		declaredContentType = trimAggressivelyToNull(declaredContentType);

		// A cut-off MIME type is meaningless, so an oversized declaration counts as no declaration
		if (declaredContentType != null && declaredContentType.length() > MAXIMUM_CONTENT_TYPE_LENGTH) {
			getLogger().debug("Ignoring declared content type of {} characters", declaredContentType.length());
			declaredContentType = null;
		}

		String sniffedContentType = null;

		try {
			sniffedContentType = content.length == 0 ? null : getTika().detect(content);
		} catch (RuntimeException e) {
			getLogger().debug("Unable to sniff content type", e);
		}

		if (sniffedContentType != null && !GENERIC_CONTENT_TYPES.contains(sniffedContentType))
			return sniffedContentType;

		if (declaredContentType != null)
			return declaredContentType;

		return sniffedContentType == null ? UNKNOWN_CONTENT_TYPE : sniffedContentType;
	}

	@NonNull
	private Tika getTika() {
		return this.tika;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
