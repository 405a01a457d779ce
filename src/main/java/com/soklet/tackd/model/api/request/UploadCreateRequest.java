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


package com.soklet.tackd.model.api.request;

import com.soklet.tackd.annotation.SensitiveValue;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.UUID;

import static java.lang.String.format;

/**
 * Everything a caller supplies when storing a payload.
 * <p>
 * {@code tags} is the raw comma-separated query parameter value; {@code reads} of zero or less means unlimited.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record UploadCreateRequest(
		@Nullable byte[] payload,
		@Nullable String contentType,
		@Nullable String filename,
		@Nullable String tags,
		@Nullable Integer reads,
		@Nullable String expires,
		@Nullable @SensitiveValue String password,
		@Nullable String userAgent,
		@Nullable String forwardedFor,
		@Nullable UUID ownerAccountId
) {
	@NonNull
	public UploadCreateRequest withOwnerAccountId(@Nullable UUID ownerAccountId) {
		return new UploadCreateRequest(payload, contentType, filename, tags, reads, expires, password, userAgent, forwardedFor, ownerAccountId);
	}

	@Override
	public String toString() {
		return format("%s{bytes=%s, contentType=%s, filename=%s, tags=%s, reads=%s, expires=%s, password=%s, ownerAccountId=%s}",
				UploadCreateRequest.class.getSimpleName(), payload() == null ? null : payload().length, contentType(), filename(), tags(),
				reads(), expires(), password() == null ? null : "[REDACTED]", ownerAccountId());
	}
}
