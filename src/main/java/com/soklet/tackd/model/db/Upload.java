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


package com.soklet.tackd.model.db;

import com.soklet.tackd.crypto.EncryptionDescriptor;
import com.soklet.tackd.crypto.EncryptionDescriptor.Mode;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.UUID;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Maps to the {@code upload} table in the database.
 * <p>
 * A {@code maxReads} of zero or less means reads are unlimited until {@code expiresAt}.
 * Once {@code active} is false the upload is terminal.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record Upload(
		@NonNull UUID uploadId,
		@NonNull Boolean active,
		@NonNull String contentType,
		@NonNull Long byteLength,
		@Nullable String filename,
		@Nullable String tags,
		@Nullable String userAgent,
		@Nullable String forwardedFor,
		@NonNull Integer maxReads,
		@NonNull Long maxSeconds,
		@NonNull Instant expiresAt,
		@Nullable String expiresParameter,
		@NonNull Integer readCount,
		@Nullable UUID ownerAccountId,
		@Nullable String passwordHash,
		@NonNull Mode encryptionMode,
		@Nullable String wrappedKey,
		@Nullable Integer wrappedKeyVersion,
		@NonNull Boolean ignoreLinkKey,
		@NonNull Instant createdAt
) {
	public Upload {
		requireNonNull(uploadId);
		requireNonNull(active);
		requireNonNull(contentType);
		requireNonNull(byteLength);
		requireNonNull(maxReads);
		requireNonNull(maxSeconds);
		requireNonNull(expiresAt);
		requireNonNull(readCount);
		requireNonNull(encryptionMode);
		requireNonNull(ignoreLinkKey);
		requireNonNull(createdAt);
	}

	@NonNull
	public EncryptionDescriptor encryptionDescriptor() {
		return new EncryptionDescriptor(encryptionMode(), wrappedKey(), wrappedKeyVersion());
	}

	@NonNull
	public Boolean hasReadLimit() {
		return maxReads() > 0;
	}

	@Override
	public String toString() {
		return format("%s{uploadId=%s, active=%s, mode=%s, reads=%d/%d, expiresAt=%s}", Upload.class.getSimpleName(),
				uploadId(), active(), encryptionMode().name(), readCount(), maxReads(), expiresAt());
	}
}
