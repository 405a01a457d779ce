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


package com.soklet.tackd.model.api.response;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import com.google.inject.assistedinject.Assisted;
import com.google.inject.assistedinject.AssistedInject;
import com.soklet.tackd.model.db.Upload;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Public-facing representation of an {@link Upload}.
 * <p>
 * Scrubbed: wrapped keys, password hashes and client network details never leave the server.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class UploadResponse {
	@NonNull
	private final UUID uploadId;
	@NonNull
	private final String contentType;
	@NonNull
	private final Long byteLength;
	@Nullable
	private final String filename;
	@NonNull
	private final List<String> tags;
	@NonNull
	private final Integer maxReads;
	@NonNull
	private final Long maxSeconds;
	@NonNull
	private final Integer readCount;
	@NonNull
	private final Instant expiresAt;
	@NonNull
	private final String encryptionMode;
	@NonNull
	private final Boolean passwordProtected;
	@NonNull
	private final Instant createdAt;

	@ThreadSafe
	public interface UploadResponseFactory {
		@NonNull
		UploadResponse create(@NonNull Upload upload);
	}

	@AssistedInject
	public UploadResponse(@NonNull Gson gson,
												@Assisted @NonNull Upload upload) {
		requireNonNull(gson);
		requireNonNull(upload);

		this.uploadId = upload.uploadId();
		this.contentType = upload.contentType();
		this.byteLength = upload.byteLength();
		this.filename = upload.filename();
		this.tags = upload.tags() == null ? List.of() : gson.fromJson(upload.tags(), new TypeToken<List<String>>() {}.getType());
		this.maxReads = upload.maxReads();
		this.maxSeconds = upload.maxSeconds();
		this.readCount = upload.readCount();
		this.expiresAt = upload.expiresAt();
		this.encryptionMode = upload.encryptionMode().name();
		this.passwordProtected = upload.passwordHash() != null;
		this.createdAt = upload.createdAt();
	}

	public record UploadResponseHolder(
			@NonNull UploadResponse upload
	) {
		public UploadResponseHolder {
			requireNonNull(upload);
		}
	}

	public record UploadsResponseHolder(
			@NonNull List<UploadResponse> uploads
	) {
		public UploadsResponseHolder {
			requireNonNull(uploads);
		}
	}

	@NonNull
	public UUID getUploadId() {
		return this.uploadId;
	}

	@NonNull
	public String getContentType() {
		return this.contentType;
	}

	@NonNull
	public Long getByteLength() {
		return this.byteLength;
	}

	@Nullable
	public String getFilename() {
		return this.filename;
	}

	@NonNull
	public List<String> getTags() {
		return this.tags;
	}

	@NonNull
	public Integer getMaxReads() {
		return this.maxReads;
	}

	@NonNull
	public Long getMaxSeconds() {
		return this.maxSeconds;
	}

	@NonNull
	public Integer getReadCount() {
		return this.readCount;
	}

	@NonNull
	public Instant getExpiresAt() {
		return this.expiresAt;
	}

	@NonNull
	public String getEncryptionMode() {
		return this.encryptionMode;
	}

	@NonNull
	public Boolean getPasswordProtected() {
		return this.passwordProtected;
	}

	@NonNull
	public Instant getCreatedAt() {
		return this.createdAt;
	}
}
