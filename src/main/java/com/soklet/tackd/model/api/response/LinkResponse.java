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
import com.soklet.tackd.model.db.Link;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Public-facing representation of a {@link Link}. Key hashes are never exposed, only whether one exists.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class LinkResponse {
	@NonNull
	private final UUID linkId;
	@NonNull
	private final UUID uploadId;
	@NonNull
	private final Boolean keyed;
	@NonNull
	private final List<String> tags;
	@NonNull
	private final Integer readCount;
	@NonNull
	private final Instant createdAt;

	@ThreadSafe
	public interface LinkResponseFactory {
		@NonNull
		LinkResponse create(@NonNull Link link);
	}

	@AssistedInject
	public LinkResponse(@NonNull Gson gson,
											@Assisted @NonNull Link link) {
		requireNonNull(gson);
		requireNonNull(link);

		this.linkId = link.linkId();
		this.uploadId = link.uploadId();
		this.keyed = link.keyHash() != null;
		this.tags = link.tags() == null ? List.of() : gson.fromJson(link.tags(), new TypeToken<List<String>>() {}.getType());
		this.readCount = link.readCount();
		this.createdAt = link.createdAt();
	}

	public record LinksResponseHolder(
			@NonNull List<LinkResponse> links
	) {
		public LinksResponseHolder {
			requireNonNull(links);
		}
	}

	@NonNull
	public UUID getLinkId() {
		return this.linkId;
	}

	@NonNull
	public UUID getUploadId() {
		return this.uploadId;
	}

	@NonNull
	public Boolean getKeyed() {
		return this.keyed;
	}

	@NonNull
	public List<String> getTags() {
		return this.tags;
	}

	@NonNull
	public Integer getReadCount() {
		return this.readCount;
	}

	@NonNull
	public Instant getCreatedAt() {
		return this.createdAt;
	}
}
