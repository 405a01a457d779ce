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
import com.soklet.tackd.model.db.ApiKey;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Instant;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ApiKeyResponse {
	@NonNull
	private final String key;
	@NonNull
	private final Instant created;
	@NonNull
	private final List<String> tags;

	@ThreadSafe
	public interface ApiKeyResponseFactory {
		@NonNull
		ApiKeyResponse create(@NonNull ApiKey apiKey);
	}

	@AssistedInject
	public ApiKeyResponse(@NonNull Gson gson,
												@Assisted @NonNull ApiKey apiKey) {
		requireNonNull(gson);
		requireNonNull(apiKey);

		this.key = apiKey.apiKey();
		this.created = apiKey.createdAt();
		this.tags = apiKey.tags() == null ? List.of() : gson.fromJson(apiKey.tags(), new TypeToken<List<String>>() {}.getType());
	}

	public record ApiKeysResponseHolder(
			@NonNull List<ApiKeyResponse> apiKeys
	) {
		public ApiKeysResponseHolder {
			requireNonNull(apiKeys);
		}
	}

	@NonNull
	public String getKey() {
		return this.key;
	}

	@NonNull
	public Instant getCreated() {
		return this.created;
	}

	@NonNull
	public List<String> getTags() {
		return this.tags;
	}
}
