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


package com.soklet.tackd.resource;

import com.google.inject.Inject;
import com.google.inject.Provider;
import com.soklet.Response;
import com.soklet.annotation.DELETE;
import com.soklet.annotation.GET;
import com.soklet.annotation.POST;
import com.soklet.annotation.PathParameter;
import com.soklet.annotation.RequestBody;
import com.soklet.tackd.CurrentContext;
import com.soklet.tackd.annotation.AuthorizationRequired;
import com.soklet.tackd.model.api.request.AccountCredentialsRequest;
import com.soklet.tackd.model.api.request.ApiKeyCreateRequest;
import com.soklet.tackd.model.api.response.ApiKeyResponse;
import com.soklet.tackd.model.api.response.ApiKeyResponse.ApiKeyResponseFactory;
import com.soklet.tackd.model.api.response.ApiKeyResponse.ApiKeysResponseHolder;
import com.soklet.tackd.model.db.Account;
import com.soklet.tackd.service.AccountService;
import com.soklet.tackd.service.AccountService.CreatedApiKey;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Contains Resource Methods for accounts and their API keys.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class UserResource {
	@Nonnull
	private final AccountService accountService;
	@Nonnull
	private final ApiKeyResponseFactory apiKeyResponseFactory;
	@Nonnull
	private final Provider<CurrentContext> currentContextProvider;

	@Inject
	public UserResource(@Nonnull AccountService accountService,
											@Nonnull ApiKeyResponseFactory apiKeyResponseFactory,
											@Nonnull Provider<CurrentContext> currentContextProvider) {
		requireNonNull(accountService);
		requireNonNull(apiKeyResponseFactory);
		requireNonNull(currentContextProvider);

		this.accountService = accountService;
		this.apiKeyResponseFactory = apiKeyResponseFactory;
		this.currentContextProvider = currentContextProvider;
	}

	@Nonnull
	@POST("/api/v1/user")
	public Response createAccount(@Nonnull @RequestBody AccountCredentialsRequest request) {
		requireNonNull(request);

		UUID accountId = getAccountService().createAccount(request);

		return Response.withStatusCode(201)
				.body(new AccountIdResponseHolder(accountId))
				.build();
	}

	@Nonnull
	@POST("/api/v1/user/recover/id")
	public AccountIdResponseHolder recoverAccountId(@Nonnull @RequestBody AccountCredentialsRequest request) {
		requireNonNull(request);
		return new AccountIdResponseHolder(getAccountService().recoverAccountId(request));
	}

	public record AccountIdResponseHolder(
			@Nonnull UUID id
	) {
		public AccountIdResponseHolder {
			requireNonNull(id);
		}
	}

	@Nonnull
	@AuthorizationRequired
	@POST("/api/v1/user/apiKeys")
	public Response createApiKey(@Nullable @RequestBody(optional = true) ApiKeyCreateRequest request) {
		Account account = getCurrentContext().getAccount().get();
		CreatedApiKey createdApiKey = getAccountService().createApiKey(account.accountId(), request == null ? null : request.tags());
		ApiKeyResponse apiKeyResponse = getApiKeyResponseFactory().create(createdApiKey.apiKey());

		// The secret is shown here once and is unrecoverable afterwards
		return Response.withStatusCode(201)
				.body(new ApiKeyCreatedResponseHolder(apiKeyResponse.getKey(), createdApiKey.secret(),
						apiKeyResponse.getCreated(), apiKeyResponse.getTags()))
				.build();
	}

	public record ApiKeyCreatedResponseHolder(
			@Nonnull String key,
			@Nonnull String secret,
			@Nonnull Instant created,
			@Nonnull List<String> tags
	) {
		public ApiKeyCreatedResponseHolder {
			requireNonNull(key);
			requireNonNull(secret);
			requireNonNull(created);
			requireNonNull(tags);
		}
	}

	@Nonnull
	@AuthorizationRequired
	@GET("/api/v1/user/apiKeys")
	public ApiKeysResponseHolder findApiKeys() {
		Account account = getCurrentContext().getAccount().get();

		return new ApiKeysResponseHolder(getAccountService().findApiKeysByAccountId(account.accountId()).stream()
				.map(apiKey -> getApiKeyResponseFactory().create(apiKey))
				.collect(Collectors.toList()));
	}

	@Nonnull
	@AuthorizationRequired
	@DELETE("/api/v1/user/apiKeys/{key}")
	public ApiKeyDeletedResponseHolder deleteApiKey(@Nonnull @PathParameter String key) {
		requireNonNull(key);

		Account account = getCurrentContext().getAccount().get();
		return new ApiKeyDeletedResponseHolder(getAccountService().deleteApiKey(account.accountId(), key));
	}

	public record ApiKeyDeletedResponseHolder(
			@Nonnull Boolean deleted
	) {
		public ApiKeyDeletedResponseHolder {
			requireNonNull(deleted);
		}
	}

	@Nonnull
	private AccountService getAccountService() {
		return this.accountService;
	}

	@Nonnull
	private ApiKeyResponseFactory getApiKeyResponseFactory() {
		return this.apiKeyResponseFactory;
	}

	@Nonnull
	private CurrentContext getCurrentContext() {
		return this.currentContextProvider.get();
	}
}
