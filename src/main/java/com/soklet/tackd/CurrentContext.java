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


package com.soklet.tackd;

import com.soklet.Request;
import com.soklet.ResourceMethod;
import com.soklet.tackd.model.db.Account;
import com.soklet.tackd.model.db.ApiKey;
import com.soklet.tackd.model.db.Role;
import org.slf4j.MDC;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.function.Supplier;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Keeps track of context: which request, account and role apply to the current thread of execution?
 * <p>
 * Contexts nest. {@link #run(Supplier)} restores whatever was bound before it, including the logging MDC.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class CurrentContext {
	@Nonnull
	private static final ThreadLocal<CurrentContext> CURRENT_CONTEXT_HOLDER;
	@Nonnull
	private static final String LOGGING_KEY;

	static {
		CURRENT_CONTEXT_HOLDER = new ThreadLocal<>();
		LOGGING_KEY = "CURRENT_CONTEXT";
	}

	@Nonnull
	public static CurrentContext get() {
		CurrentContext currentContext = CURRENT_CONTEXT_HOLDER.get();

		if (currentContext == null)
			throw new IllegalStateException(format("No %s is bound to the current thread", CurrentContext.class.getSimpleName()));

		return currentContext;
	}

	@Nonnull
	public static Optional<CurrentContext> find() {
		return Optional.ofNullable(CURRENT_CONTEXT_HOLDER.get());
	}

	@NotThreadSafe
	public static class Builder {
		@Nullable
		private Request request;
		@Nullable
		private ResourceMethod resourceMethod;
		@Nullable
		private Account account;
		@Nullable
		private ApiKey apiKey;
		@Nullable
		private Role role;

		private Builder() {}

		@Nonnull
		public Builder request(@Nullable Request request) {
			this.request = request;
			return this;
		}

		@Nonnull
		public Builder resourceMethod(@Nullable ResourceMethod resourceMethod) {
			this.resourceMethod = resourceMethod;
			return this;
		}

		@Nonnull
		public Builder account(@Nullable Account account) {
			this.account = account;
			return this;
		}

		@Nonnull
		public Builder apiKey(@Nullable ApiKey apiKey) {
			this.apiKey = apiKey;
			return this;
		}

		@Nonnull
		public Builder role(@Nullable Role role) {
			this.role = role;
			return this;
		}

		@Nonnull
		public CurrentContext build() {
			return new CurrentContext(this);
		}
	}

	// Background work, e.g. the cleanup sweep
	@Nonnull
	public static Builder empty() {
		return new Builder();
	}

	@Nonnull
	public static Builder withRequest(@Nullable Request request,
																		@Nullable ResourceMethod resourceMethod) {
		return new Builder().request(request).resourceMethod(resourceMethod);
	}

	@Nonnull
	public static Builder withAccount(@Nullable Account account) {
		return new Builder().account(account);
	}

	@Nullable
	private final Request request;
	@Nullable
	private final ResourceMethod resourceMethod;
	@Nullable
	private final Account account;
	@Nullable
	private final ApiKey apiKey;
	@Nullable
	private final Role role;

	private CurrentContext(@Nonnull Builder builder) {
		requireNonNull(builder);

		this.request = builder.request;
		this.resourceMethod = builder.resourceMethod;
		this.account = builder.account;
		this.apiKey = builder.apiKey;
		this.role = builder.role;
	}

	public void run(@Nonnull Runnable runnable) {
		requireNonNull(runnable);
		run(() -> {
			runnable.run();
			return null;
		});
	}

	@Nullable
	public <T> T run(@Nonnull Supplier<T> supplier) {
		requireNonNull(supplier);

		CurrentContext previousContext = CURRENT_CONTEXT_HOLDER.get();
		String previousMdc = MDC.get(LOGGING_KEY);

		CURRENT_CONTEXT_HOLDER.set(this);

		try {
			MDC.put(LOGGING_KEY, determineLoggingDescription());
			return supplier.get();
		} finally {
			if (previousContext != null)
				CURRENT_CONTEXT_HOLDER.set(previousContext);
			else
				CURRENT_CONTEXT_HOLDER.remove();

			if (previousMdc != null)
				MDC.put(LOGGING_KEY, previousMdc);
			else
				MDC.remove(LOGGING_KEY);
		}
	}

	@Override
	public String toString() {
		StringJoiner joiner = new StringJoiner(", ", format("%s{", CurrentContext.class.getSimpleName()), "}");

		getAccount().ifPresent(account -> joiner.add(format("accountId=%s", account.accountId())));
		getApiKey().ifPresent(apiKey -> joiner.add(format("apiKey=%s", apiKey.apiKey())));
		getRole().ifPresent(role -> joiner.add(format("roleId=%s", role.roleId().name())));
		getRequest().ifPresent(request -> joiner.add(format("request=%s %s", request.getHttpMethod().name(), request.getRawPath())));

		return joiner.toString();
	}

	@Nonnull
	public Optional<Request> getRequest() {
		return Optional.ofNullable(this.request);
	}

	@Nonnull
	public Optional<ResourceMethod> getResourceMethod() {
		return Optional.ofNullable(this.resourceMethod);
	}

	@Nonnull
	public Optional<Account> getAccount() {
		return Optional.ofNullable(this.account);
	}

	@Nonnull
	public Optional<ApiKey> getApiKey() {
		return Optional.ofNullable(this.apiKey);
	}

	@Nonnull
	public Optional<Role> getRole() {
		return Optional.ofNullable(this.role);
	}

	@Nonnull
	private String determineLoggingDescription() {
		Request request = getRequest().orElse(null);
		Account account = getAccount().orElse(null);

		String requestDescription = request == null ? "background thread" : String.valueOf(request.getId());
		String accountDescription = account == null ? "anonymous" : account.accountId().toString();

		return format("%s (%s)", requestDescription, accountDescription);
	}
}
