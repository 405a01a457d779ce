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


package com.soklet.tackd.service;

import com.google.gson.Gson;
import com.google.inject.Inject;
import com.pyranid.Database;
import com.pyranid.DatabaseException;
import com.soklet.tackd.crypto.SecureTokens;
import com.soklet.tackd.exception.ApplicationException;
import com.soklet.tackd.exception.ApplicationException.ErrorCollector;
import com.soklet.tackd.exception.AuthenticationException;
import com.soklet.tackd.exception.UserExistsException;
import com.soklet.tackd.model.api.request.AccountCredentialsRequest;
import com.soklet.tackd.model.db.Account;
import com.soklet.tackd.model.db.ApiKey;
import com.soklet.tackd.model.db.Role;
import com.soklet.tackd.model.db.Role.RoleId;
import com.soklet.tackd.util.PasswordManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.soklet.tackd.util.Normalizer.normalizeEmailAddress;
import static com.soklet.tackd.util.Normalizer.normalizeTags;
import static com.soklet.tackd.util.Normalizer.trimAggressivelyToNull;
import static com.soklet.tackd.util.Validator.isAcceptablePassword;
import static com.soklet.tackd.util.Validator.isStorableTags;
import static com.soklet.tackd.util.Validator.isValidEmailAddress;
import static com.soklet.tackd.util.Validator.isWellFormedToken;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Business logic for accounts, API keys and request authentication.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class AccountService {
	public static final int API_KEY_LENGTH;

	static {
		API_KEY_LENGTH = 8;
	}

	@Nonnull
	private final PasswordManager passwordManager;
	@Nonnull
	private final Database database;
	@Nonnull
	private final Clock clock;
	@Nonnull
	private final Gson gson;
	@Nonnull
	private final Logger logger;

	@Inject
	public AccountService(@Nonnull PasswordManager passwordManager,
												@Nonnull Database database,
												@Nonnull Clock clock,
												@Nonnull Gson gson) {
		requireNonNull(passwordManager);
		requireNonNull(database);
		requireNonNull(clock);
		requireNonNull(gson);

		this.passwordManager = passwordManager;
		this.database = database;
		this.clock = clock;
		this.gson = gson;
		this.logger = LoggerFactory.getLogger(getClass());
	}

	@Nonnull
	public Optional<Account> findAccountById(@Nullable UUID accountId) {
		if (accountId == null)
			return Optional.empty();

		return getDatabase().queryForObject("""
				SELECT *
				FROM account
				WHERE account_id=?
				""", Account.class, accountId);
	}

	@Nonnull
	public Optional<Account> findAccountByEmailAddress(@Nullable String emailAddress) {
		String normalizedEmailAddress = normalizeEmailAddress(emailAddress).orElse(null);

		if (normalizedEmailAddress == null)
			return Optional.empty();

		return getDatabase().queryForObject("""
				SELECT *
				FROM account
				WHERE email_address=?
				""", Account.class, normalizedEmailAddress);
	}

	@Nonnull
	public Optional<Role> findRoleById(@Nullable RoleId roleId) {
		if (roleId == null)
			return Optional.empty();

		return getDatabase().queryForObject("""
				SELECT *
				FROM role
				WHERE role_id=?
				""", Role.class, roleId);
	}

	@Nonnull
	public Optional<ApiKey> findApiKeyById(@Nullable String apiKey) {
		if (apiKey == null)
			return Optional.empty();

		return getDatabase().queryForObject("""
				SELECT *
				FROM api_key
				WHERE api_key=?
				""", ApiKey.class, apiKey);
	}

	@Nonnull
	public List<ApiKey> findApiKeysByAccountId(@Nullable UUID accountId) {
		if (accountId == null)
			return List.of();

		return getDatabase().queryForList("""
				SELECT *
				FROM api_key
				WHERE account_id=?
				ORDER BY created_at, api_key
				""", ApiKey.class, accountId);
	}

	@Nonnull
	public UUID createAccount(@Nonnull AccountCredentialsRequest request) {
		requireNonNull(request);

		String emailAddress = trimAggressivelyToNull(request.email());
		String password = request.password();
		ErrorCollector errorCollector = new ErrorCollector();

		if (emailAddress == null)
			errorCollector.addFieldError("email", "Email address is required.");
		else if (!isValidEmailAddress(emailAddress))
			errorCollector.addFieldError("email", "Email address is invalid.");

		if (password == null)
			errorCollector.addFieldError("password", "Password is required.");
		else if (!isAcceptablePassword(password))
			errorCollector.addFieldError("password", "Password must be between 8 and 256 characters.");

		if (errorCollector.hasErrors())
			throw ApplicationException.withStatusCodeAndErrors(422, errorCollector).build();

		String normalizedEmailAddress = normalizeEmailAddress(emailAddress).orElseThrow();

		if (findAccountByEmailAddress(normalizedEmailAddress).isPresent())
			throw new UserExistsException(format("An account already exists for %s", normalizedEmailAddress));

		UUID accountId = UUID.randomUUID();

		try {
			getDatabase().execute("""
					INSERT INTO account (
						account_id,
						role_id,
						email_address,
						password_hash,
						created_at
					) VALUES (?,?,?,?,?)
					""", accountId, RoleId.USER, normalizedEmailAddress, getPasswordManager().hashPassword(password), getClock().instant());
		} catch (DatabaseException e) {
			// Lost a race with a concurrent signup for the same address
			if ("23505".equals(e.getSqlState().orElse(null)))
				throw new UserExistsException(format("An account already exists for %s", normalizedEmailAddress), e);

			throw e;
		}

		getLogger().info("Created account ID {}", accountId);

		return accountId;
	}

	/**
	 * Looks up an account's id given its email address and password.
	 * Unknown addresses and wrong passwords are indistinguishable to the caller.
	 */
	@Nonnull
	public UUID recoverAccountId(@Nonnull AccountCredentialsRequest request) {
		requireNonNull(request);

		Account account = findAccountByEmailAddress(request.email()).orElse(null);

		if (account == null || !getPasswordManager().verifyPassword(request.password(), account.passwordHash()))
			throw new AuthenticationException("Unable to recover account ID: bad credentials");

		return account.accountId();
	}

	/**
	 * Resolves an {@code Authorization} header to an identity.
	 * <p>
	 * Credentials are HTTP Basic. A username that parses as a UUID is an account id and is checked against the
	 * account's password. Anything else is treated as an API key and checked against the key's secret.
	 * No header at all yields the anonymous role.
	 *
	 * @throws AuthenticationException if credentials are present but malformed or wrong
	 */
	@Nonnull
	public Identity authenticate(@Nullable String authorizationHeader) {
		authorizationHeader = trimAggressivelyToNull(authorizationHeader);

		if (authorizationHeader == null)
			return new Identity(null, null, findRoleById(RoleId.ANONYMOUS).orElseThrow());

		BasicCredentials basicCredentials = parseBasicCredentials(authorizationHeader)
				.orElseThrow(() -> new AuthenticationException("Malformed Authorization header"));

		UUID accountId = parseUuid(basicCredentials.username()).orElse(null);

		if (accountId != null) {
			Account account = findAccountById(accountId).orElse(null);

			if (account == null || !getPasswordManager().verifyPassword(basicCredentials.password(), account.passwordHash()))
				throw new AuthenticationException(format("Bad credentials for account ID %s", accountId));

			return new Identity(account, null, findRoleById(account.roleId()).orElseThrow());
		}

		String key = basicCredentials.username();

		if (!isWellFormedToken(key, API_KEY_LENGTH))
			throw new AuthenticationException("Malformed API key");

		ApiKey apiKey = findApiKeyById(key).orElse(null);

		if (apiKey == null || !getPasswordManager().verifyPassword(basicCredentials.password(), apiKey.secretHash()))
			throw new AuthenticationException(format("Bad credentials for API key %s", key));

		Account account = findAccountById(apiKey.accountId()).orElseThrow();

		return new Identity(account, apiKey, findRoleById(account.roleId()).orElseThrow());
	}

	/**
	 * Issues a new API key. The secret is returned here and never again; only its hash is stored.
	 */
	@Nonnull
	public CreatedApiKey createApiKey(@Nonnull UUID accountId,
																		@Nullable List<String> tags) {
		requireNonNull(accountId);

		String key = SecureTokens.alphanumeric(API_KEY_LENGTH);
		String secret = UUID.randomUUID().toString();
		List<String> normalizedTags = normalizeTags(tags == null ? null : String.join(",", tags));
		String tagsJson = normalizedTags.isEmpty() ? null : getGson().toJson(normalizedTags);

		if (!isStorableTags(tagsJson))
			throw ApplicationException.withStatusCodeAndFieldError(422, "tags", "Too many tags, or the tags are too long.").build();

		Instant now = getClock().instant();

		getDatabase().execute("""
				INSERT INTO api_key (
					api_key,
					account_id,
					secret_hash,
					tags,
					created_at
				) VALUES (?,?,?,?,?)
				""", key, accountId, getPasswordManager().hashPassword(secret), tagsJson, now);

		getLogger().info("Created API key {} for account ID {}", key, accountId);

		return new CreatedApiKey(findApiKeyById(key).orElseThrow(), secret);
	}

	@Nonnull
	public Boolean deleteApiKey(@Nonnull UUID accountId,
															@Nullable String apiKey) {
		requireNonNull(accountId);

		if (apiKey == null)
			return false;

		return getDatabase().execute("""
				DELETE FROM api_key
				WHERE api_key=?
				AND account_id=?
				""", apiKey, accountId) > 0;
	}

	@Nonnull
	protected Optional<BasicCredentials> parseBasicCredentials(@Nonnull String authorizationHeader) {
		requireNonNull(authorizationHeader);

		String prefix = "Basic ";

		if (!authorizationHeader.regionMatches(true, 0, prefix, 0, prefix.length()))
			return Optional.empty();

		String decoded;

		try {
			decoded = new String(Base64.getDecoder().decode(authorizationHeader.substring(prefix.length()).trim()), StandardCharsets.UTF_8);
		} catch (IllegalArgumentException e) {
			return Optional.empty();
		}

		int separatorIndex = decoded.indexOf(':');

		if (separatorIndex <= 0)
			return Optional.empty();

		return Optional.of(new BasicCredentials(decoded.substring(0, separatorIndex), decoded.substring(separatorIndex + 1)));
	}

	@Nonnull
	protected Optional<UUID> parseUuid(@Nonnull String value) {
		requireNonNull(value);

		// UUID.fromString() is lenient about hyphen placement, so require the canonical length too
		if (value.length() != 36)
			return Optional.empty();

		try {
			return Optional.of(UUID.fromString(value));
		} catch (IllegalArgumentException e) {
			return Optional.empty();
		}
	}

	/**
	 * Who is making a request. Anonymous callers have neither an account nor an API key.
	 */
	public record Identity(
			@Nullable Account account,
			@Nullable ApiKey apiKey,
			@Nonnull Role role
	) {
		public Identity {
			requireNonNull(role);
		}
	}

	public record CreatedApiKey(
			@Nonnull ApiKey apiKey,
			@Nonnull String secret
	) {
		public CreatedApiKey {
			requireNonNull(apiKey);
			requireNonNull(secret);
		}

		@Override
		public String toString() {
			return format("%s{apiKey=%s}", CreatedApiKey.class.getSimpleName(), apiKey());
		}
	}

	protected record BasicCredentials(
			@Nonnull String username,
			@Nonnull String password
	) {
		public BasicCredentials {
			requireNonNull(username);
			requireNonNull(password);
		}

		@Override
		public String toString() {
			return format("%s{username=%s}", BasicCredentials.class.getSimpleName(), username());
		}
	}

	@Nonnull
	private PasswordManager getPasswordManager() {
		return this.passwordManager;
	}

	@Nonnull
	private Database getDatabase() {
		return this.database;
	}

	@Nonnull
	private Clock getClock() {
		return this.clock;
	}

	@Nonnull
	private Gson getGson() {
		return this.gson;
	}

	@Nonnull
	private Logger getLogger() {
		return this.logger;
	}
}
