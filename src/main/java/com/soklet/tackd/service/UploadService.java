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
import com.pyranid.Transaction;
import com.pyranid.TransactionResult;
import com.soklet.tackd.Configuration;
import com.soklet.tackd.crypto.EncryptionDescriptor;
import com.soklet.tackd.crypto.EncryptionDescriptor.Mode;
import com.soklet.tackd.crypto.EncryptionEngine;
import com.soklet.tackd.crypto.EncryptionEngine.SealedPayload;
import com.soklet.tackd.crypto.LinkMinter;
import com.soklet.tackd.crypto.LinkMinter.MintedLink;
import com.soklet.tackd.exception.ApplicationException;
import com.soklet.tackd.exception.ApplicationException.ErrorCollector;
import com.soklet.tackd.exception.BadInsertException;
import com.soklet.tackd.exception.CleanupNotRequiredException;
import com.soklet.tackd.exception.CryptoException;
import com.soklet.tackd.exception.NotFoundException;
import com.soklet.tackd.model.api.request.UploadCreateRequest;
import com.soklet.tackd.model.api.request.UploadDownloadRequest;
import com.soklet.tackd.model.db.Link;
import com.soklet.tackd.model.db.Upload;
import com.soklet.tackd.storage.ObjectStore;
import com.soklet.tackd.util.PasswordManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.soklet.tackd.util.ExpiryParser.parseExpiry;
import static com.soklet.tackd.util.Normalizer.normalizeFilename;
import static com.soklet.tackd.util.Normalizer.normalizeTags;
import static com.soklet.tackd.util.Normalizer.trimAggressivelyToNull;
import static com.soklet.tackd.util.Normalizer.truncate;
import static com.soklet.tackd.util.Validator.isStorableTags;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Business logic for the upload lifecycle: create, download-and-consume, delete and link management.
 * <p>
 * A download walks a fixed sequence of checks (see {@link DownloadStage}). Every failure, whatever its cause,
 * surfaces as {@link NotFoundException} so responses never confirm that an upload exists; the cause is kept in
 * {@code DEBUG} logging only.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class UploadService {
	public static final int UNLIMITED_READS;
	private static final int MAXIMUM_CLIENT_HEADER_LENGTH;

	static {
		UNLIMITED_READS = -1;
		// Width of the user_agent and forwarded_for columns
		MAXIMUM_CLIENT_HEADER_LENGTH = 1024;
	}

	@Nonnull
	private final Configuration configuration;
	@Nonnull
	private final Database database;
	@Nonnull
	private final ObjectStore objectStore;
	@Nonnull
	private final EncryptionEngine encryptionEngine;
	@Nonnull
	private final LinkMinter linkMinter;
	@Nonnull
	private final PasswordManager passwordManager;
	@Nonnull
	private final CleanupCoordinator cleanupCoordinator;
	@Nonnull
	private final Clock clock;
	@Nonnull
	private final Gson gson;
	@Nonnull
	private final Logger logger;

	@Inject
	public UploadService(@Nonnull Configuration configuration,
											 @Nonnull Database database,
											 @Nonnull ObjectStore objectStore,
											 @Nonnull EncryptionEngine encryptionEngine,
											 @Nonnull LinkMinter linkMinter,
											 @Nonnull PasswordManager passwordManager,
											 @Nonnull CleanupCoordinator cleanupCoordinator,
											 @Nonnull Clock clock,
											 @Nonnull Gson gson) {
		requireNonNull(configuration);
		requireNonNull(database);
		requireNonNull(objectStore);
		requireNonNull(encryptionEngine);
		requireNonNull(linkMinter);
		requireNonNull(passwordManager);
		requireNonNull(cleanupCoordinator);
		requireNonNull(clock);
		requireNonNull(gson);

		this.configuration = configuration;
		this.database = database;
		this.objectStore = objectStore;
		this.encryptionEngine = encryptionEngine;
		this.linkMinter = linkMinter;
		this.passwordManager = passwordManager;
		this.cleanupCoordinator = cleanupCoordinator;
		this.clock = clock;
		this.gson = gson;
		this.logger = LoggerFactory.getLogger(getClass());
	}

	@Nonnull
	public Optional<Upload> findUploadById(@Nullable UUID uploadId) {
		if (uploadId == null)
			return Optional.empty();

		return getDatabase().queryForObject("""
				SELECT *
				FROM upload
				WHERE upload_id=?
				""", Upload.class, uploadId);
	}

	@Nonnull
	public Optional<Link> findLinkById(@Nullable UUID linkId) {
		if (linkId == null)
			return Optional.empty();

		return getDatabase().queryForObject("""
				SELECT *
				FROM link
				WHERE link_id=?
				""", Link.class, linkId);
	}

	@Nonnull
	public List<Link> findLinksByUploadId(@Nullable UUID uploadId) {
		if (uploadId == null)
			return List.of();

		return getDatabase().queryForList("""
				SELECT *
				FROM link
				WHERE upload_id=?
				ORDER BY created_at, link_id
				""", Link.class, uploadId);
	}

	// Active, unexpired uploads only, newest first
	@Nonnull
	public List<Upload> findUploadsByOwnerAccountId(@Nullable UUID ownerAccountId) {
		if (ownerAccountId == null)
			return List.of();

		return getDatabase().queryForList("""
				SELECT *
				FROM upload
				WHERE owner_account_id=?
				AND active=TRUE
				AND expires_at > ?
				ORDER BY created_at DESC
				LIMIT 1000
				""", Upload.class, ownerAccountId, getClock().instant());
	}

	@Nonnull
	public Optional<Upload> findOwnedUpload(@Nullable UUID uploadId,
																					@Nullable UUID ownerAccountId) {
		if (uploadId == null || ownerAccountId == null)
			return Optional.empty();

		return getDatabase().queryForObject("""
				SELECT *
				FROM upload
				WHERE upload_id=?
				AND owner_account_id=?
				AND active=TRUE
				AND expires_at > ?
				""", Upload.class, uploadId, ownerAccountId, getClock().instant());
	}

	/**
	 * Seals the payload, writes the blob, then records metadata and the first link.
	 * <p>
	 * The blob write completes before any metadata is visible. If the metadata write fails, or the surrounding
	 * transaction later rolls back, the blob is deleted again.
	 */
	@Nonnull
	public SavedUpload createUpload(@Nonnull UploadCreateRequest request) {
		requireNonNull(request);

		byte[] payload = request.payload();
		String expiresParameter = trimAggressivelyToNull(request.expires());
		String requestedFilename = trimAggressivelyToNull(request.filename());
		String filename = normalizeFilename(requestedFilename).orElse(null);
		String password = trimAggressivelyToNull(request.password());
		List<String> tags = normalizeTags(request.tags());
		String tagsJson = toTagsJson(tags);
		Duration requestedExpiry = null;
		ErrorCollector errorCollector = new ErrorCollector();

		if (payload == null || payload.length == 0)
			errorCollector.addGeneralError("Nothing to upload: the request body is empty.");
		else if (payload.length > getConfiguration().getUploadLimitInBytes())
			throw ApplicationException.withStatusCodeAndGeneralError(413, "The upload is too large.")
					.metadata(Map.of("uploadLimitInBytes", getConfiguration().getUploadLimitInBytes()))
					.build();

		if (expiresParameter != null) {
			requestedExpiry = parseExpiry(expiresParameter).orElse(null);

			if (requestedExpiry == null)
				errorCollector.addFieldError("expires", "Expiry must be a number of seconds or a duration like 15m, 2h or 7d.");
		}

		if (requestedFilename != null && filename == null)
			errorCollector.addFieldError("filename", "Filename is not usable.");

		if (!isStorableTags(tagsJson))
			errorCollector.addFieldError("tags", "Too many tags, or the tags are too long.");

		if (errorCollector.hasErrors())
			throw ApplicationException.withStatusCodeAndErrors(422, errorCollector).build();

		Instant now = getClock().instant();
		UUID uploadId = UUID.randomUUID();
		UUID ownerAccountId = request.ownerAccountId();
		Duration expiry = clampExpiry(requestedExpiry == null ? getConfiguration().getDefaultRetention() : requestedExpiry);
		Instant expiresAt = now.plus(expiry);
		Integer maxReads = determineMaxReads(request.reads(), expiresParameter);

		// Owners get server-managed keys; anonymous uploaders hold their own data key
		SealedPayload sealedPayload = getEncryptionEngine().create(payload, request.contentType(), null,
				ownerAccountId != null, getConfiguration().getEncryptData());

		EncryptionDescriptor encryptionDescriptor = sealedPayload.encryptionDescriptor();
		MintedLink mintedLink = getLinkMinter().mint(encryptionDescriptor.isManaged() ? ownerAccountId : null, tags);

		getLogger().info("Storing {} byte upload ID {} ({}, {} read[s], expires {})", sealedPayload.storedBytes().length,
				uploadId, encryptionDescriptor.mode().name(), maxReads > 0 ? maxReads : "unlimited", expiresAt);

		Map<String, String> blobMetadata = new LinkedHashMap<>();
		blobMetadata.put("linkId", mintedLink.linkId().toString());

		if (filename != null)
			blobMetadata.put("filename", filename);

		try {
			getObjectStore().put(uploadId.toString(), sealedPayload.storedBytes(), sealedPayload.contentType(), blobMetadata);
		} catch (RuntimeException e) {
			throw new BadInsertException(format("Unable to store blob for upload ID %s", uploadId), e);
		}

		// Deleting an already-deleted blob is a no-op, so this may safely overlap the compensation below
		getDatabase().currentTransaction().ifPresent(transaction ->
				transaction.addPostTransactionOperation((TransactionResult transactionResult) -> {
					if (transactionResult == TransactionResult.ROLLED_BACK)
						deleteBlob(uploadId, "transaction rolled back");
				}));

		try {
			getDatabase().execute("""
							INSERT INTO upload (
								upload_id,
								active,
								content_type,
								byte_length,
								filename,
								tags,
								user_agent,
								forwarded_for,
								max_reads,
								max_seconds,
								expires_at,
								expires_parameter,
								read_count,
								owner_account_id,
								password_hash,
								encryption_mode,
								wrapped_key,
								wrapped_key_version,
								ignore_link_key,
								created_at
							) VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)
							""", uploadId, true, sealedPayload.contentType(), (long) sealedPayload.storedBytes().length, filename,
					tagsJson, truncate(trimAggressivelyToNull(request.userAgent()), MAXIMUM_CLIENT_HEADER_LENGTH),
					truncate(trimAggressivelyToNull(request.forwardedFor()), MAXIMUM_CLIENT_HEADER_LENGTH),
					maxReads, expiry.getSeconds(), expiresAt, expiresParameter, 0, ownerAccountId,
					password == null ? null : getPasswordManager().hashPassword(password), encryptionDescriptor.mode(),
					encryptionDescriptor.wrappedKey(), encryptionDescriptor.wrappedKeyVersion(), getConfiguration().getIgnoreLinkKey(), now);

			insertLink(uploadId, mintedLink, now);
		} catch (DatabaseException e) {
			deleteBlob(uploadId, "metadata insert failed");
			throw new BadInsertException(format("Unable to record metadata for upload ID %s", uploadId), e);
		}

		String key = determineKey(sealedPayload, mintedLink);
		String url = buildDownloadUrl(mintedLink.linkId(), filename, key);

		return new SavedUpload(uploadId, mintedLink.linkId(), key, url, expiresAt, maxReads);
	}

	/**
	 * Follows a link: validates it, decrypts the blob and claims one read.
	 * <p>
	 * The read is claimed with a single conditional update after decryption succeeds, so wrong keys never use up a
	 * read and concurrent requests can never exceed the upload's read limit. The request that claims the last read
	 * deactivates the upload and deletes its blob once the transaction commits.
	 *
	 * @throws NotFoundException for every failure, by design of the capability model
	 */
	@Nonnull
	public DownloadedUpload downloadUpload(@Nonnull UploadDownloadRequest request) {
		requireNonNull(request);

		try {
			getCleanupCoordinator().cleanup();
		} catch (CleanupNotRequiredException e) {
			getLogger().trace("Opportunistic cleanup skipped: {}", e.getReason().name());
		}

		UUID linkId = request.linkId();

		// LOOKUP
		Link link = findLinkById(linkId).orElse(null);

		if (link == null)
			throw downloadFailure(DownloadStage.LOOKUP, linkId, "no such link");

		Upload upload = getDatabase().queryForObject("""
				SELECT *
				FROM upload
				WHERE upload_id=?
				AND active=TRUE
				""", Upload.class, link.uploadId()).orElse(null);

		if (upload == null)
			throw downloadFailure(DownloadStage.LOOKUP, linkId, "upload is inactive");

		// PASSWORD_CHECK
		if (upload.passwordHash() != null && !getPasswordManager().verifyPassword(request.password(), upload.passwordHash()))
			throw downloadFailure(DownloadStage.PASSWORD_CHECK, linkId, "password missing or incorrect");

		// LINK_KEY_CHECK
		if (upload.encryptionMode() == Mode.MANAGED && !upload.ignoreLinkKey()
				&& !getLinkMinter().matches(request.key(), link.keyHash()))
			throw downloadFailure(DownloadStage.LINK_KEY_CHECK, linkId, "link key missing or incorrect");

		// EXPIRY_CHECK
		if (getClock().instant().isAfter(upload.expiresAt()))
			throw downloadFailure(DownloadStage.EXPIRY_CHECK, linkId, format("expired at %s", upload.expiresAt()));

		// FETCH_BLOB
		byte[] storedBytes = getObjectStore().get(upload.uploadId().toString()).orElse(null);

		if (storedBytes == null)
			throw downloadFailure(DownloadStage.FETCH_BLOB, linkId, "blob is missing");

		// DECRYPT
		byte[] payload;

		try {
			payload = getEncryptionEngine().decrypt(storedBytes, upload.encryptionDescriptor(), request.key());
		} catch (CryptoException e) {
			getLogger().debug(format("Decryption of upload ID %s failed", upload.uploadId()), e);
			throw downloadFailure(DownloadStage.DECRYPT, linkId, "decryption failed");
		}

		// CONSUME_ACCOUNTING
		boolean claimed = getDatabase().execute("""
				UPDATE upload
				SET read_count=read_count+1
				WHERE upload_id=?
				AND active=TRUE
				AND (max_reads <= 0 OR read_count < max_reads)
				""", upload.uploadId()) > 0;

		if (!claimed)
			throw downloadFailure(DownloadStage.CONSUME_ACCOUNTING, linkId, "lost the race for the final read");

		getDatabase().execute("UPDATE link SET read_count=read_count+1 WHERE link_id=?", link.linkId());

		Integer readCount = getDatabase().queryForObject("SELECT read_count FROM upload WHERE upload_id=?",
				Integer.class, upload.uploadId()).get();

		if (upload.hasReadLimit() && readCount >= upload.maxReads()) {
			getLogger().info("Upload ID {} reached its limit of {} read[s]; deactivating", upload.uploadId(), upload.maxReads());
			deactivateUpload(upload.uploadId());
		}

		return new DownloadedUpload(upload.uploadId(), payload, upload.contentType(), upload.filename());
	}

	/**
	 * Owner-scoped delete. Deactivation is terminal; the blob goes once the transaction commits.
	 *
	 * @return {@code false} if there was no active upload with this id belonging to this owner
	 */
	@Nonnull
	public Boolean deleteUpload(@Nonnull UUID uploadId,
															@Nonnull UUID ownerAccountId) {
		requireNonNull(uploadId);
		requireNonNull(ownerAccountId);

		boolean deactivated = getDatabase().execute("""
				UPDATE upload
				SET active=FALSE
				WHERE upload_id=?
				AND owner_account_id=?
				AND active=TRUE
				""", uploadId, ownerAccountId) > 0;

		if (deactivated) {
			getLogger().info("Owner deleted upload ID {}", uploadId);
			deleteBlobAfterCommit(uploadId);
		}

		return deactivated;
	}

	/**
	 * Adds an independently keyed, independently counted link to an owned upload.
	 * Only managed uploads qualify: an unmanaged upload's data key is not the server's to hand out again.
	 */
	@Nonnull
	public CreatedLink createLink(@Nonnull UUID uploadId,
																@Nonnull UUID ownerAccountId,
																@Nullable List<String> tags) {
		requireNonNull(uploadId);
		requireNonNull(ownerAccountId);

		Upload upload = findOwnedUpload(uploadId, ownerAccountId).orElse(null);

		if (upload == null)
			throw new NotFoundException();

		if (upload.encryptionMode() != Mode.MANAGED)
			throw ApplicationException.withStatusCodeAndGeneralError(422,
					"Links can only be added to uploads whose keys are managed by the server.").build();

		List<String> normalizedTags = normalizeTags(tags == null ? null : String.join(",", tags));

		if (!isStorableTags(toTagsJson(normalizedTags)))
			throw ApplicationException.withStatusCodeAndFieldError(422, "tags", "Too many tags, or the tags are too long.").build();

		MintedLink mintedLink = getLinkMinter().mint(ownerAccountId, normalizedTags);
		Instant now = getClock().instant();

		try {
			insertLink(uploadId, mintedLink, now);
		} catch (DatabaseException e) {
			throw new BadInsertException(format("Unable to record link for upload ID %s", uploadId), e);
		}

		Link link = findLinkById(mintedLink.linkId()).get();
		String url = buildDownloadUrl(link.linkId(), upload.filename(), mintedLink.unlockKey());

		return new CreatedLink(link, mintedLink.unlockKey(), url);
	}

	protected void deactivateUpload(@Nonnull UUID uploadId) {
		requireNonNull(uploadId);

		boolean deactivated = getDatabase().execute("""
				UPDATE upload
				SET active=FALSE
				WHERE upload_id=?
				AND active=TRUE
				""", uploadId) > 0;

		if (deactivated)
			deleteBlobAfterCommit(uploadId);
	}

	protected void insertLink(@Nonnull UUID uploadId,
														@Nonnull MintedLink mintedLink,
														@Nonnull Instant createdAt) {
		requireNonNull(uploadId);
		requireNonNull(mintedLink);
		requireNonNull(createdAt);

		getDatabase().execute("""
				INSERT INTO link (
					link_id,
					upload_id,
					key_hash,
					tags,
					read_count,
					created_at
				) VALUES (?,?,?,?,?,?)
				""", mintedLink.linkId(), uploadId, mintedLink.keyHash(), toTagsJson(mintedLink.tags()), 0, createdAt);
	}

	@Nonnull
	protected Duration clampExpiry(@Nonnull Duration requestedExpiry) {
		requireNonNull(requestedExpiry);

		Duration maximumRetention = getConfiguration().getMaximumRetention();

		if (requestedExpiry.compareTo(maximumRetention) <= 0)
			return requestedExpiry;

		getLogger().debug("Requested expiry of {}s exceeds the maximum; clamping to {}s", requestedExpiry.getSeconds(), maximumRetention.getSeconds());
		return maximumRetention;
	}

	// No limits at all means burn-after-reading; an expiry on its own means unlimited reads until then
	@Nonnull
	protected Integer determineMaxReads(@Nullable Integer reads,
																			@Nullable String expiresParameter) {
		if (reads != null)
			return reads > 0 ? reads : UNLIMITED_READS;

		return expiresParameter == null ? getConfiguration().getDefaultReads() : UNLIMITED_READS;
	}

	// Unmanaged uploads must always hand back their data key; managed ones hand back the link's unlock key, if any
	@Nullable
	protected String determineKey(@Nonnull SealedPayload sealedPayload,
																@Nonnull MintedLink mintedLink) {
		requireNonNull(sealedPayload);
		requireNonNull(mintedLink);

		Mode mode = sealedPayload.encryptionDescriptor().mode();

		if (mode == Mode.UNMANAGED)
			return sealedPayload.dataKey();

		if (mode == Mode.MANAGED)
			return mintedLink.unlockKey();

		return null;
	}

	@Nonnull
	protected String buildDownloadUrl(@Nonnull UUID linkId,
																		@Nullable String filename,
																		@Nullable String key) {
		requireNonNull(linkId);

		List<String> queryParameters = new ArrayList<>(2);

		if (filename != null)
			queryParameters.add(format("id=%s", linkId));

		if (key != null)
			queryParameters.add(format("key=%s", URLEncoder.encode(key, StandardCharsets.UTF_8)));

		String pathComponent = filename == null ? linkId.toString() : URLEncoder.encode(filename, StandardCharsets.UTF_8);
		String url = format("%s/download/%s", getConfiguration().getBaseUrl(), pathComponent);

		return queryParameters.isEmpty() ? url : format("%s?%s", url, String.join("&", queryParameters));
	}

	protected void deleteBlobAfterCommit(@Nonnull UUID uploadId) {
		requireNonNull(uploadId);

		Transaction transaction = getDatabase().currentTransaction().orElse(null);

		if (transaction == null) {
			deleteBlob(uploadId, "upload deactivated");
			return;
		}

		transaction.addPostTransactionOperation((TransactionResult transactionResult) -> {
			if (transactionResult == TransactionResult.COMMITTED)
				deleteBlob(uploadId, "upload deactivated");
		});
	}

	// Best-effort: an orphaned blob is an accepted, recoverable outcome, so failures are logged and not rethrown
	protected void deleteBlob(@Nonnull UUID uploadId,
														@Nonnull String reason) {
		requireNonNull(uploadId);
		requireNonNull(reason);

		try {
			getObjectStore().delete(uploadId.toString());
			getLogger().debug("Deleted blob for upload ID {} ({})", uploadId, reason);
		} catch (RuntimeException e) {
			getLogger().warn(format("Unable to delete blob for upload ID %s (%s); it is now orphaned", uploadId, reason), e);
		}
	}

	@Nullable
	protected String toTagsJson(@Nullable List<String> tags) {
		return tags == null || tags.isEmpty() ? null : getGson().toJson(tags);
	}

	@Nonnull
	protected NotFoundException downloadFailure(@Nonnull DownloadStage downloadStage,
																							@Nullable UUID linkId,
																							@Nonnull String detail) {
		requireNonNull(downloadStage);
		requireNonNull(detail);

		getLogger().debug("Download of link ID {} failed at {}: {}", linkId, downloadStage.name(), detail);
		return new NotFoundException();
	}

	/**
	 * The checks a download passes through, in order. The first one to fail ends the download.
	 */
	public enum DownloadStage {
		LOOKUP,
		PASSWORD_CHECK,
		LINK_KEY_CHECK,
		EXPIRY_CHECK,
		FETCH_BLOB,
		DECRYPT,
		CONSUME_ACCOUNTING
	}

	/**
	 * Result of {@link #createUpload(UploadCreateRequest)}. {@code key} is shown to the caller exactly once.
	 */
	public record SavedUpload(
			@Nonnull UUID uploadId,
			@Nonnull UUID linkId,
			@Nullable String key,
			@Nonnull String url,
			@Nonnull Instant expiresAt,
			@Nonnull Integer maxReads
	) {
		public SavedUpload {
			requireNonNull(uploadId);
			requireNonNull(linkId);
			requireNonNull(url);
			requireNonNull(expiresAt);
			requireNonNull(maxReads);
		}

		@Override
		public String toString() {
			return format("%s{uploadId=%s, linkId=%s, expiresAt=%s, maxReads=%d}", SavedUpload.class.getSimpleName(),
					uploadId(), linkId(), expiresAt(), maxReads());
		}
	}

	public record DownloadedUpload(
			@Nonnull UUID uploadId,
			@Nonnull byte[] payload,
			@Nonnull String contentType,
			@Nullable String filename
	) {
		public DownloadedUpload {
			requireNonNull(uploadId);
			requireNonNull(payload);
			requireNonNull(contentType);
		}
	}

	public record CreatedLink(
			@Nonnull Link link,
			@Nullable String key,
			@Nonnull String url
	) {
		public CreatedLink {
			requireNonNull(link);
			requireNonNull(url);
		}

		@Override
		public String toString() {
			return format("%s{linkId=%s}", CreatedLink.class.getSimpleName(), link().linkId());
		}
	}

	@Nonnull
	private Configuration getConfiguration() {
		return this.configuration;
	}

	@Nonnull
	private Database getDatabase() {
		return this.database;
	}

	@Nonnull
	private ObjectStore getObjectStore() {
		return this.objectStore;
	}

	@Nonnull
	private EncryptionEngine getEncryptionEngine() {
		return this.encryptionEngine;
	}

	@Nonnull
	private LinkMinter getLinkMinter() {
		return this.linkMinter;
	}

	@Nonnull
	private PasswordManager getPasswordManager() {
		return this.passwordManager;
	}

	@Nonnull
	private CleanupCoordinator getCleanupCoordinator() {
		return this.cleanupCoordinator;
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
