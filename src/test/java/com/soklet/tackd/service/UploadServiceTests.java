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

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.pyranid.Database;
import com.soklet.tackd.App;
import com.soklet.tackd.Configuration;
import com.soklet.tackd.MutableClock;
import com.soklet.tackd.crypto.EncryptionDescriptor.Mode;
import com.soklet.tackd.exception.ApplicationException;
import com.soklet.tackd.exception.NotFoundException;
import com.soklet.tackd.model.api.request.AccountCredentialsRequest;
import com.soklet.tackd.model.api.request.UploadCreateRequest;
import com.soklet.tackd.model.api.request.UploadDownloadRequest;
import com.soklet.tackd.model.db.Upload;
import com.soklet.tackd.service.UploadService.CreatedLink;
import com.soklet.tackd.service.UploadService.DownloadedUpload;
import com.soklet.tackd.service.UploadService.SavedUpload;
import com.soklet.tackd.storage.MemoryObjectStore;
import com.soklet.tackd.storage.ObjectStore;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static java.lang.String.format;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class UploadServiceTests {
	@Test
	public void testBurnAfterReading() {
		App app = new App(new Configuration("test"));
		UploadService uploadService = app.getInjector().getInstance(UploadService.class);
		MemoryObjectStore objectStore = (MemoryObjectStore) app.getInjector().getInstance(ObjectStore.class);

		// No read limit and no expiry means a single read
		SavedUpload savedUpload = uploadService.createUpload(uploadRequest("read me once", null, null, null));

		Assertions.assertEquals(1, savedUpload.maxReads(), "Default upload should allow exactly one read");
		Assertions.assertNotNull(savedUpload.key(), "Anonymous encrypted uploads must return their data key");
		Assertions.assertTrue(savedUpload.url().startsWith("https://tackd.test/download/" + savedUpload.linkId()),
				"Download URL is malformed");
		Assertions.assertTrue(savedUpload.url().contains("key=" + savedUpload.key()), "Download URL is missing the key");

		DownloadedUpload downloadedUpload = uploadService.downloadUpload(downloadRequest(savedUpload.linkId(), savedUpload.key(), null));

		Assertions.assertEquals("read me once", new String(downloadedUpload.payload(), StandardCharsets.UTF_8), "Payload doesn't match");
		Assertions.assertThrows(NotFoundException.class,
				() -> uploadService.downloadUpload(downloadRequest(savedUpload.linkId(), savedUpload.key(), null)),
				"Second read should not be possible");

		Upload upload = uploadService.findUploadById(savedUpload.uploadId()).get();

		Assertions.assertFalse(upload.active(), "Upload should be inactive after its last read");
		Assertions.assertEquals(1, upload.readCount(), "Read count is wrong");
		Assertions.assertTrue(objectStore.get(savedUpload.uploadId().toString()).isEmpty(), "Blob should be deleted after the last read");
	}

	@Test
	public void testReadLimit() {
		App app = new App(new Configuration("test"));
		UploadService uploadService = app.getInjector().getInstance(UploadService.class);

		SavedUpload savedUpload = uploadService.createUpload(uploadRequest("three reads", 3, null, null));

		for (int i = 0; i < 3; ++i)
			uploadService.downloadUpload(downloadRequest(savedUpload.linkId(), savedUpload.key(), null));

		Assertions.assertThrows(NotFoundException.class,
				() -> uploadService.downloadUpload(downloadRequest(savedUpload.linkId(), savedUpload.key(), null)),
				"Fourth read should not be possible");

		Assertions.assertEquals(3, uploadService.findUploadById(savedUpload.uploadId()).get().readCount(), "Read count is wrong");
		Assertions.assertEquals(3, uploadService.findLinkById(savedUpload.linkId()).get().readCount(), "Link read count is wrong");
	}

	@Test
	public void testWrongKeyDoesNotConsumeARead() {
		App app = new App(new Configuration("test"));
		UploadService uploadService = app.getInjector().getInstance(UploadService.class);

		SavedUpload savedUpload = uploadService.createUpload(uploadRequest("guarded", null, null, null));
		String wrongKey = "00000000000000000000000000000000";

		Assertions.assertThrows(NotFoundException.class,
				() -> uploadService.downloadUpload(downloadRequest(savedUpload.linkId(), wrongKey, null)),
				"Wrong data key should look like a missing upload");
		Assertions.assertThrows(NotFoundException.class,
				() -> uploadService.downloadUpload(downloadRequest(savedUpload.linkId(), null, null)),
				"Missing data key should look like a missing upload");
		Assertions.assertThrows(NotFoundException.class,
				() -> uploadService.downloadUpload(downloadRequest(UUID.randomUUID(), savedUpload.key(), null)),
				"Unknown link should be not found");

		// The single read is still available
		DownloadedUpload downloadedUpload = uploadService.downloadUpload(downloadRequest(savedUpload.linkId(), savedUpload.key(), null));
		Assertions.assertEquals("guarded", new String(downloadedUpload.payload(), StandardCharsets.UTF_8), "Payload doesn't match");
	}

	@Test
	public void testPasswordProtectedUpload() {
		App app = new App(new Configuration("test"));
		UploadService uploadService = app.getInjector().getInstance(UploadService.class);

		SavedUpload savedUpload = uploadService.createUpload(uploadRequest("behind a password", null, null, "open sesame"));

		Assertions.assertThrows(NotFoundException.class,
				() -> uploadService.downloadUpload(downloadRequest(savedUpload.linkId(), savedUpload.key(), "open barley")),
				"Wrong password should look like a missing upload");
		Assertions.assertThrows(NotFoundException.class,
				() -> uploadService.downloadUpload(downloadRequest(savedUpload.linkId(), savedUpload.key(), null)),
				"Missing password should look like a missing upload");

		DownloadedUpload downloadedUpload = uploadService.downloadUpload(downloadRequest(savedUpload.linkId(), savedUpload.key(), "open sesame"));
		Assertions.assertEquals("behind a password", new String(downloadedUpload.payload(), StandardCharsets.UTF_8), "Payload doesn't match");
	}

	@Test
	public void testExpiry() {
		MutableClock clock = new MutableClock();
		App app = new App(new Configuration("test"), clockModule(clock));
		UploadService uploadService = app.getInjector().getInstance(UploadService.class);

		// An expiry on its own means unlimited reads until then
		SavedUpload savedUpload = uploadService.createUpload(uploadRequest("good for ten minutes", null, "10m", null));

		Assertions.assertEquals(UploadService.UNLIMITED_READS, savedUpload.maxReads(), "Expiry-only upload should allow unlimited reads");
		Assertions.assertEquals(clock.instant().plus(Duration.ofMinutes(10)), savedUpload.expiresAt(), "Expiry is wrong");

		for (int i = 0; i < 5; ++i)
			uploadService.downloadUpload(downloadRequest(savedUpload.linkId(), savedUpload.key(), null));

		clock.advance(Duration.ofMinutes(11));

		Assertions.assertThrows(NotFoundException.class,
				() -> uploadService.downloadUpload(downloadRequest(savedUpload.linkId(), savedUpload.key(), null)),
				"Expired upload should not be readable");
	}

	@Test
	public void testExpiryIsClampedToMaximumRetention() {
		App app = new App(new Configuration("test"));
		UploadService uploadService = app.getInjector().getInstance(UploadService.class);
		Configuration configuration = app.getConfiguration();

		SavedUpload savedUpload = uploadService.createUpload(uploadRequest("forever, please", 1, "100y", null));
		Upload upload = uploadService.findUploadById(savedUpload.uploadId()).get();

		Assertions.assertEquals(configuration.getMaximumRetention().getSeconds(), upload.maxSeconds(), "Expiry was not clamped");
		Assertions.assertEquals("100y", upload.expiresParameter(), "Requested expiry should be kept as-is");
	}

	@Test
	public void testInvalidUploads() {
		App app = new App(new Configuration("test"));
		UploadService uploadService = app.getInjector().getInstance(UploadService.class);

		ApplicationException emptyException = Assertions.assertThrows(ApplicationException.class,
				() -> uploadService.createUpload(uploadRequest("", null, null, null)), "Empty upload should be rejected");
		Assertions.assertEquals(422, emptyException.getStatusCode(), "Wrong status for empty upload");

		ApplicationException expiryException = Assertions.assertThrows(ApplicationException.class,
				() -> uploadService.createUpload(uploadRequest("hello", null, "next tuesday", null)), "Bad expiry should be rejected");
		Assertions.assertEquals(422, expiryException.getStatusCode(), "Wrong status for bad expiry");
		Assertions.assertTrue(expiryException.getFieldErrors().containsKey("expires"), "Missing 'expires' field error");

		byte[] oversizedPayload = new byte[app.getConfiguration().getUploadLimitInBytes() + 1];

		ApplicationException sizeException = Assertions.assertThrows(ApplicationException.class,
				() -> uploadService.createUpload(new UploadCreateRequest(oversizedPayload, null, null, null, null, null, null, null, null, null)),
				"Oversized upload should be rejected");
		Assertions.assertEquals(413, sizeException.getStatusCode(), "Wrong status for oversized upload");
		Assertions.assertEquals(app.getConfiguration().getUploadLimitInBytes(), sizeException.getMetadata().get("uploadLimitInBytes"),
				"Upload limit should be reported");
	}

	@Test
	public void testManagedUploadLinks() {
		App app = new App(new Configuration("test"));
		UploadService uploadService = app.getInjector().getInstance(UploadService.class);
		AccountService accountService = app.getInjector().getInstance(AccountService.class);

		UUID ownerAccountId = accountService.createAccount(new AccountCredentialsRequest("owner@tackd.test", "owner-password"));
		UUID otherAccountId = accountService.createAccount(new AccountCredentialsRequest("other@tackd.test", "other-password"));

		SavedUpload savedUpload = uploadService.createUpload(uploadRequest("owned", 10, null, null).withOwnerAccountId(ownerAccountId));
		Upload upload = uploadService.findUploadById(savedUpload.uploadId()).get();

		Assertions.assertEquals(Mode.MANAGED, upload.encryptionMode(), "Owned uploads should have server-managed keys");
		Assertions.assertEquals(2, upload.wrappedKeyVersion(), "Data key should be wrapped under the latest key version");
		Assertions.assertNotNull(savedUpload.key(), "Managed links should carry an unlock key");

		Assertions.assertThrows(NotFoundException.class,
				() -> uploadService.downloadUpload(downloadRequest(savedUpload.linkId(), null, null)),
				"Managed link without its unlock key should be not found");

		uploadService.downloadUpload(downloadRequest(savedUpload.linkId(), savedUpload.key(), null));

		// A second link has its own key; the first link's key does not open it
		CreatedLink createdLink = uploadService.createLink(savedUpload.uploadId(), ownerAccountId, List.of("second"));

		Assertions.assertNotEquals(savedUpload.key(), createdLink.key(), "Links should not share unlock keys");
		Assertions.assertThrows(NotFoundException.class,
				() -> uploadService.downloadUpload(downloadRequest(createdLink.link().linkId(), savedUpload.key(), null)),
				"Another link's key should not work");

		uploadService.downloadUpload(downloadRequest(createdLink.link().linkId(), createdLink.key(), null));

		Assertions.assertEquals(2, uploadService.findLinksByUploadId(savedUpload.uploadId()).size(), "Wrong number of links");
		Assertions.assertEquals(2, uploadService.findUploadById(savedUpload.uploadId()).get().readCount(),
				"Reads through every link count against the upload");

		// Only the owner can see or manage it
		Assertions.assertEquals(1, uploadService.findUploadsByOwnerAccountId(ownerAccountId).size(), "Owner should see the upload");
		Assertions.assertTrue(uploadService.findUploadsByOwnerAccountId(otherAccountId).isEmpty(), "Others should not see the upload");
		Assertions.assertThrows(NotFoundException.class, () -> uploadService.createLink(savedUpload.uploadId(), otherAccountId, null),
				"Others should not be able to add links");
		Assertions.assertFalse(uploadService.deleteUpload(savedUpload.uploadId(), otherAccountId), "Others should not be able to delete");

		Assertions.assertTrue(uploadService.deleteUpload(savedUpload.uploadId(), ownerAccountId), "Owner should be able to delete");
		Assertions.assertThrows(NotFoundException.class,
				() -> uploadService.downloadUpload(downloadRequest(createdLink.link().linkId(), createdLink.key(), null)),
				"Deleted upload should be not found");
		Assertions.assertFalse(uploadService.deleteUpload(savedUpload.uploadId(), ownerAccountId), "Deletion is terminal");
	}

	@Test
	public void testUnmanagedUploadsCannotGainLinks() {
		App app = new App(new Configuration("test"));
		UploadService uploadService = app.getInjector().getInstance(UploadService.class);
		AccountService accountService = app.getInjector().getInstance(AccountService.class);

		UUID ownerAccountId = accountService.createAccount(new AccountCredentialsRequest("owner@tackd.test", "owner-password"));
		Database database = app.getInjector().getInstance(Database.class);

		SavedUpload savedUpload = uploadService.createUpload(uploadRequest("anonymous", null, null, null));

		// Claim the anonymous upload so ownership isn't what stops the link
		database.execute("UPDATE upload SET owner_account_id=? WHERE upload_id=?", ownerAccountId, savedUpload.uploadId());

		ApplicationException exception = Assertions.assertThrows(ApplicationException.class,
				() -> uploadService.createLink(savedUpload.uploadId(), ownerAccountId, null), "Unmanaged upload should not gain links");
		Assertions.assertEquals(422, exception.getStatusCode(), "Wrong status code");
	}

	@Test
	public void testRolledBackUploadLeavesNoBlob() {
		App app = new App(new Configuration("test"));
		UploadService uploadService = app.getInjector().getInstance(UploadService.class);
		MemoryObjectStore objectStore = (MemoryObjectStore) app.getInjector().getInstance(ObjectStore.class);
		Database database = app.getInjector().getInstance(Database.class);

		Assertions.assertThrows(RuntimeException.class, () -> database.transaction(() -> {
			uploadService.createUpload(uploadRequest("doomed", null, null, null));
			failTransaction();
		}), "Transaction should have failed");

		Assertions.assertEquals(0, objectStore.size(), "Blob should be deleted when its transaction rolls back");
	}

	@Test
	public void testConcurrentReadsNeverExceedLimit() throws Exception {
		App app = new App(new Configuration("test"));
		UploadService uploadService = app.getInjector().getInstance(UploadService.class);

		SavedUpload savedUpload = uploadService.createUpload(uploadRequest("contended", 2, null, null));
		ExecutorService executorService = Executors.newFixedThreadPool(8);

		try {
			List<Callable<Boolean>> downloads = new ArrayList<>();

			for (int i = 0; i < 16; ++i)
				downloads.add(() -> {
					try {
						uploadService.downloadUpload(downloadRequest(savedUpload.linkId(), savedUpload.key(), null));
						return true;
					} catch (RuntimeException e) {
						return false;
					}
				});

			int successfulDownloads = 0;

			for (Future<Boolean> future : executorService.invokeAll(downloads))
				if (future.get())
					++successfulDownloads;

			Assertions.assertTrue(successfulDownloads >= 1, "At least one download should have succeeded");
			Assertions.assertTrue(successfulDownloads <= 2, "Downloads exceeded the read limit");
			Assertions.assertTrue(uploadService.findUploadById(savedUpload.uploadId()).get().readCount() <= 2, "Read count exceeded the limit");
		} finally {
			executorService.shutdownNow();
			executorService.awaitTermination(10, TimeUnit.SECONDS);
		}
	}

	@Test
	public void testPlaintextDeployment() {
		App app = new App(configuration(false, false));
		UploadService uploadService = app.getInjector().getInstance(UploadService.class);
		AccountService accountService = app.getInjector().getInstance(AccountService.class);
		MemoryObjectStore objectStore = (MemoryObjectStore) app.getInjector().getInstance(ObjectStore.class);
		UUID ownerAccountId = accountService.createAccount(new AccountCredentialsRequest("owner@tackd.test", "owner-password"));

		SavedUpload anonymousUpload = uploadService.createUpload(uploadRequest("stored in the clear", null, null, null));
		SavedUpload ownedUpload = uploadService.createUpload(uploadRequest("owned in the clear", null, null, null)
				.withOwnerAccountId(ownerAccountId));

		for (SavedUpload savedUpload : List.of(anonymousUpload, ownedUpload)) {
			Upload upload = uploadService.findUploadById(savedUpload.uploadId()).get();

			Assertions.assertEquals(Mode.NONE, upload.encryptionMode(), "Uploads should not be encrypted");
			Assertions.assertNull(savedUpload.key(), "Plaintext uploads have no key to hand out");
			Assertions.assertFalse(savedUpload.url().contains("key="), "Download URL should not carry a key");
		}

		Assertions.assertEquals("stored in the clear", new String(objectStore.get(anonymousUpload.uploadId().toString()).get(),
				StandardCharsets.UTF_8), "Blob should hold the payload as-is");

		DownloadedUpload anonymousDownload = uploadService.downloadUpload(downloadRequest(anonymousUpload.linkId(), null, null));
		DownloadedUpload ownedDownload = uploadService.downloadUpload(downloadRequest(ownedUpload.linkId(), null, null));

		Assertions.assertEquals("stored in the clear", new String(anonymousDownload.payload(), StandardCharsets.UTF_8),
				"Anonymous payload doesn't match");
		Assertions.assertEquals("owned in the clear", new String(ownedDownload.payload(), StandardCharsets.UTF_8),
				"Owned payload doesn't match");
		Assertions.assertThrows(NotFoundException.class,
				() -> uploadService.downloadUpload(downloadRequest(anonymousUpload.linkId(), null, null)),
				"Read limit still applies without encryption");
	}

	@Test
	public void testIgnoredLinkKeys() {
		App app = new App(configuration(true, true));
		UploadService uploadService = app.getInjector().getInstance(UploadService.class);
		AccountService accountService = app.getInjector().getInstance(AccountService.class);
		UUID ownerAccountId = accountService.createAccount(new AccountCredentialsRequest("owner@tackd.test", "owner-password"));

		SavedUpload ownedUpload = uploadService.createUpload(uploadRequest("no link key", 5, null, null).withOwnerAccountId(ownerAccountId));
		Upload upload = uploadService.findUploadById(ownedUpload.uploadId()).get();

		Assertions.assertEquals(Mode.MANAGED, upload.encryptionMode(), "Owned uploads should still be encrypted");
		Assertions.assertTrue(upload.ignoreLinkKey(), "Upload should record that link keys are ignored");
		Assertions.assertNull(ownedUpload.key(), "Links should be minted without an unlock key");
		Assertions.assertNull(uploadService.findLinkById(ownedUpload.linkId()).get().keyHash(), "No key hash should be stored");

		DownloadedUpload downloadedUpload = uploadService.downloadUpload(downloadRequest(ownedUpload.linkId(), null, null));
		Assertions.assertEquals("no link key", new String(downloadedUpload.payload(), StandardCharsets.UTF_8), "Payload doesn't match");

		CreatedLink createdLink = uploadService.createLink(ownedUpload.uploadId(), ownerAccountId, null);
		Assertions.assertNull(createdLink.key(), "Additional links should be minted without an unlock key");
		uploadService.downloadUpload(downloadRequest(createdLink.link().linkId(), null, null));

		// Anonymous uploads are still locked by their data key
		SavedUpload anonymousUpload = uploadService.createUpload(uploadRequest("data key still needed", null, null, null));

		Assertions.assertNotNull(anonymousUpload.key(), "Anonymous uploads must still return their data key");
		Assertions.assertThrows(NotFoundException.class,
				() -> uploadService.downloadUpload(downloadRequest(anonymousUpload.linkId(), null, null)),
				"Anonymous upload should not open without its data key");
		uploadService.downloadUpload(downloadRequest(anonymousUpload.linkId(), anonymousUpload.key(), null));
	}

	@Test
	public void testOversizedClientMetadata() {
		App app = new App(new Configuration("test"));
		UploadService uploadService = app.getInjector().getInstance(UploadService.class);

		String userAgent = "Agent/" + "a".repeat(2_000);
		String forwardedFor = "10.0.0.1, ".repeat(300).trim();
		String declaredContentType = "application/" + "x".repeat(300);
		String longTag = "t".repeat(5_000);

		SavedUpload savedUpload = uploadService.createUpload(new UploadCreateRequest("oversized headers".getBytes(StandardCharsets.UTF_8),
				declaredContentType, null, longTag + ",short", null, null, null, userAgent, forwardedFor, null));

		Upload upload = uploadService.findUploadById(savedUpload.uploadId()).get();

		Assertions.assertEquals(userAgent.substring(0, 1024), upload.userAgent(), "User agent should be cut to fit");
		Assertions.assertEquals(forwardedFor.substring(0, 1024), upload.forwardedFor(), "Forwarded-for chain should be cut to fit");
		Assertions.assertEquals("text/plain", upload.contentType(), "Oversized declared content type should be ignored");
		Assertions.assertEquals("[\"" + "t".repeat(64) + "\",\"short\"]", upload.tags(), "Long tag should be cut short");

		DownloadedUpload downloadedUpload = uploadService.downloadUpload(downloadRequest(savedUpload.linkId(), savedUpload.key(), null));
		Assertions.assertEquals("oversized headers", new String(downloadedUpload.payload(), StandardCharsets.UTF_8), "Payload doesn't match");
	}

	@Test
	public void testTagsTooLongToStore() {
		App app = new App(new Configuration("test"));
		UploadService uploadService = app.getInjector().getInstance(UploadService.class);
		AccountService accountService = app.getInjector().getInstance(AccountService.class);
		MemoryObjectStore objectStore = (MemoryObjectStore) app.getInjector().getInstance(ObjectStore.class);
		UUID ownerAccountId = accountService.createAccount(new AccountCredentialsRequest("owner@tackd.test", "owner-password"));

		// Quotes double in length once escaped as JSON
		List<String> tags = new ArrayList<>();

		for (int i = 0; i < 32; ++i)
			tags.add(format("%02d", i) + "\"".repeat(62));

		ApplicationException uploadException = Assertions.assertThrows(ApplicationException.class,
				() -> uploadService.createUpload(new UploadCreateRequest("tagged".getBytes(StandardCharsets.UTF_8), "text/plain", null,
						String.join(",", tags), null, null, null, "JUnit", null, null)), "Oversized tags should be rejected");

		Assertions.assertEquals(422, uploadException.getStatusCode(), "Bad status code");
		Assertions.assertTrue(uploadException.getFieldErrors().containsKey("tags"), "Missing 'tags' field error");
		Assertions.assertEquals(0, objectStore.size(), "Rejected upload should not write a blob");

		SavedUpload savedUpload = uploadService.createUpload(uploadRequest("owned", null, null, null).withOwnerAccountId(ownerAccountId));

		ApplicationException linkException = Assertions.assertThrows(ApplicationException.class,
				() -> uploadService.createLink(savedUpload.uploadId(), ownerAccountId, tags), "Oversized link tags should be rejected");
		Assertions.assertEquals(422, linkException.getStatusCode(), "Bad status code");

		ApplicationException apiKeyException = Assertions.assertThrows(ApplicationException.class,
				() -> accountService.createApiKey(ownerAccountId, tags), "Oversized API key tags should be rejected");
		Assertions.assertEquals(422, apiKeyException.getStatusCode(), "Bad status code");
	}

	@Test
	public void testSubSecondExpiryIsRejected() {
		App app = new App(new Configuration("test"));
		UploadService uploadService = app.getInjector().getInstance(UploadService.class);

		for (String expires : List.of("500ms", "0", "0s")) {
			ApplicationException applicationException = Assertions.assertThrows(ApplicationException.class,
					() -> uploadService.createUpload(uploadRequest("too brief", null, expires, null)),
					format("Expiry '%s' should be rejected", expires));

			Assertions.assertEquals(422, applicationException.getStatusCode(), "Bad status code");
			Assertions.assertTrue(applicationException.getFieldErrors().containsKey("expires"), "Missing 'expires' field error");
		}

		SavedUpload savedUpload = uploadService.createUpload(uploadRequest("brief", null, "1s", null));
		Assertions.assertEquals(1L, uploadService.findUploadById(savedUpload.uploadId()).get().maxSeconds(),
				"Shortest expiry should be one second");
	}

	private void failTransaction() {
		throw new IllegalStateException("Simulated failure after the blob was written");
	}

	@NonNull
	private UploadCreateRequest uploadRequest(@NonNull String payload,
																						@Nullable Integer reads,
																						@Nullable String expires,
																						@Nullable String password) {
		return new UploadCreateRequest(payload.getBytes(StandardCharsets.UTF_8), "text/plain", null, null, reads, expires,
				password, "JUnit", null, null);
	}

	@NonNull
	private UploadDownloadRequest downloadRequest(@NonNull UUID linkId,
																								@Nullable String key,
																								@Nullable String password) {
		return new UploadDownloadRequest(linkId, key, password);
	}

	@NonNull
	private Configuration configuration(@NonNull Boolean encryptData,
																			@NonNull Boolean ignoreLinkKey) {
		return new Configuration("test") {
			@NonNull
			@Override
			public Boolean getEncryptData() {
				return encryptData;
			}

			@NonNull
			@Override
			public Boolean getIgnoreLinkKey() {
				return ignoreLinkKey;
			}
		};
	}

	@NonNull
	private AbstractModule clockModule(@NonNull MutableClock clock) {
		return new AbstractModule() {
			@NonNull
			@Provides
			@Singleton
			public Clock provideClock() {
				return clock;
			}

			@Override
			protected void configure() {
				// Guice module configuration; nothing to do
			}
		};
	}
}
