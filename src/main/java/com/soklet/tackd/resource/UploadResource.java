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
import com.soklet.annotation.QueryParameter;
import com.soklet.annotation.RequestBody;
import com.soklet.annotation.RequestHeader;
import com.soklet.tackd.CurrentContext;
import com.soklet.tackd.annotation.AuthorizationRequired;
import com.soklet.tackd.exception.NotFoundException;
import com.soklet.tackd.model.api.request.LinkCreateRequest;
import com.soklet.tackd.model.api.request.UploadCreateRequest;
import com.soklet.tackd.model.api.response.LinkResponse;
import com.soklet.tackd.model.api.response.LinkResponse.LinkResponseFactory;
import com.soklet.tackd.model.api.response.LinkResponse.LinksResponseHolder;
import com.soklet.tackd.model.api.response.UploadResponse.UploadResponseFactory;
import com.soklet.tackd.model.api.response.UploadResponse.UploadResponseHolder;
import com.soklet.tackd.model.api.response.UploadResponse.UploadsResponseHolder;
import com.soklet.tackd.model.db.Account;
import com.soklet.tackd.model.db.Role.Permission;
import com.soklet.tackd.model.db.Upload;
import com.soklet.tackd.service.UploadService;
import com.soklet.tackd.service.UploadService.CreatedLink;
import com.soklet.tackd.service.UploadService.SavedUpload;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Instant;
import java.util.UUID;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Contains Upload-related Resource Methods.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class UploadResource {
	@Nonnull
	private final UploadService uploadService;
	@Nonnull
	private final UploadResponseFactory uploadResponseFactory;
	@Nonnull
	private final LinkResponseFactory linkResponseFactory;
	@Nonnull
	private final Provider<CurrentContext> currentContextProvider;

	@Inject
	public UploadResource(@Nonnull UploadService uploadService,
												@Nonnull UploadResponseFactory uploadResponseFactory,
												@Nonnull LinkResponseFactory linkResponseFactory,
												@Nonnull Provider<CurrentContext> currentContextProvider) {
		requireNonNull(uploadService);
		requireNonNull(uploadResponseFactory);
		requireNonNull(linkResponseFactory);
		requireNonNull(currentContextProvider);

		this.uploadService = uploadService;
		this.uploadResponseFactory = uploadResponseFactory;
		this.linkResponseFactory = linkResponseFactory;
		this.currentContextProvider = currentContextProvider;
	}

	@Nonnull
	@AuthorizationRequired(value = Permission.CREATE, accountRequired = false)
	@POST("/upload")
	public Response createUpload(@Nullable @RequestBody(optional = true) byte[] payload,
															 @Nullable @RequestHeader(name = "Content-Type", optional = true) String contentType,
															 @Nullable @RequestHeader(name = "User-Agent", optional = true) String userAgent,
															 @Nullable @RequestHeader(name = "X-Forwarded-For", optional = true) String forwardedFor,
															 @Nullable @QueryParameter(optional = true) String filename,
															 @Nullable @QueryParameter(optional = true) String tags,
															 @Nullable @QueryParameter(optional = true) Integer reads,
															 @Nullable @QueryParameter(optional = true) String expires,
															 @Nullable @QueryParameter(name = "pwd", optional = true) String pwd,
															 @Nullable @QueryParameter(name = "password", optional = true) String password) {
		// Anonymous callers may upload too; their uploads are unowned
		Account account = getCurrentContext().getAccount().orElse(null);

		UploadCreateRequest request = new UploadCreateRequest(payload, contentType, filename, tags, reads, expires,
				pwd == null ? password : pwd, userAgent, forwardedFor, null)
				.withOwnerAccountId(account == null ? null : account.accountId());

		SavedUpload savedUpload = getUploadService().createUpload(request);

		return Response.withStatusCode(201)
				.body(new UploadSavedResponseHolder("Saved", savedUpload.url(), new UploadSavedData(savedUpload.linkId(),
						savedUpload.key(), savedUpload.expiresAt(), savedUpload.maxReads())))
				.build();
	}

	public record UploadSavedResponseHolder(
			@Nonnull String message,
			@Nonnull String url,
			@Nonnull UploadSavedData data
	) {
		public UploadSavedResponseHolder {
			requireNonNull(message);
			requireNonNull(url);
			requireNonNull(data);
		}
	}

	public record UploadSavedData(
			@Nonnull UUID id,
			@Nullable String key,
			@Nonnull Instant expires,
			@Nonnull Integer maxReads
	) {
		public UploadSavedData {
			requireNonNull(id);
			requireNonNull(expires);
			requireNonNull(maxReads);
		}
	}

	@Nonnull
	@AuthorizationRequired(Permission.LIST)
	@GET("/api/v1/uploads")
	public UploadsResponseHolder findUploads() {
		Account account = getCurrentContext().getAccount().get();

		return new UploadsResponseHolder(getUploadService().findUploadsByOwnerAccountId(account.accountId()).stream()
				.map(upload -> getUploadResponseFactory().create(upload))
				.collect(Collectors.toList()));
	}

	@Nonnull
	@AuthorizationRequired(Permission.LIST)
	@GET("/api/v1/uploads/{uploadId}")
	public UploadResponseHolder findUpload(@Nonnull @PathParameter UUID uploadId) {
		requireNonNull(uploadId);

		return new UploadResponseHolder(getUploadResponseFactory().create(findOwnedUpload(uploadId)));
	}

	@Nonnull
	@AuthorizationRequired(Permission.DELETE)
	@DELETE("/api/v1/uploads/{uploadId}")
	public UploadDeletedResponseHolder deleteUpload(@Nonnull @PathParameter UUID uploadId) {
		requireNonNull(uploadId);

		Account account = getCurrentContext().getAccount().get();

		if (!getUploadService().deleteUpload(uploadId, account.accountId()))
			throw new NotFoundException();

		return new UploadDeletedResponseHolder(true);
	}

	public record UploadDeletedResponseHolder(
			@Nonnull Boolean deleted
	) {
		public UploadDeletedResponseHolder {
			requireNonNull(deleted);
		}
	}

	@Nonnull
	@AuthorizationRequired(Permission.LIST)
	@GET("/api/v1/uploads/{uploadId}/links")
	public LinksResponseHolder findLinks(@Nonnull @PathParameter UUID uploadId) {
		requireNonNull(uploadId);

		Upload upload = findOwnedUpload(uploadId);

		return new LinksResponseHolder(getUploadService().findLinksByUploadId(upload.uploadId()).stream()
				.map(link -> getLinkResponseFactory().create(link))
				.collect(Collectors.toList()));
	}

	@Nonnull
	@AuthorizationRequired(Permission.CREATE)
	@POST("/api/v1/uploads/{uploadId}/links")
	public Response createLink(@Nonnull @PathParameter UUID uploadId,
														 @Nullable @RequestBody(optional = true) LinkCreateRequest request) {
		requireNonNull(uploadId);

		Account account = getCurrentContext().getAccount().get();
		CreatedLink createdLink = getUploadService().createLink(uploadId, account.accountId(), request == null ? null : request.tags());

		return Response.withStatusCode(201)
				.body(new LinkCreatedResponseHolder(getLinkResponseFactory().create(createdLink.link()), createdLink.key(), createdLink.url()))
				.build();
	}

	public record LinkCreatedResponseHolder(
			@Nonnull LinkResponse link,
			@Nullable String key,
			@Nonnull String url
	) {
		public LinkCreatedResponseHolder {
			requireNonNull(link);
			requireNonNull(url);
		}
	}

	// Someone else's upload looks exactly like a missing one
	@Nonnull
	protected Upload findOwnedUpload(@Nonnull UUID uploadId) {
		requireNonNull(uploadId);

		Account account = getCurrentContext().getAccount().get();
		return getUploadService().findOwnedUpload(uploadId, account.accountId()).orElseThrow(NotFoundException::new);
	}

	@Nonnull
	private UploadService getUploadService() {
		return this.uploadService;
	}

	@Nonnull
	private UploadResponseFactory getUploadResponseFactory() {
		return this.uploadResponseFactory;
	}

	@Nonnull
	private LinkResponseFactory getLinkResponseFactory() {
		return this.linkResponseFactory;
	}

	@Nonnull
	private CurrentContext getCurrentContext() {
		return this.currentContextProvider.get();
	}
}
