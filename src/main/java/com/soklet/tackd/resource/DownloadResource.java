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
import com.soklet.Response;
import com.soklet.annotation.GET;
import com.soklet.annotation.PathParameter;
import com.soklet.annotation.QueryParameter;
import com.soklet.tackd.exception.NotFoundException;
import com.soklet.tackd.model.api.request.UploadDownloadRequest;
import com.soklet.tackd.service.UploadService;
import com.soklet.tackd.service.UploadService.DownloadedUpload;
import com.soklet.tackd.util.ContentTypeDetector;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Serves download links. Every failure is a plain 404.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class DownloadResource {
	@Nonnull
	private final UploadService uploadService;

	@Inject
	public DownloadResource(@Nonnull UploadService uploadService) {
		requireNonNull(uploadService);
		this.uploadService = uploadService;
	}

	/**
	 * {@code name} is either the link id or a cosmetic filename, in which case the link id travels as {@code id}.
	 */
	@Nonnull
	@GET("/download/{name}")
	public Response download(@Nonnull @PathParameter String name,
													 @Nullable @QueryParameter(optional = true) String id,
													 @Nullable @QueryParameter(optional = true) String key,
													 @Nullable @QueryParameter(name = "pwd", optional = true) String pwd,
													 @Nullable @QueryParameter(name = "password", optional = true) String password) {
		requireNonNull(name);

		UUID linkId = parseLinkId(id == null ? name : id);

		if (linkId == null)
			throw new NotFoundException();

		DownloadedUpload downloadedUpload = getUploadService().downloadUpload(new UploadDownloadRequest(linkId, key, pwd == null ? password : pwd));

		String contentType = ContentTypeDetector.UNKNOWN_CONTENT_TYPE.equals(downloadedUpload.contentType())
				? "application/octet-stream" : downloadedUpload.contentType();

		Map<String, Set<String>> headers = downloadedUpload.filename() == null
				? Map.of("Content-Type", Set.of(contentType))
				: Map.of("Content-Type", Set.of(contentType),
				"Content-Disposition", Set.of(format("inline; filename=\"%s\"", downloadedUpload.filename())));

		return Response.withStatusCode(200)
				.headers(headers)
				.body(downloadedUpload.payload())
				.build();
	}

	@Nullable
	protected UUID parseLinkId(@Nonnull String linkId) {
		requireNonNull(linkId);

		try {
			return UUID.fromString(linkId);
		} catch (IllegalArgumentException e) {
			return null;
		}
	}

	@Nonnull
	private UploadService getUploadService() {
		return this.uploadService;
	}
}
