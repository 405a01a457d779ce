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


package com.soklet.tackd.model.api.request;

import com.soklet.tackd.annotation.SensitiveValue;
import org.jspecify.annotations.Nullable;

import java.util.UUID;

/**
 * A download attempt: the link being followed plus whatever secrets the caller presented with it.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record UploadDownloadRequest(
		@Nullable UUID linkId,
		@Nullable @SensitiveValue String key,
		@Nullable @SensitiveValue String password
) {
	@Override
	public String toString() {
		return String.format("%s{linkId=%s, key=%s, password=%s}", UploadDownloadRequest.class.getSimpleName(), linkId(),
				key() == null ? null : "[REDACTED]", password() == null ? null : "[REDACTED]");
	}
}
