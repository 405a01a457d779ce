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

package com.soklet.tackd.exception;

import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Thrown when an upload, link, account or API key cannot be produced for the caller.
 * <p>
 * On the download path every failure (missing, expired, wrong password, wrong key, undecryptable) collapses into this
 * exception so responses never reveal whether an object exists.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class NotFoundException extends RuntimeException {
	public NotFoundException() {
		super();
	}

	public NotFoundException(@Nullable String message) {
		super(message);
	}

	public NotFoundException(@Nullable String message,
													 @Nullable Throwable cause) {
		super(message, cause);
	}
}
