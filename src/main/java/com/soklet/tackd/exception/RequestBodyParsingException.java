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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.lang.reflect.Type;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when a JSON request body cannot be turned into the type a resource method expects.
 * <p>
 * Only the target type is kept. Bodies can carry passwords, so they never travel with the exception.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class RequestBodyParsingException extends RuntimeException {
	@NonNull
	private final Type requestBodyType;

	public RequestBodyParsingException(@NonNull Type requestBodyType,
																		 @Nullable Throwable cause) {
		super(format("Unable to parse request body as %s", requireNonNull(requestBodyType).getTypeName()), cause);
		this.requestBodyType = requestBodyType;
	}

	@NonNull
	public Type getRequestBodyType() {
		return this.requestBodyType;
	}
}
