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

/**
 * Email and password pair, used both to create an account and to recover its id.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record AccountCredentialsRequest(
		@Nullable String email,
		@Nullable @SensitiveValue String password
) {}
