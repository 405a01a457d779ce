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


package com.soklet.tackd.annotation;

import com.soklet.tackd.model.db.Role.Permission;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Resource Method as requiring a caller whose role grants every listed permission.
 * <p>
 * With no permissions listed, any authenticated account is sufficient.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface AuthorizationRequired {
	Permission[] value() default {};

	// Owner-scoped operations need an account to scope by, not just a permitted role
	boolean accountRequired() default true;
}
