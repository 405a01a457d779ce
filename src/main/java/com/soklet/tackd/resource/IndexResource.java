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
import com.soklet.annotation.GET;
import com.soklet.tackd.Configuration;
import com.soklet.tackd.annotation.SuppressRequestLogging;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class IndexResource {
	@Nonnull
	private final Configuration configuration;

	@Inject
	public IndexResource(@Nonnull Configuration configuration) {
		requireNonNull(configuration);
		this.configuration = configuration;
	}

	@Nonnull
	@GET("/")
	public ServiceDescriptorResponseHolder index() {
		return new ServiceDescriptorResponseHolder("tackd", "Ephemeral, encrypted object sharing",
				getConfiguration().getBaseUrl(), getConfiguration().getUploadLimitInBytes());
	}

	public record ServiceDescriptorResponseHolder(
			@Nonnull String name,
			@Nonnull String description,
			@Nonnull String baseUrl,
			@Nonnull Integer uploadLimitInBytes
	) {
		public ServiceDescriptorResponseHolder {
			requireNonNull(name);
			requireNonNull(description);
			requireNonNull(baseUrl);
			requireNonNull(uploadLimitInBytes);
		}
	}

	// Load balancers poll this constantly
	@Nonnull
	@SuppressRequestLogging
	@GET("/health")
	public HealthResponseHolder health() {
		return new HealthResponseHolder("ok");
	}

	public record HealthResponseHolder(
			@Nonnull String status
	) {
		public HealthResponseHolder {
			requireNonNull(status);
		}
	}

	@Nonnull
	private Configuration getConfiguration() {
		return this.configuration;
	}
}
