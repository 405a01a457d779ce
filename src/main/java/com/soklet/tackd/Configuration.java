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

package com.soklet.tackd;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.soklet.tackd.crypto.KeyRegistry.RegistryKey;
import com.soklet.tackd.storage.ObjectStore;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Encapsulates system-wide configuration.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class Configuration {
	@Nonnull
	private static final Gson GSON;

	static {
		GSON = new GsonBuilder().disableHtmlEscaping().create();
	}

	@Nonnull
	private final String environment;
	@Nonnull
	private final Boolean runningInDocker;
	@Nonnull
	private final Boolean stopOnKeypress;
	@Nonnull
	private final Integer port;
	@Nonnull
	private final String baseUrl;
	@Nonnull
	private final Integer uploadLimitInBytes;
	@Nonnull
	private final Boolean encryptData;
	@Nonnull
	private final Boolean ignoreLinkKey;
	@Nonnull
	private final Integer defaultReads;
	@Nonnull
	private final Duration defaultRetention;
	@Nonnull
	private final Duration maximumRetention;
	@Nonnull
	private final Duration cleanupInterval;
	@Nonnull
	private final Duration staleLockThreshold;
	@Nonnull
	private final Integer cleanupBatchSize;
	@Nonnull
	private final List<RegistryKey> encryptionKeys;
	@Nonnull
	private final ObjectStore.Type objectStoreType;
	@Nullable
	private final Path objectStoreDirectory;
	@Nonnull
	private final Set<String> corsWhitelistedOrigins;

	public Configuration(@Nonnull String environment) {
		requireNonNull(environment);

		ConfigFile configFile = loadConfigFileForEnvironment(environment);

		this.environment = environment;
		this.runningInDocker = "true".equalsIgnoreCase(System.getenv("APP_RUNNING_IN_DOCKER"));
		this.stopOnKeypress = !this.runningInDocker;
		this.port = configFile.port();
		this.baseUrl = stripTrailingSlashes(configFile.baseUrl());
		this.uploadLimitInBytes = configFile.uploadLimitInBytes();
		this.encryptData = configFile.encryptData();
		this.ignoreLinkKey = configFile.ignoreLinkKey();
		this.defaultReads = configFile.defaultReads();
		this.defaultRetention = Duration.ofSeconds(configFile.defaultRetentionInSeconds());
		this.maximumRetention = Duration.ofSeconds(configFile.maximumRetentionInSeconds());
		this.cleanupInterval = Duration.ofSeconds(configFile.cleanup().intervalInSeconds());
		this.staleLockThreshold = Duration.ofSeconds(configFile.cleanup().staleLockThresholdInSeconds());
		this.cleanupBatchSize = configFile.cleanup().batchSize();
		this.encryptionKeys = configFile.encryptionKeys().stream()
				.map(encryptionKey -> new RegistryKey(encryptionKey.version(), encryptionKey.key()))
				.collect(Collectors.toUnmodifiableList());
		this.objectStoreType = configFile.objectStore().type();
		this.objectStoreDirectory = configFile.objectStore().directory() == null ? null : Path.of(configFile.objectStore().directory());
		this.corsWhitelistedOrigins = configFile.corsWhitelistedOrigins() == null ? Set.of() : Set.copyOf(configFile.corsWhitelistedOrigins());

		if (this.objectStoreType == ObjectStore.Type.FILESYSTEM && this.objectStoreDirectory == null)
			throw new IllegalStateException(format("A directory is required for the %s object store", this.objectStoreType.name()));

		if (this.defaultRetention.compareTo(this.maximumRetention) > 0)
			throw new IllegalStateException("Default retention cannot exceed maximum retention");

		// Initialize Logback if not done already
		if (System.getProperty("logback.configurationFile") == null)
			System.setProperty("logback.configurationFile", format("config/%s/logback.xml", environment));
	}

	@Nonnull
	private ConfigFile loadConfigFileForEnvironment(@Nonnull String environment) {
		Path configFile = Path.of(format("config/%s/settings.json", environment));

		if (!Files.isRegularFile(configFile))
			throw new IllegalArgumentException(format("Config file not found at %s", configFile.toAbsolutePath()));

		try {
			return GSON.fromJson(Files.readString(configFile, StandardCharsets.UTF_8), ConfigFile.class);
		} catch (IOException e) {
			throw new UncheckedIOException(format("Error reading from %s", configFile.toAbsolutePath()), e);
		}
	}

	@Nonnull
	private static String stripTrailingSlashes(@Nonnull String url) {
		requireNonNull(url);

		while (url.endsWith("/"))
			url = url.substring(0, url.length() - 1);

		return url;
	}

	// Record that maps to the config/{environment}/settings.json file format
	private record ConfigFile(
			@Nonnull Integer port,
			@Nonnull String baseUrl,
			@Nonnull Integer uploadLimitInBytes,
			@Nonnull Boolean encryptData,
			@Nonnull Boolean ignoreLinkKey,
			@Nonnull Integer defaultReads,
			@Nonnull Long defaultRetentionInSeconds,
			@Nonnull Long maximumRetentionInSeconds,
			@Nonnull ConfigCleanup cleanup,
			@Nonnull List<ConfigEncryptionKey> encryptionKeys,
			@Nonnull ConfigObjectStore objectStore,
			@Nullable Set<String> corsWhitelistedOrigins
	) {
		public ConfigFile {
			requireNonNull(port);
			requireNonNull(baseUrl);
			requireNonNull(uploadLimitInBytes);
			requireNonNull(encryptData);
			requireNonNull(ignoreLinkKey);
			requireNonNull(defaultReads);
			requireNonNull(defaultRetentionInSeconds);
			requireNonNull(maximumRetentionInSeconds);
			requireNonNull(cleanup);
			requireNonNull(encryptionKeys);
			requireNonNull(objectStore);
		}

		private record ConfigCleanup(
				@Nonnull Long intervalInSeconds,
				@Nonnull Long staleLockThresholdInSeconds,
				@Nonnull Integer batchSize
		) {
			public ConfigCleanup {
				requireNonNull(intervalInSeconds);
				requireNonNull(staleLockThresholdInSeconds);
				requireNonNull(batchSize);
			}
		}

		private record ConfigEncryptionKey(
				@Nonnull Integer version,
				@Nonnull String key
		) {
			public ConfigEncryptionKey {
				requireNonNull(version);
				requireNonNull(key);
			}
		}

		private record ConfigObjectStore(
				@Nonnull ObjectStore.Type type,
				@Nullable String directory
		) {
			public ConfigObjectStore {
				requireNonNull(type);
			}
		}
	}

	@Nonnull
	public String getEnvironment() {
		return this.environment;
	}

	@Nonnull
	public Boolean getRunningInDocker() {
		return this.runningInDocker;
	}

	@Nonnull
	public Boolean getStopOnKeypress() {
		return this.stopOnKeypress;
	}

	@Nonnull
	public Integer getPort() {
		return this.port;
	}

	@Nonnull
	public String getBaseUrl() {
		return this.baseUrl;
	}

	@Nonnull
	public Integer getUploadLimitInBytes() {
		return this.uploadLimitInBytes;
	}

	@Nonnull
	public Boolean getEncryptData() {
		return this.encryptData;
	}

	@Nonnull
	public Boolean getIgnoreLinkKey() {
		return this.ignoreLinkKey;
	}

	@Nonnull
	public Integer getDefaultReads() {
		return this.defaultReads;
	}

	@Nonnull
	public Duration getDefaultRetention() {
		return this.defaultRetention;
	}

	@Nonnull
	public Duration getMaximumRetention() {
		return this.maximumRetention;
	}

	@Nonnull
	public Duration getCleanupInterval() {
		return this.cleanupInterval;
	}

	@Nonnull
	public Duration getStaleLockThreshold() {
		return this.staleLockThreshold;
	}

	@Nonnull
	public Integer getCleanupBatchSize() {
		return this.cleanupBatchSize;
	}

	@Nonnull
	public List<RegistryKey> getEncryptionKeys() {
		return this.encryptionKeys;
	}

	@Nonnull
	public ObjectStore.Type getObjectStoreType() {
		return this.objectStoreType;
	}

	@Nonnull
	public Optional<Path> getObjectStoreDirectory() {
		return Optional.ofNullable(this.objectStoreDirectory);
	}

	@Nonnull
	public Set<String> getCorsWhitelistedOrigins() {
		return this.corsWhitelistedOrigins;
	}
}
