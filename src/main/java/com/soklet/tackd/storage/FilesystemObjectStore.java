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


package com.soklet.tackd.storage;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link ObjectStore} that keeps each blob in its own file under a root directory.
 * <p>
 * Alongside {@code <id>.blob} sits {@code <id>.properties}, holding the content type and caller metadata.
 * Blobs are written to a temporary file, forced to disk and moved into place so readers never observe a partial
 * write. Temporary files from a failed write are removed before the failure propagates.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class FilesystemObjectStore implements ObjectStore {
	@NonNull
	private static final Pattern SAFE_ID_PATTERN;
	@NonNull
	private static final String CONTENT_TYPE_PROPERTY;

	static {
		SAFE_ID_PATTERN = Pattern.compile("^[A-Za-z0-9-]{1,128}$");
		CONTENT_TYPE_PROPERTY = "content-type";
	}

	@NonNull
	private final Path directory;
	@NonNull
	private final Logger logger;

	public FilesystemObjectStore(@NonNull Path directory) {
		requireNonNull(directory);

		this.directory = directory.toAbsolutePath().normalize();
		this.logger = LoggerFactory.getLogger(getClass());

		try {
			Files.createDirectories(this.directory);
		} catch (IOException e) {
			throw new UncheckedIOException(format("Unable to create object store directory %s", this.directory), e);
		}

		getLogger().info("Storing objects under {}", this.directory);
	}

	@NonNull
	@Override
	public String put(@NonNull String id,
										@NonNull byte[] bytes,
										@NonNull String contentType,
										@NonNull Map<@NonNull String, @NonNull String> metadata) {
		requireNonNull(id);
		requireNonNull(bytes);
		requireNonNull(contentType);
		requireNonNull(metadata);

		validateId(id);

		Properties properties = new Properties();
		properties.putAll(metadata);
		properties.setProperty(CONTENT_TYPE_PROPERTY, contentType);

		StringWriter propertiesWriter = new StringWriter();

		try {
			properties.store(propertiesWriter, null);
		} catch (IOException e) {
			throw new UncheckedIOException(format("Unable to serialize metadata for object %s", id), e);
		}

		Path propertiesFile = null;
		Path blobFile = null;

		try {
			propertiesFile = Files.createTempFile(getDirectory(), id, ".properties.tmp");
			writeAndForce(propertiesFile, propertiesWriter.toString().getBytes(StandardCharsets.UTF_8));

			blobFile = Files.createTempFile(getDirectory(), id, ".blob.tmp");
			writeAndForce(blobFile, bytes);

			moveIntoPlace(propertiesFile, propertiesPath(id));
			moveIntoPlace(blobFile, blobPath(id));
		} catch (IOException e) {
			throw new UncheckedIOException(format("Unable to write object %s", id), e);
		} finally {
			// Only left behind if the write failed before its move
			deleteTemporaryFile(propertiesFile);
			deleteTemporaryFile(blobFile);
		}

		return id;
	}

	@NonNull
	@Override
	public Optional<byte[]> get(@NonNull String id) {
		requireNonNull(id);

		Path blobFile = blobPath(id);

		if (!Files.isRegularFile(blobFile))
			return Optional.empty();

		try {
			return Optional.of(Files.readAllBytes(blobFile));
		} catch (IOException e) {
			throw new UncheckedIOException(format("Unable to read object %s", id), e);
		}
	}

	@Override
	public void delete(@NonNull String id) {
		requireNonNull(id);

		try {
			Files.deleteIfExists(blobPath(id));
			Files.deleteIfExists(propertiesPath(id));
		} catch (IOException e) {
			throw new UncheckedIOException(format("Unable to delete object %s", id), e);
		}
	}

	// Content type is authoritative in the metadata database; this copy lets a blob be identified by hand
	@NonNull
	Optional<String> getContentType(@NonNull String id) {
		requireNonNull(id);

		Path propertiesFile = propertiesPath(id);

		if (!Files.isRegularFile(propertiesFile))
			return Optional.empty();

		Properties properties = new Properties();

		try (BufferedReader reader = Files.newBufferedReader(propertiesFile, StandardCharsets.UTF_8)) {
			properties.load(reader);
		} catch (IOException e) {
			throw new UncheckedIOException(format("Unable to read metadata for object %s", id), e);
		}

		return Optional.ofNullable(properties.getProperty(CONTENT_TYPE_PROPERTY));
	}

	private void writeAndForce(@NonNull Path file,
														 @NonNull byte[] bytes) throws IOException {
		try (FileChannel fileChannel = FileChannel.open(file, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
			ByteBuffer byteBuffer = ByteBuffer.wrap(bytes);

			while (byteBuffer.hasRemaining())
				fileChannel.write(byteBuffer);

			fileChannel.force(true);
		}
	}

	private void deleteTemporaryFile(@Nullable Path temporaryFile) {
		if (temporaryFile == null)
			return;

		try {
			Files.deleteIfExists(temporaryFile);
		} catch (IOException e) {
			getLogger().warn(format("Unable to delete temporary file %s", temporaryFile), e);
		}
	}

	private void moveIntoPlace(@NonNull Path source,
														 @NonNull Path target) throws IOException {
		try {
			Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		} catch (AtomicMoveNotSupportedException e) {
			Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	@NonNull
	private Path blobPath(@NonNull String id) {
		return getDirectory().resolve(validateId(id) + ".blob");
	}

	@NonNull
	private Path propertiesPath(@NonNull String id) {
		return getDirectory().resolve(validateId(id) + ".properties");
	}

	// Ids become filenames, so anything that could escape the directory is rejected
	@NonNull
	private String validateId(@NonNull String id) {
		if (!SAFE_ID_PATTERN.matcher(id).matches())
			throw new IllegalArgumentException(format("Illegal object id '%s'", id));

		return id;
	}

	@NonNull
	public Path getDirectory() {
		return this.directory;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
