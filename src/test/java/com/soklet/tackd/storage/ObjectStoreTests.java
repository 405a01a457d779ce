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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ObjectStoreTests {
	@TempDir
	Path temporaryDirectory;

	@Test
	public void testMemoryObjectStore() {
		MemoryObjectStore objectStore = new MemoryObjectStore();
		exerciseObjectStore(objectStore);

		byte[] bytes = "mutable".getBytes(StandardCharsets.UTF_8);
		objectStore.put("copy-check", bytes, "text/plain", Map.of());
		bytes[0] = 'M';

		Assertions.assertEquals("mutable", new String(objectStore.get("copy-check").get(), StandardCharsets.UTF_8),
				"Stored bytes should not change when the caller's array does");
	}

	@Test
	public void testFilesystemObjectStore() {
		FilesystemObjectStore objectStore = new FilesystemObjectStore(this.temporaryDirectory.resolve("objects"));
		exerciseObjectStore(objectStore);

		String id = UUID.randomUUID().toString();
		objectStore.put(id, new byte[]{1, 2, 3}, "application/octet-stream", Map.of("filename", "data.bin"));

		Assertions.assertEquals("application/octet-stream", objectStore.getContentType(id).orElse(null), "Content type wasn't persisted");

		// A fresh instance over the same directory sees the same objects
		FilesystemObjectStore reopenedObjectStore = new FilesystemObjectStore(this.temporaryDirectory.resolve("objects"));
		Assertions.assertArrayEquals(new byte[]{1, 2, 3}, reopenedObjectStore.get(id).orElse(null), "Object did not survive reopening");
	}

	@Test
	public void testFilesystemObjectStoreRejectsPathTraversal() {
		FilesystemObjectStore objectStore = new FilesystemObjectStore(this.temporaryDirectory.resolve("objects"));

		Assertions.assertThrows(IllegalArgumentException.class, () -> objectStore.get("../escape"),
				"Ids that could escape the directory should be rejected");
		Assertions.assertThrows(IllegalArgumentException.class, () -> objectStore.put("a/b", new byte[0], "text/plain", Map.of()),
				"Ids containing separators should be rejected");
	}

	@Test
	public void testFilesystemObjectStoreCleansUpFailedWrites() throws IOException {
		Path directory = this.temporaryDirectory.resolve("objects");
		FilesystemObjectStore objectStore = new FilesystemObjectStore(directory);
		String id = UUID.randomUUID().toString();

		// A non-empty directory where the blob belongs makes the final move fail
		Path blockingDirectory = Files.createDirectories(directory.resolve(id + ".blob"));
		Files.write(blockingDirectory.resolve("occupant"), new byte[]{1});

		Assertions.assertThrows(UncheckedIOException.class, () -> objectStore.put(id, new byte[]{1, 2, 3}, "text/plain", Map.of()),
				"Write over a blocked path should fail");

		try (Stream<Path> paths = Files.list(directory)) {
			List<Path> temporaryFiles = paths.filter(path -> path.getFileName().toString().endsWith(".tmp")).collect(Collectors.toList());
			Assertions.assertEquals(List.of(), temporaryFiles, "Failed write left temporary files behind");
		}
	}

	private void exerciseObjectStore(ObjectStore objectStore) {
		String id = UUID.randomUUID().toString();
		byte[] bytes = "stored object".getBytes(StandardCharsets.UTF_8);

		Assertions.assertTrue(objectStore.get(id).isEmpty(), "Object should not exist yet");
		Assertions.assertEquals(id, objectStore.put(id, bytes, "text/plain", Map.of("linkId", UUID.randomUUID().toString())),
				"Put should return the id");
		Assertions.assertArrayEquals(bytes, objectStore.get(id).orElse(null), "Stored bytes don't match");

		byte[] replacementBytes = "replacement".getBytes(StandardCharsets.UTF_8);
		objectStore.put(id, replacementBytes, "text/plain", Map.of());
		Assertions.assertArrayEquals(replacementBytes, objectStore.get(id).orElse(null), "Put should replace existing objects");

		objectStore.delete(id);
		Assertions.assertTrue(objectStore.get(id).isEmpty(), "Object should be gone after delete");

		// Deleting again is a no-op
		objectStore.delete(id);
	}
}
