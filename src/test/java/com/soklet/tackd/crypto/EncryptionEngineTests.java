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


package com.soklet.tackd.crypto;

import com.soklet.tackd.crypto.EncryptionDescriptor.Mode;
import com.soklet.tackd.crypto.EncryptionEngine.SealedPayload;
import com.soklet.tackd.crypto.KeyRegistry.RegistryKey;
import com.soklet.tackd.exception.CryptoException;
import com.soklet.tackd.util.ContentTypeDetector;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class EncryptionEngineTests {
	private static final String FIRST_KEY = "first-encryption-key-version-001";
	private static final String SECOND_KEY = "second-encryption-key-version-02";

	@Test
	public void testUnencryptedPayloadIsStoredAsIs() {
		EncryptionEngine encryptionEngine = createEncryptionEngine(List.of(new RegistryKey(1, FIRST_KEY)));
		byte[] payload = "plain old text".getBytes(StandardCharsets.UTF_8);

		SealedPayload sealedPayload = encryptionEngine.create(payload, "text/plain", null, false, false);

		Assertions.assertEquals(Mode.NONE, sealedPayload.encryptionDescriptor().mode(), "Wrong encryption mode");
		Assertions.assertNull(sealedPayload.dataKey(), "Unencrypted payloads should not have a data key");
		Assertions.assertArrayEquals(payload, sealedPayload.storedBytes(), "Stored bytes should match the payload");
		Assertions.assertArrayEquals(payload, encryptionEngine.decrypt(sealedPayload.storedBytes(),
				sealedPayload.encryptionDescriptor(), null), "Decrypted bytes don't match");
	}

	@Test
	public void testUnmanagedPayloadRequiresTheDataKey() {
		EncryptionEngine encryptionEngine = createEncryptionEngine(List.of(new RegistryKey(1, FIRST_KEY)));
		byte[] payload = "unmanaged secret".getBytes(StandardCharsets.UTF_8);

		SealedPayload sealedPayload = encryptionEngine.create(payload, "text/plain", null, false, true);

		Assertions.assertEquals(Mode.UNMANAGED, sealedPayload.encryptionDescriptor().mode(), "Wrong encryption mode");
		Assertions.assertNotNull(sealedPayload.dataKey(), "Unmanaged payloads must hand back a data key");
		Assertions.assertEquals(EncryptionEngine.KEY_LENGTH_IN_BYTES, sealedPayload.dataKey().length(), "Wrong data key length");
		Assertions.assertNull(sealedPayload.encryptionDescriptor().wrappedKey(), "Unmanaged payloads must not carry a wrapped key");
		Assertions.assertFalse(new String(sealedPayload.storedBytes(), StandardCharsets.UTF_8).contains("unmanaged secret"),
				"Stored bytes leak the plaintext");

		Assertions.assertArrayEquals(payload, encryptionEngine.decrypt(sealedPayload.storedBytes(),
				sealedPayload.encryptionDescriptor(), sealedPayload.dataKey()), "Decrypted bytes don't match");

		Assertions.assertThrows(CryptoException.class, () -> encryptionEngine.decrypt(sealedPayload.storedBytes(),
				sealedPayload.encryptionDescriptor(), null), "Missing data key should fail");

		String wrongKey = encryptionEngine.generateDataKey();

		Assertions.assertThrows(CryptoException.class, () -> encryptionEngine.decrypt(sealedPayload.storedBytes(),
				sealedPayload.encryptionDescriptor(), wrongKey), "Wrong data key should fail");
	}

	@Test
	public void testManagedPayloadSurvivesKeyRotation() {
		EncryptionEngine originalEngine = createEncryptionEngine(List.of(new RegistryKey(1, FIRST_KEY)));
		byte[] payload = "managed secret".getBytes(StandardCharsets.UTF_8);

		SealedPayload sealedPayload = originalEngine.create(payload, "text/plain", null, true, true);

		Assertions.assertEquals(Mode.MANAGED, sealedPayload.encryptionDescriptor().mode(), "Wrong encryption mode");
		Assertions.assertEquals(1, sealedPayload.encryptionDescriptor().wrappedKeyVersion(), "Wrong wrapping key version");

		// A new key version is added; older uploads must still open under the version they recorded
		EncryptionEngine rotatedEngine = createEncryptionEngine(List.of(new RegistryKey(1, FIRST_KEY), new RegistryKey(2, SECOND_KEY)));

		Assertions.assertArrayEquals(payload, rotatedEngine.decrypt(sealedPayload.storedBytes(),
				sealedPayload.encryptionDescriptor(), null), "Managed payload did not survive rotation");

		SealedPayload newerPayload = rotatedEngine.create(payload, "text/plain", null, true, true);
		Assertions.assertEquals(2, newerPayload.encryptionDescriptor().wrappedKeyVersion(), "New uploads should wrap under the latest key");

		// Dropping the version strands uploads wrapped under it
		EncryptionEngine strandedEngine = createEncryptionEngine(List.of(new RegistryKey(2, SECOND_KEY)));

		Assertions.assertThrows(CryptoException.class, () -> strandedEngine.decrypt(sealedPayload.storedBytes(),
				sealedPayload.encryptionDescriptor(), null), "Removed key version should not open anything");
	}

	@Test
	public void testTamperedPayloadIsRejected() {
		EncryptionEngine encryptionEngine = createEncryptionEngine(List.of(new RegistryKey(1, FIRST_KEY)));
		String dataKey = encryptionEngine.generateDataKey();

		byte[] sealed = encryptionEngine.seal(encryptionEngine.toSecretKey(dataKey), "do not touch".getBytes(StandardCharsets.UTF_8));
		sealed[sealed.length - 1] ^= 0x01;

		Assertions.assertThrows(CryptoException.class, () -> encryptionEngine.open(encryptionEngine.toSecretKey(dataKey), sealed),
				"Tampered ciphertext should fail authentication");
		Assertions.assertThrows(CryptoException.class, () -> encryptionEngine.open(encryptionEngine.toSecretKey(dataKey), new byte[4]),
				"Truncated ciphertext should be rejected");
		Assertions.assertThrows(CryptoException.class, () -> encryptionEngine.toSecretKey("too-short"),
				"Short data keys should be rejected");
	}

	private EncryptionEngine createEncryptionEngine(List<RegistryKey> registryKeys) {
		return new EncryptionEngine(new KeyRegistry(registryKeys), new ContentTypeDetector());
	}
}
