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

import com.google.inject.Inject;
import com.soklet.tackd.Configuration;
import com.soklet.tackd.exception.CryptoException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.UUID;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Mints links, the unit of sharing for an upload, and checks unlock keys presented against them.
 * <p>
 * Only a SHA-256 digest of an unlock key is ever persisted. The raw key is handed back once, at mint time,
 * for embedding in the download URL.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class LinkMinter {
	public static final int UNLOCK_KEY_LENGTH;

	static {
		UNLOCK_KEY_LENGTH = 32;
	}

	@NonNull
	private final Configuration configuration;

	@Inject
	public LinkMinter(@NonNull Configuration configuration) {
		requireNonNull(configuration);
		this.configuration = configuration;
	}

	/**
	 * Anonymous links, and every link when the deployment ignores link keys, carry no unlock key:
	 * the link id (plus the data key, for unmanaged uploads) is the whole capability.
	 */
	@NonNull
	public MintedLink mint(@Nullable UUID ownerAccountId,
												 @Nullable List<@NonNull String> tags) {
		UUID linkId = UUID.randomUUID();
		List<String> linkTags = tags == null ? List.of() : List.copyOf(tags);

		if (ownerAccountId == null || getConfiguration().getIgnoreLinkKey())
			return new MintedLink(linkId, null, null, linkTags);

		String unlockKey = SecureTokens.alphanumeric(UNLOCK_KEY_LENGTH);
		return new MintedLink(linkId, unlockKey, hashUnlockKey(unlockKey), linkTags);
	}

	@NonNull
	public Boolean matches(@Nullable String presentedUnlockKey,
												 @Nullable String storedKeyHash) {
		if (presentedUnlockKey == null || storedKeyHash == null)
			return false;

		byte[] presentedHash = hashUnlockKey(presentedUnlockKey).getBytes(StandardCharsets.US_ASCII);
		return MessageDigest.isEqual(presentedHash, storedKeyHash.getBytes(StandardCharsets.US_ASCII));
	}

	@NonNull
	public String hashUnlockKey(@NonNull String unlockKey) {
		requireNonNull(unlockKey);

		try {
			MessageDigest messageDigest = MessageDigest.getInstance("SHA-256");
			return HexFormat.of().formatHex(messageDigest.digest(unlockKey.getBytes(StandardCharsets.UTF_8)));
		} catch (NoSuchAlgorithmException e) {
			throw new CryptoException("SHA-256 is unavailable", e);
		}
	}

	/**
	 * A freshly minted link. {@code unlockKey} and {@code keyHash} are either both present or both absent.
	 */
	public record MintedLink(
			@NonNull UUID linkId,
			@Nullable String unlockKey,
			@Nullable String keyHash,
			@NonNull List<@NonNull String> tags
	) {
		public MintedLink {
			requireNonNull(linkId);
			requireNonNull(tags);

			if ((unlockKey == null) != (keyHash == null))
				throw new IllegalArgumentException("Unlock key and key hash must be supplied together");
		}

		@Override
		public String toString() {
			return format("%s{linkId=%s, keyed=%s, tags=%s}", MintedLink.class.getSimpleName(), linkId(), unlockKey() != null, tags());
		}
	}

	@NonNull
	private Configuration getConfiguration() {
		return this.configuration;
	}
}
