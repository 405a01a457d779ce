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


package com.soklet.tackd.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class UtilityTests {
	@Test
	public void testExpiryParsing() {
		Assertions.assertEquals(Duration.ofSeconds(90), ExpiryParser.parseExpiry("90").orElse(null), "Bare numbers are seconds");
		Assertions.assertEquals(Duration.ofMinutes(15), ExpiryParser.parseExpiry("15m").orElse(null), "Minutes didn't parse");
		Assertions.assertEquals(Duration.ofHours(2), ExpiryParser.parseExpiry(" 2H ").orElse(null), "Hours didn't parse");
		Assertions.assertEquals(Duration.ofDays(14), ExpiryParser.parseExpiry("2w").orElse(null), "Weeks didn't parse");
		Assertions.assertEquals(Duration.ofSeconds(1), ExpiryParser.parseExpiry("1s").orElse(null), "Seconds didn't parse");

		Assertions.assertTrue(ExpiryParser.parseExpiry(null).isEmpty(), "Missing expiry should not parse");
		Assertions.assertTrue(ExpiryParser.parseExpiry("soon").isEmpty(), "Nonsense should not parse");
		Assertions.assertTrue(ExpiryParser.parseExpiry("-5m").isEmpty(), "Negative expiry should not parse");
		Assertions.assertTrue(ExpiryParser.parseExpiry("500ms").isEmpty(), "Sub-second expiry should not parse");
		Assertions.assertTrue(ExpiryParser.parseExpiry("0").isEmpty(), "Zero expiry should not parse");

		// Overflow saturates rather than failing; callers clamp to the retention maximum
		Assertions.assertTrue(ExpiryParser.parseExpiry("999999999999999999y").isPresent(), "Huge expiry should saturate");
	}

	@Test
	public void testNormalization() {
		Assertions.assertEquals("report.pdf", Normalizer.normalizeFilename("../../etc/report.pdf").orElse(null),
				"Directory components should be dropped");
		Assertions.assertEquals("my_file_1_.txt", Normalizer.normalizeFilename("my file (1).txt").orElse(null),
				"Unsafe characters should collapse");
		Assertions.assertTrue(Normalizer.normalizeFilename("..").isEmpty(), "Dot-only names are not filenames");

		Assertions.assertEquals(List.of("alpha", "beta"), Normalizer.normalizeTags(" alpha, ,beta,alpha "),
				"Tags should be trimmed and deduplicated");
		Assertions.assertEquals(List.of("x".repeat(64)), Normalizer.normalizeTags("x".repeat(100)), "Long tags should be cut short");

		Assertions.assertEquals("abc", Normalizer.truncate("abcdef", 3), "Value should be cut to length");
		Assertions.assertEquals("a", Normalizer.truncate("a\uD83D\uDE00", 2), "Surrogate pairs should not be split");
		Assertions.assertNull(Normalizer.truncate(null, 3), "Null should stay null");
		Assertions.assertEquals("someone@example.com", Normalizer.normalizeEmailAddress(" Someone@Example.com ").orElse(null),
				"Email addresses should be trimmed and lowercased");
	}

	@Test
	public void testValidation() {
		Assertions.assertTrue(Validator.isValidEmailAddress("someone@example.com"), "Valid address was rejected");
		Assertions.assertFalse(Validator.isValidEmailAddress("someone@localhost"), "Address without a TLD was accepted");
		Assertions.assertFalse(Validator.isAcceptablePassword("short"), "Short password was accepted");
		Assertions.assertTrue(Validator.isAcceptablePassword("long enough password"), "Reasonable password was rejected");
		Assertions.assertTrue(Validator.isWellFormedToken("abcD1234", 8), "Well-formed token was rejected");
		Assertions.assertFalse(Validator.isWellFormedToken("abc-1234", 8), "Token with punctuation was accepted");
		Assertions.assertTrue(Validator.isStorableTags(null), "Missing tags are storable");
		Assertions.assertFalse(Validator.isStorableTags("x".repeat(4097)), "Oversized tags were accepted");
	}

	@Test
	public void testContentTypeDetection() {
		ContentTypeDetector contentTypeDetector = new ContentTypeDetector();
		byte[] png = new byte[]{(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n', 0, 0, 0, 0x0D, 'I', 'H', 'D', 'R'};

		Assertions.assertEquals("image/png", contentTypeDetector.detectContentType(png, "text/plain"),
				"Magic bytes should win over a declared type");
		Assertions.assertEquals("application/json", contentTypeDetector.detectContentType(
				"{\"a\":1}".getBytes(StandardCharsets.UTF_8), "application/json"), "Declared type should win over a generic sniff");
		Assertions.assertEquals("none", contentTypeDetector.detectContentType(new byte[0], null),
				"Empty content with no declared type is unknown");
		Assertions.assertEquals("none", contentTypeDetector.detectContentType(new byte[0], "application/" + "x".repeat(300)),
				"Oversized declared type should be ignored");
	}

	@Test
	public void testPasswordHashing() {
		PasswordManager passwordManager = PasswordManager.withHashAlgorithm("PBKDF2WithHmacSHA512")
				.iterations(1_000)
				.build();

		String hashedPassword = passwordManager.hashPassword("correct horse");

		Assertions.assertNotEquals("correct horse", hashedPassword, "Password was not hashed");
		Assertions.assertTrue(passwordManager.verifyPassword("correct horse", hashedPassword), "Correct password was rejected");
		Assertions.assertFalse(passwordManager.verifyPassword("battery staple", hashedPassword), "Wrong password was accepted");
		Assertions.assertFalse(passwordManager.verifyPassword(null, hashedPassword), "Missing password was accepted");
	}
}
