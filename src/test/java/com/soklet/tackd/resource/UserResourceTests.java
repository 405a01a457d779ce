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

import com.google.gson.Gson;
import com.soklet.HttpMethod;
import com.soklet.MarshaledResponse;
import com.soklet.Request;
import com.soklet.Soklet;
import com.soklet.SokletConfig;
import com.soklet.tackd.App;
import com.soklet.tackd.Configuration;
import com.soklet.tackd.model.api.request.AccountCredentialsRequest;
import com.soklet.tackd.model.api.request.ApiKeyCreateRequest;
import com.soklet.tackd.model.api.response.ApiKeyResponse.ApiKeysResponseHolder;
import com.soklet.tackd.model.api.response.ErrorResponse;
import com.soklet.tackd.resource.UploadResource.UploadSavedResponseHolder;
import com.soklet.tackd.resource.UserResource.AccountIdResponseHolder;
import com.soklet.tackd.resource.UserResource.ApiKeyCreatedResponseHolder;
import com.soklet.tackd.resource.UserResource.ApiKeyDeletedResponseHolder;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.soklet.tackd.resource.UploadResourceTests.basicAuthorization;
import static java.lang.String.format;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class UserResourceTests {
	@Test
	public void testCreateAndRecoverAccount() {
		App app = new App(new Configuration("test"));
		Gson gson = app.getInjector().getInstance(Gson.class);
		SokletConfig config = app.getInjector().getInstance(SokletConfig.class);

		Soklet.runSimulator(config, (simulator -> {
			String requestBodyJson = gson.toJson(new AccountCredentialsRequest("someone@tackd.test", "a fine password"));

			Request request = Request.withPath(HttpMethod.POST, "/api/v1/user")
					.body(requestBodyJson.getBytes(StandardCharsets.UTF_8))
					.build();

			MarshaledResponse marshaledResponse = simulator.performRequest(request).getMarshaledResponse();
			Assertions.assertEquals(201, marshaledResponse.getStatusCode().intValue(), "Bad status code");

			String responseBody = new String(marshaledResponse.getBody().get(), StandardCharsets.UTF_8);
			AccountIdResponseHolder createdResponse = gson.fromJson(responseBody, AccountIdResponseHolder.class);

			// Same address again, differently cased
			request = Request.withPath(HttpMethod.POST, "/api/v1/user")
					.body(gson.toJson(new AccountCredentialsRequest("SOMEONE@tackd.test", "another password")).getBytes(StandardCharsets.UTF_8))
					.build();

			marshaledResponse = simulator.performRequest(request).getMarshaledResponse();
			Assertions.assertEquals(409, marshaledResponse.getStatusCode().intValue(), "Duplicate account should conflict");

			// Recover the id with the right password
			request = Request.withPath(HttpMethod.POST, "/api/v1/user/recover/id")
					.body(requestBodyJson.getBytes(StandardCharsets.UTF_8))
					.build();

			marshaledResponse = simulator.performRequest(request).getMarshaledResponse();
			Assertions.assertEquals(200, marshaledResponse.getStatusCode().intValue(), "Bad status code");

			responseBody = new String(marshaledResponse.getBody().get(), StandardCharsets.UTF_8);
			Assertions.assertEquals(createdResponse.id(), gson.fromJson(responseBody, AccountIdResponseHolder.class).id(), "Recovered the wrong id");

			// ...but not with the wrong one
			request = Request.withPath(HttpMethod.POST, "/api/v1/user/recover/id")
					.body(gson.toJson(new AccountCredentialsRequest("someone@tackd.test", "not the password")).getBytes(StandardCharsets.UTF_8))
					.build();

			marshaledResponse = simulator.performRequest(request).getMarshaledResponse();
			Assertions.assertEquals(401, marshaledResponse.getStatusCode().intValue(), "Wrong password should be unauthenticated");
		}));
	}

	@Test
	public void testInvalidAccountCreation() {
		App app = new App(new Configuration("test"));
		Gson gson = app.getInjector().getInstance(Gson.class);
		SokletConfig config = app.getInjector().getInstance(SokletConfig.class);

		Soklet.runSimulator(config, (simulator -> {
			Request request = Request.withPath(HttpMethod.POST, "/api/v1/user")
					.body(gson.toJson(new AccountCredentialsRequest("not an address", "short")).getBytes(StandardCharsets.UTF_8))
					.build();

			MarshaledResponse marshaledResponse = simulator.performRequest(request).getMarshaledResponse();
			Assertions.assertEquals(422, marshaledResponse.getStatusCode().intValue(), "Bad status code");

			String responseBody = new String(marshaledResponse.getBody().get(), StandardCharsets.UTF_8);
			ErrorResponse errorResponse = gson.fromJson(responseBody, ErrorResponse.class);

			Assertions.assertTrue(errorResponse.getFieldErrors().containsKey("email"), "Error response was missing an 'email' field error");
			Assertions.assertTrue(errorResponse.getFieldErrors().containsKey("password"), "Error response was missing a 'password' field error");

			// Malformed JSON
			request = Request.withPath(HttpMethod.POST, "/api/v1/user")
					.body("{ this is not json".getBytes(StandardCharsets.UTF_8))
					.build();

			marshaledResponse = simulator.performRequest(request).getMarshaledResponse();
			Assertions.assertEquals(400, marshaledResponse.getStatusCode().intValue(), "Malformed body should be a bad request");

			responseBody = new String(marshaledResponse.getBody().get(), StandardCharsets.UTF_8);
			errorResponse = gson.fromJson(responseBody, ErrorResponse.class);

			Assertions.assertTrue(errorResponse.getGeneralErrors().contains("Your request was improperly formatted."),
					"Malformed body should be reported as improperly formatted");
		}));
	}

	@Test
	public void testApiKeyLifecycle() {
		App app = new App(new Configuration("test"));
		Gson gson = app.getInjector().getInstance(Gson.class);
		SokletConfig config = app.getInjector().getInstance(SokletConfig.class);

		Soklet.runSimulator(config, (simulator -> {
			Request request = Request.withPath(HttpMethod.POST, "/api/v1/user")
					.body(gson.toJson(new AccountCredentialsRequest("keys@tackd.test", "key-owner-password")).getBytes(StandardCharsets.UTF_8))
					.build();

			MarshaledResponse marshaledResponse = simulator.performRequest(request).getMarshaledResponse();
			String responseBody = new String(marshaledResponse.getBody().get(), StandardCharsets.UTF_8);
			String accountAuthorization = basicAuthorization(gson.fromJson(responseBody, AccountIdResponseHolder.class).id().toString(),
					"key-owner-password");

			// Issue a key
			request = Request.withPath(HttpMethod.POST, "/api/v1/user/apiKeys")
					.headers(Map.of("Authorization", Set.of(accountAuthorization)))
					.body(gson.toJson(new ApiKeyCreateRequest(List.of("ci"))).getBytes(StandardCharsets.UTF_8))
					.build();

			marshaledResponse = simulator.performRequest(request).getMarshaledResponse();
			Assertions.assertEquals(201, marshaledResponse.getStatusCode().intValue(), "Bad status code");

			responseBody = new String(marshaledResponse.getBody().get(), StandardCharsets.UTF_8);
			ApiKeyCreatedResponseHolder createdApiKey = gson.fromJson(responseBody, ApiKeyCreatedResponseHolder.class);

			Assertions.assertEquals(8, createdApiKey.key().length(), "Wrong API key length");
			Assertions.assertEquals(List.of("ci"), createdApiKey.tags(), "Tags were not kept");

			String apiKeyAuthorization = basicAuthorization(createdApiKey.key(), createdApiKey.secret());

			// The key works for uploads, which are then owned by the key's account
			request = Request.withPath(HttpMethod.POST, "/upload")
					.headers(Map.of("Authorization", Set.of(apiKeyAuthorization)))
					.body("uploaded with an API key".getBytes(StandardCharsets.UTF_8))
					.build();

			marshaledResponse = simulator.performRequest(request).getMarshaledResponse();
			Assertions.assertEquals(201, marshaledResponse.getStatusCode().intValue(), "API key upload failed");

			responseBody = new String(marshaledResponse.getBody().get(), StandardCharsets.UTF_8);
			Assertions.assertNotNull(gson.fromJson(responseBody, UploadSavedResponseHolder.class).data().key(), "Missing unlock key");

			// The key shows up in the listing, without its secret
			request = Request.withPath(HttpMethod.GET, "/api/v1/user/apiKeys")
					.headers(Map.of("Authorization", Set.of(apiKeyAuthorization)))
					.build();

			marshaledResponse = simulator.performRequest(request).getMarshaledResponse();
			responseBody = new String(marshaledResponse.getBody().get(), StandardCharsets.UTF_8);

			ApiKeysResponseHolder apiKeysResponse = gson.fromJson(responseBody, ApiKeysResponseHolder.class);
			Assertions.assertEquals(1, apiKeysResponse.apiKeys().size(), "Wrong number of API keys");
			Assertions.assertFalse(responseBody.contains(createdApiKey.secret()), "API key listing leaked the secret");

			// A wrong secret is rejected outright
			request = Request.withPath(HttpMethod.GET, "/api/v1/user/apiKeys")
					.headers(Map.of("Authorization", Set.of(basicAuthorization(createdApiKey.key(), "wrong-secret"))))
					.build();

			marshaledResponse = simulator.performRequest(request).getMarshaledResponse();
			Assertions.assertEquals(401, marshaledResponse.getStatusCode().intValue(), "Wrong secret should be unauthenticated");

			// Revoke it
			request = Request.withPath(HttpMethod.DELETE, format("/api/v1/user/apiKeys/%s", createdApiKey.key()))
					.headers(Map.of("Authorization", Set.of(accountAuthorization)))
					.build();

			marshaledResponse = simulator.performRequest(request).getMarshaledResponse();
			responseBody = new String(marshaledResponse.getBody().get(), StandardCharsets.UTF_8);
			Assertions.assertTrue(gson.fromJson(responseBody, ApiKeyDeletedResponseHolder.class).deleted(), "API key was not deleted");

			request = Request.withPath(HttpMethod.GET, "/api/v1/user/apiKeys")
					.headers(Map.of("Authorization", Set.of(apiKeyAuthorization)))
					.build();

			marshaledResponse = simulator.performRequest(request).getMarshaledResponse();
			Assertions.assertEquals(401, marshaledResponse.getStatusCode().intValue(), "Revoked key should be unauthenticated");
		}));
	}

	@Test
	public void testMalformedAuthorization() {
		App app = new App(new Configuration("test"));
		SokletConfig config = app.getInjector().getInstance(SokletConfig.class);

		Soklet.runSimulator(config, (simulator -> {
			Request request = Request.withPath(HttpMethod.GET, "/api/v1/user/apiKeys")
					.headers(Map.of("Authorization", Set.of("Bearer abc.def.ghi")))
					.build();

			MarshaledResponse marshaledResponse = simulator.performRequest(request).getMarshaledResponse();
			Assertions.assertEquals(401, marshaledResponse.getStatusCode().intValue(), "Non-Basic credentials should be unauthenticated");

			request = Request.withPath(HttpMethod.GET, "/api/v1/user/apiKeys")
					.headers(Map.of("Authorization", Set.of(basicAuthorization("not-a-key-at-all", "secret"))))
					.build();

			marshaledResponse = simulator.performRequest(request).getMarshaledResponse();
			Assertions.assertEquals(401, marshaledResponse.getStatusCode().intValue(), "Malformed API key should be unauthenticated");
		}));
	}
}
