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
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import com.google.inject.AbstractModule;
import com.google.inject.Injector;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.assistedinject.FactoryModuleBuilder;
import com.pyranid.Database;
import com.pyranid.InstanceProvider;
import com.pyranid.StatementContext;
import com.pyranid.StatementLog;
import com.pyranid.StatementLogger;
import com.soklet.CorsAuthorizer;
import com.soklet.HttpMethod;
import com.soklet.LifecycleObserver;
import com.soklet.LogEvent;
import com.soklet.MarshaledResponse;
import com.soklet.Request;
import com.soklet.RequestBodyMarshaler;
import com.soklet.RequestInterceptor;
import com.soklet.ResourceMethod;
import com.soklet.Response;
import com.soklet.ResponseMarshaler;
import com.soklet.Server;
import com.soklet.ServerType;
import com.soklet.Soklet;
import com.soklet.SokletConfig;
import com.soklet.exception.BadRequestException;
import com.soklet.exception.IllegalQueryParameterException;
import com.soklet.tackd.annotation.AuthorizationRequired;
import com.soklet.tackd.annotation.SuppressRequestLogging;
import com.soklet.tackd.crypto.KeyRegistry;
import com.soklet.tackd.exception.ApplicationException;
import com.soklet.tackd.exception.AuthenticationException;
import com.soklet.tackd.exception.AuthorizationException;
import com.soklet.tackd.exception.NotFoundException;
import com.soklet.tackd.exception.RequestBodyParsingException;
import com.soklet.tackd.exception.UserExistsException;
import com.soklet.tackd.model.api.response.ApiKeyResponse.ApiKeyResponseFactory;
import com.soklet.tackd.model.api.response.ErrorResponse;
import com.soklet.tackd.model.api.response.LinkResponse.LinkResponseFactory;
import com.soklet.tackd.model.api.response.UploadResponse.UploadResponseFactory;
import com.soklet.tackd.model.db.Role.Permission;
import com.soklet.tackd.service.AccountService;
import com.soklet.tackd.service.CleanupCoordinator;
import com.soklet.tackd.service.AccountService.Identity;
import com.soklet.tackd.storage.FilesystemObjectStore;
import com.soklet.tackd.storage.MemoryObjectStore;
import com.soklet.tackd.storage.ObjectStore;
import com.soklet.tackd.util.ContentTypeDetector;
import com.soklet.tackd.util.PasswordManager;
import com.soklet.tackd.util.SensitiveValueRedactor;
import org.hsqldb.jdbc.JDBCDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.lang.reflect.Parameter;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class AppModule extends AbstractModule {
	@Nonnull
	private final Configuration configuration;

	public AppModule(@Nonnull Configuration configuration) {
		requireNonNull(configuration);
		this.configuration = configuration;
	}

	@Nonnull
	@Provides
	@Singleton
	public Configuration provideConfiguration() {
		return this.configuration;
	}

	@Nonnull
	@Provides
	@Singleton
	public SokletConfig provideSokletConfig(@Nonnull Injector injector,
																					@Nonnull Configuration configuration,
																					@Nonnull Database database,
																					@Nonnull AccountService accountService,
																					@Nonnull CleanupCoordinator cleanupCoordinator,
																					@Nonnull SensitiveValueRedactor sensitiveValueRedactor,
																					@Nonnull Gson gson) {
		requireNonNull(injector);
		requireNonNull(configuration);
		requireNonNull(database);
		requireNonNull(accountService);
		requireNonNull(cleanupCoordinator);
		requireNonNull(sensitiveValueRedactor);
		requireNonNull(gson);

		// Headers count toward the server's request size limit, so leave room for them above the upload limit
		Server server = Server.withPort(configuration.getPort())
				.maximumRequestSizeInBytes(configuration.getUploadLimitInBytes() + 65_536)
				.build();

		return SokletConfig.withServer(server)
				.lifecycleObserver(new LifecycleObserver() {
					@Nonnull
					private final Logger logger = LoggerFactory.getLogger("com.soklet.tackd.LifecycleObserver");

					@Override
					public void didStartRequestHandling(@Nonnull ServerType serverType,
																							@Nonnull Request request,
																							@Nullable ResourceMethod resourceMethod) {
						if (shouldPerformRequestLogging(request, resourceMethod))
							logger.debug("Received {} {}", request.getHttpMethod(), request.getRawPathAndQuery());
					}

					@Override
					public void didFinishRequestHandling(@Nonnull ServerType serverType,
																							 @Nonnull Request request,
																							 @Nullable ResourceMethod resourceMethod,
																							 @Nonnull MarshaledResponse marshaledResponse,
																							 @Nonnull Duration processingDuration,
																							 @Nonnull List<Throwable> throwables) {
						if (shouldPerformRequestLogging(request, resourceMethod))
							logger.debug(format("Finished processing %s %s (HTTP %d) in %.2fms", request.getHttpMethod(),
									request.getRawPathAndQuery(), marshaledResponse.getStatusCode(), processingDuration.toNanos() / 1000000.0));
					}

					@Nonnull
					private Boolean shouldPerformRequestLogging(@Nonnull Request request,
																											@Nullable ResourceMethod resourceMethod) {
						requireNonNull(request);

						// Special OPTIONS * requests are generally health checks and should not be logged
						if (request.getHttpMethod() == HttpMethod.OPTIONS && request.getPath().equals("*"))
							return false;

						// 404? Log it...
						if (resourceMethod == null)
							return true;

						// ...and log everything else, unless the Resource Method is decorated with our custom annotation
						return !resourceMethod.getMethod().isAnnotationPresent(SuppressRequestLogging.class);
					}

					@Override
					public void willStartSoklet(@Nonnull Soklet soklet) {
						logger.debug("tackd starting in {} environment...", configuration.getEnvironment());
					}

					@Override
					public void willStopSoklet(@Nonnull Soklet soklet) {
						logger.debug("tackd stopping...");
					}

					@Override
					public void didStopSoklet(@Nonnull Soklet soklet) {
						logger.debug("tackd stopped.");
					}

					@Override
					public void didStartServer(@Nonnull Server server) {
						logger.debug("Server started on port {}", configuration.getPort());
					}

					@Override
					public void didStopServer(@Nonnull Server server) {
						// No more requests can trigger a sweep, so let any in-flight one finish and release the worker thread
						cleanupCoordinator.shutdown();
						logger.debug("Server stopped.");
					}

					@Override
					public void didReceiveLogEvent(@Nonnull LogEvent logEvent) {
						requireNonNull(logEvent);
						logger.warn(logEvent.getMessage(), logEvent.getThrowable().orElse(null));
					}
				})
				.requestInterceptor(new RequestInterceptor() {
					@Nonnull
					private final Logger logger = LoggerFactory.getLogger("com.soklet.tackd.RequestInterceptor");

					@Override
					public void wrapRequest(@Nonnull ServerType serverType,
																	@Nonnull Request request,
																	@Nonnull Consumer<Request> requestProcessor) {
						requireNonNull(request);
						requireNonNull(requestProcessor);

						// Ensure a "current context" scope exists for all request-handling code, including error handling
						CurrentContext.withRequest(request, null).build().run(() -> {
							requestProcessor.accept(request);
						});
					}

					@Override
					public void interceptRequest(@Nonnull ServerType serverType,
																			 @Nonnull Request request,
																			 @Nullable ResourceMethod resourceMethod,
																			 @Nonnull Function<Request, MarshaledResponse> responseGenerator,
																			 @Nonnull Consumer<MarshaledResponse> responseWriter) {
						requireNonNull(request);
						requireNonNull(responseGenerator);
						requireNonNull(responseWriter);

						// Missing credentials are fine (anonymous); bad credentials are rejected outright
						Identity identity = accountService.authenticate(request.getHeader("Authorization").orElse(null));

						if (resourceMethod != null) {
							// See if the resource method has an @AuthorizationRequired annotation...
							AuthorizationRequired authorizationRequired = resourceMethod.getMethod().getAnnotation(AuthorizationRequired.class);

							if (authorizationRequired != null) {
								if (authorizationRequired.accountRequired() && identity.account() == null)
									throw new AuthenticationException();

								Set<Permission> requiredPermissions = Arrays.stream(authorizationRequired.value()).collect(Collectors.toSet());

								if (!identity.role().permissions().containsAll(requiredPermissions)) {
									logger.debug("Role {} lacks one or more of {}", identity.role().roleId().name(), requiredPermissions);

									// Anonymous callers can fix this by logging in; accounts can't
									if (identity.account() == null)
										throw new AuthenticationException();

									throw new AuthorizationException();
								}
							}
						}

						CurrentContext currentContext = CurrentContext.withRequest(request, resourceMethod)
								.account(identity.account())
								.apiKey(identity.apiKey())
								.role(identity.role())
								.build();

						currentContext.run(() -> {
							// Wrap the resource method execution (not including the writing of bytes over the wire) in a database transaction.
							// If an exception occurs during this process, the transaction will roll back.
							MarshaledResponse marshaledResponse = database.transaction(() ->
									Optional.of(responseGenerator.apply(request))
							).get();

							responseWriter.accept(marshaledResponse);
						});
					}
				})
				.requestBodyMarshaler(new RequestBodyMarshaler() {
					@Nonnull
					private final Logger logger = LoggerFactory.getLogger("com.soklet.tackd.RequestBodyMarshaler");

					@Nonnull
					@Override
					public Optional<Object> marshalRequestBody(@Nonnull Request request,
																										 @Nonnull ResourceMethod resourceMethod,
																										 @Nonnull Parameter parameter,
																										 @Nonnull Type requestBodyType) {
						requireNonNull(request);
						requireNonNull(requestBodyType);

						// Uploads are opaque bytes; never decode or log them
						if (requestBodyType == byte[].class)
							return request.getBody().filter(body -> body.length > 0).map(body -> (Object) body);

						String requestBodyAsString = request.getBodyAsString().orElse(null);

						if (requestBodyAsString == null || requestBodyAsString.isBlank())
							return Optional.empty();

						// Log out the request body, taking care to redact any fields marked with the @SensitiveValue annotation
						if (logger.isDebugEnabled())
							logger.debug("Request body:\n{}", sensitiveValueRedactor.redact(requestBodyAsString, parameter.getType()));

						try {
							// Use Gson to turn the request body JSON into a Java type
							return Optional.ofNullable(gson.fromJson(requestBodyAsString, requestBodyType));
						} catch (RuntimeException e) {
							throw new RequestBodyParsingException(requestBodyType, e);
						}
					}
				})
				.responseMarshaler(ResponseMarshaler.builder()
						.resourceMethodHandler((@Nonnull Request request,
																	 @Nonnull Response response,
																	 @Nonnull ResourceMethod resourceMethod) -> {
							Object bodyObject = response.getBody().orElse(null);

							// Raw bytes (downloads) go out as-is, with whatever Content-Type the resource method chose
							if (bodyObject instanceof byte[])
								return MarshaledResponse.withStatusCode(response.getStatusCode())
										.headers(response.getHeaders())
										.cookies(response.getCookies())
										.body((byte[]) bodyObject)
										.build();

							// Use Gson to turn response objects into JSON to go over the wire
							byte[] body = bodyObject == null ? null : gson.toJson(bodyObject).getBytes(StandardCharsets.UTF_8);

							// Ensure content type header is set
							Map<String, Set<String>> headers = new HashMap<>(response.getHeaders());
							headers.put("Content-Type", Set.of("application/json;charset=UTF-8"));

							return MarshaledResponse.withStatusCode(response.getStatusCode())
									.headers(headers)
									.cookies(response.getCookies())
									.body(body)
									.build();
						})
						.notFoundHandler((@Nonnull Request request) ->
								marshalErrorResponse(gson, 404, ErrorResponse.withSummary("The resource you requested was not found.").build(), Map.of()))
						.methodNotAllowedHandler((@Nonnull Request request,
																		 @Nonnull Set<HttpMethod> allowedHttpMethods) -> {
							String allow = allowedHttpMethods.stream()
									.map(HttpMethod::name)
									.sorted()
									.collect(Collectors.joining(", "));

							return marshalErrorResponse(gson, 405, ErrorResponse.withSummary("That method is not allowed here.").build(),
									Map.of("Allow", Set.of(allow)));
						})
						.contentTooLargeHandler((@Nonnull Request request,
																		@Nullable ResourceMethod resourceMethod) ->
								marshalErrorResponse(gson, 413, ErrorResponse.withSummary("The upload is too large.")
										.generalErrors(List.of("The upload is too large."))
										.metadata(Map.of("uploadLimitInBytes", configuration.getUploadLimitInBytes()))
										.build(), Map.of()))
						.throwableHandler((@Nonnull Request request,
															@Nonnull Throwable throwable,
															@Nullable ResourceMethod resourceMethod) -> {
							// Collect error information for display to client
							int statusCode;
							List<String> generalErrors = new ArrayList<>();
							Map<String, List<String>> fieldErrors = new LinkedHashMap<>();
							Map<String, Object> metadata = new LinkedHashMap<>();

							// Unwrap CompletionExceptions
							if (throwable instanceof CompletionException) {
								Throwable cause = throwable.getCause();
								if (cause != null)
									throwable = cause;
							}

							if (throwable instanceof IllegalQueryParameterException) {
								IllegalQueryParameterException illegalQueryParameterException = (IllegalQueryParameterException) throwable;
								statusCode = 400;
								generalErrors.add(format("Illegal value '%s' specified for query parameter '%s'.",
																	illegalQueryParameterException.getQueryParameterValue().orElse("(not provided)"),
																	illegalQueryParameterException.getQueryParameterName()));
							} else if (throwable instanceof BadRequestException || throwable instanceof RequestBodyParsingException) {
								statusCode = 400;
								generalErrors.add("Your request was improperly formatted.");
							} else if (throwable instanceof AuthenticationException) {
								statusCode = 401;
								generalErrors.add("You must be authenticated to perform this action.");
							} else if (throwable instanceof AuthorizationException) {
								statusCode = 403;
								generalErrors.add("You are not authorized to perform this action.");
							} else if (throwable instanceof NotFoundException) {
								statusCode = 404;
								generalErrors.add("The resource you requested was not found.");
							} else if (throwable instanceof UserExistsException) {
								statusCode = 409;
								generalErrors.add("An account with that email address already exists.");
							} else if (throwable instanceof ApplicationException) {
								ApplicationException applicationException = (ApplicationException) throwable;
								statusCode = applicationException.getStatusCode();
								generalErrors.addAll(applicationException.getGeneralErrors());
								fieldErrors.putAll(applicationException.getFieldErrors());
								metadata.putAll(applicationException.getMetadata());
							} else {
								statusCode = 500;
								generalErrors.add("An unexpected error occurred.");
							}

							// Combine all the error messages into one field for easy access by clients
							Set<String> fieldErrorsSummary = new LinkedHashSet<>();

							for (List<String> fieldErrorValues : fieldErrors.values())
								fieldErrorsSummary.addAll(fieldErrorValues);

							String summary = format("%s %s",
									generalErrors.stream().collect(Collectors.joining(" ")),
									fieldErrorsSummary.stream().collect(Collectors.joining(" "))
							).trim();

							// Ensure there is always a summary
							if (summary.length() == 0)
								summary = "An unexpected error occurred.";

							// Collect all the error information into an object for transport over the wire
							ErrorResponse errorResponse = ErrorResponse.withSummary(summary)
									.generalErrors(generalErrors)
									.fieldErrors(fieldErrors)
									.metadata(metadata)
									.build();

							return marshalErrorResponse(gson, statusCode, errorResponse, Map.of());
						}).build()
				)
				// Permit CORS for only the specified origins
				.corsAuthorizer(CorsAuthorizer.fromWhitelistedOrigins(configuration.getCorsWhitelistedOrigins()))
				// Use Google Guice when Soklet needs to vend instances
				.instanceProvider(injector::getInstance)
				.build();
	}

	@Nonnull
	protected MarshaledResponse marshalErrorResponse(@Nonnull Gson gson,
																									 @Nonnull Integer statusCode,
																									 @Nonnull ErrorResponse errorResponse,
																									 @Nonnull Map<String, Set<String>> additionalHeaders) {
		requireNonNull(gson);
		requireNonNull(statusCode);
		requireNonNull(errorResponse);
		requireNonNull(additionalHeaders);

		// Use Gson to turn the error response into JSON
		byte[] body = gson.toJson(errorResponse).getBytes(StandardCharsets.UTF_8);

		Map<String, Set<String>> headers = new HashMap<>(additionalHeaders);
		headers.put("Content-Type", Set.of("application/json;charset=UTF-8"));

		return MarshaledResponse.withStatusCode(statusCode)
				.headers(headers)
				.body(body)
				.build();
	}

	// What context is bound to the current execution scope?
	@Nonnull
	@Provides
	public CurrentContext provideCurrentContext() {
		return CurrentContext.get();
	}

	// Provides a way to talk to a relational database
	@Nonnull
	@Provides
	@Singleton
	public Database provideDatabase(@Nonnull Injector injector) {
		requireNonNull(injector);

		// Each App instance gets its own isolated database to support parallel test execution in the same JVM instance
		JDBCDataSource dataSource = new JDBCDataSource();
		dataSource.setUrl(format("jdbc:hsqldb:mem:%s", UUID.randomUUID()));
		dataSource.setUser("sa");
		dataSource.setPassword("");

		// Use Pyranid to simplify JDBC operations
		return Database.forDataSource(dataSource)
				// Use Google Guice when Pyranid needs to vend instances
				.instanceProvider(new InstanceProvider() {
					@Override
					@Nonnull
					public <T> T provide(@Nonnull StatementContext<T> statementContext,
															 @Nonnull Class<T> instanceType) {
						return injector.getInstance(instanceType);
					}
				})
				.statementLogger(new StatementLogger() {
					@Nonnull
					private final Logger logger = LoggerFactory.getLogger("com.soklet.tackd.StatementLogger");

					@Override
					public void log(@Nonnull StatementLog statementLog) {
						if (logger.isTraceEnabled())
							logger.trace("SQL took {}ms:\n{}\nParameters: {}", format("%.2f", statementLog.getTotalDuration().toNanos() / 1000000.0),
									statementLog.getStatementContext().getStatement().getSql().stripIndent().trim(),
									statementLog.getStatementContext().getParameters());
					}
				})
				.build();
	}

	@Nonnull
	@Provides
	@Singleton
	public PasswordManager providePasswordManager() {
		return PasswordManager.withHashAlgorithm("PBKDF2WithHmacSHA512")
				.iterations(210_000)
				.saltLength(64)
				.keyLength(512)
				.build();
	}

	@Nonnull
	@Provides
	@Singleton
	public KeyRegistry provideKeyRegistry(@Nonnull Configuration configuration) {
		requireNonNull(configuration);
		return new KeyRegistry(configuration.getEncryptionKeys());
	}

	// Tika's detector is expensive to build, so share one
	@Nonnull
	@Provides
	@Singleton
	public ContentTypeDetector provideContentTypeDetector() {
		return new ContentTypeDetector();
	}

	// The backend is chosen once, at startup
	@Nonnull
	@Provides
	@Singleton
	public ObjectStore provideObjectStore(@Nonnull Configuration configuration) {
		requireNonNull(configuration);

		ObjectStore objectStore = null;

		switch (configuration.getObjectStoreType()) {
			case MEMORY -> objectStore = new MemoryObjectStore();
			case FILESYSTEM -> objectStore = new FilesystemObjectStore(configuration.getObjectStoreDirectory().get());
		}

		return objectStore;
	}

	// Tests override this to move time forward
	@Nonnull
	@Provides
	@Singleton
	public Clock provideClock() {
		return Clock.systemUTC();
	}

	@Nonnull
	@Provides
	@Singleton
	public Gson provideGson() {
		GsonBuilder gsonBuilder = new GsonBuilder()
				.setPrettyPrinting()
				.disableHtmlEscaping()
				// Use ISO formatting for Instants
				.registerTypeAdapter(Instant.class, new TypeAdapter<Instant>() {
					@Override
					public void write(@Nonnull JsonWriter jsonWriter,
														@Nullable Instant instant) throws IOException {
						if (instant == null)
							jsonWriter.nullValue();
						else
							jsonWriter.value(instant.toString());
					}

					@Override
					@Nullable
					public Instant read(@Nonnull JsonReader jsonReader) throws IOException {
						return Instant.parse(jsonReader.nextString());
					}
				});

		return gsonBuilder.create();
	}

	@Override
	protected void configure() {
		// Tells Guice to set up assisted injection for factories
		// See https://github.com/google/guice/wiki/AssistedInject
		install(new FactoryModuleBuilder().build(UploadResponseFactory.class));
		install(new FactoryModuleBuilder().build(LinkResponseFactory.class));
		install(new FactoryModuleBuilder().build(ApiKeyResponseFactory.class));
	}
}
