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

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.inject.Inject;
import com.soklet.tackd.annotation.SensitiveValue;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.requireNonNull;

/**
 * Redacts JSON request bodies before they are logged.
 * <p>
 * Redaction targets are the record components of the body's target type annotated with {@link SensitiveValue},
 * e.g. account passwords. Nested records and collections of records are followed.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class SensitiveValueRedactor {
	@NonNull
	private static final String REDACTED_VALUE;

	static {
		REDACTED_VALUE = "[REDACTED]";
	}

	@NonNull
	private final Gson gson;
	@NonNull
	private final ConcurrentHashMap<@NonNull Class<?>, @NonNull Set<@NonNull String>> sensitivePathsByType;

	@Inject
	public SensitiveValueRedactor(@NonNull Gson gson) {
		requireNonNull(gson);

		this.gson = gson;
		this.sensitivePathsByType = new ConcurrentHashMap<>();
	}

	@NonNull
	public String redact(@NonNull String json,
											 @NonNull Class<?> targetType) {
		requireNonNull(json);
		requireNonNull(targetType);

		Set<@NonNull String> sensitivePaths = getSensitivePathsByType().computeIfAbsent(targetType, this::sensitivePathsFor);

		if (sensitivePaths.isEmpty())
			return json;

		JsonElement root;

		try {
			root = JsonParser.parseString(json);
		} catch (JsonParseException e) {
			// Don't echo unparseable input, it could contain anything
			return REDACTED_VALUE;
		}

		redactElement(root, sensitivePaths, "");
		return getGson().toJson(root);
	}

	@NonNull
	private Set<@NonNull String> sensitivePathsFor(@NonNull Class<?> targetType) {
		requireNonNull(targetType);

		Set<@NonNull String> sensitivePaths = new LinkedHashSet<>();
		collectSensitivePaths(targetType, "", sensitivePaths, new HashSet<>());
		return Set.copyOf(sensitivePaths);
	}

	private void collectSensitivePaths(@NonNull Class<?> type,
																		 @NonNull String pathPrefix,
																		 @NonNull Set<@NonNull String> sensitivePaths,
																		 @NonNull Set<@NonNull Class<?>> visitedTypes) {
		if (!type.isRecord() || !visitedTypes.add(type))
			return;

		for (RecordComponent recordComponent : type.getRecordComponents()) {
			String path = pathPrefix.isEmpty() ? recordComponent.getName() : pathPrefix + "." + recordComponent.getName();

			if (recordComponent.isAnnotationPresent(SensitiveValue.class)) {
				sensitivePaths.add(path);
				continue;
			}

			collectSensitivePaths(recordComponent.getType(), path, sensitivePaths, visitedTypes);

			Type genericType = recordComponent.getGenericType();

			if (genericType instanceof ParameterizedType)
				for (Type typeArgument : ((ParameterizedType) genericType).getActualTypeArguments())
					if (typeArgument instanceof Class<?>)
						collectSensitivePaths((Class<?>) typeArgument, path, sensitivePaths, visitedTypes);
		}
	}

	private void redactElement(@NonNull JsonElement element,
														 @NonNull Set<@NonNull String> sensitivePaths,
														 @NonNull String path) {
		if (element.isJsonArray()) {
			// Elements of a collection share their parent's path
			for (JsonElement arrayElement : (JsonArray) element)
				redactElement(arrayElement, sensitivePaths, path);
		} else if (element.isJsonObject()) {
			JsonObject jsonObject = element.getAsJsonObject();

			for (String name : Set.copyOf(jsonObject.keySet())) {
				String childPath = path.isEmpty() ? name : path + "." + name;

				if (sensitivePaths.contains(childPath))
					jsonObject.addProperty(name, REDACTED_VALUE);
				else
					redactElement(jsonObject.get(name), sensitivePaths, childPath);
			}
		}
	}

	@NonNull
	private Gson getGson() {
		return this.gson;
	}

	@NonNull
	private ConcurrentHashMap<@NonNull Class<?>, @NonNull Set<@NonNull String>> getSensitivePathsByType() {
		return this.sensitivePathsByType;
	}
}
