/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.chronoql.exception;

import org.json.JSONException;
import org.json.JSONObject;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Base exception class for all ChronoQL exceptions.
 * Provides standardized error codes and diagnostic context. The JSON form produced by {@link #toJSON()} is the wire format of a
 * structured error reported by a worker node, and {@link #fromJSON(String)} restores it on the coordinator side.
 */
public class ChronoQLException extends RuntimeException {
  public static final String FIELD_ERROR_CODE = "errorCode";
  public static final String FIELD_ERROR_NAME = "errorName";
  public static final String FIELD_CATEGORY   = "category";
  public static final String FIELD_MESSAGE    = "message";
  public static final String FIELD_CONTEXT    = "context";
  public static final String FIELD_CAUSE      = "cause";

  private final ErrorCode           errorCode;
  private final Map<String, Object> context;
  private       boolean             remote;

  public ChronoQLException(final String message) {
    this(ErrorCode.INTERNAL_ERROR, message);
  }

  public ChronoQLException(final String message, final Throwable cause) {
    this(ErrorCode.INTERNAL_ERROR, message, cause);
  }

  public ChronoQLException(final ErrorCode errorCode, final String message) {
    super(message);
    this.errorCode = errorCode != null ? errorCode : ErrorCode.INTERNAL_ERROR;
    this.context = new HashMap<>();
  }

  public ChronoQLException(final ErrorCode errorCode, final String message, final Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode != null ? errorCode : ErrorCode.INTERNAL_ERROR;
    this.context = new HashMap<>();
  }

  /**
   * Gets the error code associated with this exception.
   *
   * @return the error code
   */
  public ErrorCode getErrorCode() {
    return errorCode;
  }

  /**
   * Gets the diagnostic context for this exception.
   *
   * @return unmodifiable map of context information
   */
  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /**
   * Adds a context entry to this exception.
   *
   * @param key   the context key
   * @param value the context value
   * @return this exception for method chaining
   */
  public ChronoQLException addContext(final String key, final Object value) {
    if (key != null)
      this.context.put(key, value);
    return this;
  }

  /**
   * Tells whether this exception was restored by {@link #fromJSON(String)} from an error raised by another process, as opposed to
   * one raised locally.
   */
  public boolean isRemote() {
    return remote;
  }

  /**
   * Returns the HTTP status code an outer HTTP surface should answer with.
   *
   * @return the HTTP status code, 500 unless overridden
   */
  public int getHttpStatus() {
    return 500;
  }

  /**
   * Converts this exception to a JSON string.
   *
   * @return JSON representation of this exception
   */
  public String toJSON() {
    final JSONObject json = new JSONObject();
    json.put(FIELD_ERROR_CODE, errorCode.getCode());
    json.put(FIELD_ERROR_NAME, errorCode.name());
    json.put(FIELD_CATEGORY, errorCode.getCategory().getDisplayName());
    json.put(FIELD_MESSAGE, getMessage() != null ? getMessage() : errorCode.getDefaultMessage());

    if (!context.isEmpty()) {
      final JSONObject ctx = new JSONObject();
      for (final Map.Entry<String, Object> entry : context.entrySet())
        ctx.put(entry.getKey(), entry.getValue() != null ? entry.getValue() : JSONObject.NULL);
      json.put(FIELD_CONTEXT, ctx);
    }

    if (getCause() != null && getCause().getMessage() != null)
      json.put(FIELD_CAUSE, getCause().getMessage());

    return json.toString();
  }

  /**
   * Restores an exception serialized with {@link #toJSON()}. The concrete class is chosen by the category of the code so that
   * the restored exception keeps its HTTP status.
   *
   * @param input the serialized error
   * @return the exception, or null if the input is not a serialized error
   */
  public static ChronoQLException fromJSON(final String input) {
    if (input == null || input.isBlank())
      return null;

    final JSONObject json;
    try {
      json = new JSONObject(input);
    } catch (JSONException e) {
      return null;
    }

    if (!json.has(FIELD_ERROR_CODE) || !json.has(FIELD_MESSAGE))
      return null;

    final ErrorCode code = ErrorCode.fromCode(json.optInt(FIELD_ERROR_CODE, ErrorCode.INTERNAL_ERROR.getCode()));
    final String message = json.optString(FIELD_MESSAGE, code.getDefaultMessage());

    final ChronoQLException exception = switch (code.getCategory()) {
      case QUERY -> new QueryException(code, message);
      case CLUSTER -> new ClusterException(code, message);
      default -> new ChronoQLException(code, message);
    };

    final JSONObject ctx = json.optJSONObject(FIELD_CONTEXT);
    if (ctx != null)
      for (String k : ctx.keySet())
        exception.addContext(k, ctx.isNull(k) ? null : ctx.get(k));

    exception.remote = true;
    return exception;
  }

  @Override
  public String toString() {
    return String.format("%s [%s-%d]: %s", getClass().getSimpleName(), errorCode.getCategory(), errorCode.getCode(), getMessage());
  }
}
