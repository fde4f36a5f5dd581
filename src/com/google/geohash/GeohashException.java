/*
 * Copyright 2024 Google Inc.
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
 */
package com.google.geohash;

/**
 * An unchecked exception thrown when a geohash operation is given input it cannot process, such as
 * a code containing characters outside the base-32 alphabet. Wraps a {@link GeohashError} and
 * provides a convenience method to get the underlying {@link GeohashError.Code}.
 */
public class GeohashException extends RuntimeException {

  private final GeohashError error;

  /** Creates a new GeohashException wrapping the given GeohashError. */
  public GeohashException(GeohashError error) {
    this.error = error;
  }

  /** Creates a new GeohashException with a freshly initialized GeohashError. */
  static GeohashException create(GeohashError.Code code, String format, Object... args) {
    GeohashError error = new GeohashError();
    error.init(code, format, args);
    return new GeohashException(error);
  }

  /** Returns the code of the GeohashError wrapped by this GeohashException. */
  public GeohashError.Code code() {
    return error.code();
  }

  /** Returns the wrapped error. */
  public GeohashError error() {
    return error;
  }

  @Override
  public String getMessage() {
    return error.text();
  }
}
