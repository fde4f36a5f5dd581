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

import com.google.common.annotations.GwtCompatible;

/** An error code and text string describing the first invalid input encountered. */
@GwtCompatible
public class GeohashError {
  public enum Code {
    /** No problems detected. */
    NO_ERROR(0),
    /** A character is not part of the geohash alphabet. */
    INVALID_CHARACTER(1),
    /** A precision is negative, too large, or zero where at least one cell is required. */
    INVALID_PRECISION(2),
    /** A numeric argument is outside its documented range. */
    OUT_OF_RANGE(3);

    private final int code;

    private Code(int code) {
      this.code = code;
    }

    /** Returns the numeric value of this error code. */
    public int code() {
      return code;
    }
  }

  private Code code = Code.NO_ERROR;
  private String text = "";

  /**
   * Sets the error code and text description; the description is formatted according to the rules
   * defined in {@link String#format(String, Object...)}.
   */
  public void init(Code code, String format, Object... args) {
    this.code = code;
    this.text = Platform.formatString(format, args);
  }

  /** Returns true if no error has been recorded. */
  public boolean ok() {
    return code == Code.NO_ERROR;
  }

  /** Returns the code of this error. */
  public Code code() {
    return code;
  }

  /** Returns the text string. */
  public String text() {
    return text;
  }

  @Override
  public String toString() {
    return code + ": " + text;
  }
}
