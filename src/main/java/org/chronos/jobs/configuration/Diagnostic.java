/**
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
package org.chronos.jobs.configuration;

import java.util.Objects;

import com.google.common.base.MoreObjects;

import static java.util.Objects.requireNonNull;

/**
 * A single finding produced while validating a job configuration.
 */
public final class Diagnostic {

  /**
   * How a diagnostic affects validation. Only errors cause validation to fail.
   */
  public enum Severity {
    ERROR,
    WARNING
  }

  private final String field;
  private final String message;
  private final Severity severity;

  private Diagnostic(String field, String message, Severity severity) {
    this.field = requireNonNull(field);
    this.message = requireNonNull(message);
    this.severity = requireNonNull(severity);
  }

  public static Diagnostic error(String field, String message) {
    return new Diagnostic(field, message, Severity.ERROR);
  }

  public static Diagnostic warning(String field, String message) {
    return new Diagnostic(field, message, Severity.WARNING);
  }

  /**
   * Name of the configuration field the diagnostic refers to.
   */
  public String getField() {
    return field;
  }

  public String getMessage() {
    return message;
  }

  public Severity getSeverity() {
    return severity;
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Diagnostic)) {
      return false;
    }

    Diagnostic other = (Diagnostic) o;
    return Objects.equals(field, other.field)
        && Objects.equals(message, other.message)
        && severity == other.severity;
  }

  @Override
  public int hashCode() {
    return Objects.hash(field, message, severity);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("field", field)
        .add("message", message)
        .add("severity", severity)
        .toString();
  }
}
