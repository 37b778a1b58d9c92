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

import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

/**
 * The outcome of validating some part of a job configuration. A result carries every diagnostic
 * found, and is valid when none of them is an error.
 */
public final class ValidationResult {
  private static final ValidationResult VALID = new ValidationResult(ImmutableList.of());

  private final ImmutableList<Diagnostic> diagnostics;

  private ValidationResult(ImmutableList<Diagnostic> diagnostics) {
    this.diagnostics = diagnostics;
  }

  public static ValidationResult valid() {
    return VALID;
  }

  public static ValidationResult of(Iterable<Diagnostic> diagnostics) {
    return Iterables.isEmpty(diagnostics)
        ? VALID
        : new ValidationResult(ImmutableList.copyOf(diagnostics));
  }

  public static ValidationResult error(String field, String message) {
    return of(ImmutableList.of(Diagnostic.error(field, message)));
  }

  /**
   * Combines results, preserving the order of their diagnostics.
   *
   * @param results Results to combine.
   * @return A result holding the diagnostics of all {@code results}.
   */
  public static ValidationResult merge(Iterable<ValidationResult> results) {
    ImmutableList.Builder<Diagnostic> builder = ImmutableList.builder();
    for (ValidationResult result : results) {
      builder.addAll(result.diagnostics);
    }
    return of(builder.build());
  }

  public boolean isValid() {
    return diagnostics.stream().noneMatch(Diagnostic::isError);
  }

  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  public List<Diagnostic> getErrors() {
    return diagnostics.stream()
        .filter(Diagnostic::isError)
        .collect(ImmutableList.toImmutableList());
  }

  public List<Diagnostic> getWarnings() {
    return diagnostics.stream()
        .filter(d -> !d.isError())
        .collect(ImmutableList.toImmutableList());
  }

  /**
   * Gets the human-readable messages of all errors, in the order they were found.
   */
  public List<String> getErrorMessages() {
    return getErrors().stream()
        .map(Diagnostic::getMessage)
        .collect(ImmutableList.toImmutableList());
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ValidationResult
        && Objects.equals(diagnostics, ((ValidationResult) o).diagnostics);
  }

  @Override
  public int hashCode() {
    return diagnostics.hashCode();
  }

  @Override
  public String toString() {
    return "ValidationResult" + diagnostics;
  }
}
