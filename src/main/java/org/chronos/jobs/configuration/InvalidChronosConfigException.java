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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * Thrown when a Chronos job configuration is invalid, or cannot be found.
 */
public class InvalidChronosConfigException extends Exception {
  private final ValidationResult result;

  public InvalidChronosConfigException(String msg) {
    super(msg);
    this.result = ValidationResult.valid();
  }

  /**
   * Creates an exception reporting every error in a failed validation.
   *
   * @param result A result that is not valid.
   */
  public InvalidChronosConfigException(ValidationResult result) {
    super(Joiner.on("\n").join(result.getErrorMessages()));
    this.result = result;
  }

  /**
   * Gets the diagnostics that caused this failure, empty if the failure was not a validation
   * failure.
   */
  public List<Diagnostic> getDiagnostics() {
    return result.isValid() ? ImmutableList.of() : result.getDiagnostics();
  }
}
