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

import java.util.Locale;
import java.util.Optional;

import javax.annotation.Nullable;

/**
 * Deployment-level intent for a job. When known, it takes precedence over the {@code disabled}
 * field of the job's own configuration.
 */
public enum DesiredState {
  START,
  STOP;

  /**
   * Parses a desired state as recorded in a deployment branch, e.g. {@code "start"}.
   *
   * @param value Recorded state.
   * @return The state, or empty if {@code value} is not a known state.
   */
  public static Optional<DesiredState> parse(@Nullable String value) {
    if (value == null) {
      return Optional.empty();
    }
    for (DesiredState state : values()) {
      if (state.name().toLowerCase(Locale.ENGLISH).equals(value)) {
        return Optional.of(state);
      }
    }
    return Optional.empty();
  }

  /**
   * Gets the value of the {@code disabled} flag this state implies.
   */
  public boolean isDisabled() {
    return this == STOP;
  }
}
