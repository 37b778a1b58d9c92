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
package org.chronos.jobs.base;

import java.util.regex.Pattern;

import javax.annotation.Nullable;

/**
 * Utility class for checking ISO 8601 duration strings, as accepted by Chronos for intervals and
 * epsilon windows.
 *
 * Accepted forms are {@code PnYnMnWnDTnHnMnS} with an optional leading sign, where every
 * component is optional but at least one must be present, and a {@code T} designator must be
 * followed by at least one time component. The smallest present component may be fractional.
 */
public final class IsoDurations {
  private static final String NUMBER = "\\d+(?:[.,]\\d+)?";

  private static final Pattern DURATION = Pattern.compile(
      "[+-]?P(?!$)"
          + "(?:" + NUMBER + "Y)?"
          + "(?:" + NUMBER + "M)?"
          + "(?:" + NUMBER + "W)?"
          + "(?:" + NUMBER + "D)?"
          + "(?:T(?=\\d)"
          + "(?:" + NUMBER + "H)?"
          + "(?:" + NUMBER + "M)?"
          + "(?:" + NUMBER + "S)?)?");

  private IsoDurations() {
    // Utility class.
  }

  /**
   * Checks whether a string is a well-formed ISO 8601 duration.
   *
   * @param duration Duration string to check.
   * @return {@code true} if {@code duration} is non-null and parses as a duration.
   */
  public static boolean isValid(@Nullable String duration) {
    return duration != null && DURATION.matcher(duration).matches();
  }
}
