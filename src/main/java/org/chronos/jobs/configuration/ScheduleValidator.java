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

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import org.chronos.jobs.base.IsoDurations;

/**
 * Validates Chronos schedule expressions.
 *
 * A schedule is an ISO 8601 repeating interval of the form {@code R[n]/start/interval}, e.g.
 * {@code R5/2015-03-25T19:36:35Z/PT2M}. Chronos relaxes the standard in one way: an empty start
 * time is accepted, and means the job starts now.
 *
 * All three parts are checked independently so that every problem is reported at once. The only
 * exception is a schedule that does not split into three parts, which is rejected outright.
 */
public final class ScheduleValidator {
  @VisibleForTesting
  static final String FIELD = "schedule";

  // 'R' or 'Rn', where n is the number of times to repeat.
  private static final Pattern REPEAT = Pattern.compile("R\\d*");
  private static final Splitter PART_SPLITTER = Splitter.on('/');

  // ISO 8601 extended date-time with an optional offset. Designators are upper case only.
  private static final DateTimeFormatter START_TIME = new DateTimeFormatterBuilder()
      .parseCaseSensitive()
      .append(DateTimeFormatter.ISO_LOCAL_DATE)
      .appendLiteral('T')
      .append(DateTimeFormatter.ISO_LOCAL_TIME)
      .optionalStart()
      .appendOffsetId()
      .optionalEnd()
      .toFormatter(Locale.ROOT);

  private ScheduleValidator() {
    // Utility class.
  }

  /**
   * Validates a schedule expression.
   *
   * @param schedule Schedule to validate.
   * @return The validation result. A schedule without a start time yields only a warning.
   */
  public static ValidationResult validate(@Nullable String schedule) {
    if (schedule == null) {
      return ValidationResult.error(FIELD, "You must specify a \"schedule\" in your configuration");
    }

    List<String> parts = PART_SPLITTER.splitToList(schedule);
    if (parts.size() != 3) {
      return ValidationResult.error(
          FIELD,
          String.format("The specified schedule \"%s\" is invalid", schedule));
    }

    String repeat = parts.get(0);
    String startTime = parts.get(1);
    String interval = parts.get(2);

    ImmutableList.Builder<Diagnostic> diagnostics = ImmutableList.builder();
    if (startTime.isEmpty()) {
      diagnostics.add(Diagnostic.warning(
          FIELD,
          String.format("The specified schedule \"%s\" does not contain a start time", schedule)));
    } else {
      checkStartTime(schedule, startTime, diagnostics);
    }

    if (!IsoDurations.isValid(interval)) {
      diagnostics.add(Diagnostic.error(
          FIELD,
          String.format(
              "The specified interval \"%s\" in schedule \"%s\" "
                  + "does not conform to the ISO 8601 format.",
              interval,
              schedule)));
    }

    if (!isValidRepeat(repeat)) {
      diagnostics.add(Diagnostic.error(
          FIELD,
          String.format(
              "The specified repeat \"%s\" in schedule \"%s\" "
                  + "does not conform to the ISO 8601 format.",
              repeat,
              schedule)));
    }

    return ValidationResult.of(diagnostics.build());
  }

  private static void checkStartTime(
      String schedule,
      String startTime,
      ImmutableList.Builder<Diagnostic> diagnostics) {

    TemporalAccessor parsed;
    try {
      parsed = START_TIME.parse(startTime);
    } catch (DateTimeParseException e) {
      diagnostics.add(Diagnostic.error(
          FIELD,
          String.format(
              "The specified start time \"%s\" in schedule \"%s\" "
                  + "does not conform to the ISO 8601 format:\n%s",
              startTime,
              schedule,
              e.getMessage())));
      return;
    }

    if (parsed.query(TemporalQueries.zone()) == null) {
      diagnostics.add(Diagnostic.error(
          FIELD,
          String.format("The specified start time \"%s\" must contain a time zone", startTime)));
    }
  }

  @VisibleForTesting
  static boolean isValidRepeat(String repeat) {
    return REPEAT.matcher(repeat).matches();
  }
}
