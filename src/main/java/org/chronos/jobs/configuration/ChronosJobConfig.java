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
import java.util.Map;
import java.util.Objects;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.chronos.jobs.base.IsoDurations;
import org.chronos.jobs.base.JobKey;

import static java.util.Objects.requireNonNull;

/**
 * A Chronos job as authored in a service's configuration, prior to validation.
 *
 * <p>See https://mesos.github.io/chronos/docs/api.html#adding-a-docker-job for the requirements
 * Chronos places on docker jobs. {@link SanitizedChronosJob} provides typed access to a
 * configuration that has passed {@link #validate()}.
 */
public class ChronosJobConfig extends InstanceConfig {
  public static final String ARGS = "args";
  public static final String ENV = "env";
  public static final String CONSTRAINTS = "constraints";
  public static final String EPSILON = "epsilon";
  public static final String RETRIES = "retries";
  public static final String DISABLED = "disabled";
  public static final String SCHEDULE = "schedule";
  public static final String SCHEDULE_TIME_ZONE = "schedule_time_zone";
  public static final String DESCRIPTION = "description";
  public static final String OWNER = "owner";

  public static final String DEFAULT_EPSILON = "PT60S";
  public static final int DEFAULT_RETRIES = 2;

  /**
   * Chronos parameters that are checked on every validation, by their Chronos API names.
   */
  @VisibleForTesting
  static final ImmutableList<String> CHECKED_PARAMETERS = ImmutableList.of(
      "epsilon",
      "retries",
      "cpus",
      "mem",
      "schedule",
      "scheduleTimeZone");

  private static final ImmutableSet<String> PARAMETERS_WITHOUT_CHECKS =
      ImmutableSet.of("description", "command", "owner", "disabled");

  /**
   * Keys that may appear in an authored job configuration.
   */
  @VisibleForTesting
  static final ImmutableSet<String> SUPPORTED_FIELDS = ImmutableSet.<String>builder()
      .addAll(SHARED_PARAMETERS)
      .add(ARGS, ENV, CONSTRAINTS, EPSILON, RETRIES, DISABLED)
      .add(SCHEDULE, SCHEDULE_TIME_ZONE, DESCRIPTION, OWNER)
      .build();

  private final JobKey jobKey;

  public ChronosJobConfig(JobKey jobKey, Map<String, ?> config, BranchRecord branch) {
    super(config, branch);
    this.jobKey = requireNonNull(jobKey);
  }

  public JobKey getJobKey() {
    return jobKey;
  }

  public String getServiceName() {
    return jobKey.getService();
  }

  public String getJobName() {
    return jobKey.getJob();
  }

  public ValidationResult checkEpsilon() {
    Object epsilon = getOrDefault(EPSILON, DEFAULT_EPSILON);
    if (!(epsilon instanceof String) || !IsoDurations.isValid((String) epsilon)) {
      return ValidationResult.error(
          EPSILON,
          String.format(
              "The specified epsilon value \"%s\" does not conform to the ISO8601 format.",
              epsilon));
    }
    return ValidationResult.valid();
  }

  public ValidationResult checkRetries() {
    Object retries = get(RETRIES);
    if (retries != null && !isInt(retries)) {
      return ValidationResult.error(
          RETRIES,
          String.format("The specified retries value \"%s\" is not a valid int.", retries));
    }
    return ValidationResult.valid();
  }

  private static boolean isInt(Object value) {
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return true;
    }
    if (value instanceof Long) {
      long longValue = (Long) value;
      return longValue >= Integer.MIN_VALUE && longValue <= Integer.MAX_VALUE;
    }
    return false;
  }

  public ValidationResult checkSchedule() {
    Object schedule = get(SCHEDULE);
    if (schedule != null && !(schedule instanceof String)) {
      return ValidationResult.error(
          SCHEDULE,
          String.format("The specified schedule \"%s\" is invalid", schedule));
    }
    return ScheduleValidator.validate((String) schedule);
  }

  /**
   * Checks the schedule time zone. Any value is accepted.
   *
   * <p>Note that the accepted zone format differs from the one in {@code schedule}: this field
   * takes a tz database name (e.g. {@code America/Los_Angeles}), while the start time of a
   * schedule carries an ISO 8601 zone designator (e.g. {@code -08:00}). The two are not
   * cross-checked.
   *
   * @return A valid result.
   */
  public ValidationResult checkScheduleTimeZone() {
    return ValidationResult.valid();
  }

  public ValidationResult checkArgs() {
    Object args = get(ARGS);
    if (args != null && !isListOf(args, String.class)) {
      return ValidationResult.error(
          ARGS,
          String.format("The specified args value \"%s\" is not a list of strings.", args));
    }
    return ValidationResult.valid();
  }

  public ValidationResult checkEnv() {
    Object env = get(ENV);
    if (env == null) {
      return ValidationResult.valid();
    }

    boolean valid = env instanceof List;
    if (valid) {
      for (Object entry : (List<?>) env) {
        valid &= entry instanceof Map
            && ((Map<?, ?>) entry).get("name") instanceof String
            && ((Map<?, ?>) entry).get("value") instanceof String;
      }
    }
    if (!valid) {
      return ValidationResult.error(
          ENV,
          String.format(
              "The specified env value \"%s\" is not a list of {name, value} mappings.",
              env));
    }
    return ValidationResult.valid();
  }

  public ValidationResult checkConstraints() {
    Object constraints = get(CONSTRAINTS);
    if (constraints == null) {
      return ValidationResult.valid();
    }

    boolean valid = constraints instanceof List;
    if (valid) {
      for (Object constraint : (List<?>) constraints) {
        valid &= isListOf(constraint, String.class);
      }
    }
    if (!valid) {
      return ValidationResult.error(
          CONSTRAINTS,
          String.format(
              "The specified constraints value \"%s\" is not a list of string lists.",
              constraints));
    }
    return ValidationResult.valid();
  }

  private static boolean isListOf(Object value, Class<?> elementType) {
    return value instanceof List
        && ((List<?>) value).stream().allMatch(elementType::isInstance);
  }

  /**
   * Checks that every authored key is one this system understands, so that a misspelled key
   * fails rather than being silently dropped.
   *
   * @return The validation result.
   */
  public ValidationResult checkSupportedFields() {
    ImmutableList.Builder<Diagnostic> diagnostics = ImmutableList.builder();
    for (String field : getConfig().keySet()) {
      if (!SUPPORTED_FIELDS.contains(field)) {
        diagnostics.add(unsupported(field));
      }
    }
    return ValidationResult.of(diagnostics.build());
  }

  private static Diagnostic unsupported(String param) {
    return Diagnostic.error(
        param,
        String.format("Your Chronos config specifies \"%s\", an unsupported parameter.", param));
  }

  /**
   * Runs the check for a single Chronos parameter.
   *
   * @param param Chronos API name of the parameter, e.g. {@code scheduleTimeZone}.
   * @return The result of the parameter's check. Parameters without a check always pass, and
   *     unknown parameters always fail.
   */
  public ValidationResult check(String param) {
    switch (param) {
      case "epsilon":
        return checkEpsilon();
      case "retries":
        return checkRetries();
      case "cpus":
        return checkCpus();
      case "mem":
        return checkMem();
      case "schedule":
        return checkSchedule();
      case "scheduleTimeZone":
        return checkScheduleTimeZone();
      default:
        return PARAMETERS_WITHOUT_CHECKS.contains(param)
            ? ValidationResult.valid()
            : ValidationResult.of(ImmutableList.of(unsupported(param)));
    }
  }

  /**
   * Validates the whole configuration. Every check runs regardless of earlier failures, so the
   * result reports all problems at once.
   *
   * @return The combined result of all checks.
   */
  @Override
  public ValidationResult validate() {
    ImmutableList.Builder<ValidationResult> results = ImmutableList.builder();
    results.add(super.validate());
    for (String param : CHECKED_PARAMETERS) {
      results.add(check(param));
    }
    results.add(checkArgs())
        .add(checkEnv())
        .add(checkConstraints())
        .add(checkType(DISABLED, Boolean.class, "a boolean"))
        .add(checkType(DESCRIPTION, String.class, "a string"))
        .add(checkType(OWNER, String.class, "a string"))
        .add(checkSupportedFields());
    return ValidationResult.merge(results.build());
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ChronosJobConfig)) {
      return false;
    }

    ChronosJobConfig other = (ChronosJobConfig) o;
    return Objects.equals(jobKey, other.jobKey)
        && Objects.equals(getConfig(), other.getConfig())
        && Objects.equals(getBranch(), other.getBranch());
  }

  @Override
  public int hashCode() {
    return Objects.hash(jobKey, getConfig(), getBranch());
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("jobKey", jobKey)
        .add("config", getConfig())
        .add("branch", getBranch())
        .toString();
  }
}
