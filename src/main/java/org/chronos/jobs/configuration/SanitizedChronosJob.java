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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.chronos.jobs.base.JobKey;

import static java.util.Objects.requireNonNull;

import static org.chronos.jobs.configuration.ChronosJobConfig.ARGS;
import static org.chronos.jobs.configuration.ChronosJobConfig.CONSTRAINTS;
import static org.chronos.jobs.configuration.ChronosJobConfig.DEFAULT_EPSILON;
import static org.chronos.jobs.configuration.ChronosJobConfig.DEFAULT_RETRIES;
import static org.chronos.jobs.configuration.ChronosJobConfig.DESCRIPTION;
import static org.chronos.jobs.configuration.ChronosJobConfig.DISABLED;
import static org.chronos.jobs.configuration.ChronosJobConfig.ENV;
import static org.chronos.jobs.configuration.ChronosJobConfig.EPSILON;
import static org.chronos.jobs.configuration.ChronosJobConfig.OWNER;
import static org.chronos.jobs.configuration.ChronosJobConfig.RETRIES;
import static org.chronos.jobs.configuration.ChronosJobConfig.SCHEDULE;
import static org.chronos.jobs.configuration.ChronosJobConfig.SCHEDULE_TIME_ZONE;
import static org.chronos.jobs.configuration.InstanceConfig.CMD;
import static org.chronos.jobs.configuration.InstanceConfig.CPUS;
import static org.chronos.jobs.configuration.InstanceConfig.DEFAULT_CPUS;
import static org.chronos.jobs.configuration.InstanceConfig.DEFAULT_MEM;
import static org.chronos.jobs.configuration.InstanceConfig.MEM;
import static org.chronos.jobs.configuration.InstanceConfig.MONITORING;

/**
 * Wrapper for a job configuration that has passed validation, with defaults applied to every
 * optional field.
 */
public final class SanitizedChronosJob {
  private final JobKey jobKey;
  private final BranchRecord branch;
  private final double cpus;
  private final double mem;
  private final Optional<String> cmd;
  private final Map<String, Object> monitoring;
  private final Optional<List<String>> args;
  private final List<EnvironmentVariable> env;
  private final Optional<List<List<String>>> constraints;
  private final String epsilon;
  private final int retries;
  private final boolean disabled;
  private final String schedule;
  private final Optional<String> scheduleTimeZone;
  private final Optional<String> description;
  private final Optional<String> owner;

  private SanitizedChronosJob(ChronosJobConfig config) {
    Map<String, Object> raw = config.getConfig();
    this.jobKey = config.getJobKey();
    this.branch = config.getBranch();
    this.cpus = number(raw, CPUS, DEFAULT_CPUS);
    this.mem = number(raw, MEM, DEFAULT_MEM);
    this.cmd = string(raw, CMD);
    this.monitoring = raw.get(MONITORING) == null
        ? ImmutableMap.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(castMap(raw.get(MONITORING))));
    this.args = Optional.ofNullable((List<?>) raw.get(ARGS)).map(SanitizedChronosJob::strings);
    this.env = environment(raw.get(ENV));
    this.constraints = Optional.ofNullable((List<?>) raw.get(CONSTRAINTS))
        .<List<List<String>>>map(list -> list.stream()
            .map(constraint -> strings((List<?>) constraint))
            .collect(ImmutableList.toImmutableList()));
    this.epsilon = string(raw, EPSILON).orElse(DEFAULT_EPSILON);
    this.retries = raw.get(RETRIES) == null
        ? DEFAULT_RETRIES
        : ((Number) raw.get(RETRIES)).intValue();
    this.disabled = raw.get(DISABLED) != null && (Boolean) raw.get(DISABLED);
    this.schedule = requireNonNull((String) raw.get(SCHEDULE));
    this.scheduleTimeZone = string(raw, SCHEDULE_TIME_ZONE);
    this.description = string(raw, DESCRIPTION);
    this.owner = string(raw, OWNER);
  }

  /**
   * Validates a job configuration and wraps it.
   *
   * @param config Configuration to validate.
   * @return A wrapper with typed access to the configuration.
   * @throws InvalidChronosConfigException If the configuration fails validation. The exception
   *     reports every error found.
   */
  public static SanitizedChronosJob fromUnsanitized(ChronosJobConfig config)
      throws InvalidChronosConfigException {

    ValidationResult result = config.validate();
    if (!result.isValid()) {
      throw new InvalidChronosConfigException(result);
    }
    return new SanitizedChronosJob(config);
  }

  private static double number(Map<String, Object> raw, String key, double defaultValue) {
    Object value = raw.get(key);
    return value == null ? defaultValue : ((Number) value).doubleValue();
  }

  private static Optional<String> string(Map<String, Object> raw, String key) {
    return Optional.ofNullable(raw.get(key)).map(Object::toString);
  }

  private static List<String> strings(List<?> values) {
    return values.stream().map(Object::toString).collect(ImmutableList.toImmutableList());
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> castMap(Object value) {
    return (Map<String, Object>) value;
  }

  private static List<EnvironmentVariable> environment(Object env) {
    if (env == null) {
      return ImmutableList.of();
    }
    return ((List<?>) env).stream()
        .map(entry -> (Map<?, ?>) entry)
        .map(entry -> new EnvironmentVariable(
            (String) entry.get("name"),
            (String) entry.get("value")))
        .collect(ImmutableList.toImmutableList());
  }

  public JobKey getJobKey() {
    return jobKey;
  }

  public BranchRecord getBranch() {
    return branch;
  }

  public double getCpus() {
    return cpus;
  }

  public double getMem() {
    return mem;
  }

  public Optional<String> getCmd() {
    return cmd;
  }

  public Map<String, Object> getMonitoring() {
    return monitoring;
  }

  public Optional<List<String>> getArgs() {
    return args;
  }

  public List<EnvironmentVariable> getEnv() {
    return env;
  }

  public Optional<List<List<String>>> getConstraints() {
    return constraints;
  }

  public String getEpsilon() {
    return epsilon;
  }

  public int getRetries() {
    return retries;
  }

  public boolean isDisabled() {
    return disabled;
  }

  public String getSchedule() {
    return schedule;
  }

  public Optional<String> getScheduleTimeZone() {
    return scheduleTimeZone;
  }

  public Optional<String> getDescription() {
    return description;
  }

  /**
   * Gets the owner named explicitly in the configuration, if any.
   */
  public Optional<String> getOwner() {
    return owner;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("jobKey", jobKey)
        .add("schedule", schedule)
        .add("epsilon", epsilon)
        .add("retries", retries)
        .add("disabled", disabled)
        .toString();
  }
}
