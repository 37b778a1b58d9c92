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
import java.util.Map;
import java.util.Optional;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import static java.util.Objects.requireNonNull;

/**
 * Configuration shared by every kind of service instance: resources, the command to run, and
 * monitoring overrides, together with the deployment branch the instance runs from.
 *
 * Values are kept as authored. A key that is present with a {@code null} value is treated as
 * absent.
 */
public abstract class InstanceConfig {
  public static final String CPUS = "cpus";
  public static final String MEM = "mem";
  public static final String CMD = "cmd";
  public static final String MONITORING = "monitoring";

  public static final double DEFAULT_CPUS = 0.25;
  public static final double DEFAULT_MEM = 1024;

  /**
   * Keys understood by every instance type.
   */
  protected static final ImmutableSet<String> SHARED_PARAMETERS =
      ImmutableSet.of(CPUS, MEM, CMD, MONITORING);

  private interface Validator<T> {
    Optional<String> validate(T value);
  }

  private static class GreaterThan implements Validator<Number> {
    private final double min;
    private final String label;

    GreaterThan(double min, String label) {
      this.min = min;
      this.label = label;
    }

    @Override
    public Optional<String> validate(Number value) {
      if (this.min >= value.doubleValue()) {
        return Optional.of(label + " must be greater than " + this.min);
      }
      return Optional.empty();
    }
  }

  private static final Validator<Number> CPUS_VALIDATOR = new GreaterThan(0.0, CPUS);
  private static final Validator<Number> MEM_VALIDATOR = new GreaterThan(0.0, MEM);

  private final Map<String, Object> config;
  private final BranchRecord branch;

  protected InstanceConfig(Map<String, ?> config, BranchRecord branch) {
    this.config = Collections.unmodifiableMap(new LinkedHashMap<>(requireNonNull(config)));
    this.branch = requireNonNull(branch);
  }

  /**
   * Gets the configuration as authored.
   */
  public Map<String, Object> getConfig() {
    return config;
  }

  public BranchRecord getBranch() {
    return branch;
  }

  public String getDockerImage() {
    return branch.getDockerImage();
  }

  public Optional<DesiredState> getDesiredState() {
    return branch.getDesiredState();
  }

  protected final boolean isSet(String key) {
    return config.get(key) != null;
  }

  @Nullable
  protected final Object get(String key) {
    return config.get(key);
  }

  protected final Object getOrDefault(String key, Object defaultValue) {
    Object value = config.get(key);
    return value == null ? defaultValue : value;
  }

  public ValidationResult checkCpus() {
    return checkResource(CPUS, CPUS_VALIDATOR);
  }

  public ValidationResult checkMem() {
    return checkResource(MEM, MEM_VALIDATOR);
  }

  private ValidationResult checkResource(String key, Validator<Number> validator) {
    Object value = get(key);
    if (value == null) {
      return ValidationResult.valid();
    }
    if (!(value instanceof Number)) {
      return ValidationResult.error(
          key,
          String.format("The specified %s value \"%s\" is not a valid float or int.", key, value));
    }
    return validator.validate((Number) value)
        .map(msg -> ValidationResult.error(key, msg))
        .orElse(ValidationResult.valid());
  }

  /**
   * Validates the shared keys that are not checked through a named parameter check. Resource
   * checks are run by subclasses alongside their own parameters.
   *
   * @return The validation result.
   */
  public ValidationResult validate() {
    return ValidationResult.merge(ImmutableList.of(
        checkType(CMD, String.class, "a string"),
        checkType(MONITORING, Map.class, "a mapping")));
  }

  /**
   * Checks that a key, if set, holds a value of the given type.
   *
   * @param key Key to check.
   * @param type Required value type.
   * @param description Description of the type for the error message.
   * @return The validation result.
   */
  protected final ValidationResult checkType(String key, Class<?> type, String description) {
    Object value = get(key);
    if (value != null && !type.isInstance(value)) {
      return ValidationResult.error(
          key,
          String.format("The specified %s value \"%s\" is not %s.", key, value, description));
    }
    return ValidationResult.valid();
  }
}
