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
package org.chronos.jobs.payload;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import org.chronos.jobs.configuration.EnvironmentVariable;

import static java.util.Objects.requireNonNull;

/**
 * A job definition in the exact shape accepted by the Chronos API.
 */
@JsonPropertyOrder({
    "name",
    "container",
    "environmentVariables",
    "mem",
    "cpus",
    "constraints",
    "command",
    "arguments",
    "epsilon",
    "retries",
    "async",
    "disabled",
    "owner",
    "schedule",
    "scheduleTimeZone"})
public final class ChronosJobPayload {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /**
   * The container a job runs in. Only docker containers on bridge networking are supported.
   */
  @JsonPropertyOrder({"image", "network", "type", "volumes"})
  public static final class Container {
    public static final String NETWORK = "BRIDGE";
    public static final String TYPE = "DOCKER";

    private final String image;
    private final List<Volume> volumes;

    public Container(String image, List<Volume> volumes) {
      this.image = requireNonNull(image);
      this.volumes = ImmutableList.copyOf(volumes);
    }

    @JsonProperty("image")
    public String getImage() {
      return image;
    }

    @JsonProperty("network")
    public String getNetwork() {
      return NETWORK;
    }

    @JsonProperty("type")
    public String getType() {
      return TYPE;
    }

    @JsonProperty("volumes")
    public List<Volume> getVolumes() {
      return volumes;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Container)) {
        return false;
      }

      Container other = (Container) o;
      return Objects.equals(image, other.image)
          && Objects.equals(volumes, other.volumes);
    }

    @Override
    public int hashCode() {
      return Objects.hash(image, volumes);
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("image", image)
          .add("volumes", volumes)
          .toString();
    }
  }

  private final String name;
  private final Container container;
  private final List<EnvironmentVariable> environmentVariables;
  private final double mem;
  private final double cpus;
  @Nullable
  private final List<List<String>> constraints;
  @Nullable
  private final String command;
  @Nullable
  private final List<String> arguments;
  private final String epsilon;
  private final int retries;
  private final boolean disabled;
  @Nullable
  private final String owner;
  private final String schedule;
  @Nullable
  private final String scheduleTimeZone;

  private ChronosJobPayload(Builder builder) {
    this.name = requireNonNull(builder.name);
    this.container = requireNonNull(builder.container);
    this.environmentVariables = ImmutableList.copyOf(builder.environmentVariables);
    this.mem = builder.mem;
    this.cpus = builder.cpus;
    this.constraints =
        builder.constraints == null ? null : ImmutableList.copyOf(builder.constraints);
    this.command = builder.command;
    this.arguments = builder.arguments == null ? null : ImmutableList.copyOf(builder.arguments);
    this.epsilon = requireNonNull(builder.epsilon);
    this.retries = builder.retries;
    this.disabled = builder.disabled;
    this.owner = builder.owner;
    this.schedule = requireNonNull(builder.schedule);
    this.scheduleTimeZone = builder.scheduleTimeZone;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .setName(name)
        .setContainer(container)
        .setEnvironmentVariables(environmentVariables)
        .setMem(mem)
        .setCpus(cpus)
        .setConstraints(constraints)
        .setCommand(command)
        .setArguments(arguments)
        .setEpsilon(epsilon)
        .setRetries(retries)
        .setDisabled(disabled)
        .setOwner(owner)
        .setSchedule(schedule)
        .setScheduleTimeZone(scheduleTimeZone);
  }

  public ChronosJobPayload withName(String newName) {
    return toBuilder().setName(newName).build();
  }

  public ChronosJobPayload withDisabled(boolean newDisabled) {
    return toBuilder().setDisabled(newDisabled).build();
  }

  @JsonProperty("name")
  public String getName() {
    return name;
  }

  @JsonProperty("container")
  public Container getContainer() {
    return container;
  }

  @JsonProperty("environmentVariables")
  public List<EnvironmentVariable> getEnvironmentVariables() {
    return environmentVariables;
  }

  @JsonProperty("mem")
  public double getMem() {
    return mem;
  }

  @JsonProperty("cpus")
  public double getCpus() {
    return cpus;
  }

  @Nullable
  @JsonProperty("constraints")
  public List<List<String>> getConstraints() {
    return constraints;
  }

  @Nullable
  @JsonProperty("command")
  public String getCommand() {
    return command;
  }

  @Nullable
  @JsonProperty("arguments")
  public List<String> getArguments() {
    return arguments;
  }

  @JsonProperty("epsilon")
  public String getEpsilon() {
    return epsilon;
  }

  @JsonProperty("retries")
  public int getRetries() {
    return retries;
  }

  /**
   * Always {@code false}: asynchronous jobs are not supported.
   */
  @JsonProperty("async")
  public boolean isAsync() {
    return false;
  }

  @JsonProperty("disabled")
  public boolean isDisabled() {
    return disabled;
  }

  @Nullable
  @JsonProperty("owner")
  public String getOwner() {
    return owner;
  }

  @JsonProperty("schedule")
  public String getSchedule() {
    return schedule;
  }

  @Nullable
  @JsonProperty("scheduleTimeZone")
  public String getScheduleTimeZone() {
    return scheduleTimeZone;
  }

  /**
   * Renders the payload as a mapping keyed by Chronos API field names, as it is serialized for
   * submission. Unset optional fields map to {@code null}.
   *
   * @return An unmodifiable mapping in API field order.
   */
  public Map<String, Object> toMap() {
    return Collections.unmodifiableMap(
        MAPPER.convertValue(this, new TypeReference<LinkedHashMap<String, Object>>() { }));
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ChronosJobPayload && toMap().equals(((ChronosJobPayload) o).toMap());
  }

  @Override
  public int hashCode() {
    return toMap().hashCode();
  }

  @Override
  public String toString() {
    return toMap().toString();
  }

  /**
   * Builder for {@link ChronosJobPayload}.
   */
  public static final class Builder {
    private String name;
    private Container container;
    private List<EnvironmentVariable> environmentVariables = ImmutableList.of();
    private double mem;
    private double cpus;
    private List<List<String>> constraints;
    private String command;
    private List<String> arguments;
    private String epsilon;
    private int retries;
    private boolean disabled;
    private String owner;
    private String schedule;
    private String scheduleTimeZone;

    private Builder() {
      // Use ChronosJobPayload.builder().
    }

    public Builder setName(String name) {
      this.name = name;
      return this;
    }

    public Builder setContainer(Container container) {
      this.container = container;
      return this;
    }

    public Builder setEnvironmentVariables(List<EnvironmentVariable> environmentVariables) {
      this.environmentVariables = requireNonNull(environmentVariables);
      return this;
    }

    public Builder setMem(double mem) {
      this.mem = mem;
      return this;
    }

    public Builder setCpus(double cpus) {
      this.cpus = cpus;
      return this;
    }

    public Builder setConstraints(@Nullable List<List<String>> constraints) {
      this.constraints = constraints;
      return this;
    }

    public Builder setCommand(@Nullable String command) {
      this.command = command;
      return this;
    }

    public Builder setArguments(@Nullable List<String> arguments) {
      this.arguments = arguments;
      return this;
    }

    public Builder setEpsilon(String epsilon) {
      this.epsilon = epsilon;
      return this;
    }

    public Builder setRetries(int retries) {
      this.retries = retries;
      return this;
    }

    public Builder setDisabled(boolean disabled) {
      this.disabled = disabled;
      return this;
    }

    public Builder setOwner(@Nullable String owner) {
      this.owner = owner;
      return this;
    }

    public Builder setSchedule(String schedule) {
      this.schedule = schedule;
      return this;
    }

    public Builder setScheduleTimeZone(@Nullable String scheduleTimeZone) {
      this.scheduleTimeZone = scheduleTimeZone;
      return this;
    }

    public ChronosJobPayload build() {
      return new ChronosJobPayload(this);
    }
  }
}
