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
package org.chronos.jobs.config;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import org.chronos.jobs.payload.Volume;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Facts about the local cluster that every job submission depends on.
 */
public final class SystemConfig {
  private final String cluster;
  private final String dockerRegistry;
  private final List<Volume> volumes;

  @JsonCreator
  public SystemConfig(
      @JsonProperty("cluster") String cluster,
      @JsonProperty("docker_registry") String dockerRegistry,
      @JsonProperty("volumes") List<Volume> volumes) {

    checkArgument(!Strings.isNullOrEmpty(cluster), "Cluster name cannot be empty.");
    checkArgument(!Strings.isNullOrEmpty(dockerRegistry), "Docker registry cannot be empty.");
    this.cluster = cluster;
    this.dockerRegistry = dockerRegistry;
    this.volumes = volumes == null ? ImmutableList.of() : ImmutableList.copyOf(volumes);
  }

  public String getCluster() {
    return cluster;
  }

  public String getDockerRegistry() {
    return dockerRegistry;
  }

  /**
   * Gets the volumes mounted into every job's container.
   */
  public List<Volume> getVolumes() {
    return volumes;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof SystemConfig)) {
      return false;
    }

    SystemConfig other = (SystemConfig) o;
    return Objects.equals(cluster, other.cluster)
        && Objects.equals(dockerRegistry, other.dockerRegistry)
        && Objects.equals(volumes, other.volumes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(cluster, dockerRegistry, volumes);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("cluster", cluster)
        .add("dockerRegistry", dockerRegistry)
        .add("volumes", volumes)
        .toString();
  }
}
