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

import java.util.Objects;

import com.google.common.base.MoreObjects;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The logical identity of a Chronos job: the service that owns it and the job name within that
 * service. Every revision submitted to Chronos for the same key shares this identity.
 */
public final class JobKey {
  private final String service;
  private final String job;

  private JobKey(String service, String job) {
    this.service = requireNonNull(service);
    this.job = requireNonNull(job);
  }

  /**
   * Creates a job key.
   *
   * @param service Owning service name.
   * @param job Job name within the service.
   * @return A key for {@code (service, job)}.
   * @throws IllegalArgumentException If either component is empty or contains the job id spacer.
   */
  public static JobKey from(String service, String job) {
    checkArgument(isGoodComponent(service), "Invalid service name: '%s'", service);
    checkArgument(isGoodComponent(job), "Invalid job name: '%s'", job);
    return new JobKey(service, job);
  }

  private static boolean isGoodComponent(String component) {
    return component != null && !component.isEmpty() && !component.contains(JobIds.SPACER);
  }

  public String getService() {
    return service;
  }

  public String getJob() {
    return job;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof JobKey)) {
      return false;
    }

    JobKey other = (JobKey) o;
    return Objects.equals(service, other.service)
        && Objects.equals(job, other.job);
  }

  @Override
  public int hashCode() {
    return Objects.hash(service, job);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("service", service)
        .add("job", job)
        .toString();
  }
}
