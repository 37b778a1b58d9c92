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

import java.lang.annotation.Retention;
import java.lang.annotation.Target;
import java.util.List;
import java.util.Map;

import javax.inject.Inject;
import javax.inject.Qualifier;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

import org.chronos.jobs.base.JobKey;
import org.chronos.jobs.config.SystemConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;
import static java.util.Objects.requireNonNull;

import static org.chronos.jobs.base.JobIds.INTERNAL_SPACER;

/**
 * Loads Chronos job configurations for a cluster, pairing each job with the deployment of its
 * branch.
 */
public class ChronosJobConfigLoader {
  private static final Logger LOG = LoggerFactory.getLogger(ChronosJobConfigLoader.class);

  static final String CONFIG_FILE_PREFIX = "chronos-";

  /**
   * Prefix of deploy branches when none is configured. Branch naming belongs to the deployment
   * tooling, which is why the prefix is bound rather than fixed here.
   */
  public static final String DEFAULT_BRANCH_PREFIX = "deploy-";

  /**
   * Binding annotation for the prefix of the branches that jobs are deployed from.
   */
  @Qualifier
  @Target({ FIELD, PARAMETER, METHOD }) @Retention(RUNTIME)
  public @interface BranchPrefix { }

  private final JobConfigSource source;
  private final DeploymentSource deployments;
  private final SystemConfig systemConfig;
  private final String branchPrefix;

  @Inject
  public ChronosJobConfigLoader(
      JobConfigSource source,
      DeploymentSource deployments,
      SystemConfig systemConfig,
      @BranchPrefix String branchPrefix) {

    this.source = requireNonNull(source);
    this.deployments = requireNonNull(deployments);
    this.systemConfig = requireNonNull(systemConfig);
    this.branchPrefix = requireNonNull(branchPrefix);
  }

  public static String configFileName(String cluster) {
    return CONFIG_FILE_PREFIX + cluster;
  }

  /**
   * Gets the branch that a job in a cluster is deployed from, e.g. {@code deploy-norcal.batch}
   * with the default prefix.
   */
  public String defaultBranch(String cluster, String job) {
    return branchPrefix + cluster + INTERNAL_SPACER + job;
  }

  /**
   * Reads the authored configuration of all of a service's jobs in a cluster.
   *
   * @param service Service name.
   * @param cluster Cluster name.
   * @return Job name to authored job configuration.
   */
  public Map<String, Map<String, Object>> readJobsForService(String service, String cluster) {
    LOG.info("Reading Chronos configuration file: {}/{}.yaml", service, configFileName(cluster));
    return source.readServiceConfig(service, configFileName(cluster));
  }

  /**
   * Loads a single job configuration.
   *
   * @param service Service name.
   * @param job Job name.
   * @param cluster Cluster name.
   * @return The job configuration, with its branch record resolved.
   * @throws JobConfigNotFoundException If the service does not define the job for the cluster.
   */
  public ChronosJobConfig load(String service, String job, String cluster)
      throws JobConfigNotFoundException {

    Map<String, Map<String, Object>> jobs = readJobsForService(service, cluster);
    Map<String, Object> config = jobs.get(job);
    if (config == null) {
      throw new JobConfigNotFoundException(String.format(
          "No job named \"%s\" in config file %s.yaml of service %s",
          job,
          configFileName(cluster),
          service));
    }

    BranchRecord branch = deployments.getBranchRecord(service, defaultBranch(cluster, job));
    return new ChronosJobConfig(JobKey.from(service, job), config, branch);
  }

  /**
   * Enumerates the jobs a service defines for the local cluster.
   *
   * @see #listJobNames(String, String)
   */
  public List<JobKey> listJobNames(String service) {
    return listJobNames(service, systemConfig.getCluster());
  }

  /**
   * Enumerates the jobs a service defines for a cluster.
   *
   * @param service Service name.
   * @param cluster Cluster name.
   * @return Keys of the service's jobs, sorted by job name.
   */
  public List<JobKey> listJobNames(String service, String cluster) {
    LOG.info("Enumerating all jobs from config file: */{}.yaml", configFileName(cluster));
    List<JobKey> jobs = ImmutableSortedSet.copyOf(readJobsForService(service, cluster).keySet())
        .stream()
        .map(job -> JobKey.from(service, job))
        .collect(ImmutableList.toImmutableList());
    LOG.debug("Enumerated the following jobs: {}", jobs);
    return jobs;
  }

  /**
   * Retrieves every job defined to run on the local cluster.
   *
   * @see #getJobsForCluster(String)
   */
  public List<JobKey> getJobsForCluster() {
    return getJobsForCluster(systemConfig.getCluster());
  }

  /**
   * Retrieves every job defined to run on a cluster, across all services.
   *
   * @param cluster Cluster name.
   * @return Keys of all jobs, grouped by service in service name order.
   */
  public List<JobKey> getJobsForCluster(String cluster) {
    LOG.info("Retrieving all Chronos job names for cluster {}", cluster);
    return ImmutableSortedSet.copyOf(source.listServices()).stream()
        .flatMap(service -> listJobNames(service, cluster).stream())
        .collect(ImmutableList.toImmutableList());
  }
}
