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

import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.chronos.jobs.base.JobKey;
import org.chronos.jobs.config.SystemConfig;
import org.chronos.jobs.testing.easymock.EasyMockTest;
import org.junit.Before;
import org.junit.Test;

import static org.easymock.EasyMock.expect;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class ChronosJobConfigLoaderTest extends EasyMockTest {
  private static final String CLUSTER = "norcal";
  private static final SystemConfig SYSTEM_CONFIG =
      new SystemConfig(CLUSTER, "registry.example.com", ImmutableList.of());
  private static final Map<String, Object> JOB_CONFIG =
      ImmutableMap.of("schedule", "R/2015-03-25T19:36:35Z/PT5M");
  private static final BranchRecord BRANCH =
      new BranchRecord("services-foo:jenkins-abc123", "stop");

  private JobConfigSource source;
  private DeploymentSource deployments;
  private ChronosJobConfigLoader loader;

  @Before
  public void setUp() {
    source = createMock(JobConfigSource.class);
    deployments = createMock(DeploymentSource.class);
    loader = new ChronosJobConfigLoader(
        source,
        deployments,
        SYSTEM_CONFIG,
        ChronosJobConfigLoader.DEFAULT_BRANCH_PREFIX);
  }

  @Test
  public void testNaming() {
    control.replay();

    assertEquals("chronos-norcal", ChronosJobConfigLoader.configFileName(CLUSTER));
    assertEquals("deploy-norcal.nightly", loader.defaultBranch(CLUSTER, "nightly"));
  }

  @Test
  public void testLoadWithBranchPrefix() throws Exception {
    expect(source.readServiceConfig("foo", "chronos-norcal"))
        .andReturn(ImmutableMap.of("nightly", JOB_CONFIG));
    expect(deployments.getBranchRecord("foo", "release-norcal.nightly")).andReturn(BRANCH);

    control.replay();

    ChronosJobConfigLoader prefixed =
        new ChronosJobConfigLoader(source, deployments, SYSTEM_CONFIG, "release-");
    assertEquals("release-norcal.nightly", prefixed.defaultBranch(CLUSTER, "nightly"));
    assertEquals(
        new ChronosJobConfig(JobKey.from("foo", "nightly"), JOB_CONFIG, BRANCH),
        prefixed.load("foo", "nightly", CLUSTER));
  }

  @Test
  public void testLoad() throws Exception {
    expect(source.readServiceConfig("foo", "chronos-norcal"))
        .andReturn(ImmutableMap.of("nightly", JOB_CONFIG));
    expect(deployments.getBranchRecord("foo", "deploy-norcal.nightly")).andReturn(BRANCH);

    control.replay();

    assertEquals(
        new ChronosJobConfig(JobKey.from("foo", "nightly"), JOB_CONFIG, BRANCH),
        loader.load("foo", "nightly", CLUSTER));
  }

  @Test
  public void testLoadMissingJob() throws Exception {
    expect(source.readServiceConfig("foo", "chronos-norcal"))
        .andReturn(ImmutableMap.of("nightly", JOB_CONFIG));

    control.replay();

    try {
      loader.load("foo", "hourly", CLUSTER);
      fail();
    } catch (JobConfigNotFoundException e) {
      assertEquals(
          "No job named \"hourly\" in config file chronos-norcal.yaml of service foo",
          e.getMessage());
    }
  }

  @Test
  public void testListJobNamesUsesLocalCluster() {
    expect(source.readServiceConfig("foo", "chronos-norcal"))
        .andReturn(ImmutableMap.of("nightly", JOB_CONFIG, "hourly", JOB_CONFIG));

    control.replay();

    assertEquals(
        ImmutableList.of(JobKey.from("foo", "hourly"), JobKey.from("foo", "nightly")),
        loader.listJobNames("foo"));
  }

  @Test
  public void testGetJobsForCluster() {
    expect(source.listServices()).andReturn(ImmutableSet.of("foo", "bar", "empty"));
    expect(source.readServiceConfig("bar", "chronos-socal"))
        .andReturn(ImmutableMap.of("cleanup", JOB_CONFIG));
    expect(source.readServiceConfig("empty", "chronos-socal")).andReturn(ImmutableMap.of());
    expect(source.readServiceConfig("foo", "chronos-socal"))
        .andReturn(ImmutableMap.of("nightly", JOB_CONFIG));

    control.replay();

    assertEquals(
        ImmutableList.of(JobKey.from("bar", "cleanup"), JobKey.from("foo", "nightly")),
        loader.getJobsForCluster("socal"));
  }
}
