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
package org.chronos.jobs;

import java.io.File;
import java.nio.charset.StandardCharsets;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Files;
import com.google.inject.AbstractModule;
import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;

import org.chronos.jobs.config.ChronosClientSettings;
import org.chronos.jobs.config.ChronosConfig;
import org.chronos.jobs.config.ChronosNotConfiguredException;
import org.chronos.jobs.config.SystemConfig;
import org.chronos.jobs.configuration.ChronosJobConfigLoader;
import org.chronos.jobs.configuration.DeploymentSource;
import org.chronos.jobs.configuration.JobConfigSource;
import org.chronos.jobs.configuration.OwnerLookup;
import org.chronos.jobs.payload.CompleteConfigFactory;
import org.chronos.jobs.payload.IdentitySource;
import org.chronos.jobs.testing.easymock.EasyMockTest;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class ChronosModuleTest extends EasyMockTest {
  private static final ChronosConfig CHRONOS_CONFIG = new ChronosConfig(
      ImmutableMap.of(
          "url", ImmutableList.of("http://chronos.example.com:4400"),
          "user", "admin",
          "password", "secret"),
      "chronos.json");
  private static final SystemConfig SYSTEM_CONFIG =
      new SystemConfig("norcal", "registry.example.com", ImmutableList.of());

  @Rule
  public TemporaryFolder tmpFolder = new TemporaryFolder();

  private Injector createInjector(ChronosConfig chronosConfig) {
    return createInjector(new ChronosModule(chronosConfig, SYSTEM_CONFIG));
  }

  private Injector createInjector(ChronosModule chronosModule) {
    JobConfigSource source = createMock(JobConfigSource.class);
    DeploymentSource deployments = createMock(DeploymentSource.class);
    IdentitySource identitySource = createMock(IdentitySource.class);

    return Guice.createInjector(
        chronosModule,
        new AbstractModule() {
          @Override
          protected void configure() {
            bind(JobConfigSource.class).toInstance(source);
            bind(DeploymentSource.class).toInstance(deployments);
            bind(IdentitySource.class).toInstance(identitySource);
          }
        });
  }

  @Test
  public void testBindings() {
    control.replay();

    Injector injector = createInjector(CHRONOS_CONFIG);
    assertEquals(
        new ChronosClientSettings("chronos.example.com:4400", "admin", "secret"),
        injector.getInstance(ChronosClientSettings.class));
    assertSame(SYSTEM_CONFIG, injector.getInstance(SystemConfig.class));
    assertTrue(injector.getInstance(OwnerLookup.class)
        instanceof OwnerLookup.FromMonitoringOverrides);
    assertSame(
        injector.getInstance(CompleteConfigFactory.class),
        injector.getInstance(CompleteConfigFactory.class));
    assertEquals(
        "deploy-norcal.nightly",
        injector.getInstance(ChronosJobConfigLoader.class).defaultBranch("norcal", "nightly"));
  }

  @Test
  public void testBranchPrefixBinding() {
    control.replay();

    Injector injector =
        createInjector(new ChronosModule(CHRONOS_CONFIG, SYSTEM_CONFIG, "release-"));
    assertEquals(
        "release-norcal.nightly",
        injector.getInstance(ChronosJobConfigLoader.class).defaultBranch("norcal", "nightly"));
  }

  @Test(expected = CreationException.class)
  public void testIncompleteChronosConfig() {
    control.replay();

    createInjector(new ChronosConfig(ImmutableMap.of("user", "admin"), "chronos.json"));
  }

  @Test
  public void testOptions() throws Exception {
    control.replay();

    File chronosConfig = tmpFolder.newFile("chronos.json");
    Files.asCharSink(chronosConfig, StandardCharsets.UTF_8).write(
        "{\"url\": [\"http://chronos.example.com:4400\"], \"user\": \"u\", \"password\": \"p\"}");
    File systemConfig = tmpFolder.newFile("system.json");
    Files.asCharSink(systemConfig, StandardCharsets.UTF_8)
        .write("{\"cluster\": \"norcal\", \"docker_registry\": \"registry.example.com\"}");

    ChronosModule.Options options = new ChronosModule.Options();
    JCommander.newBuilder()
        .addObject(options)
        .build()
        .parse(
            "-chronos_config=" + chronosConfig,
            "-system_config=" + systemConfig,
            "-deploy_branch_prefix=release-");

    assertEquals(chronosConfig, options.chronosConfig);
    assertEquals(systemConfig, options.systemConfig);
    Injector injector = createInjector(new ChronosModule(options));
    assertEquals("norcal", injector.getInstance(SystemConfig.class).getCluster());
    assertEquals(
        "release-norcal.nightly",
        injector.getInstance(ChronosJobConfigLoader.class).defaultBranch("norcal", "nightly"));
  }

  @Test
  public void testDefaultChronosConfigPath() {
    control.replay();

    ChronosModule.Options options = new ChronosModule.Options();
    JCommander.newBuilder()
        .addObject(options)
        .build()
        .parse("-system_config=/etc/system.json");

    assertEquals(new File(ChronosModule.DEFAULT_CHRONOS_CONFIG), options.chronosConfig);
    assertEquals(ChronosJobConfigLoader.DEFAULT_BRANCH_PREFIX, options.deployBranchPrefix);
  }

  @Test(expected = ParameterException.class)
  public void testSystemConfigRequired() {
    control.replay();

    JCommander.newBuilder()
        .addObject(new ChronosModule.Options())
        .build()
        .parse();
  }

  @Test(expected = ChronosNotConfiguredException.class)
  public void testMissingChronosConfigFile() throws Exception {
    control.replay();

    ChronosModule.Options options = new ChronosModule.Options();
    options.chronosConfig = new File(tmpFolder.getRoot(), "missing.json");
    new ChronosModule(options);
  }
}
