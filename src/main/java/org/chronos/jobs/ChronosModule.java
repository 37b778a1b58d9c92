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

import javax.inject.Singleton;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.google.common.annotations.VisibleForTesting;
import com.google.inject.AbstractModule;

import org.chronos.jobs.config.ChronosClientSettings;
import org.chronos.jobs.config.ChronosConfig;
import org.chronos.jobs.config.ChronosConfigLoader;
import org.chronos.jobs.config.ChronosNotConfiguredException;
import org.chronos.jobs.config.SystemConfig;
import org.chronos.jobs.configuration.ChronosJobConfigLoader;
import org.chronos.jobs.configuration.OwnerLookup;
import org.chronos.jobs.payload.CompleteConfigFactory;
import org.chronos.jobs.payload.PayloadBuilder;

import static java.util.Objects.requireNonNull;

/**
 * Binds the components that translate job configurations into Chronos payloads.
 *
 * Sources of job configuration and deployments ({@code JobConfigSource},
 * {@code DeploymentSource}), the {@code IdentitySource} and the {@code ChronosClient} are
 * provided by the embedding application.
 */
public class ChronosModule extends AbstractModule {
  @VisibleForTesting
  static final String DEFAULT_CHRONOS_CONFIG = "/etc/chronos-jobs/chronos.json";

  @Parameters(separators = "=")
  public static class Options {
    @Parameter(names = "-chronos_config",
        description = "JSON file holding the url, user and password of the Chronos API.")
    public File chronosConfig = new File(DEFAULT_CHRONOS_CONFIG);

    @Parameter(names = "-system_config",
        required = true,
        description = "JSON file holding the cluster name, docker registry and default volumes.")
    public File systemConfig;

    @Parameter(names = "-deploy_branch_prefix",
        description = "Prefix of the branches that jobs are deployed from.")
    public String deployBranchPrefix = ChronosJobConfigLoader.DEFAULT_BRANCH_PREFIX;
  }

  private final ChronosConfig chronosConfig;
  private final SystemConfig systemConfig;
  private final String branchPrefix;

  public ChronosModule(Options options) throws ChronosNotConfiguredException {
    this(
        ChronosConfigLoader.load(options.chronosConfig),
        ChronosConfigLoader.loadSystemConfig(options.systemConfig),
        options.deployBranchPrefix);
  }

  @VisibleForTesting
  public ChronosModule(ChronosConfig chronosConfig, SystemConfig systemConfig) {
    this(chronosConfig, systemConfig, ChronosJobConfigLoader.DEFAULT_BRANCH_PREFIX);
  }

  @VisibleForTesting
  public ChronosModule(
      ChronosConfig chronosConfig,
      SystemConfig systemConfig,
      String branchPrefix) {

    this.chronosConfig = requireNonNull(chronosConfig);
    this.systemConfig = requireNonNull(systemConfig);
    this.branchPrefix = requireNonNull(branchPrefix);
  }

  @Override
  protected void configure() {
    bind(ChronosConfig.class).toInstance(chronosConfig);
    bind(SystemConfig.class).toInstance(systemConfig);
    try {
      bind(ChronosClientSettings.class)
          .toInstance(ChronosConfigLoader.clientSettings(chronosConfig));
    } catch (ChronosNotConfiguredException e) {
      addError(e);
    }

    bind(String.class)
        .annotatedWith(ChronosJobConfigLoader.BranchPrefix.class)
        .toInstance(branchPrefix);

    bind(OwnerLookup.class).to(OwnerLookup.FromMonitoringOverrides.class);
    bind(ChronosJobConfigLoader.class).in(Singleton.class);
    bind(PayloadBuilder.class).in(Singleton.class);
    bind(CompleteConfigFactory.class).in(Singleton.class);
  }
}
