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

import java.util.HashMap;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.chronos.jobs.base.JobKey;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class ChronosJobConfigTest {
  static final JobKey JOB_KEY = JobKey.from("test_service", "test_job");
  static final String SCHEDULE = "R/2015-03-25T19:36:35Z/PT5M";
  static final BranchRecord BRANCH = new BranchRecord("test_service:jenkins-abc123", "start");

  static Map<String, Object> minimalConfig() {
    Map<String, Object> config = new HashMap<>();
    config.put("schedule", SCHEDULE);
    return config;
  }

  static ChronosJobConfig makeConfig(Map<String, Object> config) {
    return new ChronosJobConfig(JOB_KEY, config, BRANCH);
  }

  private static ChronosJobConfig makeConfig(String key, Object value) {
    Map<String, Object> config = minimalConfig();
    config.put(key, value);
    return makeConfig(config);
  }

  @Test
  public void testMinimalConfigIsValid() {
    ValidationResult result = makeConfig(minimalConfig()).validate();
    assertTrue(result.isValid());
    assertEquals(ImmutableList.of(), result.getDiagnostics());
  }

  @Test
  public void testFullConfigIsValid() {
    Map<String, Object> config = minimalConfig();
    config.put("cpus", 1);
    config.put("mem", 512.5);
    config.put("cmd", "/bin/true");
    config.put("monitoring", ImmutableMap.of("team", "batch"));
    config.put("args", ImmutableList.of("--verbose"));
    config.put("env", ImmutableList.of(ImmutableMap.of("name", "FOO", "value", "bar")));
    config.put("constraints", ImmutableList.of(ImmutableList.of("rack", "EQUALS", "rack-1")));
    config.put("epsilon", "PT30M");
    config.put("retries", 5);
    config.put("disabled", true);
    config.put("schedule_time_zone", "America/Los_Angeles");
    config.put("description", "Nightly batch");
    config.put("owner", "batch@example.com");

    assertEquals(ImmutableList.of(), makeConfig(config).validate().getDiagnostics());
  }

  @Test
  public void testNullValuesAreAbsent() {
    Map<String, Object> config = minimalConfig();
    config.put("retries", null);
    config.put("epsilon", null);
    assertTrue(makeConfig(config).validate().isValid());
  }

  @Test
  public void testCheckEpsilon() {
    assertTrue(makeConfig("epsilon", "PT60S").checkEpsilon().isValid());
    assertTrue(makeConfig(minimalConfig()).checkEpsilon().isValid());
    assertEquals(
        ImmutableList.of(
            "The specified epsilon value \"sixty\" does not conform to the ISO8601 format."),
        makeConfig("epsilon", "sixty").checkEpsilon().getErrorMessages());
    assertFalse(makeConfig("epsilon", 60).checkEpsilon().isValid());
  }

  @Test
  public void testCheckRetries() {
    assertTrue(makeConfig("retries", 0).checkRetries().isValid());
    assertTrue(makeConfig("retries", 3L).checkRetries().isValid());
    assertEquals(
        ImmutableList.of("The specified retries value \"three\" is not a valid int."),
        makeConfig("retries", "three").checkRetries().getErrorMessages());
    assertFalse(makeConfig("retries", 1.5).checkRetries().isValid());
    assertFalse(makeConfig("retries", Long.MAX_VALUE).checkRetries().isValid());
  }

  @Test
  public void testCheckResources() {
    assertTrue(makeConfig("cpus", 0.5).checkCpus().isValid());
    assertEquals(
        ImmutableList.of("The specified cpus value \"lots\" is not a valid float or int."),
        makeConfig("cpus", "lots").checkCpus().getErrorMessages());
    assertEquals(
        ImmutableList.of("cpus must be greater than 0.0"),
        makeConfig("cpus", 0).checkCpus().getErrorMessages());
    assertEquals(
        ImmutableList.of("mem must be greater than 0.0"),
        makeConfig("mem", -1).checkMem().getErrorMessages());
  }

  @Test
  public void testCheckScheduleMissing() {
    assertEquals(
        ImmutableList.of("You must specify a \"schedule\" in your configuration"),
        makeConfig(new HashMap<>()).checkSchedule().getErrorMessages());
  }

  @Test
  public void testCheckScheduleNotString() {
    assertEquals(
        ImmutableList.of("The specified schedule \"5\" is invalid"),
        makeConfig("schedule", 5).checkSchedule().getErrorMessages());
  }

  @Test
  public void testScheduleTimeZoneIsPermissive() {
    assertTrue(makeConfig("schedule_time_zone", "Not/AZone").checkScheduleTimeZone().isValid());
    assertTrue(makeConfig(minimalConfig()).check("scheduleTimeZone").isValid());
  }

  @Test
  public void testCheckDispatch() {
    ChronosJobConfig config = makeConfig("retries", "three");
    assertFalse(config.check("retries").isValid());
    assertTrue(config.check("epsilon").isValid());
    for (String param : new String[] {"description", "command", "owner", "disabled"}) {
      assertTrue(param, config.check(param).isValid());
    }
    assertEquals(
        ImmutableList.of("Your Chronos config specifies \"bogus\", an unsupported parameter."),
        config.check("bogus").getErrorMessages());
  }

  @Test
  public void testUnsupportedField() {
    ValidationResult result = makeConfig("retriesx", 3).validate();
    assertFalse(result.isValid());
    assertEquals(
        ImmutableList.of(Diagnostic.error(
            "retriesx",
            "Your Chronos config specifies \"retriesx\", an unsupported parameter.")),
        result.getDiagnostics());
  }

  @Test
  public void testEverySupportedFieldIsAccepted() {
    Map<String, Object> config = new HashMap<>();
    for (String field : ChronosJobConfig.SUPPORTED_FIELDS) {
      config.put(field, null);
    }
    config.put("schedule", SCHEDULE);
    assertTrue(makeConfig(config).checkSupportedFields().isValid());
  }

  @Test
  public void testValidateReportsEveryFailure() {
    Map<String, Object> config = minimalConfig();
    config.put("epsilon", "sixty");
    config.put("retries", "three");

    ValidationResult result = makeConfig(config).validate();
    assertFalse(result.isValid());
    assertEquals(
        ImmutableList.of(
            "The specified epsilon value \"sixty\" does not conform to the ISO8601 format.",
            "The specified retries value \"three\" is not a valid int."),
        result.getErrorMessages());
    assertEquals("epsilon", result.getErrors().get(0).getField());
    assertEquals("retries", result.getErrors().get(1).getField());
  }

  @Test
  public void testValidateSharedAndShapeChecks() {
    Map<String, Object> config = new HashMap<>();
    config.put("cmd", ImmutableList.of("not", "a", "string"));
    config.put("monitoring", "team");
    config.put("args", "--verbose");
    config.put("env", ImmutableList.of(ImmutableMap.of("name", "FOO")));
    config.put("constraints", ImmutableList.of("rack"));
    config.put("disabled", "yes");
    config.put("description", 7);
    config.put("owner", false);
    config.put("mem", "big");
    config.put("typo", 1);

    ValidationResult result = makeConfig(config).validate();
    assertEquals(
        ImmutableList.of(
            "cmd", "monitoring", "mem", "schedule", "args", "env", "constraints",
            "disabled", "description", "owner", "typo"),
        result.getErrors().stream()
            .map(Diagnostic::getField)
            .collect(ImmutableList.toImmutableList()));
  }

  @Test
  public void testEmptyStartTimeDoesNotFailValidation() {
    ValidationResult result = makeConfig("schedule", "R//PT1H").validate();
    assertTrue(result.isValid());
    assertEquals(1, result.getWarnings().size());
  }

  @Test
  public void testEquality() {
    assertEquals(makeConfig(minimalConfig()), makeConfig(minimalConfig()));
    assertEquals(makeConfig(minimalConfig()).hashCode(), makeConfig(minimalConfig()).hashCode());
    assertNotEquals(makeConfig(minimalConfig()), makeConfig("retries", 1));
    assertNotEquals(
        makeConfig(minimalConfig()),
        new ChronosJobConfig(JOB_KEY, minimalConfig(), BranchRecord.empty()));
  }

  @Test
  public void testBranchAccessors() {
    ChronosJobConfig config = makeConfig(minimalConfig());
    assertEquals("test_service", config.getServiceName());
    assertEquals("test_job", config.getJobName());
    assertEquals("test_service:jenkins-abc123", config.getDockerImage());
    assertEquals(DesiredState.START, config.getDesiredState().get());
  }
}
