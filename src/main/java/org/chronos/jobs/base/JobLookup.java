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

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

import org.chronos.jobs.client.ChronosClient;
import org.chronos.jobs.client.ReportedJob;

import static java.util.Objects.requireNonNull;

/**
 * Finds jobs reported by Chronos whose names match a pattern.
 */
public final class JobLookup {
  private JobLookup() {
    // Utility class.
  }

  /**
   * Retrieves jobs from a Chronos client with names that match {@code pattern}.
   *
   * @see #lookupJobs(String, Iterable, Optional, boolean)
   */
  public static List<ReportedJob> lookupJobs(
      String pattern,
      ChronosClient client,
      Optional<Integer> maxExpected,
      boolean includeDisabled) throws JobLookupException {

    return lookupJobs(pattern, client.list(), maxExpected, includeDisabled);
  }

  /**
   * Filters a job listing to the jobs with names that match {@code pattern}.
   *
   * @param pattern Regular expression searched for anywhere within each job name.
   * @param jobs Job listing to search, in the order reported.
   * @param maxExpected Maximum number of matches expected. The lookup fails if this is exceeded.
   *     A value of zero or less sets no maximum.
   * @param includeDisabled Whether disabled jobs are included in the matches.
   * @return Matching jobs, in listing order.
   * @throws JobLookupException If the pattern is invalid, or more than {@code maxExpected} jobs
   *     match.
   */
  public static List<ReportedJob> lookupJobs(
      String pattern,
      Iterable<ReportedJob> jobs,
      Optional<Integer> maxExpected,
      boolean includeDisabled) throws JobLookupException {

    requireNonNull(jobs);
    Optional<Integer> ceiling = maxExpected.filter(max -> max > 0);

    Pattern regexp;
    try {
      regexp = Pattern.compile(pattern);
    } catch (PatternSyntaxException e) {
      throw new JobLookupException("Invalid regex pattern '" + pattern + "'", e);
    }

    ImmutableList.Builder<ReportedJob> builder = ImmutableList.builder();
    for (ReportedJob job : jobs) {
      if (regexp.matcher(job.getName()).find() && (includeDisabled || !job.isDisabled())) {
        builder.add(job);
      }
    }
    List<ReportedJob> matching = builder.build();

    if (ceiling.isPresent() && matching.size() > ceiling.get()) {
      throw new JobLookupException(String.format(
          "Found %d jobs for pattern '%s', but max_expected is set to %d (ids: %s)",
          matching.size(),
          pattern,
          ceiling.get(),
          Joiner.on(", ").join(Iterables.transform(matching, ReportedJob::getName))));
    }

    return matching;
  }

  /**
   * Thrown when a job lookup cannot be satisfied.
   */
  public static class JobLookupException extends Exception {
    public JobLookupException(String msg, Exception e) {
      super(msg, e);
    }

    public JobLookupException(String msg) {
      super(msg);
    }
  }
}
