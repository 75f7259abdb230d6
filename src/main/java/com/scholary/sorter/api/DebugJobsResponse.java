package com.scholary.sorter.api;

import com.scholary.sorter.status.JobSummary;
import java.util.List;
import java.util.Map;

/** Diagnostics view: all counts plus recent jobs with their errors. */
public record DebugJobsResponse(Map<String, Long> counts, List<JobSummary> recent) {}
