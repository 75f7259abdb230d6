package com.scholary.sorter.api;

import java.util.List;
import java.util.Map;

/** Response for the status endpoint: counts plus folders waiting for a verdict. */
public record StatusResponse(
    Map<String, Long> counts, long processed, long total, List<FolderRef> ready) {}
