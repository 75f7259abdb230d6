package com.scholary.sorter.analyzer;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.sorter.job.FolderMetadata;

/**
 * Input for one analyzer call.
 *
 * <p>Serialized as-is for the HTTP analyzer, so field names are part of the wire contract.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisRequest(
    String folderPath, FolderMetadata metadata, String feedback, String artistHint) {}
