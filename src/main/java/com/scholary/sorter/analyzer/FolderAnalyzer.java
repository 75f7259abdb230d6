package com.scholary.sorter.analyzer;

import com.scholary.sorter.job.Proposal;

/**
 * Produces a metadata proposal for one folder.
 *
 * <p>Implementations may block for a long time; callers are expected to bound the call.
 */
public interface FolderAnalyzer {

  /**
   * Propose artist/album/year/release type for a folder.
   *
   * @param request the folder snapshot plus any human feedback from a previous attempt
   * @return a non-blank proposal
   * @throws AnalyzerException if no usable proposal could be produced
   */
  Proposal analyze(AnalysisRequest request);
}
