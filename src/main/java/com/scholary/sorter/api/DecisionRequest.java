package com.scholary.sorter.api;

import com.scholary.sorter.decision.Verdict;
import com.scholary.sorter.job.Proposal;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request to apply a verdict to a folder's job.
 *
 * <p>{@code proposal} is only read for accept, {@code feedback} only for reconsider.
 */
public record DecisionRequest(
    @NotBlank String path, @NotNull Verdict action, Proposal proposal, String feedback) {}
