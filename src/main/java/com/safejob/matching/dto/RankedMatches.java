package com.safejob.matching.dto;

import java.util.List;

/**
 * Ranked output of a recommendation run together with how many pairs were left out because a
 * snapshot could not be loaded or the job was not open.
 */
public record RankedMatches(List<MatchResult> results, int excludedPairs) {}
