package com.wcoptimizer.dto;

/**
 * Common type of every named-analysis outcome. Besides the per-analysis records
 * this covers {@link InsufficientDataResponse} and {@link NotFoundResponse}, which
 * are normal results rather than errors.
 */
public interface AnalysisResult {
}
