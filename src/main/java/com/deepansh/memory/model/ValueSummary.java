package com.deepansh.memory.model;

/**
 * Time saved expressed in whole minutes (floored) and money at an hourly
 * rate. estimatedValue is rounded to cents.
 */
public record ValueSummary(
        long timeSavedMinutes,
        double hourlyRate,
        double estimatedValue,
        int knowledgeSurfaced,
        int decisionsRecalled,
        int patternsApplied,
        int errorsPrevented) {

    public static ValueSummary of(ValueMetrics metrics, double hourlyRate) {
        long secs = metrics.getEstimatedTimeSavedSecs();
        double value = Math.round(secs / 3600.0 * hourlyRate * 100.0) / 100.0;
        return new ValueSummary(secs / 60, hourlyRate, value,
                metrics.getKnowledgeSurfacedCount(),
                metrics.getDecisionsRecalledCount(),
                metrics.getPatternsAppliedCount(),
                metrics.getErrorsPreventedCount());
    }

    public static ValueSummary empty(double hourlyRate) {
        return new ValueSummary(0, hourlyRate, 0.0, 0, 0, 0, 0);
    }
}
