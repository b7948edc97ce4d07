package com.rapidlayout.solver;

public final class SolveResult {

    private final SolveStatus status;
    private final long[] values;
    private final double objectiveValue;
    private final double wallTimeSec;
    private final String message;

    public SolveResult(SolveStatus status, long[] values, double objectiveValue, double wallTimeSec, String message) {
        assert !status.hasSolution() || values != null;
        this.status = status;
        this.values = values;
        this.objectiveValue = objectiveValue;
        this.wallTimeSec = wallTimeSec;
        this.message = message;
    }

    public static SolveResult failure(SolveStatus status, String message) {
        return new SolveResult(status, null, Double.NaN, 0.0, message);
    }

    public SolveStatus getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status.hasSolution();
    }

    public long getValue(int varId) {
        if (values == null) {
            throw new IllegalStateException("No solution available, solver status is " + status);
        }
        return values[varId];
    }

    public double getObjectiveValue() {
        return objectiveValue;
    }

    public double getWallTimeSec() {
        return wallTimeSec;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return String.format("%s (objective=%.1f, time=%.2fs)", status, objectiveValue, wallTimeSec);
        }
        return message == null || message.isEmpty() ? status.toString() : status + ": " + message;
    }
}
