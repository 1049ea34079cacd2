package com.lucidchart.imagediff;

/** The frozen settings of a single difference run, taken from a {@link With} context. */
public final class DiffConfig {
    public final boolean normalized;
    public final double scale;
    public final double normalizedScale;
    public final DiffMode diffMode;
    public final boolean includeInputs;
    public final boolean verbose;
    public final int parallelism;

    private DiffConfig(boolean normalized, double scale, double normalizedScale, DiffMode diffMode,
                       boolean includeInputs, boolean verbose, int parallelism) {
        this.normalized = normalized;
        this.scale = scale;
        this.normalizedScale = normalizedScale;
        this.diffMode = diffMode;
        this.includeInputs = includeInputs;
        this.verbose = verbose;
        this.parallelism = Math.max(1, parallelism);
    }

    static DiffConfig of(With with) {
        return new DiffConfig(
                with.isNormalized(),
                with.getScale(),
                with.getNormalizedScale(),
                with.getDiffMode(),
                with.isIncludeInputs(),
                with.isVerbose(),
                with.getParallelism());
    }

    /** The amplification actually applied: the normalized scale for normalized runs, the plain scale otherwise */
    public double getScaleFactor() {
        return normalized ? normalizedScale : scale;
    }

    @Override
    public String toString() {
        return "DiffConfig{normalized=" + normalized +
                ", scaleFactor=" + getScaleFactor() +
                ", diffMode=" + diffMode.key +
                ", includeInputs=" + includeInputs +
                ", parallelism=" + parallelism + "}";
    }
}
