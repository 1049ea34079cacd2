package com.lucidchart.imagediff;

/** A flexible way of specifying arguments in chain for an image difference
 * This enables semantic image calls and flexible updates of arguments without needing to maintain so many factory alternatives.
 * The values are frozen into a {@link DiffConfig} when the difference is computed.
 */
public class With {
    public static final double DEFAULT_SCALE = 2.0;
    public static final double DEFAULT_NORMALIZED_SCALE = 50.0;

    private boolean normalizedHolder = false;
    private double scaleHolder = DEFAULT_SCALE;
    private double normalizedScaleHolder = DEFAULT_NORMALIZED_SCALE;
    private DiffMode diffModeHolder = DiffMode.COLOR;
    private boolean includeInputsHolder = false;
    private boolean verboseHolder = false;

    /** Logical parallelism of the host, used to size the chunk grid */
    private int parallelismHolder = Runtime.getRuntime().availableProcessors();

    private With(){}

    /** Provides a With object to enable easy chaining of context options */
    public static With context() {
        return new With();
    }

    /** Compare each channel as a z-score of its own image, which corrects global brightness and contrast differences */
    public With normalized(boolean normalized) {
        normalizedHolder = normalized;
        return this;
    }

    /** Scale factor amplifying differences in non-normalized mode (default 2.0).  Not validated. */
    public With scale(double scale) {
        scaleHolder = scale;
        return this;
    }

    /** Scale factor amplifying differences in normalized mode (default 50.0).  Not validated. */
    public With normalizedScale(double normalizedScale) {
        normalizedScaleHolder = normalizedScale;
        return this;
    }

    public With diffMode(DiffMode diffMode) {
        diffModeHolder = diffMode == null ? DiffMode.COLOR : diffMode;
        return this;
    }

    /** Specify the diff mode by name ('bw', 'gray' or 'color').  Unknown names fall back to color. */
    public With diffMode(String diffMode) {
        diffModeHolder = DiffMode.parseMode(diffMode);
        return this;
    }

    /** Place the left and right inputs on either side of the diff in the output image */
    public With includeInputs(boolean includeInputs) {
        includeInputsHolder = includeInputs;
        return this;
    }

    /** Trace every chunk as it is processed */
    public With verbose(boolean verbose) {
        verboseHolder = verbose;
        return this;
    }

    /** Override the parallelism hint.  Values below 1 are treated as 1. */
    public With parallelism(int parallelism) {
        parallelismHolder = parallelism;
        return this;
    }

    public boolean isNormalized() {
        return normalizedHolder;
    }

    public double getScale() {
        return scaleHolder;
    }

    public double getNormalizedScale() {
        return normalizedScaleHolder;
    }

    public DiffMode getDiffMode() {
        return diffModeHolder;
    }

    public boolean isIncludeInputs() {
        return includeInputsHolder;
    }

    public boolean isVerbose() {
        return verboseHolder;
    }

    public int getParallelism() {
        return Math.max(1, parallelismHolder);
    }
}
