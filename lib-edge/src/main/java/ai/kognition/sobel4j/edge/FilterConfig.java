/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package ai.kognition.sobel4j.edge;

import ai.kognition.sobel4j.image.ConfigurationException;
import ai.kognition.sobel4j.image.Threshold;

/**
 * <p>
 * The tunable parameters of an {@link EdgeDetector}.
 * </p>
 *
 * <ul>
 * <li>{@code threshold} - binarization threshold in {@code [0, 255]}</li>
 * <li>{@code normalize} - clamp gradient magnitudes to {@code [0, 255]} rather than keeping their low byte</li>
 * <li>{@code useBlur} - smooth the input with a 3x3 Gaussian before computing the gradient</li>
 * <li>{@code blurSigma} - the standard deviation of that Gaussian. Must be positive.</li>
 * </ul>
 *
 * <p>
 * Every setter validates its value and throws a {@link ConfigurationException}, leaving the
 * configuration unchanged, if it's out of range. Values are never clamped. Instances are safe to
 * modify while a detector is running. Each call on the detector works from a {@link #copy()}
 * taken when it starts.
 * </p>
 */
public class FilterConfig {
    public static final int DEFAULT_THRESHOLD = 50;
    public static final boolean DEFAULT_NORMALIZE = true;
    public static final boolean DEFAULT_USE_BLUR = false;
    public static final double DEFAULT_BLUR_SIGMA = 1.0;

    private int threshold;
    private boolean normalize;
    private boolean useBlur;
    private double blurSigma;

    public FilterConfig() {
        this(DEFAULT_THRESHOLD, DEFAULT_NORMALIZE, DEFAULT_USE_BLUR, DEFAULT_BLUR_SIGMA);
    }

    public FilterConfig(final int threshold, final boolean normalize, final boolean useBlur, final double blurSigma)
        throws ConfigurationException {
        checkThreshold(threshold);
        checkSigma(blurSigma);
        this.threshold = threshold;
        this.normalize = normalize;
        this.useBlur = useBlur;
        this.blurSigma = blurSigma;
    }

    public static class Builder {
        private int threshold = DEFAULT_THRESHOLD;
        private boolean normalize = DEFAULT_NORMALIZE;
        private boolean useBlur = DEFAULT_USE_BLUR;
        private double blurSigma = DEFAULT_BLUR_SIGMA;

        public Builder threshold(final int threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder normalize(final boolean normalize) {
            this.normalize = normalize;
            return this;
        }

        public Builder useBlur(final boolean useBlur) {
            this.useBlur = useBlur;
            return this;
        }

        public Builder blurSigma(final double blurSigma) {
            this.blurSigma = blurSigma;
            return this;
        }

        /**
         * @throws ConfigurationException if any of the values are out of range
         */
        public FilterConfig build() throws ConfigurationException {
            return new FilterConfig(threshold, normalize, useBlur, blurSigma);
        }
    }

    public synchronized int getThreshold() {
        return threshold;
    }

    public synchronized boolean isNormalize() {
        return normalize;
    }

    public synchronized boolean isUseBlur() {
        return useBlur;
    }

    public synchronized double getBlurSigma() {
        return blurSigma;
    }

    public synchronized FilterConfig setThreshold(final int threshold) throws ConfigurationException {
        checkThreshold(threshold);
        this.threshold = threshold;
        return this;
    }

    public synchronized FilterConfig setNormalize(final boolean normalize) {
        this.normalize = normalize;
        return this;
    }

    public synchronized FilterConfig setUseBlur(final boolean useBlur) {
        this.useBlur = useBlur;
        return this;
    }

    public synchronized FilterConfig setBlurSigma(final double blurSigma) throws ConfigurationException {
        checkSigma(blurSigma);
        this.blurSigma = blurSigma;
        return this;
    }

    /**
     * A consistent snapshot of this configuration.
     */
    public synchronized FilterConfig copy() {
        return new FilterConfig(threshold, normalize, useBlur, blurSigma);
    }

    static void checkThreshold(final int threshold) throws ConfigurationException {
        if(!Threshold.isValid(threshold))
            throw new ConfigurationException("threshold must be between " + Threshold.MIN + " and " + Threshold.MAX + " but was " + threshold);
    }

    static void checkSigma(final double sigma) throws ConfigurationException {
        // written this way so NaN fails
        if(!(sigma > 0.0))
            throw new ConfigurationException("blurSigma must be positive but was " + sigma);
    }

    @Override
    public synchronized String toString() {
        return "FilterConfig[threshold=" + threshold + ", normalize=" + normalize + ", useBlur=" + useBlur + ", blurSigma=" + blurSigma + "]";
    }
}
