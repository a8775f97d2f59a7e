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

import java.util.Optional;

import net.dempsy.util.QuietCloseable;

import ai.kognition.sobel4j.image.ConfigurationException;
import ai.kognition.sobel4j.image.RasterImage;
import ai.kognition.sobel4j.image.Threshold;

/**
 * <p>
 * A Sobel edge detector. Every implementation computes exactly the same result. They differ only
 * in how the work is spread over threads.
 * </p>
 *
 * <p>
 * Instances are safe to call from several threads at once. An instance that owns worker threads
 * releases them in {@link #close()}.
 * </p>
 */
public interface EdgeDetector extends QuietCloseable {

    /**
     * Compute the gradient magnitude image.
     *
     * @param image an 8-bit single channel image
     *
     * @return {@link Optional#empty()} if the image can't be processed. Otherwise the gradient image which
     *     has the same dimensions as the input and a zero border.
     */
    Optional<RasterImage> computeEdges(RasterImage image);

    /**
     * Compute the gradient magnitude image and binarize it.
     *
     * @param image an 8-bit single channel image
     * @param thresholdOverride a threshold in {@code [0, 255]} or {@link Threshold#USE_DEFAULT} to
     *     use the configured one.
     *
     * @return {@link Optional#empty()} if the image can't be processed or the threshold is out of range.
     *     Otherwise an image where every pixel is either 0 or 255.
     */
    Optional<RasterImage> computeEdgesThresholded(RasterImage image, int thresholdOverride);

    default Optional<RasterImage> computeEdgesThresholded(final RasterImage image) {
        return computeEdgesThresholded(image, Threshold.USE_DEFAULT);
    }

    String getName();

    /**
     * A human readable description including the current configuration.
     */
    String describe();

    boolean isAvailable();

    /**
     * The wall clock time of the last successful call in milliseconds or {@code -1} if there hasn't been one
     * since creation or the last {@link #resetStats()}.
     */
    double lastDurationMs();

    void resetStats();

    /**
     * The live configuration. Changes made through it apply to calls started afterward.
     */
    FilterConfig config();

    default EdgeDetector setThreshold(final int threshold) throws ConfigurationException {
        config().setThreshold(threshold);
        return this;
    }

    default EdgeDetector setNormalize(final boolean normalize) {
        config().setNormalize(normalize);
        return this;
    }

    default EdgeDetector setUseBlur(final boolean useBlur) {
        config().setUseBlur(useBlur);
        return this;
    }

    default EdgeDetector setBlurSigma(final double blurSigma) throws ConfigurationException {
        config().setBlurSigma(blurSigma);
        return this;
    }
}
