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
import java.util.OptionalInt;

import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.sobel4j.image.ConfigurationException;
import ai.kognition.sobel4j.image.GaussianBlur;
import ai.kognition.sobel4j.image.InvalidImageException;
import ai.kognition.sobel4j.image.OutputRaster;
import ai.kognition.sobel4j.image.RasterImage;
import ai.kognition.sobel4j.image.SobelOperator;
import ai.kognition.sobel4j.image.Threshold;
import ai.kognition.sobel4j.util.Timer;

/**
 * <p>
 * Everything an {@link EdgeDetector} does apart from deciding which thread computes which rows.
 * A call validates the input, snapshots the configuration, then runs up to two passes over the
 * image, each of which is handed to {@link #runRows(int, RowTask)}:
 * </p>
 *
 * <ol>
 * <li>the Gaussian pre-blur, if it's enabled, into an intermediate image</li>
 * <li>the gradient computation, followed in the same task by thresholding of the same rows when a
 * binary result was asked for</li>
 * </ol>
 *
 * <p>
 * A {@link RowTask} only reads the immutable source and only writes its own rows of the destination,
 * so an implementation of {@link #runRows(int, RowTask)} can split {@code [0, rows)} however it likes
 * provided every row is covered exactly once and it doesn't return until all of them are done.
 * </p>
 */
public abstract class BaseEdgeDetector implements EdgeDetector {
    private static final Logger LOGGER = LoggerFactory.getLogger(BaseEdgeDetector.class);

    public static final double NEVER_RUN = -1.0;

    private final String name;
    private final String description;
    private final FilterConfig config;

    private volatile double lastDurationMs = NEVER_RUN;
    private volatile boolean closed = false;

    /**
     * Compute rows {@code [fromRow, toRow)}.
     */
    @FunctionalInterface
    public static interface RowTask {
        void apply(int fromRow, int toRow);
    }

    protected BaseEdgeDetector(final String name, final String description, final FilterConfig config) {
        this.name = Validate.notBlank(name, "name");
        this.description = Validate.notNull(description, "description");
        this.config = Validate.notNull(config, "config");
    }

    /**
     * Run the task over every row in {@code [0, rows)} and return once it's complete.
     *
     * @return false if any part of the task failed in which case the destination is garbage.
     */
    protected abstract boolean runRows(int rows, RowTask task);

    /**
     * A short description of how the work is executed. Added to {@link #describe()}.
     */
    protected abstract String executionInfo();

    @Override
    public Optional<RasterImage> computeEdges(final RasterImage image) {
        return run(image, OptionalInt.empty());
    }

    @Override
    public Optional<RasterImage> computeEdgesThresholded(final RasterImage image, final int thresholdOverride) {
        if(thresholdOverride != Threshold.USE_DEFAULT && !Threshold.isValid(thresholdOverride)) {
            LOGGER.warn("{} was asked to use a threshold of {} which is out of range.", name, thresholdOverride);
            return Optional.empty();
        }
        return run(image, OptionalInt.of(thresholdOverride));
    }

    private Optional<RasterImage> run(final RasterImage image, final OptionalInt thresholdOverride) {
        if(closed) {
            LOGGER.warn("{} has been closed and can't process any more images.", name);
            return Optional.empty();
        }

        final Timer timer = Timer.started();
        final Optional<RasterImage> ret;
        try {
            SobelOperator.validate(image);
            final FilterConfig cfg = config.copy();
            final OptionalInt threshold = thresholdOverride.isPresent()
                ? OptionalInt.of(thresholdOverride.getAsInt() == Threshold.USE_DEFAULT ? cfg.getThreshold() : thresholdOverride.getAsInt())
                : OptionalInt.empty();
            ret = doCompute(image, cfg, threshold);
        } catch(final InvalidImageException | ConfigurationException e) {
            LOGGER.warn("{} failed to process the image: {}", name, e.getMessage());
            return Optional.empty();
        }

        if(ret.isPresent()) {
            timer.stop();
            lastDurationMs = timer.getMillis();
            if(LOGGER.isTraceEnabled())
                LOGGER.trace("{} processed {} in {}", name, image, timer);
        }
        return ret;
    }

    private Optional<RasterImage> doCompute(final RasterImage image, final FilterConfig cfg, final OptionalInt threshold) {
        final int rows = image.rows();
        final int cols = image.cols();

        final RasterImage source;
        if(cfg.isUseBlur()) {
            final double sigma = cfg.getBlurSigma();
            final OutputRaster blurred = new OutputRaster(rows, cols);
            if(!runRows(rows, (from, to) -> GaussianBlur.applyRows(image, blurred, from, to, sigma)))
                return Optional.empty();
            source = blurred.toImage();
        } else
            source = image;

        final boolean normalize = cfg.isNormalize();
        final OutputRaster dst = new OutputRaster(rows, cols);
        final boolean success;
        if(threshold.isPresent()) {
            final int t = threshold.getAsInt();
            success = runRows(rows, (from, to) -> {
                SobelOperator.gradientRows(source, dst, from, to, normalize);
                Threshold.applyRows(dst, from, to, t);
            });
        } else
            success = runRows(rows, (from, to) -> SobelOperator.gradientRows(source, dst, from, to, normalize));

        return success ? Optional.of(dst.toImage()) : Optional.empty();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String describe() {
        return name + " - " + description + " (" + executionInfo() + ") " + config;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public double lastDurationMs() {
        return lastDurationMs;
    }

    @Override
    public void resetStats() {
        lastDurationMs = NEVER_RUN;
    }

    @Override
    public FilterConfig config() {
        return config;
    }

    protected boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
