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

package ai.kognition.sobel4j.image;

/**
 * Binarize a gradient image. Every pixel strictly greater than the threshold becomes
 * {@link #ON} ({@code 255}), everything else becomes {@link #OFF} ({@code 0}). This
 * includes the border which, being zero, is always {@link #OFF}.
 */
public final class Threshold {
    /**
     * Passed in place of a threshold to mean "use the configured default".
     */
    public static final int USE_DEFAULT = -1;

    public static final int MIN = 0;
    public static final int MAX = 255;

    public static final int ON = 255;
    public static final int OFF = 0;

    private Threshold() {}

    public static boolean isValid(final int threshold) {
        return threshold >= MIN && threshold <= MAX;
    }

    /**
     * Produce a new binary image from the given gradient image.
     *
     * @throws ConfigurationException if the threshold isn't within {@code [0, 255]}. {@link #USE_DEFAULT} is
     *     resolved by the caller and isn't accepted here.
     */
    public static RasterImage apply(final RasterImage gradient, final int threshold) throws ConfigurationException, InvalidImageException {
        checkThreshold(threshold);
        if(gradient.channels() != 1 || gradient.format().depthBits() != 8)
            throw new InvalidImageException("Thresholding needs an 8-bit single channel image but got " + gradient.format());

        final byte[] src = gradient.data();
        final OutputRaster dst = new OutputRaster(gradient.rows(), gradient.cols());
        final byte[] out = dst.data();
        for(int pos = 0; pos < src.length; pos++)
            out[pos] = binarize(src[pos] & 0xff, threshold);
        return dst.toImage();
    }

    /**
     * Binarize the rows {@code [fromRow, toRow)} of the raster in place. Only those rows are read or written.
     */
    public static void applyRows(final OutputRaster raster, final int fromRow, final int toRow, final int threshold) throws ConfigurationException {
        checkThreshold(threshold);
        SobelOperator.checkRange(raster.rows(), raster.cols(), raster, fromRow, toRow);

        final byte[] data = raster.data();
        final int end = toRow * raster.cols();
        for(int pos = fromRow * raster.cols(); pos < end; pos++)
            data[pos] = binarize(data[pos] & 0xff, threshold);
    }

    private static byte binarize(final int value, final int threshold) {
        return (byte)(value > threshold ? ON : OFF);
    }

    private static void checkThreshold(final int threshold) throws ConfigurationException {
        if(!isValid(threshold))
            throw new ConfigurationException("Threshold must be between " + MIN + " and " + MAX + " but was " + threshold);
    }
}
