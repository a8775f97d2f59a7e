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

import java.util.Arrays;

import org.apache.commons.lang3.Validate;

/**
 * <p>
 * An immutable, row-major raster of {@code rows x cols} pixels in a given {@link PixelFormat}.
 * </p>
 *
 * <p>
 * The grayscale input to edge detection, the gradient magnitude output and the binarized
 * output are all {@link RasterImage}s. Outputs are always {@link PixelFormat#GRAY8} with the
 * same dimensions as the input they were computed from.
 * </p>
 *
 * <p>
 * The factory methods copy the data they're given so the caller can't mutate the image after
 * the fact. Results produced by the operators in this package are handed over from an
 * {@link OutputRaster} without copying.
 * </p>
 */
public final class RasterImage {
    private final int rows;
    private final int cols;
    private final PixelFormat format;
    private final byte[] data;

    RasterImage(final int rows, final int cols, final PixelFormat format, final byte[] data) {
        Validate.isTrue(rows >= 0 && cols >= 0, "Image dimensions can't be negative (%d x %d)", rows, cols);
        Validate.notNull(format, "format");
        Validate.notNull(data, "data");
        final long expected = (long)rows * cols * format.elemSize();
        Validate.isTrue(data.length == expected, "A %d x %d %s image needs %d bytes but %d were supplied", rows, cols, format, expected,
            data.length);
        this.rows = rows;
        this.cols = cols;
        this.format = format;
        this.data = data;
    }

    /**
     * Create a {@link PixelFormat#GRAY8} image from a copy of the given row-major samples.
     */
    public static RasterImage gray(final int rows, final int cols, final byte[] samples) {
        return of(rows, cols, PixelFormat.GRAY8, samples);
    }

    /**
     * Create an image of the given format from a copy of the given interleaved data.
     */
    public static RasterImage of(final int rows, final int cols, final PixelFormat format, final byte[] data) {
        Validate.notNull(data, "data");
        return new RasterImage(rows, cols, format, Arrays.copyOf(data, data.length));
    }

    /**
     * Create a {@link PixelFormat#GRAY8} image from a two dimensional array of samples in {@code [0, 255]}.
     * Every row needs to be the same length.
     */
    public static RasterImage gray(final int[][] samples) {
        Validate.notNull(samples, "samples");
        final int rows = samples.length;
        final int cols = rows == 0 ? 0 : samples[0].length;
        final byte[] data = new byte[rows * cols];
        for(int r = 0; r < rows; r++) {
            Validate.isTrue(samples[r].length == cols, "Row %d has %d columns but row 0 has %d", r, samples[r].length, cols);
            for(int c = 0; c < cols; c++)
                data[(r * cols) + c] = (byte)samples[r][c];
        }
        return new RasterImage(rows, cols, PixelFormat.GRAY8, data);
    }

    /**
     * A {@link PixelFormat#GRAY8} image of all zeros.
     */
    public static RasterImage zeros(final int rows, final int cols) {
        return new RasterImage(rows, cols, PixelFormat.GRAY8, new byte[rows * cols]);
    }

    /**
     * <p>
     * Interpret a raw interleaved pixel buffer as it arrives from a foreign caller. The
     * format is inferred from the length of the buffer:
     * </p>
     *
     * <ul>
     * <li>{@code width * height} bytes - {@link PixelFormat#GRAY8}</li>
     * <li>{@code width * height * 3} bytes - {@link PixelFormat#BGR8}</li>
     * <li>{@code width * height * 4} bytes - {@link PixelFormat#RGBA8}</li>
     * </ul>
     *
     * @throws InvalidImageException if the buffer is null, empty, or its length doesn't match any of the above.
     */
    public static RasterImage fromPixelBuffer(final byte[] pixels, final int width, final int height) throws InvalidImageException {
        if(pixels == null)
            throw new InvalidImageException("no pixel buffer was supplied");
        if(width <= 0 || height <= 0)
            throw new InvalidImageException("dimensions must be positive but were " + width + " x " + height);

        final long numPixels = (long)width * height;
        final PixelFormat format;
        if(pixels.length == numPixels)
            format = PixelFormat.GRAY8;
        else if(pixels.length == numPixels * PixelFormat.BGR8.elemSize())
            format = PixelFormat.BGR8;
        else if(pixels.length == numPixels * PixelFormat.RGBA8.elemSize())
            format = PixelFormat.RGBA8;
        else
            throw new InvalidImageException("a buffer of " + pixels.length + " bytes can't hold a " + width + " x " + height
                + " image with 1, 3 or 4 channels");

        return of(height, width, format, pixels);
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public PixelFormat format() {
        return format;
    }

    public int channels() {
        return format.channels;
    }

    public int elemSize() {
        return format.elemSize();
    }

    public boolean isEmpty() {
        return rows == 0 || cols == 0;
    }

    /**
     * The total number of bytes in the raster.
     */
    public int getNumBytes() {
        return data.length;
    }

    /**
     * The unsigned value of the first channel of the pixel at {@code (row, col)}.
     */
    public int get(final int row, final int col) {
        return get(row, col, 0);
    }

    /**
     * The unsigned value of the given channel of the pixel at {@code (row, col)}.
     */
    public int get(final int row, final int col, final int channel) {
        final int pos = (((row * cols) + col) * format.channels + channel) * format.bytesPerChannel;
        if(format.bytesPerChannel == 2)
            return (data[pos] & 0xff) | ((data[pos + 1] & 0xff) << 8);
        return data[pos] & 0xff;
    }

    /**
     * Copy the entire image to a new byte array.
     */
    public byte[] copyToPrimitiveArray() {
        return Arrays.copyOf(data, data.length);
    }

    // direct access for the operators in this package. Never mutated.
    byte[] data() {
        return data;
    }

    /**
     * This is a helper comparator that verifies the byte by byte equivalence of the two images.
     */
    public static boolean pixelsIdentical(final RasterImage i1, final RasterImage i2) {
        if(i1 == i2)
            return true;
        return Arrays.equals(i1.data, i2.data);
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + cols;
        result = prime * result + rows;
        result = prime * result + format.hashCode();
        result = prime * result + Arrays.hashCode(data);
        return result;
    }

    @Override
    public boolean equals(final Object obj) {
        if(this == obj)
            return true;
        if(obj == null)
            return false;
        if(getClass() != obj.getClass())
            return false;
        final RasterImage other = (RasterImage)obj;
        if(rows != other.rows)
            return false;
        if(cols != other.cols)
            return false;
        if(format != other.format)
            return false;
        return pixelsIdentical(this, other);
    }

    @Override
    public String toString() {
        return "RasterImage[" + rows + " x " + cols + ", " + format + "]";
    }
}
