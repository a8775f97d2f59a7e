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
 * <p>
 * The Sobel gradient magnitude computation over an 8-bit single channel image using the fixed
 * 3x3 kernel pair:
 * </p>
 *
 * <pre>
 *        | -1  0  1 |          | -1 -2 -1 |
 *   Gx = | -2  0  2 |     Gy = |  0  0  0 |
 *        | -1  0  1 |          |  1  2  1 |
 * </pre>
 *
 * <p>
 * The magnitude {@code sqrt(Gx^2 + Gy^2)} is computed for every interior pixel. The one pixel
 * wide border, where the kernel would extend past the image, is always {@code 0}.
 * </p>
 *
 * <p>
 * When {@code normalize} is set the magnitude is clamped to {@code [0, 255]}. Otherwise it's
 * truncated to an int and only its low 8 bits are kept so large magnitudes wrap around (e.g.
 * 1020 is stored as 252). Callers turning normalization off accept the wraparound.
 * </p>
 *
 * <p>
 * The computation over a row range only reads the (immutable) source image and only writes the
 * requested rows of the destination, so disjoint row ranges can be computed concurrently and the
 * result is identical to a single sequential pass.
 * </p>
 *
 * @see <a href="https://en.wikipedia.org/wiki/Sobel_operator">Sobel operator</a>
 */
public final class SobelOperator {
    public static final int KERNEL_SIZE = 3;
    public static final int KERNEL_OFFSET = KERNEL_SIZE / 2;

    private static final int[][] SOBEL_X = {
        {-1, 0, 1},
        {-2, 0, 2},
        {-1, 0, 1}
    };

    private static final int[][] SOBEL_Y = {
        {-1, -2, -1},
        {0, 0, 0},
        {1, 2, 1}
    };

    private SobelOperator() {}

    /**
     * Make sure the image is something the operator can handle.
     *
     * @throws InvalidImageException if the image is empty, has more than one channel or isn't 8-bit.
     */
    public static void validate(final RasterImage image) throws InvalidImageException {
        if(image == null)
            throw new InvalidImageException("no image was supplied");
        if(image.isEmpty())
            throw new InvalidImageException("Input image is empty (" + image.rows() + " x " + image.cols() + ")");
        if(image.channels() != 1)
            throw new InvalidImageException("Input image must be single channel grayscale but has " + image.channels() + " channels");
        if(image.format().depthBits() != 8)
            throw new InvalidImageException("Input image must be 8-bit but is " + image.format().depthBits() + "-bit");
    }

    /**
     * Compute the gradient magnitude image in a single sequential pass.
     */
    public static RasterImage gradient(final RasterImage image, final boolean normalize) throws InvalidImageException {
        validate(image);
        final OutputRaster dst = new OutputRaster(image.rows(), image.cols());
        gradientRows(image, dst, 0, image.rows(), normalize);
        return dst.toImage();
    }

    /**
     * Compute the gradient magnitude for the rows {@code [fromRow, toRow)} writing only those rows
     * of {@code dst}. Border rows and columns within the range are set to zero. The image is assumed
     * to have already passed {@link #validate(RasterImage)}.
     */
    public static void gradientRows(final RasterImage image, final OutputRaster dst, final int fromRow, final int toRow,
        final boolean normalize) {
        final int rows = image.rows();
        final int cols = image.cols();
        checkRange(rows, cols, dst, fromRow, toRow);

        final byte[] src = image.data();
        final byte[] out = dst.data();

        for(int i = fromRow; i < toRow; i++) {
            final int rowStart = i * cols;
            if(i < KERNEL_OFFSET || i >= rows - KERNEL_OFFSET) {
                for(int j = 0; j < cols; j++)
                    out[rowStart + j] = 0;
                continue;
            }

            for(int j = 0; j < cols; j++) {
                if(j < KERNEL_OFFSET || j >= cols - KERNEL_OFFSET) {
                    out[rowStart + j] = 0;
                    continue;
                }
                final int gx = applyKernel(src, rows, cols, i, j, SOBEL_X);
                final int gy = applyKernel(src, rows, cols, i, j, SOBEL_Y);
                out[rowStart + j] = (byte)toSample(magnitude(gx, gy), normalize);
            }
        }
    }

    /**
     * {@code sqrt(gx^2 + gy^2)}
     */
    public static double magnitude(final int gx, final int gy) {
        return Math.sqrt((double)((gx * gx) + (gy * gy)));
    }

    /**
     * Convert a magnitude to an 8-bit sample value in {@code [0, 255]}. See the class documentation
     * for how {@code normalize} affects the result.
     */
    public static int toSample(final double magnitude, final boolean normalize) {
        if(normalize)
            return (int)Math.min(255.0, Math.max(0.0, magnitude));
        return ((int)magnitude) & 0xff;
    }

    // neighbors outside the image contribute nothing
    private static int applyKernel(final byte[] src, final int rows, final int cols, final int row, final int col, final int[][] kernel) {
        int result = 0;
        for(int ki = 0; ki < KERNEL_SIZE; ki++) {
            final int pixelRow = row + ki - KERNEL_OFFSET;
            if(pixelRow < 0 || pixelRow >= rows)
                continue;
            final int rowStart = pixelRow * cols;
            for(int kj = 0; kj < KERNEL_SIZE; kj++) {
                final int pixelCol = col + kj - KERNEL_OFFSET;
                if(pixelCol < 0 || pixelCol >= cols)
                    continue;
                result += (src[rowStart + pixelCol] & 0xff) * kernel[ki][kj];
            }
        }
        return result;
    }

    static void checkRange(final int rows, final int cols, final OutputRaster dst, final int fromRow, final int toRow) {
        if(dst.rows() != rows || dst.cols() != cols)
            throw new IllegalArgumentException("The destination is " + dst.rows() + " x " + dst.cols() + " but the source is " + rows + " x " + cols);
        if(fromRow < 0 || toRow > rows || fromRow > toRow)
            throw new IllegalArgumentException("The row range [" + fromRow + ", " + toRow + ") isn't within [0, " + rows + ")");
    }
}
