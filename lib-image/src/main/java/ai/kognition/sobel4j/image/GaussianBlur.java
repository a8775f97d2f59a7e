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
 * 3x3 Gaussian smoothing of an 8-bit single channel image, used to knock down noise before
 * the gradient pass.
 * </p>
 *
 * <p>
 * The 1-D weights are {@code exp(-x^2 / (2 sigma^2))} for {@code x} in {@code {-1, 0, 1}},
 * normalized to sum to 1. The 2-D kernel is their outer product. Pixels past the edge are
 * taken from the mirror image excluding the edge pixel itself ({@code gfedcb|abcdefgh|gfedcba}).
 * Results are rounded to the nearest integer.
 * </p>
 */
public final class GaussianBlur {
    private GaussianBlur() {}

    /**
     * Blur the entire image in a single sequential pass.
     */
    public static RasterImage apply(final RasterImage image, final double sigma) throws InvalidImageException {
        SobelOperator.validate(image);
        final OutputRaster dst = new OutputRaster(image.rows(), image.cols());
        applyRows(image, dst, 0, image.rows(), sigma);
        return dst.toImage();
    }

    /**
     * Blur the rows {@code [fromRow, toRow)} writing only those rows of {@code dst}. Like the
     * gradient computation, this only reads the source so disjoint ranges can run concurrently.
     */
    public static void applyRows(final RasterImage image, final OutputRaster dst, final int fromRow, final int toRow, final double sigma) {
        final int rows = image.rows();
        final int cols = image.cols();
        SobelOperator.checkRange(rows, cols, dst, fromRow, toRow);
        final double[][] kernel = kernel(sigma);

        final byte[] src = image.data();
        final byte[] out = dst.data();
        for(int i = fromRow; i < toRow; i++) {
            for(int j = 0; j < cols; j++) {
                double acc = 0.0;
                for(int ki = 0; ki < 3; ki++) {
                    final int rowStart = reflect101(i + ki - 1, rows) * cols;
                    for(int kj = 0; kj < 3; kj++)
                        acc += kernel[ki][kj] * (src[rowStart + reflect101(j + kj - 1, cols)] & 0xff);
                }
                final long rounded = Math.round(acc);
                out[(i * cols) + j] = (byte)(rounded > 255 ? 255 : (rounded < 0 ? 0 : rounded));
            }
        }
    }

    /**
     * The 3x3 kernel for the given sigma. Exposed for testing.
     */
    public static double[][] kernel(final double sigma) {
        if(!(sigma > 0.0))
            throw new IllegalArgumentException("Gaussian sigma must be positive but was " + sigma);

        final double[] oneD = new double[3];
        double sum = 0.0;
        for(int x = -1; x <= 1; x++) {
            oneD[x + 1] = Math.exp(-(x * x) / (2.0 * sigma * sigma));
            sum += oneD[x + 1];
        }
        for(int i = 0; i < 3; i++)
            oneD[i] /= sum;

        final double[][] ret = new double[3][3];
        for(int r = 0; r < 3; r++)
            for(int c = 0; c < 3; c++)
                ret[r][c] = oneD[r] * oneD[c];
        return ret;
    }

    static int reflect101(final int p, final int len) {
        if(len == 1)
            return 0;
        if(p < 0)
            return -p;
        if(p >= len)
            return (2 * len) - 2 - p;
        return p;
    }
}
