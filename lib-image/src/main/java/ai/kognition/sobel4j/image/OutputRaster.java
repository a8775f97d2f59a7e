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
 * A writable {@link PixelFormat#GRAY8} buffer that the operators in this package fill in,
 * possibly from several threads at once as long as each thread writes its own rows.
 * </p>
 *
 * <p>
 * Once filled, {@link #toImage()} hands the buffer over to an immutable {@link RasterImage}
 * without copying. After that the {@link OutputRaster} can no longer be used.
 * </p>
 *
 * <p>
 * Visibility of the writes to the thread calling {@link #toImage()} is the caller's
 * responsibility. Joining on the worker tasks (e.g. {@code Future.get()} or the end of a
 * parallel stream) is sufficient.
 * </p>
 */
public final class OutputRaster {
    private final int rows;
    private final int cols;
    private byte[] data;

    public OutputRaster(final int rows, final int cols) {
        if(rows < 0 || cols < 0)
            throw new IllegalArgumentException("Image dimensions can't be negative (" + rows + " x " + cols + ")");
        this.rows = rows;
        this.cols = cols;
        this.data = new byte[rows * cols];
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public int get(final int row, final int col) {
        return data()[(row * cols) + col] & 0xff;
    }

    public void set(final int row, final int col, final int value) {
        data()[(row * cols) + col] = (byte)value;
    }

    /**
     * Hand the buffer over to an immutable image. This can only be done once.
     */
    public RasterImage toImage() {
        final RasterImage ret = new RasterImage(rows, cols, PixelFormat.GRAY8, data());
        data = null;
        return ret;
    }

    byte[] data() {
        final byte[] ret = data;
        if(ret == null)
            throw new IllegalStateException("This " + OutputRaster.class.getSimpleName() + " has already been handed over to a "
                + RasterImage.class.getSimpleName());
        return ret;
    }
}
