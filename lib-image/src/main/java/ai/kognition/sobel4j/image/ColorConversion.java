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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conversion of the supported {@link PixelFormat}s to {@link PixelFormat#GRAY8}.
 * Color pixels use the ITU-R BT.601 luma weights {@code 0.299 R + 0.587 G + 0.114 B}
 * in 14-bit fixed point, rounded.
 */
public final class ColorConversion {
    private static final Logger LOGGER = LoggerFactory.getLogger(ColorConversion.class);

    private static final int SHIFT = 14;
    private static final int R_WEIGHT = 4899; // 0.299 * 2^14
    private static final int G_WEIGHT = 9617; // 0.587 * 2^14
    private static final int B_WEIGHT = 1868; // 0.114 * 2^14
    private static final int ROUND = 1 << (SHIFT - 1);

    private ColorConversion() {}

    /**
     * Return a grayscale version of the image. A {@link PixelFormat#GRAY8} image is returned as is.
     */
    public static RasterImage toGray(final RasterImage image) throws InvalidImageException {
        if(image == null)
            throw new InvalidImageException("no image was supplied");
        if(image.format() == PixelFormat.GRAY8)
            return image;

        if(LOGGER.isTraceEnabled())
            LOGGER.trace("converting {} to 8-bit grayscale", image);

        final int rows = image.rows();
        final int cols = image.cols();
        final OutputRaster dst = new OutputRaster(rows, cols);
        final byte[] out = dst.data();
        final byte[] src = image.data();
        final int numPixels = rows * cols;

        switch(image.format()) {
            case BGR8:
                for(int p = 0, s = 0; p < numPixels; p++, s += 3)
                    out[p] = luma(src[s + 2] & 0xff, src[s + 1] & 0xff, src[s] & 0xff);
                break;
            case RGBA8:
                for(int p = 0, s = 0; p < numPixels; p++, s += 4)
                    out[p] = luma(src[s] & 0xff, src[s + 1] & 0xff, src[s + 2] & 0xff);
                break;
            case GRAY16:
                // keep the most significant byte of each little endian sample
                for(int p = 0, s = 1; p < numPixels; p++, s += 2)
                    out[p] = src[s];
                break;
            default:
                throw new InvalidImageException("Can't convert an image with format " + image.format() + " to grayscale");
        }
        return dst.toImage();
    }

    static byte luma(final int r, final int g, final int b) {
        return (byte)(((r * R_WEIGHT) + (g * G_WEIGHT) + (b * B_WEIGHT) + ROUND) >> SHIFT);
    }
}
