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

import javax.imageio.ImageIO;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In memory encoding and decoding of 8-bit grayscale images using {@link ImageIO}.
 */
public class ImageFile {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImageFile.class);

    /**
     * Passed as the extension to get the unencoded, row major samples back.
     */
    public static final String RAW = "raw";

    private ImageFile() {}

    /**
     * In memory encode of an image. The extension selects the format ({@code png}, {@code jpg},
     * {@code bmp}, ...) or {@link #RAW} for a plain copy of the samples.
     *
     * @throws IllegalArgumentException if no writer is registered for the extension
     */
    public static byte[] encodeToImageData(final RasterImage image, final String ext) throws IOException {
        SobelOperator.validate(image);
        final String format = normalizeExtension(ext);
        if(RAW.equals(format))
            return image.copyToPrimitiveArray();

        final BufferedImage bi = toBufferedImage(image);
        try(final ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            if(!ImageIO.write(bi, format, baos))
                throw new IllegalArgumentException("No ImageIO writer available for the extension \"" + ext + "\"");
            final byte[] ret = baos.toByteArray();
            LOGGER.trace("Encoded {} as {} in {} bytes", image, format, ret.length);
            return ret;
        }
    }

    /**
     * Given the imageData byte array contains an encoded image, decode the image
     * into an 8-bit grayscale {@link RasterImage}. Color images are converted.
     */
    public static RasterImage decodeImageData(final byte[] imageData) throws IOException {
        if(imageData == null || imageData.length == 0)
            throw new IOException("No image data to decode");
        final BufferedImage bi;
        try(final ByteArrayInputStream bais = new ByteArrayInputStream(imageData)) {
            bi = ImageIO.read(bais);
        }
        if(bi == null)
            throw new IOException("No ImageIO reader could decode the " + imageData.length + " bytes of image data");
        return fromBufferedImage(bi);
    }

    /**
     * Copy the image into a {@link BufferedImage#TYPE_BYTE_GRAY} {@link BufferedImage}.
     */
    public static BufferedImage toBufferedImage(final RasterImage image) {
        if(image.format() != PixelFormat.GRAY8)
            throw new InvalidImageException("Only " + PixelFormat.GRAY8 + " images can be converted but got " + image.format());
        final BufferedImage ret = new BufferedImage(image.cols(), image.rows(), BufferedImage.TYPE_BYTE_GRAY);
        final byte[] dst = ((DataBufferByte)ret.getRaster().getDataBuffer()).getData();
        System.arraycopy(image.data(), 0, dst, 0, dst.length);
        return ret;
    }

    /**
     * Convert any {@link BufferedImage} to an 8-bit grayscale {@link RasterImage}.
     */
    public static RasterImage fromBufferedImage(final BufferedImage bi) {
        final int rows = bi.getHeight();
        final int cols = bi.getWidth();
        if(bi.getType() == BufferedImage.TYPE_BYTE_GRAY) {
            final byte[] src = ((DataBufferByte)bi.getRaster().getDataBuffer()).getData();
            if(src.length == rows * cols)
                return RasterImage.gray(rows, cols, src);
        }

        final OutputRaster dst = new OutputRaster(rows, cols);
        for(int r = 0; r < rows; r++) {
            for(int c = 0; c < cols; c++) {
                final int argb = bi.getRGB(c, r);
                dst.set(r, c, ColorConversion.luma((argb >> 16) & 0xff, (argb >> 8) & 0xff, argb & 0xff));
            }
        }
        return dst.toImage();
    }

    private static String normalizeExtension(final String ext) {
        if(ext == null)
            throw new IllegalArgumentException("No image extension was supplied");
        String ret = ext.trim().toLowerCase(Locale.ROOT);
        if(ret.startsWith("."))
            ret = ret.substring(1);
        if(ret.isEmpty())
            throw new IllegalArgumentException("No image extension was supplied");
        return "jpeg".equals(ret) ? "jpg" : ret;
    }
}
