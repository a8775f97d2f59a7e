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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

public class TestGaussianBlur {

    @Test
    public void testKernel() {
        final double[][] kernel = GaussianBlur.kernel(1.0);
        double sum = 0.0;
        for(final double[] row: kernel)
            for(final double v: row)
                sum += v;
        assertEquals(1.0, sum, 1e-12);
        assertEquals(kernel[0][0], kernel[2][2], 0.0);
        assertEquals(kernel[0][1], kernel[1][0], 0.0);
        assertTrue(kernel[1][1] > kernel[0][1]);
        assertTrue(kernel[0][1] > kernel[0][0]);
    }

    @Test
    public void testBadSigma() {
        assertThrows(IllegalArgumentException.class, () -> GaussianBlur.kernel(0.0));
        assertThrows(IllegalArgumentException.class, () -> GaussianBlur.kernel(-1.0));
        assertThrows(IllegalArgumentException.class, () -> GaussianBlur.kernel(Double.NaN));
    }

    @Test
    public void testUniformImageIsUnchanged() {
        final byte[] data = new byte[6 * 9];
        Arrays.fill(data, (byte)100);
        final RasterImage image = RasterImage.gray(6, 9, data);
        assertEquals(image, GaussianBlur.apply(image, 1.5));
    }

    @Test
    public void testSmoothsAnImpulse() {
        final int[][] samples = new int[5][5];
        samples[2][2] = 255;
        final RasterImage blurred = GaussianBlur.apply(RasterImage.gray(samples), 1.0);
        assertTrue(blurred.get(2, 2) < 255);
        assertTrue(blurred.get(2, 1) > 0);
        assertTrue(blurred.get(1, 1) > 0);
        assertEquals(blurred.get(1, 2), blurred.get(3, 2));
        assertEquals(0, blurred.get(0, 0));
    }

    @Test
    public void testRowRangesMatchTheFullPass() {
        final RasterImage image = TestSobelOperator.random(99L, 13, 8);
        final OutputRaster dst = new OutputRaster(13, 8);
        GaussianBlur.applyRows(image, dst, 7, 13, 0.8);
        GaussianBlur.applyRows(image, dst, 0, 7, 0.8);
        assertEquals(GaussianBlur.apply(image, 0.8), dst.toImage());
    }

    @Test
    public void testReflect101() {
        assertEquals(1, GaussianBlur.reflect101(-1, 5));
        assertEquals(3, GaussianBlur.reflect101(5, 5));
        assertEquals(2, GaussianBlur.reflect101(2, 5));
        assertEquals(0, GaussianBlur.reflect101(-1, 1));
    }
}
