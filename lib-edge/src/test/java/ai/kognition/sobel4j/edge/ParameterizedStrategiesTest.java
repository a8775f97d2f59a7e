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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.function.Function;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import ai.kognition.sobel4j.image.GaussianBlur;
import ai.kognition.sobel4j.image.RasterImage;
import ai.kognition.sobel4j.image.SobelOperator;
import ai.kognition.sobel4j.image.Threshold;

@RunWith(Parameterized.class)
public class ParameterizedStrategiesTest {
    // sizes include fewer rows than the largest worker count
    private static final int[][] SIZES = {{1, 1},{2, 5},{3, 3},{5, 7},{7, 5},{64, 33},{101, 97}};

    private final Function<FilterConfig, EdgeDetector> factory;

    public ParameterizedStrategiesTest(final String name, final Function<FilterConfig, EdgeDetector> factory) {
        this.factory = factory;
    }

    @Parameters(name = "{index}={0}")
    public static Collection<Object[]> params() {
        return List.of(
            new Object[] {"sequential",(Function<FilterConfig, EdgeDetector>)c -> new SequentialEdgeDetector(c)},
            new Object[] {"rows-1",(Function<FilterConfig, EdgeDetector>)c -> new RowPartitionedEdgeDetector(c, 1)},
            new Object[] {"rows-2",(Function<FilterConfig, EdgeDetector>)c -> new RowPartitionedEdgeDetector(c, 2)},
            new Object[] {"rows-3",(Function<FilterConfig, EdgeDetector>)c -> new RowPartitionedEdgeDetector(c, 3)},
            new Object[] {"rows-8",(Function<FilterConfig, EdgeDetector>)c -> new RowPartitionedEdgeDetector(c, 8)},
            new Object[] {"auto-parallel",(Function<FilterConfig, EdgeDetector>)c -> new AutoParallelEdgeDetector(c)});
    }

    static RasterImage random(final Random rand, final int rows, final int cols) {
        final byte[] data = new byte[rows * cols];
        rand.nextBytes(data);
        return RasterImage.gray(rows, cols, data);
    }

    @Test
    public void testGradientMatchesReference() {
        final Random rand = new Random(1L);
        for(final boolean normalize: new boolean[] {true,false}) {
            try(final EdgeDetector detector = factory.apply(new FilterConfig.Builder().normalize(normalize).build());) {
                for(final int[] size: SIZES) {
                    final RasterImage image = random(rand, size[0], size[1]);
                    final Optional<RasterImage> result = detector.computeEdges(image);
                    assertTrue(result.isPresent());
                    assertEquals(SobelOperator.gradient(image, normalize), result.get());
                }
            }
        }
    }

    @Test
    public void testThresholdedMatchesReference() {
        final Random rand = new Random(2L);
        try(final EdgeDetector detector = factory.apply(new FilterConfig.Builder().threshold(100).build());) {
            for(final int[] size: SIZES) {
                final RasterImage image = random(rand, size[0], size[1]);
                final RasterImage gradient = SobelOperator.gradient(image, true);
                assertEquals(Threshold.apply(gradient, 100), detector.computeEdgesThresholded(image).get());
                for(final int t: new int[] {0,1,37,254,255})
                    assertEquals(Threshold.apply(gradient, t), detector.computeEdgesThresholded(image, t).get());
            }
        }
    }

    @Test
    public void testBlurredMatchesReference() {
        final Random rand = new Random(3L);
        try(final EdgeDetector detector = factory.apply(new FilterConfig.Builder().useBlur(true).blurSigma(0.7).build());) {
            for(final int[] size: SIZES) {
                final RasterImage image = random(rand, size[0], size[1]);
                final RasterImage expected = SobelOperator.gradient(GaussianBlur.apply(image, 0.7), true);
                assertEquals(expected, detector.computeEdges(image).get());
            }
        }
    }

    @Test
    public void testBorderIsZero() {
        try(final EdgeDetector detector = factory.apply(new FilterConfig());) {
            final RasterImage gradient = detector.computeEdges(random(new Random(4L), 40, 30)).get();
            for(int c = 0; c < 30; c++) {
                assertEquals(0, gradient.get(0, c));
                assertEquals(0, gradient.get(39, c));
            }
            for(int r = 0; r < 40; r++) {
                assertEquals(0, gradient.get(r, 0));
                assertEquals(0, gradient.get(r, 29));
            }
        }
    }

    @Test
    public void testInvalidInputIsAbsent() {
        try(final EdgeDetector detector = factory.apply(new FilterConfig());) {
            assertFalse(detector.computeEdges(null).isPresent());
            assertFalse(detector.computeEdges(RasterImage.zeros(0, 10)).isPresent());
            assertFalse(detector.computeEdgesThresholded(RasterImage.zeros(5, 5), 256).isPresent());
            assertFalse(detector.computeEdgesThresholded(RasterImage.zeros(5, 5), -2).isPresent());
            assertEquals(BaseEdgeDetector.NEVER_RUN, detector.lastDurationMs(), 0.0);

            // still usable afterward
            assertEquals(RasterImage.zeros(5, 5), detector.computeEdges(RasterImage.zeros(5, 5)).get());
        }
    }

    @Test
    public void testConcurrentCallsOnOneInstance() throws Exception {
        final RasterImage image = random(new Random(5L), 80, 60);
        final RasterImage expected = SobelOperator.gradient(image, true);
        try(final EdgeDetector detector = factory.apply(new FilterConfig());) {
            final Thread[] threads = new Thread[4];
            final boolean[] matched = new boolean[threads.length];
            for(int i = 0; i < threads.length; i++) {
                final int index = i;
                threads[i] = new Thread(() -> {
                    boolean ok = true;
                    for(int j = 0; j < 10; j++)
                        ok &= expected.equals(detector.computeEdges(image).orElse(null));
                    matched[index] = ok;
                });
                threads[i].start();
            }
            for(final Thread t: threads)
                t.join();
            for(final boolean ok: matched)
                assertTrue(ok);
        }
    }
}
