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


package ai.kognition.sobel4j.bridge;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Test;

public class TestSobelBridge {

    @After
    public void shutdown() {
        SobelBridge.shutdown();
    }

    @Test
    public void testLifecycle() {
        final long h = SobelBridge.createFilter("sobel_pthread");
        assertNotEquals(0L, h);
        assertTrue(SobelBridge.describeFilter(h).startsWith("Sobel Row Partitioned"));

        final byte[] encoded = SobelBridge.processImage(h, TestFilterHandles.brightColumnBgr(), 5, 5);
        assertTrue(encoded.length > 0);
        assertTrue(SobelBridge.processImageWithThreshold(h, TestFilterHandles.brightColumnBgr(), 5, 5, 0).length > 0);
        assertTrue(SobelBridge.getLastDurationMs(h) >= 0.0);

        SobelBridge.destroyFilter(h);
        assertEquals(0, SobelBridge.processImage(h, TestFilterHandles.brightColumnBgr(), 5, 5).length);
        assertEquals(-1.0, SobelBridge.getLastDurationMs(h), 0.0);
    }

    @Test
    public void testSetters() {
        final long h = SobelBridge.createFilter("basic");
        assertTrue(SobelBridge.setThreshold(h, 100));
        assertTrue(SobelBridge.setNormalize(h, true));
        assertTrue(SobelBridge.setUseBlur(h, true));
        assertTrue(SobelBridge.setBlurSigma(h, 2.0));
        assertTrue(SobelBridge.describeFilter(h).contains("threshold=100"));
        assertFalse(SobelBridge.setThreshold(h, 1000));
        assertFalse(SobelBridge.setBlurSigma(h + 1000, 2.0));
    }

    @Test
    public void testNeverThrows() {
        assertEquals(0L, SobelBridge.createFilter(null));
        assertEquals(0L, SobelBridge.createFilter("canny"));
        assertEquals(0, SobelBridge.processImage(-5L, null, -1, -1).length);
        assertEquals(0, SobelBridge.processImageWithThreshold(99999L, new byte[3], 1, 1, 7).length);
        SobelBridge.destroyFilter(-5L);
        assertEquals("", SobelBridge.describeFilter(-5L));
    }

    @Test
    public void testListAvailable() {
        final String list = SobelBridge.listAvailable();
        assertTrue(list, list.contains("sobel_basic"));
        assertTrue(list, list.contains("sobel_omp"));
        assertTrue(list, list.contains("not available"));
    }

    @Test
    public void testHandlesAreNotReusedAcrossShutdown() {
        final long first = SobelBridge.createFilter("sobel_basic");
        SobelBridge.shutdown();
        final long second = SobelBridge.createFilter("sobel_basic");
        assertTrue(second > first);
        assertEquals(0, SobelBridge.processImage(first, new byte[25], 5, 5).length);
    }
}
