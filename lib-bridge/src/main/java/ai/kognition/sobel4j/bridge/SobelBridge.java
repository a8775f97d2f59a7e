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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.sobel4j.edge.StrategyRegistry;
import ai.kognition.sobel4j.util.Settings;

/**
 * <p>
 * The static entry points a host application binds to. They all delegate to one process wide
 * {@link FilterHandles} that's created the first time it's needed. None of them throw.
 * </p>
 *
 * <pre>
 * <code>
 * final long filter = SobelBridge.createFilter("sobel_pthread");
 * final byte[] png = SobelBridge.processImage(filter, bgrPixels, width, height);
 * SobelBridge.destroyFilter(filter);
 * </code>
 * </pre>
 */
public final class SobelBridge {
    private static final Logger LOGGER = LoggerFactory.getLogger(SobelBridge.class);

    private static final byte[] EMPTY = new byte[0];

    private static FilterHandles handles = null;
    private static long firstHandle = 1L;

    private SobelBridge() {}

    private static synchronized FilterHandles handles() {
        if(handles == null) {
            handles = new FilterHandles(new StrategyRegistry(), Settings.getString(Settings.ENCODE_FORMAT, FilterHandles.DEFAULT_ENCODE_FORMAT),
                Settings.getBoolean(Settings.TRACK_HANDLE_LEAKS, false), firstHandle);
            LOGGER.info("Created the filter handle registry encoding results as {}", handles.getEncodeFormat());
        }
        return handles;
    }

    /**
     * @return a handle for the new filter or {@code 0} on failure.
     */
    public static long createFilter(final String filterType) {
        try {
            return handles().create(filterType);
        } catch(final RuntimeException rte) {
            LOGGER.error("Unexpected failure creating a \"{}\" filter", filterType, rte);
            return FilterHandles.INVALID_HANDLE;
        }
    }

    public static void destroyFilter(final long handle) {
        try {
            handles().destroy(handle);
        } catch(final RuntimeException rte) {
            LOGGER.error("Unexpected failure destroying handle {}", handle, rte);
        }
    }

    /**
     * @return the encoded gradient image or an empty array on failure.
     */
    public static byte[] processImage(final long handle, final byte[] pixels, final int width, final int height) {
        try {
            return handles().process(handle, pixels, width, height);
        } catch(final RuntimeException rte) {
            LOGGER.error("Unexpected failure processing an image with handle {}", handle, rte);
            return EMPTY;
        }
    }

    /**
     * @return the encoded binary edge image or an empty array on failure.
     */
    public static byte[] processImageWithThreshold(final long handle, final byte[] pixels, final int width, final int height, final int threshold) {
        try {
            return handles().processThresholded(handle, pixels, width, height, threshold);
        } catch(final RuntimeException rte) {
            LOGGER.error("Unexpected failure processing an image with handle {}", handle, rte);
            return EMPTY;
        }
    }

    public static String listAvailable() {
        try {
            return handles().listAvailable();
        } catch(final RuntimeException rte) {
            LOGGER.error("Unexpected failure listing the available filters", rte);
            return "";
        }
    }

    public static boolean setThreshold(final long handle, final int threshold) {
        try {
            return handles().setThreshold(handle, threshold);
        } catch(final RuntimeException rte) {
            LOGGER.error("Unexpected failure setting the threshold on handle {}", handle, rte);
            return false;
        }
    }

    public static boolean setNormalize(final long handle, final boolean normalize) {
        try {
            return handles().setNormalize(handle, normalize);
        } catch(final RuntimeException rte) {
            LOGGER.error("Unexpected failure setting normalize on handle {}", handle, rte);
            return false;
        }
    }

    public static boolean setUseBlur(final long handle, final boolean useBlur) {
        try {
            return handles().setUseBlur(handle, useBlur);
        } catch(final RuntimeException rte) {
            LOGGER.error("Unexpected failure setting useBlur on handle {}", handle, rte);
            return false;
        }
    }

    public static boolean setBlurSigma(final long handle, final double blurSigma) {
        try {
            return handles().setBlurSigma(handle, blurSigma);
        } catch(final RuntimeException rte) {
            LOGGER.error("Unexpected failure setting the blur sigma on handle {}", handle, rte);
            return false;
        }
    }

    public static double getLastDurationMs(final long handle) {
        try {
            return handles().lastDurationMs(handle);
        } catch(final RuntimeException rte) {
            LOGGER.error("Unexpected failure reading the last duration of handle {}", handle, rte);
            return -1.0;
        }
    }

    public static String describeFilter(final long handle) {
        try {
            return handles().describe(handle);
        } catch(final RuntimeException rte) {
            LOGGER.error("Unexpected failure describing handle {}", handle, rte);
            return "";
        }
    }

    /**
     * Destroy every live filter. The next call starts a fresh registry which carries on issuing handles
     * where this one left off so a stale handle can never address a new filter.
     */
    public static synchronized void shutdown() {
        if(handles != null) {
            try {
                firstHandle = handles.closeAndGetNextHandle();
            } catch(final RuntimeException rte) {
                LOGGER.error("Unexpected failure closing the filter handle registry", rte);
            }
            handles = null;
        }
    }
}
