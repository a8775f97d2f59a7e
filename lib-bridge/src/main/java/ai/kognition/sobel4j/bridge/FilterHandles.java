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

import static net.dempsy.util.Functional.uncheck;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.dempsy.util.QuietCloseable;

import ai.kognition.sobel4j.edge.EdgeDetector;
import ai.kognition.sobel4j.edge.StrategyRegistry;
import ai.kognition.sobel4j.image.ColorConversion;
import ai.kognition.sobel4j.image.ImageFile;
import ai.kognition.sobel4j.image.RasterImage;
import ai.kognition.sobel4j.util.Settings;

/**
 * <p>
 * Owns live {@link EdgeDetector}s on behalf of a caller that can only hold on to an opaque
 * {@code long}. Nothing here throws. Failures are logged and reported with a sentinel:
 * {@link #INVALID_HANDLE} from {@link #create(String)}, an empty array from the {@code process}
 * methods, {@code false} from the setters and {@code -1} or an empty string from the accessors.
 * </p>
 *
 * <p>
 * Every method can be called concurrently. The table of handles is guarded by a single lock which
 * is only held to look up, add or remove an entry and to pin it. The image work runs outside the lock
 * against the pinned detector. A {@link #destroy(long)} that races a call in flight on the same
 * handle removes the handle right away but the detector is only closed when that call releases it.
 * </p>
 *
 * <p>
 * Handles start at 1 and are never reused by the same {@link FilterHandles}.
 * </p>
 */
public class FilterHandles implements QuietCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(FilterHandles.class);

    public static final long INVALID_HANDLE = 0L;
    public static final String DEFAULT_ENCODE_FORMAT = "png";

    private static final byte[] EMPTY = new byte[0];

    private final StrategyRegistry strategies;
    private final String encodeFormat;
    private final boolean trackHandleLeaks;

    private final Object lock = new Object();
    private final Map<Long, Entry> table = new HashMap<>();
    private long nextHandle;
    private boolean closed = false;

    private static class Entry {
        final long handle;
        final EdgeDetector detector;
        final RuntimeException createdAt;

        private int users = 0;
        private boolean retired = false;
        private boolean detectorClosed = false;

        Entry(final long handle, final EdgeDetector detector, final RuntimeException createdAt) {
            this.handle = handle;
            this.detector = detector;
            this.createdAt = createdAt;
        }

        synchronized boolean pin() {
            if(retired)
                return false;
            users++;
            return true;
        }

        void unpin() {
            final boolean closeNow;
            synchronized(this) {
                users--;
                closeNow = shouldClose();
            }
            if(closeNow)
                closeDetector();
        }

        void retire() {
            final boolean closeNow;
            synchronized(this) {
                retired = true;
                closeNow = shouldClose();
            }
            if(closeNow)
                closeDetector();
        }

        // must hold the monitor
        private boolean shouldClose() {
            if(retired && users == 0 && !detectorClosed) {
                detectorClosed = true;
                return true;
            }
            return false;
        }

        private void closeDetector() {
            try {
                detector.close();
                LOGGER.debug("Closed {} for handle {}", detector, handle);
            } catch(final RuntimeException rte) {
                LOGGER.warn("Closing {} for handle {} failed", detector, handle, rte);
            }
        }
    }

    /**
     * A registry reading {@link Settings#ENCODE_FORMAT} and {@link Settings#TRACK_HANDLE_LEAKS}.
     */
    public FilterHandles(final StrategyRegistry strategies) {
        this(strategies, Settings.getString(Settings.ENCODE_FORMAT, DEFAULT_ENCODE_FORMAT),
            Settings.getBoolean(Settings.TRACK_HANDLE_LEAKS, false));
    }

    public FilterHandles() {
        this(new StrategyRegistry());
    }

    /**
     * @param encodeFormat the encoding of processed images. Anything {@link ImageFile#encodeToImageData(RasterImage, String)}
     *     accepts.
     * @param trackHandleLeaks record where each handle was created so those never destroyed can be reported
     *     by {@link #close()}.
     */
    public FilterHandles(final StrategyRegistry strategies, final String encodeFormat, final boolean trackHandleLeaks) {
        this(strategies, encodeFormat, trackHandleLeaks, 1L);
    }

    FilterHandles(final StrategyRegistry strategies, final String encodeFormat, final boolean trackHandleLeaks, final long firstHandle) {
        Validate.isTrue(firstHandle > INVALID_HANDLE, "The first handle must be positive but was %d", firstHandle);
        this.strategies = Validate.notNull(strategies, "strategies");
        this.encodeFormat = Validate.notBlank(encodeFormat, "encodeFormat").trim().toLowerCase(Locale.ROOT);
        this.trackHandleLeaks = trackHandleLeaks;
        this.nextHandle = firstHandle;
    }

    /**
     * Create a filter by name. See {@link StrategyRegistry#createByName(String)} for how the name is resolved.
     *
     * @return the new handle or {@link #INVALID_HANDLE} if the filter couldn't be created.
     */
    public long create(final String name) {
        synchronized(lock) {
            if(closed) {
                LOGGER.warn("Can't create a \"{}\" filter because the handle registry has been closed", name);
                return INVALID_HANDLE;
            }
        }

        final EdgeDetector detector;
        try {
            detector = strategies.createByName(name);
        } catch(final RuntimeException rte) {
            LOGGER.warn("Failed to create a filter named \"{}\": {}", name, rte.getMessage());
            LOGGER.debug("Filter creation failure", rte);
            return INVALID_HANDLE;
        }

        final long handle;
        synchronized(lock) {
            if(closed)
                handle = INVALID_HANDLE;
            else {
                handle = nextHandle++;
                table.put(handle, new Entry(handle, detector,
                    trackHandleLeaks ? new RuntimeException("Here's where handle " + handle + " was created: ") : null));
            }
        }

        if(handle == INVALID_HANDLE) {
            LOGGER.warn("The handle registry was closed while a \"{}\" filter was being created", name);
            detector.close();
        } else
            LOGGER.debug("Created handle {} for {}", handle, detector);
        return handle;
    }

    /**
     * Remove the handle. The filter is closed once no call is using it. Destroying a handle that
     * isn't live does nothing.
     */
    public void destroy(final long handle) {
        final Entry entry;
        synchronized(lock) {
            entry = table.remove(handle);
        }
        if(entry == null) {
            LOGGER.debug("Destroying handle {} which isn't live", handle);
            return;
        }
        entry.retire();
        LOGGER.debug("Destroyed handle {}", handle);
    }

    /**
     * Compute the gradient image of the pixels and encode it.
     *
     * @param pixels {@code width * height} gray, {@code width * height * 3} BGR or {@code width * height * 4}
     *     RGBA bytes, row major.
     *
     * @return the encoded gradient image or an empty array if the handle isn't live or the image couldn't
     *     be processed.
     */
    public byte[] process(final long handle, final byte[] pixels, final int width, final int height) {
        return withDetector(handle, EMPTY, d -> uncheck(() -> encode(d.computeEdges(toGray(pixels, width, height)))));
    }

    /**
     * Like {@link #process(long, byte[], int, int)} but produces the binarized image.
     *
     * @param threshold in {@code [0, 255]} or {@code -1} to use the filter's configured threshold.
     */
    public byte[] processThresholded(final long handle, final byte[] pixels, final int width, final int height, final int threshold) {
        return withDetector(handle, EMPTY, d -> uncheck(() -> encode(d.computeEdgesThresholded(toGray(pixels, width, height), threshold))));
    }

    public boolean setThreshold(final long handle, final int threshold) {
        return withDetector(handle, false, d -> {
            d.setThreshold(threshold);
            return true;
        });
    }

    public boolean setNormalize(final long handle, final boolean normalize) {
        return withDetector(handle, false, d -> {
            d.setNormalize(normalize);
            return true;
        });
    }

    public boolean setUseBlur(final long handle, final boolean useBlur) {
        return withDetector(handle, false, d -> {
            d.setUseBlur(useBlur);
            return true;
        });
    }

    public boolean setBlurSigma(final long handle, final double blurSigma) {
        return withDetector(handle, false, d -> {
            d.setBlurSigma(blurSigma);
            return true;
        });
    }

    public boolean resetStats(final long handle) {
        return withDetector(handle, false, d -> {
            d.resetStats();
            return true;
        });
    }

    /**
     * @return the duration of the filter's last successful call in milliseconds or {@code -1}
     */
    public double lastDurationMs(final long handle) {
        return withDetector(handle, -1.0, EdgeDetector::lastDurationMs);
    }

    public String describe(final long handle) {
        return withDetector(handle, "", EdgeDetector::describe);
    }

    public boolean isLive(final long handle) {
        synchronized(lock) {
            return table.containsKey(handle);
        }
    }

    public int liveCount() {
        synchronized(lock) {
            return table.size();
        }
    }

    /**
     * A human readable list of the filters that can be created.
     */
    public String listAvailable() {
        try {
            return strategies.describeAll();
        } catch(final RuntimeException rte) {
            LOGGER.warn("Failed to list the available filters", rte);
            return "";
        }
    }

    public String getEncodeFormat() {
        return encodeFormat;
    }

    /**
     * Destroy every live handle. Nothing can be created afterward.
     */
    @Override
    public void close() {
        closeAndGetNextHandle();
    }

    /**
     * {@link #close()} and return the handle this registry would have issued next. It's read under the
     * same lock that marks the registry closed so no {@link #create(String)} can take it afterward and a
     * successor starting from it never issues a handle this one did.
     */
    long closeAndGetNextHandle() {
        final List<Entry> remaining;
        final long next;
        synchronized(lock) {
            next = nextHandle;
            if(closed)
                return next;
            closed = true;
            remaining = new ArrayList<>(table.values());
            table.clear();
        }

        if(!remaining.isEmpty())
            LOGGER.debug("Closing the handle registry with {} live handles", remaining.size());
        for(final Entry e: remaining) {
            if(e.createdAt != null)
                LOGGER.warn("TRACKING: handle {} was never destroyed. It was created at:", e.handle, e.createdAt);
            e.retire();
        }
        return next;
    }

    private <T> T withDetector(final long handle, final T failure, final Function<EdgeDetector, T> call) {
        final Entry entry;
        try {
            entry = pin(handle);
        } catch(final HandleNotFoundException hnfe) {
            LOGGER.debug(hnfe.getMessage());
            return failure;
        }

        try {
            return call.apply(entry.detector);
        } catch(final RuntimeException e) {
            LOGGER.warn("Call on handle {} ({}) failed: {}", handle, entry.detector, e.getMessage());
            LOGGER.debug("Failure on handle {}", handle, e);
            return failure;
        } finally {
            entry.unpin();
        }
    }

    private Entry pin(final long handle) throws HandleNotFoundException {
        synchronized(lock) {
            final Entry ret = table.get(handle);
            if(ret == null || !ret.pin())
                throw new HandleNotFoundException(handle);
            return ret;
        }
    }

    private static RasterImage toGray(final byte[] pixels, final int width, final int height) {
        return ColorConversion.toGray(RasterImage.fromPixelBuffer(pixels, width, height));
    }

    private byte[] encode(final Optional<RasterImage> result) throws IOException {
        if(!result.isPresent())
            return EMPTY;
        return ImageFile.encodeToImageData(result.get(), encodeFormat);
    }
}
