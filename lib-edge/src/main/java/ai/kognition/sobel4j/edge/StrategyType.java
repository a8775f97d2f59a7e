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

import java.util.function.Supplier;

import ai.kognition.sobel4j.image.ConfigurationException;
import ai.kognition.sobel4j.util.Settings;

/**
 * The strategies every {@link StrategyRegistry} starts out with.
 */
public enum StrategyType implements Supplier<EdgeDetector> {
    SOBEL_BASIC("sobel_basic", "Basic Sobel filter - standard sequential implementation", true) {
        @Override
        public EdgeDetector get() {
            return new SequentialEdgeDetector("Sobel Basic", description(), new FilterConfig());
        }
    },
    SOBEL_IMPROVED("sobel_improved", "Improved Sobel filter - configurable with optional Gaussian pre-blur", true) {
        @Override
        public EdgeDetector get() {
            return new SequentialEdgeDetector("Sobel Improved", description(),
                new FilterConfig.Builder().threshold(IMPROVED_DEFAULT_THRESHOLD).build());
        }
    },
    SOBEL_OMP("sobel_omp", "Parallel Sobel filter - automatic parallelization", true) {
        @Override
        public EdgeDetector get() {
            return new AutoParallelEdgeDetector("Sobel Auto Parallel", description(), new FilterConfig());
        }
    },
    SOBEL_PTHREAD("sobel_pthread", "Threaded Sobel filter - explicit worker threads over row bands", true) {
        @Override
        public EdgeDetector get() {
            return new RowPartitionedEdgeDetector("Sobel Row Partitioned", description(), new FilterConfig(),
                Settings.getInt(Settings.WORKER_COUNT, RowPartitionedEdgeDetector.DEFAULT_WORKER_COUNT));
        }
    },
    CANNY("canny", "Canny filter - advanced edge detection", false) {
        @Override
        public EdgeDetector get() {
            throw new UnknownStrategyException("The " + canonicalName() + " strategy isn't implemented");
        }
    };

    public static final int IMPROVED_DEFAULT_THRESHOLD = 80;

    private final String canonicalName;
    private final String description;
    private final boolean available;

    private StrategyType(final String canonicalName, final String description, final boolean available) {
        this.canonicalName = canonicalName;
        this.description = description;
        this.available = available;
    }

    /**
     * Create a new instance of this strategy with its default configuration.
     *
     * @throws UnknownStrategyException if the strategy isn't available
     * @throws ConfigurationException if the process level settings can't configure it
     */
    @Override
    public abstract EdgeDetector get();

    public String canonicalName() {
        return canonicalName;
    }

    public String description() {
        return description;
    }

    public boolean isAvailable() {
        return available;
    }
}
