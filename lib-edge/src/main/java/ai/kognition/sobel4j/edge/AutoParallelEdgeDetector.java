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

import java.util.concurrent.ForkJoinPool;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands each row to a parallel stream and leaves the scheduling to the common
 * {@link ForkJoinPool}.
 */
public class AutoParallelEdgeDetector extends BaseEdgeDetector {
    private static final Logger LOGGER = LoggerFactory.getLogger(AutoParallelEdgeDetector.class);

    public AutoParallelEdgeDetector(final String name, final String description, final FilterConfig config) {
        super(name, description, config);
    }

    public AutoParallelEdgeDetector(final FilterConfig config) {
        this("Sobel Auto Parallel", "3x3 Sobel gradient over a parallel stream of rows", config);
    }

    public AutoParallelEdgeDetector() {
        this(new FilterConfig());
    }

    @Override
    protected boolean runRows(final int rows, final RowTask task) {
        try {
            // forEach doesn't return until every row is done
            IntStream.range(0, rows).parallel().forEach(r -> task.apply(r, r + 1));
            return true;
        } catch(final RuntimeException rte) {
            LOGGER.error("{} failed computing a row", this, rte);
            return false;
        }
    }

    @Override
    protected String executionInfo() {
        return "parallel stream, parallelism " + ForkJoinPool.getCommonPoolParallelism();
    }
}
