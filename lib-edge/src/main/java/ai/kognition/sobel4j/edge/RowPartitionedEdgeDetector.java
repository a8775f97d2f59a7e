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

import static net.dempsy.util.Functional.chain;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.sobel4j.image.ConfigurationException;

/**
 * <p>
 * Splits the image into {@code workerCount} contiguous bands of rows (see {@link RowPartition#split(int, int)})
 * and computes each band as one task on a fixed pool of daemon threads owned by this instance. The call
 * blocks until every band is done.
 * </p>
 *
 * <p>
 * If any band fails the bands that haven't finished are cancelled and the call produces no result.
 * </p>
 *
 * <p>
 * The pool is shut down by {@link #close()}.
 * </p>
 */
public class RowPartitionedEdgeDetector extends BaseEdgeDetector {
    private static final Logger LOGGER = LoggerFactory.getLogger(RowPartitionedEdgeDetector.class);

    public static final int DEFAULT_WORKER_COUNT = 4;

    private static final AtomicLong threadSequence = new AtomicLong(0);

    private final int workerCount;
    private final ExecutorService pool;

    public RowPartitionedEdgeDetector(final String name, final String description, final FilterConfig config, final int workerCount)
        throws ConfigurationException {
        super(name, description, config);
        if(workerCount < 1)
            throw new ConfigurationException("workerCount must be at least 1 but was " + workerCount);
        this.workerCount = workerCount;
        this.pool = Executors.newFixedThreadPool(workerCount, r -> chain(new Thread(r, nextThreadName()), t -> t.setDaemon(true)));
    }

    public RowPartitionedEdgeDetector(final FilterConfig config, final int workerCount) throws ConfigurationException {
        this("Sobel Row Partitioned", "3x3 Sobel gradient over bands of rows on dedicated worker threads", config, workerCount);
    }

    public RowPartitionedEdgeDetector(final int workerCount) throws ConfigurationException {
        this(new FilterConfig(), workerCount);
    }

    public int getWorkerCount() {
        return workerCount;
    }

    @Override
    protected boolean runRows(final int rows, final RowTask task) {
        final List<RowPartition> bands = RowPartition.split(rows, workerCount).stream()
            .filter(p -> !p.isEmpty())
            .collect(Collectors.toList());

        final List<Future<?>> futures = new ArrayList<>(bands.size());
        try {
            for(final RowPartition band: bands)
                futures.add(pool.submit(() -> task.apply(band.from, band.to)));
        } catch(final RejectedExecutionException ree) {
            LOGGER.warn("{} couldn't schedule its workers. Has it been closed?", this, ree);
            cancelAll(futures);
            return false;
        }

        // join on every band. The first failure cancels whatever hasn't finished.
        for(final Future<?> f: futures) {
            try {
                f.get();
            } catch(final ExecutionException ee) {
                LOGGER.error("{} failed computing a band of rows", this, ee.getCause());
                cancelAll(futures);
                return false;
            } catch(final CancellationException ce) {
                LOGGER.warn("{} had a band of rows cancelled", this, ce);
                cancelAll(futures);
                return false;
            } catch(final InterruptedException ie) {
                Thread.currentThread().interrupt();
                LOGGER.warn("{} was interrupted waiting for its workers", this);
                cancelAll(futures);
                return false;
            }
        }
        return true;
    }

    private static void cancelAll(final List<Future<?>> futures) {
        futures.forEach(f -> f.cancel(true));
    }

    @Override
    protected String executionInfo() {
        return workerCount + " workers";
    }

    @Override
    public void close() {
        if(!isClosed()) {
            super.close();
            pool.shutdown();
            try {
                if(!pool.awaitTermination(1, TimeUnit.SECONDS))
                    LOGGER.debug("{} workers are still finishing after close", this);
            } catch(final InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static String nextThreadName() {
        return "sobel-rows-" + threadSequence.getAndIncrement();
    }
}
