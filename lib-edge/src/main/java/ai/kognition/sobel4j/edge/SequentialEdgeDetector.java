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

/**
 * Computes every row on the calling thread in a single row major scan. This is the reference
 * the parallel implementations are held to.
 */
public class SequentialEdgeDetector extends BaseEdgeDetector {

    public SequentialEdgeDetector(final String name, final String description, final FilterConfig config) {
        super(name, description, config);
    }

    public SequentialEdgeDetector(final FilterConfig config) {
        this("Sobel Sequential", "Single threaded 3x3 Sobel gradient", config);
    }

    public SequentialEdgeDetector() {
        this(new FilterConfig());
    }

    @Override
    protected boolean runRows(final int rows, final RowTask task) {
        task.apply(0, rows);
        return true;
    }

    @Override
    protected String executionInfo() {
        return "sequential";
    }
}
