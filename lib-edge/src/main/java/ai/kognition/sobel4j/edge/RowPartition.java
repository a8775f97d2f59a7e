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

import java.util.ArrayList;
import java.util.List;

/**
 * A half open range of rows {@code [from, to)}.
 */
public final class RowPartition {
    public final int from;
    public final int to;

    public RowPartition(final int from, final int to) {
        this.from = from;
        this.to = to;
    }

    public int size() {
        return to - from;
    }

    public boolean isEmpty() {
        return from == to;
    }

    /**
     * Split {@code [0, rows)} into {@code parts} contiguous ranges of {@code rows / parts} rows each.
     * The last range also takes the remainder so when there are fewer rows than parts every range but
     * the last is empty.
     */
    public static List<RowPartition> split(final int rows, final int parts) {
        if(parts < 1)
            throw new IllegalArgumentException("Can't split rows into " + parts + " parts");
        if(rows < 0)
            throw new IllegalArgumentException("Can't split " + rows + " rows");

        final int rowsPerPart = rows / parts;
        final List<RowPartition> ret = new ArrayList<>(parts);
        for(int i = 0; i < parts; i++) {
            final int from = i * rowsPerPart;
            final int to = (i == parts - 1) ? rows : from + rowsPerPart;
            ret.add(new RowPartition(from, to));
        }
        return ret;
    }

    @Override
    public boolean equals(final Object obj) {
        if(this == obj)
            return true;
        if(!(obj instanceof RowPartition))
            return false;
        final RowPartition other = (RowPartition)obj;
        return from == other.from && to == other.to;
    }

    @Override
    public int hashCode() {
        return (31 * from) + to;
    }

    @Override
    public String toString() {
        return "[" + from + ", " + to + ")";
    }
}
