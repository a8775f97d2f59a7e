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

import java.util.Objects;

/**
 * What a {@link StrategyRegistry} knows about one registered strategy.
 */
public final class StrategyDescriptor {
    public final String id;
    public final String canonicalName;
    public final String description;
    public final boolean available;

    public StrategyDescriptor(final String id, final String canonicalName, final String description, final boolean available) {
        this.id = id;
        this.canonicalName = canonicalName;
        this.description = description;
        this.available = available;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, canonicalName, description, available);
    }

    @Override
    public boolean equals(final Object obj) {
        if(this == obj)
            return true;
        if(obj == null || getClass() != obj.getClass())
            return false;
        final StrategyDescriptor other = (StrategyDescriptor)obj;
        return available == other.available && Objects.equals(id, other.id) && Objects.equals(canonicalName, other.canonicalName)
            && Objects.equals(description, other.description);
    }

    @Override
    public String toString() {
        return "StrategyDescriptor[" + canonicalName + " (" + id + "), available=" + available + "]";
    }
}
