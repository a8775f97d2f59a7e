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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Maps strategy names and ids to the constructors of {@link EdgeDetector}s.
 * </p>
 *
 * <p>
 * A new registry holds the {@link StrategyType}s, registered in declaration order the first
 * time the registry is used. A name is resolved by looking for, in order:
 * </p>
 *
 * <ol>
 * <li>a strategy with that canonical name</li>
 * <li>an alias of one (see {@link #ALIASES})</li>
 * </ol>
 *
 * <p>
 * {@link #createByName(String)} falls back to {@link StrategyType#SOBEL_BASIC} for any other name
 * and logs a warning. Use {@link #resolve(String)} to find out if a name is known.
 * </p>
 *
 * <p>
 * Registering a strategy with the id or canonical name of an existing one replaces it in
 * place. Instances already created are unaffected. The registry is thread safe.
 * </p>
 */
public class StrategyRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(StrategyRegistry.class);

    public static final String FALLBACK_NAME = StrategyType.SOBEL_BASIC.canonicalName();

    /**
     * alias -> canonical name
     */
    public static final Map<String, String> ALIASES;

    static {
        final Map<String, String> aliases = new HashMap<>();
        aliases.put("sobel", StrategyType.SOBEL_BASIC.canonicalName());
        aliases.put("basic", StrategyType.SOBEL_BASIC.canonicalName());
        aliases.put("improved", StrategyType.SOBEL_IMPROVED.canonicalName());
        aliases.put("modern", StrategyType.SOBEL_IMPROVED.canonicalName());
        aliases.put("omp", StrategyType.SOBEL_OMP.canonicalName());
        aliases.put("openmp", StrategyType.SOBEL_OMP.canonicalName());
        aliases.put("pthread", StrategyType.SOBEL_PTHREAD.canonicalName());
        aliases.put("pthreads", StrategyType.SOBEL_PTHREAD.canonicalName());
        ALIASES = Collections.unmodifiableMap(aliases);
    }

    private static class Registration {
        final StrategyDescriptor descriptor;
        final Supplier<? extends EdgeDetector> constructor;

        Registration(final StrategyDescriptor descriptor, final Supplier<? extends EdgeDetector> constructor) {
            this.descriptor = descriptor;
            this.constructor = constructor;
        }
    }

    // registration order matters for listing
    private final List<Registration> registrations = new ArrayList<>();
    private boolean builtInsRegistered = false;

    /**
     * Register a strategy.
     *
     * @param constructor creates new instances. May be null only if the strategy isn't {@code available}.
     */
    public void register(final String id, final String canonicalName, final String description, final Supplier<? extends EdgeDetector> constructor,
        final boolean available) {
        Validate.notBlank(id, "id");
        Validate.notBlank(canonicalName, "canonicalName");
        Validate.isTrue(!available || constructor != null, "The available strategy %s needs a constructor", canonicalName);

        final Registration reg = new Registration(new StrategyDescriptor(id, canonicalName, StringUtils.defaultString(description), available),
            constructor);

        synchronized(this) {
            ensureBuiltIns();
            doRegister(reg);
        }
    }

    public void register(final String id, final String canonicalName, final String description, final Supplier<? extends EdgeDetector> constructor) {
        register(id, canonicalName, description, constructor, true);
    }

    /**
     * Create a new instance of the strategy the name resolves to, falling back to
     * {@link #FALLBACK_NAME} when the name isn't known.
     *
     * @throws UnknownStrategyException if the name is null or resolves to a strategy that isn't available.
     */
    public EdgeDetector createByName(final String name) throws UnknownStrategyException {
        if(name == null)
            throw new UnknownStrategyException("No strategy name was supplied");

        final Registration reg;
        synchronized(this) {
            ensureBuiltIns();
            final Registration found = lookup(name);
            if(found == null) {
                LOGGER.warn("There's no strategy named \"{}\". Falling back to \"{}\"", name, FALLBACK_NAME);
                reg = byName(FALLBACK_NAME);
                if(reg == null)
                    throw new UnknownStrategyException("There's no strategy named \"" + name + "\" and the fallback \"" + FALLBACK_NAME
                        + "\" has been removed");
            } else
                reg = found;
        }
        return instantiate(reg);
    }

    /**
     * @throws UnknownStrategyException if there's no available strategy registered with the id.
     */
    public EdgeDetector createById(final String id) throws UnknownStrategyException {
        final Registration reg;
        synchronized(this) {
            ensureBuiltIns();
            reg = byId(id);
        }
        if(reg == null)
            throw new UnknownStrategyException("There's no strategy with the id \"" + id + "\"");
        return instantiate(reg);
    }

    public EdgeDetector createByType(final StrategyType type) throws UnknownStrategyException {
        Validate.notNull(type, "type");
        return createById(type.name());
    }

    /**
     * Find the strategy a name refers to, by canonical name then alias. There's no fallback.
     */
    public synchronized Optional<StrategyDescriptor> resolve(final String name) {
        ensureBuiltIns();
        return Optional.ofNullable(lookup(name)).map(r -> r.descriptor);
    }

    /**
     * The available strategies in the order they were registered.
     */
    public synchronized List<StrategyDescriptor> listAvailable() {
        ensureBuiltIns();
        return registrations.stream()
            .map(r -> r.descriptor)
            .filter(d -> d.available)
            .collect(Collectors.toList());
    }

    public synchronized List<StrategyDescriptor> listAll() {
        ensureBuiltIns();
        return registrations.stream()
            .map(r -> r.descriptor)
            .collect(Collectors.toList());
    }

    public synchronized boolean isAvailable(final String id) {
        ensureBuiltIns();
        final Registration reg = byId(id);
        return reg != null && reg.descriptor.available;
    }

    public boolean isAvailable(final StrategyType type) {
        return isAvailable(type.name());
    }

    /**
     * A human readable listing of every registered strategy and whether it's available.
     */
    public String describeAll() {
        final StringBuilder sb = new StringBuilder("=== AVAILABLE FILTERS ===\n\n");
        for(final StrategyDescriptor d: listAll()) {
            sb.append("* ").append(d.canonicalName).append(" (").append(d.id).append(")\n");
            sb.append("  ").append(d.description).append("\n");
            sb.append("  Status: ").append(d.available ? "[x] available" : "[ ] not available").append("\n\n");
        }
        return sb.toString();
    }

    private EdgeDetector instantiate(final Registration reg) throws UnknownStrategyException {
        if(!reg.descriptor.available || reg.constructor == null)
            throw new UnknownStrategyException("The strategy \"" + reg.descriptor.canonicalName + "\" isn't available");
        final EdgeDetector ret = reg.constructor.get();
        if(ret == null)
            throw new UnknownStrategyException("The constructor for \"" + reg.descriptor.canonicalName + "\" didn't create anything");
        LOGGER.debug("Created {} for {}", ret, reg.descriptor);
        return ret;
    }

    // must hold the lock
    private void ensureBuiltIns() {
        if(!builtInsRegistered) {
            builtInsRegistered = true;
            for(final StrategyType t: StrategyType.values())
                doRegister(new Registration(new StrategyDescriptor(t.name(), t.canonicalName(), t.description(), t.isAvailable()),
                    t.isAvailable() ? t : null));
        }
    }

    // must hold the lock
    private void doRegister(final Registration reg) {
        final String id = reg.descriptor.id;
        final String name = reg.descriptor.canonicalName;

        int pos = -1;
        for(int i = 0; i < registrations.size(); i++) {
            final StrategyDescriptor d = registrations.get(i).descriptor;
            if(d.id.equals(id) || d.canonicalName.equals(name)) {
                if(pos < 0) {
                    pos = i;
                    registrations.set(i, reg);
                } else
                    // the id and the name each matched a different entry. The first one wins the spot.
                    registrations.remove(i--);
            }
        }

        if(pos < 0)
            registrations.add(reg);
        else
            LOGGER.info("Replaced the strategy registered at {} with {}", pos, reg.descriptor);
    }

    // must hold the lock
    private Registration lookup(final String name) {
        if(name == null)
            return null;
        final Registration exact = byName(name);
        if(exact != null)
            return exact;
        final String canonical = ALIASES.get(name);
        return canonical == null ? null : byName(canonical);
    }

    private Registration byName(final String name) {
        return registrations.stream().filter(r -> r.descriptor.canonicalName.equals(name)).findFirst().orElse(null);
    }

    private Registration byId(final String id) {
        return registrations.stream().filter(r -> r.descriptor.id.equals(id)).findFirst().orElse(null);
    }
}
