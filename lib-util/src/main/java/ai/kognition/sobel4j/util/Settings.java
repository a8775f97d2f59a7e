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

package ai.kognition.sobel4j.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Process level settings. Each setting {@code NAME} is looked up first as the system property
 * {@code -Dsobel4j.NAME=...} and, if that isn't set, as the environment variable
 * {@code SOBEL4J_NAME}.
 * </p>
 *
 * <p>
 * For boolean settings, a system property that's present but empty (i.e. {@code -Dsobel4j.NAME})
 * counts as {@code true}.
 * </p>
 */
public class Settings {
    private static final Logger LOGGER = LoggerFactory.getLogger(Settings.class);

    public static final String SYSTEM_PROPERTY_PREFIX = "sobel4j.";
    public static final String ENVIRONMENT_PREFIX = "SOBEL4J_";

    /**
     * Number of workers a row partitioned filter is built with.
     */
    public static final String WORKER_COUNT = "WORKER_COUNT";

    /**
     * Encoding applied to results handed back across the boundary.
     */
    public static final String ENCODE_FORMAT = "ENCODE_FORMAT";

    /**
     * Record where each handle was created so handles still live at shutdown can be reported.
     */
    public static final String TRACK_HANDLE_LEAKS = "TRACK_HANDLE_LEAKS";

    private Settings() {}

    /**
     * Raw lookup. Returns {@code null} if neither the system property nor the environment variable is set.
     */
    public static String get(final String name) {
        final String sysOp = System.getProperty(SYSTEM_PROPERTY_PREFIX + name);
        if(sysOp != null)
            return sysOp;
        return System.getenv(ENVIRONMENT_PREFIX + name);
    }

    public static String getString(final String name, final String defaultValue) {
        final String ret = get(name);
        return (ret == null || ret.trim().length() == 0) ? defaultValue : ret.trim();
    }

    public static boolean getBoolean(final String name, final boolean defaultValue) {
        final String sysOp = System.getProperty(SYSTEM_PROPERTY_PREFIX + name);
        if(sysOp != null)
            return "".equals(sysOp) || Boolean.parseBoolean(sysOp);
        final String env = System.getenv(ENVIRONMENT_PREFIX + name);
        return env == null ? defaultValue : Boolean.parseBoolean(env);
    }

    public static int getInt(final String name, final int defaultValue) {
        final String val = get(name);
        if(val == null)
            return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch(final NumberFormatException nfe) {
            LOGGER.warn("The setting {} has the value \"{}\" which isn't an integer. Using the default of {}", name, val, defaultValue);
            return defaultValue;
        }
    }
}
