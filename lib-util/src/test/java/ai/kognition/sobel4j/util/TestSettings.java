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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Test;

public class TestSettings {
    private static final String NAME = "TEST_SETTING_" + TestSettings.class.hashCode();

    @After
    public void clear() {
        System.clearProperty(Settings.SYSTEM_PROPERTY_PREFIX + NAME);
    }

    @Test
    public void testUnsetFallsBackToDefaults() {
        assertNull(Settings.get(NAME));
        assertEquals("png", Settings.getString(NAME, "png"));
        assertEquals(7, Settings.getInt(NAME, 7));
        assertFalse(Settings.getBoolean(NAME, false));
        assertTrue(Settings.getBoolean(NAME, true));
    }

    @Test
    public void testSystemProperty() {
        System.setProperty(Settings.SYSTEM_PROPERTY_PREFIX + NAME, " 12 ");
        assertEquals(12, Settings.getInt(NAME, 7));
        assertEquals("12", Settings.getString(NAME, "x"));
    }

    @Test
    public void testBadIntUsesDefault() {
        System.setProperty(Settings.SYSTEM_PROPERTY_PREFIX + NAME, "twelve");
        assertEquals(7, Settings.getInt(NAME, 7));
    }

    @Test
    public void testEmptyBooleanPropertyIsTrue() {
        System.setProperty(Settings.SYSTEM_PROPERTY_PREFIX + NAME, "");
        assertTrue(Settings.getBoolean(NAME, false));
        System.setProperty(Settings.SYSTEM_PROPERTY_PREFIX + NAME, "false");
        assertFalse(Settings.getBoolean(NAME, true));
    }

    @Test
    public void testTimer() throws Exception {
        final Timer timer = Timer.started();
        Thread.sleep(5);
        timer.stop();
        assertTrue(timer.getMillis() >= 4.0);
        assertTrue(timer.toString().endsWith(" ms"));
    }
}
