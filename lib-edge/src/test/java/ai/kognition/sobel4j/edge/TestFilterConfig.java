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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import ai.kognition.sobel4j.image.ConfigurationException;

public class TestFilterConfig {

    @Test
    public void testDefaults() {
        final FilterConfig config = new FilterConfig();
        assertEquals(50, config.getThreshold());
        assertTrue(config.isNormalize());
        assertFalse(config.isUseBlur());
        assertEquals(1.0, config.getBlurSigma(), 0.0);
    }

    @Test
    public void testBuilder() {
        final FilterConfig config = new FilterConfig.Builder().threshold(0).normalize(false).useBlur(true).blurSigma(2.5).build();
        assertEquals(0, config.getThreshold());
        assertFalse(config.isNormalize());
        assertTrue(config.isUseBlur());
        assertEquals(2.5, config.getBlurSigma(), 0.0);

        assertThrows(ConfigurationException.class, () -> new FilterConfig.Builder().threshold(256).build());
        assertThrows(ConfigurationException.class, () -> new FilterConfig.Builder().blurSigma(0.0).build());
    }

    @Test
    public void testRejectedValuesLeaveConfigUnchanged() {
        final FilterConfig config = new FilterConfig().setThreshold(120).setBlurSigma(1.5);

        assertThrows(ConfigurationException.class, () -> config.setThreshold(-1));
        assertThrows(ConfigurationException.class, () -> config.setThreshold(256));
        assertEquals(120, config.getThreshold());

        assertThrows(ConfigurationException.class, () -> config.setBlurSigma(0.0));
        assertThrows(ConfigurationException.class, () -> config.setBlurSigma(-3.0));
        assertThrows(ConfigurationException.class, () -> config.setBlurSigma(Double.NaN));
        assertEquals(1.5, config.getBlurSigma(), 0.0);

        config.setThreshold(255).setThreshold(0);
        assertEquals(0, config.getThreshold());
    }

    @Test
    public void testCopyIsIndependent() {
        final FilterConfig config = new FilterConfig();
        final FilterConfig copy = config.copy();
        assertNotSame(config, copy);
        config.setThreshold(200).setUseBlur(true);
        assertEquals(50, copy.getThreshold());
        assertFalse(copy.isUseBlur());
        assertEquals("FilterConfig[threshold=200, normalize=true, useBlur=true, blurSigma=1.0]", config.toString());
    }
}
