/* Copyright (C) 2024 The DeclareGen Authors
 * This file is part of DeclareGen.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.declaregen.setting;

import java.util.Properties;

import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.Test;

public class DeclareGenSettingsTest {

    @AfterMethod
    public void clearSystemProperties() {
        System.clearProperty(DeclareGenProperty.MAX_LENGTH.getPropertyKey());
    }

    @Test
    public void testPropertiesAndDefaults() {
        Properties props = new Properties();
        props.setProperty("declaregen.maxLength", "25");
        props.setProperty("declaregen.seed", "not-a-number");
        DeclareGenSettings settings = new DeclareGenSettings(props);

        Assert.assertEquals(settings.getInt(DeclareGenProperty.MAX_LENGTH, 100), 25);
        Assert.assertEquals(settings.getInt(DeclareGenProperty.ORDER, 2), 2);
        Assert.assertEquals(settings.getLong(DeclareGenProperty.SEED, 7L), 7L);
        Assert.assertNull(settings.getProperty(DeclareGenProperty.PARALLELISM));
    }

    @Test
    public void testSystemPropertyOverride() {
        Properties props = new Properties();
        props.setProperty("declaregen.maxLength", "25");
        DeclareGenSettings settings = new DeclareGenSettings(props);

        System.setProperty(DeclareGenProperty.MAX_LENGTH.getPropertyKey(), "40");
        Assert.assertEquals(settings.getInt(DeclareGenProperty.MAX_LENGTH, 100), 40);
    }

    @Test
    public void testOutOfRangeIntegerFallsBack() {
        Properties props = new Properties();
        props.setProperty("declaregen.maxLength", "5000000000");
        props.setProperty("declaregen.order", "-5000000000");
        props.setProperty("declaregen.seed", "5000000000");
        DeclareGenSettings settings = new DeclareGenSettings(props);

        Assert.assertEquals(settings.getInt(DeclareGenProperty.MAX_LENGTH, 100), 100);
        Assert.assertEquals(settings.getInt(DeclareGenProperty.ORDER, 2), 2);
        Assert.assertEquals(settings.getLong(DeclareGenProperty.SEED, 7L), 5000000000L);
    }
}
