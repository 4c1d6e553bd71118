/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
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

package com.phonepe.council.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ModelSettingsTest {

    @Test
    void testEffectiveMaxIterations() {
        assertEquals(ModelSettings.DEFAULT_MAX_ITERATIONS, ModelSettings.builder().build().effectiveMaxIterations());
        assertEquals(ModelSettings.DEFAULT_MAX_ITERATIONS,
                     ModelSettings.builder().maxIterations(0).build().effectiveMaxIterations());
        assertEquals(3, ModelSettings.builder().maxIterations(3).build().effectiveMaxIterations());
    }
}
