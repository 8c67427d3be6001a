/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Atelier.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.atelier.parameters;

import com.hellblazer.atelier.cultural.Season;
import net.jqwik.api.*;
import net.jqwik.api.constraints.DoubleRange;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@Label("Canonical key properties")
class CanonicalKeyPropertyTest {

    @Property
    @Label("Equal parameter sets produce equal keys however they are assembled")
    void equalParametersEqualKeys(@ForAll @DoubleRange(min = 0.3, max = 3.0) double width,
                                  @ForAll("elements") List<String> elements, @ForAll boolean withSecondary) {
        var first = ParametricParameters.builder()
                                        .type("chair")
                                        .culture("japanese")
                                        .width(width)
                                        .culturalElements(elements)
                                        .secondaryMaterial(withSecondary ? "fabric-cotton" : null)
                                        .build();
        var second = ParametricParameters.builder()
                                         .secondaryMaterial(withSecondary ? "fabric-cotton" : null)
                                         .culturalElements(new ArrayList<>(elements))
                                         .width(width)
                                         .culture("japanese")
                                         .type("chair")
                                         .build();
        assertEquals(first, second);
        assertEquals(CanonicalKey.of(first), CanonicalKey.of(second));
    }

    @Property
    @Label("Parameter sets that differ produce different keys")
    void differentParametersDifferentKeys(@ForAll @DoubleRange(min = 0.3, max = 1.0) double width,
                                          @ForAll @DoubleRange(min = 0.3, max = 1.0) double otherWidth) {
        Assume.that(width != otherWidth);
        var params = ParametricParameters.builder().type("chair").culture("modern").width(width).build();
        assertNotEquals(CanonicalKey.of(params), CanonicalKey.of(params.toBuilder().width(otherWidth).build()));
    }

    @Example
    @Label("Absent optionals are omitted, present ones included")
    void optionals() {
        var params = ParametricParameters.builder().type("chair").culture("modern").build();
        var key = CanonicalKey.of(params);
        assertFalse(key.contains("seasonalAdaptation"));
        var seasonal = CanonicalKey.of(params.toBuilder().seasonalAdaptation(Season.WINTER).capacity(4).build());
        assertTrue(seasonal.contains("\"seasonalAdaptation\""));
        assertTrue(seasonal.contains("\"capacity\":4"));
        assertTrue(seasonal.indexOf("\"capacity\"") < seasonal.indexOf("\"width\""));
    }

    @Provide
    Arbitrary<List<String>> elements() {
        return Arbitraries.of("sashimono-joinery", "subtle-curves", "natural-grain", "paper-panels")
                          .list()
                          .ofMaxSize(4);
    }
}
