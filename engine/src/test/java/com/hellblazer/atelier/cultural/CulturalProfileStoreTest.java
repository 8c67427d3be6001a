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
package com.hellblazer.atelier.cultural;

import com.hellblazer.atelier.parameters.FormalityLevel;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@DisplayName("Cultural profile store")
public class CulturalProfileStoreTest {

    private static CulturalProfileStore profiles;

    @BeforeAll
    public static void load() {
        profiles = CulturalProfileStore.loadDefault();
    }

    @Nested
    @DisplayName("Bundled profiles")
    class Bundled {

        @Test
        @DisplayName("All five cultures load in declaration order")
        void cultures() {
            assertEquals(List.of("japanese", "scandinavian", "italian", "french", "modern"),
                         List.copyOf(profiles.cultures()));
        }

        @Test
        void japaneseProportions() {
            var japanese = profiles.find("japanese").orElseThrow();
            assertEquals("Japanese Traditional", japanese.name());
            assertEquals(0.40, japanese.proportions().seatHeight(), 1e-9);
            assertEquals(0.72, japanese.proportions().tableHeight(), 1e-9);
            assertEquals("wood-oak", japanese.materials().preferred().get(0));
            assertTrue(japanese.materials().avoids("metal-steel"));
            assertEquals(CulturalProfile.GroupOrientation.CIRCULAR, japanese.ergonomics().groupOrientation());
            assertEquals(List.of("wood-cherry", "fabric-silk"), japanese.materials().seasonal().get(Season.SPRING));
        }

        @Test
        @DisplayName("Lookup ignores case and surrounding whitespace")
        void normalizedLookup() {
            assertTrue(profiles.isKnown(" Italian "));
            assertEquals(profiles.find("italian"), profiles.find("ITALIAN"));
        }

        @Test
        void unknownCultureUsesDefault() {
            assertFalse(profiles.isKnown("klingon"));
            assertTrue(profiles.find("klingon").isEmpty());
            assertSame(CulturalProfileStore.DEFAULT_PROFILE, profiles.getOrDefault("klingon"));
            assertTrue(profiles.recommendations("klingon").isEmpty());
        }

        @Test
        void recommendations() {
            var recommendations = profiles.recommendations("japanese");
            assertEquals(4, recommendations.size());
            assertEquals("Use wood-oak, wood-cherry, wood-bamboo for authentic materials", recommendations.get(0));
        }

        @Test
        void materialAppropriateness() {
            assertFalse(profiles.isMaterialAppropriate("metal-steel", "japanese"));
            assertTrue(profiles.isMaterialAppropriate("metal-steel", "modern"));
            assertTrue(profiles.isMaterialAppropriate("anything", "klingon"));
        }
    }

    @Nested
    @DisplayName("Type adapted proportions")
    class Adapted {

        @Test
        void coffeeAndSideTables() {
            assertEquals(0.72 * 0.6, profiles.proportionsFor("japanese", "coffee-table").tableHeight(), 1e-9);
            assertEquals(0.75 * 0.8, profiles.proportionsFor("french", "side-table").tableHeight(), 1e-9);
            assertEquals(0.76, profiles.proportionsFor("italian", "dining-table").tableHeight(), 1e-9);
        }

        @Test
        void benchSitsLower() {
            assertEquals(0.45 * 0.95, profiles.proportionsFor("scandinavian", "bench").seatHeight(), 1e-9);
            assertEquals(0.45, profiles.proportionsFor("scandinavian", "chair").seatHeight(), 1e-9);
        }

        @Test
        void typeTagCaseIsIgnored() {
            assertEquals(0.72 * 0.6, profiles.proportionsFor("japanese", "Coffee-Table").tableHeight(), 1e-9);
            assertEquals(0.45 * 0.95, profiles.proportionsFor("scandinavian", "BENCH").seatHeight(), 1e-9);
            assertEquals(0.45, profiles.proportionsFor("scandinavian", null).seatHeight(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Decorative intensity")
    class Intensity {

        @Test
        void expectedIsCappedAtOne() {
            assertEquals(0.3, DecorativeIntensity.expected("japanese", FormalityLevel.SEMI_FORMAL), 1e-9);
            assertEquals(1.0, DecorativeIntensity.expected("italian", FormalityLevel.CEREMONIAL), 1e-9);
            assertEquals(0.5 * 0.8, DecorativeIntensity.expected("unknown", FormalityLevel.CASUAL), 1e-9);
        }

        @Test
        void forFormality() {
            assertEquals(0.7 * 0.4, DecorativeIntensity.forFormality(FormalityLevel.FORMAL, "modern"), 1e-9);
            assertEquals(1.0, DecorativeIntensity.forFormality(FormalityLevel.CEREMONIAL, "italian"), 1e-9);
            assertEquals(0.5, DecorativeIntensity.forFormality(FormalityLevel.SEMI_FORMAL, "unknown"), 1e-9);
        }
    }

    @Test
    @DisplayName("Profiles load from an arbitrary JSON stream")
    void loadFromStream() throws IOException {
        var json = """
                   {"nordic": {
                     "name": "Nordic",
                     "proportions": {"seatHeight": 0.44, "tableHeight": 0.74, "armrestHeight": 0.66,
                                     "backrestAngle": 12, "legThickness": 0.05, "surfaceThickness": 0.03},
                     "materials": {"preferred": ["wood-birch"], "traditional": ["wood-birch"], "avoided": [],
                                   "seasonal": {}},
                     "aesthetics": {"colorPalette": ["#FFFFFF"], "decorativeElements": ["clean-lines"],
                                    "surfaceFinishes": ["soap"], "joiningMethods": ["dowel"], "symbolism": {}},
                     "ergonomics": {"floorSeating": false, "formalPosture": false,
                                    "groupOrientation": "CLUSTERED", "personalSpace": 0.6}
                   }}
                   """;
        var store = CulturalProfileStore.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
        assertEquals(List.of("nordic"), List.copyOf(store.cultures()));
        assertEquals("wood-birch", store.getOrDefault("Nordic").materials().preferred().get(0));
    }
}
