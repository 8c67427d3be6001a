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
package com.hellblazer.atelier.template;

import com.hellblazer.atelier.cultural.CulturalProfileStore;
import com.hellblazer.atelier.parameters.CraftsmanshipLevel;
import com.hellblazer.atelier.parameters.FormalityLevel;
import com.hellblazer.atelier.parameters.ParameterValidator;
import com.hellblazer.atelier.parameters.ParametricParameters;
import com.hellblazer.atelier.parameters.StyleVariant;
import com.hellblazer.atelier.template.Shape.Box;
import com.hellblazer.atelier.template.Shape.Cylinder;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@DisplayName("Chair template")
public class ChairTemplateTest {

    private static ChairTemplate template;

    @BeforeAll
    public static void setup() {
        template = new ChairTemplate(CulturalProfileStore.loadDefault(), new ParameterValidator());
    }

    private static ParametricParameters.Builder japaneseChair() {
        return ParametricParameters.builder()
                                   .type("chair")
                                   .culture("japanese")
                                   .width(0.5)
                                   .height(0.4)
                                   .depth(0.5)
                                   .culturalElements(List.of("sashimono-joinery", "subtle-curves", "natural-grain"));
    }

    private static long count(SceneNode root, String component) {
        return root.meshes().stream().filter(m -> m.hasComponent(component)).count();
    }

    @Nested
    @DisplayName("Geometry")
    class Geometry {

        @Test
        @DisplayName("Traditional Japanese chair: seat, backrest, four box legs, armrests and joinery")
        void japanese() {
            var chair = template.generateGeometry(japaneseChair().build());
            assertEquals("ParametricChair", chair.name());
            assertEquals(9, chair.componentCount());
            assertEquals(1, count(chair, "seat"));
            assertEquals(1, count(chair, "backrest"));
            assertEquals(4, count(chair, "leg"));
            assertEquals(2, count(chair, "armrest"));
            assertEquals(1, count(chair, "cultural-accent"));
            assertTrue(chair.meshes().stream().allMatch(m -> m.shape().orElseThrow() instanceof Box));
            assertEquals(9 * 12, chair.polygonCount());
            assertEquals(9L * (24 * 32 + 12 * 3 * 2), chair.memoryBytes());

            var seat = chair.meshes().get(0);
            assertEquals(0.4f, seat.position().y, 1e-6f);
        }

        @Test
        @DisplayName("Benches have no backrest or armrests")
        void bench() {
            var bench = template.generateGeometry(japaneseChair().type("bench").width(1.0).culturalElements(
            List.of()).build());
            assertEquals("ParametricBench", bench.name());
            assertEquals(5, bench.componentCount());
            assertEquals(0, count(bench, "backrest"));
            assertEquals(0, count(bench, "armrest"));
        }

        @Test
        @DisplayName("Casual Scandinavian chair: cylinder legs, thicker seat, no armrests")
        void casualScandinavian() {
            var chair = template.generateGeometry(ParametricParameters.builder()
                                                                      .type("chair")
                                                                      .culture("scandinavian")
                                                                      .formality(FormalityLevel.CASUAL)
                                                                      .culturalElements(List.of("cozy-textures"))
                                                                      .build());
            assertEquals(0, count(chair, "armrest"));
            var seat = (Box) chair.meshes().get(0).shape().orElseThrow();
            assertEquals(0.06f, seat.height(), 1e-6f);
            var leg = chair.meshes().stream().filter(m -> m.hasComponent("leg")).findFirst().orElseThrow();
            assertEquals(8, ((Cylinder) leg.shape().orElseThrow()).segments());
            assertTrue(chair.meshes().stream().anyMatch(m -> m.name().equals("cushion")));
        }

        @Test
        void minimalistChairsHaveNoArmrests() {
            var chair = template.generateGeometry(japaneseChair().style(StyleVariant.MINIMALIST).build());
            assertEquals(0, count(chair, "armrest"));
        }

        @Test
        @DisplayName("French details: molding, tufting, nail heads and medallion")
        void french() {
            var chair = template.generateGeometry(ParametricParameters.builder()
                                                                      .type("chair")
                                                                      .culture("french")
                                                                      .height(0.44)
                                                                      .formality(FormalityLevel.FORMAL)
                                                                      .culturalElements(List.of("refined-curves",
                                                                                                "button-tufting",
                                                                                                "bronze-hardware",
                                                                                                "louis-xvi-influences"))
                                                                      .build());
            assertEquals(4, count(chair, "cultural-accent"));
            assertEquals(13, count(chair, "ornate-detail"));
            assertEquals(25, chair.componentCount());
            var backrest = (Box) chair.meshes().get(1).shape().orElseThrow();
            assertEquals(0.35f * 1.2f, backrest.height(), 1e-6f);
        }
    }

    @Nested
    @DisplayName("Metadata")
    class Metadata {

        @Test
        void japaneseChair() {
            var params = ChairTemplateTest.japaneseChair().build();
            var metadata = template.generateMetadata(params);
            assertEquals("Japanese Traditional Chair", metadata.name());
            assertEquals(
            "Authentic Japanese Traditional Chair with traditional styling and refined craftsmanship in wood-oak",
            metadata.description());
            assertTrue(metadata.culturalSignificance().contains("wabi-sabi"));
            assertTrue(metadata.usageGuidelines().contains("Remove shoes before use in traditional settings"));
            assertTrue(metadata.maintenanceInstructions().contains("Apply wood conditioner quarterly"));
            assertEquals(585, metadata.estimatedCost());
        }

        @Test
        @DisplayName("Ids are stable for equal parameters and differ otherwise")
        void ids() {
            var params = ChairTemplateTest.japaneseChair().build();
            var id = template.generateMetadata(params).id();
            assertTrue(id.startsWith("chair-japanese-"));
            assertEquals(id, template.generateMetadata(ChairTemplateTest.japaneseChair().build()).id());
            assertNotEquals(id, template.generateMetadata(params.toBuilder().width(0.6).build()).id());
        }

        @Test
        void benchCost() {
            var bench = ParametricParameters.builder()
                                            .type("bench")
                                            .culture("italian")
                                            .primaryMaterial("leather")
                                            .craftsmanshipLevel(CraftsmanshipLevel.MASTERWORK)
                                            .build();
            assertEquals(2275, template.generateMetadata(bench).estimatedCost());
            assertEquals("Italian Luxury Bench", template.generateMetadata(bench).name());
        }

        @Test
        void unknownCultureUsesItsTag() {
            var params = ChairTemplateTest.japaneseChair().culture("atlantean").build();
            var metadata = template.generateMetadata(params);
            assertEquals("atlantean Chair", metadata.name());
            assertEquals(Math.round(200 * 1.5 * 1.5), metadata.estimatedCost());
        }
    }

    @Test
    void validation() {
        assertTrue(template.validateParameters(japaneseChair().build()));
        assertFalse(template.validateParameters(japaneseChair().height(1.5).build()));
        assertFalse(template.validateParameters(japaneseChair().type("dining-table").build()));
        assertEquals(0.40, template.getCulturalProportions("japanese").seatHeight(), 1e-9);
    }
}
