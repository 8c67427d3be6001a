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
package com.hellblazer.atelier.analysis;

import com.hellblazer.atelier.cultural.CulturalProfileStore;
import com.hellblazer.atelier.parameters.BudgetRange;
import com.hellblazer.atelier.parameters.FormalityLevel;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class RuleBasedRequirementAnalyzerTest {

    private final RuleBasedRequirementAnalyzer analyzer = new RuleBasedRequirementAnalyzer(
    CulturalProfileStore.loadDefault());

    private static UserFurnitureRequest request(String event, String culture, int guests) {
        return new UserFurnitureRequest(event, culture, guests, new SpaceDimensions(10, 3, 8), BudgetRange.MEDIUM,
                                        FormalityLevel.SEMI_FORMAL, "");
    }

    @Test
    void seatingIsCappedAtTwelve() {
        var analysis = analyzer.analyzeNow(request("wedding", "italian", 40));
        assertEquals(1, analysis.pieces().size());
        var chairs = analysis.pieces().get(0);
        assertEquals("chair", chairs.type());
        assertEquals(12, chairs.quantity());
        assertEquals(Priority.ESSENTIAL, chairs.priority());
        assertEquals("italian traditional design", analysis.overallTheme());

        var params = chairs.parameters();
        assertEquals(0.46, params.height(), 1e-9);
        assertEquals("wood-cherry", params.primaryMaterial());
        assertEquals(List.of("ornate-carvings", "gold-accents", "curved-lines"), params.culturalElements());
        assertEquals(FormalityLevel.SEMI_FORMAL, params.formality());
    }

    @Test
    void dinnersAddTables() throws Exception {
        var analysis = analyzer.analyze(request("intimate-dinner", "scandinavian", 13)).get();
        assertEquals(2, analysis.pieces().size());
        assertEquals(12, analysis.pieces().get(0).quantity());
        var tables = analysis.pieces().get(1);
        assertEquals("dining-table", tables.type());
        assertEquals(3, tables.quantity());
        assertEquals(1.8, tables.parameters().width());
        assertEquals(0.9, tables.parameters().depth());
        assertEquals(0.75, tables.parameters().height(), 1e-9);
        assertEquals(Optional.of(6), tables.parameters().capacity());
        assertEquals(15, analysis.totalQuantity());
    }

    @Test
    void unknownCultureUsesDefaultProfile() {
        var chairs = analyzer.analyzeNow(request("reception", "atlantean", 4)).pieces().get(0);
        assertEquals(4, chairs.quantity());
        assertEquals("wood-oak", chairs.parameters().primaryMaterial());
        assertEquals(List.of("clean-lines"), chairs.parameters().culturalElements());
    }
}
