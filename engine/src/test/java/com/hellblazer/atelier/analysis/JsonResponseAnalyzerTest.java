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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * @author hal.hildebrand
 */
public class JsonResponseAnalyzerTest {

    private static final UserFurnitureRequest REQUEST = new UserFurnitureRequest("tea-ceremony", "japanese", 4,
                                                                                 new SpaceDimensions(4, 2.5, 4),
                                                                                 BudgetRange.LUXURY,
                                                                                 FormalityLevel.CEREMONIAL,
                                                                                 "floor seating preferred");

    private CompletionSource     source;
    private JsonResponseAnalyzer analyzer;

    @BeforeEach
    public void setup() {
        var profiles = CulturalProfileStore.loadDefault();
        source = mock(CompletionSource.class);
        analyzer = new JsonResponseAnalyzer(source, new AnalysisResponseParser(profiles), profiles);
    }

    @Test
    void parsesTheCompletion() throws Exception {
        when(source.complete(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(
        "{\"furniture_pieces\": [{\"type\": \"bench\", \"quantity\": 2}], \"overall_theme\": \"Wabi-sabi\"}"));

        var analysis = analyzer.analyze(REQUEST).get(5, TimeUnit.SECONDS);
        assertEquals("Wabi-sabi", analysis.overallTheme());
        assertEquals(2, analysis.totalQuantity());
        assertEquals("japanese", analysis.pieces().get(0).parameters().culture());
    }

    @Test
    void promptCarriesRequestAndCulturalContext() {
        when(source.complete(anyString(), anyString())).thenReturn(
        CompletableFuture.completedFuture("{\"furniture_pieces\": []}"));
        analyzer.analyze(REQUEST).join();

        var prompt = ArgumentCaptor.forClass(String.class);
        verify(source).complete(eq(JsonResponseAnalyzer.SYSTEM_PROMPT), prompt.capture());
        assertTrue(prompt.getValue().contains("Event Type: tea-ceremony"));
        assertTrue(prompt.getValue().contains("Guest Count: 4"));
        assertTrue(prompt.getValue().contains("Formality Level: ceremonial"));
        assertTrue(prompt.getValue().contains("Special Requirements: floor seating preferred"));
        assertTrue(prompt.getValue().contains("Preferred Materials: wood-oak, wood-cherry"));
    }

    @Test
    void malformedCompletionFailsTheFuture() {
        when(source.complete(anyString(), anyString())).thenReturn(
        CompletableFuture.completedFuture("Sorry, I cannot help with that."));

        var e = assertThrows(ExecutionException.class, () -> analyzer.analyze(REQUEST).get(5, TimeUnit.SECONDS));
        assertInstanceOf(AnalysisException.class, e.getCause());
    }

    @Test
    void transportFailureFailsTheFuture() {
        when(source.complete(anyString(), anyString())).thenReturn(
        CompletableFuture.failedFuture(new IOException("connection reset")));

        var e = assertThrows(ExecutionException.class, () -> analyzer.analyze(REQUEST).get(5, TimeUnit.SECONDS));
        assertInstanceOf(IOException.class, e.getCause());
    }
}
