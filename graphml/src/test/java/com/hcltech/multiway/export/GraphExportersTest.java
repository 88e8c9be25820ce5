package com.hcltech.multiway.export;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GraphExportersTest {

    @Test
    void bothFormatsAreRegistered() {
        assertEquals(Set.of("graphml", "json"), GraphExporters.available().keySet());
    }

    @Test
    void lookupIsCaseInsensitive() {
        assertInstanceOf(GraphMlExporter.class, GraphExporters.find("GraphML").orElseThrow());
        assertInstanceOf(JsonGraphExporter.class, GraphExporters.find("json").orElseThrow());
    }

    @Test
    void unknownFormatIsEmpty() {
        assertTrue(GraphExporters.find("dot").isEmpty());
    }
}
