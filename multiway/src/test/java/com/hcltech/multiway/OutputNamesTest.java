package com.hcltech.multiway;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutputNamesTest {

    @Test
    void namesComeFromKindAndInput() {
        var n3 = InputSelector.ofSize(3).valueOrThrow();
        var vals = InputSelector.ofValues(List.of(3, 1, 1, 2));
        assertEquals("multiway_n3.graphml", OutputNames.defaultName(GraphKind.MULTIWAY, n3, "graphml"));
        assertEquals("causal_n3.json", OutputNames.defaultName(GraphKind.CAUSAL, n3, ".json"));
        assertEquals("multiway_values_3-1-1-2.png", OutputNames.defaultName(GraphKind.MULTIWAY, vals, "png"));
    }

    @Test
    void graphNameIsTheFileStem() {
        var vals = InputSelector.ofValues("3,-5").valueOrThrow();
        assertEquals("causal_values_3-m5", OutputNames.graphName(GraphKind.CAUSAL, vals));
        assertEquals("causal_values_3-m5.graphml", OutputNames.defaultName(GraphKind.CAUSAL, vals, "graphml"));
    }

    @Test
    void sameInputSameName() {
        var a = InputSelector.ofValues("2,1").valueOrThrow();
        var b = InputSelector.ofValues(" 2 , 1 ").valueOrThrow();
        assertEquals(OutputNames.defaultName(GraphKind.CAUSAL, a, "graphml"),
                OutputNames.defaultName(GraphKind.CAUSAL, b, "graphml"));
    }
}
