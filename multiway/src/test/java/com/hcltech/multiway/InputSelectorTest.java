package com.hcltech.multiway;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hcltech.multiway.MultiwayFixture.s;
import static org.junit.jupiter.api.Assertions.*;

class InputSelectorTest {

    @Nested
    class Parsing {
        @Test
        void trimsAndSkipsBlankTokens() {
            assertEquals(List.of(3, 1, 2), ValueParser.parse(" 3, 1,,2 ,").valueOrThrow());
            assertEquals(List.of(-4, 0), ValueParser.parse("-4,0").valueOrThrow());
        }

        @Test
        void emptyInputIsEmptyList() {
            assertEquals(List.of(), ValueParser.parse("").valueOrThrow());
        }

        @Test
        void reportsEveryBadToken() {
            var errs = ValueParser.parse("3,x,1,2.5").errorsOrThrow();
            assertEquals(2, errs.size(), errs.toString());
            assertTrue(errs.get(0).contains("'x'"), errs.get(0));
            assertTrue(errs.get(1).contains("'2.5'"), errs.get(1));
        }

        @Test
        void nullIsAnError() {
            assertTrue(ValueParser.parse(null).isError());
        }
    }

    @Nested
    class Resolution {
        @Test
        void sizeSelector() {
            var sel = InputSelector.resolve(3, null).valueOrThrow();
            assertEquals(InputSelector.Mode.SIZE, sel.mode());
            assertEquals(List.of(1, 2, 3), sel.values());
            assertEquals(s(1, 2, 3), sel.sortedState());
            assertEquals("n3", sel.descriptor());
        }

        @Test
        void valuesSelector() {
            var sel = InputSelector.resolve(null, "3,1,1,2").valueOrThrow();
            assertEquals(InputSelector.Mode.VALUES, sel.mode());
            assertEquals(s(1, 1, 2, 3), sel.sortedState());
            assertEquals("values_3-1-1-2", sel.descriptor());
            assertEquals(4, sel.size());
        }

        @Test
        void maxInversionsIsThatOfTheDescendingArrangement() {
            assertEquals(3, InputSelector.ofSize(3).valueOrThrow().maxInversions());
            assertEquals(6, InputSelector.ofSize(4).valueOrThrow().maxInversions());
            assertEquals(5, InputSelector.ofValues(List.of(3, 1, 1, 2)).maxInversions());
            assertEquals(0, InputSelector.ofValues(List.of(1, 1)).maxInversions());
            assertEquals(0, InputSelector.ofSize(0).valueOrThrow().maxInversions());
        }

        @Test
        void negativeValuesAreFileNameSafe() {
            assertEquals("values_m5-2", InputSelector.ofValues(List.of(-5, 2)).descriptor());
            assertEquals("values_empty", InputSelector.ofValues(List.of()).descriptor());
        }

        @Test
        void bothOrNeitherIsAnError() {
            assertTrue(InputSelector.resolve(3, "1,2").errorsOrThrow().get(0).contains("not both"));
            assertTrue(InputSelector.resolve(null, null).errorsOrThrow().get(0).contains("required"));
        }

        @Test
        void negativeSizeIsAnError() {
            assertTrue(InputSelector.resolve(-1, null).errorsOrThrow().get(0).contains(">= 0"));
        }

        @Test
        void malformedValuesAreAnError() {
            assertTrue(InputSelector.resolve(null, "1,a").isError());
        }
    }
}
