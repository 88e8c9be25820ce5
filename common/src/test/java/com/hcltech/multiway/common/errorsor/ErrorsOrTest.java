package com.hcltech.multiway.common.errorsor;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ErrorsOrTest {

    @Nested
    class ConstructionAndPredicates {
        @Test
        void liftCreatesValue() {
            ErrorsOr<Integer> eo = ErrorsOr.lift(42);
            assertTrue(eo.isValue());
            assertFalse(eo.isError());
            assertEquals(Optional.of(42), eo.getValue());
            assertTrue(eo.getErrors().isEmpty());
        }

        @Test
        void errorCreatesError() {
            ErrorsOr<String> eo = ErrorsOr.error("boom");
            assertTrue(eo.isError());
            assertEquals(List.of("boom"), eo.getErrors());
            assertEquals(Optional.empty(), eo.getValue());
        }

        @Test
        void errorsFactoryRejectsEmptyList() {
            assertThrows(IllegalArgumentException.class, () -> ErrorsOr.errors(List.of()));
        }

        @Test
        void liftRejectsNull() {
            assertThrows(NullPointerException.class, () -> ErrorsOr.lift(null));
        }

        @Test
        void errorWithExceptionFormatsClassAndMessage() {
            ErrorsOr<String> eo = ErrorsOr.error("Write failed: {0}: {1}", new IOException("disk full"));
            assertEquals(List.of("Write failed: IOException: disk full"), eo.getErrors());
        }
    }

    @Nested
    class Extractors {
        @Test
        void valueOrThrowOnErrorThrows() {
            ErrorsOr<String> eo = ErrorsOr.error("nope");
            IllegalStateException ex = assertThrows(IllegalStateException.class, eo::valueOrThrow);
            assertTrue(ex.getMessage().contains("nope"));
        }

        @Test
        void errorsOrThrowOnValueThrows() {
            ErrorsOr<Integer> eo = ErrorsOr.lift(7);
            IllegalStateException ex = assertThrows(IllegalStateException.class, eo::errorsOrThrow);
            assertTrue(ex.getMessage().contains("7"));
        }

        @Test
        void foldPicksTheMatchingBranch() {
            assertEquals("v=1", ErrorsOr.lift(1).fold(v -> "v=" + v, errs -> "e=" + errs));
            assertEquals("e=[x]", ErrorsOr.<Integer>error("x").fold(v -> "v=" + v, errs -> "e=" + errs));
        }
    }

    @Nested
    class FunctionalHelpers {
        @Test
        void mapAppliesOnValueAndPassesThroughError() {
            assertEquals("n=10", ErrorsOr.lift(10).map(n -> "n=" + n).valueOrThrow());
            assertEquals(List.of("bad"), ErrorsOr.<Integer>error("bad").map(Object::toString).getErrors());
        }

        @Test
        void flatMapShortCircuitsOnError() {
            ErrorsOr<Integer> out = ErrorsOr.<Integer>error("first").flatMap(n -> ErrorsOr.lift(n * 99));
            assertEquals(List.of("first"), out.getErrors());
        }

        @Test
        void ifValueAndIfErrorInvokeConsumersConditionally() {
            var valueSink = new AtomicReference<>("");
            var errorSink = new AtomicReference<List<String>>(List.of());

            ErrorsOr.lift("yay").ifValue(valueSink::set);
            ErrorsOr.<String>error("nay").ifError(errorSink::set);
            ErrorsOr.<String>error("ignored").ifValue(valueSink::set);

            assertEquals("yay", valueSink.get());
            assertEquals(List.of("nay"), errorSink.get());
        }

        @Test
        void addPrefixIfError_prefixesEachError_andNoOpOnValue() {
            ErrorsOr<Object> err = ErrorsOr.errors(List.of("e1", "e2")).addPrefixIfError("ctx: ");
            assertEquals(List.of("ctx: e1", "ctx: e2"), err.getErrors());
            assertEquals(99, ErrorsOr.lift(99).addPrefixIfError("ctx: ").valueOrThrow());
        }

        @Test
        void allCollectsValuesOrEveryError() {
            assertEquals(List.of(1, 2), ErrorsOr.all(List.of(ErrorsOr.lift(1), ErrorsOr.lift(2))).valueOrThrow());
            assertEquals(List.of("a", "b"),
                    ErrorsOr.all(List.<ErrorsOr<Integer>>of(ErrorsOr.error("a"), ErrorsOr.lift(3), ErrorsOr.error("b"))).getErrors());
        }

        @Test
        void tryingCapturesThrownException() {
            assertEquals(5, ErrorsOr.trying("failed {0}", () -> 5).valueOrThrow());
            ErrorsOr<Integer> failed = ErrorsOr.trying("failed {0}: {1}", () -> {
                throw new IOException("no");
            });
            assertEquals(List.of("failed IOException: no"), failed.getErrors());
        }
    }
}
