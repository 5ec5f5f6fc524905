package com.raditha.fuzzy.backend;

import com.raditha.fuzzy.config.AlignerConfig;
import com.raditha.fuzzy.config.ScoringConfig;
import com.raditha.fuzzy.config.WeightedRatioScales;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScoringBackendsTest {

    private static ScoringConfig withBackend(String backend) {
        return new ScoringConfig(backend, AlignerConfig.defaults(), WeightedRatioScales.defaults());
    }

    @Test
    void testReferenceBackend() {
        ScoringBackend backend = ScoringBackends.create(ScoringConfig.defaults());

        assertInstanceOf(ReferenceScoringBackend.class, backend);
        assertEquals("reference", backend.name());
    }

    @Test
    void testMissingClassFallsBackToReference() {
        ScoringBackend backend = ScoringBackends.create(withBackend("com.example.NoSuchBackend"));

        assertInstanceOf(ReferenceScoringBackend.class, backend);
    }

    @Test
    void testCustomBackendIsInstantiated() {
        ScoringBackend backend = ScoringBackends.create(withBackend(ConstantBackend.class.getName()));

        assertInstanceOf(ConstantBackend.class, backend);
        assertEquals(42, backend.ratio("a", "b"));
        assertEquals("ConstantBackend", backend.name());
    }

    @Test
    void testClassThatIsNotABackendIsRejected() {
        assertThrows(IllegalStateException.class, () -> ScoringBackends.create(withBackend("java.lang.String")));
    }

    @Test
    void testBackendWithoutNoArgConstructorIsRejected() {
        assertThrows(IllegalStateException.class,
                () -> ScoringBackends.create(withBackend(NeedsArgumentsBackend.class.getName())));
    }

    @Test
    void testFailingConstructorIsReported() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> ScoringBackends.create(withBackend(FailingBackend.class.getName())));

        assertInstanceOf(UnsupportedOperationException.class, e.getCause());
    }

    @Test
    void testActiveBindingIsStable() {
        ScoringBackend first = ScoringBackends.active();

        assertSame(first, ScoringBackends.active());
        assertEquals("reference", first.name());
    }

    @Test
    void testReferenceBackendHonoursAlignerConfig() {
        ScoringBackend exhaustive = ScoringBackends.create(ScoringConfig.exhaustive());
        ScoringBackend defaults = ScoringBackends.create(ScoringConfig.defaults());
        String shorter = "x" + "a".repeat(250);
        String longer = "a".repeat(250);

        assertEquals(100, exhaustive.ratio(shorter, longer));
        assertEquals(0, defaults.ratio(shorter, longer));
    }

    public static class ConstantBackend implements ScoringBackend {
        @Override
        public int ratio(String s1, String s2) {
            return 42;
        }

        @Override
        public int partialRatio(String s1, String s2) {
            return 42;
        }

        @Override
        public int tokenSortRatio(String s1, String s2) {
            return 42;
        }

        @Override
        public int partialTokenSortRatio(String s1, String s2) {
            return 42;
        }

        @Override
        public int tokenSetRatio(String s1, String s2) {
            return 42;
        }

        @Override
        public int partialTokenSetRatio(String s1, String s2) {
            return 42;
        }

        @Override
        public int weightedRatio(String s1, String s2) {
            return 42;
        }
    }

    public static class NeedsArgumentsBackend extends ConstantBackend {
        public NeedsArgumentsBackend(int unused) {
        }
    }

    public static class FailingBackend extends ConstantBackend {
        public FailingBackend() {
            throw new UnsupportedOperationException("native library missing");
        }
    }
}
