package io.github.yok.broombridge.core.operator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

final class FermionTermTest {

    private static LadderOperator op(boolean creation, int orbital, Spin spin) {
        return new LadderOperator(creation, new SpinOrbital(orbital, spin, IndexConvention.UP_DOWN));
    }

    @Test
    void orderedTermIsItsOwnCanonicalOrder() {
        FermionTerm term = new FermionTerm(
                List.of(op(true, 0, Spin.UP), op(true, 1, Spin.DOWN), op(false, 1, Spin.UP)), 0.3);
        assertEquals(List.of(term), term.canonicalOrder());
    }

    @Test
    void acceptsImmutableOperatorLists() {
        List<LadderOperator> ops = List.of(op(true, 0, Spin.UP), op(false, 0, Spin.DOWN));

        assertEquals(ops, new FermionTerm(ops, 1.0).getOperators());
        assertEquals(ops, new FermionTerm(List.copyOf(ops), 1.0).getOperators());
        assertEquals(List.of(), new FermionTerm(List.of(), 1.0).getOperators());
    }

    @Test
    void rejectsNullOperator() {
        List<LadderOperator> ops = new ArrayList<>(Arrays.asList(op(true, 0, Spin.UP), null));

        assertThrows(IllegalArgumentException.class, () -> new FermionTerm(ops, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new FermionTerm(null, 1.0));
    }

    @Test
    void creationOperatorsSwapWithSignFlip() {
        FermionTerm term = new FermionTerm(List.of(op(true, 1, Spin.UP), op(true, 0, Spin.UP)), 2.0);

        List<FermionTerm> canonical = term.canonicalOrder();

        assertEquals(1, canonical.size());
        assertEquals(List.of(op(true, 0, Spin.UP), op(true, 1, Spin.UP)),
                canonical.get(0).getOperators());
        assertEquals(-2.0, canonical.get(0).getCoefficient());
    }

    @Test
    void annihilationOperatorsAreOrderedDescending() {
        FermionTerm term =
                new FermionTerm(List.of(op(false, 0, Spin.UP), op(false, 1, Spin.UP)), 1.0);

        List<FermionTerm> canonical = term.canonicalOrder();

        assertEquals(1, canonical.size());
        assertEquals(List.of(op(false, 1, Spin.UP), op(false, 0, Spin.UP)),
                canonical.get(0).getOperators());
        assertEquals(-1.0, canonical.get(0).getCoefficient());
    }

    @Test
    void repeatedOperatorVanishes() {
        FermionTerm term = new FermionTerm(
                List.of(op(true, 2, Spin.UP), op(true, 0, Spin.UP), op(true, 2, Spin.UP)), 1.0);
        assertTrue(term.canonicalOrder().isEmpty());
    }

    @Test
    void annihilationBeforeCreationOnSameOrbitalContracts() {
        FermionTerm term =
                new FermionTerm(List.of(op(false, 0, Spin.DOWN), op(true, 0, Spin.DOWN)), 0.5);

        List<FermionTerm> canonical = term.canonicalOrder();

        assertEquals(2, canonical.size());
        assertEquals(new FermionTerm(List.of(), 0.5), canonical.get(0));
        assertEquals(new FermionTerm(List.of(op(true, 0, Spin.DOWN), op(false, 0, Spin.DOWN)), -0.5),
                canonical.get(1));
    }

    @Test
    void annihilationBeforeCreationOnDifferentOrbitalsOnlyFlipsSign() {
        FermionTerm term =
                new FermionTerm(List.of(op(false, 0, Spin.UP), op(true, 1, Spin.UP)), 1.0);

        List<FermionTerm> canonical = term.canonicalOrder();

        assertEquals(List.of(new FermionTerm(List.of(op(true, 1, Spin.UP), op(false, 0, Spin.UP)),
                -1.0)), canonical);
    }

    @Test
    void canonicalOrderIsIdempotent() {
        FermionTerm term = new FermionTerm(List.of(op(false, 1, Spin.UP), op(true, 1, Spin.UP),
                op(false, 0, Spin.DOWN), op(true, 2, Spin.UP)), 0.7);

        for (FermionTerm t : term.canonicalOrder()) {
            assertEquals(List.of(t), t.canonicalOrder());
        }
    }

    @Test
    void containsAnnihilation() {
        assertFalse(new FermionTerm(List.of(op(true, 0, Spin.UP)), 1.0).containsAnnihilation());
        assertTrue(new FermionTerm(List.of(op(true, 0, Spin.UP), op(false, 0, Spin.UP)), 1.0)
                .containsAnnihilation());
    }

    @Test
    void withCoefficientKeepsOperators() {
        FermionTerm term = new FermionTerm(List.of(op(true, 0, Spin.UP)), 3.0);
        FermionTerm copy = term.withCoefficient(1.0);
        assertEquals(term.getOperators(), copy.getOperators());
        assertEquals(1.0, copy.getCoefficient());
        assertEquals(3.0, term.getCoefficient());
    }
}
