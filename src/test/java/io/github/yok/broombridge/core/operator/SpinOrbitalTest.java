package io.github.yok.broombridge.core.operator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class SpinOrbitalTest {

    @Test
    void upDownInterleavesSpins() {
        assertEquals(0, new SpinOrbital(0, Spin.UP, IndexConvention.UP_DOWN).toInt(3));
        assertEquals(1, new SpinOrbital(0, Spin.DOWN, IndexConvention.UP_DOWN).toInt(3));
        assertEquals(4, new SpinOrbital(2, Spin.UP, IndexConvention.UP_DOWN).toInt(3));
    }

    @Test
    void halfUpPutsDownSpinsInTheSecondHalf() {
        assertEquals(2, new SpinOrbital(2, Spin.UP, IndexConvention.HALF_UP).toInt(3));
        assertEquals(3, new SpinOrbital(0, Spin.DOWN, IndexConvention.HALF_UP).toInt(3));
        assertEquals(5, new SpinOrbital(2, Spin.DOWN, IndexConvention.HALF_UP).toInt(3));
    }

    @Test
    void everySpinOrbitalMapsIntoRangeWithoutCollision() {
        int nOrbitals = 5;
        for (IndexConvention convention : IndexConvention.values()) {
            Set<Integer> seen = new HashSet<>();
            for (int orbital = 0; orbital < nOrbitals; orbital++) {
                for (Spin spin : Spin.values()) {
                    int flat = new SpinOrbital(orbital, spin, convention).toInt(nOrbitals);
                    assertTrue(flat >= 0 && flat < 2 * nOrbitals);
                    assertTrue(seen.add(flat));
                }
            }
        }
    }

    @Test
    void orderMatchesFlattenedIndex() {
        int nOrbitals = 4;
        for (IndexConvention convention : IndexConvention.values()) {
            SpinOrbital a = new SpinOrbital(1, Spin.DOWN, convention);
            SpinOrbital b = new SpinOrbital(2, Spin.UP, convention);
            assertEquals(Integer.signum(Integer.compare(a.toInt(nOrbitals), b.toInt(nOrbitals))),
                    Integer.signum(a.compareTo(b)));
        }
    }

    @Test
    void rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class,
                () -> new SpinOrbital(-1, Spin.UP, IndexConvention.UP_DOWN));
        assertThrows(IllegalArgumentException.class,
                () -> new SpinOrbital(3, Spin.UP, IndexConvention.UP_DOWN).toInt(3));
    }
}
