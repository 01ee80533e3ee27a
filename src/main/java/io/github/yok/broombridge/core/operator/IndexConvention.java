package io.github.yok.broombridge.core.operator;

import java.util.Comparator;

/**
 * スピン軌道 (軌道, スピン) を 1 つの整数に平坦化する規約です。
 *
 * <p>
 * 各規約は平坦化後の整数と同じ順序を与える比較器も提供します。 比較器は軌道数に依存しません。
 * </p>
 */
public enum IndexConvention {

    /**
     * {@code 2 * orbital + spin} で平坦化します（up/down が交互に並ぶ）。
     */
    UP_DOWN {
        @Override
        public int flatten(int orbital, Spin spin, int nOrbitals) {
            return 2 * orbital + spin.getIndex();
        }

        @Override
        Comparator<SpinOrbital> order() {
            return Comparator.comparingInt(SpinOrbital::getOrbital)
                    .thenComparingInt(so -> so.getSpin().getIndex());
        }
    },

    /**
     * {@code orbital + nOrbitals * spin} で平坦化します（前半が up、後半が down）。
     */
    HALF_UP {
        @Override
        public int flatten(int orbital, Spin spin, int nOrbitals) {
            return orbital + nOrbitals * spin.getIndex();
        }

        @Override
        Comparator<SpinOrbital> order() {
            return Comparator.<SpinOrbital>comparingInt(so -> so.getSpin().getIndex())
                    .thenComparingInt(SpinOrbital::getOrbital);
        }
    };

    /**
     * スピン軌道を整数に平坦化します。
     *
     * @param orbital 0 始まりの軌道番号です
     * @param spin スピンです
     * @param nOrbitals 空間軌道数です
     * @return 平坦化した整数です
     */
    public abstract int flatten(int orbital, Spin spin, int nOrbitals);

    /**
     * 平坦化後の整数と同じ順序を与える比較器を返します。
     *
     * @return 比較器です
     */
    abstract Comparator<SpinOrbital> order();
}
