package io.github.yok.broombridge.core.integral;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import lombok.Value;

/**
 * 0 始まりの軌道添字列と係数からなる軌道積分（1 電子または 2 電子）です。
 *
 * <p>
 * 等価性は (添字列, 係数, 規約) による構造的な比較です。 対称性で同一視される積分を 1 つにまとめる場合は
 * {@link #canonicalForm()} を経由します。
 * </p>
 */
@Value
public class OrbitalIntegral {

    /**
     * 2 電子積分の添字の並び規約です。
     */
    public enum Convention {

        /**
         * Mulliken 規約 (ij|kl) です。
         */
        MULLIKEN(new int[][] {{0, 1, 2, 3}, {1, 0, 2, 3}, {0, 1, 3, 2}, {1, 0, 3, 2},
                {2, 3, 0, 1}, {3, 2, 0, 1}, {2, 3, 1, 0}, {3, 2, 1, 0}}),

        /**
         * Dirac 規約 &lt;ij|kl&gt; です。
         */
        DIRAC(new int[][] {{0, 1, 2, 3}, {1, 0, 3, 2}, {2, 3, 0, 1}, {3, 2, 1, 0},
                {2, 1, 0, 3}, {3, 0, 1, 2}, {0, 3, 2, 1}, {1, 2, 3, 0}});

        /**
         * 実軌道の 2 電子積分を不変に保つ添字の置換です。
         */
        private final int[][] twoBodySymmetries;

        Convention(int[][] twoBodySymmetries) {
            this.twoBodySymmetries = twoBodySymmetries;
        }
    }

    /**
     * 1 電子積分の添字の置換です。
     */
    private static final int[][] ONE_BODY_SYMMETRIES = {{0, 1}, {1, 0}};

    /**
     * 0 始まりの軌道添字列です（変更不可）。
     */
    List<Integer> orbitalIndices;

    /**
     * 積分値です。
     */
    double coefficient;

    /**
     * 添字の並び規約です。
     */
    Convention convention;

    /**
     * 軌道積分を生成します。
     *
     * @param orbitalIndices 0 始まりの軌道添字列です（長さ 2 または 4）
     * @param coefficient 積分値です
     * @param convention 添字の並び規約です（null 不可）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public OrbitalIntegral(List<Integer> orbitalIndices, double coefficient,
            Convention convention) {
        if (orbitalIndices == null) {
            throw new IllegalArgumentException("orbitalIndices は null 不可です");
        }
        if (orbitalIndices.size() != 2 && orbitalIndices.size() != 4) {
            throw new IllegalArgumentException(
                    "orbitalIndices の長さは 2 または 4 が必要です: " + orbitalIndices);
        }
        for (Integer index : orbitalIndices) {
            if (index == null || index < 0) {
                throw new IllegalArgumentException("orbitalIndices は 0 以上が必要です: " + orbitalIndices);
            }
        }
        if (convention == null) {
            throw new IllegalArgumentException("convention は null 不可です");
        }
        this.orbitalIndices = Collections.unmodifiableList(new ArrayList<>(orbitalIndices));
        this.coefficient = coefficient;
        this.convention = convention;
    }

    /**
     * 対称性で同一視される添字列のうち、辞書順で最小のものを持つ積分を返します。
     *
     * @return 正準形の積分です
     */
    public OrbitalIntegral canonicalForm() {
        int[][] symmetries =
                orbitalIndices.size() == 2 ? ONE_BODY_SYMMETRIES : convention.twoBodySymmetries;

        int[] best = null;
        for (int[] permutation : symmetries) {
            int[] candidate = new int[permutation.length];
            for (int i = 0; i < permutation.length; i++) {
                candidate[i] = orbitalIndices.get(permutation[i]);
            }
            if (best == null || Arrays.compare(candidate, best) < 0) {
                best = candidate;
            }
        }

        List<Integer> indices = new ArrayList<>(best.length);
        for (int index : best) {
            indices.add(index);
        }
        return new OrbitalIntegral(indices, coefficient, convention);
    }
}
