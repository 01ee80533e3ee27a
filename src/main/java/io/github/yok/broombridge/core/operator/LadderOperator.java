package io.github.yok.broombridge.core.operator;

import lombok.Value;

/**
 * スピン軌道に作用する生成演算子または消滅演算子です。
 */
@Value
public class LadderOperator {

    /**
     * 生成演算子なら true、消滅演算子なら false です。
     */
    boolean creation;

    /**
     * 作用するスピン軌道です。
     */
    SpinOrbital spinOrbital;

    /**
     * 1 始まりの演算子トークン（例: {@code (3b)+}）に書き戻します。
     *
     * @return 演算子トークンです
     */
    public String toPolishNotation() {
        return "(" + (spinOrbital.getOrbital() + 1) + spinOrbital.getSpin().getLetter() + ")"
                + (creation ? "+" : "");
    }

    /**
     * 正規順序における並び順を比較します。
     *
     * <p>
     * 生成演算子が左、消滅演算子が右です。 生成演算子同士はスピン軌道の昇順、消滅演算子同士は降順です。
     * </p>
     *
     * @param a 左側の演算子です
     * @param b 右側の演算子です
     * @return a が b より先なら負、同順なら 0、後なら正です
     */
    static int normalOrder(LadderOperator a, LadderOperator b) {
        if (a.creation != b.creation) {
            return a.creation ? -1 : 1;
        }
        int c = a.spinOrbital.compareTo(b.spinOrbital);
        return a.creation ? c : -c;
    }
}
