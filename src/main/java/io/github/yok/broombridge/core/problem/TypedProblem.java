package io.github.yok.broombridge.core.problem;

import io.github.yok.broombridge.core.integral.OrbitalIntegral;
import io.github.yok.broombridge.core.operator.IndexConvention;
import io.github.yok.broombridge.core.parse.InputState;
import java.util.Map;
import java.util.Set;
import lombok.Value;

/**
 * 型付けされた電子状態問題です。
 *
 * <p>
 * 軌道添字はすべて 0 始まりです。 コレクションは変更不可で、挿入順を保持します。
 * </p>
 */
@Value
public class TypedProblem {

    /**
     * 空間軌道数です。
     */
    int nOrbitals;

    /**
     * 電子数です。
     */
    int nElectrons;

    /**
     * 恒等項（核間反発 + エネルギーオフセット）です。
     */
    double identityTerm;

    /**
     * 1 電子積分です（正準形で重複を除いたもの）。
     */
    Set<OrbitalIntegral> oneBodyTerms;

    /**
     * 2 電子積分です（正準形にせず、文書上の添字のまま重複を除いたもの）。
     */
    Set<OrbitalIntegral> twoBodyTerms;

    /**
     * ラベルから初期状態への対応です。
     */
    Map<String, InputState> initialStates;

    /**
     * スピン軌道の添字規約です。
     */
    IndexConvention indexConvention;
}
