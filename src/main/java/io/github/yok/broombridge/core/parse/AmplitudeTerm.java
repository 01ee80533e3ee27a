package io.github.yok.broombridge.core.parse;

import io.github.yok.broombridge.core.operator.FermionTerm;
import lombok.Value;

/**
 * 重ね合わせの 1 要素（複素振幅とフェルミオン項の組）です。
 *
 * <p>
 * 振幅と項自身の係数は別々の値です。
 * </p>
 */
@Value
public class AmplitudeTerm {

    /**
     * 振幅の実部です。
     */
    double real;

    /**
     * 振幅の虚部です（現状は常に 0.0）。
     */
    double imaginary;

    /**
     * フェルミオン項です。
     */
    FermionTerm term;
}
