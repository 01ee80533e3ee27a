package io.github.yok.broombridge.core.parse;

import io.github.yok.broombridge.core.exception.UnsupportedStateMethodException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Value;

/**
 * 変換済みの初期状態です。
 */
@Value
public class InputState {

    /**
     * ラベル（問題内で一意）です。
     */
    String label;

    /**
     * 初期状態の種類です。
     */
    StateType type;

    /**
     * 重ね合わせです（SINGLE_CONFIGURATIONAL と UNRECOGNIZED では空）。
     */
    List<AmplitudeTerm> superposition;

    /**
     * 初期状態を生成します。
     *
     * @param label ラベルです
     * @param type 種類です（null 不可）
     * @param superposition 重ね合わせです（null 不可）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public InputState(String label, StateType type, List<AmplitudeTerm> superposition) {
        if (type == null) {
            throw new IllegalArgumentException("type は null 不可です");
        }
        if (superposition == null) {
            throw new IllegalArgumentException("superposition は null 不可です");
        }
        this.label = label;
        this.type = type;
        this.superposition = Collections.unmodifiableList(new ArrayList<>(superposition));
    }

    /**
     * 重ね合わせを持つ種類として解釈し、重ね合わせを返します。
     *
     * @return 重ね合わせです
     * @throws UnsupportedStateMethodException 重ね合わせを持たない種類の場合に発生します
     */
    public List<AmplitudeTerm> requireSuperposition() {
        switch (type) {
            case SPARSE_MULTI_CONFIGURATIONAL:
            case UNITARY_COUPLED_CLUSTER:
                return superposition;
            case SINGLE_CONFIGURATIONAL:
            case UNRECOGNIZED:
                throw new UnsupportedStateMethodException(label, type.name());
            default:
                throw new IllegalStateException("未対応の初期状態の種類です: " + type);
        }
    }
}
