package io.github.yok.broombridge.core.parse;

import java.util.Locale;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 初期状態の種類です。
 *
 * <p>
 * {@link #UNRECOGNIZED} はエラーではなく、文書の method が既知のどれにも一致しなかったことを表す正規の値です。
 * </p>
 */
@Getter
@RequiredArgsConstructor
public enum StateType {

    /**
     * 単一配置状態です（重ね合わせは持ちません）。
     */
    SINGLE_CONFIGURATIONAL("single_configurational"),

    /**
     * 疎な多配置状態です。
     */
    SPARSE_MULTI_CONFIGURATIONAL("sparse_multi_configurational"),

    /**
     * ユニタリ結合クラスター状態です。
     */
    UNITARY_COUPLED_CLUSTER("unitary_coupled_cluster"),

    /**
     * 未知の method です（重ね合わせは持ちません）。
     */
    UNRECOGNIZED(null);

    /**
     * 文書上の method 名です（UNRECOGNIZED は null）。
     */
    private final String methodLabel;

    /**
     * method 名（大文字小文字は区別しません）から種類を返します。
     *
     * @param method method 名です（null 可）
     * @return 種類です（一致しない場合は UNRECOGNIZED）
     */
    public static StateType fromMethod(String method) {
        if (method == null) {
            return UNRECOGNIZED;
        }
        String normalized = method.toLowerCase(Locale.ROOT);
        for (StateType t : values()) {
            if (normalized.equals(t.methodLabel)) {
                return t;
            }
        }
        return UNRECOGNIZED;
    }
}
