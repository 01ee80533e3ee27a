package io.github.yok.broombridge.core.exception;

/**
 * 重ね合わせを持たない初期状態に対して重ね合わせを要求した場合の例外です。
 */
public class UnsupportedStateMethodException extends BroombridgeException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param label 初期状態ラベルです
     * @param stateType 初期状態の種類です
     */
    public UnsupportedStateMethodException(String label, String stateType) {
        super("初期状態 '" + label + "' (" + stateType + ") は重ね合わせを持ちません", label);
    }
}
