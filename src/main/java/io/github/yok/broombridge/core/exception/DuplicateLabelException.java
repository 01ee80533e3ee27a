package io.github.yok.broombridge.core.exception;

/**
 * 初期状態ラベルの重複を検出した場合の例外です。
 */
public class DuplicateLabelException extends BroombridgeException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param label 重複したラベルです
     */
    public DuplicateLabelException(String label) {
        super("初期状態ラベルが重複しています: '" + label + "'", label);
    }
}
