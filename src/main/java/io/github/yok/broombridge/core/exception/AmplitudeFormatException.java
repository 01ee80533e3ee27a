package io.github.yok.broombridge.core.exception;

/**
 * 振幅トークンを実数として解釈できない場合の例外です。
 */
public class AmplitudeFormatException extends BroombridgeException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param token 不正な振幅トークンです
     * @param cause 数値変換の失敗です
     */
    public AmplitudeFormatException(String token, NumberFormatException cause) {
        super("振幅を実数として解釈できません: '" + token + "'", token, cause);
    }
}
