package io.github.yok.broombridge.core.exception;

/**
 * 軌道添字が軌道数の範囲外にある場合の例外です。
 */
public class OrbitalIndexOutOfRangeException extends BroombridgeException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param rawValue 範囲外の添字を含む元の値（積分表の行や演算子トークン）です
     * @param nOrbitals 軌道数です
     */
    public OrbitalIndexOutOfRangeException(String rawValue, int nOrbitals) {
        super("軌道添字が範囲外です（軌道数=" + nOrbitals + "）: " + rawValue, rawValue);
    }
}
