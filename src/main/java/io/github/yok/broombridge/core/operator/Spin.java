package io.github.yok.broombridge.core.operator;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * スピン（up / down）です。
 */
@Getter
@RequiredArgsConstructor
public enum Spin {

    /**
     * up スピン（トークン上は {@code a}）です。
     */
    UP('a', 0),

    /**
     * down スピン（トークン上は {@code b}）です。
     */
    DOWN('b', 1);

    /**
     * 演算子トークン上の文字です。
     */
    private final char letter;

    /**
     * 添字計算に用いる値（up=0, down=1）です。
     */
    private final int index;

    /**
     * トークン上の文字からスピンを返します。
     *
     * @param letter トークン上の文字です
     * @return スピンです（該当しない場合は null）
     */
    public static Spin fromLetter(char letter) {
        for (Spin s : values()) {
            if (s.letter == letter) {
                return s;
            }
        }
        return null;
    }
}
