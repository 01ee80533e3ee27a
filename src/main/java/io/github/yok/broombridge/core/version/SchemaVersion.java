package io.github.yok.broombridge.core.version;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Broombridge 文書のスキーマバージョンです。
 */
@Getter
@RequiredArgsConstructor
public enum SchemaVersion {

    /**
     * バージョン 0.1 です。
     */
    V0_1("0.1"),

    /**
     * バージョン 0.2 です（現行）。
     */
    V0_2("0.2");

    /**
     * 文書中に現れるバージョン文字列です。
     */
    private final String label;
}
