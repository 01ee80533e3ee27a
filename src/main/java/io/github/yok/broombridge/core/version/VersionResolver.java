package io.github.yok.broombridge.core.version;

import io.github.yok.broombridge.core.exception.InvalidVersionException;

/**
 * バージョン文字列を {@link SchemaVersion} に変換するクラスです。
 *
 * <p>
 * 大文字小文字や前後の空白も区別する完全一致で判定します。
 * </p>
 */
public final class VersionResolver {

    private VersionResolver() {}

    /**
     * バージョン文字列を解決します。
     *
     * @param version バージョン文字列です
     * @return スキーマバージョンです
     * @throws InvalidVersionException 対応していないバージョンの場合に発生します
     */
    public static SchemaVersion resolve(String version) {
        if (version != null) {
            for (SchemaVersion v : SchemaVersion.values()) {
                if (v.getLabel().equals(version)) {
                    return v;
                }
            }
        }
        throw new InvalidVersionException(version);
    }
}
