package io.github.yok.broombridge.core.operator;

import lombok.Value;

/**
 * スピン軌道（0 始まりの軌道番号・スピン・添字規約）を表すクラスです。
 */
@Value
public class SpinOrbital implements Comparable<SpinOrbital> {

    /**
     * 0 始まりの軌道番号です。
     */
    int orbital;

    /**
     * スピンです。
     */
    Spin spin;

    /**
     * 平坦化に用いる添字規約です。
     */
    IndexConvention indexConvention;

    /**
     * スピン軌道を生成します。
     *
     * @param orbital 0 始まりの軌道番号です（0 以上）
     * @param spin スピンです（null 不可）
     * @param indexConvention 添字規約です（null 不可）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public SpinOrbital(int orbital, Spin spin, IndexConvention indexConvention) {
        if (orbital < 0) {
            throw new IllegalArgumentException("orbital は 0 以上が必要です: " + orbital);
        }
        if (spin == null) {
            throw new IllegalArgumentException("spin は null 不可です");
        }
        if (indexConvention == null) {
            throw new IllegalArgumentException("indexConvention は null 不可です");
        }
        this.orbital = orbital;
        this.spin = spin;
        this.indexConvention = indexConvention;
    }

    /**
     * 平坦化した整数添字を返します。
     *
     * @param nOrbitals 空間軌道数です
     * @return {@code [0, 2 * nOrbitals)} の整数です
     * @throws IllegalArgumentException 軌道番号が軌道数以上の場合に発生します
     */
    public int toInt(int nOrbitals) {
        if (orbital >= nOrbitals) {
            throw new IllegalArgumentException(
                    "orbital が軌道数を超えています: orbital=" + orbital + ", nOrbitals=" + nOrbitals);
        }
        return indexConvention.flatten(orbital, spin, nOrbitals);
    }

    /**
     * 添字規約の順序で比較します。
     *
     * @param other 比較対象です
     * @return 比較結果です
     */
    @Override
    public int compareTo(SpinOrbital other) {
        return indexConvention.order().compare(this, other);
    }
}
