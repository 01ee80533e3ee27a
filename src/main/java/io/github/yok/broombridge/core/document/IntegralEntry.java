package io.github.yok.broombridge.core.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Value;

/**
 * 積分表の 1 行（1 始まりの添字列と値）です。
 */
@Value
public class IntegralEntry {

    /**
     * 1 始まりの軌道添字列です。
     */
    List<Integer> indices;

    /**
     * 積分値です。
     */
    double value;

    /**
     * 積分表の 1 行（{@code [i, j, ..., value]}）から生成します。
     *
     * @param row 行です（末尾が値、それ以外が添字）
     * @return 積分表の行です
     * @throws IllegalArgumentException 行が短い、添字が整数でない、または添字が 1 以上の int に収まらない場合に発生します
     */
    public static IntegralEntry fromRow(List<Double> row) {
        if (row == null || row.size() < 2) {
            throw new IllegalArgumentException("積分表の行には添字と値が必要です: " + row);
        }
        List<Integer> indices = new ArrayList<>(row.size() - 1);
        for (int i = 0; i < row.size() - 1; i++) {
            Double raw = row.get(i);
            if (raw == null || raw != Math.rint(raw)) {
                throw new IllegalArgumentException("積分表の添字が整数ではありません: " + row);
            }
            if (raw < 1 || raw > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("積分表の添字が範囲外です: " + row);
            }
            indices.add(raw.intValue());
        }
        Double value = row.get(row.size() - 1);
        if (value == null) {
            throw new IllegalArgumentException("積分表の値が null です: " + row);
        }
        return new IntegralEntry(Collections.unmodifiableList(indices), value);
    }
}
