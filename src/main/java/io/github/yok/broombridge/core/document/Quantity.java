package io.github.yok.broombridge.core.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 単位付きの数値（例: {@code {value: 0.71, units: hartree}}）です。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Quantity {

    private double value;

    private String units;

    /**
     * 数値を返します。
     *
     * @param quantity 単位付き数値です（null 可）
     * @return 数値です（null の場合は 0.0）
     */
    public static double valueOrZero(Quantity quantity) {
        return quantity == null ? 0.0 : quantity.getValue();
    }
}
