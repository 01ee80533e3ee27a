package io.github.yok.broombridge.core.operator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Value;

/**
 * 生成・消滅演算子の積と係数からなるフェルミオン項です。
 *
 * <p>
 * 演算子列は左から右への積の順序で保持します。 インスタンスは不変です。
 * </p>
 */
@Value
public class FermionTerm {

    /**
     * 演算子列です（変更不可）。
     */
    List<LadderOperator> operators;

    /**
     * 係数です。
     */
    double coefficient;

    /**
     * フェルミオン項を生成します。
     *
     * @param operators 演算子列です（null 不可）
     * @param coefficient 係数です
     * @throws IllegalArgumentException operators が null、または null 要素を含む場合に発生します
     */
    public FermionTerm(List<LadderOperator> operators, double coefficient) {
        if (operators == null) {
            throw new IllegalArgumentException("operators は null 不可です");
        }
        for (LadderOperator op : operators) {
            if (op == null) {
                throw new IllegalArgumentException("operators に null が含まれています");
            }
        }
        this.operators = Collections.unmodifiableList(new ArrayList<>(operators));
        this.coefficient = coefficient;
    }

    /**
     * 係数だけを差し替えた項を返します。
     *
     * @param newCoefficient 新しい係数です
     * @return 新しい項です
     */
    public FermionTerm withCoefficient(double newCoefficient) {
        return new FermionTerm(operators, newCoefficient);
    }

    /**
     * 消滅演算子を含むかどうかを返します。
     *
     * @return 1 つでも消滅演算子を含む場合は true です
     */
    public boolean containsAnnihilation() {
        for (LadderOperator op : operators) {
            if (!op.isCreation()) {
                return true;
            }
        }
        return false;
    }

    /**
     * 反交換関係を用いて正規順序に並べ替えた項の列を返します。
     *
     * <p>
     * 生成演算子をスピン軌道の昇順で左に、消滅演算子を降順で右に集めます。 隣接交換ごとに符号が反転し、
     * {@code a_p a_p†} の交換では縮約項も生じます。 同一演算子が重複する項は 0 として除かれ、 同じ演算子列の項は係数を合算します。
     * </p>
     *
     * @return 正規順序の項の列です（0 個・1 個・複数個のいずれもあり得ます）
     */
    public List<FermionTerm> canonicalOrder() {
        Map<List<LadderOperator>, Double> accumulated = new LinkedHashMap<>();

        Deque<FermionTerm> pending = new ArrayDeque<>();
        pending.push(this);

        while (!pending.isEmpty()) {
            FermionTerm term = pending.pop();
            List<LadderOperator> ops = term.operators;

            int i = firstInversion(ops);
            if (i < 0) {
                if (!hasRepeatedOperator(ops)) {
                    accumulated.merge(ops, term.coefficient, Double::sum);
                }
                continue;
            }

            LadderOperator left = ops.get(i);
            LadderOperator right = ops.get(i + 1);

            List<LadderOperator> swapped = new ArrayList<>(ops);
            swapped.set(i, right);
            swapped.set(i + 1, left);
            pending.push(new FermionTerm(swapped, -term.coefficient));

            // a_p a_p† = 1 - a_p† a_p
            if (!left.isCreation() && right.isCreation()
                    && left.getSpinOrbital().equals(right.getSpinOrbital())) {
                List<LadderOperator> contracted = new ArrayList<>(ops.subList(0, i));
                contracted.addAll(ops.subList(i + 2, ops.size()));
                pending.push(new FermionTerm(contracted, term.coefficient));
            }
        }

        List<FermionTerm> result = new ArrayList<>();
        for (Map.Entry<List<LadderOperator>, Double> e : accumulated.entrySet()) {
            if (e.getValue() != 0.0) {
                result.add(new FermionTerm(e.getKey(), e.getValue()));
            }
        }
        return result;
    }

    /**
     * 正規順序に反する最初の隣接位置を返します。
     *
     * @param ops 演算子列です
     * @return 位置 i（ops[i] と ops[i+1] が逆順）、無ければ -1 です
     */
    private static int firstInversion(List<LadderOperator> ops) {
        for (int i = 0; i + 1 < ops.size(); i++) {
            if (LadderOperator.normalOrder(ops.get(i), ops.get(i + 1)) > 0) {
                return i;
            }
        }
        return -1;
    }

    /**
     * 正規順序の演算子列に同一演算子が隣接しているか（項が 0 になるか）を返します。
     *
     * @param ops 正規順序の演算子列です
     * @return 同一演算子が重複していれば true です
     */
    private static boolean hasRepeatedOperator(List<LadderOperator> ops) {
        for (int i = 0; i + 1 < ops.size(); i++) {
            if (ops.get(i).equals(ops.get(i + 1))) {
                return true;
            }
        }
        return false;
    }
}
