package io.github.yok.broombridge.core.problem;

import io.github.yok.broombridge.core.document.Hamiltonian;
import io.github.yok.broombridge.core.document.IntegralEntry;
import io.github.yok.broombridge.core.document.IntegralTable;
import io.github.yok.broombridge.core.document.ProblemDescription;
import io.github.yok.broombridge.core.document.Quantity;
import io.github.yok.broombridge.core.document.StateSuggestion;
import io.github.yok.broombridge.core.exception.DuplicateLabelException;
import io.github.yok.broombridge.core.exception.OrbitalIndexOutOfRangeException;
import io.github.yok.broombridge.core.integral.OrbitalIntegral;
import io.github.yok.broombridge.core.operator.IndexConvention;
import io.github.yok.broombridge.core.operator.LadderOperator;
import io.github.yok.broombridge.core.parse.AmplitudeTerm;
import io.github.yok.broombridge.core.parse.InitialStateParser;
import io.github.yok.broombridge.core.parse.InputState;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * 文書上の問題記述から {@link TypedProblem} を組み立てるクラスです。
 *
 * <p>
 * 積分の軌道添字は 1 始まりから 0 始まりに変換し、Mulliken 規約の積分として扱います。 1 電子積分は正準形にしてから重複を除き、
 * 2 電子積分は正準形にせずそのまま重複を除きます。
 * </p>
 *
 * <p>
 * 積分の添字と初期状態の演算子はすべて軌道数の範囲内にあることを検査します。 したがって各スピン軌道の整数表現は
 * {@code [0, 2 * 軌道数)} に収まります。
 * </p>
 */
@Slf4j
public final class ProblemExtractor {

    /**
     * 初期状態の変換処理です。
     */
    private final InitialStateParser initialStateParser;

    /**
     * 抽出処理を生成します。
     *
     * @param initialStateParser 初期状態の変換処理です（null 不可）
     * @throws IllegalArgumentException initialStateParser が null の場合に発生します
     */
    public ProblemExtractor(InitialStateParser initialStateParser) {
        if (initialStateParser == null) {
            throw new IllegalArgumentException("initialStateParser は null 不可です");
        }
        this.initialStateParser = initialStateParser;
    }

    /**
     * 問題記述を型付けされた問題に変換します。
     *
     * @param problem 問題記述です（null 不可）
     * @param indexConvention スピン軌道の添字規約です（null 不可）
     * @return 型付けされた問題です
     * @throws DuplicateLabelException 初期状態ラベルが重複した場合に発生します
     * @throws OrbitalIndexOutOfRangeException 軌道添字が軌道数の範囲外の場合に発生します
     * @throws io.github.yok.broombridge.core.exception.BroombridgeException 初期状態の記述が不正な場合に発生します
     */
    public TypedProblem extract(ProblemDescription problem, IndexConvention indexConvention) {
        if (problem == null) {
            throw new IllegalArgumentException("problem は null 不可です");
        }
        if (indexConvention == null) {
            throw new IllegalArgumentException("indexConvention は null 不可です");
        }

        double identityTerm = Quantity.valueOrZero(problem.getCoulombRepulsion())
                + Quantity.valueOrZero(problem.getEnergyOffset());

        Hamiltonian hamiltonian = problem.getHamiltonian();
        IntegralTable oneTable = hamiltonian == null ? null : hamiltonian.getOneElectronIntegrals();
        IntegralTable twoTable = hamiltonian == null ? null : hamiltonian.getTwoElectronIntegrals();

        int nOrbitals = problem.getNOrbitals();

        Set<OrbitalIntegral> oneBodyTerms = new LinkedHashSet<>();
        for (IntegralEntry entry : entriesOf(oneTable)) {
            requireInRange(entry, nOrbitals);
            oneBodyTerms.add(toZeroBasedIntegral(entry).canonicalForm());
        }

        Set<OrbitalIntegral> twoBodyTerms = new LinkedHashSet<>();
        for (IntegralEntry entry : entriesOf(twoTable)) {
            requireInRange(entry, nOrbitals);
            twoBodyTerms.add(toZeroBasedIntegral(entry));
        }

        Map<String, InputState> initialStates = new LinkedHashMap<>();
        List<StateSuggestion> suggestions = problem.getInitialStateSuggestions();
        if (suggestions != null) {
            for (StateSuggestion suggestion : suggestions) {
                if (initialStates.containsKey(suggestion.getLabel())) {
                    throw new DuplicateLabelException(suggestion.getLabel());
                }
                InputState state = initialStateParser.parse(suggestion, indexConvention);
                requireInRange(state, nOrbitals);
                initialStates.put(suggestion.getLabel(), state);
            }
        }

        log.info("問題を抽出しました。軌道数={}、電子数={}、恒等項={}、1電子積分={}、2電子積分={}、初期状態={}、添字規約={}",
                problem.getNOrbitals(), problem.getNElectrons(), identityTerm, oneBodyTerms.size(),
                twoBodyTerms.size(), initialStates.keySet(), indexConvention);

        return new TypedProblem(problem.getNOrbitals(), problem.getNElectrons(), identityTerm,
                Collections.unmodifiableSet(oneBodyTerms),
                Collections.unmodifiableSet(twoBodyTerms),
                Collections.unmodifiableMap(initialStates), indexConvention);
    }

    /**
     * 積分表の行を返します。
     *
     * @param table 積分表です（null 可）
     * @return 行の一覧です（null の場合は空）
     */
    private static List<IntegralEntry> entriesOf(IntegralTable table) {
        return table == null ? new ArrayList<>() : table.entries();
    }

    /**
     * 積分表の行の添字（1 始まり）が軌道数の範囲内にあることを検査します。
     *
     * @param entry 積分表の行です
     * @param nOrbitals 軌道数です
     * @throws OrbitalIndexOutOfRangeException 範囲外の添字がある場合に発生します
     */
    private static void requireInRange(IntegralEntry entry, int nOrbitals) {
        for (int index : entry.getIndices()) {
            if (index < 1 || index > nOrbitals) {
                throw new OrbitalIndexOutOfRangeException(
                        entry.getIndices() + " " + entry.getValue(), nOrbitals);
            }
        }
    }

    /**
     * 初期状態の演算子の軌道が軌道数の範囲内にあることを検査します。
     *
     * @param state 初期状態です
     * @param nOrbitals 軌道数です
     * @throws OrbitalIndexOutOfRangeException 範囲外の演算子がある場合に発生します
     */
    private static void requireInRange(InputState state, int nOrbitals) {
        for (AmplitudeTerm amplitudeTerm : state.getSuperposition()) {
            for (LadderOperator op : amplitudeTerm.getTerm().getOperators()) {
                if (op.getSpinOrbital().getOrbital() >= nOrbitals) {
                    throw new OrbitalIndexOutOfRangeException(op.toPolishNotation(), nOrbitals);
                }
            }
        }
    }

    /**
     * 1 始まりの行を 0 始まりの Mulliken 規約の積分に変換します。
     *
     * @param entry 積分表の行です
     * @return 積分です
     * @throws IllegalArgumentException 添字が 1 未満の場合に発生します
     */
    private static OrbitalIntegral toZeroBasedIntegral(IntegralEntry entry) {
        List<Integer> zeroBased = new ArrayList<>(entry.getIndices().size());
        for (int index : entry.getIndices()) {
            zeroBased.add(index - 1);
        }
        return new OrbitalIntegral(zeroBased, entry.getValue(), OrbitalIntegral.Convention.MULLIKEN);
    }
}
