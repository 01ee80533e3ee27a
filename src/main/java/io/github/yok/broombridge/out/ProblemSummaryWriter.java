package io.github.yok.broombridge.out;

import io.github.yok.broombridge.core.problem.TypedProblem;
import io.github.yok.broombridge.core.version.SchemaVersion;

/**
 * 変換結果を出力する処理のインタフェースです。
 *
 * <p>
 * 1 文書に複数の問題記述があり得るため、出力の命名規約に必要な問題番号を受け取ります。
 * </p>
 */
public interface ProblemSummaryWriter {

    /**
     * 型付けされた問題を出力します。
     *
     * @param problem 型付けされた問題です
     * @param version 文書のスキーマバージョンです
     * @param problemNumber 文書内での問題番号（1 始まり）です
     */
    void write(TypedProblem problem, SchemaVersion version, int problemNumber);
}
