package com.anorby.matching.matcher;

import com.anorby.matching.model.Marriage;

/**
 * 局所探索 1 回分の結果と診断値。weight はシャドウを含まない実ユーザーペアの重み合計。
 *
 * @param converged 最後のパスで改善スワップが 1 つも無かったか (false ならパス上限で打ち切り)
 */
public record LocalSearchOutcome(
    Marriage marriage,
    double initialWeight,
    double finalWeight,
    int passes,
    int swaps,
    boolean converged) {}
