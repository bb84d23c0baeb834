package io.github.yok.nport.core.sweep;

import io.github.yok.nport.core.parameter.ParameterType;

/**
 * 周波数ごとの行列標本の列（周波数スイープ）を表すインタフェースです。
 *
 * <p>
 * 通常の n ポート（{@link FrequencySweep}）と 2n ポートのブロック形式
 * （{@link io.github.yok.nport.core.twonport.TwoNPortSweep}）に共通する読み取り専用の情報を提供します。
 * </p>
 */
public interface Sweep {

    /**
     * 標本周波数（昇順）のコピーを返します。
     *
     * @return 標本周波数です
     */
    double[] frequencies();

    /**
     * 標本数を返します。
     *
     * @return 標本数です
     */
    int size();

    /**
     * スイープ全体のパラメータ種別を返します。
     *
     * @return パラメータ種別です
     */
    ParameterType getType();

    /**
     * スイープ全体の参照インピーダンスを返します。
     *
     * @return 参照インピーダンスです（S/T 以外では null）
     */
    Double getReferenceImpedance();
}
