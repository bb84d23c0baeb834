package io.github.yok.nport.core.analysis;

import io.github.yok.nport.core.parameter.ParameterType;
import io.github.yok.nport.core.port.PortSpec;
import io.github.yok.nport.core.sweep.FrequencySweep;
import java.util.List;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * 周波数スイープに一連の処理（ポート再結合 → 移動平均 → 再標本化 → 表現変換 → 受動性判定）を適用するクラスです。
 *
 * <p>
 * 各処理は設定されている場合のみ実行します。
 * </p>
 */
@Getter
@Slf4j
public final class SweepAnalyzer {

    /**
     * ポート再結合の定義です（空の場合は再結合しません）。
     */
    private final List<PortSpec> recombination;

    /**
     * 移動平均の窓幅です（1 の場合は平均化しません）。
     */
    private final int averageWindow;

    /**
     * 再標本化する周波数です（空の場合は再標本化しません）。
     */
    @Getter(AccessLevel.NONE)
    private final double[] resampleFrequencies;

    /**
     * 変換先の種別です（null の場合は変換しません）。
     */
    private final ParameterType targetType;

    /**
     * 変換先の参照インピーダンスです（null 可）。
     */
    private final Double targetImpedance;

    /**
     * 解析処理を生成します。
     *
     * @param recombination ポート再結合の定義です（null 不可、空可）
     * @param averageWindow 移動平均の窓幅です（1 以上）
     * @param resampleFrequencies 再標本化する周波数です（null 不可、空可）
     * @param targetType 変換先の種別です（null 可）
     * @param targetImpedance 変換先の参照インピーダンスです（null 可）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public SweepAnalyzer(List<PortSpec> recombination, int averageWindow,
            double[] resampleFrequencies, ParameterType targetType, Double targetImpedance) {
        if (recombination == null) {
            throw new IllegalArgumentException("recombination は null 不可です");
        }
        if (averageWindow < 1) {
            throw new IllegalArgumentException("averageWindow は 1 以上が必要です: " + averageWindow);
        }
        if (resampleFrequencies == null) {
            throw new IllegalArgumentException("resampleFrequencies は null 不可です");
        }
        if (targetType == null && targetImpedance != null) {
            throw new IllegalArgumentException("targetImpedance を指定する場合は targetType も必要です");
        }
        this.recombination = List.copyOf(recombination);
        this.averageWindow = averageWindow;
        this.resampleFrequencies = resampleFrequencies.clone();
        this.targetType = targetType;
        this.targetImpedance = targetImpedance;
    }

    /**
     * 再標本化する周波数のコピーを返します。
     *
     * @return 再標本化する周波数です（空の場合は再標本化しません）
     */
    public double[] getResampleFrequencies() {
        return resampleFrequencies.clone();
    }

    /**
     * 設定された処理をスイープに適用します。
     *
     * @param input 入力スイープです
     * @return 解析結果です
     * @throws IllegalArgumentException input が null の場合に発生します
     */
    public AnalysisResult analyze(FrequencySweep input) {
        if (input == null) {
            throw new IllegalArgumentException("input は null 不可です");
        }

        log.info("解析を開始します。入力={}", input);
        FrequencySweep sweep = input;

        // 1) ポート再結合（Z 以外は Z に変換して再結合し、元の表現に戻す）
        if (!recombination.isEmpty()) {
            sweep = recombine(sweep);
            log.info("ポートを再結合しました。定義={}、ポート数={}", recombination, sweep.ports());
        }

        // 2) 移動平均
        if (averageWindow > 1) {
            sweep = sweep.average(averageWindow);
            log.info("移動平均を適用しました。窓幅={}", averageWindow);
        }

        // 3) 再標本化
        if (resampleFrequencies.length > 0) {
            sweep = sweep.at(resampleFrequencies);
            log.info("再標本化しました。点数={}", sweep.size());
        }

        // 4) 表現変換
        if (targetType != null) {
            sweep = sweep.convert(targetType, targetImpedance);
            log.info("表現を変換しました。種別={}、参照インピーダンス={}", sweep.getType(),
                    sweep.getReferenceImpedance());
        }

        // 5) 受動性（Z/Y/S のみ判定可能）
        Boolean passive = null;
        if (isPassivityCheckable(sweep.getType())) {
            passive = sweep.isPassive();
            if (!passive) {
                log.warn("受動的でない標本が含まれています。{}", sweep);
            }
        } else {
            log.warn("種別 {} では受動性を判定できないため省略します", sweep.getType());
        }

        return new AnalysisResult(sweep, passive);
    }

    private FrequencySweep recombine(FrequencySweep sweep) {
        if (sweep.getType() == ParameterType.Z) {
            return sweep.recombine(recombination);
        }
        ParameterType originalType = sweep.getType();
        Double originalImpedance = sweep.getReferenceImpedance();
        return sweep.convert(ParameterType.Z).recombine(recombination).convert(originalType,
                originalImpedance);
    }

    private static boolean isPassivityCheckable(ParameterType type) {
        return type == ParameterType.Z || type == ParameterType.Y || type == ParameterType.S;
    }

    /**
     * 解析結果を表すクラスです。
     */
    @Value
    public static class AnalysisResult {

        /**
         * 処理後のスイープです。
         */
        FrequencySweep sweep;

        /**
         * 受動性の判定結果です（判定できない種別の場合は null）。
         */
        Boolean passive;
    }
}
