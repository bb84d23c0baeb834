package io.github.yok.nport.core.sweep;

import io.github.yok.nport.core.exception.ImpedanceMismatchException;
import io.github.yok.nport.core.exception.OutOfDomainException;
import io.github.yok.nport.core.exception.TypeMismatchException;
import java.util.Objects;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;

/**
 * 2 つの周波数スイープを共通の周波数グリッドに揃えるための処理をまとめたクラスです。
 */
@Slf4j
public final class FrequencyAlignment {

    private FrequencyAlignment() {}

    /**
     * 二項演算の両オペランドの種別と参照インピーダンスが一致することを検査します。
     *
     * @param left 左オペランドです
     * @param right 右オペランドです
     * @throws TypeMismatchException 種別が異なる場合に発生します
     * @throws ImpedanceMismatchException 参照インピーダンスが異なる場合に発生します
     */
    public static void checkCompatible(Sweep left, Sweep right) {
        if (left.getType() != right.getType()) {
            throw new TypeMismatchException(
                    "オペランドの種別が異なります: " + left.getType() + " != " + right.getType());
        }
        if (!Objects.equals(left.getReferenceImpedance(), right.getReferenceImpedance())) {
            throw new ImpedanceMismatchException("オペランドの参照インピーダンスが異なります: "
                    + left.getReferenceImpedance() + " != " + right.getReferenceImpedance());
        }
    }

    /**
     * 2 つの標本周波数列の共通グリッドを返します。
     *
     * <p>
     * 両者の和集合（昇順）のうち、重なり区間 {@code [max(始点), min(終点)]} に含まれる周波数を返します。 終点も含みます。
     * </p>
     *
     * @param a 周波数列 a です（昇順）
     * @param b 周波数列 b です（昇順）
     * @return 共通グリッドです
     * @throws OutOfDomainException 周波数範囲が重ならない場合に発生します
     */
    public static double[] commonGrid(double[] a, double[] b) {
        double min = Math.max(a[0], b[0]);
        double max = Math.min(a[a.length - 1], b[b.length - 1]);
        if (min > max) {
            throw new OutOfDomainException(
                    "周波数範囲が重なりません: [" + a[0] + ", " + a[a.length - 1] + "] と [" + b[0]
                            + ", " + b[b.length - 1] + "]");
        }

        TreeSet<Double> union = new TreeSet<>();
        for (double f : a) {
            union.add(f);
        }
        for (double f : b) {
            union.add(f);
        }

        double[] grid = union.subSet(min, true, max, true).stream()
                .mapToDouble(Double::doubleValue).toArray();
        log.debug("共通周波数グリッドを作成しました。範囲=[{}, {}]、点数={}", min, max, grid.length);
        return grid;
    }

    /**
     * 周波数列が有限値かつ狭義単調増加であることを検査します。
     *
     * @param freqs 周波数列です
     * @throws IllegalArgumentException 空、非有限値、または昇順でない場合に発生します
     */
    public static void checkStrictlyIncreasing(double[] freqs) {
        if (freqs == null || freqs.length == 0) {
            throw new IllegalArgumentException("周波数は 1 点以上が必要です");
        }
        for (int i = 0; i < freqs.length; i++) {
            if (!Double.isFinite(freqs[i])) {
                throw new IllegalArgumentException("周波数は有限値が必要です: " + freqs[i]);
            }
            if (i > 0 && freqs[i] <= freqs[i - 1]) {
                throw new IllegalArgumentException("周波数は重複なしの昇順である必要があります: "
                        + freqs[i - 1] + " >= " + freqs[i]);
            }
        }
    }
}
