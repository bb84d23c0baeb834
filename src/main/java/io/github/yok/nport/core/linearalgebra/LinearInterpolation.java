package io.github.yok.nport.core.linearalgebra;

import io.github.yok.nport.core.exception.OutOfDomainException;
import java.util.Arrays;
import org.ejml.data.ZMatrixRMaj;

/**
 * 周波数軸に沿った複素行列列の線形補間を行うユーティリティクラスです。
 *
 * <p>
 * 実部・虚部を要素ごとに独立して補間します。 標本範囲外の問い合わせ（外挿）はサポートしません。
 * </p>
 */
public final class LinearInterpolation {

    private LinearInterpolation() {}

    /**
     * 指定した周波数における補間行列を返します。
     *
     * <p>
     * 標本周波数に一致する場合は、その標本のコピーをそのまま返します。
     * </p>
     *
     * @param freqs 標本周波数です（昇順、重複なし）
     * @param samples 各周波数の行列です（すべて同じ形状）
     * @param f 問い合わせ周波数です
     * @return 補間した行列です
     * @throws OutOfDomainException f が標本範囲外の場合に発生します
     */
    public static ZMatrixRMaj at(double[] freqs, ZMatrixRMaj[] samples, double f) {
        int last = freqs.length - 1;
        if (Double.isNaN(f) || f < freqs[0] || f > freqs[last]) {
            throw new OutOfDomainException("周波数 " + f + " は標本範囲 [" + freqs[0] + ", "
                    + freqs[last] + "] の外側です（外挿はサポートしません）");
        }

        int idx = Arrays.binarySearch(freqs, f);
        if (idx >= 0) {
            return samples[idx].copy();
        }

        // 挿入位置の直前・直後の標本で補間します。
        int upper = -idx - 1;
        int lower = upper - 1;
        double w = (f - freqs[lower]) / (freqs[upper] - freqs[lower]);
        return lerp(samples[lower], samples[upper], w);
    }

    /**
     * 複数の周波数における補間行列を返します。
     *
     * @param freqs 標本周波数です（昇順、重複なし）
     * @param samples 各周波数の行列です
     * @param queries 問い合わせ周波数の配列です
     * @return 問い合わせ順の補間行列です
     * @throws OutOfDomainException いずれかの問い合わせが標本範囲外の場合に発生します
     */
    public static ZMatrixRMaj[] at(double[] freqs, ZMatrixRMaj[] samples, double[] queries) {
        ZMatrixRMaj[] out = new ZMatrixRMaj[queries.length];
        for (int i = 0; i < queries.length; i++) {
            out[i] = at(freqs, samples, queries[i]);
        }
        return out;
    }

    /**
     * {@code (1-w)·a + w·b} を返します。
     *
     * @param a 下側の行列です
     * @param b 上側の行列です
     * @param w 重み（0〜1）です
     * @return 補間行列です
     */
    static ZMatrixRMaj lerp(ZMatrixRMaj a, ZMatrixRMaj b, double w) {
        ZMatrixRMaj out = new ZMatrixRMaj(a.numRows, a.numCols);
        int len = a.getDataLength();
        for (int i = 0; i < len; i++) {
            out.data[i] = a.data[i] + w * (b.data[i] - a.data[i]);
        }
        return out;
    }
}
