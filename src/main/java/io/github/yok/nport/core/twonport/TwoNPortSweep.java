package io.github.yok.nport.core.twonport;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.nport.core.exception.ShapeMismatchException;
import io.github.yok.nport.core.linearalgebra.LinearInterpolation;
import io.github.yok.nport.core.parameter.ParameterType;
import io.github.yok.nport.core.sweep.FrequencyAlignment;
import io.github.yok.nport.core.sweep.Sweep;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import org.ejml.data.ZMatrixRMaj;

/**
 * 周波数ごとの 2n ポートブロック行列の列を表す不変クラスです。
 *
 * <p>
 * ブロック (i, j) ごとに周波数方向の行列列として保持し、補間もブロックごとに行います。
 * </p>
 */
public final class TwoNPortSweep implements Sweep {

    /**
     * 標本周波数（昇順）です。
     */
    private final double[] freqs;

    /**
     * ブロック (i, j) ごとの周波数方向の行列列です。
     */
    private final ZMatrixRMaj[][][] blocks;

    /**
     * パラメータ種別です。
     */
    @Getter
    private final ParameterType type;

    /**
     * 参照インピーダンスです（S/T 以外では null）。
     */
    @Getter
    private final Double referenceImpedance;

    /**
     * 片側のポート数 n です。
     */
    @Getter
    private final int halfPorts;

    /**
     * 2n ポートのスイープを生成します。
     *
     * <p>
     * 各標本の種別・参照インピーダンスは無視し、スイープ全体の指定で統一します。
     * </p>
     *
     * @param freqs 標本周波数です（重複なしの昇順）
     * @param matrices 各周波数のブロック行列です
     * @param type パラメータ種別です
     * @param referenceImpedance 参照インピーダンスです（null 可）
     * @throws ShapeMismatchException 周波数と標本の数が異なる、またはブロックの次元が揃わない場合に発生します
     */
    public TwoNPortSweep(double[] freqs, List<TwoNPortMatrix> matrices, ParameterType type,
            Double referenceImpedance) {
        checkNotNull(freqs, "freqs は null 不可です");
        checkNotNull(matrices, "matrices は null 不可です");
        this.type = checkNotNull(type, "type は null 不可です");
        this.referenceImpedance = type.checkReferenceImpedance(referenceImpedance);

        if (freqs.length != matrices.size()) {
            throw new ShapeMismatchException("周波数の数とブロック行列の数は同じである必要があります: " + freqs.length
                    + " != " + matrices.size());
        }
        this.freqs = freqs.clone();
        FrequencyAlignment.checkStrictlyIncreasing(this.freqs);

        this.halfPorts = matrices.get(0).getHalfPorts();
        this.blocks = new ZMatrixRMaj[2][2][matrices.size()];
        for (int k = 0; k < matrices.size(); k++) {
            TwoNPortMatrix m = checkNotNull(matrices.get(k), "matrices に null が含まれています");
            if (m.getHalfPorts() != halfPorts) {
                throw new ShapeMismatchException(
                        "ブロックの次元が揃っていません: " + halfPorts + " != " + m.getHalfPorts());
            }
            for (int i = 0; i < 2; i++) {
                for (int j = 0; j < 2; j++) {
                    blocks[i][j][k] = m.block(i, j);
                }
            }
        }
    }

    @Override
    public double[] frequencies() {
        return freqs.clone();
    }

    @Override
    public int size() {
        return freqs.length;
    }

    /**
     * k 番目（0 始まり）の標本を返します。
     *
     * @param index 標本インデックスです
     * @return ブロック行列です
     */
    public TwoNPortMatrix sample(int index) {
        checkArgument(index >= 0 && index < freqs.length, "標本インデックスが範囲外です: %s", index);
        ZMatrixRMaj[][] b = new ZMatrixRMaj[][] {{blocks[0][0][index], blocks[0][1][index]},
                {blocks[1][0][index], blocks[1][1][index]}};
        return new TwoNPortMatrix(b, type, referenceImpedance);
    }

    /**
     * 単一周波数における補間ブロック行列を返します。
     *
     * @param f 周波数です
     * @return 補間したブロック行列です
     * @throws io.github.yok.nport.core.exception.OutOfDomainException 標本範囲外の場合に発生します
     */
    public TwoNPortMatrix at(double f) {
        ZMatrixRMaj[][] b = new ZMatrixRMaj[2][2];
        for (int i = 0; i < 2; i++) {
            for (int j = 0; j < 2; j++) {
                b[i][j] = LinearInterpolation.at(freqs, blocks[i][j], f);
            }
        }
        return new TwoNPortMatrix(b, type, referenceImpedance);
    }

    /**
     * 複数周波数における補間スイープを返します。
     *
     * @param queryFreqs 周波数です（重複なしの昇順）
     * @return 補間したスイープです
     */
    public TwoNPortSweep at(double[] queryFreqs) {
        checkNotNull(queryFreqs, "queryFreqs は null 不可です");
        List<TwoNPortMatrix> out = new ArrayList<>(queryFreqs.length);
        for (double f : queryFreqs) {
            out.add(at(f));
        }
        return new TwoNPortSweep(queryFreqs, out, type, referenceImpedance);
    }

    @Override
    public String toString() {
        return "TwoNPortSweep(type=" + type + ", z0=" + referenceImpedance + ", halfPorts="
                + halfPorts + ", samples=" + freqs.length + ")";
    }
}
