package io.github.yok.nport.core.sweep;

import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.nport.core.exception.ShapeMismatchException;
import io.github.yok.nport.core.linearalgebra.ComplexMatrices;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.Complex_F64;
import org.ejml.data.ZMatrixRMaj;

/**
 * 周波数スイープの要素ごとの四則演算を行うクラスです。
 *
 * <p>
 * スイープ同士の演算では、種別と参照インピーダンスの一致を確認した後、 重なり区間の共通グリッドに両者を補間してから演算します（整列）。 定数との演算では周波数を揃えず、
 * 各標本にそのまま適用します（ブロードキャスト）。
 * </p>
 */
@Slf4j
public final class SweepArithmetic {

    private SweepArithmetic() {}

    /**
     * 2 つのスイープを周波数を揃えて演算します。
     *
     * @param op 演算子です
     * @param left 左オペランドです
     * @param right 右オペランドです
     * @return 共通グリッド上の結果スイープです（種別・参照インピーダンスは左オペランドと同じ）
     * @throws io.github.yok.nport.core.exception.TypeMismatchException 種別が異なる場合に発生します
     * @throws io.github.yok.nport.core.exception.ImpedanceMismatchException 参照インピーダンスが異なる場合に発生します
     * @throws ShapeMismatchException ポート数が異なる場合に発生します
     * @throws io.github.yok.nport.core.exception.OutOfDomainException 周波数範囲が重ならない場合に発生します
     */
    public static FrequencySweep combine(ArithmeticOperator op, FrequencySweep left,
            FrequencySweep right) {
        checkNotNull(op, "op は null 不可です");
        checkNotNull(left, "left は null 不可です");
        checkNotNull(right, "right は null 不可です");
        FrequencyAlignment.checkCompatible(left, right);
        checkSamePorts(left, right);

        double[] grid = FrequencyAlignment.commonGrid(left.frequencies(), right.frequencies());
        ZMatrixRMaj[] a = left.interpolate(grid);
        ZMatrixRMaj[] b = right.interpolate(grid);

        ZMatrixRMaj[] out = new ZMatrixRMaj[grid.length];
        for (int i = 0; i < grid.length; i++) {
            out[i] = op.apply(a[i], b[i]);
        }
        log.debug("スイープ演算 {} を実行しました。点数={}", op, grid.length);
        return FrequencySweep.wrap(grid, out, left.getType(), left.getReferenceImpedance());
    }

    /**
     * スイープの各標本と定数行列を演算します（{@code sweep ∘ constant}）。
     *
     * @param op 演算子です
     * @param left スイープです
     * @param constant n×n の定数行列です
     * @return 結果スイープです（周波数・種別・参照インピーダンスは維持）
     */
    public static FrequencySweep combine(ArithmeticOperator op, FrequencySweep left,
            ZMatrixRMaj constant) {
        return broadcast(op, left, constant, false);
    }

    /**
     * 定数行列とスイープの各標本を演算します（{@code constant ∘ sweep}）。
     *
     * @param op 演算子です
     * @param constant n×n の定数行列です
     * @param right スイープです
     * @return 結果スイープです（周波数・種別・参照インピーダンスは維持）
     */
    public static FrequencySweep combine(ArithmeticOperator op, ZMatrixRMaj constant,
            FrequencySweep right) {
        return broadcast(op, right, constant, true);
    }

    /**
     * スイープの各要素と複素定数を演算します（{@code sweep ∘ c}）。
     *
     * @param op 演算子です
     * @param left スイープです
     * @param constant 複素定数です
     * @return 結果スイープです
     */
    public static FrequencySweep combine(ArithmeticOperator op, FrequencySweep left,
            Complex_F64 constant) {
        checkNotNull(left, "left は null 不可です");
        checkNotNull(constant, "constant は null 不可です");
        return broadcast(op, left, ComplexMatrices.filled(left.ports(), left.ports(), constant),
                false);
    }

    /**
     * 複素定数とスイープの各要素を演算します（{@code c ∘ sweep}）。
     *
     * @param op 演算子です
     * @param constant 複素定数です
     * @param right スイープです
     * @return 結果スイープです
     */
    public static FrequencySweep combine(ArithmeticOperator op, Complex_F64 constant,
            FrequencySweep right) {
        checkNotNull(right, "right は null 不可です");
        checkNotNull(constant, "constant は null 不可です");
        return broadcast(op, right,
                ComplexMatrices.filled(right.ports(), right.ports(), constant), true);
    }

    private static FrequencySweep broadcast(ArithmeticOperator op, FrequencySweep sweep,
            ZMatrixRMaj constant, boolean constantOnLeft) {
        checkNotNull(op, "op は null 不可です");
        checkNotNull(sweep, "sweep は null 不可です");
        checkNotNull(constant, "constant は null 不可です");

        ZMatrixRMaj[] samples = sweep.samplesView();
        ZMatrixRMaj[] out = new ZMatrixRMaj[samples.length];
        for (int i = 0; i < samples.length; i++) {
            out[i] = constantOnLeft ? op.apply(constant, samples[i])
                    : op.apply(samples[i], constant);
        }
        return FrequencySweep.wrap(sweep.frequencies(), out, sweep.getType(),
                sweep.getReferenceImpedance());
    }

    static void checkSamePorts(FrequencySweep left, FrequencySweep right) {
        if (left.ports() != right.ports()) {
            throw new ShapeMismatchException(
                    "オペランドのポート数が異なります: " + left.ports() + " != " + right.ports());
        }
    }
}
