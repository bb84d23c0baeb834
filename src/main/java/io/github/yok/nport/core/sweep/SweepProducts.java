package io.github.yok.nport.core.sweep;

import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.nport.core.exception.ShapeMismatchException;
import io.github.yok.nport.core.linearalgebra.ComplexMatrices;
import io.github.yok.nport.core.twonport.TwoNPortMatrix;
import io.github.yok.nport.core.twonport.TwoNPortSweep;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.ZMatrixRMaj;

/**
 * 周波数スイープの行列積（dot）を行うクラスです。
 *
 * <p>
 * スイープ同士の積では、四則演算と同じく重なり区間の共通グリッド（終点を含む）に両者を補間してから、 周波数ごとに行列積を取ります。 2n ポートのスイープ同士はブロック行列積になります。
 * </p>
 */
@Slf4j
public final class SweepProducts {

    private SweepProducts() {}

    /**
     * 2 つのスイープを周波数を揃えて行列積を取ります。
     *
     * @param left 左オペランドです
     * @param right 右オペランドです
     * @return 共通グリッド上の積のスイープです（種別・参照インピーダンスは左オペランドと同じ）
     * @throws io.github.yok.nport.core.exception.TypeMismatchException 種別が異なる場合に発生します
     * @throws io.github.yok.nport.core.exception.ImpedanceMismatchException 参照インピーダンスが異なる場合に発生します
     * @throws ShapeMismatchException ポート数が異なる場合に発生します
     */
    public static FrequencySweep dot(FrequencySweep left, FrequencySweep right) {
        checkNotNull(left, "left は null 不可です");
        checkNotNull(right, "right は null 不可です");
        FrequencyAlignment.checkCompatible(left, right);
        SweepArithmetic.checkSamePorts(left, right);

        double[] grid = FrequencyAlignment.commonGrid(left.frequencies(), right.frequencies());
        ZMatrixRMaj[] a = left.interpolate(grid);
        ZMatrixRMaj[] b = right.interpolate(grid);

        ZMatrixRMaj[] out = new ZMatrixRMaj[grid.length];
        for (int i = 0; i < grid.length; i++) {
            out[i] = ComplexMatrices.mult(a[i], b[i]);
        }
        log.debug("行列積を実行しました（n ポート）。点数={}", grid.length);
        return FrequencySweep.wrap(grid, out, left.getType(), left.getReferenceImpedance());
    }

    /**
     * スイープの各標本に定数行列を右から掛けます。
     *
     * @param left スイープです
     * @param constant 定数行列です（n×n）
     * @return 積のスイープです（周波数・種別・参照インピーダンスは維持）
     * @throws ShapeMismatchException 定数行列が n×n でない場合に発生します
     */
    public static FrequencySweep dot(FrequencySweep left, ZMatrixRMaj constant) {
        checkNotNull(left, "left は null 不可です");
        checkNotNull(constant, "constant は null 不可です");
        if (constant.numRows != left.ports() || constant.numCols != left.ports()) {
            throw new ShapeMismatchException("定数行列は " + left.ports() + "x" + left.ports()
                    + " である必要があります: " + constant.numRows + "x" + constant.numCols);
        }
        ZMatrixRMaj[] samples = left.samplesView();
        ZMatrixRMaj[] out = new ZMatrixRMaj[samples.length];
        for (int i = 0; i < samples.length; i++) {
            out[i] = ComplexMatrices.mult(samples[i], constant);
        }
        return FrequencySweep.wrap(left.frequencies(), out, left.getType(),
                left.getReferenceImpedance());
    }

    /**
     * 2 つの 2n ポートスイープを周波数を揃えてブロック行列積を取ります。
     *
     * @param left 左オペランドです
     * @param right 右オペランドです
     * @return 共通グリッド上の積のスイープです
     * @see TwoNPortMatrix#multiply(TwoNPortMatrix)
     */
    public static TwoNPortSweep dot(TwoNPortSweep left, TwoNPortSweep right) {
        checkNotNull(left, "left は null 不可です");
        checkNotNull(right, "right は null 不可です");
        FrequencyAlignment.checkCompatible(left, right);

        double[] grid = FrequencyAlignment.commonGrid(left.frequencies(), right.frequencies());
        List<TwoNPortMatrix> out = new ArrayList<>(grid.length);
        for (double f : grid) {
            out.add(left.at(f).multiply(right.at(f)));
        }
        log.debug("行列積を実行しました（2n ポート）。点数={}", grid.length);
        return new TwoNPortSweep(grid, out, left.getType(), left.getReferenceImpedance());
    }

    /**
     * オペランドの実際の型に応じて行列積を振り分けます。
     *
     * @param left 左オペランドです
     * @param right 右オペランドです
     * @return 積のスイープです
     * @throws UnsupportedOperationException n ポートと 2n ポートの組み合わせなど、未実装の組み合わせの場合に発生します
     */
    public static Sweep dot(Sweep left, Sweep right) {
        checkNotNull(left, "left は null 不可です");
        checkNotNull(right, "right は null 不可です");
        if (left instanceof FrequencySweep && right instanceof FrequencySweep) {
            return dot((FrequencySweep) left, (FrequencySweep) right);
        }
        if (left instanceof TwoNPortSweep && right instanceof TwoNPortSweep) {
            return dot((TwoNPortSweep) left, (TwoNPortSweep) right);
        }
        throw new UnsupportedOperationException("この組み合わせの行列積は未実装です: "
                + left.getClass().getSimpleName() + " · " + right.getClass().getSimpleName());
    }
}
