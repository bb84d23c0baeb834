package io.github.yok.nport.core.sweep;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.nport.core.exception.ShapeMismatchException;
import io.github.yok.nport.core.exception.UnsupportedConversionException;
import io.github.yok.nport.core.linearalgebra.ComplexMatrices;
import io.github.yok.nport.core.linearalgebra.LinearInterpolation;
import io.github.yok.nport.core.parameter.ParameterType;
import io.github.yok.nport.core.port.PortMatrix;
import io.github.yok.nport.core.port.PortSpec;
import io.github.yok.nport.core.twonport.TwoNPortMatrix;
import io.github.yok.nport.core.twonport.TwoNPortSweep;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;
import lombok.Getter;
import org.ejml.data.Complex_F64;
import org.ejml.data.ZMatrixRMaj;

/**
 * 周波数ごとの n ポート行列の列を表す不変クラスです。
 *
 * <p>
 * すべての標本は同じパラメータ種別・参照インピーダンス・ポート数を持ち、 周波数は重複なしの昇順です。 種別と参照インピーダンスはスイープ全体で 1 つだけ保持します。
 * </p>
 *
 * <p>
 * 単一周波数の操作（変換・再正規化・再結合など）は、 各標本を {@link PortMatrix} として取り出して適用します。
 * </p>
 */
public final class FrequencySweep implements Sweep {

    /**
     * 標本周波数（昇順）です。
     */
    private final double[] freqs;

    /**
     * 各周波数の行列（n×n）です。
     */
    private final ZMatrixRMaj[] samples;

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
     * 周波数スイープを生成します。
     *
     * @param freqs 標本周波数です（重複なしの昇順）
     * @param matrices 各周波数の行列です（同じポート数の正方行列、コピーして保持します）
     * @param type パラメータ種別です
     * @param referenceImpedance 参照インピーダンスです（S/T で null の場合は 50.0）
     * @throws ShapeMismatchException 周波数と行列の数が異なる、または行列が正方でない・ポート数が揃わない場合に発生します
     * @throws IllegalArgumentException 周波数が空、または昇順でない場合に発生します
     */
    public FrequencySweep(double[] freqs, ZMatrixRMaj[] matrices, ParameterType type,
            Double referenceImpedance) {
        this(copyOf(freqs), copyOf(matrices), type, referenceImpedance, true);
    }

    /**
     * 検証のみ行い、配列をそのまま保持します。
     */
    private FrequencySweep(double[] freqs, ZMatrixRMaj[] matrices, ParameterType type,
            Double referenceImpedance, boolean validate) {
        this.type = checkNotNull(type, "type は null 不可です");
        this.referenceImpedance = type.checkReferenceImpedance(referenceImpedance);
        if (validate) {
            if (freqs.length != matrices.length) {
                throw new ShapeMismatchException("周波数の数と行列の数は同じである必要があります: " + freqs.length
                        + " != " + matrices.length);
            }
            FrequencyAlignment.checkStrictlyIncreasing(freqs);
            int ports = matrices[0].numRows;
            for (ZMatrixRMaj m : matrices) {
                ComplexMatrices.checkSquare(m, "標本行列");
                if (m.numRows != ports) {
                    throw new ShapeMismatchException(
                            "標本行列のポート数が揃っていません: " + ports + " != " + m.numRows);
                }
            }
        }
        this.freqs = freqs;
        this.samples = matrices;
    }

    /**
     * {@link PortMatrix} の列から周波数スイープを生成します。
     *
     * <p>
     * 各行列の種別・参照インピーダンスが指定と異なる場合は、指定の表現に変換してから格納します。
     * </p>
     *
     * @param freqs 標本周波数です
     * @param matrices 各周波数の行列です
     * @param type スイープの種別です
     * @param referenceImpedance スイープの参照インピーダンスです（null 可）
     * @return 周波数スイープです
     */
    public static FrequencySweep of(double[] freqs, List<PortMatrix> matrices, ParameterType type,
            Double referenceImpedance) {
        checkNotNull(matrices, "matrices は null 不可です");
        Double z0 = checkNotNull(type, "type は null 不可です").checkReferenceImpedance(referenceImpedance);
        ZMatrixRMaj[] raw = new ZMatrixRMaj[matrices.size()];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = toFormat(matrices.get(i), type, z0).toMatrix();
        }
        return new FrequencySweep(copyOf(freqs), raw, type, z0, true);
    }

    /**
     * 検証済みの配列から生成します（コピーしません）。
     */
    static FrequencySweep wrap(double[] freqs, ZMatrixRMaj[] matrices, ParameterType type,
            Double referenceImpedance) {
        return new FrequencySweep(freqs, matrices, type, referenceImpedance, false);
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
     * ポート数を返します。
     *
     * @return ポート数です
     */
    public int ports() {
        return samples[0].numRows;
    }

    /**
     * i 番目（0 始まり）の標本を {@link PortMatrix} として返します。
     *
     * @param index 標本インデックスです
     * @return 標本行列です
     */
    public PortMatrix sample(int index) {
        checkArgument(index >= 0 && index < samples.length, "標本インデックスが範囲外です: %s", index);
        return new PortMatrix(samples[index], type, referenceImpedance);
    }

    /**
     * ポート番号（1 始まり）で指定したパラメータの周波数特性を返します。
     *
     * @param port1 行側のポート番号です
     * @param port2 列側のポート番号です
     * @return 各周波数のパラメータ値です
     * @throws io.github.yok.nport.core.exception.PortIndexException ポート番号が範囲外の場合に発生します
     */
    public Complex_F64[] parameter(int port1, int port2) {
        Complex_F64[] values = new Complex_F64[samples.length];
        for (int i = 0; i < samples.length; i++) {
            values[i] = sample(i).parameter(port1, port2);
        }
        return values;
    }

    /**
     * 指定した要素のみからなる 1×1 のスイープを返します。
     *
     * @param port1 行側のポート番号（1 始まり）です
     * @param port2 列側のポート番号（1 始まり）です
     * @return 1×1 の周波数スイープです（種別・参照インピーダンスは維持）
     */
    public FrequencySweep element(int port1, int port2) {
        Complex_F64[] values = parameter(port1, port2);
        ZMatrixRMaj[] out = new ZMatrixRMaj[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = ComplexMatrices.filled(1, 1, values[i]);
        }
        return wrap(freqs.clone(), out, type, referenceImpedance);
    }

    /**
     * 単一周波数における補間行列を返します。
     *
     * @param f 周波数です
     * @return 補間した行列です
     * @throws io.github.yok.nport.core.exception.OutOfDomainException 標本範囲外の場合に発生します
     */
    public PortMatrix at(double f) {
        return new PortMatrix(LinearInterpolation.at(freqs, samples, f), type, referenceImpedance);
    }

    /**
     * 複数周波数における補間スイープを返します。
     *
     * @param queryFreqs 周波数です（重複なしの昇順）
     * @return 補間したスイープです
     * @throws io.github.yok.nport.core.exception.OutOfDomainException 標本範囲外の周波数を含む場合に発生します
     */
    public FrequencySweep at(double[] queryFreqs) {
        double[] q = copyOf(queryFreqs);
        FrequencyAlignment.checkStrictlyIncreasing(q);
        return wrap(q, interpolate(q), type, referenceImpedance);
    }

    /**
     * 指定した周波数グリッド上の補間行列列を返します。
     */
    ZMatrixRMaj[] interpolate(double[] grid) {
        return LinearInterpolation.at(freqs, samples, grid);
    }

    /**
     * n 点の移動平均を取ったスイープを返します。
     *
     * <p>
     * 標本 i に対して {@code i−⌊n/2⌋ .. i+⌈n/2⌉−1} の平均を取り、 範囲外のインデックスは端の標本で置き換えます。
     * </p>
     *
     * @param n 窓幅です（1 以上）
     * @return 平均化したスイープです
     */
    public FrequencySweep average(int n) {
        checkArgument(n >= 1, "移動平均の窓幅は 1 以上が必要です: %s", n);
        int len = samples.length;
        long from = -(n / 2);
        long to = n / 2 + n % 2;

        ZMatrixRMaj[] averaged = new ZMatrixRMaj[len];
        for (int i = 0; i < len; i++) {
            // 窓 [start, end] のうち範囲外の分は端の標本の個数として数えます
            long start = i + from;
            long end = i + to - 1;
            long below = Math.max(0L, Math.min(end, -1L) - start + 1);
            long above = Math.max(0L, end - Math.max(start, len) + 1);

            ZMatrixRMaj acc = new ZMatrixRMaj(ports(), ports());
            if (below > 0) {
                acc = ComplexMatrices.add(acc, ComplexMatrices.scale(samples[0], below));
            }
            if (above > 0) {
                acc = ComplexMatrices.add(acc, ComplexMatrices.scale(samples[len - 1], above));
            }
            for (long k = Math.max(start, 0L); k <= Math.min(end, len - 1L); k++) {
                acc = ComplexMatrices.add(acc, samples[(int) k]);
            }
            averaged[i] = ComplexMatrices.scale(acc, 1.0 / n);
        }
        return wrap(freqs.clone(), averaged, type, referenceImpedance);
    }

    /**
     * 周波数標本を追加したスイープを返します。
     *
     * <p>
     * 行列の種別・参照インピーダンスがこのスイープと異なる場合は、このスイープの表現に変換してから追加します。
     * </p>
     *
     * @param f 追加する周波数です
     * @param matrix 追加する行列です
     * @return 標本を追加したスイープです
     */
    public FrequencySweep add(double f, PortMatrix matrix) {
        checkNotNull(matrix, "matrix は null 不可です");
        return add(f, toFormat(matrix, type, referenceImpedance).toMatrix());
    }

    /**
     * 周波数標本を追加したスイープを返します（行列はこのスイープの表現とみなします）。
     *
     * @param f 追加する周波数です
     * @param matrix 追加する行列です
     * @return 標本を追加したスイープです
     * @throws IllegalArgumentException 同じ周波数の標本が既に存在する場合に発生します
     */
    public FrequencySweep add(double f, ZMatrixRMaj matrix) {
        checkNotNull(matrix, "matrix は null 不可です");
        int idx = Arrays.binarySearch(freqs, f);
        checkArgument(idx < 0, "周波数 %s の標本は既に存在します", f);
        int insert = -idx - 1;

        double[] newFreqs = new double[freqs.length + 1];
        ZMatrixRMaj[] newSamples = new ZMatrixRMaj[samples.length + 1];
        System.arraycopy(freqs, 0, newFreqs, 0, insert);
        System.arraycopy(samples, 0, newSamples, 0, insert);
        newFreqs[insert] = f;
        newSamples[insert] = matrix.copy();
        System.arraycopy(freqs, insert, newFreqs, insert + 1, freqs.length - insert);
        System.arraycopy(samples, insert, newSamples, insert + 1, samples.length - insert);
        return new FrequencySweep(newFreqs, newSamples, type, referenceImpedance, true);
    }

    /**
     * 各標本を別の表現に変換します。
     *
     * @param target 変換先の種別です（Z, Y, S）
     * @return 変換後のスイープです
     */
    public FrequencySweep convert(ParameterType target) {
        return convert(target, null);
    }

    /**
     * 各標本を別の表現に変換します。
     *
     * @param target 変換先の種別です（Z, Y, S）
     * @param targetImpedance 変換先の参照インピーダンスです（S のみ指定可、null 可）
     * @return 変換後のスイープです
     * @see PortMatrix#convert(ParameterType, Double)
     */
    public FrequencySweep convert(ParameterType target, Double targetImpedance) {
        PortMatrix.checkConvertible(type, target);
        Double z0 = target.resolveTargetImpedance(type, referenceImpedance, targetImpedance);
        return mapSamples(m -> m.convert(target, z0), target, z0);
    }

    /**
     * S パラメータを別の参照インピーダンスに再正規化します。
     *
     * @param newImpedance 新しい参照インピーダンスです
     * @return 再正規化したスイープです（同じ参照インピーダンスならこのインスタンス）
     * @throws UnsupportedConversionException S 以外のスイープで呼び出した場合に発生します
     */
    public FrequencySweep renormalize(double newImpedance) {
        requireType(ParameterType.S, "再正規化");
        if (newImpedance == referenceImpedance) {
            return this;
        }
        return mapSamples(m -> m.renormalize(newImpedance), ParameterType.S, newImpedance);
    }

    /**
     * 各標本のポートを再結合します（Z スイープのみ）。
     *
     * @param portSpecs 新ポートの定義列です
     * @return 再結合後のスイープです
     * @throws UnsupportedConversionException Z 以外のスイープで呼び出した場合に発生します
     * @see PortMatrix#recombine(List)
     */
    public FrequencySweep recombine(List<PortSpec> portSpecs) {
        requireType(ParameterType.Z, "ポート再結合");
        return mapSamples(m -> m.recombine(portSpecs), type, referenceImpedance);
    }

    /**
     * 指定したポートのパラメータのみを残したスイープを返します。
     *
     * @param keepPorts 残すポート番号（1 始まり）です
     * @return 部分スイープです
     */
    public FrequencySweep submatrix(int... keepPorts) {
        return mapSamples(m -> m.submatrix(keepPorts), type, referenceImpedance);
    }

    /**
     * 各標本の逆行列からなるスイープを返します。
     *
     * <p>
     * 結果の種別は再計算せず、このスイープの種別・参照インピーダンスをそのまま引き継ぎます。 必要に応じて {@link #retag(ParameterType, Double)}
     * で付け替えてください。
     * </p>
     *
     * @return 逆行列のスイープです
     * @throws io.github.yok.nport.core.exception.SingularMatrixException いずれかの標本が特異な場合に発生します
     */
    public FrequencySweep invert() {
        ZMatrixRMaj[] inverted = new ZMatrixRMaj[samples.length];
        for (int i = 0; i < samples.length; i++) {
            inverted[i] = ComplexMatrices.invert(samples[i]);
        }
        return wrap(freqs.clone(), inverted, type, referenceImpedance);
    }

    /**
     * 行列の値はそのままに、種別と参照インピーダンスを付け替えたスイープを返します。
     *
     * @param newType 新しい種別です
     * @param newImpedance 新しい参照インピーダンスです（null 可）
     * @return 付け替えたスイープです
     */
    public FrequencySweep retag(ParameterType newType, Double newImpedance) {
        return wrap(freqs.clone(), copyOf(samples), newType, newImpedance);
    }

    /**
     * 既定の分割（先頭 n ポートが入力）で 2n ポートのスイープに変換します。
     *
     * @return 2n ポートのスイープです
     */
    public TwoNPortSweep twoNPort() {
        return twoNPort(null, null);
    }

    /**
     * 入力ポート群と出力ポート群を指定して 2n ポートのスイープに変換します。
     *
     * @param inPorts 入力ポート番号（1 始まり）です
     * @param outPorts 出力ポート番号（1 始まり）です
     * @return 2n ポートのスイープです
     * @see PortMatrix#twoNPortMatrix(int[], int[])
     */
    public TwoNPortSweep twoNPort(int[] inPorts, int[] outPorts) {
        List<TwoNPortMatrix> blocks = new ArrayList<>(samples.length);
        for (int i = 0; i < samples.length; i++) {
            blocks.add(sample(i).twoNPortMatrix(inPorts, outPorts));
        }
        return new TwoNPortSweep(freqs, blocks, type, referenceImpedance);
    }

    /**
     * すべての標本が受動的かどうかを返します。
     *
     * @return すべて受動的であれば true です
     */
    public boolean isPassive() {
        for (int i = 0; i < samples.length; i++) {
            if (!sample(i).isPassive()) {
                return false;
            }
        }
        return true;
    }

    /**
     * 周波数を揃えて要素ごとに加算します。
     *
     * @param other 右オペランドです
     * @return 和のスイープです
     * @see SweepArithmetic#combine(ArithmeticOperator, FrequencySweep, FrequencySweep)
     */
    public FrequencySweep plus(FrequencySweep other) {
        return SweepArithmetic.combine(ArithmeticOperator.ADD, this, other);
    }

    /**
     * 周波数を揃えて要素ごとに減算します。
     *
     * @param other 右オペランドです
     * @return 差のスイープです
     */
    public FrequencySweep minus(FrequencySweep other) {
        return SweepArithmetic.combine(ArithmeticOperator.SUBTRACT, this, other);
    }

    /**
     * 周波数を揃えて要素ごとに乗算します。
     *
     * @param other 右オペランドです
     * @return 積のスイープです
     */
    public FrequencySweep times(FrequencySweep other) {
        return SweepArithmetic.combine(ArithmeticOperator.MULTIPLY, this, other);
    }

    /**
     * 周波数を揃えて要素ごとに除算します。
     *
     * @param other 右オペランドです
     * @return 商のスイープです
     */
    public FrequencySweep dividedBy(FrequencySweep other) {
        return SweepArithmetic.combine(ArithmeticOperator.DIVIDE, this, other);
    }

    /**
     * 周波数・種別・参照インピーダンスが同じで、各標本が許容誤差内で一致するかどうかを返します。
     *
     * @param other 比較対象です
     * @param tolerance 許容誤差です
     * @return 一致すれば true です
     */
    public boolean approximatelyEquals(FrequencySweep other, double tolerance) {
        if (other == null || type != other.type
                || !Objects.equals(referenceImpedance, other.referenceImpedance)
                || !Arrays.equals(freqs, other.freqs)) {
            return false;
        }
        for (int i = 0; i < samples.length; i++) {
            if (!ComplexMatrices.approximatelyEquals(samples[i], other.samples[i], tolerance)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "FrequencySweep(type=" + type + ", z0=" + referenceImpedance + ", ports=" + ports()
                + ", samples=" + samples.length + ", range=[" + freqs[0] + ", "
                + freqs[freqs.length - 1] + "])";
    }

    /**
     * 標本列の参照（変更しないこと）を返します。
     */
    ZMatrixRMaj[] samplesView() {
        return samples;
    }

    /**
     * 各標本に単一周波数の操作を適用し、結果の種別・参照インピーダンスで包み直します。
     */
    private FrequencySweep mapSamples(UnaryOperator<PortMatrix> op, ParameterType resultType,
            Double resultImpedance) {
        ZMatrixRMaj[] out = new ZMatrixRMaj[samples.length];
        for (int i = 0; i < samples.length; i++) {
            out[i] = op.apply(sample(i)).toMatrix();
        }
        return new FrequencySweep(freqs.clone(), out, resultType, resultImpedance, true);
    }

    private void requireType(ParameterType required, String operation) {
        if (type != required) {
            throw new UnsupportedConversionException(
                    operation + " は " + required + " スイープでのみ実行できます: " + type);
        }
    }

    private static PortMatrix toFormat(PortMatrix m, ParameterType type, Double z0) {
        if (m.getType() == type && Objects.equals(m.getReferenceImpedance(), z0)) {
            return m;
        }
        return m.convert(type, z0);
    }

    private static double[] copyOf(double[] freqs) {
        checkNotNull(freqs, "freqs は null 不可です");
        return freqs.clone();
    }

    private static ZMatrixRMaj[] copyOf(ZMatrixRMaj[] matrices) {
        checkNotNull(matrices, "matrices は null 不可です");
        if (matrices.length == 0) {
            throw new ShapeMismatchException("行列は 1 つ以上が必要です");
        }
        ZMatrixRMaj[] out = new ZMatrixRMaj[matrices.length];
        for (int i = 0; i < matrices.length; i++) {
            out[i] = checkNotNull(matrices[i], "matrices に null が含まれています").copy();
        }
        return out;
    }
}
