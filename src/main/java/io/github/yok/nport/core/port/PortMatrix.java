package io.github.yok.nport.core.port;

import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.nport.core.exception.PortIndexException;
import io.github.yok.nport.core.exception.ShapeMismatchException;
import io.github.yok.nport.core.exception.UnsupportedConversionException;
import io.github.yok.nport.core.linearalgebra.ComplexMatrices;
import io.github.yok.nport.core.parameter.ParameterType;
import io.github.yok.nport.core.twonport.TwoNPortMatrix;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import lombok.Getter;
import org.ejml.data.Complex_F64;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.ZMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * 単一周波数における n ポート行列（Z, Y, S, T, H, G, ABCD）を表す不変クラスです。
 *
 * <p>
 * 行列本体に加えてパラメータ種別と参照インピーダンス（S/T のみ）を保持し、 変換・再正規化・ポート再結合などの操作はすべて新しいインスタンスを返します。
 * </p>
 *
 * <p>
 * 変換式は以下の文献に基づきます。
 * </p>
 * <ul>
 * <li>Qucs technical papers: "Transformations of n-Port matrices"</li>
 * <li>Reimann et al., "Multiport S-Parameter Measurements of Linear Circuits With Open Ports"</li>
 * </ul>
 */
public final class PortMatrix {

    /**
     * 行列本体（n×n）です。
     */
    private final ZMatrixRMaj matrix;

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
     * n ポート行列を生成します。
     *
     * @param matrix n×n の複素行列です（コピーして保持します）
     * @param type パラメータ種別です
     * @param referenceImpedance 参照インピーダンスです（S/T で null の場合は 50.0）
     * @throws ShapeMismatchException 行列が正方でない場合に発生します
     * @throws io.github.yok.nport.core.exception.ImpedanceRuleViolationException S/T 以外に参照インピーダンスを指定した場合に発生します
     */
    public PortMatrix(ZMatrixRMaj matrix, ParameterType type, Double referenceImpedance) {
        checkNotNull(matrix, "matrix は null 不可です");
        this.type = checkNotNull(type, "type は null 不可です");
        ComplexMatrices.checkSquare(matrix, "n ポート行列");
        this.referenceImpedance = type.checkReferenceImpedance(referenceImpedance);
        this.matrix = matrix.copy();
    }

    /**
     * 参照インピーダンスを省略して n ポート行列を生成します。
     *
     * @param matrix n×n の複素行列です
     * @param type パラメータ種別です
     */
    public PortMatrix(ZMatrixRMaj matrix, ParameterType type) {
        this(matrix, type, null);
    }

    /**
     * 実部・虚部の配列から n ポート行列を生成します。
     *
     * @param real 実部です
     * @param imag 虚部です（null の場合は 0）
     * @param type パラメータ種別です
     * @param referenceImpedance 参照インピーダンスです（null 可）
     * @return n ポート行列です
     */
    public static PortMatrix of(double[][] real, double[][] imag, ParameterType type,
            Double referenceImpedance) {
        return new PortMatrix(ComplexMatrices.of(real, imag), type, referenceImpedance);
    }

    /**
     * ポート数 n を返します。
     *
     * @return ポート数です
     */
    public int ports() {
        return matrix.numRows;
    }

    /**
     * 行列本体のコピーを返します。
     *
     * @return n×n の複素行列です
     */
    public ZMatrixRMaj toMatrix() {
        return matrix.copy();
    }

    /**
     * ポート番号（1 始まり）で指定したパラメータ値を返します。
     *
     * @param port1 行側のポート番号です
     * @param port2 列側のポート番号です
     * @return パラメータ値です
     * @throws PortIndexException ポート番号が範囲外の場合に発生します
     */
    public Complex_F64 parameter(int port1, int port2) {
        checkPort(port1, ports());
        checkPort(port2, ports());
        return ComplexMatrices.get(matrix, port1 - 1, port2 - 1);
    }

    /**
     * 変換先の参照インピーダンスを省略して別の表現に変換します。
     *
     * @param target 変換先の種別です（Z, Y, S）
     * @return 変換後の行列です
     * @see #convert(ParameterType, Double)
     */
    public PortMatrix convert(ParameterType target) {
        return convert(target, null);
    }

    /**
     * 別の表現（Z, Y, S）に変換します。
     *
     * <p>
     * S への変換で参照インピーダンスを省略した場合、変換元が S/T ならその値を、 そうでなければ 50.0 を用います。 特異点の回避は行わず、逆行列が求まらない場合は例外になります。
     * </p>
     *
     * @param target 変換先の種別です（Z, Y, S）
     * @param targetImpedance 変換先の参照インピーダンスです（S のみ指定可、null 可）
     * @return 変換後の行列です
     * @throws UnsupportedConversionException ABCD/T など、n ポート行列のままでは変換できない種別を指定した場合に発生します
     * @throws io.github.yok.nport.core.exception.ImpedanceRuleViolationException S 以外の変換先に参照インピーダンスを指定した場合に発生します
     * @throws io.github.yok.nport.core.exception.SingularMatrixException 逆行列が求まらない場合に発生します
     */
    public PortMatrix convert(ParameterType target, Double targetImpedance) {
        checkConvertible(type, target);
        Double z0 = target.resolveTargetImpedance(type, referenceImpedance, targetImpedance);

        int n = ports();
        ZMatrixRMaj idty = ComplexMatrices.identity(n);
        ZMatrixRMaj result;

        switch (type) {
            case S:
                if (target == ParameterType.S) {
                    return renormalize(z0);
                }
                double sz0 = referenceImpedance;
                if (target == ParameterType.Z) {
                    // Z = (2·(I−S)⁻¹ − I)·z0
                    ZMatrixRMaj inv = ComplexMatrices.invert(ComplexMatrices.subtract(idty, matrix));
                    result = ComplexMatrices.scale(
                            ComplexMatrices.subtract(ComplexMatrices.scale(inv, 2.0), idty), sz0);
                } else {
                    // Y = (2·(I+S)⁻¹ − I)/z0
                    ZMatrixRMaj inv = ComplexMatrices.invert(ComplexMatrices.add(idty, matrix));
                    result = ComplexMatrices.scale(
                            ComplexMatrices.subtract(ComplexMatrices.scale(inv, 2.0), idty),
                            1.0 / sz0);
                }
                break;
            case Z:
                if (target == ParameterType.S) {
                    // S = I − 2·(I + Z/z0)⁻¹
                    ZMatrixRMaj inv = ComplexMatrices.invert(
                            ComplexMatrices.add(idty, ComplexMatrices.scale(matrix, 1.0 / z0)));
                    result = ComplexMatrices.subtract(idty, ComplexMatrices.scale(inv, 2.0));
                } else if (target == ParameterType.Y) {
                    result = ComplexMatrices.invert(matrix);
                } else {
                    result = matrix;
                }
                break;
            case Y:
                if (target == ParameterType.S) {
                    // S = 2·(I + Y·z0)⁻¹ − I
                    ZMatrixRMaj inv = ComplexMatrices.invert(
                            ComplexMatrices.add(idty, ComplexMatrices.scale(matrix, z0)));
                    result = ComplexMatrices.subtract(ComplexMatrices.scale(inv, 2.0), idty);
                } else if (target == ParameterType.Z) {
                    result = ComplexMatrices.invert(matrix);
                } else {
                    result = matrix;
                }
                break;
            default:
                throw new UnsupportedConversionException("変換元の種別 " + type + " からの変換はサポートしていません");
        }

        return new PortMatrix(result, target, z0);
    }

    /**
     * S パラメータを別の参照インピーダンスに再正規化します。
     *
     * <p>
     * {@code r = (z0' − z0)/(z0' + z0)} として {@code S' = (S − r·I)·(I − r·S)⁻¹} を計算します。 参照インピーダンスが同じ場合は
     * このインスタンスをそのまま返します。
     * </p>
     *
     * @param newImpedance 新しい参照インピーダンスです
     * @return 再正規化した S 行列です
     * @throws UnsupportedConversionException S 以外の種別で呼び出した場合に発生します
     */
    public PortMatrix renormalize(double newImpedance) {
        requireType(ParameterType.S, "再正規化");
        ParameterType.S.checkReferenceImpedance(newImpedance);
        if (newImpedance == referenceImpedance) {
            return this;
        }
        double z0 = referenceImpedance;
        double r = (newImpedance - z0) / (newImpedance + z0);

        ZMatrixRMaj idty = ComplexMatrices.identity(ports());
        ZMatrixRMaj numerator = ComplexMatrices.subtract(matrix, ComplexMatrices.scale(idty, r));
        ZMatrixRMaj denominator =
                ComplexMatrices.subtract(idty, ComplexMatrices.scale(matrix, r));
        ZMatrixRMaj result =
                ComplexMatrices.mult(numerator, ComplexMatrices.invert(denominator));
        return new PortMatrix(result, ParameterType.S, newImpedance);
    }

    /**
     * ポートを再結合してポート数を減らします（Z 行列のみ）。
     *
     * <p>
     * 各定義から実数の変換行列 M（新ポート数 × 元ポート数）を作り、 {@code M·Z·Mᵗ} を返します。
     * 例えば {@code [(1,3), (2,4), 5, -6]} は、 ポート 3 基準のポート 1、ポート 4 基準のポート 2、ポート 5、 極性反転したポート 6 からなる
     * 4 ポートを生成します。
     * </p>
     *
     * @param portSpecs 新ポートの定義列です（順序が新ポート番号になります）
     * @return 再結合後の Z 行列です
     * @throws UnsupportedConversionException Z 以外の種別で呼び出した場合に発生します
     * @throws PortIndexException ポート番号が範囲外の場合に発生します
     */
    public PortMatrix recombine(List<PortSpec> portSpecs) {
        requireType(ParameterType.Z, "ポート再結合");
        checkNotNull(portSpecs, "portSpecs は null 不可です");
        if (portSpecs.isEmpty()) {
            throw new ShapeMismatchException("ポート定義は 1 つ以上が必要です");
        }

        int n = ports();
        DMatrixRMaj m = new DMatrixRMaj(portSpecs.size(), n);
        for (int i = 0; i < portSpecs.size(); i++) {
            double[] row = new double[n];
            checkNotNull(portSpecs.get(i), "portSpecs に null が含まれています").fillTransformRow(row);
            for (int j = 0; j < n; j++) {
                m.set(i, j, row[j]);
            }
        }
        DMatrixRMaj mt = CommonOps_DDRM.transpose(m, null);

        ZMatrixRMaj result = ComplexMatrices.mult(
                ComplexMatrices.mult(ComplexMatrices.ofReal(m), matrix), ComplexMatrices.ofReal(mt));
        return new PortMatrix(result, type, referenceImpedance);
    }

    /**
     * 指定したポートのパラメータのみを残した行列を返します。
     *
     * @param keepPorts 残すポート番号（1 始まり）です
     * @return 部分行列です（種別・参照インピーダンスは維持）
     * @throws PortIndexException ポート番号が範囲外の場合に発生します
     */
    public PortMatrix submatrix(int... keepPorts) {
        return new PortMatrix(ComplexMatrices.permute(matrix, toIndices(keepPorts, ports())), type,
                referenceImpedance);
    }

    /**
     * 先頭 n ポートを入力、後半 n ポートを出力として 2n ポートのブロック行列を返します。
     *
     * @return 2n ポートのブロック行列です
     * @throws ShapeMismatchException ポート数が偶数でない場合に発生します
     */
    public TwoNPortMatrix twoNPortMatrix() {
        return twoNPortMatrix(null, null);
    }

    /**
     * 入力ポート群と出力ポート群を指定して 2n ポートのブロック行列を返します。
     *
     * <p>
     * 行・列を {@code [inPorts..., outPorts...]} の順に並べ替えたうえで 4 つの n×n ブロックに分割します。 両方 null の場合は既定の分割です。
     * </p>
     *
     * @param inPorts 入力ポート番号（1 始まり、n 個）です
     * @param outPorts 出力ポート番号（1 始まり、n 個）です
     * @return 2n ポートのブロック行列です
     * @throws ShapeMismatchException ポート数が偶数でない、またはポート群が {1..2n} を過不足なく分割しない場合に発生します
     * @throws PortIndexException ポート番号が範囲外の場合に発生します
     */
    public TwoNPortMatrix twoNPortMatrix(int[] inPorts, int[] outPorts) {
        int ports = ports();
        if (ports % 2 != 0) {
            throw new ShapeMismatchException("ポート数が 2 の倍数ではありません: " + ports);
        }
        int n = ports / 2;

        ZMatrixRMaj ordered;
        if (inPorts == null && outPorts == null) {
            ordered = matrix;
        } else {
            if (inPorts == null || outPorts == null) {
                throw new ShapeMismatchException("入力ポートと出力ポートは両方指定する必要があります");
            }
            if (inPorts.length != n || outPorts.length != n) {
                throw new ShapeMismatchException("入力・出力ポートはそれぞれ " + n + " 個必要です: "
                        + inPorts.length + ", " + outPorts.length);
            }
            int[] order = new int[ports];
            System.arraycopy(toIndices(inPorts, ports), 0, order, 0, n);
            System.arraycopy(toIndices(outPorts, ports), 0, order, n, n);

            boolean[] seen = new boolean[ports];
            for (int index : order) {
                if (seen[index]) {
                    throw new ShapeMismatchException("入力・出力ポートが {1.." + ports
                            + "} を分割していません（重複: " + (index + 1) + "）");
                }
                seen[index] = true;
            }
            ordered = ComplexMatrices.permute(matrix, order);
        }

        ZMatrixRMaj[][] blocks = new ZMatrixRMaj[][] {
                {ComplexMatrices.block(ordered, 0, 0, n, n),
                        ComplexMatrices.block(ordered, 0, n, n, n)},
                {ComplexMatrices.block(ordered, n, 0, n, n),
                        ComplexMatrices.block(ordered, n, n, n, n)}};
        return new TwoNPortMatrix(blocks, type, referenceImpedance);
    }

    /**
     * 受動的かどうかを返します。
     *
     * <p>
     * S 行列の各行について絶対値二乗和が 1 以下であれば受動的とします。 S 以外の種別は S に変換してから判定します。
     * </p>
     *
     * @return 受動的であれば true です
     */
    public boolean isPassive() {
        if (type != ParameterType.S) {
            return convert(ParameterType.S).isPassive();
        }
        return ComplexMatrices.maxRowPowerSum(matrix) <= 1.0;
    }

    /**
     * 相反性を判定します（未実装）。
     *
     * @return なし
     * @throws UnsupportedOperationException 常に発生します
     */
    public boolean isReciprocal() {
        throw new UnsupportedOperationException("相反性の判定は未実装です");
    }

    /**
     * 対称性を判定します（未実装）。
     *
     * @return なし
     * @throws UnsupportedOperationException 常に発生します
     */
    public boolean isSymmetrical() {
        throw new UnsupportedOperationException("対称性の判定は未実装です");
    }

    /**
     * 種別・参照インピーダンスが同じで、要素が許容誤差内で一致するかどうかを返します。
     *
     * @param other 比較対象です
     * @param tolerance 許容誤差です
     * @return 一致すれば true です
     */
    public boolean approximatelyEquals(PortMatrix other, double tolerance) {
        return other != null && type == other.type
                && Objects.equals(referenceImpedance, other.referenceImpedance)
                && ComplexMatrices.approximatelyEquals(matrix, other.matrix, tolerance);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PortMatrix)) {
            return false;
        }
        PortMatrix other = (PortMatrix) o;
        return type == other.type && Objects.equals(referenceImpedance, other.referenceImpedance)
                && matrix.numRows == other.matrix.numRows
                && Arrays.equals(normalizedData(), other.normalizedData());
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, referenceImpedance, matrix.numRows,
                Arrays.hashCode(normalizedData()));
    }

    /**
     * 比較・ハッシュ用に、-0.0 を 0.0 に揃えた要素列を返します。
     *
     * <p>
     * {@link Arrays#equals(double[], double[])} と {@link Arrays#hashCode(double[])} はどちらも
     * {@code Double.doubleToLongBits} に基づくため、NaN 同士は一致し、NaN と有限値は一致しません。
     * </p>
     */
    private double[] normalizedData() {
        double[] data = Arrays.copyOf(matrix.data, matrix.getDataLength());
        for (int i = 0; i < data.length; i++) {
            if (data[i] == 0.0) {
                data[i] = 0.0;
            }
        }
        return data;
    }

    @Override
    public String toString() {
        return "PortMatrix(type=" + type + ", z0=" + referenceImpedance + ", ports=" + ports()
                + ")";
    }

    /**
     * 1 始まりのポート番号列を 0 始まりのインデックス列に変換します。
     *
     * @param ports ポート番号列です
     * @param portCount ポート数です
     * @return インデックス列です
     * @throws PortIndexException ポート番号が範囲外の場合に発生します
     */
    static int[] toIndices(int[] ports, int portCount) {
        checkNotNull(ports, "ポート番号列は null 不可です");
        int[] indices = new int[ports.length];
        for (int i = 0; i < ports.length; i++) {
            checkPort(ports[i], portCount);
            indices[i] = ports[i] - 1;
        }
        return indices;
    }

    private static void checkPort(int port, int portCount) {
        if (port < 1 || port > portCount) {
            throw new PortIndexException(
                    "ポート番号は 1 以上 " + portCount + " 以下が必要です: " + port);
        }
    }

    private void requireType(ParameterType required, String operation) {
        if (type != required) {
            throw new UnsupportedConversionException(
                    operation + " は " + required + " 行列でのみ実行できます: " + type);
        }
    }

    /**
     * n ポート行列として変換可能な種別の組み合わせかどうかを検査します。
     *
     * <p>
     * 参照インピーダンスの検査より先に行うため、ABCD/T への変換は常に
     * {@link UnsupportedConversionException} になります。
     * </p>
     *
     * @param source 変換元の種別です
     * @param target 変換先の種別です
     * @throws UnsupportedConversionException 変換できない組み合わせの場合に発生します
     */
    public static void checkConvertible(ParameterType source, ParameterType target) {
        checkNotNull(source, "source は null 不可です");
        checkNotNull(target, "target は null 不可です");
        if (target == ParameterType.ABCD || target == ParameterType.T) {
            throw new UnsupportedConversionException("n ポート行列を " + target
                    + " 表現に変換することはできません。先に TwoNPortMatrix に変換してください");
        }
        if (!isConvertible(target)) {
            throw new UnsupportedConversionException("変換先の種別 " + target + " はサポートしていません");
        }
        if (!isConvertible(source)) {
            throw new UnsupportedConversionException("変換元の種別 " + source + " からの変換はサポートしていません");
        }
    }

    private static boolean isConvertible(ParameterType t) {
        return t == ParameterType.Z || t == ParameterType.Y || t == ParameterType.S;
    }
}
