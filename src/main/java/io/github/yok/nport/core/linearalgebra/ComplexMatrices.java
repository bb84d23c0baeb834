package io.github.yok.nport.core.linearalgebra;

import io.github.yok.nport.core.exception.ShapeMismatchException;
import io.github.yok.nport.core.exception.SingularMatrixException;
import org.ejml.data.Complex_F64;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.ZMatrixRMaj;
import org.ejml.dense.row.CommonOps_ZDRM;

/**
 * EJML の複素行列（{@link ZMatrixRMaj}）に対する演算をまとめたユーティリティクラスです。
 *
 * <p>
 * すべての演算は新しい行列を返し、引数の行列を書き換えません。
 * </p>
 */
public final class ComplexMatrices {

    private ComplexMatrices() {}

    /**
     * 実部・虚部の 2 次元配列から複素行列を生成します。
     *
     * @param real 実部です（行の配列）
     * @param imag 虚部です（行の配列、null の場合は 0）
     * @return 複素行列です
     * @throws ShapeMismatchException 行長が揃っていない、または実部と虚部の形状が異なる場合に発生します
     */
    public static ZMatrixRMaj of(double[][] real, double[][] imag) {
        if (real == null || real.length == 0) {
            throw new ShapeMismatchException("行列は 1 行以上が必要です");
        }
        int rows = real.length;
        int cols = real[0].length;
        if (imag != null && imag.length != rows) {
            throw new ShapeMismatchException("実部と虚部の行数が異なります: " + rows + " != " + imag.length);
        }
        ZMatrixRMaj m = new ZMatrixRMaj(rows, cols);
        for (int r = 0; r < rows; r++) {
            if (real[r].length != cols || (imag != null && imag[r].length != cols)) {
                throw new ShapeMismatchException("行 " + r + " の列数が揃っていません");
            }
            for (int c = 0; c < cols; c++) {
                m.set(r, c, real[r][c], imag == null ? 0.0 : imag[r][c]);
            }
        }
        return m;
    }

    /**
     * 実数行列を複素行列に変換します。
     *
     * @param real 実数行列です
     * @return 虚部 0 の複素行列です
     */
    public static ZMatrixRMaj ofReal(DMatrixRMaj real) {
        ZMatrixRMaj m = new ZMatrixRMaj(real.numRows, real.numCols);
        CommonOps_ZDRM.convert(real, m);
        return m;
    }

    /**
     * n×n の単位行列を返します。
     *
     * @param n 次元です
     * @return 単位行列です
     */
    public static ZMatrixRMaj identity(int n) {
        return CommonOps_ZDRM.identity(n);
    }

    /**
     * 行列が正方であることを検査します。
     *
     * @param m 対象行列です
     * @param name エラーメッセージ用の名前です
     * @throws ShapeMismatchException 正方でない場合に発生します
     */
    public static void checkSquare(ZMatrixRMaj m, String name) {
        if (m.numRows != m.numCols) {
            throw new ShapeMismatchException(
                    name + " は正方行列である必要があります: " + m.numRows + "x" + m.numCols);
        }
    }

    /**
     * 2 つの行列の形状が一致することを検査します。
     *
     * @param a 行列 a です
     * @param b 行列 b です
     * @throws ShapeMismatchException 形状が異なる場合に発生します
     */
    public static void checkSameShape(ZMatrixRMaj a, ZMatrixRMaj b) {
        if (a.numRows != b.numRows || a.numCols != b.numCols) {
            throw new ShapeMismatchException("行列の形状が一致しません: " + a.numRows + "x" + a.numCols
                    + " と " + b.numRows + "x" + b.numCols);
        }
    }

    /**
     * 逆行列を返します。
     *
     * @param m 正方行列です
     * @return 逆行列です
     * @throws SingularMatrixException 逆行列が求まらない場合に発生します
     */
    public static ZMatrixRMaj invert(ZMatrixRMaj m) {
        checkSquare(m, "逆行列の対象");
        ZMatrixRMaj out = new ZMatrixRMaj(m.numRows, m.numCols);
        // EJML の LU は特異でも false を返さないことがあるため、有限値かどうかも確認します。
        if (!CommonOps_ZDRM.invert(m.copy(), out) || !isFinite(out)) {
            throw new SingularMatrixException("逆行列の計算に失敗しました（EJML）: 行列が特異です");
        }
        return out;
    }

    /**
     * 行列積 a·b を返します。
     *
     * @param a 左オペランドです
     * @param b 右オペランドです
     * @return 行列積です
     * @throws ShapeMismatchException 内側の次元が一致しない場合に発生します
     */
    public static ZMatrixRMaj mult(ZMatrixRMaj a, ZMatrixRMaj b) {
        if (a.numCols != b.numRows) {
            throw new ShapeMismatchException("行列積の次元が一致しません: " + a.numRows + "x" + a.numCols
                    + " · " + b.numRows + "x" + b.numCols);
        }
        ZMatrixRMaj out = new ZMatrixRMaj(a.numRows, b.numCols);
        CommonOps_ZDRM.mult(a, b, out);
        return out;
    }

    /**
     * 和 a+b を返します。
     *
     * @param a 行列 a です
     * @param b 行列 b です
     * @return 和です
     */
    public static ZMatrixRMaj add(ZMatrixRMaj a, ZMatrixRMaj b) {
        checkSameShape(a, b);
        ZMatrixRMaj out = new ZMatrixRMaj(a.numRows, a.numCols);
        CommonOps_ZDRM.add(a, b, out);
        return out;
    }

    /**
     * 差 a-b を返します。
     *
     * @param a 行列 a です
     * @param b 行列 b です
     * @return 差です
     */
    public static ZMatrixRMaj subtract(ZMatrixRMaj a, ZMatrixRMaj b) {
        checkSameShape(a, b);
        ZMatrixRMaj out = new ZMatrixRMaj(a.numRows, a.numCols);
        CommonOps_ZDRM.subtract(a, b, out);
        return out;
    }

    /**
     * 実数倍した行列を返します。
     *
     * @param m 行列です
     * @param factor 係数です
     * @return {@code factor * m} です
     */
    public static ZMatrixRMaj scale(ZMatrixRMaj m, double factor) {
        ZMatrixRMaj out = m.copy();
        for (int i = 0; i < out.data.length; i++) {
            out.data[i] *= factor;
        }
        return out;
    }

    /**
     * 行と列を同じ順序で並べ替えた行列を返します。
     *
     * @param m 正方行列です
     * @param order 新しい順序（0 始まりの元インデックス）です
     * @return 並べ替え後の行列（{@code order.length} 次の正方行列）です
     */
    public static ZMatrixRMaj permute(ZMatrixRMaj m, int[] order) {
        int n = order.length;
        ZMatrixRMaj out = new ZMatrixRMaj(n, n);
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                out.set(r, c, m.getReal(order[r], order[c]), m.getImag(order[r], order[c]));
            }
        }
        return out;
    }

    /**
     * 部分行列を切り出します。
     *
     * @param m 行列です
     * @param row0 開始行（0 始まり）です
     * @param col0 開始列（0 始まり）です
     * @param rows 行数です
     * @param cols 列数です
     * @return 部分行列です
     */
    public static ZMatrixRMaj block(ZMatrixRMaj m, int row0, int col0, int rows, int cols) {
        ZMatrixRMaj out = new ZMatrixRMaj(rows, cols);
        copyInto(m, row0, col0, out, 0, 0, rows, cols);
        return out;
    }

    /**
     * 2×2 に並べたブロックから 1 つの行列を組み立てます。
     *
     * @param b11 左上ブロックです
     * @param b12 右上ブロックです
     * @param b21 左下ブロックです
     * @param b22 右下ブロックです
     * @return 組み立てた行列です
     */
    public static ZMatrixRMaj assemble(ZMatrixRMaj b11, ZMatrixRMaj b12, ZMatrixRMaj b21,
            ZMatrixRMaj b22) {
        int top = b11.numRows;
        int left = b11.numCols;
        ZMatrixRMaj out = new ZMatrixRMaj(top + b21.numRows, left + b12.numCols);
        copyInto(b11, 0, 0, out, 0, 0, b11.numRows, b11.numCols);
        copyInto(b12, 0, 0, out, 0, left, b12.numRows, b12.numCols);
        copyInto(b21, 0, 0, out, top, 0, b21.numRows, b21.numCols);
        copyInto(b22, 0, 0, out, top, left, b22.numRows, b22.numCols);
        return out;
    }

    /**
     * 各行の絶対値二乗和の最大値を返します。
     *
     * @param m 行列です
     * @return {@code max_i Σ_j |m_ij|^2} です
     */
    public static double maxRowPowerSum(ZMatrixRMaj m) {
        double max = 0.0;
        for (int r = 0; r < m.numRows; r++) {
            double sum = 0.0;
            for (int c = 0; c < m.numCols; c++) {
                double re = m.getReal(r, c);
                double im = m.getImag(r, c);
                sum += re * re + im * im;
            }
            max = Math.max(max, sum);
        }
        return max;
    }

    /**
     * 要素 (row, col) を複素数として返します。
     *
     * @param m 行列です
     * @param row 行（0 始まり）です
     * @param col 列（0 始まり）です
     * @return 要素値です
     */
    public static Complex_F64 get(ZMatrixRMaj m, int row, int col) {
        return new Complex_F64(m.getReal(row, col), m.getImag(row, col));
    }

    /**
     * すべての要素が複素定数 c である行列を返します。
     *
     * @param rows 行数です
     * @param cols 列数です
     * @param c 値です
     * @return 定数行列です
     */
    public static ZMatrixRMaj filled(int rows, int cols, Complex_F64 c) {
        ZMatrixRMaj out = new ZMatrixRMaj(rows, cols);
        for (int r = 0; r < rows; r++) {
            for (int col = 0; col < cols; col++) {
                out.set(r, col, c.real, c.imaginary);
            }
        }
        return out;
    }

    /**
     * 2 つの行列が要素ごとに許容誤差内で一致するかどうかを返します。
     *
     * @param a 行列 a です
     * @param b 行列 b です
     * @param tolerance 実部・虚部それぞれの許容誤差（絶対値）です
     * @return 形状が同じで、すべての要素が許容誤差内なら true です（NaN を含む場合は false）
     */
    public static boolean approximatelyEquals(ZMatrixRMaj a, ZMatrixRMaj b, double tolerance) {
        if (a.numRows != b.numRows || a.numCols != b.numCols) {
            return false;
        }
        int len = a.getDataLength();
        for (int i = 0; i < len; i++) {
            // NaN を含む要素は一致しないものとします
            if (!(Math.abs(a.data[i] - b.data[i]) <= tolerance)) {
                return false;
            }
        }
        return true;
    }

    private static void copyInto(ZMatrixRMaj src, int srcRow, int srcCol, ZMatrixRMaj dst,
            int dstRow, int dstCol, int rows, int cols) {
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                dst.set(dstRow + r, dstCol + c, src.getReal(srcRow + r, srcCol + c),
                        src.getImag(srcRow + r, srcCol + c));
            }
        }
    }

    private static boolean isFinite(ZMatrixRMaj m) {
        int len = m.getDataLength();
        for (int i = 0; i < len; i++) {
            if (!Double.isFinite(m.data[i])) {
                return false;
            }
        }
        return true;
    }
}
