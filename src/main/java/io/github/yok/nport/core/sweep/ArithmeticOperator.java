package io.github.yok.nport.core.sweep;

import io.github.yok.nport.core.linearalgebra.ComplexMatrices;
import org.ejml.data.Complex_F64;
import org.ejml.data.ZMatrixRMaj;
import org.ejml.ops.ComplexMath_F64;

/**
 * 周波数スイープ同士、またはスイープと定数の要素ごとの四則演算を表す列挙型です。
 *
 * <p>
 * 乗算・除算も要素ごとに行います（行列積は {@link SweepProducts#dot} を使用します）。
 * </p>
 */
public enum ArithmeticOperator {

    /**
     * 加算です。
     */
    ADD {
        @Override
        void apply(Complex_F64 a, Complex_F64 b, Complex_F64 result) {
            ComplexMath_F64.plus(a, b, result);
        }
    },

    /**
     * 減算です。
     */
    SUBTRACT {
        @Override
        void apply(Complex_F64 a, Complex_F64 b, Complex_F64 result) {
            ComplexMath_F64.minus(a, b, result);
        }
    },

    /**
     * 乗算（要素ごと）です。
     */
    MULTIPLY {
        @Override
        void apply(Complex_F64 a, Complex_F64 b, Complex_F64 result) {
            ComplexMath_F64.multiply(a, b, result);
        }
    },

    /**
     * 除算（要素ごと）です。
     */
    DIVIDE {
        @Override
        void apply(Complex_F64 a, Complex_F64 b, Complex_F64 result) {
            ComplexMath_F64.divide(a, b, result);
        }
    };

    /**
     * 2 つの複素数に演算を適用します。
     *
     * @param a 左オペランドです
     * @param b 右オペランドです
     * @param result 結果の格納先です
     */
    abstract void apply(Complex_F64 a, Complex_F64 b, Complex_F64 result);

    /**
     * 同じ形状の 2 つの行列に要素ごとに演算を適用します。
     *
     * @param a 左オペランドです
     * @param b 右オペランドです
     * @return 結果の行列です
     * @throws io.github.yok.nport.core.exception.ShapeMismatchException 形状が異なる場合に発生します
     */
    public ZMatrixRMaj apply(ZMatrixRMaj a, ZMatrixRMaj b) {
        ComplexMatrices.checkSameShape(a, b);
        ZMatrixRMaj out = new ZMatrixRMaj(a.numRows, a.numCols);
        Complex_F64 x = new Complex_F64();
        Complex_F64 y = new Complex_F64();
        Complex_F64 z = new Complex_F64();
        for (int r = 0; r < a.numRows; r++) {
            for (int c = 0; c < a.numCols; c++) {
                a.get(r, c, x);
                b.get(r, c, y);
                apply(x, y, z);
                out.set(r, c, z.real, z.imaginary);
            }
        }
        return out;
    }
}
