package io.github.yok.nport.core.sweep;

import static io.github.yok.nport.core.linearalgebra.ComplexMatrixAssertions.assertComplexEquals;
import static io.github.yok.nport.core.linearalgebra.ComplexMatrixAssertions.real;
import static io.github.yok.nport.core.linearalgebra.ComplexMatrixAssertions.scalar;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.nport.core.exception.ImpedanceMismatchException;
import io.github.yok.nport.core.exception.OutOfDomainException;
import io.github.yok.nport.core.exception.ShapeMismatchException;
import io.github.yok.nport.core.exception.TypeMismatchException;
import io.github.yok.nport.core.parameter.ParameterType;
import org.ejml.data.Complex_F64;
import org.ejml.data.ZMatrixRMaj;
import org.junit.jupiter.api.Test;

class SweepArithmeticTest {

    /**
     * 値が周波数の k 倍となる 1×1 スイープを生成します。
     */
    private static FrequencySweep proportional(ParameterType type, Double z0, double k,
            double... freqs) {
        ZMatrixRMaj[] m = new ZMatrixRMaj[freqs.length];
        for (int i = 0; i < freqs.length; i++) {
            m[i] = scalar(k * freqs[i], 0);
        }
        return new FrequencySweep(freqs, m, type, z0);
    }

    @Test
    void operandsAreAlignedOnOverlappingUnionGrid() {
        FrequencySweep a = proportional(ParameterType.Z, null, 1, 1, 2, 3, 4);
        FrequencySweep b = proportional(ParameterType.Z, null, 10, 1.5, 2.5, 4.5);

        FrequencySweep sum = a.plus(b);

        assertArrayEquals(new double[] {1.5, 2, 2.5, 3, 4}, sum.frequencies());
        Complex_F64[] values = sum.parameter(1, 1);
        double[] grid = sum.frequencies();
        for (int i = 0; i < grid.length; i++) {
            assertComplexEquals(11 * grid[i], 0, values[i]);
        }
    }

    @Test
    void identicalGridsAreKept() {
        FrequencySweep a = proportional(ParameterType.Z, null, 1, 1, 2, 3, 4);
        FrequencySweep b = proportional(ParameterType.Z, null, 1, 2, 3, 4, 5);

        assertArrayEquals(new double[] {2, 3, 4}, a.minus(b).frequencies());
    }

    @Test
    void elementwiseOperators() {
        FrequencySweep a = proportional(ParameterType.Z, null, 6, 1, 2);
        FrequencySweep b = proportional(ParameterType.Z, null, 2, 1, 2);

        assertComplexEquals(24, 0, a.times(b).parameter(1, 1)[1]);
        assertComplexEquals(3, 0, a.dividedBy(b).parameter(1, 1)[0]);
        assertComplexEquals(4, 0, a.minus(b).parameter(1, 1)[0]);
    }

    @Test
    void resultKeepsLeftOperandTag() {
        FrequencySweep a = proportional(ParameterType.S, 75.0, 0.1, 1, 2);
        FrequencySweep b = proportional(ParameterType.S, 75.0, 0.2, 1, 2);

        FrequencySweep sum = a.plus(b);

        assertEquals(ParameterType.S, sum.getType());
        assertEquals(75.0, sum.getReferenceImpedance());
    }

    @Test
    void mismatchedImpedanceIsRejectedBeforeAlignment() {
        FrequencySweep a = proportional(ParameterType.S, 50.0, 0.1, 1, 2);
        FrequencySweep b = proportional(ParameterType.S, 75.0, 0.1, 5, 6);

        assertThrows(ImpedanceMismatchException.class, () -> a.plus(b));
    }

    @Test
    void mismatchedTypeIsRejected() {
        FrequencySweep z = proportional(ParameterType.Z, null, 1, 1, 2);
        FrequencySweep y = proportional(ParameterType.Y, null, 1, 1, 2);

        assertThrows(TypeMismatchException.class, () -> z.plus(y));
    }

    @Test
    void mismatchedPortCountIsRejected() {
        FrequencySweep one = proportional(ParameterType.Z, null, 1, 1, 2);
        FrequencySweep two = new FrequencySweep(new double[] {1, 2},
                new ZMatrixRMaj[] {new ZMatrixRMaj(2, 2), new ZMatrixRMaj(2, 2)},
                ParameterType.Z, null);

        assertThrows(ShapeMismatchException.class, () -> one.plus(two));
    }

    @Test
    void disjointRangesAreRejected() {
        FrequencySweep a = proportional(ParameterType.Z, null, 1, 1, 2);
        FrequencySweep b = proportional(ParameterType.Z, null, 1, 3, 4);

        assertThrows(OutOfDomainException.class, () -> a.plus(b));
    }

    @Test
    void touchingRangesShareSinglePoint() {
        FrequencySweep a = proportional(ParameterType.Z, null, 1, 1, 2);
        FrequencySweep b = proportional(ParameterType.Z, null, 1, 2, 3);

        assertArrayEquals(new double[] {2}, a.plus(b).frequencies());
    }

    @Test
    void constantMatrixIsBroadcastOnEitherSide() {
        FrequencySweep a = proportional(ParameterType.Z, null, 1, 1, 2);

        FrequencySweep minusConst =
                SweepArithmetic.combine(ArithmeticOperator.SUBTRACT, a, real(new double[][] {{5}}));
        FrequencySweep constMinus =
                SweepArithmetic.combine(ArithmeticOperator.SUBTRACT, real(new double[][] {{5}}), a);

        assertComplexEquals(-4, 0, minusConst.parameter(1, 1)[0]);
        assertComplexEquals(3, 0, constMinus.parameter(1, 1)[1]);
        assertArrayEquals(a.frequencies(), constMinus.frequencies());
    }

    @Test
    void complexScalarIsAppliedToEveryEntry() {
        FrequencySweep line = FrequencySweepTest.lineSweep();

        FrequencySweep scaled = SweepArithmetic.combine(ArithmeticOperator.MULTIPLY, line,
                new Complex_F64(0, 1));
        FrequencySweep reciprocal = SweepArithmetic.combine(ArithmeticOperator.DIVIDE,
                new Complex_F64(1, 0), FrequencySweepTest.scalarSweep(new double[] {1}, 4));

        assertComplexEquals(-6.28, 110, scaled.parameter(1, 1)[0]);
        assertComplexEquals(0, 100, scaled.parameter(2, 1)[0]);
        assertComplexEquals(0.25, 0, reciprocal.parameter(1, 1)[0]);
    }

    @Test
    void operandsAreNotModified() {
        FrequencySweep a = proportional(ParameterType.Z, null, 1, 1, 2);
        FrequencySweep copy = proportional(ParameterType.Z, null, 1, 1, 2);

        a.plus(a);
        SweepArithmetic.combine(ArithmeticOperator.ADD, a, new Complex_F64(1, 0));

        assertTrue(a.approximatelyEquals(copy, 0.0));
    }
}
