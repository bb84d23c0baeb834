package io.github.yok.nport.core.twonport;

import static io.github.yok.nport.core.linearalgebra.ComplexMatrixAssertions.assertMatrixEquals;
import static io.github.yok.nport.core.linearalgebra.ComplexMatrixAssertions.real;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.nport.core.exception.ImpedanceRuleViolationException;
import io.github.yok.nport.core.exception.ShapeMismatchException;
import io.github.yok.nport.core.linearalgebra.ComplexMatrices;
import io.github.yok.nport.core.parameter.ParameterType;
import io.github.yok.nport.core.port.PortMatrix;
import org.ejml.data.ZMatrixRMaj;
import org.junit.jupiter.api.Test;

class TwoNPortMatrixTest {

    private static final double[][] LEFT =
            {{1, 2, 0, 1}, {0, 1, 3, 0}, {2, 0, 1, 1}, {1, 1, 0, 2}};
    private static final double[][] RIGHT =
            {{2, 0, 1, 0}, {1, 1, 0, 3}, {0, 2, 1, 1}, {1, 0, 0, 1}};

    private static TwoNPortMatrix split(double[][] values) {
        return new PortMatrix(real(values), ParameterType.ABCD).twoNPortMatrix();
    }

    @Test
    void blockProductEqualsFullMatrixProduct() {
        TwoNPortMatrix product = split(LEFT).multiply(split(RIGHT));

        assertMatrixEquals(ComplexMatrices.mult(real(LEFT), real(RIGHT)),
                product.toPortMatrix().toMatrix());
        assertEquals(ParameterType.ABCD, product.getType());
    }

    @Test
    void productKeepsLeftOperandTag() {
        TwoNPortMatrix t = new PortMatrix(real(LEFT), ParameterType.T, 75.0).twoNPortMatrix();

        TwoNPortMatrix product = t.multiply(split(RIGHT));

        assertEquals(ParameterType.T, product.getType());
        assertEquals(75.0, product.getReferenceImpedance());
    }

    @Test
    void blocksMustBeSquareAndEqualSized() {
        ZMatrixRMaj two = new ZMatrixRMaj(2, 2);
        ZMatrixRMaj one = new ZMatrixRMaj(1, 1);

        assertThrows(ShapeMismatchException.class, () -> new TwoNPortMatrix(
                new ZMatrixRMaj[][] {{two, two}, {two, one}}, ParameterType.ABCD, null));
        assertThrows(ShapeMismatchException.class, () -> new TwoNPortMatrix(
                new ZMatrixRMaj[][] {{two, two}}, ParameterType.ABCD, null));
    }

    @Test
    void multiplyRejectsDifferentHalfPorts() {
        TwoNPortMatrix small = split(new double[][] {{1, 0}, {0, 1}});

        assertThrows(ShapeMismatchException.class, () -> split(LEFT).multiply(small));
    }

    @Test
    void referenceImpedanceFollowsTypeRules() {
        ZMatrixRMaj one = new ZMatrixRMaj(1, 1);
        ZMatrixRMaj[][] blocks = {{one, one}, {one, one}};

        assertEquals(50.0, new TwoNPortMatrix(blocks, ParameterType.T, null)
                .getReferenceImpedance());
        assertThrows(ImpedanceRuleViolationException.class,
                () -> new TwoNPortMatrix(blocks, ParameterType.ABCD, 50.0));
    }

    @Test
    void blockReturnsCopy() {
        TwoNPortMatrix t = split(LEFT);

        t.block(0, 0).set(0, 0, 99, 0);

        assertMatrixEquals(real(new double[][] {{1, 2}, {0, 1}}), t.block(0, 0), 0.0);
        assertThrows(IllegalArgumentException.class, () -> t.block(2, 0));
    }
}
