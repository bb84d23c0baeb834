package io.github.yok.nport.core.port;
import static io.github.yok.nport.core.linearalgebra.ComplexMatrixAssertions.assertComplexEquals;
import static io.github.yok.nport.core.linearalgebra.ComplexMatrixAssertions.assertMatrixEquals;
import static io.github.yok.nport.core.linearalgebra.ComplexMatrixAssertions.real;
import static io.github.yok.nport.core.linearalgebra.ComplexMatrixAssertions.scalar;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.nport.core.exception.ImpedanceRuleViolationException;
import io.github.yok.nport.core.exception.PortIndexException;
import io.github.yok.nport.core.exception.ShapeMismatchException;
import io.github.yok.nport.core.exception.UnsupportedConversionException;
import io.github.yok.nport.core.linearalgebra.ComplexMatrices;
import io.github.yok.nport.core.parameter.ParameterType;
import io.github.yok.nport.core.twonport.TwoNPortMatrix;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.ejml.data.ZMatrixRMaj;
import org.junit.jupiter.api.Test;

class PortMatrixTest {

    /**
     * 2 ポートの Z 行列（損失のある結合線路相当）です。
     */
    private static PortMatrix lineZ() {
        return PortMatrix.of(new double[][] {{110, 100}, {100, 110}},
                new double[][] {{6.28, 0}, {0, 6.28}}, ParameterType.Z, null);
    }

    private static PortMatrix fourPort() {
        double[][] re = new double[4][4];
        double[][] im = new double[4][4];
        for (int r = 0; r < 4; r++) {
            for (int c = 0; c < 4; c++) {
                re[r][c] = 10 * (r + 1) + (c + 1);
                im[r][c] = r - c;
            }
        }
        return PortMatrix.of(re, im, ParameterType.Z, null);
    }

    @Test
    void scatteringDefaultsTo50OhmAndOthersHaveNone() {
        assertEquals(50.0, new PortMatrix(scalar(0, 0), ParameterType.S).getReferenceImpedance());
        assertNull(lineZ().getReferenceImpedance());
        assertThrows(ImpedanceRuleViolationException.class,
                () -> new PortMatrix(scalar(1, 0), ParameterType.Z, 50.0));
    }

    @Test
    void nonSquareMatrixIsRejected() {
        assertThrows(ShapeMismatchException.class,
                () -> new PortMatrix(new ZMatrixRMaj(2, 3), ParameterType.Z));
    }

    @Test
    void parameterUsesOneBasedPorts() {
        assertComplexEquals(100, 0, lineZ().parameter(1, 2));
        assertComplexEquals(110, 6.28, lineZ().parameter(2, 2));
        assertThrows(PortIndexException.class, () -> lineZ().parameter(0, 1));
        assertThrows(PortIndexException.class, () -> lineZ().parameter(1, 3));
    }

    @Test
    void onePortResistorConvertsToKnownReflection() {
        PortMatrix z = new PortMatrix(scalar(100, 0), ParameterType.Z);

        PortMatrix s = z.convert(ParameterType.S);
        assertEquals(ParameterType.S, s.getType());
        assertEquals(50.0, s.getReferenceImpedance());
        assertMatrixEquals(scalar(1.0 / 3.0, 0), s.toMatrix());

        assertMatrixEquals(scalar(100, 0), s.convert(ParameterType.Z).toMatrix());
        assertMatrixEquals(scalar(0.01, 0), s.convert(ParameterType.Y).toMatrix());
        assertMatrixEquals(scalar(1.0 / 3.0, 0),
                new PortMatrix(scalar(0.01, 0), ParameterType.Y).convert(ParameterType.S)
                        .toMatrix());
    }

    @Test
    void matchedLoadHasZeroReflection() {
        PortMatrix s = new PortMatrix(scalar(75, 0), ParameterType.Z).convert(ParameterType.S,
                75.0);

        assertMatrixEquals(scalar(0, 0), s.toMatrix());
        assertEquals(75.0, s.getReferenceImpedance());
    }

    @Test
    void impedanceSurvivesRoundTripThroughScattering() {
        PortMatrix z = lineZ();

        PortMatrix back = z.convert(ParameterType.S, 50.0).convert(ParameterType.Z);

        assertEquals(ParameterType.Z, back.getType());
        assertNull(back.getReferenceImpedance());
        assertTrue(z.approximatelyEquals(back, 1e-9));
    }

    @Test
    void admittanceSurvivesRoundTripThroughScattering() {
        PortMatrix y = lineZ().convert(ParameterType.Y);

        PortMatrix back = y.convert(ParameterType.S, 25.0).convert(ParameterType.Y);

        assertTrue(y.approximatelyEquals(back, 1e-10));
    }

    @Test
    void impedanceAndAdmittanceAreInverses() {
        PortMatrix z = lineZ();
        PortMatrix y = z.convert(ParameterType.Y);

        assertMatrixEquals(ComplexMatrices.identity(2),
                ComplexMatrices.mult(z.toMatrix(), y.toMatrix()));
    }

    @Test
    void conversionToSameTypeIsIdentity() {
        PortMatrix z = lineZ();

        assertEquals(z, z.convert(ParameterType.Z));
    }

    @Test
    void transferTypesRequireTwoNPortMatrix() {
        assertThrows(UnsupportedConversionException.class,
                () -> lineZ().convert(ParameterType.ABCD));
        assertThrows(UnsupportedConversionException.class,
                () -> lineZ().convert(ParameterType.T));
        assertThrows(UnsupportedConversionException.class,
                () -> lineZ().convert(ParameterType.H));
        assertThrows(UnsupportedConversionException.class,
                () -> new PortMatrix(scalar(1, 0), ParameterType.G).convert(ParameterType.Z));
    }

    @Test
    void impedanceCannotBeGivenForNonScatteringTarget() {
        assertThrows(ImpedanceRuleViolationException.class,
                () -> lineZ().convert(ParameterType.Y, 50.0));
    }

    @Test
    void scatteringToScatteringKeepsImpedanceWhenOmitted() {
        PortMatrix s = new PortMatrix(scalar(0.2, 0.1), ParameterType.S, 75.0);

        assertSame(s, s.convert(ParameterType.S));
    }

    @Test
    void renormalizeMovesReferencePlane() {
        // 50 Ω 基準で Z = 100 Ω の反射係数 1/3
        PortMatrix s = new PortMatrix(scalar(1.0 / 3.0, 0), ParameterType.S, 50.0);

        assertMatrixEquals(scalar(0, 0), s.renormalize(100.0).toMatrix());
        assertMatrixEquals(scalar(1.0 / 7.0, 0), s.renormalize(75.0).toMatrix());
        assertEquals(75.0, s.renormalize(75.0).getReferenceImpedance());
    }

    @Test
    void renormalizeAgreesWithConversionThroughImpedance() {
        PortMatrix s = lineZ().convert(ParameterType.S, 50.0);

        PortMatrix direct = s.renormalize(30.0);
        PortMatrix viaZ = s.convert(ParameterType.Z).convert(ParameterType.S, 30.0);

        assertTrue(direct.approximatelyEquals(viaZ, 1e-10));
        assertTrue(direct.approximatelyEquals(s.convert(ParameterType.S, 30.0), 0.0));
    }

    @Test
    void renormalizeToSameImpedanceReturnsSameInstance() {
        PortMatrix s = new PortMatrix(scalar(0.3, 0), ParameterType.S, 50.0);

        assertSame(s, s.renormalize(50.0));
        PortMatrix once = s.renormalize(60.0);
        assertSame(once, once.renormalize(60.0));
    }

    @Test
    void renormalizeRequiresScattering() {
        assertThrows(UnsupportedConversionException.class, () -> lineZ().renormalize(75.0));
    }

    @Test
    void recombinePairGivesDifferentialImpedance() {
        PortMatrix z = PortMatrix.of(new double[][] {{5, 2}, {3, 7}},
                new double[][] {{1, 0}, {0, 2}}, ParameterType.Z, null);

        PortMatrix diff = z.recombine(List.of(PortSpec.pair(1, 2)));

        assertEquals(1, diff.ports());
        // z11 − z12 − z21 + z22
        assertComplexEquals(7, 3, diff.parameter(1, 1));
    }

    @Test
    void recombineNegativePortFlipsPolarity() {
        PortMatrix z = PortMatrix.of(new double[][] {{5, 2}, {3, 7}}, null, ParameterType.Z,
                null);

        PortMatrix r = z.recombine(List.of(PortSpec.single(1), PortSpec.single(-2)));

        assertMatrixEquals(real(new double[][] {{5, -2}, {-3, 7}}), r.toMatrix());
        assertEquals(z, z.recombine(List.of(PortSpec.single(1), PortSpec.single(2))));
    }

    @Test
    void recombineFourPortIntoTwoDifferentialPorts() {
        PortMatrix z = fourPort();

        PortMatrix r = z.recombine(List.of(PortSpec.pair(1, 3), PortSpec.pair(2, 4)));

        assertEquals(2, r.ports());
        // (1,3)-(2,4) 要素: z12 − z14 − z32 + z34
        assertComplexEquals(12 - 14 - 32 + 34, -1 + 3 - 1 - 1, r.parameter(1, 2));
    }

    @Test
    void recombineRejectsInvalidUse() {
        assertThrows(PortIndexException.class,
                () -> lineZ().recombine(List.of(PortSpec.single(3))));
        assertThrows(ShapeMismatchException.class, () -> lineZ().recombine(List.of()));
        assertThrows(UnsupportedConversionException.class, () -> lineZ()
                .convert(ParameterType.S).recombine(List.of(PortSpec.pair(1, 2))));
    }

    @Test
    void submatrixKeepsRequestedPortsInOrder() {
        PortMatrix sub = fourPort().submatrix(3, 1);

        assertEquals(2, sub.ports());
        assertComplexEquals(33, 0, sub.parameter(1, 1));
        assertComplexEquals(31, 2, sub.parameter(1, 2));
        assertComplexEquals(13, -2, sub.parameter(2, 1));
        assertThrows(PortIndexException.class, () -> fourPort().submatrix(5));
    }

    @Test
    void defaultTwoNPortSplitEqualsExplicitHalves() {
        PortMatrix m = fourPort();

        TwoNPortMatrix def = m.twoNPortMatrix();
        TwoNPortMatrix explicit = m.twoNPortMatrix(new int[] {1, 2}, new int[] {3, 4});

        assertEquals(2, def.getHalfPorts());
        for (int i = 0; i < 2; i++) {
            for (int j = 0; j < 2; j++) {
                assertMatrixEquals(def.block(i, j), explicit.block(i, j), 0.0);
            }
        }
        assertEquals(m, def.toPortMatrix());
    }

    @Test
    void twoNPortPermutesPortsBeforeSplitting() {
        TwoNPortMatrix t = fourPort().twoNPortMatrix(new int[] {1, 3}, new int[] {2, 4});

        assertMatrixEquals(ComplexMatrices.of(new double[][] {{11, 13}, {31, 33}},
                new double[][] {{0, -2}, {2, 0}}), t.block(0, 0));
        assertMatrixEquals(ComplexMatrices.of(new double[][] {{12, 14}, {32, 34}},
                new double[][] {{-1, -3}, {1, -1}}), t.block(0, 1));
    }

    @Test
    void twoNPortRejectsBadPartitions() {
        PortMatrix m = fourPort();

        assertThrows(ShapeMismatchException.class,
                () -> m.twoNPortMatrix(new int[] {1, 1}, new int[] {3, 4}));
        assertThrows(ShapeMismatchException.class,
                () -> m.twoNPortMatrix(new int[] {1}, new int[] {2, 3, 4}));
        assertThrows(ShapeMismatchException.class,
                () -> m.twoNPortMatrix(new int[] {1, 2}, null));
        assertThrows(PortIndexException.class,
                () -> m.twoNPortMatrix(new int[] {1, 2}, new int[] {3, 5}));
        assertThrows(ShapeMismatchException.class,
                () -> fourPort().submatrix(1, 2, 3).twoNPortMatrix());
    }

    @Test
    void passivityFollowsRowPowerSums() {
        assertTrue(new PortMatrix(new ZMatrixRMaj(2, 2), ParameterType.S).isPassive());
        assertFalse(PortMatrix.of(new double[][] {{0.8, 0.7}, {0, 0}}, null, ParameterType.S,
                null).isPassive());
    }

    @Test
    void passivityOfImpedanceIsCheckedInScattering() {
        assertTrue(new PortMatrix(scalar(100, 0), ParameterType.Z).isPassive());
        // 負性抵抗は S = −3
        assertFalse(new PortMatrix(scalar(-25, 0), ParameterType.Z).isPassive());
        assertTrue(lineZ().isPassive());
    }

    @Test
    void reciprocityAndSymmetryAreNotImplemented() {
        assertThrows(UnsupportedOperationException.class, () -> lineZ().isReciprocal());
        assertThrows(UnsupportedOperationException.class, () -> lineZ().isSymmetrical());
    }

    @Test
    void inputMatrixIsCopied() {
        ZMatrixRMaj raw = scalar(1, 0);
        PortMatrix m = new PortMatrix(raw, ParameterType.Z);

        raw.set(0, 0, 9, 9);
        m.toMatrix().set(0, 0, 8, 8);

        assertComplexEquals(1, 0, m.parameter(1, 1));
        assertEquals(1, m.ports());
    }

    @Test
    void nanMatrixDiffersFromFiniteMatrix() {
        PortMatrix nan = new PortMatrix(scalar(Double.NaN, 0), ParameterType.Z);
        PortMatrix one = new PortMatrix(scalar(1, 0), ParameterType.Z);

        assertNotEquals(one, nan);
        assertNotEquals(nan, one);
        assertFalse(nan.approximatelyEquals(one, 1e-9));
        assertEquals(nan, new PortMatrix(scalar(Double.NaN, 0), ParameterType.Z));
    }

    @Test
    void signedZeroEntriesAreEqualWithSameHash() {
        PortMatrix positive = new PortMatrix(scalar(0.0, 0.0), ParameterType.Z);
        PortMatrix negative = new PortMatrix(scalar(-0.0, -0.0), ParameterType.Z);
        Set<PortMatrix> set = new HashSet<>();
        set.add(positive);

        assertEquals(positive, negative);
        assertEquals(positive.hashCode(), negative.hashCode());
        assertTrue(set.contains(negative));
    }

    @Test
    void recombinedNegativeZeroMatchesPlainZero() {
        PortMatrix z = PortMatrix.of(new double[][] {{0, 0}, {0, 0}}, null, ParameterType.Z,
                null);

        PortMatrix flipped = z.recombine(List.of(PortSpec.single(-1), PortSpec.single(2)));

        assertEquals(z, flipped);
        assertTrue(new HashSet<>(List.of(z)).contains(flipped));
    }

    @Test
    void transferTargetIsRejectedBeforeImpedanceRule() {
        assertThrows(UnsupportedConversionException.class,
                () -> lineZ().convert(ParameterType.ABCD, 50.0));
        assertThrows(UnsupportedConversionException.class,
                () -> lineZ().convert(ParameterType.T, 50.0));
        assertThrows(UnsupportedConversionException.class,
                () -> lineZ().convert(ParameterType.H, 50.0));
    }
}
