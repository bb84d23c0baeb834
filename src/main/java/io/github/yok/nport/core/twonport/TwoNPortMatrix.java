package io.github.yok.nport.core.twonport;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.nport.core.exception.ShapeMismatchException;
import io.github.yok.nport.core.linearalgebra.ComplexMatrices;
import io.github.yok.nport.core.parameter.ParameterType;
import io.github.yok.nport.core.port.PortMatrix;
import lombok.AccessLevel;
import lombok.Getter;
import org.ejml.data.ZMatrixRMaj;

/**
 * 2n ポート行列を 2×2 のブロック（各 n×n）として保持するクラスです。
 *
 * <p>
 * ブロックの並びは (入力-入力, 入力-出力; 出力-入力, 出力-出力) です。 ABCD/T などブロック前提の表現は、この形式を介して扱います。
 * </p>
 */
@Getter
public final class TwoNPortMatrix {

    /**
     * パラメータ種別です。
     */
    private final ParameterType type;

    /**
     * 参照インピーダンスです（S/T 以外では null）。
     */
    private final Double referenceImpedance;

    /**
     * 片側のポート数 n です。
     */
    private final int halfPorts;

    /**
     * 2×2 のブロック配列です。
     */
    @Getter(AccessLevel.NONE)
    private final ZMatrixRMaj[][] blocks;

    /**
     * ブロック行列を生成します。
     *
     * @param blocks 2×2 のブロック配列です（各 n×n、コピーして保持します）
     * @param type パラメータ種別です
     * @param referenceImpedance 参照インピーダンスです（null 可）
     * @throws ShapeMismatchException ブロックが 2×2 でない、または各ブロックが同じ n×n でない場合に発生します
     */
    public TwoNPortMatrix(ZMatrixRMaj[][] blocks, ParameterType type, Double referenceImpedance) {
        checkNotNull(blocks, "blocks は null 不可です");
        this.type = checkNotNull(type, "type は null 不可です");
        this.referenceImpedance = type.checkReferenceImpedance(referenceImpedance);

        if (blocks.length != 2 || blocks[0].length != 2 || blocks[1].length != 2) {
            throw new ShapeMismatchException("ブロック配列は 2×2 である必要があります");
        }
        int n = blocks[0][0].numRows;
        this.blocks = new ZMatrixRMaj[2][2];
        for (int i = 0; i < 2; i++) {
            for (int j = 0; j < 2; j++) {
                ZMatrixRMaj b = checkNotNull(blocks[i][j], "ブロックに null が含まれています");
                if (b.numRows != n || b.numCols != n) {
                    throw new ShapeMismatchException("ブロック (" + i + ", " + j + ") は " + n + "x" + n
                            + " である必要があります: " + b.numRows + "x" + b.numCols);
                }
                this.blocks[i][j] = b.copy();
            }
        }
        this.halfPorts = n;
    }

    /**
     * ブロック (row, col) のコピーを返します。
     *
     * @param row ブロック行（0 または 1）です
     * @param col ブロック列（0 または 1）です
     * @return n×n のブロックです
     */
    public ZMatrixRMaj block(int row, int col) {
        checkArgument(row == 0 || row == 1, "ブロック行は 0 または 1 です: %s", row);
        checkArgument(col == 0 || col == 1, "ブロック列は 0 または 1 です: %s", col);
        return blocks[row][col].copy();
    }

    /**
     * ブロック行列積 {@code this · other} を返します。
     *
     * <p>
     * (A, B; C, D)·(E, F; G, H) = (AE+BG, AF+BH; CE+DG, CF+DH) です。 結果の種別・参照インピーダンスは左オペランドを引き継ぎます。
     * </p>
     *
     * @param other 右オペランドです
     * @return ブロック行列積です
     * @throws ShapeMismatchException ブロックの次元が一致しない場合に発生します
     */
    public TwoNPortMatrix multiply(TwoNPortMatrix other) {
        checkNotNull(other, "other は null 不可です");
        if (other.halfPorts != halfPorts) {
            throw new ShapeMismatchException(
                    "ブロックの次元が一致しません: " + halfPorts + " != " + other.halfPorts);
        }
        ZMatrixRMaj[][] r = other.blocks;
        ZMatrixRMaj[][] out = new ZMatrixRMaj[2][2];
        for (int i = 0; i < 2; i++) {
            for (int j = 0; j < 2; j++) {
                out[i][j] = ComplexMatrices.add(ComplexMatrices.mult(blocks[i][0], r[0][j]),
                        ComplexMatrices.mult(blocks[i][1], r[1][j]));
            }
        }
        return new TwoNPortMatrix(out, type, referenceImpedance);
    }

    /**
     * ブロックを組み立て直した 2n×2n の行列を返します（ポート順は 入力…, 出力…）。
     *
     * @return 2n ポート行列です
     */
    public PortMatrix toPortMatrix() {
        ZMatrixRMaj full =
                ComplexMatrices.assemble(blocks[0][0], blocks[0][1], blocks[1][0], blocks[1][1]);
        return new PortMatrix(full, type, referenceImpedance);
    }
}
