package io.github.yok.nport.core.exception;

/**
 * 逆行列の計算に失敗した（特異行列）場合に発生する例外です。
 */
public class SingularMatrixException extends ArithmeticException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     */
    public SingularMatrixException(String message) {
        super(message);
    }
}
