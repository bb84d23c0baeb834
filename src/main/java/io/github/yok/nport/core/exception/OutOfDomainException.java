package io.github.yok.nport.core.exception;

/**
 * 標本化された周波数範囲の外側を補間しようとした場合に発生する例外です。
 */
public class OutOfDomainException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     */
    public OutOfDomainException(String message) {
        super(message);
    }
}
