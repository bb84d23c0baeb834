package io.github.yok.nport.core.exception;

/**
 * 二項演算の両オペランドでパラメータ種別が異なる場合に発生する例外です。
 */
public class TypeMismatchException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     */
    public TypeMismatchException(String message) {
        super(message);
    }
}
