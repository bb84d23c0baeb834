package io.github.yok.nport.core.exception;

/**
 * 認識できないパラメータ種別が指定された場合に発生する例外です。
 */
public class InvalidParameterTypeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     */
    public InvalidParameterTypeException(String message) {
        super(message);
    }
}
