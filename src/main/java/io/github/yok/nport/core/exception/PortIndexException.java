package io.github.yok.nport.core.exception;

/**
 * ポート番号が 0、またはポート数を超える場合に発生する例外です。
 */
public class PortIndexException extends IndexOutOfBoundsException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     */
    public PortIndexException(String message) {
        super(message);
    }
}
