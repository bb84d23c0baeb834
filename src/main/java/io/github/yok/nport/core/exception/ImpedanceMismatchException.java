package io.github.yok.nport.core.exception;

/**
 * 二項演算の両オペランドで参照インピーダンスが異なる場合に発生する例外です。
 */
public class ImpedanceMismatchException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     */
    public ImpedanceMismatchException(String message) {
        super(message);
    }
}
