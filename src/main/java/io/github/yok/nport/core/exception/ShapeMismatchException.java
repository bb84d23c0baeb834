package io.github.yok.nport.core.exception;

/**
 * 行列形状・ポート数・周波数点数が整合しない場合に発生する例外です。
 */
public class ShapeMismatchException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     */
    public ShapeMismatchException(String message) {
        super(message);
    }
}
