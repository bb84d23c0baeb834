package io.github.yok.nport.core.exception;

/**
 * 要求された変換・操作が現在のパラメータ種別では実行できない場合に発生する例外です。
 *
 * <p>
 * ABCD/T への変換（2n ポートのブロック表現が必要）や、S 専用・Z 専用の操作を 他の種別に対して呼び出した場合が該当します。
 * </p>
 */
public class UnsupportedConversionException extends UnsupportedOperationException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     */
    public UnsupportedConversionException(String message) {
        super(message);
    }
}
