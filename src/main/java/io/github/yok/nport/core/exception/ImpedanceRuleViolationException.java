package io.github.yok.nport.core.exception;

/**
 * 参照インピーダンスの指定規則（S/T のみ指定可）に違反した場合に発生する例外です。
 */
public class ImpedanceRuleViolationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     */
    public ImpedanceRuleViolationException(String message) {
        super(message);
    }
}
