package io.github.yok.nport.core.parameter;

import io.github.yok.nport.core.exception.ImpedanceRuleViolationException;
import io.github.yok.nport.core.exception.InvalidParameterTypeException;
import java.util.Locale;

/**
 * n ポート行列のパラメータ種別を表す列挙型です。
 *
 * <p>
 * S（散乱）と T（散乱伝達）のみが参照インピーダンスを必要とし、 それ以外の種別では参照インピーダンスを指定できません。
 * </p>
 */
public enum ParameterType {

    /**
     * インピーダンス行列です。
     */
    Z("IMPEDANCE"),

    /**
     * アドミタンス行列です。
     */
    Y("ADMITTANCE"),

    /**
     * 散乱行列です。
     */
    S("SCATTERING"),

    /**
     * 散乱伝達行列です。
     */
    T("SCATTERING_TRANSFER"),

    /**
     * ハイブリッド行列です。
     */
    H("HYBRID"),

    /**
     * 逆ハイブリッド行列です。
     */
    G("INVERSE_HYBRID"),

    /**
     * 伝送（ABCD）行列です。
     */
    ABCD("TRANSMISSION");

    /**
     * 参照インピーダンス省略時の既定値（Ω）です。
     */
    public static final double DEFAULT_REFERENCE_IMPEDANCE = 50.0;

    /**
     * 種別の別名です。
     */
    private final String alias;

    ParameterType(String alias) {
        this.alias = alias;
    }

    /**
     * この種別が参照インピーダンスを必要とするかどうかを返します。
     *
     * @return S または T の場合に true です
     */
    public boolean requiresReferenceImpedance() {
        return this == S || this == T;
    }

    /**
     * 行列生成時の参照インピーダンス規則を適用します。
     *
     * <p>
     * S/T で未指定の場合は既定値 50.0 を返します。 それ以外の種別で指定された場合は例外です。
     * </p>
     *
     * @param referenceImpedance 指定された参照インピーダンスです（null 可）
     * @return この種別に対する参照インピーダンスです（S/T 以外では null）
     * @throws ImpedanceRuleViolationException 指定不可の種別に指定された場合、または正の有限値でない場合に発生します
     */
    public Double checkReferenceImpedance(Double referenceImpedance) {
        if (!requiresReferenceImpedance()) {
            if (referenceImpedance != null) {
                throw new ImpedanceRuleViolationException(
                        "指定された表現（" + this + "）は参照インピーダンスを必要としません: " + referenceImpedance);
            }
            return null;
        }
        if (referenceImpedance == null) {
            return DEFAULT_REFERENCE_IMPEDANCE;
        }
        checkPositiveFinite(referenceImpedance);
        return referenceImpedance;
    }

    /**
     * 変換先としてこの種別を指定したときの参照インピーダンスを決定します。
     *
     * <p>
     * S/T への変換で未指定の場合、変換元が S/T ならその参照インピーダンスを引き継ぎ、 そうでなければ既定値 50.0 とします。
     * </p>
     *
     * @param source 変換元の種別です
     * @param sourceImpedance 変換元の参照インピーダンスです（null 可）
     * @param requested 指定された変換先の参照インピーダンスです（null 可）
     * @return 変換先の参照インピーダンスです（S/T 以外では null）
     * @throws ImpedanceRuleViolationException 指定不可の種別に指定された場合に発生します
     */
    public Double resolveTargetImpedance(ParameterType source, Double sourceImpedance,
            Double requested) {
        if (requiresReferenceImpedance() && requested == null) {
            if (source.requiresReferenceImpedance() && sourceImpedance != null) {
                return sourceImpedance;
            }
            return DEFAULT_REFERENCE_IMPEDANCE;
        }
        return checkReferenceImpedance(requested);
    }

    /**
     * 記号または別名から種別を取得します（大文字小文字は区別しません）。
     *
     * @param symbol 記号（Z, Y, S, T, H, G, ABCD）または別名（IMPEDANCE など）です
     * @return 種別です
     * @throws InvalidParameterTypeException 該当する種別がない場合に発生します
     */
    public static ParameterType fromSymbol(String symbol) {
        if (symbol == null) {
            throw new InvalidParameterTypeException("パラメータ種別が指定されていません");
        }
        String key = symbol.trim().toUpperCase(Locale.ROOT);
        for (ParameterType type : values()) {
            if (type.name().equals(key) || type.alias.equals(key)) {
                return type;
            }
        }
        throw new InvalidParameterTypeException("不正なパラメータ種別です: " + symbol);
    }

    private static void checkPositiveFinite(double z0) {
        if (!(z0 > 0.0) || Double.isInfinite(z0)) {
            throw new ImpedanceRuleViolationException("参照インピーダンスは正の有限値が必要です: " + z0);
        }
    }
}
