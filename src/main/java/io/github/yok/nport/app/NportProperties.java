package io.github.yok.nport.app;

import java.util.ArrayList;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * nport-solver の設定値（nport.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "nport")
public class NportProperties {

    /**
     * 解析対象デバイスの設定です。
     */
    @Valid
    private Device device = new Device();

    /**
     * 解析処理の設定です。
     */
    @Valid
    private Analysis analysis = new Analysis();

    /**
     * 出力設定です。
     */
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "nport")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Device d = getDevice();
        Analysis a = getAnalysis();
        Output o = getOutput();

        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "device",
                // type: パラメータ種別
                "type", d.getType(),
                // referenceImpedance: 参照インピーダンス（S/T のみ）
                "referenceImpedance", d.getReferenceImpedance(),
                // samples: 周波数標本の数
                "samples", d.getSamples().size());

        appendSection(sb, nl, "analysis",
                // recombine: ポート再結合の定義
                "recombine", a.getRecombine(),
                // averageWindow: 移動平均の窓幅
                "averageWindow", a.getAverageWindow(),
                // frequencies: 再標本化する周波数
                "frequencies", a.getFrequencies(),
                // targetType: 変換先の種別
                "targetType", a.getTargetType(),
                // targetReferenceImpedance: 変換先の参照インピーダンス
                "targetReferenceImpedance", a.getTargetReferenceImpedance());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", o.getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Device {

        /**
         * パラメータ種別（Z, Y, S, T, H, G, ABCD または IMPEDANCE などの別名）です。
         */
        @NotNull
        private String type = "Z";

        /**
         * 参照インピーダンスです（S/T のみ、省略時 50.0）。
         */
        private Double referenceImpedance;

        /**
         * 周波数標本の一覧です。
         */
        @Valid
        @NotEmpty
        private List<Sample> samples = new ArrayList<>();
    }

    @Data
    public static class Sample {

        /**
         * 周波数（Hz）です。
         */
        private double frequency;

        /**
         * 行列の実部（行の一覧）です。
         */
        @NotEmpty
        private List<List<Double>> real = new ArrayList<>();

        /**
         * 行列の虚部（行の一覧、省略時は 0）です。
         */
        private List<List<Double>> imag = new ArrayList<>();
    }

    @Data
    public static class Analysis {

        /**
         * ポート再結合の定義です（例: "1,3", "2", "-4"）。
         */
        private List<String> recombine = new ArrayList<>();

        /**
         * 移動平均の窓幅です（1 は平均化なし）。
         */
        @Min(1)
        private int averageWindow = 1;

        /**
         * 再標本化する周波数の一覧です（空は再標本化なし）。
         */
        private List<Double> frequencies = new ArrayList<>();

        /**
         * 変換先の種別です（未指定は変換なし）。
         */
        private String targetType;

        /**
         * 変換先の参照インピーダンスです（S のみ）。
         */
        private Double targetReferenceImpedance;
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        private String dir = "./out";
    }
}
