package io.github.yok.nport.out;

import io.github.yok.nport.core.analysis.SweepAnalyzer;
import io.github.yok.nport.core.sweep.FrequencySweep;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.ejml.data.Complex_F64;

/**
 * 解析結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（X は種別）。
 * </p>
 *
 * <ul>
 * <li>{@code nport_parameters_X.csv}（周波数・行ポート・列ポートごとの実部/虚部）</li>
 * <li>{@code nport_meta_X.csv}（種別、参照インピーダンス、ポート数、受動性など）</li>
 * </ul>
 */
public final class CsvSweepWriter implements SweepWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "nport";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvSweepWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 解析結果を出力します。
     *
     * @param result 解析結果です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(SweepAnalyzer.AnalysisResult result) {
        if (result == null || result.getSweep() == null) {
            throw new IllegalArgumentException("result は null 不可です");
        }

        try {
            Files.createDirectories(outputDir);

            // 1) パラメータ値
            writeParametersCsv(result.getSweep());

            // 2) メタ情報
            writeMetaCsv(result);

        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * 周波数・行ポート・列ポートごとのパラメータ値を出力します。
     *
     * @param sweep 周波数スイープです
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeParametersCsv(FrequencySweep sweep) throws IOException {
        Path file = outputDir.resolve(buildFileName("parameters", sweep));
        double[] freqs = sweep.frequencies();
        int ports = sweep.ports();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("frequency", "row", "col", "real", "imag").build().print(w)) {

            for (int row = 1; row <= ports; row++) {
                for (int col = 1; col <= ports; col++) {
                    Complex_F64[] values = sweep.parameter(row, col);
                    for (int i = 0; i < freqs.length; i++) {
                        pr.printRecord(freqs[i], row, col, values[i].real, values[i].imaginary);
                    }
                }
            }
        }
    }

    /**
     * メタ情報を出力します。
     *
     * @param result 解析結果です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeMetaCsv(SweepAnalyzer.AnalysisResult result) throws IOException {
        FrequencySweep sweep = result.getSweep();
        Path file = outputDir.resolve(buildFileName("meta", sweep));
        double[] freqs = sweep.frequencies();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("type", sweep.getType());
            pr.printRecord("referenceImpedance", sweep.getReferenceImpedance());
            pr.printRecord("ports", sweep.ports());
            pr.printRecord("samples", sweep.size());
            pr.printRecord("frequency.min", freqs[0]);
            pr.printRecord("frequency.max", freqs[freqs.length - 1]);
            pr.printRecord("passive", result.getPassive());
        }
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * @param kind 出力の識別子（parameters/meta）
     * @param sweep 周波数スイープです
     * @return ファイル名です
     */
    private static String buildFileName(String kind, FrequencySweep sweep) {
        return FILE_HEAD + "_" + kind + "_" + sweep.getType() + ".csv";
    }
}
