package io.github.yok.nport.app;

import io.github.yok.nport.core.analysis.SweepAnalyzer;
import io.github.yok.nport.core.linearalgebra.ComplexMatrices;
import io.github.yok.nport.core.parameter.ParameterType;
import io.github.yok.nport.core.port.PortSpec;
import io.github.yok.nport.core.sweep.FrequencySweep;
import io.github.yok.nport.out.CsvSweepWriter;
import io.github.yok.nport.out.SweepWriter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.ejml.data.ZMatrixRMaj;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * デバイスのスイープ・解析処理・結果出力の Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class NportConfiguration {

    /**
     * nport-solver の設定値（nport.*）です。
     */
    private final NportProperties p;

    /**
     * 設定されたデバイスの周波数スイープを生成します。
     *
     * @return 周波数スイープです
     */
    @Bean
    public FrequencySweep deviceSweep() {
        return toSweep(p.getDevice());
    }

    /**
     * 解析処理を生成します。
     *
     * @return 解析処理です
     */
    @Bean
    public SweepAnalyzer sweepAnalyzer() {
        return toAnalyzer(p.getAnalysis());
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public SweepWriter sweepWriter() {
        return new CsvSweepWriter(p.getOutput().getDir());
    }

    /**
     * デバイス設定から周波数スイープを生成します（標本は周波数順に並べ替えます）。
     *
     * @param device デバイス設定です
     * @return 周波数スイープです
     * @throws IllegalArgumentException 標本が空の場合に発生します
     */
    static FrequencySweep toSweep(NportProperties.Device device) {
        List<NportProperties.Sample> samples = new ArrayList<>(device.getSamples());
        if (samples.isEmpty()) {
            throw new IllegalArgumentException("nport.device.samples は 1 件以上が必要です");
        }
        samples.sort(Comparator.comparingDouble(NportProperties.Sample::getFrequency));

        double[] freqs = new double[samples.size()];
        ZMatrixRMaj[] matrices = new ZMatrixRMaj[samples.size()];
        for (int i = 0; i < samples.size(); i++) {
            NportProperties.Sample s = samples.get(i);
            freqs[i] = s.getFrequency();
            double[][] imag = s.getImag().isEmpty() ? null : toArray(s.getImag());
            matrices[i] = ComplexMatrices.of(toArray(s.getReal()), imag);
        }
        return new FrequencySweep(freqs, matrices, ParameterType.fromSymbol(device.getType()),
                device.getReferenceImpedance());
    }

    /**
     * 解析設定から解析処理を生成します。
     *
     * @param analysis 解析設定です
     * @return 解析処理です
     */
    static SweepAnalyzer toAnalyzer(NportProperties.Analysis analysis) {
        List<PortSpec> specs = new ArrayList<>();
        for (String text : analysis.getRecombine()) {
            specs.add(PortSpec.parse(text));
        }
        double[] freqs = analysis.getFrequencies().stream().mapToDouble(Double::doubleValue)
                .toArray();
        ParameterType target = analysis.getTargetType() == null ? null
                : ParameterType.fromSymbol(analysis.getTargetType());
        return new SweepAnalyzer(specs, analysis.getAverageWindow(), freqs, target,
                analysis.getTargetReferenceImpedance());
    }

    private static double[][] toArray(List<List<Double>> rows) {
        double[][] out = new double[rows.size()][];
        for (int r = 0; r < rows.size(); r++) {
            out[r] = rows.get(r).stream().mapToDouble(Double::doubleValue).toArray();
        }
        return out;
    }
}
