package io.github.yok.nport.app;

import io.github.yok.nport.core.analysis.SweepAnalyzer;
import io.github.yok.nport.core.sweep.FrequencySweep;
import io.github.yok.nport.out.SweepWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で nport-solver を実行するクラスです。
 *
 * <p>
 * 設定されたデバイスのスイープに解析処理を適用し、結果を出力します。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NportCliRunner implements CommandLineRunner {

    /**
     * nport-solver の設定値（nport.*）です。
     */
    private final NportProperties properties;

    /**
     * 解析対象デバイスのスイープです。
     */
    private final FrequencySweep deviceSweep;

    /**
     * 解析処理です。
     */
    private final SweepAnalyzer sweepAnalyzer;

    /**
     * 結果出力ロジックです。
     */
    private final SweepWriter sweepWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== nport-solver start: analyze n-port sweep ===");
        System.out.print(properties.toMultilineString());

        SweepAnalyzer.AnalysisResult result = sweepAnalyzer.analyze(deviceSweep);

        sweepWriter.write(result);

        FrequencySweep sweep = result.getSweep();
        System.out.println("結果: type=" + sweep.getType() + ", z0=" + sweep.getReferenceImpedance()
                + ", ports=" + sweep.ports() + ", samples=" + sweep.size() + ", passive="
                + result.getPassive());
        log.info("出力が完了しました。出力先={}", properties.getOutput().getDir());
    }
}
