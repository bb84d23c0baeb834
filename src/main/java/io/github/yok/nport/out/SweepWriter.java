package io.github.yok.nport.out;

import io.github.yok.nport.core.analysis.SweepAnalyzer;

/**
 * 解析結果を出力する処理のインタフェースです。
 */
public interface SweepWriter {

    /**
     * 解析結果（処理後のスイープと受動性）を出力します。
     *
     * @param result 解析結果です
     */
    void write(SweepAnalyzer.AnalysisResult result);
}
