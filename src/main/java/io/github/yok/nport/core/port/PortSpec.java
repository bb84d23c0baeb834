package io.github.yok.nport.core.port;

import io.github.yok.nport.core.exception.PortIndexException;
import lombok.EqualsAndHashCode;

/**
 * ポート再結合（{@link PortMatrix#recombine(java.util.List)}）における 1 つの新ポートの定義です。
 *
 * <ul>
 * <li>単一ポート：元ポートをそのまま残します。負のポート番号は極性反転を意味します。</li>
 * <li>ポート対 (p, q)：ポート p をポート q を基準（グランド）とした差動ポートにします。</li>
 * </ul>
 */
@EqualsAndHashCode
public final class PortSpec {

    /**
     * 正側のポート番号（1 始まり、単一ポートの場合は符号付き）です。
     */
    private final int port;

    /**
     * 基準側のポート番号（1 始まり）です。単一ポートの場合は 0 です。
     */
    private final int reference;

    private PortSpec(int port, int reference) {
        this.port = port;
        this.reference = reference;
    }

    /**
     * 単一ポートの定義を生成します。
     *
     * @param signedPort 符号付きポート番号です（負は極性反転）
     * @return ポート定義です
     * @throws PortIndexException ポート番号が 0 の場合に発生します
     */
    public static PortSpec single(int signedPort) {
        if (signedPort == 0) {
            throw new PortIndexException("ポート番号 0 は指定できません（1 始まりです）");
        }
        return new PortSpec(signedPort, 0);
    }

    /**
     * 差動ポートの定義を生成します。
     *
     * @param port 正側のポート番号です（1 以上）
     * @param reference 基準側のポート番号です（1 以上）
     * @return ポート定義です
     * @throws PortIndexException ポート番号が 1 未満の場合に発生します
     */
    public static PortSpec pair(int port, int reference) {
        if (port < 1 || reference < 1) {
            throw new PortIndexException(
                    "差動ポートのポート番号は 1 以上が必要です: (" + port + ", " + reference + ")");
        }
        return new PortSpec(port, reference);
    }

    /**
     * 文字列表現（{@code "3"}, {@code "-2"}, {@code "1,3"}）から定義を生成します。
     *
     * @param text 文字列表現です
     * @return ポート定義です
     * @throws IllegalArgumentException 書式が不正な場合に発生します
     */
    public static PortSpec parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("ポート定義が空です");
        }
        String[] parts = text.replace("(", "").replace(")", "").split(",");
        try {
            if (parts.length == 1) {
                return single(Integer.parseInt(parts[0].trim()));
            }
            if (parts.length == 2) {
                return pair(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("ポート定義の書式が不正です: " + text, e);
        }
        throw new IllegalArgumentException("ポート定義の書式が不正です: " + text);
    }

    /**
     * 差動ポート（ポート対）かどうかを返します。
     *
     * @return ポート対の場合に true です
     */
    public boolean isPair() {
        return reference != 0;
    }

    /**
     * 変換行列 M のこの定義に対応する行を書き込みます。
     *
     * @param row 書き込み先の行（長さ = 元ポート数、0 初期化済み）です
     * @throws PortIndexException ポート番号が元ポート数を超える場合に発生します
     */
    void fillTransformRow(double[] row) {
        int ports = row.length;
        if (isPair()) {
            checkInRange(port, ports);
            checkInRange(reference, ports);
            row[port - 1] = 1.0;
            row[reference - 1] = -1.0;
        } else {
            int p = Math.abs(port);
            checkInRange(p, ports);
            row[p - 1] = port > 0 ? 1.0 : -1.0;
        }
    }

    private static void checkInRange(int p, int ports) {
        if (p < 1 || p > ports) {
            throw new PortIndexException("指定されたポート番号がポート数を超えています: " + p + " > " + ports);
        }
    }

    @Override
    public String toString() {
        return isPair() ? "(" + port + "," + reference + ")" : Integer.toString(port);
    }
}
