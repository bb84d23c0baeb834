package io.github.yok.nport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * nport-solver のエントリポイントです。
 *
 * <p>
 * 設定クラス（@ConfigurationProperties）をスキャンし、CLI 実行を開始します。
 * </p>
 */
@SpringBootApplication
@ConfigurationPropertiesScan(basePackages = "io.github.yok.nport")
public class NportSolverApplication {

    /**
     * Spring Boot アプリケーションを起動します。
     *
     * @param args 起動引数です
     */
    public static void main(String[] args) {
        SpringApplication.run(NportSolverApplication.class, args);
    }
}
