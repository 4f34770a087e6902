package org.nowstart.squeezewatch.backtest.runner;

import org.nowstart.squeezewatch.Application;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;

/**
 * Offline entry point: runs the batch backtest without the web server or the live monitor.
 */
public class BacktestMain {

    public static void main(String[] args) {
        try (var ignored = new SpringApplicationBuilder(Application.class)
                .web(WebApplicationType.NONE)
                .logStartupInfo(false)
                .properties(
                        "squeezewatch.backtest.enabled=true",
                        "squeezewatch.monitor.auto-start=false"
                )
                .run(args)) {
            // ApplicationRunner beans execute during startup.
        }
    }
}
