package org.csits.reportd;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.reportd.server.dto.SweepSummary;
import org.csits.reportd.server.service.ScheduledReportService;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.ComponentScan;

/**
 * 启动类。默认常驻，由 xxl-job 周期触发；带 --sweep 参数时执行一次后退出。
 *
 * 示例：
 *  java -jar reportd-start.jar --sweep
 */
@Slf4j
@SpringBootApplication
@ComponentScan(basePackages = "org.csits.reportd")
@RequiredArgsConstructor
public class ReportdApplication implements CommandLineRunner {

    static final String SWEEP_ARG = "--sweep";

    private final ScheduledReportService scheduledReportService;

    public static void main(String[] args) {
        if (hasSweepArg(args)) {
            ConfigurableApplicationContext context = new SpringApplicationBuilder(ReportdApplication.class)
                .web(WebApplicationType.NONE)
                .properties("xxl.job.enabled=false")
                .run(args);
            System.exit(SpringApplication.exit(context));
        }
        SpringApplication.run(ReportdApplication.class, args);
    }

    @Override
    public void run(String... args) throws Exception {
        if (!hasSweepArg(args)) {
            log.info("未指定 {}，以常驻模式启动", SWEEP_ARG);
            return;
        }
        SweepSummary summary = scheduledReportService.executeScheduledReports().get();
        if (summary.getError() != null) {
            log.error("单次执行失败: {}", summary.getError());
            return;
        }
        log.info("单次执行完成: checked={}, executed={}, success={}, failed={}",
            summary.getTotalReportsChecked(), summary.getReportsExecuted(),
            summary.getSuccessfulExecutions(), summary.getFailedExecutions());
    }

    static boolean hasSweepArg(String... args) {
        for (String arg : args) {
            if (SWEEP_ARG.equals(arg)) {
                return true;
            }
        }
        return false;
    }
}
