package com.example.apirecovery.recovery;

import com.example.apirecovery.model.HealthLevel;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;
import java.util.Locale;

@Data
@AllArgsConstructor
public class RecoveryReport {
    private Summary summary;
    private ErrorRecoveryStats details;
    private List<String> recommendations;
    private Trends trends;

    static RecoveryReport of(ErrorRecoveryStats stats, HealthStatus health) {
        Summary summary = new Summary(
                stats.getTotalRequests(),
                percent(stats.getAvailability()),
                String.format(Locale.ROOT, "%.1f minutes", stats.getUptime() / 1000.0 / 60),
                health.getStatus());
        Trends trends = new Trends(
                ratio(stats.getSuccessfulRequests(), stats.getTotalRequests()),
                ratio(stats.getRecoveredRequests(), stats.getFailedRequests()),
                ratio(stats.getFallbacksUsed(), stats.getTotalRequests()));
        return new RecoveryReport(summary, stats, health.getRecommendations(), trends);
    }

    private static String ratio(long part, long whole) {
        return whole > 0 ? percent(part * 100.0 / whole) : "0%";
    }

    private static String percent(double value) {
        return String.format(Locale.ROOT, "%.2f%%", value);
    }

    /**
     * 渲染成可直接输出到日志或控制台的文本
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("=== Error Recovery Report ===\n");
        sb.append("Status: ").append(summary.getStatus().value()).append('\n');
        sb.append("Total requests: ").append(summary.getTotalRequests()).append('\n');
        sb.append("Availability: ").append(summary.getAvailability()).append('\n');
        sb.append("Uptime: ").append(summary.getUptime()).append('\n');
        sb.append("Success rate: ").append(trends.getSuccessRate()).append('\n');
        sb.append("Recovery rate: ").append(trends.getRecoveryRate()).append('\n');
        sb.append("Fallback usage: ").append(trends.getFallbackUsage()).append('\n');
        if (!recommendations.isEmpty()) {
            sb.append("Recommendations:\n");
            recommendations.forEach(r -> sb.append("  - ").append(r).append('\n'));
        }
        return sb.toString();
    }

    @Data
    @AllArgsConstructor
    public static class Summary {
        private long totalRequests;
        private String availability;
        private String uptime;
        private HealthLevel status;
    }

    @Data
    @AllArgsConstructor
    public static class Trends {
        private String successRate;
        private String recoveryRate;
        private String fallbackUsage;
    }
}
