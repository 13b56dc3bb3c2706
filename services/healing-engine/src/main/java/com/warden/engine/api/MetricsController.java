package com.warden.engine.api;

import com.warden.engine.domain.metrics.ErrorMetrics;
import com.warden.engine.domain.metrics.MetricsAggregator;
import com.warden.engine.domain.metrics.MetricsSummary;
import com.warden.engine.domain.metrics.PerformanceWindow;
import com.warden.engine.domain.queue.QueueMetrics;
import java.time.Instant;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/metrics")
public class MetricsController {

    private final MetricsAggregator aggregator;

    public MetricsController(MetricsAggregator aggregator) {
        this.aggregator = aggregator;
    }

    @GetMapping("/summary")
    public MetricsSummary summary() {
        return aggregator.getMetricsSummary();
    }

    /** Unknown windows fall back to {@code hour}. */
    @GetMapping("/performance")
    public MetricsSummary performance(@RequestParam(defaultValue = "hour") String window) {
        return aggregator.getPerformanceMetrics(PerformanceWindow.parse(window));
    }

    @GetMapping("/queues")
    public Map<String, QueueMetrics> queues() {
        return aggregator.getQueueMetrics();
    }

    /** Error log summary; the range defaults to the last 24 hours. */
    @GetMapping("/errors")
    public ErrorMetrics errors(@RequestParam(required = false) String component,
                               @RequestParam(required = false) Instant from,
                               @RequestParam(required = false) Instant to) {
        return aggregator.getErrorMetrics(component, from, to);
    }
}
