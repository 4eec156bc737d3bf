package xyz.firestige.redis.gateway.metrics;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import xyz.firestige.redis.gateway.util.TimingExtension;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(TimingExtension.class)
@DisplayName("Micrometer 指标记录测试")
class MicrometerCommandMetricsRecorderTest {

    @Test
    @DisplayName("场景: 按 command 与 outcome 分别计时")
    void recordsTimerPerCommandAndOutcome() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MicrometerCommandMetricsRecorder recorder = new MicrometerCommandMetricsRecorder(registry);

        recorder.record("GET", "success", Duration.ofMillis(5));
        recorder.record("GET", "success", Duration.ofMillis(15));
        recorder.record("GET", "NETWORK_ERROR", Duration.ofMillis(1));

        Timer success = registry.get(MicrometerCommandMetricsRecorder.METRIC_NAME)
                .tag("command", "GET").tag("outcome", "success").timer();
        assertThat(success.count()).isEqualTo(2);
        assertThat(success.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(20.0);

        Timer failure = registry.get(MicrometerCommandMetricsRecorder.METRIC_NAME)
                .tag("outcome", "NETWORK_ERROR").timer();
        assertThat(failure.count()).isEqualTo(1);
    }
}
