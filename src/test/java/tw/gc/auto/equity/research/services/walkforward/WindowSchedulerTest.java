package tw.gc.auto.equity.research.services.walkforward;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.*;

class WindowSchedulerTest {

    @Nested
    @DisplayName("Rolling mode")
    class RollingTests {

        @Test
        @DisplayName("should produce exactly 4 windows over 300 time points")
        void shouldProduceFourWindows() {
            var config = WindowSchedulerConfig.rolling(200, 20, 20, 1);

            List<WalkForwardWindow> windows = WindowScheduler.preview(config, 300);

            assertThat(windows).containsExactly(
                new WalkForwardWindow(0, 0, 200, 201, 221),
                new WalkForwardWindow(1, 20, 220, 221, 241),
                new WalkForwardWindow(2, 40, 240, 241, 261),
                new WalkForwardWindow(3, 60, 260, 261, 281));
        }

        @Test
        @DisplayName("should never clip the last window")
        void shouldNotClipLastWindow() {
            var config = WindowSchedulerConfig.rolling(200, 20, 20, 1);

            List<WalkForwardWindow> windows = WindowScheduler.preview(config, 300);

            assertThat(windows).allSatisfy(w -> {
                assertThat(w.valSize()).isEqualTo(20);
                assertThat(w.valEnd()).isLessThanOrEqualTo(300);
            });
        }

        @Test
        @DisplayName("should emit a window ending exactly at the last time point")
        void shouldEmitWindowEndingAtLength() {
            var config = WindowSchedulerConfig.rolling(10, 5, 5, 0);

            List<WalkForwardWindow> windows = WindowScheduler.preview(config, 20);

            assertThat(windows).hasSize(2);
            assertThat(windows.get(1).valEnd()).isEqualTo(20);
        }

        @ParameterizedTest(name = "train={0} val={1} step={2} embargo={3} length={4}")
        @CsvSource({
            "200, 20, 20, 1, 300",
            "50, 5, 5, 0, 120",
            "30, 7, 3, 2, 90",
            "10, 1, 1, 5, 40"
        })
        @DisplayName("should keep validation strictly after training plus embargo")
        void shouldNotLeak(int train, int val, int step, int embargo, int length) {
            var config = WindowSchedulerConfig.rolling(train, val, step, embargo);

            List<WalkForwardWindow> windows = WindowScheduler.preview(config, length);

            assertThat(windows).isNotEmpty();
            for (WalkForwardWindow w : windows) {
                assertThat(w.trainEnd() + embargo).isLessThanOrEqualTo(w.valStart());
                assertThat(w.trainSize()).isEqualTo(train);
                assertThat(w.valEnd()).isLessThanOrEqualTo(length);
            }
        }

        @Test
        @DisplayName("should produce disjoint validation ranges when step >= val")
        void shouldProduceDisjointValidation() {
            var config = WindowSchedulerConfig.rolling(30, 5, 5, 1);

            List<WalkForwardWindow> windows = WindowScheduler.preview(config, 100);

            for (int i = 0; i < windows.size(); i++) {
                for (int j = i + 1; j < windows.size(); j++) {
                    assertThat(windows.get(i).validationOverlaps(windows.get(j))).isFalse();
                }
            }
        }

        @Test
        @DisplayName("should produce overlapping validation ranges when step < val")
        void shouldOverlapWhenStepSmallerThanVal() {
            var config = WindowSchedulerConfig.rolling(30, 10, 5, 0);

            List<WalkForwardWindow> windows = WindowScheduler.preview(config, 100);

            assertThat(config.hasOverlappingValidation()).isTrue();
            assertThat(windows.get(0).validationOverlaps(windows.get(1))).isTrue();
        }

        @Test
        @DisplayName("should number windows consecutively from zero")
        void shouldNumberWindows() {
            var windows = WindowScheduler.preview(WindowSchedulerConfig.rolling(20, 5, 3, 1), 80);

            for (int i = 0; i < windows.size(); i++) {
                assertThat(windows.get(i).windowIndex()).isEqualTo(i);
            }
        }
    }

    @Nested
    @DisplayName("Expanding mode")
    class ExpandingTests {

        @Test
        @DisplayName("should anchor training at zero and grow by step")
        void shouldGrowTrainingRange() {
            var config = WindowSchedulerConfig.expanding(50, 10, 10, 2);

            List<WalkForwardWindow> windows = WindowScheduler.preview(config, 100);

            assertThat(windows).hasSize(4);
            assertThat(windows).allSatisfy(w -> assertThat(w.trainStart()).isZero());
            assertThat(windows).extracting(WalkForwardWindow::trainEnd).containsExactly(50, 60, 70, 80);
            assertThat(windows).extracting(WalkForwardWindow::valStart).containsExactly(52, 62, 72, 82);
        }
    }

    @Nested
    @DisplayName("Insufficient data")
    class InsufficientDataTests {

        @Test
        @DisplayName("should produce no windows when data is shorter than one window")
        void shouldProduceNothing() {
            var config = WindowSchedulerConfig.rolling(200, 20, 20, 1);

            assertThat(WindowScheduler.preview(config, 220)).isEmpty();
            assertThat(WindowScheduler.preview(config, 0)).isEmpty();
        }

        @Test
        @DisplayName("should produce one window at the minimum length")
        void shouldProduceOneAtMinimum() {
            var config = WindowSchedulerConfig.rolling(200, 20, 20, 1);

            assertThat(WindowScheduler.preview(config, config.minimumLength())).hasSize(1);
        }

        @Test
        @DisplayName("should reject negative length")
        void shouldRejectNegativeLength() {
            var config = WindowSchedulerConfig.rolling(10, 5, 5, 0);

            assertThatThrownBy(() -> new WindowScheduler(config, -1))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Iteration")
    class IterationTests {

        @Test
        @DisplayName("should be iterable only once")
        void shouldIterateOnce() {
            var scheduler = new WindowScheduler(WindowSchedulerConfig.rolling(10, 5, 5, 0), 40);

            List<WalkForwardWindow> seen = new ArrayList<>();
            for (WalkForwardWindow w : scheduler) {
                seen.add(w);
            }

            assertThat(seen).hasSize(6);
            assertThatThrownBy(scheduler::iterator).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("should throw after exhaustion")
        void shouldThrowAfterExhaustion() {
            Iterator<WalkForwardWindow> it =
                new WindowScheduler(WindowSchedulerConfig.rolling(10, 5, 5, 0), 15).iterator();

            assertThat(it.next().windowIndex()).isZero();
            assertThat(it.hasNext()).isFalse();
            assertThatThrownBy(it::next).isInstanceOf(NoSuchElementException.class);
        }

        @Test
        @DisplayName("should be deterministic for the same inputs")
        void shouldBeDeterministic() {
            var config = WindowSchedulerConfig.rolling(37, 6, 4, 3);

            assertThat(WindowScheduler.preview(config, 250)).isEqualTo(WindowScheduler.preview(config, 250));
        }
    }
}
