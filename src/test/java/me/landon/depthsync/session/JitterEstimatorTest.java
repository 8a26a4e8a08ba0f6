package me.landon.depthsync.session;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class JitterEstimatorTest {
    @Test
    void needsTwoGaps() {
        JitterEstimator estimator = new JitterEstimator();
        estimator.onArrival(0);
        estimator.onArrival(40);

        assertEquals(0.0, estimator.jitterMs());
    }

    @Test
    void computesPopulationStandardDeviation() {
        JitterEstimator estimator = new JitterEstimator();
        estimator.onArrival(0);
        estimator.onArrival(30);
        estimator.onArrival(80);

        // gaps 30 and 50
        assertEquals(10.0, estimator.jitterMs(), 1e-9);
    }

    @Test
    void keepsOnlyMostRecentWindow() {
        JitterEstimator estimator = new JitterEstimator();
        long now = 0;
        estimator.onArrival(now);

        for (int i = 0; i < 10; i++) {
            now += i % 2 == 0 ? 10 : 90;
            estimator.onArrival(now);
        }

        for (int i = 0; i < JitterEstimator.WINDOW_SIZE; i++) {
            now += 33;
            estimator.onArrival(now);
        }

        assertEquals(JitterEstimator.WINDOW_SIZE, estimator.sampleCount());
        assertEquals(0.0, estimator.jitterMs(), 1e-9);
    }
}
