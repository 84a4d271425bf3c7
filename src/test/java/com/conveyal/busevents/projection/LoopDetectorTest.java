package com.conveyal.busevents.projection;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static com.conveyal.busevents.TestUtils.stop;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class LoopDetectorTest {

    @Test
    public void sameFirstAndLastStopIsLoop () {
        assertThat(LoopDetector.isLoop(Arrays.asList(
            stop(1, 10.0, 106.0), stop(2, 10.01, 106.0), stop(1, 10.0, 106.0))), is(true));
    }

    @Test
    public void toleratesTinyCoordinateDifferences () {
        assertThat(LoopDetector.isLoop(Arrays.asList(
            stop(1, 10.0, 106.0), stop(2, 10.01, 106.0), stop(3, 10.0000005, 105.9999995))), is(true));
        assertThat(LoopDetector.isLoop(Arrays.asList(
            stop(1, 10.0, 106.0), stop(2, 10.01, 106.0), stop(3, 10.00001, 106.0))), is(false));
    }

    @Test
    public void openRouteIsNotLoop () {
        assertThat(LoopDetector.isLoop(Arrays.asList(stop(1, 10.0, 106.0), stop(2, 10.01, 106.0))), is(false));
    }

    @Test
    public void singleStopIsNotLoop () {
        assertThat(LoopDetector.isLoop(Collections.singletonList(stop(1, 10.0, 106.0))), is(false));
        assertThat(LoopDetector.isLoop(Collections.emptyList()), is(false));
    }
}
