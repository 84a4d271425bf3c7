package com.conveyal.busevents.projection;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class PathProjectorTest {

    private static final double[] LATS = {10.0, 10.0, 10.0, 10.0};
    private static final double[] LNGS = {106.0, 106.01, 106.02, 106.03};

    @Test
    public void canFindExactVertex () {
        PathProjector.NearestVertex nearest = PathProjector.nearest(10.0, 106.02, LATS, LNGS);
        assertThat(nearest.index, equalTo(2));
        assertThat(nearest.distanceMeters, closeTo(0, 1e-9));
    }

    @Test
    public void canFindNearestVertexOffThePath () {
        assertThat(PathProjector.nearest(10.001, 106.012, LATS, LNGS).index, equalTo(1));
        assertThat(PathProjector.nearest(9.99, 106.5, LATS, LNGS).index, equalTo(3));
    }

    /** A trace passing twice through the same point snaps to its first pass. */
    @Test
    public void tiesGoToLowestIndex () {
        double[] repeatedLats = {10.0, 10.01, 10.02, 10.01};
        double[] repeatedLngs = {106.0, 106.0, 106.0, 106.0};
        assertThat(PathProjector.nearest(10.01, 106.0, repeatedLats, repeatedLngs).index, equalTo(1));
    }

    @Test
    public void emptyPathIsRejected () {
        assertThrows(IllegalArgumentException.class,
            () -> PathProjector.nearest(10.0, 106.0, new double[0], new double[0]));
    }
}
