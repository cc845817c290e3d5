package com.tarterware.pedalpath.utilities;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SpeedSmootherTest
{
    @Test
    void testInvalidCapacity()
    {
        // Capacity must be at least 1
        assertThrows(IllegalArgumentException.class, () -> new SpeedSmoother(0));
        assertThrows(IllegalArgumentException.class, () -> new SpeedSmoother(-5));
    }

    @Test
    void testInitialState()
    {
        SpeedSmoother smoother = new SpeedSmoother(5);
        assertEquals(0, smoother.getCount());
        assertEquals(0.0, smoother.getSmoothedSpeed(), 0.0001);
    }

    @Test
    void testNewestReadingWeighsMost()
    {
        SpeedSmoother smoother = new SpeedSmoother(5);
        smoother.recordReading(2.0);
        smoother.recordReading(4.0);
        // (2*1 + 4*2) / (1 + 2)
        assertEquals(10.0 / 3.0, smoother.getSmoothedSpeed(), 0.0001);
    }

    @Test
    void testAccelerationFromStandstill()
    {
        SpeedSmoother smoother = new SpeedSmoother(5);
        for (int i = 0; i < 4; i++)
        {
            smoother.recordReading(0.0);
        }
        double smoothed = smoother.recordReading(10.0);

        // 10 * 5 / (1 + 2 + 3 + 4 + 5)
        assertEquals(10.0 / 3.0, smoothed, 0.0001);
        assertTrue((smoothed > 0.0) && (smoothed < 10.0));
    }

    @Test
    void testCircularBufferReplacement()
    {
        SpeedSmoother smoother = new SpeedSmoother(3);
        smoother.recordReading(1.0);
        smoother.recordReading(2.0);
        smoother.recordReading(3.0);
        smoother.recordReading(4.0); // 1.0 is replaced

        assertEquals(3, smoother.getCount());
        assertArrayEquals(new double[] { 2.0, 3.0, 4.0 }, smoother.getReadings(), 0.0001);
        // (2*1 + 3*2 + 4*3) / 6
        assertEquals(20.0 / 6.0, smoother.getSmoothedSpeed(), 0.0001);
    }

    @Test
    void testMissingAndNegativeReadingsCountAsZero()
    {
        SpeedSmoother smoother = new SpeedSmoother(5);
        smoother.recordReading(null);
        smoother.recordReading(-3.0);

        assertArrayEquals(new double[] { 0.0, 0.0 }, smoother.getReadings(), 0.0001);
        assertEquals(0.0, smoother.getSmoothedSpeed(), 0.0001);
    }

    @Test
    void testReset()
    {
        SpeedSmoother smoother = new SpeedSmoother(5);
        smoother.recordReading(8.0);
        smoother.reset();

        assertEquals(0, smoother.getCount());
        assertEquals(0.0, smoother.getSmoothedSpeed(), 0.0001);
        assertEquals(6.0, smoother.recordReading(6.0), 0.0001);
    }
}
