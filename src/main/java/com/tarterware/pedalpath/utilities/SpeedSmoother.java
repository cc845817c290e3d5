package com.tarterware.pedalpath.utilities;

/**
 * Smooths GPS speed readings over a fixed-size circular buffer using a
 * linearly weighted moving average. The oldest retained reading has weight 1
 * and the newest has weight n, which damps jitter while still following real
 * acceleration.
 */
public class SpeedSmoother
{
    // Maximum number of readings to retain
    private final int capacity;

    // Circular buffer to hold readings
    private final double[] readings;

    // Position where the next reading will be written
    private int index = 0;

    // Current number of valid readings in the buffer
    private int count = 0;

    // Weighted average over the current window
    private double smoothedSpeed = 0.0;

    /**
     * Constructs a new SpeedSmoother with the specified capacity.
     *
     * @param capacity the maximum number of readings to retain
     * @throws IllegalArgumentException if capacity is less than 1
     */
    public SpeedSmoother(int capacity)
    {
        if (capacity < 1)
        {
            throw new IllegalArgumentException("Capacity must be at least 1");
        }
        this.capacity = capacity;
        this.readings = new double[capacity];
    }

    /**
     * Records a new reading, replacing the oldest one when the buffer is full.
     * Missing or negative readings count as 0.
     *
     * @param metersPerSecond the raw reading, may be null
     * @return the smoothed speed after recording
     */
    public double recordReading(Double metersPerSecond)
    {
        double value = ((metersPerSecond == null) || (metersPerSecond < 0.0) || metersPerSecond.isNaN()) ? 0.0
                : metersPerSecond;

        readings[index] = value;
        index = (index + 1) % capacity;
        if (count < capacity)
        {
            count++;
        }

        recalc();

        return smoothedSpeed;
    }

    private void recalc()
    {
        double weightedSum = 0.0;
        double totalWeight = 0.0;

        // Walk from the oldest reading to the newest.
        int oldest = (index - count + capacity) % capacity;
        for (int i = 0; i < count; i++)
        {
            double weight = i + 1;
            weightedSum += readings[(oldest + i) % capacity] * weight;
            totalWeight += weight;
        }

        smoothedSpeed = (count > 0) ? weightedSum / totalWeight : 0.0;
    }

    /**
     * Discards all readings.
     */
    public void reset()
    {
        index = 0;
        count = 0;
        smoothedSpeed = 0.0;
    }

    /**
     * @return the weighted average of the retained readings, 0 when empty
     */
    public double getSmoothedSpeed()
    {
        return smoothedSpeed;
    }

    /**
     * @return the current number of retained readings
     */
    public int getCount()
    {
        return count;
    }

    /**
     * @return the retained readings, oldest first
     */
    public double[] getReadings()
    {
        double[] ordered = new double[count];
        int oldest = (index - count + capacity) % capacity;
        for (int i = 0; i < count; i++)
        {
            ordered[i] = readings[(oldest + i) % capacity];
        }
        return ordered;
    }
}
