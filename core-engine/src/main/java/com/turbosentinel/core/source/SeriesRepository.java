package com.turbosentinel.core.source;

import com.turbosentinel.core.model.SensorSeries;

import java.time.Instant;
import java.util.List;

/**
 * Storage collaborator delivering de-duplicated, time-ordered series.
 *
 * <p>
 * Implementations live outside the engine. Any failure to deliver data is
 * reported as {@link com.turbosentinel.core.error.UpstreamDataException}.
 * </p>
 */
public interface SeriesRepository {

    /**
     * @param tag   tag to read
     * @param unit  unit the tag belongs to
     * @param start inclusive lower bound
     * @param end   inclusive upper bound
     * @return the tag's samples in the interval; an empty series when there
     *         are none
     * @throws com.turbosentinel.core.error.UpstreamDataException if storage fails
     */
    SensorSeries getSeries(String tag, String unit, Instant start, Instant end);

    /**
     * @param unit unit name
     * @return every tag storage knows for the unit
     * @throws com.turbosentinel.core.error.UpstreamDataException if storage fails
     */
    List<String> getAllTags(String unit);
}
