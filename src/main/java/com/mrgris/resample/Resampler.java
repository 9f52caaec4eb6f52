package com.mrgris.resample;

import com.mrgris.resample.grid.Grid;

/**
 * Resamples a value grid within all zones of a zone grid. Both grids have the same extent and
 * cell size; the result has that geometry and the no-data value of the value grid.
 */
public interface Resampler {
	Grid resample(Grid valueGrid, Grid zoneGrid);
}
