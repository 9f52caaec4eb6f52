package com.mrgris.resample.strategy;

import com.mrgris.resample.grid.Grid;

/**
 * Fills the no-data cells of one zone (usually one connected region, clipped to its bounding box).
 */
public interface ResampleStrategy {

	/**
	 * @param valueGrid known values; no-data marks cells to be filled
	 * @param zoneGrid grid with the same geometry as valueGrid; only cells equal to zoneValue are resampled
	 * @return new grid with the geometry of valueGrid holding known and resampled values of the zone, no-data elsewhere
	 */
	Grid resample(Grid valueGrid, Grid zoneGrid, float zoneValue);
}
