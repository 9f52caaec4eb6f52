package com.mrgris.resample;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mrgris.resample.grid.Grid;
import com.mrgris.resample.grid.GridFormat;
import com.mrgris.resample.strategy.FullZoneStatistics;
import com.mrgris.resample.strategy.IDWStrategy;
import com.mrgris.resample.strategy.LocalZoneStatistics;
import com.mrgris.resample.strategy.NearestNeighborStrategy;
import com.mrgris.resample.strategy.ZoneStatistic;

/**
 * Entry point of a resampling run: aligns the value grid to the zone grid and hands both to the
 * resampler selected by the settings.
 *
 * <p>The result has the extent and cell size of the zone grid and the no-data value of the value
 * grid. Only zone cells can get a value.
 */
public class ZoneResampler {

	private static final Logger LOG = LoggerFactory.getLogger(ZoneResampler.class);

	// zone value of derived zone grids
	public static final float DERIVED_ZONE = 1f;

	final ResampleSettings settings;
	final Resampler resampler;

	public ZoneResampler(ResampleSettings settings) {
		settings.validate();
		this.settings = settings;
		this.resampler = createResampler(settings);
	}

	static Resampler createResampler(ResampleSettings s) {
		boolean diagonal = !s.skipDiagonalProcessing;
		switch (s.resampleMethod) {
		case NEAREST_NEIGHBOR:
			return new RegionResampler(new NearestNeighborStrategy(s.conflictMethod, diagonal), diagonal);
		case IDW:
			return new RegionResampler(new IDWStrategy(s.idwPower, s.idwSmoothing, s.idwMaxDistance), diagonal);
		case MINIMUM_VALUE:
		case MAXIMUM_VALUE:
		case MEAN_VALUE:
		case PERCENTILE_VALUE:
			ZoneStatistic stat = new ZoneStatistic(s.resampleMethod, s.percentile);
			if (s.statDistance == 0) {
				return new FullZoneStatistics(stat);
			} else {
				return new LocalZoneStatistics(stat, s.statDistance);
			}
		default:
			throw new IllegalStateException("undefined resample method: " + s.resampleMethod);
		}
	}

	/**
	 * Writes the intermediate grids of the regional methods to {@code dir}; has no effect for
	 * the statistics methods.
	 */
	public void enableDebug(GridFormat format, Path dir, String extension) {
		if (resampler instanceof RegionResampler) {
			((RegionResampler)resampler).enableDebug(format, dir, extension, settings.debugSubZone);
		} else {
			LOG.warn("debug output is only written for the nn and idw methods");
		}
	}

	public Grid resample(Grid valueGrid, Grid zoneGrid) {
		Grid aligned = alignToZone(valueGrid, zoneGrid);
		return resampler.resample(aligned, zoneGrid);
	}

	/* value grid clipped and padded to the extent of the zone grid */
	public static Grid alignToZone(Grid valueGrid, Grid zoneGrid) {
		valueGrid.checkCellSize(zoneGrid);
		if (valueGrid.extent.equals(zoneGrid.extent)) {
			return valueGrid;
		}
		if (!valueGrid.extent.intersects(zoneGrid.extent)) {
			throw new ResampleException("no overlap between extents of zone grid " + zoneGrid.extent + " and value grid " + valueGrid.extent);
		}
		Grid aligned = valueGrid.clip(zoneGrid.extent).enlarge(zoneGrid.extent);
		if (aligned.rows != zoneGrid.rows || aligned.cols != zoneGrid.cols) {
			throw new ResampleException("cells of zone grid " + zoneGrid + " and value grid " + valueGrid + " are not aligned");
		}
		return aligned;
	}

	/**
	 * Zone grid for a value grid when no zone grid is given, with zone value 1. For nn and idw it
	 * covers the empty cells plus a border of one cell of known values to resample from; for the
	 * statistics methods it covers the cells with a value.
	 */
	public Grid deriveZone(Grid valueGrid) {
		Grid zone = new Grid(valueGrid.extent, valueGrid.cellSize, Float.NaN);
		if (settings.resampleMethod.isRegional()) {
			zone.replaceValues(valueGrid, valueGrid.noData, DERIVED_ZONE);
			// diagonals only with -x, the reverse of the resampling connectivity
			zone = zone.grow(DERIVED_ZONE, settings.skipDiagonalProcessing);
		} else {
			zone.replaceValues(valueGrid, DERIVED_ZONE);
		}
		return zone;
	}
}
