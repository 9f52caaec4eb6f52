package com.mrgris.resample;

import java.nio.file.Path;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mrgris.resample.grid.Grid;
import com.mrgris.resample.grid.GridFormat;
import com.mrgris.resample.strategy.ResampleStrategy;
import com.mrgris.resample.util.DefaultMap;

/**
 * Resamples the empty cells of a value grid per connected region of each zone.
 *
 * <p>The zone grid is scanned row by row for a zone cell that is still empty in the value grid
 * and not yet processed. The connected region of its zone is extracted (clipped to its bounding
 * box), resampled by the strategy, merged into the result, and all cells of the region are
 * marked processed before the scan continues.
 */
public class RegionResampler implements Resampler {

	private static final Logger LOG = LoggerFactory.getLogger(RegionResampler.class);

	final ResampleStrategy strategy;
	final RegionFinder finder;

	// debug output of the intermediate local grids
	GridFormat debugFormat;
	Path debugDir;
	String debugExtension;
	String debugSubZone;

	public RegionResampler(ResampleStrategy strategy, boolean diagonal) {
		this.strategy = strategy;
		this.finder = new RegionFinder(diagonal);
	}

	/**
	 * Write the local value, zone and result grids of every sub-zone (or only of the sub-zone with
	 * id {@code subZone}, e.g. "3.0.2", when not null) to {@code dir}.
	 */
	public void enableDebug(GridFormat format, Path dir, String extension, String subZone) {
		this.debugFormat = format;
		this.debugDir = dir;
		this.debugExtension = extension;
		this.debugSubZone = subZone;
	}

	@Override
	public Grid resample(Grid valueGrid, Grid zoneGrid) {
		valueGrid.checkCellSize(zoneGrid);

		Grid result = valueGrid.copyEmpty();
		result.replaceFrom(zoneGrid, valueGrid);

		// cells with a value need no resampling and count as processed from the start
		Grid processed = valueGrid.copy();
		float processedMark = (Grid.same(processed.noData, 1f) ? 0f : 1f);

		Map<Float, Integer> subZoneCounts = new DefaultMap<Float, Integer>() {
			private static final long serialVersionUID = 1L;

			@Override
			public Integer defaultValue(Float key) {
				return 0;
			}
		};

		int regions = 0;
		for (int r = 0; r < zoneGrid.rows; r++) {
			for (int c = 0; c < zoneGrid.cols; c++) {
				if (processed.hasValue(r, c) || !zoneGrid.hasValue(r, c)) {
					continue;
				}
				float zoneValue = zoneGrid.get(r, c);
				float zoneKey = Grid.zoneKey(zoneValue);
				int subZone = subZoneCounts.get(zoneKey) + 1;
				subZoneCounts.put(zoneKey, subZone);
				String subZoneId = zoneKey + "." + subZone;

				Region region = finder.find(zoneGrid, zoneGrid, new Cell(r, c), zoneValue, zoneValue, zoneValue, false);
				Grid localZone = region.grid;
				Grid localValues = valueGrid.clip(localZone.extent);
				localValues.replaceValues(localZone, localZone.noData, localValues.noData);
				LOG.info(String.format("resampling local zone %s at cell %s: %d cells, %d with a value",
						subZoneId, new Cell(r, c), region.size(), localValues.countNonNoData()));

				Grid localResult = strategy.resample(localValues, localZone, zoneValue);

				if (isDebugged(subZoneId)) {
					writeDebug(localValues, "LocalValues" + subZoneId);
					writeDebug(localZone, "LocalZone" + subZoneId);
					writeDebug(localResult, "LocalResult" + subZoneId);
				}

				result.replaceFrom(localZone, localResult);
				processed.replaceValues(localZone, processedMark);
				regions++;
			}
		}
		LOG.info(regions + " local zone(s) resampled");
		return result;
	}

	boolean isDebugged(String subZoneId) {
		return debugFormat != null && (debugSubZone == null || debugSubZone.equals(subZoneId));
	}

	void writeDebug(Grid grid, String name) {
		Path path = debugDir.resolve(name + debugExtension);
		try {
			debugFormat.write(grid, path);
		} catch (RuntimeException e) {
			LOG.warn("could not write debug grid " + path + ": " + e.getMessage());
		}
	}
}
