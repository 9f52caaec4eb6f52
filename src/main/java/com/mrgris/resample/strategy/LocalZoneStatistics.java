package com.mrgris.resample.strategy;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mrgris.resample.ResampleException;
import com.mrgris.resample.Resampler;
import com.mrgris.resample.grid.Grid;

/**
 * Assigns to every zone cell a statistic over the values of the same zone within a square window
 * of {@code 2 * distance + 1} cells centered on it. The window is cut off at the grid border.
 */
public class LocalZoneStatistics implements Resampler {

	private static final Logger LOG = LoggerFactory.getLogger(LocalZoneStatistics.class);

	final ZoneStatistic statistic;
	final int distance;

	public LocalZoneStatistics(ZoneStatistic statistic, int distance) {
		if (distance <= 0) {
			throw new ResampleException("window distance must be positive: " + distance);
		}
		this.statistic = statistic;
		this.distance = distance;
	}

	@Override
	public Grid resample(Grid valueGrid, Grid zoneGrid) {
		NearestNeighborStrategy.checkGeometry(valueGrid, zoneGrid);
		// a window wider than the grid covers the whole grid
		int d = Math.min(distance, Math.max(zoneGrid.rows, zoneGrid.cols));
		LOG.info(String.format("%s within %dx%d cell window", statistic, 2 * d + 1, 2 * d + 1));

		Grid result = valueGrid.copyEmpty();
		result.replaceFrom(zoneGrid, valueGrid);

		int empty = 0;
		List<Float> values = new ArrayList<Float>();
		for (int r = 0; r < zoneGrid.rows; r++) {
			for (int c = 0; c < zoneGrid.cols; c++) {
				if (!zoneGrid.hasValue(r, c)) {
					continue;
				}
				float zoneValue = zoneGrid.get(r, c);

				values.clear();
				int r1 = Math.min(zoneGrid.rows - 1, r + d);
				int c1 = Math.min(zoneGrid.cols - 1, c + d);
				for (int wr = Math.max(0, r - d); wr <= r1; wr++) {
					for (int wc = Math.max(0, c - d); wc <= c1; wc++) {
						if (Grid.same(zoneGrid.get(wr, wc), zoneValue) && valueGrid.hasValue(wr, wc)) {
							values.add(valueGrid.get(wr, wc));
						}
					}
				}

				if (values.isEmpty()) {
					empty++;
				} else {
					result.set(r, c, statistic.compute(values));
				}
			}
		}
		if (empty > 0) {
			LOG.debug(empty + " zone cells without values in their window");
		}
		return result;
	}
}
