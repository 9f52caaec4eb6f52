package com.mrgris.resample.strategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mrgris.resample.Resampler;
import com.mrgris.resample.grid.Grid;
import com.mrgris.resample.util.DefaultMap;

/**
 * Assigns to every cell of a zone one statistic over all values of that zone, regardless of
 * whether the zone is connected.
 */
public class FullZoneStatistics implements Resampler {

	private static final Logger LOG = LoggerFactory.getLogger(FullZoneStatistics.class);

	final ZoneStatistic statistic;

	public FullZoneStatistics(ZoneStatistic statistic) {
		this.statistic = statistic;
	}

	@Override
	public Grid resample(Grid valueGrid, Grid zoneGrid) {
		NearestNeighborStrategy.checkGeometry(valueGrid, zoneGrid);

		Map<Float, List<Float>> zoneValues = new DefaultMap<Float, List<Float>>() {
			private static final long serialVersionUID = 1L;

			@Override
			public List<Float> defaultValue(Float key) {
				return new ArrayList<Float>();
			}
		};
		for (int r = 0; r < zoneGrid.rows; r++) {
			for (int c = 0; c < zoneGrid.cols; c++) {
				if (zoneGrid.hasValue(r, c) && valueGrid.hasValue(r, c)) {
					zoneValues.get(Grid.zoneKey(zoneGrid.get(r, c))).add(valueGrid.get(r, c));
				}
			}
		}

		SortedSet<Float> zones = zoneGrid.uniqueValues();
		LOG.info(String.format("%s over %d zone(s)", statistic, zones.size()));
		Map<Float, Float> zoneStatistics = new TreeMap<Float, Float>();
		for (float zoneValue : zones) {
			if (!zoneValues.containsKey(zoneValue)) {
				LOG.warn("missing values for zone " + zoneValue);
				continue;
			}
			float stat = statistic.compute(zoneValues.get(zoneValue));
			zoneStatistics.put(zoneValue, stat);
			LOG.debug(String.format("zone %s: %d values, %s = %s", zoneValue, zoneValues.get(zoneValue).size(), statistic, stat));
		}

		Grid result = valueGrid.copyEmpty();
		result.replaceFrom(zoneGrid, valueGrid);
		for (int r = 0; r < zoneGrid.rows; r++) {
			for (int c = 0; c < zoneGrid.cols; c++) {
				if (!zoneGrid.hasValue(r, c)) {
					continue;
				}
				Float stat = zoneStatistics.get(Grid.zoneKey(zoneGrid.get(r, c)));
				if (stat != null) {
					result.set(r, c, stat);
				}
			}
		}
		return result;
	}
}
