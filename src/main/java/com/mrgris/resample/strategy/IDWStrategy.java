package com.mrgris.resample.strategy;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mrgris.resample.Cell;
import com.mrgris.resample.ResampleException;
import com.mrgris.resample.grid.Grid;

/**
 * Inverse-distance-weighted interpolation of the empty cells of a zone from all cells of the zone
 * that have a value. Every empty cell is computed independently from the same set of sources.
 *
 * <p>Distances are between cell centers, in world units.
 */
public class IDWStrategy implements ResampleStrategy {

	private static final Logger LOG = LoggerFactory.getLogger(IDWStrategy.class);

	// below this distance a source coincides with the target
	static final double ZERO_DISTANCE = 1e-10;

	final double power;
	final double smoothing;
	final double maxDistance;

	/**
	 * @param maxDistance sources further away are ignored; NaN to use all sources
	 */
	public IDWStrategy(double power, double smoothing, double maxDistance) {
		if (smoothing < 0) {
			throw new ResampleException("IDW smoothing cannot be negative: " + smoothing);
		}
		if (maxDistance < 0) {
			throw new ResampleException("IDW maximum distance cannot be negative: " + maxDistance);
		}
		this.power = power;
		this.smoothing = smoothing;
		this.maxDistance = maxDistance;
	}

	@Override
	public Grid resample(Grid valueGrid, Grid zoneGrid, float zoneValue) {
		NearestNeighborStrategy.checkGeometry(valueGrid, zoneGrid);

		Grid result = valueGrid.copyEmpty();
		List<Cell> sources = new ArrayList<Cell>();
		List<Cell> targets = new ArrayList<Cell>();
		for (int r = 0; r < result.rows; r++) {
			for (int c = 0; c < result.cols; c++) {
				if (!Grid.same(zoneGrid.get(r, c), zoneValue)) {
					continue;
				}
				if (valueGrid.hasValue(r, c)) {
					float v = valueGrid.get(r, c);
					result.set(r, c, v);
					sources.add(new Cell(r, c, v));
				} else {
					targets.add(new Cell(r, c));
				}
			}
		}

		int unresolved = 0;
		for (Cell target : targets) {
			float v = interpolate(result, target, sources);
			if (Float.isNaN(v)) {
				unresolved++;
			} else {
				result.set(target.row, target.col, v);
			}
		}
		if (unresolved > 0) {
			LOG.debug(String.format("%d of %d cells of zone %s have no IDW source within range", unresolved, targets.size(), zoneValue));
		}
		return result;
	}

	/* NaN if no source contributes */
	float interpolate(Grid grid, Cell target, List<Cell> sources) {
		double x = grid.x(target.col);
		double y = grid.y(target.row);

		double weightedSum = 0;
		double weightSum = 0;
		for (Cell source : sources) {
			double d = Math.hypot(grid.x(source.col) - x, grid.y(source.row) - y);
			if (d < ZERO_DISTANCE) {
				return source.value;
			}
			if (!Double.isNaN(maxDistance) && d > maxDistance) {
				continue;
			}
			double w = 1. / (Math.pow(d, power) + smoothing);
			weightedSum += w * source.value;
			weightSum += w;
		}
		if (weightSum == 0) {
			return Float.NaN;
		}
		return (float)(weightedSum / weightSum);
	}
}
