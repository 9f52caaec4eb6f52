package com.mrgris.resample.strategy;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mrgris.resample.Cell;
import com.mrgris.resample.ConflictMethod;
import com.mrgris.resample.ResampleException;
import com.mrgris.resample.grid.Grid;

/**
 * Nearest-neighbor resampling by growing the known values outward, one ring of cells per round.
 *
 * <p>Each round resolves exactly the cells that were queued before the round started, from the
 * values resolved in earlier rounds only; the values of a round are written to the grid after the
 * whole round is done. Cells with more than one resolved neighbor combine them with the
 * configured {@link ConflictMethod}.
 */
public class NearestNeighborStrategy implements ResampleStrategy {

	private static final Logger LOG = LoggerFactory.getLogger(NearestNeighborStrategy.class);

	// down, right, up, left, then up-left, down-left, down-right, up-right
	static final int[][] NEIGHBOR_OFFSETS = {
			{1, 0}, {0, 1}, {-1, 0}, {0, -1},
			{-1, -1}, {1, -1}, {1, 1}, {-1, 1},
		};

	// down, right, up, left, then up-left, down-left, up-right, down-right
	static final int[][] EXPANSION_OFFSETS = {
			{1, 0}, {0, 1}, {-1, 0}, {0, -1},
			{-1, -1}, {1, -1}, {-1, 1}, {1, 1},
		};

	final ConflictMethod conflictMethod;
	final boolean diagonal;

	public NearestNeighborStrategy(ConflictMethod conflictMethod, boolean diagonal) {
		this.conflictMethod = conflictMethod;
		this.diagonal = diagonal;
	}

	@Override
	public Grid resample(Grid valueGrid, Grid zoneGrid, float zoneValue) {
		checkGeometry(valueGrid, zoneGrid);

		Grid result = valueGrid.copyEmpty();
		for (int r = 0; r < result.rows; r++) {
			for (int c = 0; c < result.cols; c++) {
				if (Grid.same(zoneGrid.get(r, c), zoneValue)) {
					result.set(r, c, valueGrid.get(r, c));
				}
			}
		}

		// initial front: empty zone cells next to a known value
		Queue<Cell> queue = new ArrayDeque<Cell>();
		Set<Cell> queued = new HashSet<Cell>();
		int emptyCount = 0;
		for (int r = 0; r < result.rows; r++) {
			for (int c = 0; c < result.cols; c++) {
				if (!Grid.same(zoneGrid.get(r, c), zoneValue) || result.hasValue(r, c)) {
					continue;
				}
				emptyCount++;
				if (resolvedNeighborCount(result, r, c) > 0) {
					Cell cell = new Cell(r, c);
					queue.add(cell);
					queued.add(cell);
				}
			}
		}

		int resolvedCount = 0;
		int round = 0;
		while (!queue.isEmpty()) {
			round++;
			int inRound = queue.size();
			List<Cell> resolved = new ArrayList<Cell>();
			Set<Cell> resolvedSet = new HashSet<Cell>();
			while (inRound-- > 0) {
				Cell cell = queue.poll();
				queued.remove(cell);

				Cell candidate = resolve(result, cell.row, cell.col);
				if (candidate == null) {
					continue;
				}
				resolved.add(candidate);
				resolvedSet.add(candidate);

				int n = (diagonal ? 8 : 4);
				for (int i = 0; i < n; i++) {
					int nr = cell.row + EXPANSION_OFFSETS[i][0];
					int nc = cell.col + EXPANSION_OFFSETS[i][1];
					if (!result.inBounds(nr, nc) || result.hasValue(nr, nc) || !Grid.same(zoneGrid.get(nr, nc), zoneValue)) {
						continue;
					}
					Cell neighbor = new Cell(nr, nc);
					if (!queued.contains(neighbor) && !resolvedSet.contains(neighbor)) {
						queue.add(neighbor);
						queued.add(neighbor);
					}
				}
			}

			for (Cell cell : resolved) {
				result.set(cell.row, cell.col, cell.value);
			}
			resolvedCount += resolved.size();
		}

		if (resolvedCount < emptyCount) {
			LOG.debug(String.format("%d of %d empty cells of zone %s could not be reached after %d rounds",
					emptyCount - resolvedCount, emptyCount, zoneValue, round));
		}
		return result;
	}

	static void checkGeometry(Grid valueGrid, Grid zoneGrid) {
		valueGrid.checkCellSize(zoneGrid);
		if (valueGrid.rows != zoneGrid.rows || valueGrid.cols != zoneGrid.cols) {
			throw new ResampleException(String.format("value grid (%dx%d) and zone grid (%dx%d) do not match",
					valueGrid.rows, valueGrid.cols, zoneGrid.rows, zoneGrid.cols));
		}
	}

	int resolvedNeighborCount(Grid result, int row, int col) {
		int count = 0;
		int n = (diagonal ? 8 : 4);
		for (int i = 0; i < n; i++) {
			int r = row + NEIGHBOR_OFFSETS[i][0];
			int c = col + NEIGHBOR_OFFSETS[i][1];
			if (result.inBounds(r, c) && result.hasValue(r, c)) {
				count++;
			}
		}
		return count;
	}

	/* value for the cell from its resolved neighbors, or null if it has none */
	Cell resolve(Grid result, int row, int col) {
		NeighborValues acc = new NeighborValues(conflictMethod);
		int n = (diagonal ? 8 : 4);
		for (int i = 0; i < n; i++) {
			int r = row + NEIGHBOR_OFFSETS[i][0];
			int c = col + NEIGHBOR_OFFSETS[i][1];
			if (result.inBounds(r, c) && result.hasValue(r, c)) {
				acc.add(result.get(r, c));
			}
		}
		if (acc.neighborCount == 0) {
			return null;
		}
		return new Cell(row, col, acc.value());
	}

	/*
	 * running combination of neighbor values. note for min/max the value count is reset to 1 on each
	 * new extreme rather than counting every neighbor; a cell whose neighbors never beat the initial
	 * extreme therefore resolves to NaN
	 */
	static class NeighborValues {
		final ConflictMethod method;
		int neighborCount = 0;
		int valueCount = 0;
		float sum = 0;
		float min = Float.MAX_VALUE;
		float max = -Float.MAX_VALUE;
		boolean undefinedHarmonic = false;

		NeighborValues(ConflictMethod method) {
			this.method = method;
		}

		void add(float v) {
			neighborCount++;
			switch (method) {
			case ARITHMETIC_AVERAGE:
				sum += v;
				valueCount++;
				break;
			case HARMONIC_AVERAGE:
				if (v != 0) {
					sum += 1 / v;
				} else {
					undefinedHarmonic = true;
				}
				valueCount++;
				break;
			case MINIMUM_VALUE:
				if (v < min) {
					min = v;
					valueCount = 1;
				}
				break;
			case MAXIMUM_VALUE:
				if (v > max) {
					max = v;
					valueCount = 1;
				}
				break;
			default:
				throw new IllegalStateException("unknown conflict method: " + method);
			}
		}

		float value() {
			if (valueCount == 0) {
				return Float.NaN;
			}
			switch (method) {
			case ARITHMETIC_AVERAGE:
				return sum / (float)valueCount;
			case HARMONIC_AVERAGE:
				return (undefinedHarmonic ? 0f : (float)valueCount / sum);
			case MINIMUM_VALUE:
				return min;
			case MAXIMUM_VALUE:
				return max;
			default:
				throw new IllegalStateException("unknown conflict method: " + method);
			}
		}
	}
}
