package com.mrgris.resample;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;

import com.mrgris.resample.grid.Grid;

/**
 * Breadth-first extraction of one connected region of a zone.
 *
 * <p>Starting from a seed cell, all cells that are connected through cells with the same zone
 * value are visited. A visited cell whose value in the value grid equals the searched value is
 * part of the region and its neighbors are visited too; any other visited cell is kept as a
 * boundary cell of the region but is not expanded across.
 */
public class RegionFinder {

	// down, left, right, up, then down-left, down-right, up-left, up-right
	static final int[][] OFFSETS = {
			{1, 0}, {0, -1}, {0, 1}, {-1, 0},
			{1, -1}, {1, 1}, {-1, -1}, {-1, 1},
		};

	final boolean diagonal;

	public RegionFinder(boolean diagonal) {
		this.diagonal = diagonal;
	}

	/**
	 * @param valueGrid grid that holds the searched value; may be the zone grid itself
	 * @param zoneGrid grid whose zone values define connectivity
	 * @param seed first cell of the region, always included
	 * @param searchedValue value (in valueGrid) of cells that are expanded
	 * @param replacedValue value written for searched cells in the resulting grid
	 * @param includeOutsideBoundary if set, every visited cell is expanded regardless of its value
	 * @return the region, with a grid covering its bounding box in which all cells outside the region are no-data
	 */
	public Region find(Grid valueGrid, Grid zoneGrid, Cell seed, float zoneValue, float searchedValue,
			float replacedValue, boolean includeOutsideBoundary) {
		if (valueGrid.rows != zoneGrid.rows || valueGrid.cols != zoneGrid.cols) {
			throw new ResampleException(String.format("value grid (%dx%d) and zone grid (%dx%d) do not match",
					valueGrid.rows, valueGrid.cols, zoneGrid.rows, zoneGrid.cols));
		}

		List<Cell> cells = new ArrayList<Cell>();
		Set<Cell> visited = new HashSet<Cell>();
		Set<Cell> queued = new HashSet<Cell>();
		Queue<Cell> queue = new ArrayDeque<Cell>();

		cells.add(seed);
		visited.add(seed);
		enqueueNeighbors(seed, zoneGrid, zoneValue, queue, queued, visited);

		int minRow = seed.row, maxRow = seed.row;
		int minCol = seed.col, maxCol = seed.col;

		while (!queue.isEmpty()) {
			Cell cell = queue.poll();
			queued.remove(cell);
			visited.add(cell);

			cells.add(cell);
			minRow = Math.min(minRow, cell.row);
			maxRow = Math.max(maxRow, cell.row);
			minCol = Math.min(minCol, cell.col);
			maxCol = Math.max(maxCol, cell.col);

			if (includeOutsideBoundary || Grid.same(valueGrid.get(cell.row, cell.col), searchedValue)) {
				enqueueNeighbors(cell, zoneGrid, zoneValue, queue, queued, visited);
			}
		}

		Grid local = valueGrid.subGrid(minRow, minCol, maxRow, maxCol);
		local.resetValues();
		for (Cell cell : cells) {
			float v = valueGrid.get(cell.row, cell.col);
			local.set(cell.row - minRow, cell.col - minCol, Grid.same(v, searchedValue) ? replacedValue : v);
		}
		return new Region(local, cells, minRow, minCol, maxRow, maxCol);
	}

	void enqueueNeighbors(Cell cell, Grid zoneGrid, float zoneValue, Queue<Cell> queue, Set<Cell> queued, Set<Cell> visited) {
		int n = (diagonal ? 8 : 4);
		for (int i = 0; i < n; i++) {
			int r = cell.row + OFFSETS[i][0];
			int c = cell.col + OFFSETS[i][1];
			if (!zoneGrid.inBounds(r, c) || !Grid.same(zoneGrid.get(r, c), zoneValue)) {
				continue;
			}
			Cell neighbor = new Cell(r, c);
			if (!visited.contains(neighbor) && !queued.contains(neighbor)) {
				queue.add(neighbor);
				queued.add(neighbor);
			}
		}
	}
}
