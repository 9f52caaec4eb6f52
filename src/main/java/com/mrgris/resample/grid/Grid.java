package com.mrgris.resample.grid;

import java.util.SortedSet;
import java.util.TreeSet;

import com.mrgris.resample.ResampleException;

/**
 * A dense raster of single-precision values with a no-data sentinel, a square cell size and an
 * axis-aligned extent. Row 0 is the top (ymax) row.
 *
 * <p>Operations that combine two grids (replaceValues, replaceFrom) match cells by position in
 * world coordinates, so the grids may have different extents as long as their cells are aligned.
 * Clipped, enlarged and copied grids never share storage with their source.
 */
public class Grid {

	static final double EPS = 1e-6;

	public final float[][] values;
	public final float noData;
	public final double cellSize;
	public final Extent extent;
	public final int rows;
	public final int cols;

	public Grid(Extent extent, double cellSize, float noData) {
		if (!(cellSize > 0)) {
			throw new IllegalArgumentException("cell size must be positive: " + cellSize);
		}
		this.extent = extent;
		this.cellSize = cellSize;
		this.noData = noData;
		this.rows = dimension(extent.height(), cellSize);
		this.cols = dimension(extent.width(), cellSize);
		this.values = new float[rows][cols];
		resetValues();
	}

	public Grid(float[][] values, Extent extent, double cellSize, float noData) {
		if (!(cellSize > 0)) {
			throw new IllegalArgumentException("cell size must be positive: " + cellSize);
		}
		this.extent = extent;
		this.cellSize = cellSize;
		this.noData = noData;
		this.rows = dimension(extent.height(), cellSize);
		this.cols = dimension(extent.width(), cellSize);
		if (values.length != rows) {
			throw new IllegalArgumentException(String.format("expected %d rows, got %d", rows, values.length));
		}
		for (float[] row : values) {
			if (row.length != cols) {
				throw new IllegalArgumentException(String.format("expected %d columns, got %d", cols, row.length));
			}
		}
		this.values = values;
	}

	/* grid with its lower-left corner at the origin */
	public static Grid of(float[][] values, double cellSize, float noData) {
		int nrows = values.length;
		int ncols = (nrows > 0 ? values[0].length : 0);
		return new Grid(values, new Extent(0, 0, ncols * cellSize, nrows * cellSize), cellSize, noData);
	}

	static int dimension(double span, double cellSize) {
		double n = span / cellSize;
		long rounded = Math.round(n);
		if (Math.abs(n - rounded) < EPS) {
			return (int)rounded;
		}
		return (int)Math.ceil(n);
	}

	/* exact equality in which NaN equals NaN; zone and no-data tests rely on this */
	public static boolean same(float a, float b) {
		return a == b || (Float.isNaN(a) && Float.isNaN(b));
	}

	/* key for grouping by zone value in hash and sorted collections; -0 and 0 are the same zone */
	public static float zoneKey(float value) {
		return (value == 0f ? 0f : value);
	}

	public boolean isNoData(float value) {
		return same(value, noData);
	}

	public float get(int row, int col) {
		return values[row][col];
	}

	public void set(int row, int col, float value) {
		values[row][col] = value;
	}

	public boolean hasValue(int row, int col) {
		return !isNoData(values[row][col]);
	}

	public boolean inBounds(int row, int col) {
		return row >= 0 && row < rows && col >= 0 && col < cols;
	}

	public double x(int col) {
		return extent.xmin + (col + 0.5) * cellSize;
	}

	public double y(int row) {
		return extent.ymax - (row + 0.5) * cellSize;
	}

	public int row(double y) {
		return (int)Math.floor((extent.ymax - y) / cellSize);
	}

	public int col(double x) {
		return (int)Math.floor((x - extent.xmin) / cellSize);
	}

	// row/column in this grid of row/column 0 of the other grid
	int rowOffset(Grid other) {
		return (int)Math.round((this.extent.ymax - other.extent.ymax) / cellSize);
	}

	int colOffset(Grid other) {
		return (int)Math.round((other.extent.xmin - this.extent.xmin) / cellSize);
	}

	/* value of the other grid at cell (row, col) of this grid; the other grid's no-data when outside it */
	float valueOf(Grid other, int row, int col) {
		int r = row - rowOffset(other);
		int c = col - colOffset(other);
		if (!other.inBounds(r, c)) {
			return other.noData;
		}
		return other.values[r][c];
	}

	public void checkCellSize(Grid other) {
		if (Math.abs(this.cellSize - other.cellSize) > EPS * Math.max(1., this.cellSize)) {
			throw new ResampleException(String.format("cell sizes are different (%s and %s)", this.cellSize, other.cellSize));
		}
	}

	public void resetValues() {
		for (float[] row : values) {
			for (int c = 0; c < row.length; c++) {
				row[c] = noData;
			}
		}
	}

	public Grid copy() {
		Grid g = new Grid(extent, cellSize, noData);
		for (int r = 0; r < rows; r++) {
			System.arraycopy(values[r], 0, g.values[r], 0, cols);
		}
		return g;
	}

	public Grid copyEmpty() {
		return new Grid(extent, cellSize, noData);
	}

	/** Sets {@code newValue} in every cell where {@code mask} has a value. */
	public void replaceValues(Grid mask, float newValue) {
		checkCellSize(mask);
		for (int r = 0; r < rows; r++) {
			for (int c = 0; c < cols; c++) {
				if (!mask.isNoData(valueOf(mask, r, c))) {
					values[r][c] = newValue;
				}
			}
		}
	}

	/** Sets {@code newValue} in every cell where {@code mask} equals {@code predicateValue}. */
	public void replaceValues(Grid mask, float predicateValue, float newValue) {
		checkCellSize(mask);
		int ro = rowOffset(mask);
		int co = colOffset(mask);
		for (int r = 0; r < rows; r++) {
			for (int c = 0; c < cols; c++) {
				if (mask.inBounds(r - ro, c - co) && same(mask.values[r - ro][c - co], predicateValue)) {
					values[r][c] = newValue;
				}
			}
		}
	}

	/** Replaces every cell of this grid equal to {@code searchedValue} by the value of {@code source}. */
	public void replaceValues(float searchedValue, Grid source) {
		checkCellSize(source);
		for (int r = 0; r < rows; r++) {
			for (int c = 0; c < cols; c++) {
				if (same(values[r][c], searchedValue)) {
					float v = valueOf(source, r, c);
					values[r][c] = (source.isNoData(v) ? noData : v);
				}
			}
		}
	}

	/**
	 * Copies the value of {@code source} into every cell where {@code mask} has a value. Source
	 * no-data (or a cell outside the source) is written as this grid's no-data.
	 */
	public void replaceFrom(Grid mask, Grid source) {
		checkCellSize(mask);
		checkCellSize(source);
		int ro = rowOffset(mask);
		int co = colOffset(mask);
		for (int mr = 0; mr < mask.rows; mr++) {
			for (int mc = 0; mc < mask.cols; mc++) {
				int r = mr + ro;
				int c = mc + co;
				if (!inBounds(r, c) || !mask.hasValue(mr, mc)) {
					continue;
				}
				float v = valueOf(source, r, c);
				values[r][c] = (source.isNoData(v) ? noData : v);
			}
		}
	}

	/** Copy of the cells within the given bounds (inclusive, in this grid's row/column indices). */
	public Grid subGrid(int minRow, int minCol, int maxRow, int maxCol) {
		if (!inBounds(minRow, minCol) || !inBounds(maxRow, maxCol) || minRow > maxRow || minCol > maxCol) {
			throw new IndexOutOfBoundsException(String.format("[%d,%d]-[%d,%d] outside %dx%d grid", minRow, minCol, maxRow, maxCol, rows, cols));
		}
		Extent sub = new Extent(
				extent.xmin + minCol * cellSize,
				extent.ymax - (maxRow + 1) * cellSize,
				extent.xmin + (maxCol + 1) * cellSize,
				extent.ymax - minRow * cellSize);
		Grid g = new Grid(sub, cellSize, noData);
		for (int r = minRow; r <= maxRow; r++) {
			System.arraycopy(values[r], minCol, g.values[r - minRow], 0, maxCol - minCol + 1);
		}
		return g;
	}

	/** Cell-aligned part of this grid that lies within the given extent. */
	public Grid clip(Extent e) {
		int c0 = Math.max(0, (int)Math.floor((e.xmin - extent.xmin) / cellSize + EPS));
		int c1 = Math.min(cols, (int)Math.ceil((e.xmax - extent.xmin) / cellSize - EPS));
		int r0 = Math.max(0, (int)Math.floor((extent.ymax - e.ymax) / cellSize + EPS));
		int r1 = Math.min(rows, (int)Math.ceil((extent.ymax - e.ymin) / cellSize - EPS));
		if (c0 >= c1 || r0 >= r1) {
			throw new ResampleException("no overlap between extents " + extent + " and " + e);
		}
		return subGrid(r0, c0, r1 - 1, c1 - 1);
	}

	/** Copy of this grid padded with no-data cells, keeping cell alignment, so it covers the given extent. */
	public Grid enlarge(Extent e) {
		int left = Math.max(0, (int)Math.ceil((extent.xmin - e.xmin) / cellSize - EPS));
		int right = Math.max(0, (int)Math.ceil((e.xmax - (extent.xmin + cols * cellSize)) / cellSize - EPS));
		int top = Math.max(0, (int)Math.ceil((e.ymax - extent.ymax) / cellSize - EPS));
		int bottom = Math.max(0, (int)Math.ceil(((extent.ymax - rows * cellSize) - e.ymin) / cellSize - EPS));
		if (left == 0 && right == 0 && top == 0 && bottom == 0) {
			return copy();
		}

		int nrows = rows + top + bottom;
		int ncols = cols + left + right;
		double ymax = extent.ymax + top * cellSize;
		double xmin = extent.xmin - left * cellSize;
		Grid g = new Grid(new Extent(xmin, ymax - nrows * cellSize, xmin + ncols * cellSize, ymax), cellSize, noData);
		for (int r = 0; r < rows; r++) {
			System.arraycopy(values[r], 0, g.values[r + top], left, cols);
		}
		return g;
	}

	/**
	 * Copy of this grid where every no-data cell next to a cell with a value gets {@code newValue}.
	 * Diagonal neighbors count only when {@code diagonal} is set.
	 */
	public Grid grow(float newValue, boolean diagonal) {
		int[][] offsets = {
				{1, 0}, {0, 1}, {-1, 0}, {0, -1},
				{-1, -1}, {1, -1}, {1, 1}, {-1, 1},
			};
		int n = (diagonal ? 8 : 4);

		Grid g = copy();
		for (int r = 0; r < rows; r++) {
			for (int c = 0; c < cols; c++) {
				if (!hasValue(r, c)) {
					continue;
				}
				for (int i = 0; i < n; i++) {
					int nr = r + offsets[i][0];
					int nc = c + offsets[i][1];
					if (g.inBounds(nr, nc) && g.isNoData(g.values[nr][nc])) {
						g.values[nr][nc] = newValue;
					}
				}
			}
		}
		return g;
	}

	public int countNonNoData() {
		int count = 0;
		for (int r = 0; r < rows; r++) {
			for (int c = 0; c < cols; c++) {
				if (hasValue(r, c)) {
					count++;
				}
			}
		}
		return count;
	}

	public SortedSet<Float> uniqueValues() {
		SortedSet<Float> unique = new TreeSet<Float>();
		for (int r = 0; r < rows; r++) {
			for (int c = 0; c < cols; c++) {
				if (hasValue(r, c)) {
					unique.add(zoneKey(values[r][c]));
				}
			}
		}
		return unique;
	}

	public String toString() {
		return String.format("%dx%d grid %s, cellsize %s, nodata %s", rows, cols, extent, cellSize, noData);
	}
}
