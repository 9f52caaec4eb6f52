package com.mrgris.resample.grid;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.gdal.gdal.Band;
import org.gdal.gdal.Dataset;
import org.gdal.gdal.Driver;
import org.gdal.gdal.gdal;
import org.gdal.gdalconst.gdalconstConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableMap;
import com.mrgris.resample.ResampleException;

/**
 * Single-band float rasters through GDAL. Any raster GDAL can open is read; the output driver is
 * chosen by file extension.
 */
public class GDALFormat implements GridFormat {

	private static final Logger LOG = LoggerFactory.getLogger(GDALFormat.class);

	// extension -> gdal driver, and whether the driver supports Create() (else CreateCopy() from MEM)
	static final Map<String, String> DRIVERS = ImmutableMap.of(
			".tif", "GTiff",
			".tiff", "GTiff",
			".img", "HFA",
			".asc", "AAIGrid");
	static final Map<String, Boolean> DIRECT_CREATE = ImmutableMap.of(
			"GTiff", true,
			"HFA", true,
			"AAIGrid", false);

	public GDALFormat() {
		GDALUtil.initializeGDAL();
	}

	@Override
	public Grid read(Path path) {
		if (!Files.exists(path)) {
			throw new ResampleException(String.format("[%s] not found", path));
		}
		Dataset ds = gdal.Open(path.toString(), gdalconstConstants.GA_ReadOnly);
		if (ds == null) {
			throw new ResampleException(String.format("could not read grid [%s]: %s", path, GDALUtil.lastError()));
		}
		try {
			int width = ds.GetRasterXSize();
			int height = ds.GetRasterYSize();
			double[] gt = ds.GetGeoTransform();
			if (gt[2] != 0 || gt[4] != 0) {
				throw new ResampleException(String.format("[%s] is rotated, which is not supported", path));
			}
			double cellSize = gt[1];
			if (Math.abs(Math.abs(gt[5]) - cellSize) > Grid.EPS * cellSize) {
				throw new ResampleException(String.format("[%s] has non-square cells (%sx%s)", path, gt[1], Math.abs(gt[5])));
			}

			Band band = ds.GetRasterBand(1);
			Double[] nodata = new Double[1];
			band.GetNoDataValue(nodata);
			float noData = (nodata[0] != null ? nodata[0].floatValue() : Float.NaN);

			float[] data = new float[width * height];
			band.ReadRaster(0, 0, width, height, data);
			float[][] values = new float[height][width];
			for (int r = 0; r < height; r++) {
				System.arraycopy(data, r * width, values[r], 0, width);
			}

			double xmin = gt[0];
			double ymax = gt[3];
			Extent extent = new Extent(xmin, ymax - height * cellSize, xmin + width * cellSize, ymax);
			Grid grid = new Grid(values, extent, cellSize, noData);
			LOG.debug("read " + path + ": " + grid);
			return grid;
		} finally {
			ds.delete();
		}
	}

	@Override
	public void write(Grid grid, Path path) {
		String driverName = DRIVERS.get(GridFormat.extension(path));
		if (driverName == null) {
			throw new ResampleException(String.format("no output format for [%s]; use one of %s", path, DRIVERS.keySet()));
		}
		Driver driver = gdal.GetDriverByName(driverName);
		if (driver == null) {
			throw new ResampleException("gdal driver " + driverName + " is not available");
		}

		try {
			Path parent = path.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
		} catch (IOException e) {
			throw new RuntimeException(e);
		}

		boolean direct = DIRECT_CREATE.get(driverName);
		Driver createWith = (direct ? driver : gdal.GetDriverByName("MEM"));
		Dataset ds = createWith.Create(direct ? path.toString() : "", grid.cols, grid.rows, 1, gdalconstConstants.GDT_Float32);
		if (ds == null) {
			throw new ResampleException(String.format("could not create [%s]: %s", path, GDALUtil.lastError()));
		}
		try {
			ds.SetGeoTransform(new double[] {grid.extent.xmin, grid.cellSize, 0, grid.extent.ymax, 0, -grid.cellSize});
			Band band = ds.GetRasterBand(1);
			band.SetNoDataValue(grid.noData);
			float[] data = new float[grid.rows * grid.cols];
			for (int r = 0; r < grid.rows; r++) {
				System.arraycopy(grid.values[r], 0, data, r * grid.cols, grid.cols);
			}
			band.WriteRaster(0, 0, grid.cols, grid.rows, data);

			if (direct) {
				ds.FlushCache();
			} else {
				Dataset copy = driver.CreateCopy(path.toString(), ds);
				if (copy == null) {
					throw new ResampleException(String.format("could not write [%s]: %s", path, GDALUtil.lastError()));
				}
				copy.delete();
			}
		} finally {
			ds.delete();
		}
		LOG.debug("wrote " + path);
	}
}
