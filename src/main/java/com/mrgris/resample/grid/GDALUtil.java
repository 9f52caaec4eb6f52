package com.mrgris.resample.grid;

import org.gdal.gdal.gdal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class GDALUtil {

	private static final Logger LOG = LoggerFactory.getLogger(GDALUtil.class);

	public static boolean initialized = false;

	/* the native gdal libraries must be on java.library.path */
	public static synchronized void initializeGDAL() {
		if (initialized) {
			return;
		}

		gdal.AllRegister();
		LOG.debug("gdal " + gdal.VersionInfo("RELEASE_NAME") + ", " + gdal.GetDriverCount() + " drivers");

		initialized = true;
	}

	static String lastError() {
		String msg = gdal.GetLastErrorMsg();
		return (msg == null || msg.isEmpty() ? "unknown gdal error" : msg);
	}
}
