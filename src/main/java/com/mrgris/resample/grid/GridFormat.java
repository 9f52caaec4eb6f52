package com.mrgris.resample.grid;

import java.nio.file.Path;
import java.util.Locale;

/* reads and writes grids; the resampling code itself never touches files */
public interface GridFormat {

	Grid read(Path path);

	void write(Grid grid, Path path);

	/* lower-case extension including the dot, or "" */
	static String extension(Path path) {
		return extension(path.getFileName().toString());
	}

	static String extension(String name) {
		int dot = name.lastIndexOf('.');
		return (dot < 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT));
	}
}
