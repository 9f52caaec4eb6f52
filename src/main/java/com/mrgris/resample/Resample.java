package com.mrgris.resample;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Splitter;
import com.mrgris.resample.grid.GDALFormat;
import com.mrgris.resample.grid.Grid;
import com.mrgris.resample.grid.GridFormat;

/**
 * Command-line tool: resamples every grid in a directory that matches a filter within the zones
 * of a zone grid, writing {@code <name>_resampled<ext>} to the output directory.
 */
public class Resample {

	private static final Logger LOG = LoggerFactory.getLogger(Resample.class);

	static final String USAGE = "Resample [options] <inPath> <filter> <outPath>";
	static final String RESULT_POSTFIX = "_resampled";

	final GridFormat format;

	public Resample(GridFormat format) {
		this.format = format;
	}

	public static void main(String[] args) {
		System.exit(new Resample(new GDALFormat()).run(args));
	}

	static Options options() {
		Options options = new Options();
		options.addOption("z", true, "zone grid; when omitted a zone is derived from each value grid");
		options.addOption("m", true, "resample method: nn (1), idw (2), min (3), max (4), mean (5), perc (6)");
		options.addOption("c", true, "nn conflict method: 1 arithmetic average, 2 harmonic average, 3 minimum, 4 maximum");
		options.addOption("p", true, "percentile (0-100) for the perc method");
		options.addOption("d", true, "half-width in cells of the statistics window; 0 for the full zone");
		options.addOption("idw", true, "IDW parameters (format: 'power[,smoothing[,maxDistance]]')");
		options.addOption("x", false, "skip diagonal neighbors (4-connectivity)");
		options.addOption("config", true, "JSON settings file");
		options.addOption(Option.builder("debug").hasArg().optionalArg(true).argName("subzone")
				.desc("write intermediate grids to <outPath>/debug, optionally for one sub-zone (e.g. '2.0.1') only").build());
		return options;
	}

	public int run(String[] args) {
		Options options = options();
		CommandLine cmd;
		try {
			cmd = new DefaultParser().parse(options, args);
		} catch (ParseException e) {
			LOG.error(e.getMessage());
			new HelpFormatter().printHelp(USAGE, options);
			return 1;
		}
		if (cmd.getArgs().length != 3) {
			new HelpFormatter().printHelp(USAGE, options);
			return 1;
		}

		try {
			ResampleSettings settings = parseSettings(cmd);
			int count = process(Paths.get(cmd.getArgs()[0]), cmd.getArgs()[1], Paths.get(cmd.getArgs()[2]), settings);
			LOG.info("finished processing " + count + " file(s)");
			return 0;
		} catch (ResampleException e) {
			LOG.error(e.getMessage());
			return 1;
		} catch (RuntimeException e) {
			LOG.error("unexpected error", e);
			return 1;
		}
	}

	static ResampleSettings parseSettings(CommandLine cmd) {
		Properties props = ResampleSettings.defaults();
		if (cmd.hasOption("config")) {
			Path config = Paths.get(cmd.getOptionValue("config"));
			try (Reader r = Files.newBufferedReader(config)) {
				ResampleSettings.overlayJson(props, r);
			} catch (IOException e) {
				throw new ResampleException("could not read settings file " + config, e);
			}
		}

		setIfPresent(cmd, "z", props, "zoneFile");
		setIfPresent(cmd, "m", props, "resampleMethod");
		setIfPresent(cmd, "c", props, "conflictMethod");
		setIfPresent(cmd, "p", props, "percentile");
		setIfPresent(cmd, "d", props, "statDistance");
		if (cmd.hasOption("idw")) {
			List<String> parts = Splitter.on(',').trimResults().splitToList(cmd.getOptionValue("idw"));
			if (parts.size() > 3 || parts.get(0).isEmpty()) {
				throw new ResampleException("invalid IDW parameters: " + cmd.getOptionValue("idw"));
			}
			props.setProperty("idwPower", parts.get(0));
			if (parts.size() > 1) {
				props.setProperty("idwSmoothing", parts.get(1));
			}
			if (parts.size() > 2) {
				props.setProperty("idwMaxDistance", parts.get(2));
			}
		}
		if (cmd.hasOption("x")) {
			props.setProperty("skipDiagonalProcessing", "true");
		}
		if (cmd.hasOption("debug")) {
			props.setProperty("debug", "true");
			setIfPresent(cmd, "debug", props, "debugSubZone");
		}
		return ResampleSettings.fromProperties(props);
	}

	static void setIfPresent(CommandLine cmd, String opt, Properties props, String key) {
		String value = cmd.getOptionValue(opt);
		if (value != null) {
			props.setProperty(key, value);
		}
	}

	static List<Path> inputFiles(Path inPath, String filter) {
		if (!Files.isDirectory(inPath)) {
			throw new ResampleException("input path not found: " + inPath);
		}
		List<Path> files = new ArrayList<Path>();
		try (DirectoryStream<Path> ds = Files.newDirectoryStream(inPath, filter)) {
			for (Path p : ds) {
				if (Files.isRegularFile(p)) {
					files.add(p);
				}
			}
		} catch (IOException e) {
			throw new RuntimeException(e);
		}
		Collections.sort(files);
		return files;
	}

	/* outPath names the result file itself when it has the extension of the filter */
	static Path resultPath(Path valueFile, String filter, Path outPath) {
		String filterExt = GridFormat.extension(filter);
		if (!filterExt.isEmpty() && GridFormat.extension(outPath).equals(filterExt)) {
			return outPath;
		}
		String name = valueFile.getFileName().toString();
		int dot = name.lastIndexOf('.');
		String resultName = (dot < 0 ? name + RESULT_POSTFIX : name.substring(0, dot) + RESULT_POSTFIX + name.substring(dot));
		return outPath.resolve(resultName);
	}

	int process(Path inPath, String filter, Path outPath, ResampleSettings settings) {
		LOG.info("resampling with " + settings);
		ZoneResampler resampler = new ZoneResampler(settings);

		Grid zoneGrid = null;
		if (settings.zoneFile != null) {
			LOG.info("reading zone grid " + settings.zoneFile);
			zoneGrid = format.read(Paths.get(settings.zoneFile));
			LOG.info(zoneGrid.uniqueValues().size() + " unique zone value(s)");
		}

		List<Path> files = inputFiles(inPath, filter);
		if (files.isEmpty()) {
			LOG.warn("no files matching " + filter + " in " + inPath);
		}
		for (Path valueFile : files) {
			Path resultFile = resultPath(valueFile, filter, outPath);
			if (files.size() > 1 && resultFile.equals(outPath)) {
				throw new ResampleException("output file " + outPath + " given for " + files.size() + " input files");
			}
			if (settings.debug) {
				resampler.enableDebug(format, resultFile.toAbsolutePath().getParent().resolve("debug"), GridFormat.extension(resultFile));
			}

			LOG.info("processing " + valueFile.getFileName());
			Grid valueGrid = format.read(valueFile);
			Grid zone = (zoneGrid != null ? zoneGrid : resampler.deriveZone(valueGrid));
			Grid result = resampler.resample(valueGrid, zone);

			LOG.info("writing " + resultFile);
			format.write(result, resultFile);
		}
		return files.size();
	}
}
