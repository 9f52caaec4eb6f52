package com.mrgris.resample;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.Map;
import java.util.Properties;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Settings of a resampling run. Values come from the {@code resample.properties} defaults on the
 * classpath, optionally overridden by a JSON settings file and then by command-line options. All
 * three layers use the same keys, which are the field names below.
 */
public class ResampleSettings {

	public static final String DEFAULTS_RESOURCE = "resample.properties";

	public ResampleMethod resampleMethod;
	public ConflictMethod conflictMethod;
	public double idwPower;
	public double idwSmoothing;
	public double idwMaxDistance;  // NaN: unbounded
	public Integer percentile;     // required for the percentile method only
	public int statDistance;       // 0: statistics over the full zone
	public boolean skipDiagonalProcessing;

	public String zoneFile;
	public boolean debug;
	public String debugSubZone;

	public static Properties defaults() {
		Properties props = new Properties();
		try (InputStream is = ResampleSettings.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
			if (is == null) {
				throw new ResampleException(DEFAULTS_RESOURCE + " not found on classpath");
			}
			props.load(is);
		} catch (IOException e) {
			throw new RuntimeException(e);
		}
		return props;
	}

	/* copies the (flat) settings of a JSON object over props; a null value removes the key */
	public static void overlayJson(Properties props, Reader r) {
		JsonObject json;
		try {
			json = JsonParser.parseReader(r).getAsJsonObject();
		} catch (JsonParseException | IllegalStateException e) {
			throw new ResampleException("invalid settings file: " + e.getMessage(), e);
		}
		for (Map.Entry<String, JsonElement> e : json.entrySet()) {
			JsonElement value = e.getValue();
			if (value.isJsonNull()) {
				props.remove(e.getKey());
			} else if (value.isJsonPrimitive()) {
				props.setProperty(e.getKey(), value.getAsString());
			} else {
				throw new ResampleException("setting " + e.getKey() + " must be a number, string or boolean");
			}
		}
	}

	public static ResampleSettings fromProperties(Properties props) {
		ResampleSettings s = new ResampleSettings();
		s.resampleMethod = ResampleMethod.parse(required(props, "resampleMethod"));
		s.conflictMethod = ConflictMethod.fromNumber(parseInt(props, "conflictMethod"));
		s.idwPower = parseDouble(props, "idwPower");
		s.idwSmoothing = parseDouble(props, "idwSmoothing");
		s.idwMaxDistance = parseDouble(props, "idwMaxDistance");
		s.percentile = (props.getProperty("percentile") != null ? parseInt(props, "percentile") : null);
		s.statDistance = parseInt(props, "statDistance");
		s.skipDiagonalProcessing = Boolean.parseBoolean(required(props, "skipDiagonalProcessing").trim());
		s.zoneFile = props.getProperty("zoneFile");
		s.debug = Boolean.parseBoolean(props.getProperty("debug", "false").trim());
		s.debugSubZone = props.getProperty("debugSubZone");
		if (s.debugSubZone != null) {
			s.debug = true;
		}
		s.validate();
		return s;
	}

	public void validate() {
		if (resampleMethod == ResampleMethod.PERCENTILE_VALUE) {
			if (percentile == null) {
				throw new ResampleException("percentile is required for the percentile resample method");
			}
			if (percentile < 0 || percentile > 100) {
				throw new ResampleException("invalid percentile value for percentile resample method: " + percentile);
			}
		}
		if (statDistance < 0) {
			throw new ResampleException("statistics distance cannot be negative: " + statDistance);
		}
		if (statDistance > 0 && resampleMethod.isRegional()) {
			throw new ResampleException("a statistics distance cannot be combined with the " + resampleMethod.key + " method");
		}
		if (idwSmoothing < 0) {
			throw new ResampleException("IDW smoothing cannot be negative: " + idwSmoothing);
		}
		if (idwMaxDistance < 0) {
			throw new ResampleException("IDW maximum distance cannot be negative: " + idwMaxDistance);
		}
	}

	static String required(Properties props, String key) {
		String value = props.getProperty(key);
		if (value == null) {
			throw new ResampleException("missing setting: " + key);
		}
		return value;
	}

	/* json numbers come through as e.g. "2.0", so whole doubles are accepted too */
	static int parseInt(Properties props, String key) {
		double d = parseDouble(props, key);
		if (d != Math.rint(d) || Math.abs(d) > Integer.MAX_VALUE) {
			throw new ResampleException("invalid integer for " + key + ": " + props.getProperty(key));
		}
		return (int)d;
	}

	static double parseDouble(Properties props, String key) {
		String value = required(props, key).trim();
		try {
			return Double.parseDouble(value);
		} catch (NumberFormatException e) {
			throw new ResampleException("invalid number for " + key + ": " + value, e);
		}
	}

	public String toString() {
		StringBuilder sb = new StringBuilder(resampleMethod.key);
		switch (resampleMethod) {
		case NEAREST_NEIGHBOR:
			sb.append(", conflict method " + conflictMethod);
			break;
		case IDW:
			sb.append(String.format(", power %s, smoothing %s, max distance %s", idwPower, idwSmoothing, idwMaxDistance));
			break;
		case PERCENTILE_VALUE:
			sb.append(", percentile " + percentile);
			// fall through
		default:
			sb.append(statDistance == 0 ? ", full zone" : ", window distance " + statDistance);
		}
		if (skipDiagonalProcessing) {
			sb.append(", no diagonals");
		}
		return sb.toString();
	}
}
