package com.tarterware.pedalpath.utilities;

import java.util.Locale;

public class StringUtilities {
	/**
	 * Test if string is null, empty, or blank.
	 * @param str String to be evaluated
	 * @return true if the string is null, empty, or blank.
	 */
	public static boolean isNullEmptyOrBlank(String str) {
		if(str == null) {
			return true;
		}
		if(str.trim().isEmpty()) {
			return true;
		}

		return false;
	}

	/**
	 * Format a distance for display: whole meters below one kilometer,
	 * kilometers with one decimal otherwise.
	 * @param meters Distance in meters.
	 * @return e.g. "850 m" or "12.3 km".
	 */
	public static String formatDistance(double meters) {
		if(meters < 1000.0) {
			return String.format(Locale.ROOT, "%d m", Math.round(meters));
		}

		return String.format(Locale.ROOT, "%.1f km", meters / 1000.0);
	}

	/**
	 * Format a duration for display.
	 * @param seconds Duration in seconds, or null when unknown.
	 * @return "Hh Mm" when at least an hour, "M min" otherwise, "--:--" for null.
	 */
	public static String formatDuration(Double seconds) {
		if(seconds == null) {
			return "--:--";
		}

		long totalSeconds = (long) Math.floor(seconds);
		long hours = totalSeconds / 3600;
		long minutes = (totalSeconds % 3600) / 60;
		if(hours > 0) {
			return hours + "h " + minutes + "m";
		}

		return minutes + " min";
	}

	/**
	 * Format a speed for display in km/h with one decimal.
	 * @param metersPerSecond Speed in meters per second.
	 * @return e.g. "18.0 km/h".
	 */
	public static String formatSpeed(double metersPerSecond) {
		return String.format(Locale.ROOT, "%.1f km/h", GeoUtilities.convertMetersPerSecondToKmh(metersPerSecond));
	}
}
