package org.springaicommunity.github.teamhealth;

import java.util.Locale;

/**
 * The independently scored dimensions of an issue.
 */
public enum EvaluationType {

	SPEED, QUALITY, CONSISTENCY;

	public static EvaluationType fromString(String value) {
		try {
			return valueOf(value.trim().toUpperCase(Locale.ROOT));
		}
		catch (IllegalArgumentException e) {
			throw new IllegalArgumentException(
					"Unknown evaluation type '" + value + "'. Expected speed, quality or consistency", e);
		}
	}

}
