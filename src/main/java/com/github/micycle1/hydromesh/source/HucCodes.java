package com.github.micycle1.hydromesh.source;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * HUC code helpers. Codes have an even number of digits, two per level; codes
 * read from numeric columns lose their leading zero, which is restored here.
 */
public class HucCodes {

	private HucCodes() {
	}

	public static String normalize(String huc) {
		Validate.notBlank(huc, "HUC code must not be blank");
		String code = huc.trim();
		Validate.isTrue(StringUtils.isNumeric(code), "HUC code must be numeric: %s", code);
		if (code.length() % 2 == 1) {
			code = "0" + code;
		}
		return code;
	}

	public static String normalize(long huc) {
		Validate.isTrue(huc >= 0, "HUC code must be non-negative: %d", huc);
		return normalize(Long.toString(huc));
	}

	public static int level(String huc) {
		return normalize(huc).length();
	}
}
