package my.compositeindex.app.util;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

public final class CsvParsing {
	private CsvParsing() {
	}

	public static String stripBom(String value) {
		if (value == null || value.isEmpty()) {
			return value;
		}
		int start = 0;
		while (start < value.length() && value.charAt(start) == '\uFEFF') {
			start++;
		}
		return value.substring(start);
	}

	/**
	 * First non-blank line of the text, or an empty string.
	 */
	public static String headerLine(String text) {
		if (text == null) {
			return "";
		}
		for (String line : text.split("\\R", -1)) {
			if (!line.isBlank()) {
				return line;
			}
		}
		return "";
	}

	/**
	 * Picks ';' when the header carries more semicolons than commas, otherwise ','.
	 */
	public static char sniffDelimiter(String header) {
		if (header == null || header.isEmpty()) {
			return ',';
		}
		long commas = header.chars().filter(c -> c == ',').count();
		long semicolons = header.chars().filter(c -> c == ';').count();
		return semicolons > commas ? ';' : ',';
	}

	/**
	 * Strict UTF-8 with a latin-1 fallback; a leading BOM is removed.
	 */
	public static String decode(byte[] payload) {
		CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT);
		try {
			return stripBom(decoder.decode(ByteBuffer.wrap(payload)).toString());
		} catch (CharacterCodingException ex) {
			return stripBom(new String(payload, StandardCharsets.ISO_8859_1));
		}
	}

	public static String trimToEmpty(String value) {
		return value == null ? "" : value.trim();
	}
}
