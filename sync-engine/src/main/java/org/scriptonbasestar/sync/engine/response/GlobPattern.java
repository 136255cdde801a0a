package org.scriptonbasestar.sync.engine.response;

import lombok.experimental.UtilityClass;

import java.util.regex.Pattern;

/**
 * Redis KEYS/SCAN MATCH 스타일 glob 을 정규식으로 바꾼다.
 * <ul>
 *   <li>{@code *} 임의 길이, {@code ?} 한 글자</li>
 *   <li>{@code [abc]}, {@code [a-z]}, {@code [^a]} 문자 클래스 (범위가 뒤집혀 있으면 Redis 처럼 뒤집어서 해석)</li>
 *   <li>{@code \x} 다음 글자를 그대로 매칭</li>
 * </ul>
 * 닫히지 않은 {@code [} 는 일반 글자로 취급한다.
 *
 * @author archmagece
 * @since 2025-02
 */
@UtilityClass
public class GlobPattern {

	private static final String SPECIAL = "*?[]\\";

	public static Pattern compile(String glob) {
		StringBuilder regex = new StringBuilder();
		StringBuilder literal = new StringBuilder();
		int i = 0;
		int n = glob.length();
		while (i < n) {
			char c = glob.charAt(i);
			if (c == '\\' && i + 1 < n) {
				literal.append(glob.charAt(i + 1));
				i += 2;
				continue;
			}
			int end = c == '[' ? classEnd(glob, i + 1) : -1;
			if (c != '*' && c != '?' && end < 0) {
				literal.append(c);
				i++;
				continue;
			}
			flush(regex, literal);
			if (c == '*') {
				regex.append(".*");
				i++;
			} else if (c == '?') {
				regex.append('.');
				i++;
			} else {
				regex.append(charClass(glob, i + 1, end));
				i = end + 1;
			}
		}
		flush(regex, literal);
		return Pattern.compile(regex.toString(), Pattern.DOTALL);
	}

	private static void flush(StringBuilder regex, StringBuilder literal) {
		if (literal.length() > 0) {
			regex.append(Pattern.quote(literal.toString()));
			literal.setLength(0);
		}
	}

	public static boolean matches(String glob, String key) {
		return compile(glob).matcher(key).matches();
	}

	/**
	 * glob 특수문자를 escape 해서 text 가 글자 그대로 매칭되게 한다.
	 */
	public static String escape(String text) {
		StringBuilder sb = new StringBuilder(text.length());
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (SPECIAL.indexOf(c) >= 0) {
				sb.append('\\');
			}
			sb.append(c);
		}
		return sb.toString();
	}

	// 닫는 ']' 의 위치, 없으면 -1. 클래스 안의 '\]' 는 닫는 괄호가 아니다
	private static int classEnd(String glob, int from) {
		int i = from;
		while (i < glob.length()) {
			char c = glob.charAt(i);
			if (c == '\\' && i + 1 < glob.length()) {
				i += 2;
			} else if (c == ']') {
				return i;
			} else {
				i++;
			}
		}
		return -1;
	}

	private static String charClass(String glob, int from, int end) {
		int i = from;
		boolean negate = false;
		if (i < end && glob.charAt(i) == '^') {
			negate = true;
			i++;
		}
		StringBuilder members = new StringBuilder();
		while (i < end) {
			char c = glob.charAt(i);
			if (c == '\\' && i + 1 < end) {
				c = glob.charAt(i + 1);
				i += 2;
			} else {
				i++;
			}
			if (i + 1 < end && glob.charAt(i) == '-') {
				char to = glob.charAt(i + 1);
				int skip = 2;
				if (to == '\\' && i + 2 < end) {
					to = glob.charAt(i + 2);
					skip = 3;
				}
				char low = c <= to ? c : to;
				char high = c <= to ? to : c;
				members.append(literal(low)).append('-').append(literal(high));
				i += skip;
			} else {
				members.append(literal(c));
			}
		}
		if (members.length() == 0) {
			// 빈 클래스: [] 는 아무것도, [^] 는 아무 글자나
			return negate ? "." : "(?!)";
		}
		return "[" + (negate ? "^" : "") + members + "]";
	}

	private static String literal(char c) {
		return String.format("\\x{%X}", (int) c);
	}
}
