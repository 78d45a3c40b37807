package org.springaicommunity.github.stalerepos;

import java.util.regex.Pattern;

/**
 * Shell-style wildcard pattern matched case-sensitively against a whole name.
 *
 * <p>
 * Supports {@code *} (any run of characters), {@code ?} (one character), {@code [abc]},
 * {@code [a-z]} and negated {@code [!abc]} classes. Everything else is literal; an
 * unterminated {@code [} is matched literally.
 */
public final class GlobPattern {

	private final String glob;

	private final Pattern regex;

	private GlobPattern(String glob) {
		this.glob = glob;
		this.regex = Pattern.compile(toRegex(glob));
	}

	public static GlobPattern compile(String glob) {
		return new GlobPattern(glob);
	}

	public boolean matches(String name) {
		return regex.matcher(name).matches();
	}

	public String glob() {
		return glob;
	}

	static String toRegex(String glob) {
		StringBuilder sb = new StringBuilder();
		StringBuilder literal = new StringBuilder();
		int i = 0;
		int n = glob.length();
		while (i < n) {
			char c = glob.charAt(i++);
			if (c == '*' || c == '?') {
				flushLiteral(sb, literal);
				sb.append(c == '*' ? ".*" : ".");
			}
			else if (c == '[') {
				int end = findClassEnd(glob, i);
				if (end < 0) {
					literal.append(c);
					continue;
				}
				flushLiteral(sb, literal);
				sb.append(toCharClass(glob.substring(i, end)));
				i = end + 1;
			}
			else {
				literal.append(c);
			}
		}
		flushLiteral(sb, literal);
		return sb.toString();
	}

	/**
	 * Index of the closing bracket for a class starting at {@code start}, or -1. A
	 * {@code ]} directly after {@code [} or {@code [!} is a member, not the terminator.
	 */
	private static int findClassEnd(String glob, int start) {
		int j = start;
		if (j < glob.length() && glob.charAt(j) == '!') {
			j++;
		}
		if (j < glob.length() && glob.charAt(j) == ']') {
			j++;
		}
		return glob.indexOf(']', j);
	}

	/**
	 * Regex for a bracket class body. Reversed ranges such as {@code z-a} match nothing;
	 * a class left without members never matches, or matches any character when negated.
	 */
	private static String toCharClass(String body) {
		boolean negated = body.startsWith("!");
		StringBuilder members = new StringBuilder();
		int k = negated ? 1 : 0;
		while (k < body.length()) {
			char lo = body.charAt(k);
			if (k + 2 < body.length() && body.charAt(k + 1) == '-') {
				char hi = body.charAt(k + 2);
				if (lo <= hi) {
					appendClassMember(members, lo);
					members.append('-');
					appendClassMember(members, hi);
				}
				k += 3;
			}
			else {
				appendClassMember(members, lo);
				k++;
			}
		}
		if (members.length() == 0) {
			return negated ? "." : "(?!)";
		}
		return "[" + (negated ? "^" : "") + members + "]";
	}

	private static void appendClassMember(StringBuilder members, char ch) {
		if (Character.isLetterOrDigit(ch)) {
			members.append(ch);
		}
		else {
			members.append('\\').append(ch);
		}
	}

	private static void flushLiteral(StringBuilder sb, StringBuilder literal) {
		if (literal.length() > 0) {
			sb.append(Pattern.quote(literal.toString()));
			literal.setLength(0);
		}
	}

	@Override
	public String toString() {
		return glob;
	}

}
