package works.lazon.document;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.lazon.document.PathSegment.Index;
import works.lazon.document.PathSegment.Key;
import works.lazon.document.PathSegment.PointerToken;
import works.lazon.document.PathSegment.Wildcard;
import works.lazon.exceptions.ErrorCode;
import works.lazon.exceptions.ErrorTaxonomy;
import works.lazon.exceptions.JsonException;
import works.lazon.exceptions.JsonNavigationException;
import works.lazon.scan.JsonIterator;
import works.lazon.scan.JsonType;
import works.lazon.scan.Utf8Validator;

/**
 * Parses JSON pointers and path expressions, and finds the values they address.
 * <p>
 * Resolution yields {@link JsonIterator#checkpoint() checkpoints} rather than values,
 * so that nothing is materialized until the whole path has been resolved.
 * <p>
 * Supported path syntax: an optional leading {@code $}, followed by any sequence of
 * {@code .name}, {@code [n]}, {@code ['name']}, {@code ["name"]},
 * and, where wildcards are allowed, {@code .*} and {@code [*]}.
 * A leading name may omit its dot, as in {@code a.b[0]}.
 */
final class PathResolver {
	private PathResolver() {}

	/**
	 * Accepts both the plain string form and the URI fragment form
	 * ({@code #/a/b%20c}) described in RFC 6901 section 6.
	 *
	 * @throws works.lazon.exceptions.JsonPathException if {@code pointer} is not a valid RFC 6901 JSON pointer
	 */
	static List<PathSegment> parsePointer(String pointer) {
		if (!pointer.isEmpty() && pointer.charAt(0) == '#') {
			return parsePlainPointer(decodeFragment(pointer));
		}
		return parsePlainPointer(pointer);
	}

	private static List<PathSegment> parsePlainPointer(String pointer) {
		if (pointer.isEmpty()) {
			return List.of();
		}
		if (pointer.charAt(0) != '/') {
			throw invalidPath("JSON pointer must start with '/'", pointer);
		}
		List<PathSegment> result = new ArrayList<>();
		int start = 1;
		while (true) {
			int slash = pointer.indexOf('/', start);
			int end = (slash == -1) ? pointer.length() : slash;
			result.add(new PointerToken(unescapePointerToken(pointer, start, end)));
			if (slash == -1) {
				return result;
			}
			start = slash + 1;
		}
	}

	/**
	 * Strips the leading {@code #} and decodes {@code %xx} escapes as UTF-8.
	 */
	static String decodeFragment(String fragment) {
		if (fragment.indexOf('%') == -1) {
			return fragment.substring(1);
		}
		byte[] bytes = new byte[fragment.length() * 3];
		int length = 0;
		for (int i = 1; i < fragment.length(); i++) {
			char c = fragment.charAt(i);
			if (c == '%') {
				int hi = (i + 2 < fragment.length()) ? Character.digit(fragment.charAt(i + 1), 16) : -1;
				int lo = (hi == -1) ? -1 : Character.digit(fragment.charAt(i + 2), 16);
				if (lo == -1) {
					throw invalidFragment("'%' must be followed by two hex digits", fragment);
				}
				bytes[length++] = (byte) ((hi << 4) | lo);
				i += 2;
			} else {
				byte[] encoded = String.valueOf(c).getBytes(StandardCharsets.UTF_8);
				if (Character.isHighSurrogate(c) && i + 1 < fragment.length()) {
					encoded = fragment.substring(i, i + 2).getBytes(StandardCharsets.UTF_8);
					i++;
				}
				System.arraycopy(encoded, 0, bytes, length, encoded.length);
				length += encoded.length;
			}
		}
		if (Utf8Validator.firstInvalid(bytes, 0, length) != -1) {
			throw invalidFragment("escapes do not decode as UTF-8", fragment);
		}
		return new String(bytes, 0, length, StandardCharsets.UTF_8);
	}

	private static String unescapePointerToken(String pointer, int start, int end) {
		int tilde = pointer.indexOf('~', start);
		if (tilde == -1 || tilde >= end) {
			return pointer.substring(start, end);
		}
		StringBuilder sb = new StringBuilder(end - start);
		for (int i = start; i < end; i++) {
			char c = pointer.charAt(i);
			if (c == '~') {
				char next = (i + 1 < end) ? pointer.charAt(i + 1) : 0;
				switch (next) {
					case '0' -> sb.append('~');
					case '1' -> sb.append('/');
					default -> throw invalidPath("'~' must be followed by '0' or '1'", pointer);
				}
				i++;
			} else {
				sb.append(c);
			}
		}
		return sb.toString();
	}

	/**
	 * @throws works.lazon.exceptions.JsonPathException if {@code path} is malformed,
	 * or contains a wildcard when {@code allowWildcards} is false
	 */
	static List<PathSegment> parsePath(String path, boolean allowWildcards) {
		List<PathSegment> result = new ArrayList<>();
		int i = 0;
		int length = path.length();
		if (i < length && path.charAt(i) == '$') {
			i++;
		} else if (i < length && path.charAt(i) != '.' && path.charAt(i) != '[') {
			// Leading name without a dot
			int end = endOfName(path, i);
			result.add(nameSegment(path.substring(i, end), path, allowWildcards));
			i = end;
		}
		while (i < length) {
			char c = path.charAt(i);
			if (c == '.') {
				int end = endOfName(path, i + 1);
				if (end == i + 1) {
					throw invalidPath("Empty name after '.'", path);
				}
				result.add(nameSegment(path.substring(i + 1, end), path, allowWildcards));
				i = end;
			} else if (c == '[') {
				int close;
				char first = (i + 1 < length) ? path.charAt(i + 1) : 0;
				if (first == '\'' || first == '"') {
					int endQuote = path.indexOf(first, i + 2);
					if (endQuote == -1 || endQuote + 1 >= length || path.charAt(endQuote + 1) != ']') {
						throw invalidPath("Unterminated quoted name", path);
					}
					result.add(new Key(path.substring(i + 2, endQuote)));
					close = endQuote + 1;
				} else {
					close = path.indexOf(']', i + 1);
					if (close == -1) {
						throw invalidPath("Unterminated '['", path);
					}
					String inside = path.substring(i + 1, close);
					if (inside.equals("*")) {
						result.add(wildcard(path, allowWildcards));
					} else {
						result.add(new Index(parseIndex(inside, path)));
					}
				}
				i = close + 1;
			} else {
				throw invalidPath("Unexpected character '" + c + "'", path);
			}
		}
		return result;
	}

	private static int endOfName(String path, int start) {
		int i = start;
		while (i < path.length() && path.charAt(i) != '.' && path.charAt(i) != '[') {
			i++;
		}
		return i;
	}

	private static PathSegment nameSegment(String name, String path, boolean allowWildcards) {
		return name.equals("*") ? wildcard(path, allowWildcards) : new Key(name);
	}

	private static PathSegment wildcard(String path, boolean allowWildcards) {
		if (!allowWildcards) {
			throw invalidPath("Wildcards are not supported here", path);
		}
		return Wildcard.INSTANCE;
	}

	private static long parseIndex(String digits, String path) {
		if (digits.isEmpty() || digits.length() > 18) {
			throw invalidPath("Invalid array index '" + digits + "'", path);
		}
		for (int i = 0; i < digits.length(); i++) {
			char c = digits.charAt(i);
			if (c < '0' || c > '9') {
				throw invalidPath("Invalid array index '" + digits + "'", path);
			}
		}
		return Long.parseLong(digits);
	}

	/**
	 * @return the checkpoint of the single value addressed by {@code path}, starting from the root
	 * @throws JsonNavigationException if there's no such value
	 */
	static int resolveOne(JsonIterator iterator, List<PathSegment> path) {
		List<Integer> result = new ArrayList<>(1);
		step(iterator, path, 0, 0, result, false);
		assert result.size() == 1;
		return result.get(0);
	}

	/**
	 * @return checkpoints of every value matching {@code path}, in document order.
	 * Branches that don't match are skipped.
	 */
	static List<Integer> resolveAll(JsonIterator iterator, List<PathSegment> path) {
		List<Integer> result = new ArrayList<>();
		try {
			step(iterator, path, 0, 0, result, true);
		} catch (JsonNavigationException e) {
			LOGGER.trace("No matches: {}", e.getMessage());
			assert result.isEmpty();
		}
		return result;
	}

	private static void step(JsonIterator iterator, List<PathSegment> path, int depth, int checkpoint, List<Integer> out, boolean skipMisses) {
		if (depth == path.size()) {
			out.add(checkpoint);
			return;
		}
		iterator.seek(checkpoint);
		PathSegment segment = path.get(depth);
		if (segment instanceof Key key) {
			step(iterator, path, depth + 1, memberCheckpoint(iterator, key.name()), out, skipMisses);
		} else if (segment instanceof Index index) {
			step(iterator, path, depth + 1, elementCheckpoint(iterator, index.index()), out, skipMisses);
		} else if (segment instanceof PointerToken token) {
			int next;
			if (iterator.peekType() == JsonType.ARRAY) {
				next = elementCheckpoint(iterator, pointerIndex(token.token()));
			} else {
				next = memberCheckpoint(iterator, token.token());
			}
			step(iterator, path, depth + 1, next, out, skipMisses);
		} else if (segment == Wildcard.INSTANCE) {
			for (int child : childCheckpoints(iterator)) {
				if (skipMisses) {
					try {
						step(iterator, path, depth + 1, child, out, true);
					} catch (JsonNavigationException e) {
						LOGGER.trace("No match below checkpoint {}: {}", child, e.getMessage());
					}
				} else {
					step(iterator, path, depth + 1, child, out, false);
				}
			}
		} else {
			throw new AssertionError("Unexpected path segment: " + segment);
		}
	}

	private static int memberCheckpoint(JsonIterator iterator, String name) {
		if (iterator.enterObject()) {
			do {
				if (iterator.fieldKey().equals(name)) {
					return iterator.checkpoint();
				}
				iterator.skipValue();
			} while (iterator.nextField());
		}
		throw miss(ErrorCode.NO_SUCH_FIELD, "'" + name + "'");
	}

	private static int elementCheckpoint(JsonIterator iterator, long index) {
		if (iterator.enterArray()) {
			long remaining = index;
			do {
				if (remaining-- == 0) {
					return iterator.checkpoint();
				}
				iterator.skipValue();
			} while (iterator.nextElement());
		}
		throw miss(ErrorCode.INDEX_OUT_OF_BOUNDS, "[" + index + "]");
	}

	private static List<Integer> childCheckpoints(JsonIterator iterator) {
		List<Integer> result = new ArrayList<>();
		switch (iterator.peekType()) {
			case OBJECT -> {
				if (iterator.enterObject()) {
					do {
						iterator.fieldKey();
						result.add(iterator.checkpoint());
						iterator.skipValue();
					} while (iterator.nextField());
				}
			}
			case ARRAY -> {
				if (iterator.enterArray()) {
					do {
						result.add(iterator.checkpoint());
						iterator.skipValue();
					} while (iterator.nextElement());
				}
			}
			default -> throw miss(ErrorCode.INCORRECT_TYPE, "(wildcard applied to a scalar)");
		}
		return result;
	}

	/**
	 * Array indexes in a JSON pointer are decimal with no leading zeros.
	 * {@code -} refers to the element after the last, which never exists.
	 */
	private static long pointerIndex(String token) {
		if (token.equals("-")) {
			throw miss(ErrorCode.INDEX_OUT_OF_BOUNDS, "(the '-' index)");
		}
		if (token.isEmpty()) {
			throw ErrorTaxonomy.exceptionFor(ErrorCode.INVALID_JSON_POINTER, "(empty array index)");
		}
		for (int i = 0; i < token.length(); i++) {
			char c = token.charAt(i);
			if (c < '0' || c > '9') {
				throw miss(ErrorCode.INCORRECT_TYPE, "(array index '" + token + "' is not a number)");
			}
		}
		if (token.length() > 1 && token.charAt(0) == '0') {
			throw ErrorTaxonomy.exceptionFor(ErrorCode.INVALID_JSON_POINTER, "(array index '" + token + "' has a leading zero)");
		}
		if (token.length() > 18) {
			throw miss(ErrorCode.INDEX_OUT_OF_BOUNDS, "[" + token + "]");
		}
		return Long.parseLong(token);
	}

	private static JsonException miss(ErrorCode code, String detail) {
		assert ErrorTaxonomy.isLookupMiss(code);
		return ErrorTaxonomy.exceptionFor(code, detail);
	}

	private static JsonException invalidPath(String detail, String path) {
		return ErrorTaxonomy.exceptionFor(ErrorCode.INVALID_JSON_POINTER, "(" + detail + ": \"" + path + "\")");
	}

	private static JsonException invalidFragment(String detail, String fragment) {
		return ErrorTaxonomy.exceptionFor(ErrorCode.INVALID_URI_FRAGMENT, "(" + detail + ": \"" + fragment + "\")");
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(PathResolver.class);
}
