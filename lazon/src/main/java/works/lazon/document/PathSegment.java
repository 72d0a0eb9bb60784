package works.lazon.document;

import static java.util.Objects.requireNonNull;

/**
 * One step of a parsed pointer or path expression.
 */
sealed interface PathSegment {
	/**
	 * An object member, from a path expression.
	 */
	record Key(String name) implements PathSegment {
		public Key {
			requireNonNull(name);
		}
	}

	/**
	 * An array element, from a path expression.
	 */
	record Index(long index) implements PathSegment { }

	/**
	 * A JSON pointer reference token, already unescaped.
	 * Means a member name or an array index depending on what it's applied to.
	 */
	record PointerToken(String token) implements PathSegment {
		public PointerToken {
			requireNonNull(token);
		}
	}

	/**
	 * Every member or element.
	 */
	enum Wildcard implements PathSegment {
		INSTANCE;

		@Override
		public String toString() {
			return "*";
		}
	}
}
