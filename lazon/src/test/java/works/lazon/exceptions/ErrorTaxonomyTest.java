package works.lazon.exceptions;

import java.util.EnumSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ErrorTaxonomyTest {

	@ParameterizedTest
	@EnumSource(ErrorCode.class)
	void everyCode_mapsToItsKind(ErrorCode code) {
		JsonException e = ErrorTaxonomy.exceptionFor(code);
		assertSame(code, e.code());
		assertEquals(code.kind(), e.kind());
		assertEquals(code.message(), e.getMessage());
		Class<? extends JsonException> expected = switch (code.kind()) {
			case SYNTAX -> JsonSyntaxException.class;
			case NUMBER_FORMAT -> JsonNumberException.class;
			case EMPTY -> JsonEmptyInputException.class;
			case RESOURCE_LIMIT -> JsonResourceException.class;
			case NAVIGATION_MISS -> JsonNavigationException.class;
			case STRUCTURAL_MISUSE -> JsonUsageException.class;
			case PATH_SYNTAX -> JsonPathException.class;
			case IO, UNSUPPORTED_ARCHITECTURE, UNEXPECTED -> JsonProcessingException.class;
		};
		assertInstanceOf(expected, e);
	}

	@Test
	void formatExceptions_shareABaseClass() {
		assertInstanceOf(JsonFormatException.class, ErrorTaxonomy.exceptionFor(ErrorCode.TAPE_ERROR));
		assertInstanceOf(JsonFormatException.class, ErrorTaxonomy.exceptionFor(ErrorCode.NUMBER_ERROR));
		assertInstanceOf(JsonFormatException.class, ErrorTaxonomy.exceptionFor(ErrorCode.EMPTY_INPUT));
	}

	@Test
	void onlyNavigationMisses_areLookupMisses() {
		var misses = EnumSet.of(ErrorCode.NO_SUCH_FIELD, ErrorCode.INDEX_OUT_OF_BOUNDS, ErrorCode.OUT_OF_BOUNDS, ErrorCode.INCORRECT_TYPE);
		for (ErrorCode code : ErrorCode.values()) {
			assertEquals(misses.contains(code), ErrorTaxonomy.isLookupMiss(code), code::name);
		}
	}

	@Test
	void detail_isAppended() {
		JsonException e = ErrorTaxonomy.exceptionFor(ErrorCode.TAPE_ERROR, "at offset 7");
		assertEquals(ErrorCode.TAPE_ERROR.message() + " at offset 7", e.getMessage());
	}

	@Test
	void wrap_preservesClassAndCode() {
		JsonNumberException original = new JsonNumberException(ErrorCode.BIGINT_ERROR, "too big");
		JsonNumberException wrapped = JsonException.wrap(original, "Reading config");
		assertSame(ErrorCode.BIGINT_ERROR, wrapped.code());
		assertEquals("Reading config: too big", wrapped.getMessage());
		assertSame(original, wrapped.getCause());
	}

	@Test
	void outOfMemory_isFatal() {
		OutOfMemoryError oom = new OutOfMemoryError("test");
		JsonResourceException e = ErrorTaxonomy.outOfMemory(oom);
		assertSame(ErrorCode.MEMALLOC, e.code());
		assertSame(oom, e.getCause());
		assertTrue(ErrorTaxonomy.isFatal(e.code()));
		assertFalse(ErrorTaxonomy.isFatal(ErrorCode.CAPACITY));
	}
}
