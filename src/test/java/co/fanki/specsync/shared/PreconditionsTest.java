package co.fanki.specsync.shared;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for Preconditions utility.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PreconditionsTest {

    @Test
    void whenRequireNonNull_givenNonNullValue_shouldReturnValue() {
        final String value = "test";

        final String result = Preconditions.requireNonNull(value, "message");

        assertEquals(value, result);
    }

    @Test
    void whenRequireNonNull_givenNullValue_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonNull(null, "Value is null"));
    }

    @Test
    void whenRequireNonBlank_givenBlankString_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonBlank("  ", "String is blank"));
    }

    @Test
    void whenRequireNonBlank_givenNullString_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonBlank(null, "String is null"));
    }

    @Test
    void whenRequire_givenFalseCondition_shouldThrowWithMessage() {
        final IllegalArgumentException e = assertThrows(
                IllegalArgumentException.class,
                () -> Preconditions.require(false, "Condition is false"));

        assertEquals("Condition is false", e.getMessage());
    }

    @Test
    void whenRequirePositive_givenPositiveValue_shouldReturnValue() {
        assertEquals(500L, Preconditions.requirePositive(500L, "message"));
    }

    @Test
    void whenRequirePositive_givenZero_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requirePositive(0L, "Not positive"));
    }

    @Test
    void whenCreatingDomainException_givenCode_shouldExposeIt() {
        final DomainException e = new DomainException("Project not found",
                "PROJECT_NOT_FOUND");

        assertEquals("PROJECT_NOT_FOUND", e.getErrorCode());
        assertEquals("Project not found", e.getMessage());
    }

}
