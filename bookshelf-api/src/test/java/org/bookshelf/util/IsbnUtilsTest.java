package org.bookshelf.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IsbnUtilsTest {

    @Test
    void sanitizeRemovesSpreadsheetQuoting() {
        assertThat(IsbnUtils.sanitize("=\"9781250313195\"")).isEqualTo("9781250313195");
    }

    @Test
    void sanitizeUppercasesCheckDigitX() {
        assertThat(IsbnUtils.sanitize("0-306-40615-x")).isEqualTo("030640615X");
    }

    @Test
    void sanitizeReturnsNullWhenNoIsbnCharactersRemain() {
        assertThat(IsbnUtils.sanitize("=\"\"")).isNull();
        assertThat(IsbnUtils.sanitize(null)).isNull();
    }

    @Test
    void toIsbn13KeepsIsbn13() {
        assertThat(IsbnUtils.toIsbn13("978-1-4028-9462-6")).isEqualTo("9781402894626");
    }

    @Test
    void toIsbn13ConvertsIsbn10() {
        assertThat(IsbnUtils.toIsbn13("0-306-40615-2")).isEqualTo("9780306406157");
        assertThat(IsbnUtils.toIsbn13("[2070291362]")).isEqualTo("9782070291366");
    }

    @Test
    void toIsbn13RejectsOtherIdentifiers() {
        assertThat(IsbnUtils.toIsbn13("12345")).isNull();
        assertThat(IsbnUtils.toIsbn13("a1b2c3")).isNull();
        assertThat(IsbnUtils.isValidIsbn13("978030640615")).isFalse();
        assertThat(IsbnUtils.isValidIsbn10("030640615X")).isTrue();
    }

    @Test
    void toIsbn13RejectsThirteenDigitsWithoutValidCheckDigit() {
        assertThat(IsbnUtils.toIsbn13("9781250313196")).isNull();
        assertThat(IsbnUtils.isValidIsbn13("9781250313196")).isFalse();
    }

    @Test
    void toIsbn13RejectsThirteenDigitsOutsideBooklandPrefixes() {
        assertThat(IsbnUtils.toIsbn13("2700000000000")).isNull();
        assertThat(IsbnUtils.isValidIsbn13("2700000000000")).isFalse();
    }

    @Test
    void isValidIsbn13AcceptsBothPrefixes() {
        assertThat(IsbnUtils.isValidIsbn13("9781250313195")).isTrue();
        assertThat(IsbnUtils.isValidIsbn13("979-10-90636-07-1")).isTrue();
    }
}
