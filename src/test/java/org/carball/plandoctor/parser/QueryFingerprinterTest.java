package org.carball.plandoctor.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class QueryFingerprinterTest {

    @Test
    void shouldReplaceNumericLiterals() {
        assertThat(QueryFingerprinter.fingerprint("SELECT * FROM users WHERE id = 42 LIMIT 10"))
                .isEqualTo("SELECT * FROM users WHERE id = N LIMIT N");
    }

    @Test
    void shouldReplaceStringLiterals() {
        assertThat(QueryFingerprinter.fingerprint("SELECT * FROM users WHERE name = 'alice' AND city = 'Oslo 9'"))
                .isEqualTo("SELECT * FROM users WHERE name = S AND city = S");
    }

    @Test
    void shouldReplaceArrayAndJsonLiterals() {
        assertThat(QueryFingerprinter.fingerprint("SELECT * FROM t WHERE tags && [1, 2, 3]"))
                .isEqualTo("SELECT * FROM t WHERE tags && A");
        assertThat(QueryFingerprinter.fingerprint("SELECT * FROM t WHERE doc @> {\"a\": true}"))
                .isEqualTo("SELECT * FROM t WHERE doc @> J");
    }

    @Test
    void shouldCollapseWhitespace() {
        // Given
        String query = """
            SELECT id,
                   name
              FROM users
             WHERE id = 7
            """;

        // When / Then
        assertThat(QueryFingerprinter.fingerprint(query))
                .isEqualTo("SELECT id, name FROM users WHERE id = N");
    }

    @Test
    void shouldGroupQueriesThatDifferOnlyInLiterals() {
        // Given
        String first = "SELECT * FROM orders WHERE customer_id = 17 AND status = 'open'";
        String second = "SELECT *   FROM orders WHERE customer_id = 9001 AND status = 'closed'";

        // When / Then
        assertThat(QueryFingerprinter.fingerprint(first)).isEqualTo(QueryFingerprinter.fingerprint(second));
    }

    @Test
    void shouldLeaveIdentifiersWithDigitsAlone() {
        assertThat(QueryFingerprinter.fingerprint("SELECT col1 FROM table2"))
                .isEqualTo("SELECT col1 FROM table2");
    }

    @Test
    void shouldBeIdempotent() {
        // Given
        String once = QueryFingerprinter.fingerprint("SELECT * FROM t WHERE a = 1 AND b = 'x' AND c = ARRAY[4]");

        // When / Then
        assertThat(QueryFingerprinter.fingerprint(once)).isEqualTo(once);
    }

    @Test
    void shouldHandleNullAndEmptyInput() {
        assertThat(QueryFingerprinter.fingerprint(null)).isEmpty();
        assertThat(QueryFingerprinter.fingerprint("")).isEmpty();
        assertThat(QueryFingerprinter.fingerprint("   \n ")).isEmpty();
    }
}
