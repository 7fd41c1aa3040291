package com.enterprise.morpher.sql.validation;

import com.enterprise.morpher.sql.validation.SchemaValidator.SchemaProblem;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class SchemaValidatorTest {

    private final SchemaValidator validator = new SchemaValidator(table -> switch (table) {
        case "users" -> Set.of("ID", "USERNAME");
        case "profiles" -> Set.of("user_id", "phone");
        default -> Set.of();
    });

    @Test
    void testExistingColumnsMatchCaseInsensitively() {
        Map<String, List<String>> required = Map.of("users", List.of("id", "username"));

        assertThat(validator.validate(required)).isEmpty();
    }

    @Test
    void testMissingTableAndColumnReported() {
        Map<String, List<String>> required = new LinkedHashMap<>();
        required.put("profiles", List.of("user_id", "email"));
        required.put("countries", List.of("id"));

        List<SchemaProblem> problems = validator.validate(required);

        assertThat(problems).hasSize(2);
        assertThat(problems.get(0).column()).isEqualTo("email");
        assertThat(problems.get(0).missingTable()).isFalse();
        assertThat(problems.get(1).table()).isEqualTo("countries");
        assertThat(problems.get(1).missingTable()).isTrue();
        assertThat(problems.get(1).message()).contains("Table 'countries' not found");
    }
}
