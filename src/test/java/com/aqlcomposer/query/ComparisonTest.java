package com.aqlcomposer.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for Comparison and ComparisonBuilder
 */
@DisplayName("Comparison Tests")
class ComparisonTest {

    @Test
    @DisplayName("Should bind subject kinds")
    void shouldBindSubjects() {
        assertThat(Comparison.field("age").getSubject().isField()).isTrue();
        assertThat(Comparison.any("emails").getSubject().getQuantifier()).isEqualTo(ArrayQuantifier.ANY);
        assertThat(Comparison.all("emails").getSubject().getQuantifier()).isEqualTo(ArrayQuantifier.ALL);
        assertThat(Comparison.none("emails").getSubject().getQuantifier()).isEqualTo(ArrayQuantifier.NONE);
        assertThat(Comparison.statement("1").getSubject().isField()).isFalse();
        assertThatThrownBy(() -> Comparison.field("")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should record operator and operand without evaluating them")
    void shouldRecordOperatorAndOperand() {
        Comparison comparison = Comparison.field("born").greaterThan(LocalDate.of(1990, 1, 1));

        assertThat(comparison.getOperator()).isEqualTo(ComparisonOperator.GREATER_THAN);
        assertThat(comparison.getOperand().isFieldReference()).isFalse();
        assertThat(comparison.getOperand().getValue()).isEqualTo(LocalDate.of(1990, 1, 1));
    }

    @Test
    @DisplayName("Should carry no operand for unary operators")
    void shouldHaveNoOperandForUnary() {
        Comparison comparison = Comparison.field("deleted").isFalse();

        assertThat(comparison.getOperator().isUnary()).isTrue();
        assertThat(comparison.getOperand()).isNull();
        assertThat(comparison.toString()).isEqualTo("deleted == false");
    }

    @Test
    @DisplayName("Should treat field references as bare operands")
    void shouldUseFieldReferences() {
        Comparison viaBuilder = Comparison.field("price").lesserThan(FieldReference.of("cost"));
        Comparison viaEqualTo = Comparison.field("price").equalTo(FieldReference.of("cost"));

        assertThat(viaBuilder.getOperand().isFieldReference()).isTrue();
        assertThat(viaEqualTo.getOperand().getFieldReference()).isEqualTo(FieldReference.of("cost"));
    }

    @Test
    @DisplayName("Should copy collection, array and map operands on construction")
    void shouldSnapshotOperands() {
        String[] names = {"felix", "felixm"};
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("role", "admin");

        Comparison inNames = Comparison.field("username").inArray((Object[]) names);
        Comparison withAttributes = Comparison.field("attributes").equalTo(attributes);
        names[0] = "mallory";
        attributes.put("role", "root");

        assertThat(inNames.getOperand().getValue()).isEqualTo(Arrays.asList("felix", "felixm"));
        assertThat(withAttributes.getOperand().getValue()).isEqualTo(Collections.singletonMap("role", "admin"));
    }

    @Test
    @DisplayName("Should reject null operands on ordering and pattern operators")
    void shouldRejectNullOperands() {
        assertThatThrownBy(() -> Comparison.field("age").greaterThan((Integer) null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("isNull()");
        assertThatThrownBy(() -> Comparison.field("name").like(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> Comparison.field("price").lesserThan((FieldReference) null))
                .isInstanceOf(NullPointerException.class);
    }
}
