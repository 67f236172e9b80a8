package com.ryuqq.eventflow.application.repository;

import com.ryuqq.eventflow.application.support.TestAccount;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PrefixedCamelCaseStreamNameBuilderTest {

    private static final UUID ID = UUID.fromString("0b9a4c5e-1f2d-4e3a-9b8c-7d6e5f4a3b2c");

    @Test
    void generateForAggregate_접두사_없이_camelCase와_dash없는_uuid() {
        assertThat(new PrefixedCamelCaseStreamNameBuilder().generateForAggregate(TestAccount.class, ID))
            .isEqualTo("testAccount-0b9a4c5e1f2d4e3a9b8c7d6e5f4a3b2c");
    }

    @Test
    void generateForAggregate_접두사는_소문자로_붙임() {
        assertThat(new PrefixedCamelCaseStreamNameBuilder("Bank").generateForAggregate(TestAccount.class, ID))
            .isEqualTo("bank.testAccount-0b9a4c5e1f2d4e3a9b8c7d6e5f4a3b2c");
    }

    @Test
    void generateForCategory_ce_접두사() {
        assertThat(new PrefixedCamelCaseStreamNameBuilder("bank").generateForCategory(TestAccount.class))
            .isEqualTo("$ce-bank.testAccount");
    }

    @Test
    void generateForEventType_et_접두사() {
        assertThat(new PrefixedCamelCaseStreamNameBuilder().generateForEventType("Deposited"))
            .isEqualTo("$et-Deposited");
    }

    @Test
    void constructor_빈_접두사면_IllegalArgumentException() {
        assertThatThrownBy(() -> new PrefixedCamelCaseStreamNameBuilder(" "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Provide with prefix or use default constructor instead.");
    }
}
