package com.swiftship.core.assembler;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ViewNames}.
 */
class ViewNamesTest {

    @ParameterizedTest
    @CsvSource({
        "LoginScreen, LoginScreen",
        "login-screen.swift, LoginScreen",
        "profile_card, ProfileCard",
        "views/settings page.swift, SettingsPage",
        "Screens\\Home.SWIFT, Home",
        "2fa-prompt, View2faPrompt",
        "checkout.v2, CheckoutV2"
    })
    void fromFileName_derivesPascalCaseIdentifier(String fileName, String expected) {
        assertThat(ViewNames.fromFileName(fileName)).isEqualTo(expected);
    }

    @Test
    void fromFileName_nothingUsable_fallsBackToContentView() {
        assertThat(ViewNames.fromFileName(null)).isEqualTo(ViewNames.DEFAULT_VIEW_NAME);
        assertThat(ViewNames.fromFileName("")).isEqualTo("ContentView");
        assertThat(ViewNames.fromFileName("--.swift")).isEqualTo("ContentView");
    }
}
