package com.swiftship.core.generator.impl.navigation;

import java.util.List;
import java.util.Map;

import com.swiftship.core.generator.GeneratorTestBase;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link NavigationStackGenerator}, {@link NavigationLinkGenerator},
 * {@link TabViewGenerator} and {@link MenuGenerator}.
 */
class NavigationContainerGeneratorsTest extends GeneratorTestBase {

    @Test
    void navigationStack_titleAppliesToSingleChild() {
        String printed = render(new NavigationStackGenerator(), props("title", "Settings", "titleDisplayMode", "inline"),
            text("A"));

        assertThat(printed).isEqualTo(
            "NavigationStack {\n"
                + "    Text(\"A\")\n"
                + "    .navigationTitle(\"Settings\")\n"
                + "    .navigationBarTitleDisplayMode(.inline)\n"
                + "}");
    }

    @Test
    void navigationStack_titleWithSeveralChildren_wrapsInGroup() {
        String printed = render(new NavigationStackGenerator(), props("title", "Settings"), text("A"), text("B"));

        assertThat(printed).isEqualTo(
            "NavigationStack {\n"
                + "    Group {\n"
                + "        Text(\"A\")\n"
                + "        Text(\"B\")\n"
                + "    }\n"
                + "    .navigationTitle(\"Settings\")\n"
                + "}");
    }

    @Test
    void navigationStack_withoutTitle_keepsChildrenAsIs() {
        assertThat(render(new NavigationStackGenerator(), props("titleDisplayMode", "automatic"), text("A")))
            .isEqualTo("NavigationStack {\n    Text(\"A\")\n}");
    }

    @Test
    void navigationLink_destinationAndLabel() {
        assertThat(render(new NavigationLinkGenerator(), props("destination", "Profile"), text("Open"))).isEqualTo(
            "NavigationLink(destination: Text(\"Profile\")) {\n"
                + "    Text(\"Open\")\n"
                + "}");
    }

    @Test
    void tabView_pairsTabsWithChildrenByPosition() {
        String printed = render(new TabViewGenerator(), props("tabs", List.of(
                Map.of("id", "home", "title", "Home", "icon", "house", "badgeCount", 3),
                Map.of("id", "settings", "title", "Settings"))),
            text("Home screen"));

        assertThat(printed).isEqualTo(
            "TabView {\n"
                + "    Text(\"Home screen\")\n"
                + "    .tabItem {\n"
                + "        Label(\"Home\", systemImage: \"house\")\n"
                + "    }\n"
                + "    .badge(3)\n"
                + "    .tag(\"home\")\n"
                + "    Text(\"Settings\")\n"
                + "    .tabItem {\n"
                + "        Text(\"Settings\")\n"
                + "    }\n"
                + "    .tag(\"settings\")\n"
                + "}");
    }

    @Test
    void tabView_tabWithoutId_isTaggedByTitle() {
        assertThat(render(new TabViewGenerator(), props("tabs", List.of(Map.of("title", "Feed")), "style", "page"),
            text("Feed")))
            .contains(".tag(\"Feed\")")
            .endsWith("}\n.tabViewStyle(.page)");
    }

    @Test
    void menu_itemsBecomeButtons() {
        String printed = render(new MenuGenerator(), props("items", List.of(
            Map.of("label", "Edit", "icon", "pencil"),
            Map.of("label", "Delete", "role", "destructive"))));

        assertThat(printed).isEqualTo(
            "Menu(\"More\", systemImage: \"ellipsis.circle\") {\n"
                + "    Button(\"Edit\", systemImage: \"pencil\") {\n"
                + "        // TODO: Add action\n"
                + "    }\n"
                + "    Button(\"Delete\", role: .destructive) {\n"
                + "        // TODO: Add action\n"
                + "    }\n"
                + "}");
    }
}
