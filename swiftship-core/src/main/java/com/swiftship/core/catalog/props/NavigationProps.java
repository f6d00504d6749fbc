package com.swiftship.core.catalog.props;

import com.swiftship.core.catalog.PropBag;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed prop sets for navigation containers and presentations.
 */
public final class NavigationProps {

    private NavigationProps() {
    }

    public record NavigationStack(String title, String titleDisplayMode) {

        public static NavigationStack from(PropBag bag) {
            return new NavigationStack(bag.string("title"), bag.string("titleDisplayMode"));
        }
    }

    public record NavigationLink(String destination) {

        public static NavigationLink from(PropBag bag) {
            return new NavigationLink(PrimitiveProps.orEmpty(bag.string("destination")));
        }
    }

    /**
     * One tab of a tab view. Tabs pair with the tab view's children by position.
     *
     * @param id tag value
     * @param title tab label
     * @param icon SF Symbol name, or null
     * @param badgeCount badge number, or null
     */
    public record Tab(String id, String title, String icon, Integer badgeCount) {
    }

    public record TabView(List<Tab> tabs, String style) {

        public static TabView from(PropBag bag) {
            List<Tab> tabs = new ArrayList<>();
            for (Object raw : bag.list("tabs")) {
                PropBag.Nested tab = PropBag.nested(raw);
                Double badge = tab.number("badgeCount");
                String title = tab.string("title", "");
                tabs.add(new Tab(
                    tab.string("id", title),
                    title,
                    tab.string("icon"),
                    badge == null ? null : (int) Math.round(badge)));
            }
            return new TabView(List.copyOf(tabs), bag.string("style"));
        }
    }

    public record Sheet(List<String> detents, boolean showsDragIndicator, boolean isInteractiveDismissDisabled) {

        public static Sheet from(PropBag bag) {
            List<String> detents = new ArrayList<>();
            bag.list("detents").forEach(d -> detents.add(String.valueOf(d)));
            return new Sheet(
                List.copyOf(detents),
                !Boolean.FALSE.equals(bag.bool("showsDragIndicator")),
                Boolean.TRUE.equals(bag.bool("isInteractiveDismissDisabled")));
        }
    }

    public record FullScreenCover(boolean isInteractiveDismissDisabled) {

        public static FullScreenCover from(PropBag bag) {
            return new FullScreenCover(Boolean.TRUE.equals(bag.bool("isInteractiveDismissDisabled")));
        }
    }

    /**
     * A button inside an alert, dialog or menu.
     *
     * @param label button title
     * @param icon SF Symbol name, or null (menus only)
     * @param role {@code default}, {@code cancel} or {@code destructive}
     */
    public record Action(String label, String icon, String role) {

        /**
         * Whether the action carries an explicit button role.
         *
         * @return true for cancel and destructive actions
         */
        public boolean hasRole() {
            return role != null && !"default".equals(role);
        }
    }

    public record Alert(String title, String message, List<Action> actions) {

        public static Alert from(PropBag bag) {
            return new Alert(PrimitiveProps.orEmpty(bag.string("title")), bag.string("message"), parseActions(bag, "actions"));
        }
    }

    public record ConfirmationDialog(String title, String titleVisibility, List<Action> actions) {

        public static ConfirmationDialog from(PropBag bag) {
            return new ConfirmationDialog(
                PrimitiveProps.orEmpty(bag.string("title")),
                bag.string("titleVisibility"),
                parseActions(bag, "actions"));
        }
    }

    public record Menu(List<Action> items) {

        public static Menu from(PropBag bag) {
            return new Menu(parseActions(bag, "items"));
        }
    }

    public record Toolbar(List<String> placements) {

        public static Toolbar from(PropBag bag) {
            List<String> placements = new ArrayList<>();
            for (Object raw : bag.list("items")) {
                placements.add(PropBag.nested(raw).string("placement", "automatic"));
            }
            return new Toolbar(List.copyOf(placements));
        }
    }

    private static List<Action> parseActions(PropBag bag, String name) {
        List<Action> actions = new ArrayList<>();
        for (Object raw : bag.list(name)) {
            PropBag.Nested action = PropBag.nested(raw);
            actions.add(new Action(action.string("label", ""), action.string("icon"), action.string("role", "default")));
        }
        return List.copyOf(actions);
    }
}
