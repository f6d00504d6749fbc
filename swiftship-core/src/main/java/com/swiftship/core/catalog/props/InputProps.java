package com.swiftship.core.catalog.props;

import com.swiftship.core.catalog.PropBag;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed prop sets for the input controls.
 */
public final class InputProps {

    private InputProps() {
    }

    public record TextField(
        String placeholder,
        String label,
        String axis,
        String keyboardType,
        String textContentType,
        String autocapitalization,
        boolean autocorrection
    ) {
        public static TextField from(PropBag bag) {
            return new TextField(
                PrimitiveProps.orEmpty(bag.string("placeholder")),
                bag.string("label"),
                bag.string("axis"),
                bag.string("keyboardType"),
                bag.string("textContentType"),
                bag.string("autocapitalization"),
                !Boolean.FALSE.equals(bag.bool("autocorrection")));
        }

        /**
         * The visible title: the label when given, otherwise the placeholder.
         *
         * @return field title
         */
        public String title() {
            return label != null && !label.isEmpty() ? label : placeholder;
        }
    }

    public record SecureField(String placeholder, String label, String textContentType) {

        public static SecureField from(PropBag bag) {
            return new SecureField(
                PrimitiveProps.orEmpty(bag.string("placeholder")),
                bag.string("label"),
                bag.string("textContentType"));
        }

        public String title() {
            return label != null && !label.isEmpty() ? label : placeholder;
        }
    }

    public record TextEditor(String placeholder, Double minHeight) {

        public static TextEditor from(PropBag bag) {
            return new TextEditor(bag.string("placeholder"), bag.number("minHeight"));
        }
    }

    public record Toggle(String label, boolean isOn) {

        public static Toggle from(PropBag bag) {
            return new Toggle(PrimitiveProps.orEmpty(bag.string("label")), Boolean.TRUE.equals(bag.bool("isOn")));
        }
    }

    /**
     * One picker choice.
     *
     * @param label displayed text
     * @param value tag value
     */
    public record Option(String label, String value) {
    }

    public record Picker(String label, List<Option> options, String style) {

        public static Picker from(PropBag bag) {
            List<Option> options = new ArrayList<>();
            for (Object raw : bag.list("options")) {
                PropBag.Nested option = PropBag.nested(raw);
                String label = option.string("label", "");
                options.add(new Option(label, option.string("value", label)));
            }
            return new Picker(PrimitiveProps.orEmpty(bag.string("label")), List.copyOf(options), bag.string("style"));
        }
    }

    public record DatePicker(String label, String components, String displayedComponents) {

        public static DatePicker from(PropBag bag) {
            return new DatePicker(
                PrimitiveProps.orEmpty(bag.string("label")),
                bag.string("components"),
                bag.string("displayedComponents"));
        }
    }

    public record Slider(String label, Double minValue, Double maxValue, Double step) {

        public static Slider from(PropBag bag) {
            return new Slider(bag.string("label"), bag.number("minValue"), bag.number("maxValue"), bag.number("step"));
        }
    }

    public record Stepper(String label, Double minValue, Double maxValue, Double step) {

        public static Stepper from(PropBag bag) {
            return new Stepper(
                PrimitiveProps.orEmpty(bag.string("label")),
                bag.number("minValue"),
                bag.number("maxValue"),
                bag.number("step"));
        }
    }
}
