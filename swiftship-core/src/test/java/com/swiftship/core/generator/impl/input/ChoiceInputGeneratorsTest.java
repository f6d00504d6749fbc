package com.swiftship.core.generator.impl.input;

import java.util.List;
import java.util.Map;

import com.swiftship.core.generator.GeneratorTestBase;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the toggle, picker, date picker, slider and stepper generators.
 */
class ChoiceInputGeneratorsTest extends GeneratorTestBase {

    @Test
    void toggle_initialStateFollowsIsOn() {
        assertThat(render(new ToggleGenerator(), props("label", "Wi-Fi", "isOn", true)))
            .isEqualTo("Toggle(\"Wi-Fi\", isOn: $isOn)");
        assertThat(stateDeclarations()).containsExactly("@State private var isOn: Bool = true");
    }

    @Test
    void picker_optionsBecomeTaggedRows() {
        String printed = render(new PickerGenerator(), props("label", "Size",
            "options", List.of(Map.of("label", "Small", "value", "s"), Map.of("label", "Large", "value", "l")),
            "style", "segmented"));

        assertThat(printed).isEqualTo(
            "Picker(\"Size\", selection: $selection) {\n"
                + "    Text(\"Small\")\n"
                + "    .tag(\"s\")\n"
                + "    Text(\"Large\")\n"
                + "    .tag(\"l\")\n"
                + "}\n"
                + ".pickerStyle(.segmented)");
        assertThat(stateDeclarations()).containsExactly("@State private var selection: String = \"s\"");
    }

    @Test
    void picker_optionWithoutValue_tagsByLabel() {
        String printed = render(new PickerGenerator(), props("label", "Color", "options", List.of(Map.of("label", "Red"))));

        assertThat(printed).contains(".tag(\"Red\")");
        assertThat(stateDeclarations()).containsExactly("@State private var selection: String = \"Red\"");
    }

    @Test
    void datePicker_dateAndTimeGraphical() {
        String printed = render(new DatePickerGenerator(), props("label", "Due",
            "components", "dateAndTime", "displayedComponents", "graphical"));

        assertThat(printed).isEqualTo(
            "DatePicker(\"Due\", selection: $date, displayedComponents: [.date, .hourAndMinute])\n"
                + ".datePickerStyle(.graphical)");
        assertThat(stateDeclarations()).containsExactly("@State private var date: Date = Date()");
    }

    @Test
    void datePicker_defaults_keepDateComponentOnly() {
        assertThat(render(new DatePickerGenerator(), props("label", "Birthday")))
            .isEqualTo("DatePicker(\"Birthday\", selection: $date, displayedComponents: .date)");
    }

    @Test
    void slider_rangeStepAndLabel() {
        String printed = render(new SliderGenerator(), props("label", "Volume", "minValue", 0, "maxValue", 10,
            "step", 0.5));

        assertThat(printed).isEqualTo(
            "Slider(value: $value, in: 0...10, step: 0.5) {\n"
                + "    Text(\"Volume\")\n"
                + "}");
        assertThat(stateDeclarations()).containsExactly("@State private var value: Double = 0");
    }

    @Test
    void slider_withoutLabel_usesDefaultRange() {
        assertThat(render(new SliderGenerator(), props())).isEqualTo("Slider(value: $value, in: 0...100)");
    }

    @Test
    void stepper_boundedRange() {
        assertThat(render(new StepperGenerator(), props("label", "Guests", "minValue", 1, "maxValue", 8)))
            .isEqualTo("Stepper(\"Guests\", value: $count, in: 1...8)");
        assertThat(stateDeclarations()).containsExactly("@State private var count: Int = 1");
    }

    @Test
    void stepper_openBoundAndStep() {
        assertThat(render(new StepperGenerator(), props("label", "Qty", "maxValue", 5, "step", 2)))
            .isEqualTo("Stepper(\"Qty\", value: $count, in: Int.min...5, step: 2)");
    }

    @Test
    void stepper_unbounded_omitsRange() {
        assertThat(render(new StepperGenerator(), props("label", "Qty", "step", 1)))
            .isEqualTo("Stepper(\"Qty\", value: $count)");
    }
}
