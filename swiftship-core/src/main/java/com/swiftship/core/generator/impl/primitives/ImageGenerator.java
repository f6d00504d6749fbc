package com.swiftship.core.generator.impl.primitives;

import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.FunctionCallExpr;
import com.swiftship.core.ast.ModifierCall;
import com.swiftship.core.ast.ViewBuilderExpr;
import com.swiftship.core.catalog.ComponentKind;
import com.swiftship.core.catalog.props.PrimitiveProps;
import com.swiftship.core.generator.AbstractViewGenerator;
import com.swiftship.core.generator.GenerationContext;
import com.swiftship.core.generator.ModifierChain;

import java.util.ArrayList;
import java.util.List;

import static com.swiftship.core.generator.Expressions.number;
import static com.swiftship.core.generator.Expressions.string;

/**
 * Generates {@code Image(systemName:)}, {@code Image("asset")} or
 * {@code AsyncImage(url:)} depending on the image source.
 *
 * <p>Local images that are filled or framed get {@code .resizable()} directly after the
 * {@code Image} call, since no other modifier returns an {@code Image}.
 */
public class ImageGenerator extends AbstractViewGenerator<PrimitiveProps.Image> {

    private static final String URL_SOURCE = "url";
    private static final String ASSET_SOURCE = "asset";

    public ImageGenerator() {
        super(ComponentKind.IMAGE, PrimitiveProps.Image::from);
    }

    @Override
    protected Expression build(PrimitiveProps.Image props, List<Expression> children, GenerationContext context) {
        PrimitiveProps.ImageSource source = props.source();
        boolean remote = URL_SOURCE.equals(source.type());
        boolean fill = !schema().isDefault("contentMode", props.contentMode());
        boolean framed = props.width() != null || props.height() != null;

        ModifierChain chain = modifiers();
        if (!remote && (fill || framed)) {
            chain.add("source", ModifierCall.of("resizable"));
        }
        chain.unlessDefault("contentMode", props.contentMode(), () -> ModifierCall.of("scaledToFill"))
            .unlessDefault("cornerRadius", props.cornerRadius(), () -> ModifierCall.of("clipShape",
                Argument.of(FunctionCallExpr.of("RoundedRectangle",
                    Argument.labeled("cornerRadius", number(props.cornerRadius()))))));
        if (framed) {
            List<Argument> frame = new ArrayList<>();
            if (props.width() != null) {
                frame.add(Argument.labeled("width", number(props.width())));
            }
            if (props.height() != null) {
                frame.add(Argument.labeled("height", number(props.height())));
            }
            chain.add(frameAnchor(props), new ModifierCall("frame", frame, List.of()));
        }
        List<ModifierCall> modifiers = chain.build();

        if (remote) {
            Expression url = FunctionCallExpr.of("URL", Argument.labeled("string", string(source.url())));
            return new ViewBuilderExpr("AsyncImage", List.of(Argument.labeled("url", url)), List.of(), modifiers);
        }
        Argument name = ASSET_SOURCE.equals(source.type())
            ? Argument.of(string(source.name()))
            : Argument.labeled("systemName", string(source.name()));
        return new ViewBuilderExpr(getViewName(), List.of(name), List.of(), modifiers);
    }

    private static String frameAnchor(PrimitiveProps.Image props) {
        return props.width() != null ? "width" : "height";
    }
}
