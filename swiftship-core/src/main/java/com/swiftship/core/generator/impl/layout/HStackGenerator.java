package com.swiftship.core.generator.impl.layout;

import com.swiftship.core.catalog.ComponentKind;

public class HStackGenerator extends StackGenerator {

    public HStackGenerator() {
        super(ComponentKind.HSTACK);
    }
}
