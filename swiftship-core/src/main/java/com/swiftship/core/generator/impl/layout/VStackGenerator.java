package com.swiftship.core.generator.impl.layout;

import com.swiftship.core.catalog.ComponentKind;

public class VStackGenerator extends StackGenerator {

    public VStackGenerator() {
        super(ComponentKind.VSTACK);
    }
}
