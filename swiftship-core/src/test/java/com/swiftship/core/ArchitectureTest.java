package com.swiftship.core;

import com.swiftship.core.ast.SwiftNode;
import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Architecture tests enforcing package boundaries of the code generator.
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void setUp() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.swiftship.core");
    }

    @Test
    void astNodesShouldBeRecords() {
        classes()
            .that().resideInAPackage("..ast..")
            .and().areNotInterfaces()
            .and().areNotEnums()
            .and().areTopLevelClasses()
            .should().beRecords()
            .because("AST nodes are immutable values")
            .check(classes);
    }

    @Test
    void swiftNodeVariantsShouldLiveInAstPackage() {
        classes()
            .that().implement(SwiftNode.class)
            .and().areNotInterfaces()
            .should().resideInAPackage("..ast..")
            .andShould().beRecords()
            .because("the printer handles a closed set of node variants")
            .check(classes);
    }

    @Test
    void astShouldOnlyDependOnItself() {
        noClasses()
            .that().resideInAPackage("..ast..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..printer..", "..generator..", "..assembler..", "..catalog..", "..model..", "..config..")
            .check(classes);
    }

    @Test
    void printerShouldNotDependOnGeneration() {
        noClasses()
            .that().resideInAPackage("..printer..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..generator..", "..assembler..", "..catalog..", "..model..")
            .because("printing works on the AST alone")
            .check(classes);
    }

    @Test
    void modelShouldNotDependOnGeneration() {
        noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..generator..", "..printer..", "..assembler..", "..ast..")
            .check(classes);
    }

    @Test
    void catalogShouldNotDependOnGenerators() {
        noClasses()
            .that().resideInAPackage("..catalog..")
            .should().dependOnClassesThat().resideInAnyPackage("..generator..", "..assembler..", "..printer..")
            .check(classes);
    }
}
