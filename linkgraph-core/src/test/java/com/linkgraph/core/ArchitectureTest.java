package com.linkgraph.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * ArchUnit tests to validate package layering.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Value types in the model package are immutable records</li>
 *   <li>Lower layers never reach up into the engine</li>
 *   <li>The graph types stay independent of validation, schema and history logic</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.linkgraph.core");
    }

    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnOtherLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..graph..", "..schema..", "..validation..", "..history..", "..engine..", "..node..");

        rule.check(classes);
    }

    /**
     * Only the orchestrator composes the checks; the checks themselves must not know it.
     */
    @Test
    void lowerLayers_shouldNotDependOnEngine() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..validation..", "..schema..", "..history..", "..graph..", "..config..")
            .should().dependOnClassesThat().resideInAPackage("..engine..");

        rule.check(classes);
    }

    @Test
    void graph_shouldNotDependOnBehaviour() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..graph..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..validation..", "..schema..", "..history..", "..node..");

        rule.check(classes);
    }

    @Test
    void history_shouldNotDependOnValidationOrSchema() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..history..")
            .should().dependOnClassesThat().resideInAnyPackage("..validation..", "..schema..");

        rule.check(classes);
    }
}
