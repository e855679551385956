package com.pagewright.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate the package layering.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>Compilation errors share one exception hierarchy</li>
 *   <li>Lower layers don't reach up into representations or the compiler</li>
 *   <li>Production code logs through SLF4J only</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.pagewright.core");
    }

    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .and().areNotInterfaces()
            .should().beRecords();

        rule.check(classes);
    }

    /**
     * Callers catch {@code CompilationException} to tell rule errors from bugs.
     */
    @Test
    void errors_shouldExtendCompilationException() {
        ArchRule rule = classes()
            .that().resideInAPackage("..error..")
            .should().beAssignableTo("com.pagewright.core.error.CompilationException");

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnOtherLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..rep..", "..compiler..", "..writer..", "..filter..", "..event..");

        rule.check(classes);
    }

    @Test
    void utilClasses_shouldNotDependOnDomain() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..rep..", "..compiler..", "..model..", "..filter..");

        rule.check(classes);
    }

    @Test
    void filters_shouldNotDependOnRepresentations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..filter..")
            .should().dependOnClassesThat().resideInAnyPackage("..rep..", "..compiler..");

        rule.check(classes);
    }

    @Test
    void production_shouldNotDependOnLogback() {
        ArchRule rule = noClasses()
            .should().dependOnClassesThat().resideInAPackage("ch.qos.logback..");

        rule.check(classes);
    }
}
