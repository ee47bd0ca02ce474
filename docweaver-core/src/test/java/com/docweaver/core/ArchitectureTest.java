package com.docweaver.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate architectural rules and design patterns.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>The theme engine and the sitemap builder stay independent of each other</li>
 *   <li>Low-level packages don't depend on the generation pipeline</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.docweaver.core");
    }

    /**
     * Verifies all domain models in the model package are implemented as Java records.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .and().haveSimpleNameNotEndingWith("Reader")
            .should().beRecords();

        rule.check(classes);
    }

    /**
     * Verifies the theme engine doesn't know about navigation, and navigation doesn't know
     * about themes.
     */
    @Test
    void themes_andSitemap_shouldBeIndependent() {
        noClasses()
            .that().resideInAPackage("..theme..")
            .should().dependOnClassesThat().resideInAPackage("..sitemap..")
            .check(classes);

        noClasses()
            .that().resideInAPackage("..sitemap..")
            .should().dependOnClassesThat().resideInAPackage("..theme..")
            .check(classes);
    }

    /**
     * Verifies utility classes don't depend on domain packages.
     */
    @Test
    void utilClasses_shouldNotDependOnDomain() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..theme..", "..sitemap..", "..service..", "..context..", "..topic..");

        rule.check(classes);
    }

    /**
     * Verifies model layer has no dependencies on the generation pipeline.
     */
    @Test
    void models_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..service..", "..renderer..", "..theme..", "..sitemap..");

        rule.check(classes);
    }

    /**
     * Verifies only the generation service and the CLI drive renderers.
     */
    @Test
    void renderers_shouldNotDependOnService() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..renderer..")
            .should().dependOnClassesThat().resideInAnyPackage("..service..", "..theme..", "..context..");

        rule.check(classes);
    }
}
