package com.daoindexer;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: domain and common are leaves, ingestion (write side) and snapshot (read side) do not
 * see each other, api reads through snapshot services only.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.daoindexer");
    }

    @Test
    void domain_must_not_depend_on_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.daoindexer.domain..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.daoindexer.common..", "com.daoindexer.config..", "com.daoindexer.ingestion..",
                        "com.daoindexer.snapshot..", "com.daoindexer.api..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.daoindexer.common..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.daoindexer.domain..", "com.daoindexer.config..", "com.daoindexer.ingestion..",
                        "com.daoindexer.snapshot..", "com.daoindexer.api..");
        rule.check(classes);
    }

    @Test
    void config_must_not_depend_on_ingestion_snapshot_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.daoindexer.config..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.daoindexer.ingestion..", "com.daoindexer.snapshot..", "com.daoindexer.api..");
        rule.check(classes);
    }

    @Test
    void ingestion_must_not_depend_on_snapshot_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.daoindexer.ingestion..")
                .should().dependOnClassesThat().resideInAnyPackage("com.daoindexer.snapshot..", "com.daoindexer.api..");
        rule.check(classes);
    }

    @Test
    void snapshot_must_not_depend_on_ingestion_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.daoindexer.snapshot..")
                .should().dependOnClassesThat().resideInAnyPackage("com.daoindexer.ingestion..", "com.daoindexer.api..");
        rule.check(classes);
    }

    @Test
    void api_should_not_import_repository_classes() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..api..")
                .should().dependOnClassesThat().haveSimpleNameEndingWith("Repository");
        rule.check(classes);
    }

    @Test
    void refresh_and_remote_must_not_depend_on_job_triggers() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("..ingestion.refresh..", "..ingestion.remote..", "..ingestion.parser..")
                .should().dependOnClassesThat().resideInAPackage("..ingestion.job..");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.daoindexer.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
