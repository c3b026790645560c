package com.familyledger;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: pure core (domain, common, ingestion, metrics) below the cache, services and adapters.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.familyledger");
    }

    @Test
    void domain_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion..", "..metrics..", "..cache..", "..config..",
                        "..ledger..", "..query..", "..store..", "..api..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..common..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..ingestion..", "..metrics..", "..cache..",
                        "..config..", "..ledger..", "..query..", "..store..", "..api..");
        rule.check(classes);
    }

    @Test
    void metrics_must_stay_pure() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.familyledger.metrics")
                .should().dependOnClassesThat().resideInAnyPackage("..store..", "..cache..", "..ingestion..", "..api..",
                        "org.springframework..");
        rule.check(classes);
    }

    @Test
    void ingestion_must_not_depend_on_store_cache_or_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion..")
                .should().dependOnClassesThat().resideInAnyPackage("..store..", "..cache..", "..query..", "..ledger..", "..api..");
        rule.check(classes);
    }

    @Test
    void store_must_not_depend_on_services_or_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..store..")
                .should().dependOnClassesThat().resideInAnyPackage("..cache..", "..query..", "..ledger..", "..api..", "..metrics..");
        rule.check(classes);
    }

    @Test
    void api_should_not_touch_store_adapters_or_caches() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..api..")
                .should().dependOnClassesThat().resideInAnyPackage("..store.sheets..", "..store.mongo..", "..cache..");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.familyledger.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
