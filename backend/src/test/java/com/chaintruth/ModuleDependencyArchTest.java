package com.chaintruth;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: chain access and persistence never reach up into verification, ledger or the HTTP layer.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.chaintruth");
    }

    @Test
    void domain_must_only_depend_on_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..registry..", "..chain..", "..config..", "..api..",
                        "..intent..", "..verification..", "..ledger..", "..pricing..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..common..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..registry..", "..chain..", "..config..",
                        "..api..", "..intent..", "..verification..", "..ledger..", "..pricing..");
        rule.check(classes);
    }

    @Test
    void registry_must_only_depend_on_domain() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..registry..")
                .should().dependOnClassesThat().resideInAnyPackage("..chain..", "..config..", "..api..",
                        "..intent..", "..verification..", "..ledger..", "..pricing..");
        rule.check(classes);
    }

    @Test
    void chain_must_not_depend_on_verification_ledger_intent_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..chain..")
                .should().dependOnClassesThat().resideInAnyPackage("..verification..", "..ledger..", "..intent..", "..api..");
        rule.check(classes);
    }

    @Test
    void ledger_must_not_depend_on_chain_verification_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ledger..")
                .should().dependOnClassesThat().resideInAnyPackage("..chain..", "..verification..", "..api..");
        rule.check(classes);
    }

    @Test
    void pricing_must_not_depend_on_chain_intent_verification_ledger_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..pricing..")
                .should().dependOnClassesThat().resideInAnyPackage("..chain..", "..intent..", "..verification..", "..ledger..", "..api..");
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
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.chaintruth.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
