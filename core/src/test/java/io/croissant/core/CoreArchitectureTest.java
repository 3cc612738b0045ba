package io.croissant.core;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

/**
 * Layering of the core module: the document model and the structure graph know nothing about
 * execution, and only the file layer touches the network.
 */
@AnalyzeClasses(
        packages = "io.croissant.core",
        importOptions = {ImportOption.DoNotIncludeTests.class})
class CoreArchitectureTest {

    @ArchTest
    static final ArchRule modelIsIndependentOfExecution = noClasses()
            .that()
            .resideInAnyPackage("io.croissant.core.model..", "io.croissant.core.issues..", "io.croissant.core.graph..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.croissant.core.operation..", "io.croissant.core.io..")
            .because("validation must not depend on how records are read");

    @ArchTest
    static final ArchRule onlyFileLayerUsesHttp = noClasses()
            .that()
            .resideOutsideOfPackage("io.croissant.core.io..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("java.net.http..")
            .because("downloads go through the FileFetcher seam");

    @ArchTest
    static final ArchRule noReflectionUsage = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("java.lang.reflect..")
            .because("reflection is forbidden by project governance");
}
